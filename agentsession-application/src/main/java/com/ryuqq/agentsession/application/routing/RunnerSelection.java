package com.ryuqq.agentsession.application.routing;

import com.ryuqq.agentsession.core.runner.BackendType;

/**
 * 라우팅 신호로 결정된 백엔드와 모델.
 *
 * @param backend 백엔드
 * @param model 모델
 * @param fallbackModel 대체 모델
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunnerSelection(BackendType backend, String model, String fallbackModel) {

    public RunnerSelection {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
    }
}
