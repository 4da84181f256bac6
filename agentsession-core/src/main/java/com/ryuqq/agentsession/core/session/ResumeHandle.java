package com.ryuqq.agentsession.core.session;

import com.ryuqq.agentsession.core.runner.BackendType;

/**
 * 백엔드별 resume handle.
 *
 * <p>Session은 한 번에 하나의 handle만 가지며, 다른 백엔드의 handle을 설정하면 기존 handle은 대체됩니다.</p>
 *
 * @param backend 백엔드
 * @param sessionId 백엔드 세션 ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResumeHandle(BackendType backend, String sessionId) {

    public ResumeHandle {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
    }
}
