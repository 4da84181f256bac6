package com.ryuqq.agentsession.core.spi;

import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;

/**
 * 백엔드별 RunnerAdapter 생성.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunnerFactory {

    /**
     * 새 runner 생성 (시작하지 않음).
     *
     * @param backend 백엔드
     * @param config 실행 설정
     * @return IDLE 상태의 runner
     * @throws com.ryuqq.agentsession.core.runner.RunnerStartException 백엔드를 지원하지 않는 경우
     */
    RunnerAdapter create(BackendType backend, RunnerConfig config);
}
