package com.ryuqq.agentsession.application.orchestrator;

import com.ryuqq.agentsession.core.runner.BackendType;

/**
 * SessionOrchestrator 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>defaultBackend: CLAUDE (라우팅 신호가 없을 때)</li>
 *   <li>persistOnEveryEvent: true (이벤트 처리 후마다 상태 저장)</li>
 *   <li>stateSaveEnabled: true</li>
 * </ul>
 *
 * @param defaultBackend 기본 백엔드
 * @param persistOnEveryEvent 이벤트마다 저장 여부
 * @param stateSaveEnabled 상태 저장 사용 여부 (false면 saveState가 무시됨)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    BackendType defaultBackend,
    boolean persistOnEveryEvent,
    boolean stateSaveEnabled
) {

    public OrchestratorConfig {
        if (defaultBackend == null) {
            throw new IllegalArgumentException("defaultBackend cannot be null");
        }
    }

    public OrchestratorConfig() {
        this(BackendType.CLAUDE, true, true);
    }

    public OrchestratorConfig withDefaultBackend(BackendType defaultBackend) {
        return new OrchestratorConfig(defaultBackend, persistOnEveryEvent, stateSaveEnabled);
    }

    public OrchestratorConfig withPersistOnEveryEvent(boolean persistOnEveryEvent) {
        return new OrchestratorConfig(defaultBackend, persistOnEveryEvent, stateSaveEnabled);
    }

    public OrchestratorConfig withStateSaveEnabled(boolean stateSaveEnabled) {
        return new OrchestratorConfig(defaultBackend, persistOnEveryEvent, stateSaveEnabled);
    }
}
