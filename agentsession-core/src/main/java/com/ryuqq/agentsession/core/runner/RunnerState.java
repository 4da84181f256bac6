package com.ryuqq.agentsession.core.runner;

/**
 * RunnerAdapter 인스턴스 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * IDLE ──► STARTING ──► RUNNING ──► COMPLETED
 *              │            │
 *              │            ├──► FAILED
 *              │            │
 *              └────────────┴──► STOPPED
 * </pre>
 *
 * <p>종료 상태(COMPLETED, FAILED, STOPPED)의 인스턴스는 재사용되지 않으며,
 * resume 시에는 새 인스턴스로 교체됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunnerState {

    /**
     * 생성됨, 아직 시작 전.
     */
    IDLE,

    /**
     * 프로세스 기동/핸드셰이크 중.
     */
    STARTING,

    /**
     * 메시지 스트리밍 중.
     */
    RUNNING,

    /**
     * 호출자 요청으로 중단됨.
     */
    STOPPED,

    /**
     * 성공 Result로 종료됨.
     */
    COMPLETED,

    /**
     * 오류 Result로 종료됨.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED, COMPLETED, FAILED이면 true
     */
    public boolean isTerminal() {
        return this == STOPPED || this == COMPLETED || this == FAILED;
    }

    /**
     * 실행 중(isRunning)으로 간주되는 상태인지 확인.
     *
     * @return STARTING 또는 RUNNING이면 true
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}
