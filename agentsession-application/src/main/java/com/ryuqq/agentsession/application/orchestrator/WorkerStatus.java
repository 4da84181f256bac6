package com.ryuqq.agentsession.application.orchestrator;

/**
 * 워커 liveness 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkerStatus {

    BUSY("busy"),
    IDLE("idle");

    private final String value;

    WorkerStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
