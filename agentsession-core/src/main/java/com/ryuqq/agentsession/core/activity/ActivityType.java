package com.ryuqq.agentsession.core.activity;

/**
 * 외부 트래커에 게시되는 activity 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ActivityType {
    THOUGHT("thought"),
    ACTION("action"),
    RESPONSE("response"),
    ERROR("error"),
    ELICITATION("elicitation");

    private final String wireValue;

    ActivityType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
