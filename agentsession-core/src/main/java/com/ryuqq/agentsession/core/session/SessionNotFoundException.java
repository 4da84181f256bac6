package com.ryuqq.agentsession.core.session;

/**
 * 존재하지 않는 Session 조회.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
