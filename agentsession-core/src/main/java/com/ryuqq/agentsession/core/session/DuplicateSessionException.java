package com.ryuqq.agentsession.core.session;

/**
 * 작업 단위에 이미 Session이 존재하는데 교체 없이 생성하려 함.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DuplicateSessionException extends RuntimeException {

    private final String workItemId;
    private final String existingSessionId;

    public DuplicateSessionException(String workItemId, String existingSessionId) {
        super("Session already exists for work item " + workItemId + " (existing: " + existingSessionId + ")");
        this.workItemId = workItemId;
        this.existingSessionId = existingSessionId;
    }

    public String getWorkItemId() {
        return workItemId;
    }

    public String getExistingSessionId() {
        return existingSessionId;
    }
}
