package com.ryuqq.agentsession.core.snapshot;

/**
 * 스냅샷 쓰기 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SnapshotPersistenceException extends RuntimeException {

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
