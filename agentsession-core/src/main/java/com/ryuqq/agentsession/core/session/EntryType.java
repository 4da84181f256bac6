package com.ryuqq.agentsession.core.session;

/**
 * 세션 기록 항목 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EntryType {
    USER,
    ASSISTANT,
    SYSTEM,
    RESULT
}
