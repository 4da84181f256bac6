package com.ryuqq.agentsession.core.session;

/**
 * 세션이 속한 이슈 트래커 컨텍스트.
 *
 * @param trackerId 트래커 식별자 (예: "linear")
 * @param issueId 이슈 ID
 * @param issueIdentifier 사람이 읽는 이슈 키 (예: "ENG-42")
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record IssueContext(String trackerId, String issueId, String issueIdentifier) {

    /**
     * 기본 트래커.
     */
    public static final String DEFAULT_TRACKER = "linear";

    public IssueContext {
        if (trackerId == null || trackerId.isBlank()) {
            throw new IllegalArgumentException("trackerId cannot be null or blank");
        }
    }
}
