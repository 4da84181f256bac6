package com.ryuqq.agentsession.core.session;

/**
 * 세션 메시지 기록 항목.
 *
 * <p>정규 메시지를 영속 가능한 형태로 평탄화한 것으로, ActivitySink에 게시된 경우 activityId를 가집니다.</p>
 *
 * @param type 항목 유형
 * @param content 본문
 * @param resumeSessionId 해당 메시지를 발행한 백엔드 세션 ID
 * @param metadata 부가 정보
 * @param activityId 게시된 activity ID (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionEntry(
    EntryType type,
    String content,
    String resumeSessionId,
    EntryMetadata metadata,
    String activityId
) {

    public SessionEntry {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        content = content == null ? "" : content;
        metadata = metadata == null ? EntryMetadata.at(System.currentTimeMillis()) : metadata;
    }

    public SessionEntry withActivityId(String activityId) {
        return new SessionEntry(type, content, resumeSessionId, metadata, activityId);
    }

    /**
     * 도구 호출 항목인지 확인.
     *
     * @return ASSISTANT이고 toolUseId가 있으면 true
     */
    public boolean isToolUse() {
        return type == EntryType.ASSISTANT && metadata.toolUseId() != null;
    }

    /**
     * 도구 결과 항목인지 확인.
     *
     * @return USER이고 toolUseId가 있으면 true
     */
    public boolean isToolResult() {
        return type == EntryType.USER && metadata.toolUseId() != null;
    }
}
