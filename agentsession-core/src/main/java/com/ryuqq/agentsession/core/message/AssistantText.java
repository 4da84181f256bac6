package com.ryuqq.agentsession.core.message;

/**
 * 어시스턴트 텍스트 메시지.
 *
 * <p>{@code sdkError}가 있으면 (예: rate_limit) 진행 상황이 아닌 오류로 게시되며,
 * 텍스트는 변경 없이 그대로 전달됩니다.</p>
 *
 * @param sessionId 세션 ID
 * @param text 텍스트 본문
 * @param parentToolUseId 상위 도구 호출 ID (sub-agent 메시지인 경우, null 가능)
 * @param sdkError 백엔드가 표시한 오류 코드 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AssistantText(
    String sessionId,
    String text,
    String parentToolUseId,
    String sdkError
) implements CanonicalMessage {

    public AssistantText {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }

    /**
     * 일반 텍스트 메시지 생성.
     *
     * @param sessionId 세션 ID
     * @param text 텍스트
     * @return AssistantText 인스턴스
     */
    public static AssistantText of(String sessionId, String text) {
        return new AssistantText(sessionId, text, null, null);
    }

    /**
     * 백엔드 오류 표시 여부.
     *
     * @return sdkError가 있으면 true
     */
    public boolean hasSdkError() {
        return sdkError != null && !sdkError.isBlank();
    }
}
