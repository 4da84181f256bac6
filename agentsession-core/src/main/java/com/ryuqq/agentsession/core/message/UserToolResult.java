package com.ryuqq.agentsession.core.message;

/**
 * 도구 실행 결과 메시지.
 *
 * <p>correlation id 당 정확히 한 번만 발행됩니다.</p>
 *
 * @param sessionId 세션 ID
 * @param toolUseId correlation id
 * @param content 결과 텍스트 (또는 합성된 실패 문자열)
 * @param isError 오류 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record UserToolResult(
    String sessionId,
    String toolUseId,
    String content,
    boolean isError
) implements CanonicalMessage {

    public UserToolResult {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (toolUseId == null || toolUseId.isBlank()) {
            throw new IllegalArgumentException("toolUseId cannot be null or blank");
        }
        content = content == null ? "" : content;
    }
}
