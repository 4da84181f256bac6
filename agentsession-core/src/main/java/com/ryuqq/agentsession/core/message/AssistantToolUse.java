package com.ryuqq.agentsession.core.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 도구 호출 메시지.
 *
 * <p>{@code toolUseId}는 매칭되는 {@link UserToolResult}와 공유하는 correlation id입니다.
 * {@code toolName}은 백엔드 독립 이름(Bash, Read, Grep, Glob, Write, Edit, ...)입니다.</p>
 *
 * <p>input 값은 String, Number, Boolean, List, Map 중 하나로 구성됩니다.</p>
 *
 * @param sessionId 세션 ID
 * @param toolUseId correlation id
 * @param toolName 정규화된 도구 이름
 * @param input 도구 입력 (불변)
 * @param parentToolUseId 상위 도구 호출 ID (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AssistantToolUse(
    String sessionId,
    String toolUseId,
    String toolName,
    Map<String, Object> input,
    String parentToolUseId
) implements CanonicalMessage {

    public AssistantToolUse {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (toolUseId == null || toolUseId.isBlank()) {
            throw new IllegalArgumentException("toolUseId cannot be null or blank");
        }
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName cannot be null or blank");
        }
        // null 값을 허용해야 하므로 Map.copyOf 대신 unmodifiable 복사본 사용
        input = input == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    /**
     * 상위 호출 없는 도구 호출 생성.
     *
     * @param sessionId 세션 ID
     * @param toolUseId correlation id
     * @param toolName 도구 이름
     * @param input 도구 입력
     * @return AssistantToolUse 인스턴스
     */
    public static AssistantToolUse of(String sessionId, String toolUseId, String toolName, Map<String, Object> input) {
        return new AssistantToolUse(sessionId, toolUseId, toolName, input, null);
    }
}
