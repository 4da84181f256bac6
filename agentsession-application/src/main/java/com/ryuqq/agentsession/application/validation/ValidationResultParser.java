package com.ryuqq.agentsession.application.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 검증 단계의 최종 텍스트에서 {@code {"pass": bool, "reason": string}}를 추출.
 *
 * <p>텍스트 전체가 JSON이 아니어도 마지막 JSON 객체 블록(코드 펜스 포함)을 찾아 해석합니다.
 * 해석할 수 없으면 실패로 취급하여 fixer가 원문을 보고 대응하도록 합니다.</p>
 *
 * <pre>
 * ValidationResultParser.parse("All good.\n```json\n{\"pass\": true, \"reason\": \"tests green\"}\n```");
 * // → ValidationResult[pass=true, reason=tests green]
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ValidationResultParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_ECHOED_LENGTH = 500;

    private ValidationResultParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 검증 결과 해석.
     *
     * @param text 검증 단계 결과 텍스트
     * @return 해석 결과 (해석 불가 시 fail)
     */
    public static ValidationResult parse(String text) {
        if (text == null || text.isBlank()) {
            return ValidationResult.failed("Validation produced no output");
        }
        String trimmed = text.trim();
        JsonNode node = readObject(trimmed);
        if (node == null) {
            node = readObject(lastJsonObject(trimmed));
        }
        if (node == null || !node.path("pass").isBoolean()) {
            return ValidationResult.failed("Could not parse validation result: " + echo(trimmed));
        }
        String reason = node.path("reason").isTextual() ? node.path("reason").asText() : "";
        return new ValidationResult(node.path("pass").asBoolean(), reason);
    }

    private static JsonNode readObject(String candidate) {
        if (candidate == null || !candidate.startsWith("{")) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    // 마지막 '}'에서 역방향으로 괄호 깊이를 맞춰 객체 시작을 찾음
    private static String lastJsonObject(String text) {
        int end = text.lastIndexOf('}');
        if (end < 0) {
            return null;
        }
        int depth = 0;
        for (int i = end; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '}') {
                depth++;
            } else if (c == '{') {
                depth--;
                if (depth == 0) {
                    return text.substring(i, end + 1);
                }
            }
        }
        return null;
    }

    private static String echo(String text) {
        return text.length() <= MAX_ECHOED_LENGTH ? text : text.substring(0, MAX_ECHOED_LENGTH) + "…";
    }
}
