package com.ryuqq.agentsession.application.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 도구 호출/결과를 진행 상황 게시용 텍스트로 변환.
 *
 * <p><strong>파라미터 우선순위:</strong></p>
 * <pre>
 * command → file_path (+ offset/limit 줄 범위) → path → url → pattern → JSON
 * </pre>
 *
 * <p>결과 텍스트는 최대 길이를 넘으면 잘라내고 {@code [truncated]} 표시를 붙이며,
 * 오류 결과는 코드 블록으로 감쌉니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProgressFormatter {

    public static final int DEFAULT_MAX_RESULT_LENGTH = 4000;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int maxResultLength;

    public ProgressFormatter() {
        this(DEFAULT_MAX_RESULT_LENGTH);
    }

    public ProgressFormatter(int maxResultLength) {
        if (maxResultLength <= 0) {
            throw new IllegalArgumentException("maxResultLength must be positive (current: " + maxResultLength + ")");
        }
        this.maxResultLength = maxResultLength;
    }

    /**
     * 도구 호출의 대표 파라미터.
     *
     * @param toolName 도구 이름
     * @param input 도구 입력
     * @return 한 줄 요약
     */
    public String formatToolParameter(String toolName, Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String command = stringValue(input, "command");
        if (command != null) {
            return command;
        }
        String lineRange = formatLineRange(input);
        if (lineRange != null) {
            return lineRange;
        }
        String path = stringValue(input, "path");
        if (path != null) {
            return path;
        }
        String url = stringValue(input, "url");
        if (url != null) {
            return url;
        }
        String pattern = stringValue(input, "pattern");
        if (pattern != null) {
            return toolName != null && toolName.toLowerCase(Locale.ROOT).contains("grep")
                ? pattern
                : pattern + " (" + toolName + ")";
        }
        return toJson(input);
    }

    /**
     * 액션 이름 (설명이 있으면 괄호로 덧붙임).
     *
     * @param toolName 도구 이름
     * @param input 도구 입력
     * @return 액션 이름
     */
    public String formatToolActionName(String toolName, Map<String, Object> input) {
        String description = input == null ? null : stringValue(input, "description");
        if (description != null) {
            return toolName + " (" + description.trim() + ")";
        }
        return toolName;
    }

    /**
     * 도구 결과 본문.
     *
     * @param result 결과 텍스트
     * @param isError 오류 결과 여부
     * @return 잘라내고 오류면 코드 블록으로 감싼 텍스트
     */
    public String formatToolResult(String result, boolean isError) {
        String normalized = truncate(result == null || result.isEmpty() ? "No output" : result);
        if (isError) {
            return "```\n" + normalized + "\n```";
        }
        return normalized;
    }

    /**
     * TodoWrite 입력을 체크리스트로 변환.
     *
     * @param input {@code todos} 배열을 가진 입력
     * @return 체크리스트, todos가 없으면 JSON
     */
    public String formatTodoList(Map<String, Object> input) {
        Object todos = input == null ? null : input.get("todos");
        if (!(todos instanceof List<?>)) {
            return toJson(input);
        }
        List<String> lines = new ArrayList<>();
        for (Object item : (List<?>) todos) {
            if (!(item instanceof Map<?, ?>)) {
                continue;
            }
            Map<?, ?> todo = (Map<?, ?>) item;
            Object rawStatus = todo.get("status");
            String status = rawStatus instanceof String
                ? ((String) rawStatus).toLowerCase(Locale.ROOT)
                : "pending";
            Object content = todo.get("content") instanceof String ? todo.get("content") : todo.get("description");
            String text = content instanceof String ? (String) content : "";
            String marker = "completed".equals(status) ? "[x]" : "[ ]";
            String suffix = "in_progress".equals(status) ? " (in progress)" : "";
            lines.add(("- " + marker + " " + text + suffix).trim());
        }
        return String.join("\n", lines);
    }

    /**
     * 최대 길이로 잘라냄.
     *
     * @param text 원문
     * @return 잘린 텍스트
     */
    public String truncate(String text) {
        if (text == null || text.length() <= maxResultLength) {
            return text;
        }
        return text.substring(0, maxResultLength) + "\n\n[truncated]";
    }

    private static String formatLineRange(Map<String, Object> input) {
        String filePath = stringValue(input, "file_path");
        if (filePath == null) {
            return null;
        }
        Long offset = longValue(input.get("offset"));
        Long limit = longValue(input.get("limit"));
        if (offset == null && limit == null) {
            return filePath;
        }
        long start = offset == null ? 0 : offset;
        String end = limit != null && limit != 0 ? String.valueOf(start + limit) : "end";
        return filePath + " (lines " + (start + 1) + "-" + end + ")";
    }

    private static String stringValue(Map<String, Object> input, String key) {
        Object value = input.get(key);
        if (value instanceof String && !((String) value).isBlank()) {
            return (String) value;
        }
        return null;
    }

    private static Long longValue(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (!Double.isNaN(d) && !Double.isInfinite(d)) {
                return (long) d;
            }
        }
        return null;
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
