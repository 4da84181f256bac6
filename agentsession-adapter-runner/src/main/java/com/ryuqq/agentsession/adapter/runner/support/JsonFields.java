package com.ryuqq.agentsession.adapter.runner.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 백엔드 JSON payload의 방어적 추출.
 *
 * <p>누락되었거나 타입이 맞지 않는 필드는 예외 없이 안전한 기본값(null, 빈 컬렉션)으로 변환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonFields {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    // Utility class - prevent instantiation
    private JsonFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 한 줄을 JSON 객체로 파싱.
     *
     * @param line 출력 한 줄
     * @return 객체이면 노드, JSON이 아니거나 객체가 아니면 empty
     */
    public static Optional<JsonNode> parseObject(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * 첫 번째로 비어 있지 않은 문자열 필드.
     *
     * @param node 객체 노드 (null 가능)
     * @param fields 후보 필드 이름
     * @return 값, 없으면 null
     */
    public static String text(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * 숫자 필드.
     *
     * @param node 객체 노드
     * @param field 필드 이름
     * @return 숫자, 없거나 숫자가 아니면 null
     */
    public static Number number(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.numberValue() : null;
    }

    public static boolean bool(JsonNode node, String field) {
        if (node == null) {
            return false;
        }
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() && value.booleanValue();
    }

    /**
     * 객체 필드.
     *
     * @param node 객체 노드
     * @param field 필드 이름
     * @return 객체 노드, 없거나 객체가 아니면 null
     */
    public static JsonNode object(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isObject() ? value : null;
    }

    /**
     * 배열 필드의 원소 목록.
     *
     * @param node 객체 노드
     * @param field 필드 이름
     * @return 원소 목록, 없거나 배열이 아니면 빈 목록
     */
    public static List<JsonNode> array(JsonNode node, String field) {
        List<JsonNode> items = new ArrayList<>();
        if (node == null) {
            return items;
        }
        JsonNode value = node.get(field);
        if (value != null && value.isArray()) {
            value.forEach(items::add);
        }
        return items;
    }

    /**
     * 문자열 배열 필드.
     *
     * @param node 객체 노드
     * @param field 필드 이름
     * @return 문자열 원소만 모은 목록
     */
    public static List<String> textArray(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array(node, field)) {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    /**
     * 객체 노드를 Map으로 변환.
     *
     * @param node 노드 (null 가능)
     * @return 객체면 Map, 아니면 빈 Map
     */
    public static Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return MAPPER.convertValue(node, MAP_TYPE);
    }

    /**
     * 노드를 일반 Java 값(String, Number, Boolean, List, Map)으로 변환.
     *
     * @param node 노드
     * @return 변환값 (null 노드는 null)
     */
    public static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return MAPPER.convertValue(node, Object.class);
    }

    /**
     * JSON 문자열로 직렬화.
     *
     * @param value 값
     * @return JSON 문자열, 직렬화 실패 시 toString
     */
    public static String stringify(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /**
     * 단일 JSON 라인 직렬화 (stdin 스트리밍 입력용).
     *
     * @param value 값
     * @return JSON 문자열
     * @throws IllegalArgumentException 직렬화할 수 없는 경우
     */
    public static String toJsonLine(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize stream message", e);
        }
    }
}
