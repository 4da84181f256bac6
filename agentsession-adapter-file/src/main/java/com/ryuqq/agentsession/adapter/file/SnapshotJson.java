package com.ryuqq.agentsession.adapter.file;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ryuqq.agentsession.core.session.SessionEntry;

/**
 * 스냅샷 파일용 ObjectMapper.
 *
 * <p>알 수 없는 필드는 무시하고 null 필드는 쓰지 않습니다.
 * 기록 타입({@code "assistant"} 등)은 대소문자를 가리지 않고 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class SnapshotJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .addMixIn(SessionEntry.class, SessionEntryMixIn.class)
        .build();

    private SnapshotJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }

    // 파생 값은 파일에 쓰지 않음
    abstract static class SessionEntryMixIn {

        @JsonIgnore
        abstract boolean isToolUse();

        @JsonIgnore
        abstract boolean isToolResult();
    }
}
