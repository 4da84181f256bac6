package com.ryuqq.agentsession.core.session;

import java.util.Map;

/**
 * 세션 기록 항목의 부가 정보.
 *
 * @param timestamp 기록 시각 (epoch millis)
 * @param parentToolUseId 상위 도구 호출 ID
 * @param toolUseId 도구 호출 ID
 * @param toolName 도구 이름
 * @param toolInput 도구 입력
 * @param toolResultError 도구 결과 오류 여부
 * @param sdkError 백엔드 오류 코드
 * @param durationMs 실행 시간 (Result 항목)
 * @param resultError 오류 Result 여부 (Result 항목)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EntryMetadata(
    long timestamp,
    String parentToolUseId,
    String toolUseId,
    String toolName,
    Map<String, Object> toolInput,
    Boolean toolResultError,
    String sdkError,
    Long durationMs,
    Boolean resultError
) {

    public static EntryMetadata at(long timestamp) {
        return new EntryMetadata(timestamp, null, null, null, null, null, null, null, null);
    }
}
