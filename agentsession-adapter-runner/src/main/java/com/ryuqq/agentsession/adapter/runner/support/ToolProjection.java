package com.ryuqq.agentsession.adapter.runner.support;

import java.util.Map;

/**
 * 백엔드 도구 이벤트를 정규 도구 호출/결과 쌍으로 투영한 결과.
 *
 * @param toolUseId correlation id
 * @param toolName 정규 도구 이름
 * @param input 도구 입력
 * @param result 결과 텍스트 (진행 중이면 아직 의미 없음)
 * @param isError 오류 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ToolProjection(
    String toolUseId,
    String toolName,
    Map<String, Object> input,
    String result,
    boolean isError
) {

    public ToolProjection withError(boolean isError) {
        return new ToolProjection(toolUseId, toolName, input, result, isError);
    }
}
