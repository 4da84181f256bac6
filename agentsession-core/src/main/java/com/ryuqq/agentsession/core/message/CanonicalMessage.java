package com.ryuqq.agentsession.core.message;

/**
 * 백엔드 독립 정규 메시지.
 *
 * <p>모든 RunnerAdapter는 백엔드별 스트림 출력을 이 다섯 가지 형태로 정규화합니다:</p>
 * <ul>
 *   <li>{@link SystemInit}: 세션 식별 확정 (항상 첫 번째)</li>
 *   <li>{@link AssistantText}: 어시스턴트 텍스트 응답</li>
 *   <li>{@link AssistantToolUse}: 도구 호출 (correlation id 보유)</li>
 *   <li>{@link UserToolResult}: 도구 실행 결과 (동일 correlation id)</li>
 *   <li>{@link ResultMessage}: 종료 결과 (항상 마지막, success 또는 error)</li>
 * </ul>
 *
 * <p><strong>순서 불변식:</strong></p>
 * <pre>
 * SystemInit
 *    │
 *    ├─► AssistantText / AssistantToolUse(id) ─► UserToolResult(id) ...
 *    │
 *    ▼
 * ResultMessage (정확히 1개, 마지막)
 * </pre>
 *
 * <p>Sealed interface로 정의되어 reducer가 모든 케이스를 처리하도록 강제합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface CanonicalMessage
    permits SystemInit, AssistantText, AssistantToolUse, UserToolResult, ResultMessage {

    /**
     * 백엔드 세션 ID (확정 전에는 "pending").
     *
     * @return 세션 ID
     */
    String sessionId();

    /**
     * 세션 시작 메시지인지 확인.
     *
     * @return SystemInit 여부
     */
    default boolean isSystemInit() {
        return this instanceof SystemInit;
    }

    /**
     * 종료 메시지인지 확인.
     *
     * @return ResultMessage 여부
     */
    default boolean isResult() {
        return this instanceof ResultMessage;
    }
}
