/**
 * 정규 메시지 프로토콜.
 *
 * <p>백엔드별로 상이한 스트리밍 출력은 adapter 경계에서 이 패키지의 타입으로 변환되며,
 * 원시 백엔드 payload는 adapter 밖으로 나가지 않습니다.</p>
 *
 * <h2>메시지 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentsession.core.message.SystemInit}</li>
 *   <li>{@link com.ryuqq.agentsession.core.message.AssistantText}</li>
 *   <li>{@link com.ryuqq.agentsession.core.message.AssistantToolUse}</li>
 *   <li>{@link com.ryuqq.agentsession.core.message.UserToolResult}</li>
 *   <li>{@link com.ryuqq.agentsession.core.message.ResultMessage}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.core.message;
