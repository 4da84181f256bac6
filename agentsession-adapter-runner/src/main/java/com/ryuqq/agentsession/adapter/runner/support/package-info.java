/**
 * 백엔드 공통 정규화 지원.
 *
 * <ul>
 *   <li>{@link com.ryuqq.agentsession.adapter.runner.support.AbstractEventTranslator}: 순서/중복/종료 합성 규칙</li>
 *   <li>{@link com.ryuqq.agentsession.adapter.runner.support.ToolCallTracker}: correlation id 추적</li>
 *   <li>{@link com.ryuqq.agentsession.adapter.runner.support.ToolNameInference}: 명령 → 도구 이름</li>
 *   <li>{@link com.ryuqq.agentsession.adapter.runner.support.PathNormalizer}: 경로 상대화</li>
 *   <li>{@link com.ryuqq.agentsession.adapter.runner.support.UsageAccumulator}: 토큰 사용량</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.adapter.runner.support;
