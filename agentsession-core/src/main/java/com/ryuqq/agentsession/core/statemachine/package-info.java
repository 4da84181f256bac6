/**
 * Session / RunnerAdapter 상태 머신.
 *
 * <p>모든 상태 변경은 이 패키지의 Transition 유틸리티로 검증된 후에만 적용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.core.statemachine;
