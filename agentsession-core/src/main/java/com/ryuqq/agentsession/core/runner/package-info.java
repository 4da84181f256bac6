/**
 * RunnerAdapter 계약.
 *
 * <p>백엔드 구현은 adapter 모듈에 있으며, 이 패키지는 상태/설정/예외 타입과 계약만 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.core.runner;
