/**
 * Service Provider Interface.
 *
 * <p>애플리케이션 계층이 의존하는 협력자 계약입니다. 구현체는 adapter 모듈에 있습니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.agentsession.core.spi.ActivitySink}: 진행 게시</li>
 *   <li>{@link com.ryuqq.agentsession.core.spi.ProcedureEngine}: 분류/단계 진행</li>
 *   <li>{@link com.ryuqq.agentsession.core.spi.RequestClassifier}: AI 분류기</li>
 *   <li>{@link com.ryuqq.agentsession.core.spi.RunnerFactory}: runner 생성</li>
 *   <li>{@link com.ryuqq.agentsession.core.spi.SessionStore}: 영속화</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.core.spi;
