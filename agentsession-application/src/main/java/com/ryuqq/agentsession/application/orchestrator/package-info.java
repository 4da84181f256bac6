/**
 * 이벤트 라우팅과 세션별 동시성 조정.
 *
 * <p>외부 이벤트를 세션으로 해석하고, 스트림 추가 / 재분류 / runner 재시작 중 하나를 결정합니다.
 * SessionManager의 절차 신호(단계 전이, 검증 루프, 자식 세션 완료)는 내부 이벤트로 다시 들어옵니다.</p>
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentsession.application.orchestrator.SessionOrchestrator} - 라우팅 / 영속화 조정</li>
 *   <li>{@link com.ryuqq.agentsession.application.orchestrator.InboundEvent} - 입력 이벤트</li>
 *   <li>{@link com.ryuqq.agentsession.application.orchestrator.PromptAssembler} - 프롬프트 조립 확장점</li>
 *   <li>{@link com.ryuqq.agentsession.application.orchestrator.WorkerStatus} - liveness 상태</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>세션별 임계 구역:</strong> "대상 결정 → runner 연결"은 세션 잠금 안에서 수행</li>
 *   <li><strong>실패 격리:</strong> 이벤트 처리 실패는 로그로 남기고 다른 세션에 전파하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.application.orchestrator;
