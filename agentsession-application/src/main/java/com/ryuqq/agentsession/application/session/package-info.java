/**
 * 세션 상태 머신과 정규 메시지 reducer.
 *
 * <p>{@link com.ryuqq.agentsession.application.session.SessionManager}가 세션의 유일한 소유자입니다.
 * 절차 진행 신호는 {@link com.ryuqq.agentsession.application.session.SessionManagerListener}로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.agentsession.application.session;
