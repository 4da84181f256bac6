package com.ryuqq.agentsession.application.session;

import com.ryuqq.agentsession.core.session.Session;

/**
 * SessionManager가 절차 진행 중 발생시키는 신호.
 *
 * <p>신호는 Result를 처리한 스레드에서 SessionManager 내부 잠금 없이 호출됩니다.
 * 구현체(보통 Orchestrator)는 다음 runner를 시작하는 등 후속 작업을 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SessionManagerListener {

    /**
     * 단계가 성공적으로 끝나고 다음 단계로 전진함.
     *
     * @param session 세션 (procedureMetadata는 이미 다음 단계를 가리킴)
     */
    default void subroutineComplete(Session session) {
    }

    /**
     * 검증 실패, fixer 실행 필요.
     *
     * @param session 세션
     * @param fixerPrompt fixer 프롬프트
     * @param iteration 현재 반복
     */
    default void validationLoopIteration(Session session, String fixerPrompt, int iteration) {
    }

    /**
     * fixer 종료, 검증 단계 재실행 필요.
     *
     * @param session 세션
     * @param iteration 현재 반복
     */
    default void validationLoopRerun(Session session, int iteration) {
    }

    /**
     * 자식 세션의 절차가 끝남.
     *
     * @param childSessionId 자식 세션 ID
     * @param parentSessionId 부모 세션 ID
     * @param result 자식 세션 최종 결과
     */
    default void childSessionCompleted(String childSessionId, String parentSessionId, String result) {
    }
}
