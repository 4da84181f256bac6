package com.ryuqq.agentsession.application.orchestrator;

import com.ryuqq.agentsession.core.procedure.Subroutine;
import com.ryuqq.agentsession.core.session.Session;

/**
 * runner에 전달할 프롬프트 조립.
 *
 * <p>템플릿 렌더링은 구현체 책임입니다. Orchestrator는 이벤트 종류, 세션,
 * 실행할 단계(없을 수 있음), 이벤트 본문만 넘깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PromptAssembler {

    /**
     * @param kind 이벤트 종류
     * @param session 대상 세션
     * @param subroutine 실행할 단계 (절차가 없으면 null)
     * @param eventText 이벤트 본문 (빈 문자열 가능)
     * @return runner에 전달할 프롬프트
     */
    String assemble(EventKind kind, Session session, Subroutine subroutine, String eventText);
}
