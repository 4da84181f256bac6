package com.ryuqq.agentsession.core.spi;

import com.ryuqq.agentsession.core.procedure.Procedure;
import com.ryuqq.agentsession.core.procedure.ProcedureDecision;
import com.ryuqq.agentsession.core.procedure.Subroutine;
import com.ryuqq.agentsession.core.session.Session;

import java.util.Optional;

/**
 * 작업 분류와 단계 진행을 담당하는 협력자.
 *
 * <p>단계 인덱스는 Session의 {@code procedureMetadata}에 저장되며,
 * {@link #advance}는 SessionManager만 호출합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ProcedureEngine {

    /**
     * 요청을 절차로 분류 (실패 시 기본 절차로 fallback, 예외 없음).
     *
     * @param requestText 요청 텍스트
     * @return 분류 결과
     */
    ProcedureDecision classify(String requestText);

    /**
     * 이름으로 절차 조회.
     *
     * @param name 절차 이름
     * @return 절차
     */
    Optional<Procedure> getProcedure(String name);

    /**
     * 세션의 현재 단계.
     *
     * @param session 세션
     * @return 절차가 없거나 범위 밖이면 empty
     */
    Optional<Subroutine> getCurrentSubroutine(Session session);

    /**
     * 세션의 다음 단계.
     *
     * @param session 세션
     * @return 마지막 단계면 empty
     */
    Optional<Subroutine> getNextSubroutine(Session session);

    /**
     * 현재 단계를 완료 처리하고 전진.
     *
     * @param session 세션
     * @param resumeSessionId 단계를 실행한 백엔드 세션 ID
     * @param result 단계 결과
     */
    void advance(Session session, String resumeSessionId, String result);

    /**
     * 절차 메타데이터 초기화 (index 0).
     *
     * @param session 세션
     * @param procedure 절차
     */
    void initializeMetadata(Session session, Procedure procedure);

    /**
     * 마지막으로 완료된 단계의 결과.
     *
     * @param session 세션
     * @return 기록이 없으면 empty
     */
    Optional<String> getLastSubroutineResult(Session session);
}
