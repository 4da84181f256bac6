package com.ryuqq.agentsession.core.spi;

import com.ryuqq.agentsession.core.procedure.ProcedureDecision;

/**
 * 요청 텍스트를 절차로 분류하는 black box.
 *
 * <p>AI 기반 분류기가 구현하며, 실패 시 예외를 던질 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RequestClassifier {

    /**
     * 분류.
     *
     * @param requestText 요청 텍스트
     * @return 분류 결과
     */
    ProcedureDecision classify(String requestText);
}
