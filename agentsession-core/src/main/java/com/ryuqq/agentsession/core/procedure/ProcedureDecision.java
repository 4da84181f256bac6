package com.ryuqq.agentsession.core.procedure;

/**
 * 요청 분류 결과.
 *
 * @param classification 분류 (예: "code", "question")
 * @param procedureName 선택된 절차 이름
 * @param reasoning 분류 근거
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProcedureDecision(
    String classification,
    String procedureName,
    String reasoning
) {

    public ProcedureDecision {
        if (procedureName == null || procedureName.isBlank()) {
            throw new IllegalArgumentException("procedureName cannot be null or blank");
        }
        reasoning = reasoning == null ? "" : reasoning;
    }
}
