package com.ryuqq.agentsession.core.procedure;

/**
 * 검증 루프 1회 시도 결과.
 *
 * @param iteration 시도 번호 (1부터)
 * @param pass 통과 여부
 * @param reason 사유
 * @param timestamp 시각 (epoch millis)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ValidationAttempt(
    int iteration,
    boolean pass,
    String reason,
    long timestamp
) {
}
