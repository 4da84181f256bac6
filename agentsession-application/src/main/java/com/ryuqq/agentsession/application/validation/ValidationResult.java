package com.ryuqq.agentsession.application.validation;

/**
 * 검증 단계 결과.
 *
 * @param pass 통과 여부
 * @param reason 판정 사유
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ValidationResult(boolean pass, String reason) {

    public ValidationResult {
        reason = reason == null ? "" : reason;
    }

    public static ValidationResult passed(String reason) {
        return new ValidationResult(true, reason);
    }

    public static ValidationResult failed(String reason) {
        return new ValidationResult(false, reason);
    }
}
