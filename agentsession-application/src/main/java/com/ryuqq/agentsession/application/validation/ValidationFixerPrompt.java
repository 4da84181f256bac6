package com.ryuqq.agentsession.application.validation;

import com.ryuqq.agentsession.core.procedure.ValidationAttempt;

import java.util.List;

/**
 * 검증 실패 후 fixer 실행에 사용할 프롬프트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ValidationFixerPrompt {

    private ValidationFixerPrompt() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * fixer 프롬프트 생성.
     *
     * @param failureReason 마지막 검증 실패 사유
     * @param iteration 현재 반복 (1부터)
     * @param maxIterations 최대 반복
     * @param attempts 지금까지의 검증 기록 (마지막 실패 포함)
     * @return 프롬프트 텍스트
     */
    public static String render(String failureReason, int iteration, int maxIterations,
                                List<ValidationAttempt> attempts) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("The verification step failed (attempt ")
            .append(iteration).append(" of ").append(maxIterations).append(").\n\n")
            .append("## Failure\n\n")
            .append(failureReason == null || failureReason.isBlank() ? "No reason given" : failureReason)
            .append("\n\n");

        List<ValidationAttempt> previous = attempts == null || attempts.size() <= 1
            ? List.of()
            : attempts.subList(0, attempts.size() - 1);
        if (!previous.isEmpty()) {
            prompt.append("## Previous attempts\n\n");
            for (ValidationAttempt attempt : previous) {
                prompt.append("- Attempt ").append(attempt.iteration()).append(": ")
                    .append(attempt.pass() ? "passed" : "failed")
                    .append(attempt.reason() == null || attempt.reason().isBlank() ? "" : " - " + attempt.reason())
                    .append('\n');
            }
            prompt.append('\n');
        }

        prompt.append("Fix the problems above without changing unrelated code. ")
            .append("The verifications will run again once you finish.");
        return prompt.toString();
    }
}
