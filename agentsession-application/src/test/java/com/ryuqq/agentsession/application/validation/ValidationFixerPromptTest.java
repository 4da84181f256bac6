package com.ryuqq.agentsession.application.validation;

import com.ryuqq.agentsession.core.procedure.ValidationAttempt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationFixerPromptTest {

    @Test
    void 실패_이유와_이전_시도를_포함한다() {
        // given
        List<ValidationAttempt> attempts = List.of(
            new ValidationAttempt(1, false, "lint errors", 1L),
            new ValidationAttempt(2, false, "2 tests failing", 2L));

        // when
        String prompt = ValidationFixerPrompt.render("2 tests failing", 2, 3, attempts);

        // then
        assertThat(prompt).startsWith("The verification step failed (attempt 2 of 3).");
        assertThat(prompt).contains("## Failure\n\n2 tests failing");
        assertThat(prompt).contains("## Previous attempts\n\n- Attempt 1: failed - lint errors\n");
        assertThat(prompt).doesNotContain("Attempt 2:");
        assertThat(prompt).endsWith("The verifications will run again once you finish.");
    }

    @Test
    void 첫_시도면_이전_시도_섹션이_없다() {
        // when
        String prompt = ValidationFixerPrompt.render(" ", 1, 3,
            List.of(new ValidationAttempt(1, false, "", 1L)));

        // then
        assertThat(prompt).contains("No reason given");
        assertThat(prompt).doesNotContain("## Previous attempts");
    }
}
