package com.ryuqq.agentsession.application.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ValidationResultParser 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ValidationResultParserTest {

    @Test
    void JSON_객체를_그대로_읽는다() {
        // when
        ValidationResult result = ValidationResultParser.parse("{\"pass\": true, \"reason\": \"All checks green\"}");

        // then
        assertThat(result).isEqualTo(ValidationResult.passed("All checks green"));
    }

    @Test
    void 설명_뒤의_마지막_JSON_객체를_찾는다() {
        // given
        String text = "Ran the test suite.\n```json\n"
            + "{\"pass\": false, \"reason\": \"2 tests failing\", \"details\": {\"failed\": 2}}\n```";

        // when
        ValidationResult result = ValidationResultParser.parse(text);

        // then
        assertThat(result.pass()).isFalse();
        assertThat(result.reason()).isEqualTo("2 tests failing");
    }

    @Test
    void 해석할_수_없으면_실패로_본다() {
        assertThat(ValidationResultParser.parse("Everything looks fine"))
            .isEqualTo(ValidationResult.failed("Could not parse validation result: Everything looks fine"));
        assertThat(ValidationResultParser.parse("{\"pass\": \"yes\"}").pass()).isFalse();
        assertThat(ValidationResultParser.parse("  ")).isEqualTo(ValidationResult.failed("Validation produced no output"));
        assertThat(ValidationResultParser.parse(null).pass()).isFalse();
    }

    @Test
    void reason이_없으면_빈_문자열() {
        assertThat(ValidationResultParser.parse("{\"pass\": true}")).isEqualTo(new ValidationResult(true, ""));
    }
}
