package com.ryuqq.agentsession.core.procedure;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProcedureMetadata / ValidationLoopState 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProcedureMetadataTest {

    @Test
    void advance_인덱스_증가_기록_추가_검증루프_초기화() {
        // given
        ProcedureMetadata metadata = ProcedureMetadata.start("full-development")
            .withValidationLoop(ValidationLoopState.initial().recordAttempt(false, "tests failing", 1L));

        // when
        ProcedureMetadata advanced = metadata.advance("verifications", "c-1", "all green", 2L);

        // then
        assertThat(advanced.currentSubroutineIndex()).isEqualTo(1);
        assertThat(advanced.subroutineHistory()).hasSize(1);
        assertThat(advanced.lastResult()).isEqualTo("all green");
        assertThat(advanced.validationLoop()).isNull();
        assertThat(advanced.validationIteration()).isZero();
    }

    @Test
    void recordAttempt_반복_번호는_1부터_증가() {
        // when
        ValidationLoopState state = ValidationLoopState.initial()
            .recordAttempt(false, "a", 1L)
            .withFixerMode(true)
            .recordAttempt(true, "b", 2L);

        // then
        assertThat(state.iteration()).isEqualTo(2);
        assertThat(state.inFixerMode()).isTrue();
        assertThat(state.attempts()).extracting(ValidationAttempt::iteration).containsExactly(1, 2);
    }

    @Test
    void procedure_범위_밖_인덱스는_empty() {
        Procedure procedure = new Procedure("p", "d", List.of(Subroutine.of("one", null, "first")));

        assertThat(procedure.subroutineAt(0)).isPresent();
        assertThat(procedure.subroutineAt(1)).isEmpty();
        assertThatThrownBy(() -> new Procedure("p", "d", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
