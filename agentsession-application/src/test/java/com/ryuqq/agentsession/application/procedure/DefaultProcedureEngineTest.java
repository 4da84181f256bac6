package com.ryuqq.agentsession.application.procedure;

import com.ryuqq.agentsession.core.procedure.ProcedureDecision;
import com.ryuqq.agentsession.core.procedure.ProcedureMetadata;
import com.ryuqq.agentsession.core.procedure.Subroutine;
import com.ryuqq.agentsession.core.session.Session;
import com.ryuqq.agentsession.core.session.Workspace;
import com.ryuqq.agentsession.core.spi.RequestClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * DefaultProcedureEngine 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultProcedureEngineTest {

    @Mock
    private RequestClassifier classifier;

    private DefaultProcedureEngine engine;
    private Session session;

    @BeforeEach
    void setUp() {
        engine = new DefaultProcedureEngine(classifier);
        session = Session.create("session-1", "issue-1", "repo-1", Workspace.of("/work/issue-1"));
    }

    // ========================================
    // 분류
    // ========================================

    @Test
    void 분류_결과를_등록된_절차로_매핑한다() {
        // given
        when(classifier.classify("How does auth work?"))
            .thenReturn(new ProcedureDecision("question", "simple-question", null));

        // when
        ProcedureDecision decision = engine.classify("How does auth work?");

        // then
        assertThat(decision.classification()).isEqualTo("question");
        assertThat(decision.procedureName()).isEqualTo("simple-question");
        assertThat(decision.reasoning()).isEqualTo("Classified as \"question\" → using procedure \"simple-question\"");
    }

    @Test
    void 매핑에_없는_분류는_분류기가_고른_절차를_사용한다() {
        // given
        when(classifier.classify(anyString()))
            .thenReturn(new ProcedureDecision("shipping", "release", "Looks like a release request"));

        // when
        ProcedureDecision decision = engine.classify("Ship 2.1");

        // then
        assertThat(decision.procedureName()).isEqualTo("release");
        assertThat(decision.reasoning()).isEqualTo("Looks like a release request");
    }

    @Test
    void 분류기_실패시_full_development로_fallback() {
        // given
        when(classifier.classify(anyString())).thenThrow(new IllegalStateException("classifier offline"));

        // when
        ProcedureDecision decision = engine.classify("Fix login");

        // then
        assertThat(decision.classification()).isEqualTo("code");
        assertThat(decision.procedureName()).isEqualTo("full-development");
        assertThat(decision.reasoning()).isEqualTo("Fallback to full-development due to error: classifier offline");
    }

    @Test
    void 알_수_없는_절차도_fallback() {
        // given
        when(classifier.classify(anyString())).thenReturn(new ProcedureDecision("weird", "no-such-procedure", ""));

        // when
        ProcedureDecision decision = engine.classify("???");

        // then
        assertThat(decision.procedureName()).isEqualTo("full-development");
        assertThat(decision.reasoning()).contains("Unknown procedure: no-such-procedure");
    }

    // ========================================
    // 단계 진행
    // ========================================

    @Test
    void 절차_초기화_후_첫_단계가_현재_단계() {
        // when
        engine.initializeMetadata(session, engine.getProcedure("full-development").orElseThrow());

        // then
        assertThat(engine.getCurrentSubroutine(session)).map(Subroutine::name).contains("coding-activity");
        assertThat(engine.getNextSubroutine(session)).map(Subroutine::name).contains("verifications");
        assertThat(engine.getLastSubroutineResult(session)).isEmpty();
    }

    @Test
    void advance는_완료_기록을_남기고_다음_단계로_이동한다() {
        // given
        engine.initializeMetadata(session, engine.getProcedure("full-development").orElseThrow());

        // when
        engine.advance(session, "claude-1", "Implemented the fix");

        // then
        ProcedureMetadata metadata = session.getProcedureMetadata();
        assertThat(metadata.currentSubroutineIndex()).isEqualTo(1);
        assertThat(metadata.subroutineHistory()).hasSize(1);
        assertThat(metadata.subroutineHistory().get(0).subroutine()).isEqualTo("coding-activity");
        assertThat(metadata.subroutineHistory().get(0).resumeSessionId()).isEqualTo("claude-1");
        assertThat(engine.getCurrentSubroutine(session)).map(Subroutine::name).contains("verifications");
        assertThat(engine.getLastSubroutineResult(session)).contains("Implemented the fix");
    }

    @Test
    void 마지막_단계_이후에는_현재와_다음_단계가_없다() {
        // given
        session.setProcedureMetadata(new ProcedureMetadata("simple-question", 1, List.of(), null));

        // when
        engine.advance(session, "claude-1", "The answer");

        // then
        assertThat(engine.getCurrentSubroutine(session)).isEmpty();
        assertThat(engine.getNextSubroutine(session)).isEmpty();
    }

    @Test
    void 절차가_없는_세션은_advance할_수_없다() {
        assertThat(engine.getCurrentSubroutine(session)).isEmpty();
        assertThatThrownBy(() -> engine.advance(session, "claude-1", "x"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("has no procedure");
    }
}
