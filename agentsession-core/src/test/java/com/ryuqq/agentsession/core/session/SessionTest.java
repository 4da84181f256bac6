package com.ryuqq.agentsession.core.session;

import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.statemachine.SessionStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Session 엔티티 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SessionTest {

    private Session newSession() {
        return Session.create("sess-1", "ISSUE-1", "repo-a", Workspace.of("/work/repo-a"));
    }

    @Test
    void create_초기_상태는_IDLE이고_untracked() {
        // when
        Session session = newSession();

        // then
        assertThat(session.getStatus()).isEqualTo(SessionStatus.IDLE);
        assertThat(session.trackingMode()).isEqualTo(TrackingMode.UNTRACKED);
        assertThat(session.runner()).isEmpty();
        assertThat(session.resumeHandle()).isEmpty();
    }

    @Test
    void assignResumeHandle_다른_백엔드로_교체하면_기존_handle_제거() {
        // given
        Session session = newSession();
        session.assignResumeHandle(new ResumeHandle(BackendType.CLAUDE, "c-1"));

        // when
        session.assignResumeHandle(new ResumeHandle(BackendType.CODEX, "thread-9"));

        // then
        assertThat(session.resumeSessionIdFor(BackendType.CLAUDE)).isEmpty();
        assertThat(session.resumeSessionIdFor(BackendType.CODEX)).contains("thread-9");
    }

    @Test
    void consumeStopRequest_한_번만_true_반환() {
        // given
        Session session = newSession();
        session.requestStop();

        // when & then
        assertThat(session.isStopRequested()).isTrue();
        assertThat(session.consumeStopRequest()).isTrue();
        assertThat(session.consumeStopRequest()).isFalse();
    }

    @Test
    void transitionTo_허용되지_않는_전이는_예외() {
        Session session = newSession();

        assertThatThrownBy(() -> session.transitionTo(SessionStatus.COMPLETED))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void externalSessionId가_있으면_tracked() {
        Session session = newSession();
        session.setExternalSessionId("ext-1");

        assertThat(session.isTracked()).isTrue();
        assertThat(session.trackingMode()).isEqualTo(TrackingMode.TRACKED);
    }

    @Test
    void create_workspace_없으면_예외() {
        assertThatThrownBy(() -> Session.create("s", "w", "r", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("workspace cannot be null");
    }
}
