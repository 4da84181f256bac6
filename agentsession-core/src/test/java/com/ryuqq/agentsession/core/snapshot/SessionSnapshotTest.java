package com.ryuqq.agentsession.core.snapshot;

import com.ryuqq.agentsession.core.procedure.ProcedureMetadata;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.session.IssueContext;
import com.ryuqq.agentsession.core.session.ResumeHandle;
import com.ryuqq.agentsession.core.session.Session;
import com.ryuqq.agentsession.core.session.WorkItem;
import com.ryuqq.agentsession.core.session.Workspace;
import com.ryuqq.agentsession.core.statemachine.SessionStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SessionSnapshot 캡처/복원 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SessionSnapshotTest {

    @Test
    void capture_resume_handle은_해당_백엔드_필드에만_기록() {
        // given
        Session session = Session.create("sess-1", "ISSUE-1", "repo", Workspace.of("/w"));
        session.assignResumeHandle(new ResumeHandle(BackendType.GEMINI, "g-1"));

        // when
        SessionSnapshot snapshot = SessionSnapshot.capture(session);

        // then
        assertThat(snapshot.geminiSessionId()).isEqualTo("g-1");
        assertThat(snapshot.claudeSessionId()).isNull();
        assertThat(snapshot.codexSessionId()).isNull();
        assertThat(snapshot.cursorSessionId()).isNull();
    }

    @Test
    void toSession_실행_중이던_세션은_IDLE로_복원되고_runner_없음() {
        // given
        Session session = Session.create("sess-1", "ISSUE-1", "repo", Workspace.of("/w"));
        session.setExternalSessionId("sess-1");
        session.setIssueContext(new IssueContext("linear", "ISSUE-1", "ENG-1"));
        session.setWorkItem(WorkItem.of("ISSUE-1", "ENG-1", "Fix login"));
        session.setProcedureMetadata(ProcedureMetadata.start("full-development"));
        session.transitionTo(SessionStatus.RUNNING);
        session.assignResumeHandle(new ResumeHandle(BackendType.CLAUDE, "c-1"));

        // when
        Session restored = SessionSnapshot.capture(session).toSession("repo");

        // then
        assertThat(restored.getId()).isEqualTo("sess-1");
        assertThat(restored.getStatus()).isEqualTo(SessionStatus.IDLE);
        assertThat(restored.runner()).isEmpty();
        assertThat(restored.resumeSessionIdFor(BackendType.CLAUDE)).contains("c-1");
        assertThat(restored.getIssueContext().issueIdentifier()).isEqualTo("ENG-1");
        assertThat(restored.getProcedureMetadata().procedureName()).isEqualTo("full-development");
        assertThat(restored.getRepositoryId()).isEqualTo("repo");
    }

    @Test
    void toSession_id가_없으면_externalSessionId_사용() {
        // given
        SessionSnapshot snapshot = new SessionSnapshot(null, "ext-7", "complete", 1L, 2L, null, "ISSUE-7",
            null, Workspace.of("/w"), null, "thread-1", null, null, null, null);

        // when
        Session session = snapshot.toSession("repo");

        // then
        assertThat(session.getId()).isEqualTo("ext-7");
        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(session.resumeSessionIdFor(BackendType.CODEX)).contains("thread-1");
        assertThat(session.getUpdatedAt()).isEqualTo(2L);
    }
}
