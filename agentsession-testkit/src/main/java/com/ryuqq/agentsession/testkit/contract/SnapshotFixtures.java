package com.ryuqq.agentsession.testkit.contract;

import com.ryuqq.agentsession.core.message.Usage;
import com.ryuqq.agentsession.core.procedure.ProcedureMetadata;
import com.ryuqq.agentsession.core.procedure.SubroutineHistoryEntry;
import com.ryuqq.agentsession.core.session.EntryMetadata;
import com.ryuqq.agentsession.core.session.EntryType;
import com.ryuqq.agentsession.core.session.IssueContext;
import com.ryuqq.agentsession.core.session.SessionEntry;
import com.ryuqq.agentsession.core.session.WorkItem;
import com.ryuqq.agentsession.core.session.Workspace;
import com.ryuqq.agentsession.core.snapshot.PersistedState;
import com.ryuqq.agentsession.core.snapshot.SessionSnapshot;
import com.ryuqq.agentsession.core.snapshot.SessionSnapshotMetadata;

import java.util.List;
import java.util.Map;

/**
 * SessionStore 테스트용 스냅샷 픽스처.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SnapshotFixtures {

    public static final String REPOSITORY_ID = "repo-1";

    private SnapshotFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 진행 중인 절차와 Claude resume handle을 가진 세션 스냅샷.
     *
     * @param sessionId 세션 ID
     * @param issueId 작업 항목 ID
     * @return 스냅샷
     */
    public static SessionSnapshot snapshot(String sessionId, String issueId) {
        ProcedureMetadata procedure = new ProcedureMetadata("full-development", 1,
            List.of(new SubroutineHistoryEntry("coding-activity", 1_700_000_100_000L, "claude-" + sessionId,
                "Implemented the change")),
            null);
        return new SessionSnapshot(
            sessionId,
            sessionId,
            "complete",
            1_700_000_000_000L,
            1_700_000_200_000L,
            new IssueContext(IssueContext.DEFAULT_TRACKER, issueId, "ENG-" + issueId),
            issueId,
            new WorkItem(issueId, "ENG-" + issueId, "Fix login", "https://tracker/ENG-" + issueId, "eng-fix-login"),
            new Workspace("/work/" + issueId, true),
            "claude-" + sessionId,
            null,
            null,
            null,
            null,
            new SessionSnapshotMetadata("opus", 0.25, new Usage(1200, 340, 50), procedure)
        );
    }

    public static List<SessionEntry> entries() {
        EntryMetadata toolUse = new EntryMetadata(1_700_000_050_000L, null, "tool-1", "Bash",
            Map.of("command", "ls"), null, null, null, null);
        EntryMetadata toolResult = new EntryMetadata(1_700_000_060_000L, null, "tool-1", null,
            null, false, null, null, null);
        return List.of(
            new SessionEntry(EntryType.ASSISTANT, "Looking at the code", "claude-s", EntryMetadata.at(1_700_000_040_000L),
                "activity-1"),
            new SessionEntry(EntryType.ASSISTANT, "", "claude-s", toolUse, "activity-2"),
            new SessionEntry(EntryType.USER, "README.md", "claude-s", toolResult, null)
        );
    }

    /**
     * 세션 1개, 기록, 자식/저장소 매핑을 포함한 상태.
     *
     * @return 상태
     */
    public static PersistedState state() {
        return new PersistedState(
            Map.of(REPOSITORY_ID, Map.of("session-1", snapshot("session-1", "issue-1"))),
            Map.of(REPOSITORY_ID, Map.of("session-1", entries())),
            Map.of("child-1", "session-1"),
            Map.of("issue-1", REPOSITORY_ID)
        );
    }
}
