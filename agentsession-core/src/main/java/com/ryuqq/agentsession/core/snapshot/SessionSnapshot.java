package com.ryuqq.agentsession.core.snapshot;

import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.session.IssueContext;
import com.ryuqq.agentsession.core.session.ResumeHandle;
import com.ryuqq.agentsession.core.session.Session;
import com.ryuqq.agentsession.core.session.WorkItem;
import com.ryuqq.agentsession.core.session.Workspace;
import com.ryuqq.agentsession.core.statemachine.SessionStatus;

/**
 * 영속화용 Session 표현.
 *
 * <p>부착된 runner와 중단 요청 플래그는 저장하지 않습니다. resume handle은 백엔드별 필드
 * ({@code claudeSessionId}, {@code codexSessionId}, ...) 중 하나에만 기록됩니다.</p>
 *
 * <p><strong>복원 규칙:</strong></p>
 * <ul>
 *   <li>{@code id}가 없으면 {@code externalSessionId}를 사용</li>
 *   <li>백엔드 필드가 여러 개면 claude → codex → cursor → gemini 순으로 첫 값 사용</li>
 *   <li>상태는 {@link SessionStatus#fromPersisted}로 변환 (실행 중이었던 세션은 IDLE)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionSnapshot(
    String id,
    String externalSessionId,
    String status,
    long createdAt,
    long updatedAt,
    IssueContext issueContext,
    String issueId,
    WorkItem issue,
    Workspace workspace,
    String claudeSessionId,
    String codexSessionId,
    String cursorSessionId,
    String geminiSessionId,
    String parentSessionId,
    SessionSnapshotMetadata metadata
) {

    /**
     * Session 캡처.
     *
     * @param session 세션
     * @return 스냅샷
     */
    public static SessionSnapshot capture(Session session) {
        ResumeHandle handle = session.resumeHandle().orElse(null);
        return new SessionSnapshot(
            session.getId(),
            session.getExternalSessionId(),
            session.getStatus().persistedValue(),
            session.getCreatedAt(),
            session.getUpdatedAt(),
            session.getIssueContext(),
            session.getWorkItemId(),
            session.getWorkItem(),
            session.getWorkspace(),
            handleFor(handle, BackendType.CLAUDE),
            handleFor(handle, BackendType.CODEX),
            handleFor(handle, BackendType.CURSOR),
            handleFor(handle, BackendType.GEMINI),
            session.getParentSessionId(),
            new SessionSnapshotMetadata(
                session.getModel(),
                session.getTotalCostUsd(),
                session.getUsage(),
                session.getProcedureMetadata()
            )
        );
    }

    /**
     * Session 복원.
     *
     * @param repositoryId 저장소 ID (스냅샷 맵의 키)
     * @return 복원된 Session (runner 없음)
     * @throws IllegalArgumentException 식별자나 작업 디렉터리가 없는 경우
     */
    public Session toSession(String repositoryId) {
        String sessionId = id != null ? id : externalSessionId;
        String workItemId = issueId != null ? issueId : (issue != null ? issue.id() : null);
        Session session = Session.restore(sessionId, workItemId, repositoryId, workspace,
            createdAt > 0 ? createdAt : System.currentTimeMillis());
        session.restoreStatus(SessionStatus.fromPersisted(status));
        session.setExternalSessionId(externalSessionId);
        session.setIssueContext(issueContext);
        session.setWorkItem(issue);
        session.setParentSessionId(parentSessionId);
        session.assignResumeHandle(toResumeHandle());
        if (metadata != null) {
            session.setModel(metadata.model());
            session.recordUsage(metadata.totalCostUsd() == null ? 0.0 : metadata.totalCostUsd(), metadata.usage());
            session.setProcedureMetadata(metadata.procedure());
        }
        session.restoreUpdatedAt(updatedAt > 0 ? updatedAt : session.getCreatedAt());
        return session;
    }

    /**
     * 백엔드 필드로부터 resume handle 도출.
     *
     * @return handle, 없으면 null
     */
    public ResumeHandle toResumeHandle() {
        if (claudeSessionId != null) {
            return new ResumeHandle(BackendType.CLAUDE, claudeSessionId);
        }
        if (codexSessionId != null) {
            return new ResumeHandle(BackendType.CODEX, codexSessionId);
        }
        if (cursorSessionId != null) {
            return new ResumeHandle(BackendType.CURSOR, cursorSessionId);
        }
        if (geminiSessionId != null) {
            return new ResumeHandle(BackendType.GEMINI, geminiSessionId);
        }
        return null;
    }

    private static String handleFor(ResumeHandle handle, BackendType backend) {
        return handle != null && handle.backend() == backend ? handle.sessionId() : null;
    }
}
