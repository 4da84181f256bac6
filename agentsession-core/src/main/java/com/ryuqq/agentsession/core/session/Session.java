package com.ryuqq.agentsession.core.session;

import com.ryuqq.agentsession.core.message.Usage;
import com.ryuqq.agentsession.core.procedure.ProcedureMetadata;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.statemachine.SessionStatus;
import com.ryuqq.agentsession.core.statemachine.SessionStatusTransition;

import java.util.Optional;

/**
 * 작업 단위에 바인딩된 에이전트 세션.
 *
 * <p>Session은 SessionManager의 reducer만 변경하며, 프로세스 재시작 시 SessionStore를 통해 복원됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>부착된 runner는 최대 1개 (부착 시 이전 참조 대체)</li>
 *   <li>resume handle은 최대 1개 (백엔드가 바뀌면 대체)</li>
 *   <li>상태 변경은 {@link SessionStatusTransition} 검증 통과 시에만 적용</li>
 *   <li>{@code externalSessionId}가 없으면 untracked 세션 (ActivitySink 호출 없음)</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 이 클래스는 동기화하지 않습니다.
 * 호출자(SessionManager)가 세션 단위 임계 구역 안에서만 변경해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Session {

    private final String id;
    private final String workItemId;
    private final long createdAt;

    private String repositoryId;
    private Workspace workspace;
    private WorkItem workItem;
    private IssueContext issueContext;
    private String externalSessionId;
    private SessionStatus status;
    private RunnerAdapter runner;
    private ResumeHandle resumeHandle;
    private ProcedureMetadata procedureMetadata;
    private String parentSessionId;
    private boolean stopRequested;
    private boolean modelNotified;
    private String model;
    private double totalCostUsd;
    private Usage usage;
    private long updatedAt;

    private Session(String id, String workItemId, long createdAt) {
        this.id = id;
        this.workItemId = workItemId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.status = SessionStatus.IDLE;
        this.usage = Usage.ZERO;
    }

    /**
     * 새 Session 생성 (IDLE 상태).
     *
     * @param id 세션 ID (tracked면 외부 세션 ID와 동일)
     * @param workItemId 작업 단위 ID
     * @param repositoryId 저장소 ID
     * @param workspace 작업 디렉터리
     * @return Session
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public static Session create(String id, String workItemId, String repositoryId, Workspace workspace) {
        return restore(id, workItemId, repositoryId, workspace, System.currentTimeMillis());
    }

    /**
     * 스냅샷에서 Session 복원.
     *
     * @param id 세션 ID
     * @param workItemId 작업 단위 ID
     * @param repositoryId 저장소 ID
     * @param workspace 작업 디렉터리
     * @param createdAt 원래 생성 시각
     * @return Session
     */
    public static Session restore(String id, String workItemId, String repositoryId, Workspace workspace,
                                  long createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (workItemId == null || workItemId.isBlank()) {
            throw new IllegalArgumentException("workItemId cannot be null or blank");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        Session session = new Session(id, workItemId, createdAt);
        session.repositoryId = repositoryId;
        session.workspace = workspace;
        return session;
    }

    // ========================================
    // 상태
    // ========================================

    /**
     * 상태 전이 (검증 후 적용).
     *
     * @param next 다음 상태
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public void transitionTo(SessionStatus next) {
        this.status = SessionStatusTransition.transition(status, next);
        touch();
    }

    /**
     * 검증 없이 상태 설정 (스냅샷 복원 전용).
     *
     * @param status 상태
     */
    public void restoreStatus(SessionStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        this.status = status;
    }

    // ========================================
    // Runner
    // ========================================

    /**
     * Runner 부착 (이전 참조 대체).
     *
     * <p>모델 안내 게시 여부도 초기화됩니다.</p>
     *
     * @param runner 부착할 runner
     */
    public void attachRunner(RunnerAdapter runner) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        this.runner = runner;
        this.modelNotified = false;
        touch();
    }

    public void detachRunner() {
        this.runner = null;
    }

    public Optional<RunnerAdapter> runner() {
        return Optional.ofNullable(runner);
    }

    /**
     * 부착된 runner가 실행 중인지 확인.
     *
     * @return runner가 있고 실행 중이면 true
     */
    public boolean isRunnerActive() {
        return runner != null && runner.isRunning();
    }

    // ========================================
    // Resume handle
    // ========================================

    /**
     * resume handle 설정 (기존 handle 대체).
     *
     * @param handle 새 handle
     */
    public void assignResumeHandle(ResumeHandle handle) {
        this.resumeHandle = handle;
        touch();
    }

    public Optional<ResumeHandle> resumeHandle() {
        return Optional.ofNullable(resumeHandle);
    }

    /**
     * 특정 백엔드의 resume 세션 ID.
     *
     * @param backend 백엔드
     * @return handle이 해당 백엔드 것이면 세션 ID
     */
    public Optional<String> resumeSessionIdFor(BackendType backend) {
        if (resumeHandle == null || resumeHandle.backend() != backend) {
            return Optional.empty();
        }
        return Optional.of(resumeHandle.sessionId());
    }

    // ========================================
    // 중단 요청
    // ========================================

    public void requestStop() {
        this.stopRequested = true;
        touch();
    }

    /**
     * 중단 요청을 소비 (읽고 초기화).
     *
     * @return 중단 요청이 있었으면 true
     */
    public boolean consumeStopRequest() {
        boolean requested = stopRequested;
        stopRequested = false;
        return requested;
    }

    // ========================================
    // 조회
    // ========================================

    public TrackingMode trackingMode() {
        return externalSessionId == null ? TrackingMode.UNTRACKED : TrackingMode.TRACKED;
    }

    public boolean isTracked() {
        return externalSessionId != null;
    }

    public String getId() {
        return id;
    }

    public String getWorkItemId() {
        return workItemId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public String getRepositoryId() {
        return repositoryId;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public WorkItem getWorkItem() {
        return workItem;
    }

    public IssueContext getIssueContext() {
        return issueContext;
    }

    public String getExternalSessionId() {
        return externalSessionId;
    }

    public ProcedureMetadata getProcedureMetadata() {
        return procedureMetadata;
    }

    public String getParentSessionId() {
        return parentSessionId;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public boolean isModelNotified() {
        return modelNotified;
    }

    public String getModel() {
        return model;
    }

    public double getTotalCostUsd() {
        return totalCostUsd;
    }

    public Usage getUsage() {
        return usage;
    }

    // ========================================
    // 변경 (SessionManager 전용)
    // ========================================

    public void setRepositoryId(String repositoryId) {
        this.repositoryId = repositoryId;
    }

    public void setWorkspace(Workspace workspace) {
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        this.workspace = workspace;
    }

    public void setWorkItem(WorkItem workItem) {
        this.workItem = workItem;
    }

    public void setIssueContext(IssueContext issueContext) {
        this.issueContext = issueContext;
    }

    public void setExternalSessionId(String externalSessionId) {
        this.externalSessionId = externalSessionId;
    }

    public void setProcedureMetadata(ProcedureMetadata procedureMetadata) {
        this.procedureMetadata = procedureMetadata;
        touch();
    }

    public void setParentSessionId(String parentSessionId) {
        this.parentSessionId = parentSessionId;
    }

    public void markModelNotified() {
        this.modelNotified = true;
    }

    public void setModel(String model) {
        this.model = model;
    }

    /**
     * Result 메시지의 비용/사용량 반영.
     *
     * @param totalCostUsd 비용
     * @param usage 사용량 (null이면 변경 없음)
     */
    public void recordUsage(double totalCostUsd, Usage usage) {
        if (!Double.isNaN(totalCostUsd) && !Double.isInfinite(totalCostUsd)) {
            this.totalCostUsd = totalCostUsd;
        }
        if (usage != null) {
            this.usage = usage;
        }
    }

    public void restoreUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    private void touch() {
        this.updatedAt = System.currentTimeMillis();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Session session = (Session) o;
        return id.equals(session.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Session{" +
            "id='" + id + '\'' +
            ", workItemId='" + workItemId + '\'' +
            ", status=" + status +
            ", tracking=" + trackingMode() +
            '}';
    }
}
