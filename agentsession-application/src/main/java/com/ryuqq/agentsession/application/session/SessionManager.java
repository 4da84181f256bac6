package com.ryuqq.agentsession.application.session;

import com.ryuqq.agentsession.application.progress.ProgressFormatter;
import com.ryuqq.agentsession.application.validation.ValidationFixerPrompt;
import com.ryuqq.agentsession.application.validation.ValidationResult;
import com.ryuqq.agentsession.application.validation.ValidationResultParser;
import com.ryuqq.agentsession.core.activity.ActivityContent;
import com.ryuqq.agentsession.core.activity.ActivityPostOptions;
import com.ryuqq.agentsession.core.activity.ActivityPostResult;
import com.ryuqq.agentsession.core.message.AssistantText;
import com.ryuqq.agentsession.core.message.AssistantToolUse;
import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.message.ResultMessage;
import com.ryuqq.agentsession.core.message.ResultSubtype;
import com.ryuqq.agentsession.core.message.SystemInit;
import com.ryuqq.agentsession.core.message.UserToolResult;
import com.ryuqq.agentsession.core.procedure.Procedure;
import com.ryuqq.agentsession.core.procedure.ProcedureMetadata;
import com.ryuqq.agentsession.core.procedure.Subroutine;
import com.ryuqq.agentsession.core.procedure.ValidationLoopState;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerListener;
import com.ryuqq.agentsession.core.runner.RunnerState;
import com.ryuqq.agentsession.core.session.DuplicateSessionException;
import com.ryuqq.agentsession.core.session.EntryMetadata;
import com.ryuqq.agentsession.core.session.EntryType;
import com.ryuqq.agentsession.core.session.IssueContext;
import com.ryuqq.agentsession.core.session.ResumeHandle;
import com.ryuqq.agentsession.core.session.Session;
import com.ryuqq.agentsession.core.session.SessionEntry;
import com.ryuqq.agentsession.core.session.SessionNotFoundException;
import com.ryuqq.agentsession.core.session.TrackingMode;
import com.ryuqq.agentsession.core.session.WorkItem;
import com.ryuqq.agentsession.core.session.Workspace;
import com.ryuqq.agentsession.core.snapshot.PersistedState;
import com.ryuqq.agentsession.core.snapshot.SessionSnapshot;
import com.ryuqq.agentsession.core.spi.ActivitySink;
import com.ryuqq.agentsession.core.spi.ProcedureEngine;
import com.ryuqq.agentsession.core.statemachine.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Session 엔티티의 유일한 소유자이자 정규 메시지 reducer.
 *
 * <p>runner가 발행한 메시지를 받아 세션 상태를 전이시키고, 진행 상황을 ActivitySink로
 * 게시하며, 단계가 끝나면 ProcedureEngine으로 다음 단계를 결정합니다.</p>
 *
 * <p><strong>상태 머신:</strong></p>
 * <pre>
 * IDLE ──attach──→ RUNNING ──Result──→ COMPLETED | ERROR | STOPPED
 *   ↑                                        │
 *   └──────────── 다음 이벤트 ────────────────┘
 * </pre>
 *
 * <p><strong>Reducer 규칙:</strong></p>
 * <ul>
 *   <li>SystemInit: 백엔드 resume handle 기록, attach 당 1회 모델 알림</li>
 *   <li>Assistant / UserToolResult: 세션 기록 저장 후 진행 상황 게시</li>
 *   <li>Result: 중단 요청이 있었으면 페이로드와 무관하게 STOPPED, 단계 진행 없음</li>
 *   <li>Result(success): 다음 단계가 있으면 전진 후 {@code subroutineComplete} 신호</li>
 * </ul>
 *
 * <p><strong>Tracking:</strong> externalSessionId가 없는(untracked) 세션은
 * ActivitySink 호출을 모두 생략합니다. 게시 실패는 로그만 남기고 전파하지 않습니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 세션별 상태 전이는 Session 객체 단위로 동기화되며,
 * ActivitySink 호출과 리스너 신호는 잠금 밖에서 수행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    static final String CHILD_TOOL_PREFIX = "↪ ";
    static final String DEFAULT_REPOSITORY_KEY = "default";

    private static final Set<String> HIDDEN_RESULT_TOOLS = Set.of(
        "TodoWrite", "write_todos", "AskUserQuestion", "ToolSearch");
    private static final Set<String> TODO_TOOLS = Set.of("TodoWrite", "write_todos");

    private final ActivitySink activitySink;
    private final ProcedureEngine procedureEngine;
    private final SessionManagerConfig config;
    private final ProgressFormatter formatter;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<SessionEntry>> entries = new ConcurrentHashMap<>();
    private final Map<String, String> activeTasks = new ConcurrentHashMap<>();
    private final Map<String, ToolCall> toolCalls = new ConcurrentHashMap<>();
    private final List<SessionManagerListener> listeners = new CopyOnWriteArrayList<>();
    private final Object createLock = new Object();

    public SessionManager(ActivitySink activitySink, ProcedureEngine procedureEngine, SessionManagerConfig config) {
        if (activitySink == null) {
            throw new IllegalArgumentException("activitySink cannot be null");
        }
        if (procedureEngine == null) {
            throw new IllegalArgumentException("procedureEngine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.activitySink = activitySink;
        this.procedureEngine = procedureEngine;
        this.config = config;
        this.formatter = new ProgressFormatter(config.maxResultLength());
    }

    public SessionManager(ActivitySink activitySink, ProcedureEngine procedureEngine) {
        this(activitySink, procedureEngine, new SessionManagerConfig());
    }

    public void addListener(SessionManagerListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(SessionManagerListener listener) {
        listeners.remove(listener);
    }

    // ========================================
    // 세션 생성 / 제거
    // ========================================

    /**
     * 작업 항목에 대한 세션 생성.
     *
     * @param workItemId 작업 항목 ID
     * @param repositoryId 저장소 ID
     * @param workspace 작업 디렉토리
     * @param trackingMode TRACKED면 ActivitySink에 외부 세션을 만들고 진행 상황을 게시
     * @return 생성된 세션
     * @throws DuplicateSessionException 같은 작업 항목의 세션이 이미 있는 경우
     */
    public Session createSession(String workItemId, String repositoryId, Workspace workspace,
                                 TrackingMode trackingMode) {
        return createSession(WorkItem.of(workItemId, null, null), repositoryId, workspace, trackingMode, false);
    }

    /**
     * 작업 항목에 대한 세션 생성.
     *
     * <p>TRACKED 세션의 ID는 ActivitySink가 발급한 외부 세션 ID이며,
     * UNTRACKED 세션은 내부 ID를 발급받고 externalSessionId가 비어 있습니다.</p>
     *
     * @param workItem 작업 항목
     * @param repositoryId 저장소 ID
     * @param workspace 작업 디렉토리
     * @param trackingMode 추적 모드
     * @param replaceExisting true면 기존 세션을 중단/제거하고 새로 생성
     * @return 생성된 세션
     * @throws DuplicateSessionException replaceExisting=false이고 기존 세션이 있는 경우
     */
    public Session createSession(WorkItem workItem, String repositoryId, Workspace workspace,
                                 TrackingMode trackingMode, boolean replaceExisting) {
        if (workItem == null) {
            throw new IllegalArgumentException("workItem cannot be null");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        if (trackingMode == null) {
            throw new IllegalArgumentException("trackingMode cannot be null");
        }

        synchronized (createLock) {
            List<Session> existing = getSessionsByWorkItemId(workItem.id());
            if (!existing.isEmpty()) {
                if (!replaceExisting) {
                    throw new DuplicateSessionException(workItem.id(), existing.get(0).getId());
                }
                existing.forEach(session -> removeSession(session.getId()));
            }

            String externalSessionId = null;
            String sessionId;
            if (trackingMode == TrackingMode.TRACKED) {
                externalSessionId = activitySink.createAgentSession(workItem.id());
                if (externalSessionId == null || externalSessionId.isBlank()) {
                    throw new IllegalStateException(
                        "Activity sink returned no session for work item " + workItem.id());
                }
                sessionId = externalSessionId;
            } else {
                sessionId = "session-" + UUID.randomUUID();
            }

            Session session = Session.create(sessionId, workItem.id(), repositoryId, workspace);
            session.setExternalSessionId(externalSessionId);
            session.setWorkItem(workItem);
            session.setIssueContext(new IssueContext(IssueContext.DEFAULT_TRACKER, workItem.id(), workItem.identifier()));
            sessions.put(sessionId, session);
            entries.put(sessionId, new CopyOnWriteArrayList<>());

            log.info("Created session {} for work item {} (repository: {}, tracking: {})",
                sessionId, workItem.id(), repositoryId, trackingMode);
            return session;
        }
    }

    /**
     * 세션 제거 (실행 중인 runner는 중단).
     *
     * @param sessionId 세션 ID
     * @return 제거 여부
     */
    public boolean removeSession(String sessionId) {
        Session session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        entries.remove(sessionId);
        activeTasks.remove(sessionId);
        clearToolCalls(sessionId);

        RunnerAdapter runner;
        synchronized (session) {
            runner = session.runner().orElse(null);
            session.detachRunner();
        }
        if (runner != null && runner.isRunning()) {
            runner.stop();
        }
        log.info("Removed session {} (work item: {})", sessionId, session.getWorkItemId());
        return true;
    }

    /**
     * 저장소 해제 시 해당 저장소의 모든 세션 제거.
     *
     * @param repositoryId 저장소 ID
     * @return 제거된 세션 수
     */
    public int removeRepositorySessions(String repositoryId) {
        List<String> ids = sessions.values().stream()
            .filter(session -> Objects.equals(session.getRepositoryId(), repositoryId))
            .map(Session::getId)
            .collect(Collectors.toList());
        int removed = 0;
        for (String id : ids) {
            if (removeSession(id)) {
                removed++;
            }
        }
        log.info("Removed {} session(s) for repository {}", removed, repositoryId);
        return removed;
    }

    /**
     * 기본 보존 시간보다 오래된 종료 세션 정리.
     *
     * @return 제거된 세션 수
     */
    public int cleanup() {
        return cleanup(config.cleanupAgeMs());
    }

    /**
     * 종료 상태이고 마지막 갱신이 cutoff 이전인 세션 정리.
     *
     * @param olderThanMs 보존 시간 (밀리초)
     * @return 제거된 세션 수
     */
    public int cleanup(long olderThanMs) {
        long cutoff = System.currentTimeMillis() - olderThanMs;
        List<String> expired = sessions.values().stream()
            .filter(session -> session.getStatus().isTerminal())
            .filter(session -> session.getUpdatedAt() < cutoff)
            .map(Session::getId)
            .collect(Collectors.toList());
        expired.forEach(this::removeSession);
        if (!expired.isEmpty()) {
            log.info("Cleaned up {} session(s) older than {}ms", expired.size(), olderThanMs);
        }
        return expired.size();
    }

    // ========================================
    // Runner 연결 / 상태 전이
    // ========================================

    /**
     * runner를 세션에 배타적으로 연결하고 RUNNING으로 전이.
     *
     * <p>이전 runner 참조는 교체되며, 아직 실행 중이면 분리된 뒤 중단됩니다.
     * 분리된 runner가 이후 발행하는 메시지는 무시됩니다. 남아 있던 중단 요청은 초기화됩니다.</p>
     *
     * @param sessionId 세션 ID
     * @param runner 시작 전의 runner
     * @throws SessionNotFoundException 세션이 없는 경우
     */
    public void attachRunner(String sessionId, RunnerAdapter runner) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        Session session = requireSession(sessionId);
        RunnerAdapter previous;
        synchronized (session) {
            previous = session.runner().orElse(null);
            session.consumeStopRequest();
            session.attachRunner(runner);
            if (session.getStatus() != SessionStatus.RUNNING) {
                session.transitionTo(SessionStatus.RUNNING);
            }
        }
        activeTasks.remove(sessionId);
        clearToolCalls(sessionId);
        runner.addListener(new SessionRunnerListener(sessionId, runner));
        log.info("Attached {} runner to session {}", runner.backendType().key(), sessionId);

        if (previous != null && previous != runner && previous.isRunning()) {
            log.info("Stopping replaced {} runner of session {}", previous.backendType().key(), sessionId);
            previous.stop();
        }
    }

    /**
     * 중단 요청 표시 (runner 자체는 중단하지 않음).
     *
     * @param sessionId 세션 ID
     * @throws SessionNotFoundException 세션이 없는 경우
     */
    public void requestStop(String sessionId) {
        Session session = requireSession(sessionId);
        synchronized (session) {
            session.requestStop();
        }
        log.info("Stop requested for session {}", sessionId);
    }

    /**
     * 종료 상태 세션을 다음 이벤트를 위해 IDLE로 되돌림.
     *
     * @param sessionId 세션 ID
     */
    public void markIdle(String sessionId) {
        Session session = requireSession(sessionId);
        synchronized (session) {
            if (session.getStatus().isTerminal()) {
                session.transitionTo(SessionStatus.IDLE);
            }
        }
    }

    /**
     * runner 시작 실패 기록: runner 분리, ERROR 전이, 오류 게시 시도.
     *
     * @param sessionId 세션 ID
     * @param message 오류 메시지
     */
    public void recordStartFailure(String sessionId, String message) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            log.warn("Start failure for unknown session {}: {}", sessionId, message);
            return;
        }
        synchronized (session) {
            session.detachRunner();
            finishWith(session, SessionStatus.ERROR);
        }
        log.error("Runner failed to start for session {}: {}", sessionId, message);
        createErrorActivity(sessionId, message);
    }

    /**
     * 부모 세션 연결.
     *
     * @param childSessionId 자식 세션 ID
     * @param parentSessionId 부모 세션 ID
     */
    public void linkParent(String childSessionId, String parentSessionId) {
        Session session = requireSession(childSessionId);
        synchronized (session) {
            session.setParentSessionId(parentSessionId);
        }
    }

    /**
     * 절차 메타데이터 초기화.
     *
     * @param sessionId 세션 ID
     * @param procedureName 절차 이름
     * @throws IllegalArgumentException 등록되지 않은 절차인 경우
     */
    public void startProcedure(String sessionId, String procedureName) {
        Session session = requireSession(sessionId);
        Procedure procedure = procedureEngine.getProcedure(procedureName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown procedure: " + procedureName));
        synchronized (session) {
            procedureEngine.initializeMetadata(session, procedure);
        }
        log.info("Session {} started procedure {} ({} subroutines)", sessionId, procedureName, procedure.size());
    }

    // ========================================
    // Reducer
    // ========================================

    /**
     * 정규 메시지 1건 반영.
     *
     * <p>처리 중 예외는 로그로 남기고 세션을 ERROR로 전이하며 호출자에게 전파하지 않습니다.</p>
     *
     * @param sessionId 세션 ID
     * @param message 정규 메시지
     */
    public void ingest(String sessionId, CanonicalMessage message) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            log.warn("Dropping {} for unknown session {}", message.getClass().getSimpleName(), sessionId);
            return;
        }
        log.debug("Session {} ingest {}", sessionId, message.getClass().getSimpleName());
        try {
            if (message instanceof SystemInit) {
                handleSystemInit(session, (SystemInit) message);
            } else if (message instanceof ResultMessage) {
                completeSession(session, (ResultMessage) message);
            } else {
                SessionEntry entry = toEntry(message);
                int index = appendEntry(sessionId, entry);
                syncEntryToActivitySink(session, index, entry);
            }
        } catch (RuntimeException e) {
            log.error("Failed to handle {} for session {}", message.getClass().getSimpleName(), sessionId, e);
            synchronized (session) {
                finishWith(session, SessionStatus.ERROR);
            }
        }
    }

    private void handleSystemInit(Session session, SystemInit init) {
        String model = init.model();
        boolean notify;
        synchronized (session) {
            if (!init.isPending()) {
                session.runner().ifPresent(runner ->
                    session.assignResumeHandle(new ResumeHandle(runner.backendType(), init.sessionId())));
            }
            if (model != null && !model.isBlank()) {
                session.setModel(model);
            }
            notify = model != null && !model.isBlank() && !session.isModelNotified();
            if (notify) {
                session.markModelNotified();
            }
        }
        log.info("Session {} confirmed backend session {} (model: {})", session.getId(), init.sessionId(), model);
        if (notify) {
            post(session, ActivityContent.thought("Using model: " + model), ActivityPostOptions.NONE);
        }
    }

    private void completeSession(Session session, ResultMessage result) {
        String sessionId = session.getId();
        boolean stopped;
        synchronized (session) {
            if (session.getStatus().isTerminal()) {
                log.warn("Ignoring duplicate result for session {} (status: {})", sessionId, session.getStatus());
                return;
            }
            stopped = session.consumeStopRequest();
            SessionStatus status = stopped
                ? SessionStatus.STOPPED
                : result.isError() ? SessionStatus.ERROR : SessionStatus.COMPLETED;
            finishWith(session, status);
            session.recordUsage(result.totalCostUsd(), result.usage());
        }
        activeTasks.remove(sessionId);
        clearToolCalls(sessionId);

        SessionEntry entry = toEntry(result);
        int index = appendEntry(sessionId, entry);
        log.info("Session {} finished with {} (subtype: {}, turns: {})",
            sessionId, session.getStatus(), result.subtype(), result.numTurns());

        if (stopped) {
            log.info("Session {} was stopped by request; skipping procedure continuation", sessionId);
            return;
        }
        if (session.getProcedureMetadata() == null) {
            postResult(session, index, result.displayText(), result.isError());
            return;
        }
        if (!result.isError()) {
            handleProcedureCompletion(session, index, result.displayText());
        } else if (isRecoverable(result)) {
            Optional<String> recovered = procedureEngine.getLastSubroutineResult(session);
            if (recovered.isPresent()) {
                log.info("Session {} recovered previous subroutine result after {}", sessionId, result.subtype());
                handleProcedureCompletion(session, index, recovered.get());
            } else {
                log.warn("Session {} error result has no recoverable text (subtype: {})", sessionId, result.subtype());
                postResult(session, index, result.displayText(), true);
            }
        } else {
            postResult(session, index, result.displayText(), true);
        }
    }

    private void handleProcedureCompletion(Session session, int resultIndex, String resultText) {
        String sessionId = session.getId();
        String resumeSessionId = session.resumeHandle().map(ResumeHandle::sessionId).orElse(null);
        if (resumeSessionId == null) {
            log.error("No backend session id recorded for procedure session {}", sessionId);
            return;
        }

        Optional<Subroutine> next = procedureEngine.getNextSubroutine(session);
        if (next.isEmpty()) {
            log.info("Session {} completed all subroutines", sessionId);
            postResult(session, resultIndex, resultText, false);
            String parentSessionId = session.getParentSessionId();
            if (parentSessionId != null) {
                log.info("Child session {} completed, notifying parent {}", sessionId, parentSessionId);
                dispatch(listener -> listener.childSessionCompleted(sessionId, parentSessionId, resultText));
            }
            return;
        }

        boolean validating = procedureEngine.getCurrentSubroutine(session)
            .map(Subroutine::usesValidationLoop)
            .orElse(false);
        if (validating && handleValidationLoop(session, resultText)) {
            return;
        }

        synchronized (session) {
            procedureEngine.advance(session, resumeSessionId, resultText);
        }
        log.info("Session {} advancing to subroutine {}", sessionId, next.get().name());
        dispatch(listener -> listener.subroutineComplete(session));
    }

    // 제어 흐름을 가져갔으면 true (fixer 또는 재검증 필요)
    private boolean handleValidationLoop(Session session, String resultText) {
        String sessionId = session.getId();
        int maxIterations = config.maxValidationIterations();
        ValidationLoopState loop;
        ProcedureMetadata metadata;
        synchronized (session) {
            metadata = session.getProcedureMetadata();
            loop = metadata.validationLoop() == null ? ValidationLoopState.initial() : metadata.validationLoop();
            if (loop.inFixerMode()) {
                session.setProcedureMetadata(metadata.withValidationLoop(loop.withFixerMode(false)));
            }
        }
        if (loop.inFixerMode()) {
            int iteration = loop.iteration();
            log.info("Session {} fixer finished, re-running verifications (iteration {})", sessionId, iteration);
            dispatch(listener -> listener.validationLoopRerun(session, iteration));
            return true;
        }

        ValidationResult validation = ValidationResultParser.parse(resultText);
        ValidationLoopState updated = loop.recordAttempt(validation.pass(), validation.reason(),
            System.currentTimeMillis());

        if (validation.pass()) {
            log.info("Session {} validation passed on attempt {}", sessionId, updated.iteration());
            synchronized (session) {
                session.setProcedureMetadata(session.getProcedureMetadata().withValidationLoop(null));
            }
            return false;
        }

        if (updated.iteration() >= maxIterations) {
            log.warn("Session {} validation loop exhausted after {} attempts", sessionId, updated.iteration());
            synchronized (session) {
                session.setProcedureMetadata(session.getProcedureMetadata().withValidationLoop(null));
            }
            post(session, ActivityContent.thought("Validation loop exhausted after " + updated.iteration()
                + " attempts. Last failure: " + validation.reason()), ActivityPostOptions.NONE);
            return false;
        }

        synchronized (session) {
            session.setProcedureMetadata(
                session.getProcedureMetadata().withValidationLoop(updated.withFixerMode(true)));
        }
        String fixerPrompt = ValidationFixerPrompt.render(validation.reason(), updated.iteration(),
            maxIterations, updated.attempts());
        int iteration = updated.iteration();
        log.info("Session {} validation failed (attempt {} of {}), running fixer", sessionId, iteration, maxIterations);
        dispatch(listener -> listener.validationLoopIteration(session, fixerPrompt, iteration));
        return true;
    }

    private void handleRunnerFinished(String sessionId, RunnerAdapter runner) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        // 끝난 runner의 미완료 도구 호출은 더 이상 결과를 받지 않음
        clearToolCalls(sessionId);
        SessionStatus status;
        synchronized (session) {
            if (session.getStatus() != SessionStatus.RUNNING) {
                return;
            }
            boolean stopped = session.consumeStopRequest() || runner.state() == RunnerState.STOPPED;
            if (stopped) {
                status = SessionStatus.STOPPED;
            } else {
                status = runner.state() == RunnerState.COMPLETED ? SessionStatus.COMPLETED : SessionStatus.ERROR;
            }
            finishWith(session, status);
        }
        activeTasks.remove(sessionId);
        log.info("Session {} runner finished without a result, marked {}", sessionId, status);
    }

    private static boolean isRecoverable(ResultMessage result) {
        if (result.subtype() == ResultSubtype.ERROR_MAX_TURNS) {
            return true;
        }
        String text = (result.subtype().name() + " " + String.join(" ", result.errors()) + " "
            + (result.result() == null ? "" : result.result())).toLowerCase(Locale.ROOT);
        return text.contains("max turn") || text.contains("turn limit") || text.contains("turns limit");
    }

    // IDLE은 RUNNING을 거쳐 종료 상태로, 이미 종료 상태면 그대로 둠
    private static void finishWith(Session session, SessionStatus terminal) {
        if (session.getStatus().isTerminal()) {
            return;
        }
        if (session.getStatus() == SessionStatus.IDLE) {
            session.transitionTo(SessionStatus.RUNNING);
        }
        session.transitionTo(terminal);
    }

    // ========================================
    // 세션 기록 / 진행 상황 게시
    // ========================================

    private SessionEntry toEntry(CanonicalMessage message) {
        long now = System.currentTimeMillis();
        String resumeSessionId = SystemInit.PENDING_SESSION_ID.equals(message.sessionId()) ? null : message.sessionId();
        if (message instanceof AssistantText) {
            AssistantText text = (AssistantText) message;
            return new SessionEntry(EntryType.ASSISTANT, text.text(), resumeSessionId,
                new EntryMetadata(now, text.parentToolUseId(), null, null, null, null, text.sdkError(), null, null),
                null);
        }
        if (message instanceof AssistantToolUse) {
            AssistantToolUse toolUse = (AssistantToolUse) message;
            return new SessionEntry(EntryType.ASSISTANT, toolUse.toolName(), resumeSessionId,
                new EntryMetadata(now, toolUse.parentToolUseId(), toolUse.toolUseId(), toolUse.toolName(),
                    toolUse.input(), null, null, null, null),
                null);
        }
        if (message instanceof UserToolResult) {
            UserToolResult toolResult = (UserToolResult) message;
            return new SessionEntry(EntryType.USER, toolResult.content(), resumeSessionId,
                new EntryMetadata(now, null, toolResult.toolUseId(), null, null, toolResult.isError(), null,
                    null, null),
                null);
        }
        if (message instanceof ResultMessage) {
            ResultMessage result = (ResultMessage) message;
            return new SessionEntry(EntryType.RESULT, result.displayText(), resumeSessionId,
                new EntryMetadata(now, null, null, null, null, null, null, result.durationMs(), result.isError()),
                null);
        }
        return new SessionEntry(EntryType.SYSTEM, "", resumeSessionId, EntryMetadata.at(now), null);
    }

    private int appendEntry(String sessionId, SessionEntry entry) {
        List<SessionEntry> list = entries.computeIfAbsent(sessionId, key -> new CopyOnWriteArrayList<>());
        synchronized (list) {
            list.add(entry);
            return list.size() - 1;
        }
    }

    private void recordActivityId(String sessionId, int index, String activityId) {
        List<SessionEntry> list = entries.get(sessionId);
        if (list == null || activityId == null) {
            return;
        }
        synchronized (list) {
            if (index < list.size()) {
                list.set(index, list.get(index).withActivityId(activityId));
            }
        }
    }

    private void syncEntryToActivitySink(Session session, int index, SessionEntry entry) {
        ActivityRequest request = toActivity(session, entry);
        if (request == null) {
            return;
        }
        post(session, request.content(), request.options())
            .ifPresent(activityId -> recordActivityId(session.getId(), index, activityId));
    }

    private ActivityRequest toActivity(Session session, SessionEntry entry) {
        String sessionId = session.getId();
        EntryMetadata metadata = entry.metadata();
        boolean suppressed = procedureEngine.getCurrentSubroutine(session)
            .map(Subroutine::suppressThoughtPosting)
            .orElse(false);

        if (entry.isToolUse()) {
            String toolName = metadata.toolName();
            Map<String, Object> input = metadata.toolInput() == null ? Map.of() : metadata.toolInput();
            String activeTask = activeTasks.get(sessionId);
            boolean childOfTask = activeTask != null && activeTask.equals(metadata.parentToolUseId());
            String displayName = childOfTask ? CHILD_TOOL_PREFIX + toolName : toolName;
            toolCalls.put(toolKey(sessionId, metadata.toolUseId()), new ToolCall(displayName, toolName, input));

            if ("Task".equals(toolName) && !childOfTask) {
                activeTasks.put(sessionId, metadata.toolUseId());
            }
            if ("AskUserQuestion".equals(toolName) || suppressed) {
                return null;
            }
            if (TODO_TOOLS.contains(toolName)) {
                return new ActivityRequest(ActivityContent.thought(formatter.formatTodoList(input)),
                    ActivityPostOptions.NONE);
            }
            ActivityContent action = ActivityContent.action(
                formatter.formatToolActionName(displayName, input),
                formatter.formatToolParameter(toolName, input),
                null);
            return new ActivityRequest(action,
                "Task".equals(toolName) ? ActivityPostOptions.NONE : ActivityPostOptions.EPHEMERAL);
        }

        if (entry.isToolResult()) {
            String toolUseId = metadata.toolUseId();
            ToolCall call = toolCalls.remove(toolKey(sessionId, toolUseId));
            if (activeTasks.remove(sessionId, toolUseId)) {
                if (suppressed) {
                    return null;
                }
                return new ActivityRequest(
                    ActivityContent.thought("✅ Task Completed\n\n\n\n" + entry.content() + "\n\n---\n\n"),
                    ActivityPostOptions.NONE);
            }
            if (call == null) {
                log.debug("Session {} tool result {} has no matching tool use", sessionId, toolUseId);
                return null;
            }
            if (HIDDEN_RESULT_TOOLS.contains(call.toolName()) || suppressed) {
                return null;
            }
            boolean isError = Boolean.TRUE.equals(metadata.toolResultError());
            ActivityContent action = ActivityContent.action(
                formatter.formatToolActionName(call.displayName(), call.input()),
                formatter.formatToolParameter(call.toolName(), call.input()),
                formatter.formatToolResult(entry.content().trim(), isError));
            return new ActivityRequest(action, ActivityPostOptions.NONE);
        }

        if (entry.type() == EntryType.ASSISTANT) {
            if (metadata.sdkError() != null && !metadata.sdkError().isBlank()) {
                return new ActivityRequest(ActivityContent.error(entry.content()), ActivityPostOptions.NONE);
            }
            if (entry.content().isBlank() || suppressed) {
                return null;
            }
            return new ActivityRequest(ActivityContent.thought(entry.content()), ActivityPostOptions.NONE);
        }
        return null;
    }

    private void postResult(Session session, int index, String text, boolean isError) {
        ActivityContent content = isError ? ActivityContent.error(text) : ActivityContent.response(text);
        post(session, content, ActivityPostOptions.NONE)
            .ifPresent(activityId -> recordActivityId(session.getId(), index, activityId));
    }

    private Optional<String> post(Session session, ActivityContent content, ActivityPostOptions options) {
        if (!session.isTracked()) {
            return Optional.empty();
        }
        try {
            ActivityPostResult result = activitySink.postActivity(session.getExternalSessionId(), content, options);
            return result == null ? Optional.empty() : result.id();
        } catch (RuntimeException e) {
            log.error("Failed to post {} activity for session {}", content.type(), session.getId(), e);
            return Optional.empty();
        }
    }

    private static String toolKey(String sessionId, String toolUseId) {
        return sessionId + ":" + toolUseId;
    }

    private void clearToolCalls(String sessionId) {
        String prefix = sessionId + ":";
        toolCalls.keySet().removeIf(key -> key.startsWith(prefix));
    }

    // ========================================
    // Activity helpers
    // ========================================

    public Optional<String> createThoughtActivity(String sessionId, String body) {
        return postTo(sessionId, ActivityContent.thought(body), ActivityPostOptions.NONE);
    }

    public Optional<String> createActionActivity(String sessionId, String action, String parameter, String result) {
        return postTo(sessionId, ActivityContent.action(action, parameter, result), ActivityPostOptions.NONE);
    }

    public Optional<String> createResponseActivity(String sessionId, String body) {
        return postTo(sessionId, ActivityContent.response(body), ActivityPostOptions.NONE);
    }

    public Optional<String> createErrorActivity(String sessionId, String body) {
        return postTo(sessionId, ActivityContent.error(body), ActivityPostOptions.NONE);
    }

    public Optional<String> createElicitationActivity(String sessionId, String body) {
        return postTo(sessionId, ActivityContent.elicitation(body), ActivityPostOptions.NONE);
    }

    /**
     * 요청 분석 중임을 알리는 임시(ephemeral) thought.
     *
     * @param sessionId 세션 ID
     * @return 게시된 activity ID
     */
    public Optional<String> postAnalyzingThought(String sessionId) {
        return postTo(sessionId, ActivityContent.thought("Analyzing your request…"), ActivityPostOptions.EPHEMERAL);
    }

    /**
     * 선택된 절차 알림.
     *
     * @param sessionId 세션 ID
     * @param procedureName 절차 이름
     * @param classification 분류
     * @return 게시된 activity ID
     */
    public Optional<String> postProcedureSelectionThought(String sessionId, String procedureName,
                                                          String classification) {
        return postTo(sessionId, ActivityContent.thought(
            "Selected procedure: **" + procedureName + "** (classified as: " + classification + ")"),
            ActivityPostOptions.NONE);
    }

    private Optional<String> postTo(String sessionId, ActivityContent content, ActivityPostOptions options) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            log.warn("Cannot post {} activity, unknown session {}", content.type(), sessionId);
            return Optional.empty();
        }
        return post(session, content, options);
    }

    // ========================================
    // 조회
    // ========================================

    public Optional<Session> getSession(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * 세션 조회.
     *
     * @param sessionId 세션 ID
     * @return 세션
     * @throws SessionNotFoundException 세션이 없는 경우
     */
    public Session requireSession(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public List<SessionEntry> getSessionEntries(String sessionId) {
        List<SessionEntry> list = entries.get(sessionId);
        return list == null ? List.of() : List.copyOf(list);
    }

    public List<Session> getAllSessions() {
        return sessions.values().stream()
            .sorted(Comparator.comparingLong(Session::getCreatedAt))
            .collect(Collectors.toList());
    }

    public List<Session> getActiveSessions() {
        return getAllSessions().stream()
            .filter(session -> session.getStatus() == SessionStatus.RUNNING)
            .collect(Collectors.toList());
    }

    public List<Session> getSessionsByWorkItemId(String workItemId) {
        return getAllSessions().stream()
            .filter(session -> session.getWorkItemId().equals(workItemId))
            .collect(Collectors.toList());
    }

    public List<Session> getActiveSessionsByWorkItemId(String workItemId) {
        return getActiveSessions().stream()
            .filter(session -> session.getWorkItemId().equals(workItemId))
            .collect(Collectors.toList());
    }

    public List<Session> getActiveSessionsByBranchName(String branchName) {
        return getActiveSessions().stream()
            .filter(session -> session.getWorkItem() != null
                && Objects.equals(session.getWorkItem().branchName(), branchName))
            .collect(Collectors.toList());
    }

    public Optional<RunnerAdapter> getRunner(String sessionId) {
        return getSession(sessionId).flatMap(Session::runner);
    }

    public boolean hasRunner(String sessionId) {
        return getSession(sessionId).map(Session::isRunnerActive).orElse(false);
    }

    public List<RunnerAdapter> getAllRunners() {
        return getAllSessions().stream()
            .map(Session::runner)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    public List<RunnerAdapter> getRunnersForWorkItem(String workItemId) {
        return getSessionsByWorkItemId(workItemId).stream()
            .map(Session::runner)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    public ProcedureEngine procedureEngine() {
        return procedureEngine;
    }

    // ========================================
    // 스냅샷
    // ========================================

    /**
     * 모든 세션과 세션 기록을 저장소별로 묶은 스냅샷.
     *
     * @return 부모/저장소 매핑이 비어 있는 스냅샷
     */
    public PersistedState serializeState() {
        Map<String, Map<String, SessionSnapshot>> snapshots = new LinkedHashMap<>();
        Map<String, Map<String, List<SessionEntry>>> history = new LinkedHashMap<>();
        for (Session session : getAllSessions()) {
            String repositoryKey = session.getRepositoryId() == null ? DEFAULT_REPOSITORY_KEY : session.getRepositoryId();
            SessionSnapshot snapshot;
            synchronized (session) {
                snapshot = SessionSnapshot.capture(session);
            }
            snapshots.computeIfAbsent(repositoryKey, key -> new LinkedHashMap<>()).put(session.getId(), snapshot);
            history.computeIfAbsent(repositoryKey, key -> new LinkedHashMap<>())
                .put(session.getId(), getSessionEntries(session.getId()));
        }
        return new PersistedState(snapshots, history, Map.of(), Map.of());
    }

    /**
     * 스냅샷에서 세션 복원 (RUNNING이던 세션은 IDLE, runner 없음).
     *
     * <p>항목별 복원 실패는 로그만 남기고 나머지를 계속 복원합니다.</p>
     *
     * @param state 스냅샷
     * @return 복원된 세션 수
     */
    public int restoreState(PersistedState state) {
        if (state == null) {
            return 0;
        }
        int restored = 0;
        for (Map.Entry<String, Map<String, SessionSnapshot>> repository : state.agentSessions().entrySet()) {
            String repositoryId = DEFAULT_REPOSITORY_KEY.equals(repository.getKey()) ? null : repository.getKey();
            Map<String, List<SessionEntry>> repositoryEntries =
                state.agentSessionEntries().getOrDefault(repository.getKey(), Map.of());
            for (Map.Entry<String, SessionSnapshot> item : repository.getValue().entrySet()) {
                try {
                    Session session = item.getValue().toSession(repositoryId);
                    sessions.put(session.getId(), session);
                    List<SessionEntry> history = repositoryEntries.getOrDefault(item.getKey(), List.of());
                    entries.put(session.getId(), new CopyOnWriteArrayList<>(history == null ? List.of() : history));
                    restored++;
                } catch (RuntimeException e) {
                    log.error("Failed to restore session {} of repository {}", item.getKey(), repository.getKey(), e);
                }
            }
        }
        log.info("Restored {} session(s) from snapshot", restored);
        return restored;
    }

    private void dispatch(Consumer<SessionManagerListener> signal) {
        for (SessionManagerListener listener : listeners) {
            try {
                signal.accept(listener);
            } catch (RuntimeException e) {
                log.error("Session manager listener failed", e);
            }
        }
    }

    private record ToolCall(String displayName, String toolName, Map<String, Object> input) {
    }

    private record ActivityRequest(ActivityContent content, ActivityPostOptions options) {
    }

    /**
     * 연결된 runner의 이벤트를 세션 reducer로 전달 (교체된 runner의 이벤트는 무시).
     */
    private final class SessionRunnerListener implements RunnerListener {

        private final String sessionId;
        private final RunnerAdapter runner;

        private SessionRunnerListener(String sessionId, RunnerAdapter runner) {
            this.sessionId = sessionId;
            this.runner = runner;
        }

        @Override
        public void onMessage(RunnerAdapter source, CanonicalMessage message) {
            if (!isAttached()) {
                log.warn("Dropping {} from stale runner of session {}", message.getClass().getSimpleName(), sessionId);
                return;
            }
            ingest(sessionId, message);
        }

        @Override
        public void onComplete(RunnerAdapter source, List<CanonicalMessage> messages) {
            if (isAttached()) {
                handleRunnerFinished(sessionId, runner);
            }
        }

        @Override
        public void onError(RunnerAdapter source, Throwable error) {
            log.warn("Runner of session {} reported an error: {}", sessionId, error.getMessage());
        }

        private boolean isAttached() {
            Session session = sessions.get(sessionId);
            return session != null && session.runner().map(current -> current == runner).orElse(false);
        }
    }
}
