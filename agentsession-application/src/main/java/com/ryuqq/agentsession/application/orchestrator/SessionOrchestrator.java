package com.ryuqq.agentsession.application.orchestrator;

import com.ryuqq.agentsession.application.procedure.ProcedureRegistry;
import com.ryuqq.agentsession.application.routing.RunnerSelection;
import com.ryuqq.agentsession.application.routing.RunnerSelectionService;
import com.ryuqq.agentsession.application.session.SessionManager;
import com.ryuqq.agentsession.application.session.SessionManagerListener;
import com.ryuqq.agentsession.core.procedure.ProcedureDecision;
import com.ryuqq.agentsession.core.procedure.Subroutine;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.runner.RunnerStartException;
import com.ryuqq.agentsession.core.session.ResumeHandle;
import com.ryuqq.agentsession.core.session.Session;
import com.ryuqq.agentsession.core.session.WorkItem;
import com.ryuqq.agentsession.core.session.Workspace;
import com.ryuqq.agentsession.core.snapshot.PersistedState;
import com.ryuqq.agentsession.core.spi.ProcedureEngine;
import com.ryuqq.agentsession.core.spi.RunnerFactory;
import com.ryuqq.agentsession.core.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 외부 이벤트를 (저장소, 세션)으로 해석하고 runner를 붙이는 조정자.
 *
 * <p><strong>라우팅 결정 (중단 신호는 항상 먼저 처리):</strong></p>
 * <ol>
 *   <li>연결된 runner가 실행 중이고 스트리밍 입력을 지원하면 라이브 스트림에 추가</li>
 *   <li>실행 중이 아니면 절차를 재분류 (자식 결과, 검증 루프, 단계 전이는 예정된 단계를 그대로 실행)</li>
 *   <li>실행 설정을 조립하고 새 runner를 붙여 시작</li>
 * </ol>
 *
 * <p><strong>백엔드 선택:</strong> 세션이 이미 resume handle을 가지고 있으면 그 백엔드를 유지합니다.
 * 세션은 도중에 백엔드를 바꾸지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 세션별 {@link ReentrantLock}으로 "대상 결정 → runner 연결" 구간을
 * 보호합니다. 세션 생성은 작업 항목별 잠금 안에서 runner 연결까지 진행하며, 잠금 순서는 항상
 * 작업 항목 → 세션입니다. 세션 간 전역 잠금은 없습니다. runner의 {@code stop()}은 대기하지 않으므로
 * 잠금 안에서 호출해도 교착이 생기지 않습니다.</p>
 *
 * <pre>
 * SessionOrchestrator orchestrator = SessionOrchestrator.create(sessionManager, runnerFactory,
 *     sessionStore, new DefaultPromptAssembler(), new OrchestratorConfig(), repositories);
 * orchestrator.loadState();
 * orchestrator.handle(InboundEvent.sessionStart("repo-1", workItem, null, "Fix login", labels, description,
 *     TrackingMode.TRACKED));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private static final String WORK_ITEM_LOCK_PREFIX = "work-item:";

    private final SessionManager sessionManager;
    private final ProcedureEngine procedureEngine;
    private final RunnerFactory runnerFactory;
    private final SessionStore sessionStore;
    private final PromptAssembler promptAssembler;
    private final RunnerSelectionService selectionService;
    private final OrchestratorConfig config;

    private final Map<String, RepositoryConfig> repositories = new ConcurrentHashMap<>();
    private final Map<String, String> childToParent = new ConcurrentHashMap<>();
    private final Map<String, String> issueRepositoryCache = new ConcurrentHashMap<>();
    private final Map<String, RunnerSelection> selections = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();

    private SessionOrchestrator(SessionManager sessionManager, RunnerFactory runnerFactory,
                                SessionStore sessionStore, PromptAssembler promptAssembler,
                                RunnerSelectionService selectionService, OrchestratorConfig config) {
        this.sessionManager = sessionManager;
        this.procedureEngine = sessionManager.procedureEngine();
        this.runnerFactory = runnerFactory;
        this.sessionStore = sessionStore;
        this.promptAssembler = promptAssembler;
        this.selectionService = selectionService;
        this.config = config;
    }

    /**
     * Orchestrator를 만들고 SessionManager 신호를 연결.
     *
     * <p>신호 핸들러가 완성된 Orchestrator를 참조해야 하므로 생성 후 등록합니다.</p>
     *
     * @param sessionManager 세션 관리자
     * @param runnerFactory runner 생성기
     * @param sessionStore 상태 저장소
     * @param promptAssembler 프롬프트 조립기
     * @param config 설정
     * @param repositories 저장소 설정
     * @return Orchestrator
     */
    public static SessionOrchestrator create(SessionManager sessionManager, RunnerFactory runnerFactory,
                                             SessionStore sessionStore, PromptAssembler promptAssembler,
                                             OrchestratorConfig config, Collection<RepositoryConfig> repositories) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return create(sessionManager, runnerFactory, sessionStore, promptAssembler,
            new RunnerSelectionService(config.defaultBackend()), config, repositories);
    }

    public static SessionOrchestrator create(SessionManager sessionManager, RunnerFactory runnerFactory,
                                             SessionStore sessionStore, PromptAssembler promptAssembler,
                                             RunnerSelectionService selectionService, OrchestratorConfig config,
                                             Collection<RepositoryConfig> repositories) {
        if (sessionManager == null) {
            throw new IllegalArgumentException("sessionManager cannot be null");
        }
        if (runnerFactory == null) {
            throw new IllegalArgumentException("runnerFactory cannot be null");
        }
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore cannot be null");
        }
        if (promptAssembler == null) {
            throw new IllegalArgumentException("promptAssembler cannot be null");
        }
        if (selectionService == null) {
            throw new IllegalArgumentException("selectionService cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        SessionOrchestrator orchestrator = new SessionOrchestrator(sessionManager, runnerFactory, sessionStore,
            promptAssembler, selectionService, config);
        if (repositories != null) {
            repositories.forEach(orchestrator::addRepository);
        }
        sessionManager.addListener(orchestrator.new ProcedureSignalHandler());
        return orchestrator;
    }

    // ========================================
    // 저장소
    // ========================================

    public void addRepository(RepositoryConfig repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        repositories.put(repository.id(), repository);
        log.info("Registered repository {} ({})", repository.id(), repository.repositoryPath());
    }

    /**
     * 저장소 해제: 세션의 runner를 중단하고 세션을 제거.
     *
     * @param repositoryId 저장소 ID
     * @return 제거된 세션 수
     */
    public int removeRepository(String repositoryId) {
        repositories.remove(repositoryId);
        List<String> sessionIds = sessionManager.getAllSessions().stream()
            .filter(session -> repositoryId.equals(session.getRepositoryId()))
            .map(Session::getId)
            .collect(Collectors.toList());
        int removed = sessionManager.removeRepositorySessions(repositoryId);
        sessionIds.forEach(id -> {
            selections.remove(id);
            locks.remove(id);
            childToParent.remove(id);
        });
        issueRepositoryCache.values().removeIf(repositoryId::equals);
        return removed;
    }

    public Optional<RepositoryConfig> getRepository(String repositoryId) {
        return Optional.ofNullable(repositoryId == null ? null : repositories.get(repositoryId));
    }

    // ========================================
    // 이벤트 처리
    // ========================================

    /**
     * 이벤트 1건 처리.
     *
     * <p>처리 중 예외는 로그로 남기고 전파하지 않습니다. 한 이벤트의 실패가
     * 다른 세션에 영향을 주지 않습니다. 설정에 따라 처리 후 상태를 저장합니다.</p>
     *
     * @param event 이벤트
     */
    public void handle(InboundEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        inFlight.incrementAndGet();
        try {
            switch (event.kind()) {
                case STOP_SIGNAL:
                    handleStop(event);
                    break;
                case UNASSIGN:
                    handleUnassign(event);
                    break;
                case SESSION_START:
                    handleSessionStart(event);
                    break;
                default:
                    handlePrompt(event);
                    break;
            }
        } catch (Exception e) {
            log.error("Failed to handle {} event (session: {}, work item: {})", event.kind(), event.sessionId(),
                event.workItem() == null ? null : event.workItem().id(), e);
        } finally {
            inFlight.decrementAndGet();
        }
        if (config.persistOnEveryEvent()) {
            saveState();
        }
    }

    private void handleStop(InboundEvent event) {
        String sessionId = event.sessionId();
        Optional<Session> found = sessionManager.getSession(sessionId);
        if (found.isEmpty()) {
            log.warn("Stop signal for unknown session {}", sessionId);
            return;
        }
        Session session = found.get();
        withLock(sessionId, () -> {
            stopRunner(session);
            sessionManager.createResponseActivity(sessionId,
                "I've stopped working on " + titleOf(session) + " as requested.");
        });
    }

    private void handleUnassign(InboundEvent event) {
        String workItemId = event.workItem().id();
        List<Session> sessions = sessionManager.getSessionsByWorkItemId(workItemId);
        int stopped = 0;
        for (Session session : sessions) {
            boolean wasRunning = callWithLock(session.getId(), () -> stopRunner(session));
            if (wasRunning) {
                stopped++;
            }
        }
        log.info("Unassigned work item {}: stopped {} running session(s)", workItemId, stopped);
    }

    // 실행 중이던 runner가 있었으면 true
    private boolean stopRunner(Session session) {
        RunnerAdapter runner = session.runner().orElse(null);
        if (runner == null || !runner.isRunning()) {
            log.info("Session {} has no running runner to stop", session.getId());
            return false;
        }
        sessionManager.requestStop(session.getId());
        runner.stop();
        log.info("Stopped {} runner of session {}", runner.backendType().key(), session.getId());
        return true;
    }

    private void handleSessionStart(InboundEvent event) {
        WorkItem workItem = event.workItem();
        RepositoryConfig repository = resolveRepository(event.repositoryId(), workItem.id());
        if (repository == null) {
            log.warn("No repository for work item {} (requested: {})", workItem.id(), event.repositoryId());
            return;
        }

        // 작업 항목 잠금 → 세션 잠금 순서. runner 연결까지 작업 항목 잠금을 유지해
        // 동시에 도착한 두 번째 SESSION_START는 실행 중인 세션의 프롬프트로만 전달됨
        boolean created = callWithLock(WORK_ITEM_LOCK_PREFIX + workItem.id(), () -> {
            List<Session> existing = sessionManager.getSessionsByWorkItemId(workItem.id());
            if (!existing.isEmpty()) {
                return false;
            }
            Workspace workspace = event.workspace() != null
                ? event.workspace()
                : Workspace.of(repository.repositoryPath().toString());
            Session session = sessionManager.createSession(workItem, repository.id(), workspace,
                event.trackingMode(), false);
            String sessionId = session.getId();
            issueRepositoryCache.put(workItem.id(), repository.id());
            if (event.parentSessionId() != null) {
                childToParent.put(sessionId, event.parentSessionId());
                sessionManager.linkParent(sessionId, event.parentSessionId());
            }
            selections.put(sessionId, selectionService.select(event.labels(), event.description()));
            withLock(sessionId, () -> {
                sessionManager.postAnalyzingThought(sessionId);
                classify(session, event.text());
                startRunner(session, repository, event);
            });
            return true;
        });
        if (created) {
            return;
        }

        List<Session> existing = sessionManager.getSessionsByWorkItemId(workItem.id());
        if (existing.isEmpty()) {
            log.warn("Session for work item {} disappeared while starting", workItem.id());
            return;
        }
        Session target = existing.get(existing.size() - 1);
        log.info("Work item {} already has session {}, routing as prompt", workItem.id(), target.getId());
        handlePrompt(InboundEvent.userPrompt(target.getId(), event.text())
            .withRouting(event.labels(), event.description()));
    }

    private void handlePrompt(InboundEvent event) {
        String sessionId = event.sessionId();
        Optional<Session> found = sessionManager.getSession(sessionId);
        if (found.isEmpty()) {
            log.warn("{} event for unknown session {}", event.kind(), sessionId);
            return;
        }
        Session session = found.get();
        RepositoryConfig repository = resolveRepository(session.getRepositoryId(), session.getWorkItemId());
        if (repository == null) {
            log.warn("Session {} belongs to unknown repository {}", sessionId, session.getRepositoryId());
            return;
        }

        withLock(sessionId, () -> {
            RunnerAdapter runner = session.runner().orElse(null);
            boolean running = runner != null && runner.isRunning();

            if (running && runner.supportsStreamingInput() && !event.text().isBlank()) {
                try {
                    runner.addStreamMessage(event.text());
                    log.info("Appended {} to live stream of session {}", event.kind(), sessionId);
                    return;
                } catch (UnsupportedOperationException e) {
                    log.info("Session {} stream no longer accepts input, restarting runner: {}",
                        sessionId, e.getMessage());
                }
            }

            if (!running && !event.kind().forcesPlannedSubroutine()) {
                if (!event.labels().isEmpty() || event.description() != null) {
                    selections.put(sessionId, selectionService.select(event.labels(), event.description()));
                }
                classify(session, event.text());
            }
            startRunner(session, repository, event);
        });
    }

    private void classify(Session session, String text) {
        ProcedureDecision decision = procedureEngine.classify(text);
        log.info("Session {} classified as {} -> {} ({})", session.getId(), decision.classification(),
            decision.procedureName(), decision.reasoning());
        sessionManager.startProcedure(session.getId(), decision.procedureName());
        sessionManager.postProcedureSelectionThought(session.getId(), decision.procedureName(),
            decision.classification());
    }

    // ========================================
    // Runner 시작
    // ========================================

    private void startRunner(Session session, RepositoryConfig repository, InboundEvent event) {
        String sessionId = session.getId();
        Subroutine subroutine = event.kind() == EventKind.VALIDATION_FIXER
            ? ProcedureRegistry.VALIDATION_FIXER
            : procedureEngine.getCurrentSubroutine(session).orElse(null);
        String prompt = promptAssembler.assemble(event.kind(), session, subroutine, event.text());
        RunnerConfig runnerConfig = buildRunnerConfig(session, repository, subroutine);
        BackendType backend = backendFor(session);

        RunnerAdapter runner = runnerFactory.create(backend, runnerConfig);
        sessionManager.attachRunner(sessionId, runner);
        log.info("Starting {} runner for session {} (event: {}, subroutine: {}, resume: {})", backend.key(),
            sessionId, event.kind(), subroutine == null ? null : subroutine.name(), runnerConfig.resumeSessionId());
        try {
            if (runner.supportsStreamingInput()) {
                runner.startStreaming(prompt);
            } else {
                runner.start(prompt);
            }
        } catch (RunnerStartException e) {
            sessionManager.recordStartFailure(sessionId, e.getMessage());
        } catch (RuntimeException e) {
            // 어댑터 계약 밖의 실패: 세션이 RUNNING에 묶이지 않도록 시작 실패로 기록
            log.error("Unexpected {} runner start failure for session {}", backend.key(), sessionId, e);
            if (runner.isRunning()) {
                runner.stop();
            }
            sessionManager.recordStartFailure(sessionId, e.getMessage());
        }
    }

    // resume handle의 백엔드가 라우팅 신호보다 우선
    private BackendType backendFor(Session session) {
        return session.resumeHandle()
            .map(ResumeHandle::backend)
            .orElseGet(() -> selectionFor(session).backend());
    }

    private RunnerSelection selectionFor(Session session) {
        return selections.computeIfAbsent(session.getId(), id -> selectionService.select(List.of(), null));
    }

    RunnerConfig buildRunnerConfig(Session session, RepositoryConfig repository, Subroutine subroutine) {
        BackendType backend = backendFor(session);
        RunnerSelection selection = selectionFor(session);
        String model = selection.backend() == backend ? selection.model() : selectionService.defaultModelFor(backend);
        String fallbackModel = selection.backend() == backend
            ? selection.fallbackModel() : selectionService.defaultFallbackModelFor(backend);

        Path workingDirectory = Path.of(session.getWorkspace().path());
        Set<Path> directories = new LinkedHashSet<>();
        directories.add(repository.repositoryPath());
        directories.add(workingDirectory);
        directories.addAll(repository.extraDirectories());

        List<String> disallowedTools = new ArrayList<>(repository.resolvedDisallowedTools());
        boolean disallowAllTools = false;
        Integer maxTurns = null;
        if (subroutine != null) {
            subroutine.disallowedTools().stream()
                .filter(tool -> !disallowedTools.contains(tool))
                .forEach(disallowedTools::add);
            disallowAllTools = subroutine.disallowAllTools();
            maxTurns = subroutine.singleTurn() ? 1 : null;
        }

        return RunnerConfig.of(workingDirectory)
            .withModel(model)
            .withFallbackModel(fallbackModel)
            .withResumeSessionId(session.resumeSessionIdFor(backend).orElse(null))
            .withAllowedTools(disallowAllTools ? List.of() : repository.resolvedAllowedTools())
            .withDisallowedTools(disallowedTools)
            .withAllowedDirectories(new ArrayList<>(directories))
            .withMaxTurns(maxTurns)
            .withDisallowAllTools(disallowAllTools);
    }

    private RepositoryConfig resolveRepository(String repositoryId, String workItemId) {
        if (repositoryId != null) {
            return repositories.get(repositoryId);
        }
        String cached = workItemId == null ? null : issueRepositoryCache.get(workItemId);
        if (cached != null) {
            return repositories.get(cached);
        }
        return repositories.size() == 1 ? repositories.values().iterator().next() : null;
    }

    private static String titleOf(Session session) {
        WorkItem workItem = session.getWorkItem();
        return workItem != null ? workItem.displayTitle() : session.getWorkItemId();
    }

    // ========================================
    // 영속화
    // ========================================

    /**
     * 저장소에서 상태 복원.
     *
     * @return 복원된 세션 수
     */
    public int loadState() {
        Optional<PersistedState> loaded = sessionStore.load();
        if (loaded.isEmpty()) {
            log.info("No persisted state to restore");
            return 0;
        }
        PersistedState state = loaded.get();
        int restored = sessionManager.restoreState(state);
        childToParent.putAll(state.childToParentAgentSession());
        issueRepositoryCache.putAll(state.issueRepositoryCache());
        log.info("Restored {} session(s), {} child mapping(s), {} repository mapping(s)", restored,
            state.childToParentAgentSession().size(), state.issueRepositoryCache().size());
        return restored;
    }

    /**
     * 현재 상태 저장. 실패는 로그만 남깁니다.
     */
    public void saveState() {
        if (!config.stateSaveEnabled()) {
            return;
        }
        try {
            PersistedState state = sessionManager.serializeState()
                .withMappings(new LinkedHashMap<>(childToParent), new LinkedHashMap<>(issueRepositoryCache));
            sessionStore.save(state);
            log.debug("Saved state with {} session(s)", state.sessionCount());
        } catch (RuntimeException e) {
            log.error("Failed to save session state", e);
        }
    }

    /**
     * 모든 실행 중인 runner를 중단하고 상태 저장.
     */
    public void shutdown() {
        for (Session session : sessionManager.getActiveSessions()) {
            withLock(session.getId(), () -> stopRunner(session));
        }
        saveState();
        log.info("Orchestrator shut down");
    }

    // ========================================
    // 상태 조회
    // ========================================

    /**
     * 처리 중인 이벤트가 있거나 실행 중인 runner가 있으면 BUSY.
     *
     * @return 워커 상태
     */
    public WorkerStatus computeStatus() {
        if (inFlight.get() > 0) {
            return WorkerStatus.BUSY;
        }
        boolean anyRunning = sessionManager.getAllRunners().stream().anyMatch(RunnerAdapter::isRunning);
        return anyRunning ? WorkerStatus.BUSY : WorkerStatus.IDLE;
    }

    public VersionInfo versionInfo() {
        return VersionInfo.of(SessionOrchestrator.class);
    }

    public int inFlightCount() {
        return inFlight.get();
    }

    public Optional<String> parentOf(String childSessionId) {
        return Optional.ofNullable(childToParent.get(childSessionId));
    }

    public Optional<String> repositoryOf(String workItemId) {
        return Optional.ofNullable(issueRepositoryCache.get(workItemId));
    }

    // ========================================
    // 잠금
    // ========================================

    private void withLock(String key, Runnable action) {
        callWithLock(key, () -> {
            action.run();
            return null;
        });
    }

    private <T> T callWithLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * SessionManager 신호를 내부 이벤트로 변환.
     */
    private class ProcedureSignalHandler implements SessionManagerListener {

        @Override
        public void subroutineComplete(Session session) {
            handle(InboundEvent.subroutineTransition(session.getId()));
        }

        @Override
        public void validationLoopIteration(Session session, String fixerPrompt, int iteration) {
            handle(InboundEvent.validationFixer(session.getId(), fixerPrompt));
        }

        @Override
        public void validationLoopRerun(Session session, int iteration) {
            handle(InboundEvent.validationRerun(session.getId()));
        }

        @Override
        public void childSessionCompleted(String childSessionId, String parentSessionId, String result) {
            String prompt = "Child agent session " + childSessionId + " completed with result:\n\n"
                + (result == null ? "" : result);
            handle(InboundEvent.childResult(parentSessionId, prompt));
        }
    }
}
