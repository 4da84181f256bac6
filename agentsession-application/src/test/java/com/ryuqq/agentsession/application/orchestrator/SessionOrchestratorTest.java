package com.ryuqq.agentsession.application.orchestrator;

import com.ryuqq.agentsession.adapter.inmemory.activity.InMemoryActivitySink;
import com.ryuqq.agentsession.adapter.inmemory.store.InMemorySessionStore;
import com.ryuqq.agentsession.application.procedure.DefaultProcedureEngine;
import com.ryuqq.agentsession.application.procedure.ProcedureRegistry;
import com.ryuqq.agentsession.application.routing.ToolPolicy;
import com.ryuqq.agentsession.application.session.SessionManager;
import com.ryuqq.agentsession.core.activity.ActivityPostOptions;
import com.ryuqq.agentsession.core.activity.ActivityType;
import com.ryuqq.agentsession.core.message.ResultMessage;
import com.ryuqq.agentsession.core.message.SystemInit;
import com.ryuqq.agentsession.core.message.Usage;
import com.ryuqq.agentsession.core.procedure.ProcedureDecision;
import com.ryuqq.agentsession.core.procedure.ProcedureMetadata;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.runner.RunnerStartException;
import com.ryuqq.agentsession.core.session.Session;
import com.ryuqq.agentsession.core.session.TrackingMode;
import com.ryuqq.agentsession.core.session.WorkItem;
import com.ryuqq.agentsession.core.session.Workspace;
import com.ryuqq.agentsession.core.spi.RunnerFactory;
import com.ryuqq.agentsession.core.statemachine.SessionStatus;
import com.ryuqq.agentsession.testkit.fake.FakeRunnerAdapter;
import com.ryuqq.agentsession.testkit.fake.FakeRunnerFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SessionOrchestrator 통합 테스트.
 *
 * <p>FakeRunnerFactory의 runner는 동기적으로 메시지를 발행하므로, 단계 전이 등
 * SessionManager 신호로 이어지는 이벤트도 같은 스레드에서 완료됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SessionOrchestratorTest {

    private static final Path REPOSITORY_PATH = Path.of("/repos/app");
    private static final WorkItem WORK_ITEM = new WorkItem("issue-1", "ENG-1", "Fix login", null, "eng-1-fix-login");

    private InMemoryActivitySink sink;
    private InMemorySessionStore store;
    private FakeRunnerFactory runnerFactory;
    private SessionManager sessionManager;
    private SessionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        sink = new InMemoryActivitySink();
        store = new InMemorySessionStore();
        runnerFactory = new FakeRunnerFactory();
        orchestrator = newOrchestrator(new OrchestratorConfig());
    }

    private SessionOrchestrator newOrchestrator(OrchestratorConfig config) {
        return newOrchestrator(config, runnerFactory);
    }

    private SessionOrchestrator newOrchestrator(OrchestratorConfig config, RunnerFactory factory) {
        sessionManager = new SessionManager(sink,
            new DefaultProcedureEngine(text -> new ProcedureDecision("code", "full-development", "")));
        return SessionOrchestrator.create(sessionManager, factory, store, new DefaultPromptAssembler(),
            config, List.of(RepositoryConfig.of("repo-1", REPOSITORY_PATH)));
    }

    private Session start(WorkItem workItem, String text, List<String> labels) {
        orchestrator.handle(InboundEvent.sessionStart("repo-1", workItem, null, text, labels, null,
            TrackingMode.TRACKED));
        return sessionManager.getSessionsByWorkItemId(workItem.id()).get(0);
    }

    private Session start() {
        return start(WORK_ITEM, "Fix login", List.of());
    }

    // ========================================
    // 세션 시작
    // ========================================

    @Test
    void 세션을_만들고_절차를_분류한_뒤_runner를_시작한다() {
        // when
        Session session = start();

        // then
        assertThat(session.getId()).isEqualTo("agent-session-1");
        assertThat(session.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(session.getProcedureMetadata().procedureName()).isEqualTo("full-development");

        FakeRunnerAdapter runner = runnerFactory.lastCreated();
        assertThat(runner.backendType()).isEqualTo(BackendType.CLAUDE);
        assertThat(runner.isStreaming()).isTrue();
        assertThat(runner.prompts()).containsExactly(
            "Fix login\n\nContinue with: Implementation phase for code changes");

        assertThat(sink.posted().get(0).options()).isEqualTo(ActivityPostOptions.EPHEMERAL);
        assertThat(sink.bodiesOf(ActivityType.THOUGHT)).containsExactly(
            "Analyzing your request…",
            "Selected procedure: **full-development** (classified as: code)");
        assertThat(orchestrator.repositoryOf("issue-1")).contains("repo-1");
        assertThat(store.saveCount()).isEqualTo(1);
    }

    @Test
    void runner_설정은_저장소와_라우팅_선택을_따른다() {
        // when
        start();

        // then
        RunnerConfig config = runnerFactory.lastCreated().config();
        assertThat(config.workingDirectory()).isEqualTo(REPOSITORY_PATH);
        assertThat(config.model()).isEqualTo("opus");
        assertThat(config.fallbackModel()).isEqualTo("sonnet");
        assertThat(config.resumeSessionId()).isNull();
        assertThat(config.allowedTools()).isEqualTo(ToolPolicy.SAFE);
        assertThat(config.allowedDirectories()).containsExactly(REPOSITORY_PATH);
        assertThat(config.maxTurns()).isNull();
    }

    @Test
    void codex_라벨이면_codex_runner를_스트리밍_없이_시작한다() {
        // when
        start(WORK_ITEM, "Fix login", List.of("codex"));

        // then
        FakeRunnerAdapter runner = runnerFactory.lastCreated();
        assertThat(runner.backendType()).isEqualTo(BackendType.CODEX);
        assertThat(runner.isStreaming()).isFalse();
        assertThat(runner.config().model()).isEqualTo("gpt-5.3-codex");
    }

    @Test
    void 이미_세션이_있는_작업_항목은_프롬프트로_전달한다() {
        // given
        start();

        // when
        orchestrator.handle(InboundEvent.sessionStart("repo-1", WORK_ITEM, null, "Also check logout",
            List.of(), null, TrackingMode.TRACKED));

        // then
        assertThat(sink.createdSessions()).hasSize(1);
        assertThat(runnerFactory.created()).hasSize(1);
        assertThat(runnerFactory.lastCreated().streamMessages()).containsExactly("Also check logout");
    }

    @Test
    void 알_수_없는_저장소면_세션을_만들지_않는다() {
        // when
        orchestrator.handle(InboundEvent.sessionStart("repo-x", WORK_ITEM, null, "Fix login", List.of(), null,
            TrackingMode.TRACKED));

        // then
        assertThat(sink.createdSessions()).isEmpty();
        assertThat(runnerFactory.created()).isEmpty();
        assertThat(orchestrator.inFlightCount()).isZero();
    }

    @Test
    void 시작_실패는_세션을_ERROR로_만든다() {
        // given
        runnerFactory.failNextStart(new RunnerStartException("claude executable not found"));

        // when
        Session session = start();

        // then
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ERROR);
        assertThat(session.runner()).isEmpty();
        assertThat(sink.bodiesOf(ActivityType.ERROR)).containsExactly("claude executable not found");
    }

    @Test
    void 예상하지_못한_시작_예외도_세션을_ERROR로_만든다() {
        // given
        runnerFactory.failNextStart(new IllegalStateException("stdin closed before first prompt"));

        // when
        Session session = start();

        // then
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ERROR);
        assertThat(session.runner()).isEmpty();
        assertThat(sink.bodiesOf(ActivityType.ERROR)).containsExactly("stdin closed before first prompt");
        assertThat(orchestrator.computeStatus()).isEqualTo(WorkerStatus.IDLE);
    }

    @Test
    void 같은_작업_항목의_동시_시작은_세션_하나와_runner_하나만_만든다() throws Exception {
        // given
        CountDownLatch creating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RunnerFactory gated = (backend, config) -> {
            creating.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return runnerFactory.create(backend, config);
        };
        orchestrator = newOrchestrator(new OrchestratorConfig(), gated);
        InboundEvent event = InboundEvent.sessionStart("repo-1", WORK_ITEM, null, "Fix login", List.of(), null,
            TrackingMode.TRACKED);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            // when
            Future<?> first = executor.submit(() -> orchestrator.handle(event));
            assertThat(creating.await(5, TimeUnit.SECONDS)).isTrue();
            Future<?> second = executor.submit(() -> orchestrator.handle(event));
            release.countDown();
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        // then
        assertThat(sink.createdSessions()).hasSize(1);
        List<Session> sessions = sessionManager.getSessionsByWorkItemId("issue-1");
        assertThat(sessions).hasSize(1);
        assertThat(runnerFactory.created()).hasSize(1);
        assertThat(runnerFactory.created().stream().filter(FakeRunnerAdapter::isRunning).count()).isEqualTo(1);
        assertThat(sessions.get(0).runner()).containsSame(runnerFactory.lastCreated());
        assertThat(runnerFactory.lastCreated().streamMessages()).containsExactly("Fix login");
    }

    // ========================================
    // 프롬프트 라우팅
    // ========================================

    @Test
    void 스트리밍_runner가_실행_중이면_스트림에_추가한다() {
        // given
        Session session = start();

        // when
        orchestrator.handle(InboundEvent.userPrompt(session.getId(), "Also update the docs"));

        // then
        assertThat(runnerFactory.created()).hasSize(1);
        assertThat(runnerFactory.lastCreated().streamMessages()).containsExactly("Also update the docs");
    }

    @Test
    void 스트리밍을_지원하지_않으면_새_runner로_교체한다() {
        // given
        Session session = start(WORK_ITEM, "Fix login", List.of("codex"));
        FakeRunnerAdapter first = runnerFactory.lastCreated();

        // when
        orchestrator.handle(InboundEvent.userPrompt(session.getId(), "Use the new API"));

        // then
        assertThat(runnerFactory.created()).hasSize(2);
        assertThat(first.isStopRequested()).isTrue();
        assertThat(session.runner()).containsSame(runnerFactory.lastCreated());
        assertThat(runnerFactory.lastCreated().prompts().get(0)).startsWith("Use the new API");
    }

    @Test
    void 단계가_끝나면_resume으로_다음_단계를_실행한다() {
        // given
        Session session = start();
        FakeRunnerAdapter first = runnerFactory.lastCreated();
        first.emit(SystemInit.of("claude-1", "opus"));

        // when
        first.completeWith(ResultMessage.success("claude-1", "Implemented", Usage.ZERO, 100));

        // then
        assertThat(runnerFactory.created()).hasSize(2);
        FakeRunnerAdapter second = runnerFactory.lastCreated();
        assertThat(second.config().resumeSessionId()).isEqualTo("claude-1");
        assertThat(second.prompts()).containsExactly("Continue with: Run tests, linting and type checks");
        assertThat(session.getProcedureMetadata().currentSubroutineIndex()).isEqualTo(1);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.RUNNING);
    }

    @Test
    void resume_handle의_백엔드가_라벨보다_우선한다() {
        // given
        Session session = start();
        FakeRunnerAdapter first = runnerFactory.lastCreated();
        first.emit(SystemInit.of("claude-1", "opus"));
        orchestrator.handle(InboundEvent.stopSignal(session.getId()));

        // when
        orchestrator.handle(InboundEvent.userPrompt(session.getId(), "Try again")
            .withRouting(List.of("codex"), null));

        // then
        FakeRunnerAdapter second = runnerFactory.lastCreated();
        assertThat(second).isNotSameAs(first);
        assertThat(second.backendType()).isEqualTo(BackendType.CLAUDE);
        assertThat(second.config().model()).isEqualTo("opus");
        assertThat(second.config().resumeSessionId()).isEqualTo("claude-1");
    }

    @Test
    void 자식_세션이_끝나면_부모에게_결과를_전달한다() {
        // given
        Session parent = start();
        orchestrator.handle(InboundEvent.stopSignal(parent.getId()));
        WorkItem childItem = WorkItem.of("issue-2", "ENG-2", "Sub task");
        orchestrator.handle(InboundEvent.sessionStart("repo-1", childItem, null, "Sub task", List.of(), null,
            TrackingMode.TRACKED).withParent(parent.getId()));
        Session child = sessionManager.getSessionsByWorkItemId("issue-2").get(0);
        child.setProcedureMetadata(new ProcedureMetadata("full-development", 5, List.of(), null));
        FakeRunnerAdapter childRunner = runnerFactory.lastCreated();
        childRunner.emit(SystemInit.of("claude-child", "opus"));

        // when
        childRunner.completeWith(ResultMessage.success("claude-child", "Child finished", Usage.ZERO, 10));

        // then
        assertThat(orchestrator.parentOf(child.getId())).contains(parent.getId());
        assertThat(child.getParentSessionId()).isEqualTo(parent.getId());
        FakeRunnerAdapter parentRunner = runnerFactory.lastCreated();
        assertThat(parent.runner()).containsSame(parentRunner);
        assertThat(parentRunner.prompts()).containsExactly(
            "Child agent session " + child.getId() + " completed with result:\n\nChild finished");
        assertThat(parent.getStatus()).isEqualTo(SessionStatus.RUNNING);
    }

    @Test
    void 알_수_없는_세션의_프롬프트는_무시한다() {
        // when
        orchestrator.handle(InboundEvent.userPrompt("no-such-session", "hello"));

        // then
        assertThat(runnerFactory.created()).isEmpty();
    }

    // ========================================
    // 중단
    // ========================================

    @Test
    void 중단_신호는_runner를_멈추고_응답을_게시한다() {
        // given
        Session session = start();

        // when
        orchestrator.handle(InboundEvent.stopSignal(session.getId()));

        // then
        assertThat(runnerFactory.lastCreated().isStopRequested()).isTrue();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.STOPPED);
        assertThat(sink.bodiesOf(ActivityType.RESPONSE))
            .containsExactly("I've stopped working on Fix login as requested.");
        assertThat(session.getProcedureMetadata().currentSubroutineIndex()).isZero();
    }

    @Test
    void 할당_해제는_작업_항목의_runner를_멈춘다() {
        // given
        Session session = start();

        // when
        orchestrator.handle(InboundEvent.unassign(WORK_ITEM));

        // then
        assertThat(session.getStatus()).isEqualTo(SessionStatus.STOPPED);
        assertThat(sink.bodiesOf(ActivityType.RESPONSE)).isEmpty();
    }

    @Test
    void 저장소를_제거하면_세션과_매핑도_제거한다() {
        // given
        Session session = start();

        // when
        int removed = orchestrator.removeRepository("repo-1");

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(sessionManager.getSession(session.getId())).isEmpty();
        assertThat(runnerFactory.lastCreated().isStopRequested()).isTrue();
        assertThat(orchestrator.repositoryOf("issue-1")).isEmpty();
        assertThat(orchestrator.getRepository("repo-1")).isEmpty();
    }

    // ========================================
    // 실행 설정
    // ========================================

    @Test
    void 요약_단계는_도구없이_단일_턴으로_실행한다() {
        // given
        Session session = sessionManager.createSession(WORK_ITEM, "repo-1", Workspace.of("/work/issue-1"),
            TrackingMode.UNTRACKED, false);
        RepositoryConfig repository = RepositoryConfig.of("repo-1", REPOSITORY_PATH)
            .withDisallowedTools(List.of("Bash"))
            .withExtraDirectories(List.of(Path.of("/shared")));

        // when
        RunnerConfig summary = orchestrator.buildRunnerConfig(session, repository, ProcedureRegistry.CONCISE_SUMMARY);
        RunnerConfig coding = orchestrator.buildRunnerConfig(session, repository, ProcedureRegistry.CODING_ACTIVITY);

        // then
        assertThat(summary.allowedTools()).isEmpty();
        assertThat(summary.disallowAllTools()).isTrue();
        assertThat(summary.maxTurns()).isEqualTo(1);
        assertThat(summary.disallowedTools()).containsExactly("Bash");
        assertThat(summary.allowedDirectories())
            .containsExactly(REPOSITORY_PATH, Path.of("/work/issue-1"), Path.of("/shared"));
        assertThat(coding.allowedTools()).isEqualTo(ToolPolicy.SAFE);
        assertThat(coding.maxTurns()).isNull();
        assertThat(coding.disallowAllTools()).isFalse();
    }

    // ========================================
    // 상태 / 영속화
    // ========================================

    @Test
    void 실행_중인_runner가_있으면_BUSY() {
        // given
        Session session = start();

        // when & then
        assertThat(orchestrator.computeStatus()).isEqualTo(WorkerStatus.BUSY);
        orchestrator.handle(InboundEvent.stopSignal(session.getId()));
        assertThat(orchestrator.computeStatus()).isEqualTo(WorkerStatus.IDLE);
    }

    @Test
    void 저장한_상태를_새_인스턴스에서_복원한다() {
        // given
        Session session = start();
        runnerFactory.lastCreated().emit(SystemInit.of("claude-1", "opus"));
        orchestrator.saveState();

        // when
        SessionOrchestrator restarted = newOrchestrator(new OrchestratorConfig());
        int restored = restarted.loadState();

        // then
        assertThat(restored).isEqualTo(1);
        Session restoredSession = sessionManager.requireSession(session.getId());
        assertThat(restoredSession.getStatus()).isEqualTo(SessionStatus.IDLE);
        assertThat(restoredSession.resumeSessionIdFor(BackendType.CLAUDE)).contains("claude-1");
        assertThat(restarted.repositoryOf("issue-1")).contains("repo-1");
    }

    @Test
    void 상태_저장이_꺼져_있으면_저장하지_않는다() {
        // given
        orchestrator = newOrchestrator(new OrchestratorConfig().withStateSaveEnabled(false));

        // when
        start();
        orchestrator.saveState();

        // then
        assertThat(store.saveCount()).isZero();
    }

    @Test
    void 종료시_runner를_멈추고_저장한다() {
        // given
        Session session = start();
        int savesBefore = store.saveCount();

        // when
        orchestrator.shutdown();

        // then
        assertThat(session.getStatus()).isEqualTo(SessionStatus.STOPPED);
        assertThat(store.saveCount()).isEqualTo(savesBefore + 1);
        assertThat(store.load().orElseThrow().agentSessions().get("repo-1").get(session.getId()).status())
            .isEqualTo("stopped");
    }

    @Test
    void 버전_정보는_manifest가_없으면_개발_버전() {
        assertThat(orchestrator.versionInfo())
            .isEqualTo(new VersionInfo("agentsession-application", VersionInfo.DEVELOPMENT_VERSION));
    }
}
