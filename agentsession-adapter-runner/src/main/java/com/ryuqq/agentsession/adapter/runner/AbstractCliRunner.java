package com.ryuqq.agentsession.adapter.runner;

import com.ryuqq.agentsession.adapter.runner.process.LaunchedProcess;
import com.ryuqq.agentsession.adapter.runner.process.ProcessLauncher;
import com.ryuqq.agentsession.adapter.runner.support.EventTranslator;
import com.ryuqq.agentsession.adapter.runner.support.RunTermination;
import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.message.ResultMessage;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.runner.RunnerExecutionException;
import com.ryuqq.agentsession.core.runner.RunnerListener;
import com.ryuqq.agentsession.core.runner.RunnerSessionInfo;
import com.ryuqq.agentsession.core.runner.RunnerStartException;
import com.ryuqq.agentsession.core.runner.RunnerState;
import com.ryuqq.agentsession.core.runner.StreamingInputUnsupportedException;
import com.ryuqq.agentsession.core.statemachine.RunnerStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 자식 프로세스 기반 RunnerAdapter 공통 구현.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * start(prompt)
 *   │ IDLE → STARTING
 *   ├─► preflight()            (실패 시 RunnerStartException, 메시지 없음)
 *   ├─► launcher.launch(...)   (실패 시 RunnerStartException, 메시지 없음)
 *   │ STARTING → RUNNING
 *   ▼
 * stdout reader thread
 *   ├─► translator.translate(line) ─► emit(message) ─► listeners
 *   ▼
 * EOF / exit
 *   ├─► translator.finish(termination)   (SystemInit/Result 합성)
 *   ├─► RUNNING → COMPLETED / FAILED / STOPPED   (종료 메시지 발행 전에 전이)
 *   └─► emit(tail) ─► onComplete ─► onError (실패 시) ─► future 완료
 * </pre>
 *
 * <p>stderr는 별도 스레드에서 소비하여 마지막 줄을 실패 메시지에 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractCliRunner implements RunnerAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractCliRunner.class);

    protected final RunnerConfig config;
    protected final CliRunnerConfig cliConfig;
    protected final ProcessLauncher launcher;

    private final Object lock = new Object();
    private final List<CanonicalMessage> messages = new ArrayList<>();
    private final List<RunnerListener> listeners = new CopyOnWriteArrayList<>();

    private volatile RunnerState state = RunnerState.IDLE;
    private volatile boolean stopRequested;
    private volatile String lastStderrLine;

    private LaunchedProcess process;
    private EventTranslator translator;
    private RunnerSessionInfo sessionInfo;
    private CompletableFuture<RunnerSessionInfo> completion;
    private boolean streaming;
    private boolean stdinClosed;

    protected AbstractCliRunner(RunnerConfig config, CliRunnerConfig cliConfig, ProcessLauncher launcher) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (cliConfig == null) {
            throw new IllegalArgumentException("cliConfig cannot be null");
        }
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        this.config = config;
        this.cliConfig = cliConfig;
        this.launcher = launcher;
    }

    // ========================================
    // 하위 클래스 구현
    // ========================================

    /**
     * 실행 명령 조립.
     *
     * @param prompt 프롬프트
     * @param streamingInput 스트리밍 입력 모드 여부
     * @return 실행 파일과 인자
     */
    protected abstract List<String> buildCommand(String prompt, boolean streamingInput);

    /**
     * 이번 실행용 translator 생성.
     *
     * @return 새 translator
     */
    protected abstract EventTranslator createTranslator();

    /**
     * 비정상 종료 코드에 대한 메시지.
     *
     * @param exitCode 종료 코드
     * @return 메시지
     */
    protected abstract String exitFailureMessage(int exitCode);

    /**
     * 기동 전 동기 확인 (기본: 없음).
     *
     * @throws RunnerStartException 백엔드를 사용할 수 없는 경우
     */
    protected void preflight() {
    }

    /**
     * 스트리밍 입력 한 건을 stdin 줄로 변환.
     *
     * @param text 입력
     * @return stdin에 쓸 한 줄 (개행 제외)
     */
    protected String formatStreamMessage(String text) {
        throw new StreamingInputUnsupportedException(backendType());
    }

    protected Map<String, String> environment() {
        return cliConfig.environment();
    }

    // ========================================
    // RunnerAdapter
    // ========================================

    @Override
    public CompletableFuture<RunnerSessionInfo> start(String prompt) {
        return launch(prompt, false);
    }

    @Override
    public CompletableFuture<RunnerSessionInfo> startStreaming(String prompt) {
        if (!supportsStreamingInput()) {
            throw new StreamingInputUnsupportedException(backendType());
        }
        return launch(prompt, true);
    }

    @Override
    public void addStreamMessage(String text) {
        if (!supportsStreamingInput()) {
            throw new StreamingInputUnsupportedException(backendType());
        }
        synchronized (lock) {
            if (!streaming || state != RunnerState.RUNNING || stdinClosed) {
                throw new StreamingInputUnsupportedException(
                    "No active streaming " + backendType().displayName() + " session to append to");
            }
            writeLine(formatStreamMessage(text));
        }
    }

    @Override
    public void completeStream() {
        synchronized (lock) {
            if (!streaming || process == null || stdinClosed) {
                return;
            }
            closeStdin();
        }
    }

    @Override
    public void stop() {
        LaunchedProcess target;
        synchronized (lock) {
            if (state.isTerminal() || stopRequested) {
                return;
            }
            stopRequested = true;
            if (state == RunnerState.IDLE) {
                state = RunnerStateTransition.transition(state, RunnerState.STOPPED);
                return;
            }
            target = process;
        }
        log.info("Stopping {} runner (session: {})", backendType().key(), currentSessionId());
        if (target != null) {
            target.destroy();
        }
    }

    @Override
    public boolean isRunning() {
        return state.isActive();
    }

    @Override
    public RunnerState state() {
        return state;
    }

    @Override
    public List<CanonicalMessage> getMessages() {
        synchronized (lock) {
            return List.copyOf(messages);
        }
    }

    @Override
    public void addListener(RunnerListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    /**
     * 현재까지 알려진 백엔드 세션 ID.
     *
     * @return 세션 ID, 시작 전이면 null
     */
    public String currentSessionId() {
        EventTranslator current = translator;
        return current == null ? null : current.currentSessionId();
    }

    // ========================================
    // 실행
    // ========================================

    private CompletableFuture<RunnerSessionInfo> launch(String prompt, boolean streamingInput) {
        if (prompt == null) {
            throw new IllegalArgumentException("prompt cannot be null");
        }
        String name = backendType().displayName();
        synchronized (lock) {
            if (state.isActive()) {
                throw new RunnerStartException(name + " session already running");
            }
            if (state.isTerminal()) {
                throw new RunnerStartException(name + " runner already finished (" + state + "); create a new instance");
            }
            state = RunnerStateTransition.transition(state, RunnerState.STARTING);
        }

        try {
            preflight();
        } catch (RunnerStartException e) {
            markStartFailed();
            throw e;
        }

        EventTranslator newTranslator = createTranslator();
        List<String> command = buildCommand(prompt, streamingInput);
        LaunchedProcess launched;
        try {
            launched = launcher.launch(command, config.workingDirectory(), environment());
        } catch (IOException e) {
            markStartFailed();
            throw new RunnerStartException("Failed to start " + name + " (" + command.get(0) + "): " + e.getMessage(), e);
        }

        if (streamingInput) {
            try {
                writeLine(launched, formatStreamMessage(prompt));
            } catch (IOException e) {
                launched.destroy();
                markStartFailed();
                throw new RunnerStartException(name + " rejected the initial prompt (" + command.get(0) + "): "
                    + e.getMessage(), e);
            }
        }

        CompletableFuture<RunnerSessionInfo> future = new CompletableFuture<>();
        synchronized (lock) {
            this.translator = newTranslator;
            this.process = launched;
            this.streaming = streamingInput;
            this.sessionInfo = new RunnerSessionInfo(null, Instant.now(), null, streamingInput);
            this.completion = future;
            state = RunnerStateTransition.transition(state, RunnerState.RUNNING);
            if (stopRequested) {
                // 기동 중 중단 요청: reader가 EOF 후 STOPPED로 정리
                launched.destroy();
            }
            if (!streamingInput) {
                closeStdin();
            }
        }

        log.info("Started {} runner (resume: {}, streaming: {}, cwd: {})",
            backendType().key(), config.resumeSessionId(), streamingInput, config.workingDirectory());

        startDaemon(this::drainStderr, "stderr");
        startDaemon(this::pump, "stdout");
        return future;
    }

    private void pump() {
        String failureMessage = null;
        int exitCode = -1;
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.stdout(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
            exitCode = process.waitFor();
            if (exitCode != 0) {
                failureMessage = exitFailureMessage(exitCode);
            }
        } catch (IOException e) {
            failureMessage = e.getMessage() != null ? e.getMessage() : exitFailureMessage(exitCode);
            log.warn("{} stdout read failed (session: {})", backendType().key(), currentSessionId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failureMessage = backendType().displayName() + " runner interrupted";
        }
        finish(exitCode, failureMessage);
    }

    private void handleLine(String line) {
        List<CanonicalMessage> translated;
        try {
            translated = translator.translate(line);
        } catch (RuntimeException e) {
            log.warn("Failed to translate {} event (session: {}): {}", backendType().key(), currentSessionId(), line, e);
            return;
        }
        translated.forEach(this::emit);
        if (streaming && translator.isTerminalEventSeen()) {
            completeStream();
        }
    }

    private void finish(int exitCode, String failureMessage) {
        boolean stopped = stopRequested;
        if (failureMessage != null && !stopped && lastStderrLine != null) {
            log.warn("{} failed (session: {}): {} / last stderr: {}",
                backendType().key(), currentSessionId(), failureMessage, lastStderrLine);
        }
        List<CanonicalMessage> tail = translator.finish(
            new RunTermination(exitCode, stopped, stopped ? null : failureMessage));

        ResultMessage result = null;
        for (CanonicalMessage message : tail) {
            if (message instanceof ResultMessage) {
                result = (ResultMessage) message;
            }
        }
        RunnerState terminal;
        if (stopped) {
            terminal = RunnerState.STOPPED;
        } else if (result != null && result.isError()) {
            terminal = RunnerState.FAILED;
        } else {
            terminal = RunnerState.COMPLETED;
        }

        // 종료 Result를 받은 쪽이 isRunning()=false를 보도록 먼저 전이
        synchronized (lock) {
            state = RunnerStateTransition.transition(state, terminal);
        }
        tail.forEach(this::emit);

        List<CanonicalMessage> all = getMessages();
        log.info("{} runner finished with {} (session: {}, exit: {}, messages: {})",
            backendType().key(), terminal, currentSessionId(), exitCode, all.size());

        for (RunnerListener listener : listeners) {
            try {
                listener.onComplete(this, all);
            } catch (RuntimeException e) {
                log.error("Runner listener failed on completion (session: {})", currentSessionId(), e);
            }
        }
        if (terminal == RunnerState.FAILED) {
            RunnerExecutionException error = new RunnerExecutionException(result.displayText());
            for (RunnerListener listener : listeners) {
                try {
                    listener.onError(this, error);
                } catch (RuntimeException e) {
                    log.error("Runner listener failed on error (session: {})", currentSessionId(), e);
                }
            }
        }
        completion.complete(sessionInfo.finish(currentSessionId(), Instant.now()));
    }

    private void emit(CanonicalMessage message) {
        synchronized (lock) {
            messages.add(message);
        }
        log.debug("{} message {} (session: {})", backendType().key(),
            message.getClass().getSimpleName(), message.sessionId());
        for (RunnerListener listener : listeners) {
            try {
                listener.onMessage(this, message);
            } catch (RuntimeException e) {
                log.error("Runner listener failed on {} (session: {})",
                    message.getClass().getSimpleName(), message.sessionId(), e);
            }
        }
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.stderr(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    lastStderrLine = line.trim();
                    log.debug("{} stderr: {}", backendType().key(), line);
                }
            }
        } catch (IOException e) {
            log.debug("{} stderr closed: {}", backendType().key(), e.getMessage());
        }
    }

    private void writeLine(String line) {
        try {
            writeLine(process, line);
        } catch (IOException e) {
            throw new StreamingInputUnsupportedException(
                backendType().displayName() + " stdin is no longer writable: " + e.getMessage());
        }
    }

    private static void writeLine(LaunchedProcess target, String line) throws IOException {
        OutputStream stdin = target.stdin();
        stdin.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        stdin.flush();
    }

    private void closeStdin() {
        stdinClosed = true;
        try {
            process.closeStdin();
        } catch (IOException e) {
            log.warn("Failed to close {} stdin (session: {})", backendType().key(), currentSessionId(), e);
        }
    }

    private void markStartFailed() {
        synchronized (lock) {
            state = RunnerStateTransition.transition(state, RunnerState.FAILED);
        }
    }

    private void startDaemon(Runnable task, String stream) {
        Thread thread = new Thread(task, "agentsession-" + backendType().key() + "-" + stream);
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{backend=" + backendType().key() + ", state=" + state + '}';
    }
}
