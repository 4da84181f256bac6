package com.ryuqq.agentsession.testkit.fake;

import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.message.ResultMessage;
import com.ryuqq.agentsession.core.message.SystemInit;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.runner.RunnerExecutionException;
import com.ryuqq.agentsession.core.runner.RunnerListener;
import com.ryuqq.agentsession.core.runner.RunnerSessionInfo;
import com.ryuqq.agentsession.core.runner.RunnerStartException;
import com.ryuqq.agentsession.core.runner.RunnerState;
import com.ryuqq.agentsession.core.runner.StreamingInputUnsupportedException;
import com.ryuqq.agentsession.core.statemachine.RunnerStateTransition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 테스트가 직접 메시지를 흘려보내는 RunnerAdapter.
 *
 * <p>프로세스 없이 동기적으로 동작합니다. 테스트는 {@link #emit}, {@link #complete},
 * {@link #completeWith}로 백엔드 동작을 흉내 냅니다.</p>
 *
 * <pre>
 * FakeRunnerAdapter runner = factory.lastCreated();
 * runner.emit(SystemInit.of("sess-1", "opus"));
 * runner.completeWith(ResultMessage.success("sess-1", "done", Usage.ZERO, 10));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeRunnerAdapter implements RunnerAdapter {

    private final BackendType backend;
    private final RunnerConfig config;
    private final boolean streamingSupported;
    private final List<CanonicalMessage> messages = new ArrayList<>();
    private final List<RunnerListener> listeners = new CopyOnWriteArrayList<>();
    private final List<String> prompts = new ArrayList<>();
    private final List<String> streamMessages = new ArrayList<>();

    private volatile RunnerState state = RunnerState.IDLE;
    private RuntimeException startFailure;
    private boolean streaming;
    private boolean streamCompleted;
    private boolean stopRequested;
    private RunnerSessionInfo sessionInfo;
    private CompletableFuture<RunnerSessionInfo> completion;

    public FakeRunnerAdapter(BackendType backend, RunnerConfig config, boolean streamingSupported) {
        this.backend = backend;
        this.config = config;
        this.streamingSupported = streamingSupported;
    }

    /**
     * 다음 start 호출을 실패시키도록 설정.
     *
     * @param failure 던질 예외
     * @return this
     */
    public FakeRunnerAdapter failOnStart(RuntimeException failure) {
        this.startFailure = failure;
        return this;
    }

    // ========== RunnerAdapter ==========

    @Override
    public BackendType backendType() {
        return backend;
    }

    @Override
    public boolean supportsStreamingInput() {
        return streamingSupported;
    }

    @Override
    public synchronized CompletableFuture<RunnerSessionInfo> start(String prompt) {
        return launch(prompt, false);
    }

    @Override
    public synchronized CompletableFuture<RunnerSessionInfo> startStreaming(String prompt) {
        if (!streamingSupported) {
            throw new StreamingInputUnsupportedException(backend);
        }
        return launch(prompt, true);
    }

    @Override
    public synchronized void addStreamMessage(String text) {
        if (!streamingSupported) {
            throw new StreamingInputUnsupportedException(backend);
        }
        if (!streaming || state != RunnerState.RUNNING || streamCompleted) {
            throw new StreamingInputUnsupportedException("No active streaming session to append to");
        }
        streamMessages.add(text);
    }

    @Override
    public synchronized void completeStream() {
        streamCompleted = true;
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (state.isTerminal() || stopRequested) {
                return;
            }
            stopRequested = true;
            if (state == RunnerState.IDLE) {
                state = RunnerStateTransition.transition(state, RunnerState.STOPPED);
                return;
            }
        }
        finish(RunnerState.STOPPED, null);
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
    public synchronized List<CanonicalMessage> getMessages() {
        return List.copyOf(messages);
    }

    @Override
    public void addListener(RunnerListener listener) {
        listeners.add(listener);
    }

    // ========== Test Controls ==========

    /**
     * 메시지 발행 (Result 제외).
     *
     * @param message 메시지
     */
    public void emit(CanonicalMessage message) {
        synchronized (this) {
            messages.add(message);
        }
        listeners.forEach(listener -> listener.onMessage(this, message));
    }

    /**
     * Result를 마지막으로 발행하고 종료.
     *
     * @param result 결과 메시지
     */
    public void completeWith(ResultMessage result) {
        finish(result.isError() ? RunnerState.FAILED : RunnerState.COMPLETED, result);
    }

    /**
     * Result 없이 정상 종료.
     */
    public void complete() {
        finish(RunnerState.COMPLETED, null);
    }

    public RunnerConfig config() {
        return config;
    }

    public synchronized List<String> prompts() {
        return List.copyOf(prompts);
    }

    public synchronized List<String> streamMessages() {
        return List.copyOf(streamMessages);
    }

    public synchronized boolean isStreaming() {
        return streaming;
    }

    public synchronized boolean isStopRequested() {
        return stopRequested;
    }

    private CompletableFuture<RunnerSessionInfo> launch(String prompt, boolean streamingInput) {
        if (state != RunnerState.IDLE) {
            throw new RunnerStartException(backend.displayName() + " session already running");
        }
        if (startFailure != null) {
            state = RunnerState.FAILED;
            throw startFailure;
        }
        state = RunnerStateTransition.transition(state, RunnerState.STARTING);
        state = RunnerStateTransition.transition(state, RunnerState.RUNNING);
        prompts.add(prompt);
        streaming = streamingInput;
        sessionInfo = new RunnerSessionInfo(null, Instant.now(), null, streamingInput);
        completion = new CompletableFuture<>();
        return completion;
    }

    private void finish(RunnerState terminal, ResultMessage result) {
        List<CanonicalMessage> all;
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            state = RunnerStateTransition.transition(state, terminal);
        }
        if (result != null) {
            emit(result);
        }
        synchronized (this) {
            all = List.copyOf(messages);
        }
        listeners.forEach(listener -> listener.onComplete(this, all));
        if (terminal == RunnerState.FAILED && result != null) {
            RunnerExecutionException error = new RunnerExecutionException(result.displayText());
            listeners.forEach(listener -> listener.onError(this, error));
        }
        String sessionId = all.stream()
            .filter(CanonicalMessage::isSystemInit)
            .map(CanonicalMessage::sessionId)
            .filter(id -> !SystemInit.PENDING_SESSION_ID.equals(id))
            .findFirst()
            .orElse(null);
        completion.complete(sessionInfo.finish(sessionId, Instant.now()));
    }
}
