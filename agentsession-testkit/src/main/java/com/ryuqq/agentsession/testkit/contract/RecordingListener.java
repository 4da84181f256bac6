package com.ryuqq.agentsession.testkit.contract;

import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runner 이벤트를 기록하는 테스트용 listener.
 *
 * <p>Result 메시지를 받은 시점의 {@code isRunning()} 값도 함께 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingListener implements RunnerListener {

    private final List<CanonicalMessage> messages = Collections.synchronizedList(new ArrayList<>());
    private final List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
    private final CountDownLatch completed = new CountDownLatch(1);

    private volatile Boolean runningWhenResultObserved;
    private volatile int completeCount;

    @Override
    public void onMessage(RunnerAdapter runner, CanonicalMessage message) {
        if (message.isResult()) {
            runningWhenResultObserved = runner.isRunning();
        }
        messages.add(message);
    }

    @Override
    public void onComplete(RunnerAdapter runner, List<CanonicalMessage> all) {
        completeCount++;
        completed.countDown();
    }

    @Override
    public void onError(RunnerAdapter runner, Throwable error) {
        errors.add(error);
    }

    /**
     * 완료 이벤트 대기.
     *
     * @param timeoutMillis 최대 대기 시간
     * @return 시간 내에 완료되었으면 true
     */
    public boolean awaitCompletion(long timeoutMillis) {
        try {
            return completed.await(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Await interrupted", e);
        }
    }

    public List<CanonicalMessage> messages() {
        synchronized (messages) {
            return List.copyOf(messages);
        }
    }

    public List<Throwable> errors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    public Boolean runningWhenResultObserved() {
        return runningWhenResultObserved;
    }

    public int completeCount() {
        return completeCount;
    }
}
