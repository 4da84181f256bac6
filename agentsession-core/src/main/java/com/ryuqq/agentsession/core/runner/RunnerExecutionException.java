package com.ryuqq.agentsession.core.runner;

/**
 * 백엔드가 실행되었으나 실패함 (ExecutionError).
 *
 * <p>메시지 스트림으로는 던지지 않고, 오류 ResultMessage와 함께
 * {@link RunnerListener#onError}로만 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunnerExecutionException extends RuntimeException {

    public RunnerExecutionException(String message) {
        super(message);
    }
}
