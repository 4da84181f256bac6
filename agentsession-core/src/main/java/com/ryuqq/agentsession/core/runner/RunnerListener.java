package com.ryuqq.agentsession.core.runner;

import com.ryuqq.agentsession.core.message.CanonicalMessage;

import java.util.List;

/**
 * RunnerAdapter 이벤트 수신자.
 *
 * <p>콜백은 메시지 발행 순서대로 호출됩니다. 구현체는 빠르게 반환해야 하며,
 * 콜백에서 던진 예외는 adapter가 로깅 후 무시합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RunnerListener {

    /**
     * 정규 메시지 수신.
     *
     * @param runner 발행한 runner
     * @param message 메시지
     */
    void onMessage(RunnerAdapter runner, CanonicalMessage message);

    /**
     * 실행 종료 (성공/실패/중단 모두 한 번 호출).
     *
     * @param runner 발행한 runner
     * @param messages 전체 메시지 시퀀스
     */
    default void onComplete(RunnerAdapter runner, List<CanonicalMessage> messages) {
    }

    /**
     * 실행 실패 (실패 시에만 한 번 호출).
     *
     * @param runner 발행한 runner
     * @param error 원인
     */
    default void onError(RunnerAdapter runner, Throwable error) {
    }
}
