package com.ryuqq.agentsession.core.runner;

/**
 * 백엔드를 시작할 수 없음 (StartError).
 *
 * <p>바이너리 누락, 버전 불일치, 이미 실행 중인 runner 재시작 등.
 * 메시지가 발행되기 전에 {@code start()} 호출 자체를 실패시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunnerStartException extends RuntimeException {

    public RunnerStartException(String message) {
        super(message);
    }

    public RunnerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
