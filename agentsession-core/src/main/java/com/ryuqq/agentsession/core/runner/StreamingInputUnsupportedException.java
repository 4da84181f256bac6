package com.ryuqq.agentsession.core.runner;

/**
 * 백엔드가 지원하지 않는 스트리밍 입력을 사용하려 함.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamingInputUnsupportedException extends UnsupportedOperationException {

    public StreamingInputUnsupportedException(BackendType backend) {
        super(backend.displayName() + " does not support streaming input messages");
    }

    public StreamingInputUnsupportedException(String message) {
        super(message);
    }
}
