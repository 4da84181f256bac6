package com.ryuqq.agentsession.core.runner;

import java.time.Instant;

/**
 * 한 번의 백엔드 호출에 대한 handle.
 *
 * @param sessionId 확정된 백엔드 세션 ID (확정 전이면 null)
 * @param startedAt 시작 시각
 * @param endedAt 종료 시각 (실행 중이면 null)
 * @param streaming 스트리밍 입력 모드 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunnerSessionInfo(
    String sessionId,
    Instant startedAt,
    Instant endedAt,
    boolean streaming
) {

    public RunnerSessionInfo {
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
    }

    /**
     * 종료 정보를 채운 새 인스턴스.
     *
     * @param sessionId 최종 세션 ID
     * @param endedAt 종료 시각
     * @return 새 RunnerSessionInfo
     */
    public RunnerSessionInfo finish(String sessionId, Instant endedAt) {
        return new RunnerSessionInfo(sessionId, startedAt, endedAt, streaming);
    }
}
