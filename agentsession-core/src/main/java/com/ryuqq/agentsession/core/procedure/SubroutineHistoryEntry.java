package com.ryuqq.agentsession.core.procedure;

/**
 * 완료된 단계 기록.
 *
 * @param subroutine 단계 이름
 * @param completedAt 완료 시각 (epoch millis)
 * @param resumeSessionId 해당 단계를 실행한 백엔드 세션 ID (null 가능)
 * @param result 결과 텍스트 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SubroutineHistoryEntry(
    String subroutine,
    long completedAt,
    String resumeSessionId,
    String result
) {
}
