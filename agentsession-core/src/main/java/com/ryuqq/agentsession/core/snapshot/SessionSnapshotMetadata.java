package com.ryuqq.agentsession.core.snapshot;

import com.ryuqq.agentsession.core.message.Usage;
import com.ryuqq.agentsession.core.procedure.ProcedureMetadata;

/**
 * 세션 스냅샷의 부가 정보.
 *
 * @param model 마지막 사용 모델
 * @param totalCostUsd 누적 비용
 * @param usage 사용량
 * @param procedure 절차 진행 상태
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionSnapshotMetadata(
    String model,
    Double totalCostUsd,
    Usage usage,
    ProcedureMetadata procedure
) {
}
