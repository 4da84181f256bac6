package com.ryuqq.agentsession.core.procedure;

import java.util.ArrayList;
import java.util.List;

/**
 * Session에 저장되는 절차 진행 상태.
 *
 * <p>{@code currentSubroutineIndex}는 SessionManager만 전진시킵니다.
 * 검증 루프가 진행 중이 아니면 {@code validationLoop}는 null입니다.</p>
 *
 * @param procedureName 절차 이름
 * @param currentSubroutineIndex 현재 단계 인덱스
 * @param subroutineHistory 완료된 단계 기록
 * @param validationLoop 검증 루프 상태 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProcedureMetadata(
    String procedureName,
    int currentSubroutineIndex,
    List<SubroutineHistoryEntry> subroutineHistory,
    ValidationLoopState validationLoop
) {

    public ProcedureMetadata {
        if (procedureName == null || procedureName.isBlank()) {
            throw new IllegalArgumentException("procedureName cannot be null or blank");
        }
        if (currentSubroutineIndex < 0) {
            throw new IllegalArgumentException(
                "currentSubroutineIndex cannot be negative (current: " + currentSubroutineIndex + ")");
        }
        subroutineHistory = subroutineHistory == null ? List.of() : List.copyOf(subroutineHistory);
    }

    /**
     * 절차 시작 상태.
     *
     * @param procedureName 절차 이름
     * @return index 0, 기록 없음
     */
    public static ProcedureMetadata start(String procedureName) {
        return new ProcedureMetadata(procedureName, 0, List.of(), null);
    }

    /**
     * 현재 단계를 완료 처리하고 다음 단계로 전진.
     *
     * <p>검증 루프 상태는 초기화됩니다.</p>
     *
     * @param completedSubroutine 완료한 단계 이름
     * @param resumeSessionId 백엔드 세션 ID
     * @param result 결과 텍스트
     * @param completedAt 완료 시각
     * @return 전진한 새 메타데이터
     */
    public ProcedureMetadata advance(String completedSubroutine, String resumeSessionId, String result, long completedAt) {
        List<SubroutineHistoryEntry> history = new ArrayList<>(subroutineHistory);
        history.add(new SubroutineHistoryEntry(completedSubroutine, completedAt, resumeSessionId, result));
        return new ProcedureMetadata(procedureName, currentSubroutineIndex + 1, history, null);
    }

    public ProcedureMetadata withValidationLoop(ValidationLoopState validationLoop) {
        return new ProcedureMetadata(procedureName, currentSubroutineIndex, subroutineHistory, validationLoop);
    }

    /**
     * 현재 검증 반복 횟수.
     *
     * @return 검증 루프가 없으면 0
     */
    public int validationIteration() {
        return validationLoop == null ? 0 : validationLoop.iteration();
    }

    /**
     * 마지막으로 완료된 단계의 결과.
     *
     * @return 기록이 없으면 null
     */
    public String lastResult() {
        if (subroutineHistory.isEmpty()) {
            return null;
        }
        return subroutineHistory.get(subroutineHistory.size() - 1).result();
    }
}
