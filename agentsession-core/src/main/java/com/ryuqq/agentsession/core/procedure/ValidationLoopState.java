package com.ryuqq.agentsession.core.procedure;

import java.util.ArrayList;
import java.util.List;

/**
 * 검증 루프 진행 상태.
 *
 * <p><strong>루프 흐름:</strong></p>
 * <pre>
 * verifications 완료 ─► 결과 파싱 ─► pass ─────────────► 다음 단계
 *        ▲                    │
 *        │                    ├─► fail, iteration &lt; max ─► fixer 실행 (inFixerMode)
 *        │                    │                                 │
 *        └──── rerun ◄────────┼─────────────────────────────────┘
 *                             └─► fail, iteration == max ─► 소진, 다음 단계
 * </pre>
 *
 * @param iteration 완료된 검증 횟수
 * @param inFixerMode fixer 실행 중 여부
 * @param attempts 시도 기록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ValidationLoopState(
    int iteration,
    boolean inFixerMode,
    List<ValidationAttempt> attempts
) {

    public ValidationLoopState {
        if (iteration < 0) {
            throw new IllegalArgumentException("iteration cannot be negative (current: " + iteration + ")");
        }
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    /**
     * 초기 상태.
     *
     * @return iteration=0, fixer 모드 아님
     */
    public static ValidationLoopState initial() {
        return new ValidationLoopState(0, false, List.of());
    }

    /**
     * 시도 결과를 기록한 새 상태.
     *
     * @param pass 통과 여부
     * @param reason 사유
     * @param timestamp 시각
     * @return iteration이 1 증가한 새 상태
     */
    public ValidationLoopState recordAttempt(boolean pass, String reason, long timestamp) {
        int next = iteration + 1;
        List<ValidationAttempt> updated = new ArrayList<>(attempts);
        updated.add(new ValidationAttempt(next, pass, reason, timestamp));
        return new ValidationLoopState(next, inFixerMode, updated);
    }

    public ValidationLoopState withFixerMode(boolean inFixerMode) {
        return new ValidationLoopState(iteration, inFixerMode, attempts);
    }
}
