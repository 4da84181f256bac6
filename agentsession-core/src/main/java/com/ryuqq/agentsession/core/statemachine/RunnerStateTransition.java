package com.ryuqq.agentsession.core.statemachine;

import com.ryuqq.agentsession.core.runner.RunnerState;

/**
 * RunnerAdapter 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → STARTING, IDLE → STOPPED</li>
 *   <li>STARTING → RUNNING / FAILED / STOPPED</li>
 *   <li>RUNNING → COMPLETED / FAILED / STOPPED</li>
 * </ul>
 *
 * <p>종료 상태(COMPLETED, FAILED, STOPPED)에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunnerStateTransition {

    // Utility class - prevent instantiation
    private RunnerStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이가 허용되는지 확인 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean canTransition(RunnerState from, RunnerState to) {
        if (from == null || to == null || from.isTerminal()) {
            return false;
        }
        return switch (from) {
            case IDLE -> to == RunnerState.STARTING || to == RunnerState.STOPPED;
            case STARTING -> to == RunnerState.RUNNING || to == RunnerState.FAILED || to == RunnerState.STOPPED;
            case RUNNING -> to.isTerminal();
            case STOPPED, COMPLETED, FAILED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunnerState from, RunnerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (!canTransition(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static RunnerState transition(RunnerState current, RunnerState next) {
        validate(current, next);
        return next;
    }
}
