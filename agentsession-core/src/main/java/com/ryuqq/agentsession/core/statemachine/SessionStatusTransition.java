package com.ryuqq.agentsession.core.statemachine;

/**
 * Session 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → RUNNING (runner 부착)</li>
 *   <li>RUNNING → COMPLETED / ERROR / STOPPED (종료 Result)</li>
 *   <li>COMPLETED / ERROR / STOPPED → IDLE (다음 이벤트)</li>
 *   <li>COMPLETED / ERROR / STOPPED → RUNNING (다음 이벤트에서 바로 재부착)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>RUNNING 상태에서 다시 RUNNING으로 전이 불가 (세션당 실행 중 runner는 최대 1개)</li>
 *   <li>IDLE에서 종료 상태로 직접 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionStatusTransition {

    // Utility class - prevent instantiation
    private SessionStatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SessionStatus from, SessionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case IDLE -> to == SessionStatus.RUNNING;
            case RUNNING -> to.isTerminal();
            case COMPLETED, ERROR, STOPPED -> to == SessionStatus.IDLE || to == SessionStatus.RUNNING;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid session transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static SessionStatus transition(SessionStatus current, SessionStatus next) {
        validate(current, next);
        return next;
    }
}
