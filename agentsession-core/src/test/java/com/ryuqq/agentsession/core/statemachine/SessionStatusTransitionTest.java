package com.ryuqq.agentsession.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.agentsession.core.statemachine.SessionStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionStatusTransition 테스트.
 *
 * <ul>
 *   <li>IDLE → RUNNING → 종료 상태 → IDLE 순환</li>
 *   <li>RUNNING → RUNNING 불가 (세션당 실행 중 runner 1개)</li>
 *   <li>IDLE → 종료 상태 직접 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SessionStatusTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_FullCycle_Succeeds() {
        // Given
        SessionStatus status = IDLE;

        // When
        status = SessionStatusTransition.transition(status, RUNNING);
        status = SessionStatusTransition.transition(status, COMPLETED);
        status = SessionStatusTransition.transition(status, IDLE);

        // Then
        assertEquals(IDLE, status);
    }

    @Test
    void validate_RunningToEachTerminal_Succeeds() {
        assertDoesNotThrow(() -> SessionStatusTransition.validate(RUNNING, COMPLETED));
        assertDoesNotThrow(() -> SessionStatusTransition.validate(RUNNING, ERROR));
        assertDoesNotThrow(() -> SessionStatusTransition.validate(RUNNING, STOPPED));
    }

    @Test
    void validate_TerminalToRunning_Succeeds() {
        // 다음 이벤트에서 바로 재부착
        assertDoesNotThrow(() -> SessionStatusTransition.validate(STOPPED, RUNNING));
        assertDoesNotThrow(() -> SessionStatusTransition.validate(ERROR, RUNNING));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_RunningToRunning_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> SessionStatusTransition.validate(RUNNING, RUNNING)
        );
        assertTrue(exception.getMessage().contains("RUNNING → RUNNING"));
    }

    @Test
    void validate_IdleToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> SessionStatusTransition.validate(IDLE, COMPLETED));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> SessionStatusTransition.validate(null, RUNNING));
        assertThrows(IllegalArgumentException.class, () -> SessionStatusTransition.validate(IDLE, null));
    }

    // ========== 영속화 표기 ==========

    @Test
    void fromPersisted_LegacyValues_MapToRestorableStatus() {
        assertEquals(COMPLETED, SessionStatus.fromPersisted("complete"));
        assertEquals(ERROR, SessionStatus.fromPersisted("error"));
        assertEquals(IDLE, SessionStatus.fromPersisted("active"));
        assertEquals(IDLE, SessionStatus.fromPersisted("running"));
        assertEquals(IDLE, SessionStatus.fromPersisted(null));
        assertEquals(STOPPED, SessionStatus.fromPersisted("STOPPED"));
    }
}
