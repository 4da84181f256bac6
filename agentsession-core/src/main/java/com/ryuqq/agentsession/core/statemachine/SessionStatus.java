package com.ryuqq.agentsession.core.statemachine;

import java.util.Locale;

/**
 * Session 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 *          attach                terminal Result
 * IDLE ───────────► RUNNING ───────────────────► COMPLETED / ERROR / STOPPED
 *  ▲                                                     │
 *  └─────────────────────── next event ──────────────────┘
 * </pre>
 *
 * <p>{@link #isTerminal()}은 "현재 실행이 끝났음"을 의미하며, Operation과 달리
 * 다음 이벤트가 오면 IDLE로 되돌아갈 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SessionStatus {

    /**
     * 실행 대기.
     */
    IDLE("idle"),

    /**
     * Runner가 부착되어 실행 중.
     */
    RUNNING("running"),

    /**
     * 성공 Result로 종료.
     */
    COMPLETED("complete"),

    /**
     * 오류 Result로 종료.
     */
    ERROR("error"),

    /**
     * 중단 요청 후 종료.
     */
    STOPPED("stopped");

    private final String persistedValue;

    SessionStatus(String persistedValue) {
        this.persistedValue = persistedValue;
    }

    /**
     * 실행이 끝난 상태인지 확인.
     *
     * @return COMPLETED, ERROR, STOPPED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == STOPPED;
    }

    /**
     * 스냅샷 표기값.
     *
     * @return 표기값 (예: "complete")
     */
    public String persistedValue() {
        return persistedValue;
    }

    /**
     * 스냅샷 표기값으로부터 변환.
     *
     * <p>이전 버전 스냅샷의 "active", "pending", "awaiting-input" 등은 IDLE로,
     * 알 수 없는 값도 IDLE로 취급합니다. 복원 시점에는 runner가 없기 때문입니다.</p>
     *
     * @param value 표기값 (null 가능)
     * @return SessionStatus
     */
    public static SessionStatus fromPersisted(String value) {
        if (value == null) {
            return IDLE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SessionStatus status : values()) {
            if (status.persistedValue.equals(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status == RUNNING ? IDLE : status;
            }
        }
        if ("completed".equals(normalized)) {
            return COMPLETED;
        }
        return IDLE;
    }
}
