package com.ryuqq.agentsession.core.message;

/**
 * 종료 결과 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ResultSubtype {

    /**
     * 정상 완료.
     */
    SUCCESS("success"),

    /**
     * 실행 중 오류.
     */
    ERROR_DURING_EXECUTION("error_during_execution"),

    /**
     * turn 한도 초과.
     */
    ERROR_MAX_TURNS("error_max_turns");

    private final String wireValue;

    ResultSubtype(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 백엔드 프로토콜 표기값.
     *
     * @return 표기값 (예: "error_max_turns")
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 표기값으로부터 변환.
     *
     * <p>알 수 없는 값은 {@link #ERROR_DURING_EXECUTION}으로 취급합니다.</p>
     *
     * @param value 표기값 (null 가능)
     * @return ResultSubtype
     */
    public static ResultSubtype fromWire(String value) {
        for (ResultSubtype subtype : values()) {
            if (subtype.wireValue.equals(value)) {
                return subtype;
            }
        }
        return ERROR_DURING_EXECUTION;
    }
}
