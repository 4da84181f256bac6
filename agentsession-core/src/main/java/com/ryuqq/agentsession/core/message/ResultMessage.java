package com.ryuqq.agentsession.core.message;

import java.util.List;

/**
 * 종료 결과 메시지.
 *
 * <p>모든 메시지 시퀀스는 정확히 하나의 ResultMessage로 끝납니다.
 * 실패한 실행(ExecutionError)은 예외가 아니라 {@code isError() == true}인 ResultMessage로 표현됩니다.</p>
 *
 * <p><strong>오류 텍스트 우선순위:</strong></p>
 * <ol>
 *   <li>{@code result} 텍스트</li>
 *   <li>{@code errors} 목록 (줄바꿈으로 결합)</li>
 * </ol>
 *
 * @param sessionId 세션 ID
 * @param subtype 결과 유형
 * @param result 결과 텍스트 (null 가능)
 * @param errors 오류 메시지 목록
 * @param usage 누적 토큰 사용량
 * @param durationMs 실행 시간 (밀리초)
 * @param numTurns turn 수
 * @param totalCostUsd 비용 (USD)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResultMessage(
    String sessionId,
    ResultSubtype subtype,
    String result,
    List<String> errors,
    Usage usage,
    long durationMs,
    int numTurns,
    double totalCostUsd
) implements CanonicalMessage {

    public ResultMessage {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (subtype == null) {
            throw new IllegalArgumentException("subtype cannot be null");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
        usage = usage == null ? Usage.ZERO : usage;
    }

    /**
     * 성공 결과 생성.
     *
     * @param sessionId 세션 ID
     * @param result 결과 텍스트
     * @param usage 사용량
     * @param durationMs 실행 시간
     * @return 성공 ResultMessage
     */
    public static ResultMessage success(String sessionId, String result, Usage usage, long durationMs) {
        return new ResultMessage(sessionId, ResultSubtype.SUCCESS, result, List.of(), usage, durationMs, 1, 0.0);
    }

    /**
     * 실행 오류 결과 생성.
     *
     * @param sessionId 세션 ID
     * @param errorMessage 오류 메시지 (원문 그대로 보존)
     * @param usage 사용량
     * @param durationMs 실행 시간
     * @return 오류 ResultMessage
     */
    public static ResultMessage error(String sessionId, String errorMessage, Usage usage, long durationMs) {
        return error(sessionId, ResultSubtype.ERROR_DURING_EXECUTION, errorMessage, usage, durationMs);
    }

    /**
     * 유형을 지정한 오류 결과 생성.
     *
     * @param sessionId 세션 ID
     * @param subtype 오류 유형 (SUCCESS 불가)
     * @param errorMessage 오류 메시지
     * @param usage 사용량
     * @param durationMs 실행 시간
     * @return 오류 ResultMessage
     * @throws IllegalArgumentException subtype이 SUCCESS인 경우
     */
    public static ResultMessage error(String sessionId, ResultSubtype subtype, String errorMessage,
                                      Usage usage, long durationMs) {
        if (subtype == ResultSubtype.SUCCESS) {
            throw new IllegalArgumentException("error result cannot have SUCCESS subtype");
        }
        List<String> errors = errorMessage == null ? List.of() : List.of(errorMessage);
        return new ResultMessage(sessionId, subtype, null, errors, usage, durationMs, 1, 0.0);
    }

    /**
     * 오류 결과인지 확인.
     *
     * @return SUCCESS가 아니면 true
     */
    public boolean isError() {
        return subtype != ResultSubtype.SUCCESS;
    }

    /**
     * 게시용 본문 텍스트.
     *
     * <p>result 텍스트가 있으면 그대로, 없고 오류인 경우 errors를 줄바꿈으로 결합합니다.</p>
     *
     * @return 본문 (없으면 빈 문자열)
     */
    public String displayText() {
        if (result != null) {
            return result;
        }
        if (isError() && !errors.isEmpty()) {
            return String.join("\n", errors);
        }
        return "";
    }

    /**
     * 세션 ID만 변경한 새 인스턴스 생성.
     *
     * @param sessionId 새 세션 ID
     * @return 새 ResultMessage
     */
    public ResultMessage withSessionId(String sessionId) {
        return new ResultMessage(sessionId, subtype, result, errors, usage, durationMs, numTurns, totalCostUsd);
    }
}
