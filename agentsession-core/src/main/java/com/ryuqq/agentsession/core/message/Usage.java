package com.ryuqq.agentsession.core.message;

/**
 * 토큰 사용량.
 *
 * <p>누락되었거나 유한하지 않은 값은 0으로 강제 변환됩니다.</p>
 *
 * @param inputTokens 입력 토큰 수
 * @param outputTokens 출력 토큰 수
 * @param cacheReadInputTokens 캐시 적중 입력 토큰 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Usage(
    long inputTokens,
    long outputTokens,
    long cacheReadInputTokens
) {

    /**
     * 사용량 없음.
     */
    public static final Usage ZERO = new Usage(0, 0, 0);

    public Usage {
        inputTokens = Math.max(0, inputTokens);
        outputTokens = Math.max(0, outputTokens);
        cacheReadInputTokens = Math.max(0, cacheReadInputTokens);
    }

    /**
     * 느슨한 타입의 값으로부터 Usage 생성.
     *
     * @param input 입력 토큰 (null, NaN, Infinity 허용)
     * @param output 출력 토큰
     * @param cached 캐시 토큰
     * @return Usage 인스턴스
     */
    public static Usage of(Number input, Number output, Number cached) {
        return new Usage(safeTokens(input), safeTokens(output), safeTokens(cached));
    }

    /**
     * 숫자 값을 안전한 토큰 수로 변환.
     *
     * @param value 원본 값
     * @return 유한한 값이면 long 변환값, 아니면 0
     */
    public static long safeTokens(Number value) {
        if (value == null) {
            return 0;
        }
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return 0;
        }
        return (long) d;
    }

    /**
     * 전체 토큰 수.
     *
     * @return input + output
     */
    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
