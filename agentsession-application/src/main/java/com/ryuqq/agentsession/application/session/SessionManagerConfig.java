package com.ryuqq.agentsession.application.session;

/**
 * SessionManager 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxValidationIterations: 3</li>
 *   <li>cleanupAgeMs: 24시간</li>
 *   <li>maxResultLength: 4000자</li>
 * </ul>
 *
 * @param maxValidationIterations 검증 루프 최대 반복 횟수
 * @param cleanupAgeMs cleanup 기본 보존 시간 (밀리초)
 * @param maxResultLength 도구 결과 게시 최대 길이
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionManagerConfig(
    int maxValidationIterations,
    long cleanupAgeMs,
    int maxResultLength
) {

    public static final long ONE_DAY_MS = 24L * 60 * 60 * 1000;

    public SessionManagerConfig {
        if (maxValidationIterations <= 0) {
            throw new IllegalArgumentException(
                "maxValidationIterations must be positive (current: " + maxValidationIterations + ")");
        }
        if (cleanupAgeMs <= 0) {
            throw new IllegalArgumentException("cleanupAgeMs must be positive (current: " + cleanupAgeMs + ")");
        }
        if (maxResultLength <= 0) {
            throw new IllegalArgumentException("maxResultLength must be positive (current: " + maxResultLength + ")");
        }
    }

    public SessionManagerConfig() {
        this(3, ONE_DAY_MS, 4000);
    }

    public SessionManagerConfig withMaxValidationIterations(int maxValidationIterations) {
        return new SessionManagerConfig(maxValidationIterations, cleanupAgeMs, maxResultLength);
    }

    public SessionManagerConfig withCleanupAgeMs(long cleanupAgeMs) {
        return new SessionManagerConfig(maxValidationIterations, cleanupAgeMs, maxResultLength);
    }

    public SessionManagerConfig withMaxResultLength(int maxResultLength) {
        return new SessionManagerConfig(maxValidationIterations, cleanupAgeMs, maxResultLength);
    }
}
