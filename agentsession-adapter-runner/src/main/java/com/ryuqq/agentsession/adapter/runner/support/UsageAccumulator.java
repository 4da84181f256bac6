package com.ryuqq.agentsession.adapter.runner.support;

import com.ryuqq.agentsession.core.message.Usage;

/**
 * turn 별 토큰 사용량 누적.
 *
 * <p>가장 최근에 보고된 input/output/cached 값을 유지하며, 누락/비유한 값은 0으로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class UsageAccumulator {

    private Usage current = Usage.ZERO;

    /**
     * 최신 사용량 반영.
     *
     * @param input 입력 토큰
     * @param output 출력 토큰
     * @param cached 캐시 토큰
     */
    public void update(Number input, Number output, Number cached) {
        current = Usage.of(input, output, cached);
    }

    public Usage current() {
        return current;
    }
}
