package com.ryuqq.agentsession.core.session;

/**
 * 외부 진행 게시 여부.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TrackingMode {

    /**
     * ActivitySink로 진행 상황을 게시.
     */
    TRACKED,

    /**
     * 모든 ActivitySink 호출 생략.
     */
    UNTRACKED
}
