package com.ryuqq.agentsession.core.activity;

import java.util.Optional;

/**
 * activity 게시 결과.
 *
 * @param activityId 생성된 activity ID (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActivityPostResult(String activityId) {

    public static final ActivityPostResult EMPTY = new ActivityPostResult(null);

    public Optional<String> id() {
        return Optional.ofNullable(activityId);
    }
}
