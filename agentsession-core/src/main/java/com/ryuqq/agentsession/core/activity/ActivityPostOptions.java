package com.ryuqq.agentsession.core.activity;

import java.util.Map;

/**
 * activity 게시 옵션.
 *
 * @param ephemeral 다음 activity로 대체되는 일시적 게시 여부
 * @param signal 신호 (예: "stop", "select", null 가능)
 * @param signalMetadata 신호 부가 정보
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActivityPostOptions(
    boolean ephemeral,
    String signal,
    Map<String, Object> signalMetadata
) {

    /**
     * 옵션 없음.
     */
    public static final ActivityPostOptions NONE = new ActivityPostOptions(false, null, Map.of());

    /**
     * 일시적 게시.
     */
    public static final ActivityPostOptions EPHEMERAL = new ActivityPostOptions(true, null, Map.of());

    public ActivityPostOptions {
        signalMetadata = signalMetadata == null ? Map.of() : Map.copyOf(signalMetadata);
    }
}
