package com.ryuqq.agentsession.adapter.runner.support;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * correlation id 별 도구 호출/결과 발행 여부 추적.
 *
 * <p>같은 활동이 "started"와 "completed"로 두 번 보고되어도 도구 호출은 최초 1회,
 * 결과는 종료 시점 1회만 발행되도록 보장합니다. 한 번 결과가 발행된 id는 다시 결과를 발행하지 않습니다.</p>
 *
 * <p>스레드 안전하지 않습니다. runner의 stdout 처리 스레드에서만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ToolCallTracker {

    private final Set<String> emittedToolUses = new LinkedHashSet<>();
    private final Set<String> emittedResults = new LinkedHashSet<>();

    /**
     * 도구 호출 발행 표시.
     *
     * @param toolUseId correlation id
     * @return 최초 발행이면 true
     */
    public boolean markToolUse(String toolUseId) {
        return emittedToolUses.add(toolUseId);
    }

    /**
     * 결과 발행 표시.
     *
     * @param toolUseId correlation id
     * @return 최초 발행이면 true
     */
    public boolean markResult(String toolUseId) {
        return emittedResults.add(toolUseId);
    }

    public boolean hasToolUse(String toolUseId) {
        return emittedToolUses.contains(toolUseId);
    }

    public boolean hasResult(String toolUseId) {
        return emittedResults.contains(toolUseId);
    }

    /**
     * 결과가 아직 발행되지 않은 도구 호출 수.
     *
     * @return 진행 중인 호출 수
     */
    public int openToolUses() {
        int open = 0;
        for (String id : emittedToolUses) {
            if (!emittedResults.contains(id)) {
                open++;
            }
        }
        return open;
    }
}
