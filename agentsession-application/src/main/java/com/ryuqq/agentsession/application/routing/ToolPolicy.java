package com.ryuqq.agentsession.application.routing;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 도구 허용 목록 preset.
 *
 * <ul>
 *   <li>{@code readOnly}: 읽기/조회 도구만</li>
 *   <li>{@code safe}: Bash를 제외한 모든 도구 (저장소 설정이 없을 때 기본값)</li>
 *   <li>{@code all}: 모든 도구</li>
 *   <li>{@code coordinator}: 파일 편집 도구를 제외한 조정용 도구</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ToolPolicy {

    public static final List<String> ALL = List.of(
        "Read(**)", "Edit(**)", "Bash", "Task", "WebFetch", "WebSearch", "TodoRead", "TodoWrite",
        "NotebookRead", "NotebookEdit", "Batch", "Skill", "AskUserQuestion");

    public static final List<String> READ_ONLY = List.of(
        "Read(**)", "WebFetch", "WebSearch", "TodoRead", "TodoWrite", "NotebookRead", "Task", "Batch", "Skill");

    public static final List<String> SAFE = List.of(
        "Read(**)", "Edit(**)", "Task", "WebFetch", "WebSearch", "TodoRead", "TodoWrite",
        "NotebookRead", "NotebookEdit", "Batch", "Skill", "AskUserQuestion");

    public static final List<String> COORDINATOR = List.of(
        "Read(**)", "Bash", "Task", "WebFetch", "WebSearch", "TodoRead", "TodoWrite", "NotebookRead",
        "Batch", "Skill");

    private ToolPolicy() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * preset 이름을 펼치고 중복 제거 (순서 유지).
     *
     * @param tools 도구 이름 또는 preset 이름 목록
     * @return 펼쳐진 도구 목록
     */
    public static List<String> resolve(List<String> tools) {
        if (tools == null) {
            return List.of();
        }
        Set<String> resolved = new LinkedHashSet<>();
        for (String tool : tools) {
            resolved.addAll(preset(tool));
        }
        return List.copyOf(resolved);
    }

    private static List<String> preset(String name) {
        switch (name) {
            case "readOnly":
                return READ_ONLY;
            case "safe":
                return SAFE;
            case "all":
                return ALL;
            case "coordinator":
                return COORDINATOR;
            default:
                return List.of(name);
        }
    }
}
