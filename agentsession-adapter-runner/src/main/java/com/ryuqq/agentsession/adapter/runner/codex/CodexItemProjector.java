package com.ryuqq.agentsession.adapter.runner.codex;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.agentsession.adapter.runner.support.JsonFields;
import com.ryuqq.agentsession.adapter.runner.support.PathNormalizer;
import com.ryuqq.agentsession.adapter.runner.support.ToolNameInference;
import com.ryuqq.agentsession.adapter.runner.support.ToolProjection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Codex 스레드 item을 정규 도구 호출/결과로 투영.
 *
 * <p><strong>지원 item 타입:</strong></p>
 * <ul>
 *   <li>command_execution → 명령에서 추론한 도구 (Grep, Glob, Read, Write, Bash)</li>
 *   <li>file_change → Edit</li>
 *   <li>web_search → WebFetch (open_page) 또는 WebSearch</li>
 *   <li>mcp_tool_call → {@code mcp__{server}__{tool}}</li>
 *   <li>todo_list → TodoWrite</li>
 * </ul>
 *
 * <p>그 외 타입(agent_message, reasoning 등)은 도구가 아니므로 empty를 반환합니다.
 * Cursor의 item 이벤트도 같은 형태이므로 함께 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CodexItemProjector {

    private final PathNormalizer paths;

    public CodexItemProjector(PathNormalizer paths) {
        if (paths == null) {
            throw new IllegalArgumentException("paths cannot be null");
        }
        this.paths = paths;
    }

    /**
     * item 투영.
     *
     * @param item item 객체
     * @return 도구 item이면 투영 결과
     */
    public Optional<ToolProjection> project(JsonNode item) {
        if (item == null) {
            return Optional.empty();
        }
        String id = JsonFields.text(item, "id");
        String type = JsonFields.text(item, "type");
        if (id == null || type == null) {
            return Optional.empty();
        }
        return switch (type) {
            case "command_execution" -> Optional.of(commandExecution(id, item));
            case "file_change" -> Optional.of(fileChange(id, item));
            case "web_search" -> Optional.of(webSearch(id, item));
            case "mcp_tool_call" -> Optional.of(mcpToolCall(id, item));
            case "todo_list" -> Optional.of(todoList(id, item));
            default -> Optional.empty();
        };
    }

    /**
     * MCP 식별자 정규화: 소문자, 허용 외 문자는 '_', 양끝 '_' 제거.
     *
     * @param value 원본 식별자
     * @return 정규화된 식별자, 비면 "unknown"
     */
    public static String normalizeMcpIdentifier(String value) {
        if (value == null) {
            return "unknown";
        }
        String normalized = value.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9_]+", "_")
            .replaceAll("^_+|_+$", "");
        return normalized.isEmpty() ? "unknown" : normalized;
    }

    private ToolProjection commandExecution(String id, JsonNode item) {
        String command = JsonFields.text(item, "command");
        Number exitCode = JsonFields.number(item, "exit_code");
        boolean isError = "failed".equals(JsonFields.text(item, "status"))
            || (exitCode != null && exitCode.intValue() != 0);

        String output = JsonFields.text(item, "aggregated_output");
        String result;
        if (output != null && !output.trim().isEmpty()) {
            result = output.trim();
        } else if (isError) {
            result = "Command failed (exit code " + (exitCode != null ? exitCode.intValue() : "unknown") + ")";
        } else {
            result = "Command completed with no output";
        }

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("command", command);
        return new ToolProjection(id, ToolNameInference.fromCommand(command), input, result, isError);
    }

    private ToolProjection fileChange(String id, JsonNode item) {
        List<JsonNode> changes = JsonFields.array(item, "changes");
        boolean failed = "failed".equals(JsonFields.text(item, "status"));

        Map<String, Object> input = new LinkedHashMap<>();
        List<Map<String, Object>> projected = new ArrayList<>();
        List<String> summary = new ArrayList<>();
        for (JsonNode change : changes) {
            String kind = JsonFields.text(change, "kind");
            String path = paths.normalize(JsonFields.text(change, "path"));
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", kind);
            entry.put("path", path);
            projected.add(entry);
            summary.add(kind + " " + path);
        }
        if (!projected.isEmpty() && projected.get(0).get("path") != null) {
            input.put("file_path", projected.get(0).get("path"));
        }
        input.put("changes", projected);

        String result;
        if (summary.isEmpty()) {
            result = failed ? "Patch failed" : "No file changes";
        } else {
            result = String.join("\n", summary);
        }
        return new ToolProjection(id, "Edit", input, result, failed);
    }

    private ToolProjection webSearch(String id, JsonNode item) {
        String query = JsonFields.text(item, "query");
        JsonNode action = JsonFields.object(item, "action");
        boolean isFetch = "open_page".equals(JsonFields.text(action, "type"));

        Map<String, Object> input = new LinkedHashMap<>();
        if (isFetch) {
            String url = firstNonNull(JsonFields.text(action, "url"), JsonFields.text(item, "url"));
            String pattern = firstNonNull(JsonFields.text(action, "pattern"), JsonFields.text(item, "pattern"));
            input.put("url", url != null ? url : query);
            if (pattern != null) {
                input.put("pattern", pattern);
            }
        } else {
            input.put("query", query);
        }

        String result = action != null && action.size() > 0
            ? JsonFields.stringify(JsonFields.toValue(action))
            : "Search completed for query: " + query;
        return new ToolProjection(id, isFetch ? "WebFetch" : "WebSearch", input, result, false);
    }

    private ToolProjection mcpToolCall(String id, JsonNode item) {
        String toolName = "mcp__" + normalizeMcpIdentifier(JsonFields.text(item, "server"))
            + "__" + normalizeMcpIdentifier(JsonFields.text(item, "tool"));

        JsonNode arguments = item.get("arguments");
        Map<String, Object> input;
        if (arguments != null && arguments.isObject()) {
            input = JsonFields.toMap(arguments);
        } else {
            input = new LinkedHashMap<>();
            input.put("arguments", arguments != null ? JsonFields.toValue(arguments) : null);
        }

        JsonNode error = JsonFields.object(item, "error");
        boolean failed = "failed".equals(JsonFields.text(item, "status")) || error != null;
        return new ToolProjection(id, toolName, input, mcpResult(item, error, failed), failed);
    }

    private String mcpResult(JsonNode item, JsonNode error, boolean failed) {
        String errorMessage = JsonFields.text(error, "message");
        if (errorMessage != null) {
            return errorMessage;
        }
        JsonNode result = JsonFields.object(item, "result");
        String text = JsonFields.array(result, "content").stream()
            .map(block -> JsonFields.text(block, "text"))
            .filter(value -> value != null && !value.trim().isEmpty())
            .collect(Collectors.joining("\n"));
        if (!text.isEmpty()) {
            return text;
        }
        if (result != null && result.has("structured_content")) {
            return JsonFields.stringify(JsonFields.toValue(result.get("structured_content")));
        }
        return failed ? "MCP tool call failed" : "MCP tool call completed";
    }

    private ToolProjection todoList(String id, JsonNode item) {
        List<JsonNode> items = JsonFields.array(item, "items");
        List<Map<String, Object>> todos = new ArrayList<>();
        for (JsonNode todo : items) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("content", JsonFields.text(todo, "text"));
            entry.put("status", JsonFields.bool(todo, "completed") ? "completed" : "pending");
            todos.add(entry);
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("todos", todos);
        return new ToolProjection(id, "TodoWrite", input, "Updated todo list (" + items.size() + " items)", false);
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
