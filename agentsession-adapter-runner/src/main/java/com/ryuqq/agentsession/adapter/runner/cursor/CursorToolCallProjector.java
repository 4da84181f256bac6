package com.ryuqq.agentsession.adapter.runner.cursor;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.agentsession.adapter.runner.support.JsonFields;
import com.ryuqq.agentsession.adapter.runner.support.PathNormalizer;
import com.ryuqq.agentsession.adapter.runner.support.ToolNameInference;
import com.ryuqq.agentsession.adapter.runner.support.ToolProjection;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * cursor-agent {@code tool_call} 이벤트를 정규 도구 호출/결과로 투영.
 *
 * <p>{@code tool_call} 객체의 첫 번째 키가 도구 variant입니다
 * (예: {@code {"shellToolCall": {"args": {...}, "result": {...}}}}).</p>
 *
 * <p><strong>variant 매핑:</strong></p>
 * <ul>
 *   <li>shellToolCall → 명령에서 추론한 도구</li>
 *   <li>readToolCall, readLintsToolCall → Read</li>
 *   <li>grepToolCall → Grep, globToolCall → Glob</li>
 *   <li>editToolCall, deleteToolCall → Edit</li>
 *   <li>semSearchToolCall → ToolSearch</li>
 *   <li>mcpToolCall → {@code mcp__{provider}__{tool}}, listMcpResourcesToolCall → mcp__list_resources</li>
 *   <li>webFetchToolCall → WebFetch, updateTodosToolCall → TodoWrite</li>
 *   <li>그 외 → variant 이름에서 "ToolCall" 접미사 제거</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CursorToolCallProjector {

    private static final String DEFAULT_RESULT = "Tool completed";

    private final PathNormalizer paths;

    public CursorToolCallProjector(PathNormalizer paths) {
        if (paths == null) {
            throw new IllegalArgumentException("paths cannot be null");
        }
        this.paths = paths;
    }

    /**
     * tool_call 이벤트 투영.
     *
     * @param event tool_call 이벤트
     * @return call_id와 variant가 있으면 투영 결과
     */
    public Optional<ToolProjection> project(JsonNode event) {
        String toolUseId = JsonFields.text(event, "call_id");
        JsonNode toolCall = JsonFields.object(event, "tool_call");
        if (toolUseId == null || toolCall == null) {
            return Optional.empty();
        }
        Iterator<String> names = toolCall.fieldNames();
        if (!names.hasNext()) {
            return Optional.empty();
        }
        String variant = names.next();
        JsonNode payload = JsonFields.object(toolCall, variant);
        if (payload == null) {
            return Optional.empty();
        }
        JsonNode args = JsonFields.object(payload, "args");

        String toolName;
        Map<String, Object> input = new LinkedHashMap<>();
        String resultText = DEFAULT_RESULT;

        switch (variant) {
            case "shellToolCall" -> {
                String command = orEmpty(JsonFields.text(args, "command"));
                toolName = ToolNameInference.fromCommand(command);
                input.put("command", command);
                input.put("description", command);
            }
            case "readToolCall" -> {
                toolName = "Read";
                input.put("path", pathArg(args, "path"));
                input.put("limit", args != null ? JsonFields.toValue(args.get("limit")) : null);
            }
            case "grepToolCall" -> {
                toolName = "Grep";
                input.put("pattern", orEmpty(JsonFields.text(args, "pattern")));
                input.put("path", pathArg(args, "path"));
            }
            case "globToolCall" -> {
                toolName = "Glob";
                input.put("glob", orEmpty(JsonFields.text(args, "globPattern")));
                input.put("path", pathArg(args, "targetDirectory"));
            }
            case "editToolCall" -> {
                toolName = "Edit";
                input.put("path", pathArg(args, "path"));
            }
            case "deleteToolCall" -> {
                toolName = "Edit";
                input.put("description", "delete " + pathArg(args, "path"));
            }
            case "semSearchToolCall" -> {
                toolName = "ToolSearch";
                input.put("query", orEmpty(JsonFields.text(args, "query")));
            }
            case "readLintsToolCall" -> {
                toolName = "Read";
                input.put("paths", args != null ? JsonFields.toValue(args.get("paths")) : null);
            }
            case "mcpToolCall" -> {
                String provider = JsonFields.text(args, "providerIdentifier");
                String tool = JsonFields.text(args, "toolName", "name");
                toolName = "mcp__" + (provider != null ? provider : "mcp") + "__" + (tool != null ? tool : "tool");
                input.putAll(JsonFields.toMap(JsonFields.object(args, "args")));
            }
            case "listMcpResourcesToolCall" -> toolName = "mcp__list_resources";
            case "webFetchToolCall" -> {
                toolName = "WebFetch";
                input.put("url", orEmpty(JsonFields.text(args, "url")));
            }
            case "updateTodosToolCall" -> {
                toolName = "TodoWrite";
                input.put("todos", args != null ? JsonFields.toValue(args.get("todos")) : null);
                resultText = summarizeTodos(JsonFields.array(args, "todos"));
            }
            default -> {
                toolName = variant.replaceAll("ToolCall$", "");
                input.putAll(JsonFields.toMap(args));
            }
        }

        ExtractedResult extracted = extractResult(payload);
        if (DEFAULT_RESULT.equals(resultText) || extracted.isError()) {
            resultText = extracted.text();
        }
        return Optional.of(new ToolProjection(toolUseId, toolName, input, resultText, extracted.isError()));
    }

    /**
     * 체크리스트 요약 ("- [x] text" / "- [ ] text").
     *
     * @param todos todo 항목
     * @return 요약, 비어 있으면 "No todos"
     */
    static String summarizeTodos(List<JsonNode> todos) {
        if (todos.isEmpty()) {
            return "No todos";
        }
        return todos.stream()
            .map(CursorToolCallProjector::summarizeTodo)
            .collect(Collectors.joining("\n"));
    }

    private static String summarizeTodo(JsonNode todo) {
        if (todo == null || !todo.isObject()) {
            return "- [ ] task";
        }
        String text = JsonFields.text(todo, "content", "description");
        String status = JsonFields.text(todo, "status");
        status = status != null ? status.toLowerCase(Locale.ROOT) : "pending";
        boolean completed = "completed".equals(status) || "todo_status_completed".equals(status);
        boolean inProgress = "in_progress".equals(status) || "todo_status_in_progress".equals(status);
        return "- " + (completed ? "[x]" : "[ ]") + " " + (text != null ? text : "task")
            + (inProgress ? " (in progress)" : "");
    }

    private ExtractedResult extractResult(JsonNode payload) {
        JsonNode result = JsonFields.object(payload, "result");
        if (result == null) {
            return new ExtractedResult(DEFAULT_RESULT, false);
        }
        JsonNode success = JsonFields.object(result, "success");
        if (success != null) {
            String text = JsonFields.text(success, "interleavedOutput", "stdout", "markdown", "text");
            return new ExtractedResult(text != null ? text : JsonFields.stringify(JsonFields.toValue(success)), false);
        }
        JsonNode failure = JsonFields.object(result, "failure");
        if (failure != null) {
            String text = JsonFields.text(failure, "message", "stderr");
            return new ExtractedResult(text != null ? text : JsonFields.stringify(JsonFields.toValue(failure)), true);
        }
        return new ExtractedResult(JsonFields.stringify(JsonFields.toValue(result)), false);
    }

    private String pathArg(JsonNode args, String field) {
        return paths.normalize(orEmpty(JsonFields.text(args, field)));
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private record ExtractedResult(String text, boolean isError) {
    }
}
