package com.ryuqq.agentsession.adapter.runner.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.agentsession.adapter.runner.support.AbstractEventTranslator;
import com.ryuqq.agentsession.adapter.runner.support.JsonFields;
import com.ryuqq.agentsession.adapter.runner.support.ToolNameInference;
import com.ryuqq.agentsession.adapter.runner.support.ToolProjection;
import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.message.ResultMessage;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;

import java.util.List;
import java.util.Map;

/**
 * Gemini CLI {@code stream-json} 이벤트 정규화.
 *
 * <p><strong>이벤트 매핑:</strong></p>
 * <pre>
 * init                → SystemInit(session_id, model)
 * message(delta=true) → assistant 텍스트 누적 (다른 이벤트가 오면 flush)
 * message             → AssistantText (role=assistant)
 * tool_use            → 도구 호출 (tool_id, 정규화된 tool_name, parameters)
 * tool_result         → 도구 결과 ("Error: msg (code: c) [type]" / output / "Success")
 * result              → status=success면 성공, 아니면 오류 Result 보류 (stats → usage)
 * error               → 오류 기록 + 오류 Result 보류
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GeminiEventTranslator extends AbstractEventTranslator {

    private static final Map<String, String> TOOL_NAMES = Map.of(
        "read_file", "Read",
        "write_file", "Write",
        "replace", "Edit",
        "glob", "Glob",
        "search_file_content", "Grep",
        "list_directory", "LS",
        "web_fetch", "WebFetch",
        "google_web_search", "WebSearch",
        "write_todos", "TodoWrite"
    );

    private final StringBuilder deltaBuffer = new StringBuilder();

    public GeminiEventTranslator(RunnerConfig config) {
        super(BackendType.GEMINI, config);
    }

    /**
     * Gemini 도구 이름을 백엔드 독립 이름으로 변환.
     *
     * @param toolName Gemini 도구 이름
     * @param parameters 도구 입력 (셸 명령 추론용)
     * @return 정규 도구 이름, 매핑이 없으면 원래 이름
     */
    static String canonicalToolName(String toolName, Map<String, Object> parameters) {
        if (toolName == null) {
            return "Tool";
        }
        if ("run_shell_command".equals(toolName)) {
            Object command = parameters.get("command");
            return ToolNameInference.fromCommand(command instanceof String ? (String) command : null);
        }
        return TOOL_NAMES.getOrDefault(toolName, toolName);
    }

    @Override
    protected void handleEvent(JsonNode event, List<CanonicalMessage> out) {
        String type = JsonFields.text(event, "type");
        if (type == null) {
            return;
        }
        if ("message".equals(type) && JsonFields.bool(event, "delta")) {
            if ("assistant".equals(JsonFields.text(event, "role"))) {
                String content = event.path("content").asText("");
                deltaBuffer.append(content);
            }
            return;
        }
        flushDelta(out);

        switch (type) {
            case "init" -> confirmSession(JsonFields.text(event, "session_id"), JsonFields.text(event, "model"),
                List.of(), null, out);
            case "message" -> {
                if ("assistant".equals(JsonFields.text(event, "role"))) {
                    emitAssistantText(JsonFields.text(event, "content"), out);
                }
            }
            case "tool_use" -> handleToolUse(event, out);
            case "tool_result" -> handleToolResult(event, out);
            case "result" -> handleResult(event);
            case "error" -> {
                String message = JsonFields.text(event, "message");
                if (message == null) {
                    message = defaultFailureText();
                }
                recordError(message);
                holdResult(errorResult(message));
            }
            default -> ensureSystemInit(out);
        }
    }

    @Override
    protected void beforeFinish(List<CanonicalMessage> out) {
        flushDelta(out);
    }

    @Override
    protected String defaultSuccessText() {
        return "Session completed successfully";
    }

    private void flushDelta(List<CanonicalMessage> out) {
        if (deltaBuffer.length() == 0) {
            return;
        }
        String text = deltaBuffer.toString();
        deltaBuffer.setLength(0);
        emitAssistantText(text, out);
    }

    private void handleToolUse(JsonNode event, List<CanonicalMessage> out) {
        String toolId = JsonFields.text(event, "tool_id");
        if (toolId == null) {
            return;
        }
        Map<String, Object> parameters = JsonFields.toMap(JsonFields.object(event, "parameters"));
        String toolName = canonicalToolName(JsonFields.text(event, "tool_name"), parameters);
        emitToolUse(new ToolProjection(toolId, toolName, parameters, null, false), null, out);
    }

    private void handleToolResult(JsonNode event, List<CanonicalMessage> out) {
        String toolId = JsonFields.text(event, "tool_id");
        if (toolId == null) {
            return;
        }
        JsonNode error = JsonFields.object(event, "error");
        String content;
        boolean isError = false;
        if ("error".equals(JsonFields.text(event, "status")) && error != null) {
            StringBuilder builder = new StringBuilder("Error: ").append(error.path("message").asText(""));
            String code = error.hasNonNull("code") ? error.get("code").asText() : null;
            if (code != null && !code.isEmpty()) {
                builder.append(" (code: ").append(code).append(')');
            }
            String errorType = JsonFields.text(error, "type");
            if (errorType != null) {
                builder.append(" [").append(errorType).append(']');
            }
            content = builder.toString();
            isError = true;
        } else if (event.has("output") && !event.get("output").isNull()) {
            content = event.get("output").asText();
        } else {
            content = "Success";
        }

        // tool_use 없이 온 결과는 이름을 알 수 없으므로 "Tool"로 호출을 먼저 발행
        emitToolResult(new ToolProjection(toolId, "Tool", Map.of(), content, isError), null, out);
    }

    private void handleResult(JsonNode event) {
        JsonNode stats = JsonFields.object(event, "stats");
        usage.update(JsonFields.number(stats, "input_tokens"), JsonFields.number(stats, "output_tokens"), null);
        Number reportedDuration = JsonFields.number(stats, "duration_ms");
        long durationMs = reportedDuration != null ? reportedDuration.longValue() : elapsedMillis();
        if ("success".equals(JsonFields.text(event, "status"))) {
            holdResult(ResultMessage.success(currentSessionId(), successText(), usage.current(), durationMs));
            return;
        }
        String message = JsonFields.text(JsonFields.object(event, "error"), "message");
        String errorMessage = message != null ? message : "Unknown error";
        recordError(errorMessage);
        holdResult(ResultMessage.error(currentSessionId(), errorMessage, usage.current(), durationMs));
    }
}
