package com.ryuqq.agentsession.adapter.runner.claude;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.agentsession.adapter.runner.support.AbstractEventTranslator;
import com.ryuqq.agentsession.adapter.runner.support.JsonFields;
import com.ryuqq.agentsession.adapter.runner.support.ToolProjection;
import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.message.ResultMessage;
import com.ryuqq.agentsession.core.message.ResultSubtype;
import com.ryuqq.agentsession.core.message.Usage;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Claude Code {@code stream-json} 출력 정규화.
 *
 * <p>Claude의 메시지 형태가 정규 메시지 모델과 가장 가깝기 때문에 대부분 필드를 그대로 옮깁니다.</p>
 *
 * <p><strong>이벤트 매핑:</strong></p>
 * <pre>
 * system(subtype=init)   → SystemInit(session_id, model, tools, permissionMode)
 * assistant              → text 블록은 AssistantText, tool_use 블록은 도구 호출
 * user                   → tool_result 블록은 도구 결과 (알 수 없는 호출의 결과는 버림)
 * result                 → Result 보류 (subtype, usage, duration, turns, cost)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ClaudeEventTranslator extends AbstractEventTranslator {

    private static final Logger log = LoggerFactory.getLogger(ClaudeEventTranslator.class);

    private final Map<String, String> toolNames = new HashMap<>();

    public ClaudeEventTranslator(RunnerConfig config) {
        super(BackendType.CLAUDE, config);
    }

    @Override
    protected void handleEvent(JsonNode event, List<CanonicalMessage> out) {
        String type = JsonFields.text(event, "type");
        if (type == null) {
            return;
        }
        switch (type) {
            case "system" -> {
                if ("init".equals(JsonFields.text(event, "subtype"))) {
                    confirmSession(JsonFields.text(event, "session_id"), JsonFields.text(event, "model"),
                        JsonFields.textArray(event, "tools"), JsonFields.text(event, "permissionMode"), out);
                }
            }
            case "assistant" -> handleAssistant(event, out);
            case "user" -> handleUser(event, out);
            case "result" -> handleResult(event);
            default -> log.debug("Ignoring claude event type: {}", type);
        }
    }

    private void handleAssistant(JsonNode event, List<CanonicalMessage> out) {
        String parentToolUseId = JsonFields.text(event, "parent_tool_use_id");
        String sdkError = JsonFields.text(event, "error");
        JsonNode message = JsonFields.object(event, "message");
        for (JsonNode block : JsonFields.array(message, "content")) {
            String blockType = JsonFields.text(block, "type");
            if ("text".equals(blockType)) {
                emitAssistantText(JsonFields.text(block, "text"), parentToolUseId, sdkError, out);
            } else if ("tool_use".equals(blockType)) {
                String id = JsonFields.text(block, "id");
                if (id == null) {
                    continue;
                }
                ToolProjection projection = new ToolProjection(id, JsonFields.text(block, "name"),
                    JsonFields.toMap(JsonFields.object(block, "input")), null, false);
                toolNames.put(id, toolNameOf(projection));
                emitToolUse(projection, parentToolUseId, out);
            }
        }
    }

    private void handleUser(JsonNode event, List<CanonicalMessage> out) {
        String parentToolUseId = JsonFields.text(event, "parent_tool_use_id");
        JsonNode message = JsonFields.object(event, "message");
        for (JsonNode block : JsonFields.array(message, "content")) {
            if (!"tool_result".equals(JsonFields.text(block, "type"))) {
                continue;
            }
            String toolUseId = JsonFields.text(block, "tool_use_id");
            if (toolUseId == null || !tools.hasToolUse(toolUseId)) {
                log.warn("Dropping claude tool result for unknown tool use: {}", toolUseId);
                continue;
            }
            ToolProjection projection = new ToolProjection(toolUseId, toolNames.get(toolUseId), Map.of(),
                toolResultContent(block.get("content")), JsonFields.bool(block, "is_error"));
            emitToolResult(projection, parentToolUseId, out);
        }
    }

    private void handleResult(JsonNode event) {
        ResultSubtype subtype = ResultSubtype.fromWire(JsonFields.text(event, "subtype"));
        if (subtype == ResultSubtype.SUCCESS && JsonFields.bool(event, "is_error")) {
            subtype = ResultSubtype.ERROR_DURING_EXECUTION;
        }

        JsonNode eventUsage = JsonFields.object(event, "usage");
        usage.update(
            JsonFields.number(eventUsage, "input_tokens"),
            JsonFields.number(eventUsage, "output_tokens"),
            JsonFields.number(eventUsage, "cache_read_input_tokens"));
        Usage current = usage.current();

        Number duration = JsonFields.number(event, "duration_ms");
        Number turns = JsonFields.number(event, "num_turns");
        Number cost = JsonFields.number(event, "total_cost_usd");
        List<String> errors = JsonFields.textArray(event, "errors");
        String resultText = JsonFields.text(event, "result");

        if (subtype != ResultSubtype.SUCCESS) {
            if (errors.isEmpty() && resultText != null) {
                errors = List.of(resultText);
            }
            errors.forEach(this::recordError);
        }

        holdResult(new ResultMessage(
            currentSessionId(),
            subtype,
            resultText,
            errors,
            current,
            duration != null ? duration.longValue() : elapsedMillis(),
            turns != null ? turns.intValue() : 0,
            cost != null ? cost.doubleValue() : 0.0));
    }

    private static String toolResultContent(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder builder = new StringBuilder();
            content.forEach(block -> {
                String text = JsonFields.text(block, "text");
                if (text != null) {
                    if (builder.length() > 0) {
                        builder.append('\n');
                    }
                    builder.append(text);
                }
            });
            return builder.toString();
        }
        return JsonFields.stringify(JsonFields.toValue(content));
    }
}
