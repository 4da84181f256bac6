package com.ryuqq.agentsession.adapter.runner.cursor;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.agentsession.adapter.runner.codex.CodexItemProjector;
import com.ryuqq.agentsession.adapter.runner.support.AbstractEventTranslator;
import com.ryuqq.agentsession.adapter.runner.support.JsonFields;
import com.ryuqq.agentsession.adapter.runner.support.ToolProjection;
import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.message.ResultSubtype;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * cursor-agent {@code stream-json} 이벤트 정규화.
 *
 * <p><strong>이벤트 매핑:</strong></p>
 * <pre>
 * init, system/init           → SystemInit(session_id)
 * message(role=assistant)     → AssistantText
 * assistant(message.content)  → AssistantText (text 블록 연결)
 * item.started/item.completed → Codex item과 동일한 도구 투영
 * tool_call(started)          → 도구 호출
 * tool_call(completed|failed) → 도구 결과
 * turn.completed, result      → usage 갱신, stop_reason에 "max" 포함 시 턴 제한 오류
 * error                       → 오류 기록 + 오류 Result 보류
 * </pre>
 *
 * <p>JSON이 아닌 출력 줄은 모아 두었다가 assistant 텍스트가 없을 때 성공 Result 본문으로 사용합니다.
 * 독립 error 이벤트만 있어도 실행은 실패로 처리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CursorEventTranslator extends AbstractEventTranslator {

    private final CodexItemProjector itemProjector;
    private final CursorToolCallProjector toolCallProjector;
    private final List<String> fallbackOutputLines = new ArrayList<>();

    public CursorEventTranslator(RunnerConfig config) {
        super(BackendType.CURSOR, config);
        this.itemProjector = new CodexItemProjector(paths);
        this.toolCallProjector = new CursorToolCallProjector(paths);
    }

    @Override
    protected void handleEvent(JsonNode event, List<CanonicalMessage> out) {
        String type = JsonFields.text(event, "type");
        if (type == null) {
            return;
        }
        if ("init".equals(type) || ("system".equals(type) && "init".equals(JsonFields.text(event, "subtype")))) {
            confirmSession(JsonFields.text(event, "session_id"), JsonFields.text(event, "model"), List.of(), null, out);
            return;
        }
        switch (type) {
            case "message" -> {
                if ("assistant".equals(JsonFields.text(event, "role"))) {
                    emitAssistantText(JsonFields.text(event, "content"), out);
                } else {
                    ensureSystemInit(out);
                }
            }
            case "assistant" -> emitAssistantText(messageText(JsonFields.object(event, "message")), out);
            case "item.started" -> itemProjector.project(JsonFields.object(event, "item"))
                .ifPresent(projection -> emitToolUse(projection, null, out));
            case "item.completed" -> itemProjector.project(JsonFields.object(event, "item"))
                .ifPresent(projection -> emitToolResult(projection, null, out));
            case "tool_call" -> handleToolCall(event, out);
            case "turn.completed", "result" -> handleTurnCompleted(event);
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
    protected void handleNonJson(String line, List<CanonicalMessage> out) {
        String trimmed = line.trim();
        if (!trimmed.isEmpty()) {
            fallbackOutputLines.add(trimmed);
        }
    }

    @Override
    protected boolean failsOnErrorEvents() {
        return true;
    }

    @Override
    protected String defaultSuccessText() {
        String fallback = String.join("\n", fallbackOutputLines).trim();
        return fallback.isEmpty() ? super.defaultSuccessText() : fallback;
    }

    private void handleToolCall(JsonNode event, List<CanonicalMessage> out) {
        ToolProjection projection = toolCallProjector.project(event).orElse(null);
        if (projection == null) {
            ensureSystemInit(out);
            return;
        }
        String subtype = JsonFields.text(event, "subtype");
        if (subtype == null || "started".equals(subtype)) {
            emitToolUse(projection, null, out);
        } else if ("completed".equals(subtype) || "failed".equals(subtype)) {
            emitToolResult(projection.withError(projection.isError() || "failed".equals(subtype)), null, out);
        }
    }

    private void handleTurnCompleted(JsonNode event) {
        JsonNode eventUsage = JsonFields.object(event, "usage");
        if (eventUsage != null) {
            usage.update(
                JsonFields.number(eventUsage, "input_tokens"),
                JsonFields.number(eventUsage, "output_tokens"),
                JsonFields.number(eventUsage, "cached_input_tokens"));
        }
        String stopReason = JsonFields.text(event, "stop_reason");
        if (stopReason != null && stopReason.toLowerCase(Locale.ROOT).contains("max")) {
            holdResult(errorResult(ResultSubtype.ERROR_MAX_TURNS, "Cursor turn limit reached: " + stopReason));
        }
    }

    private static String messageText(JsonNode message) {
        return JsonFields.array(message, "content").stream()
            .map(block -> JsonFields.text(block, "text"))
            .filter(text -> text != null)
            .collect(Collectors.joining(""))
            .trim();
    }
}
