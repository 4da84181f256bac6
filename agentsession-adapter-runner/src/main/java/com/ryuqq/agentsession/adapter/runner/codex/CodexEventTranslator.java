package com.ryuqq.agentsession.adapter.runner.codex;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.agentsession.adapter.runner.support.AbstractEventTranslator;
import com.ryuqq.agentsession.adapter.runner.support.JsonFields;
import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;

import java.util.List;

/**
 * {@code codex exec --json} 이벤트 스트림 정규화.
 *
 * <p><strong>이벤트 매핑:</strong></p>
 * <pre>
 * thread.started  → SystemInit(thread_id)
 * item.started    → 도구 호출 (도구 item만)
 * item.completed  → agent_message는 AssistantText, 그 외는 도구 결과
 * turn.completed  → usage 갱신 + 성공 Result 보류
 * turn.failed     → 오류 Result 보류
 * error           → 오류 메시지 기록
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CodexEventTranslator extends AbstractEventTranslator {

    private final CodexItemProjector projector;

    public CodexEventTranslator(RunnerConfig config) {
        super(BackendType.CODEX, config);
        this.projector = new CodexItemProjector(paths);
    }

    @Override
    protected void handleEvent(JsonNode event, List<CanonicalMessage> out) {
        String type = JsonFields.text(event, "type");
        if (type == null) {
            return;
        }
        switch (type) {
            case "thread.started" -> confirmSession(JsonFields.text(event, "thread_id"), null, List.of(), null, out);
            case "item.started" -> projector.project(JsonFields.object(event, "item"))
                .ifPresent(projection -> emitToolUse(projection, null, out));
            case "item.completed" -> handleItemCompleted(JsonFields.object(event, "item"), out);
            case "turn.completed" -> {
                JsonNode eventUsage = JsonFields.object(event, "usage");
                usage.update(
                    JsonFields.number(eventUsage, "input_tokens"),
                    JsonFields.number(eventUsage, "output_tokens"),
                    JsonFields.number(eventUsage, "cached_input_tokens"));
                holdResult(successResult(successText()));
            }
            case "turn.failed" -> {
                String message = JsonFields.text(JsonFields.object(event, "error"), "message");
                if (message == null) {
                    message = lastErrorMessage() != null ? lastErrorMessage() : defaultFailureText();
                }
                recordError(message);
                holdResult(errorResult(message));
            }
            case "error" -> recordError(JsonFields.text(event, "message"));
            default -> {
                // turn.started, item.updated 등은 정규화 대상 아님
            }
        }
    }

    private void handleItemCompleted(JsonNode item, List<CanonicalMessage> out) {
        if (item == null) {
            return;
        }
        if ("agent_message".equals(JsonFields.text(item, "type"))) {
            emitAssistantText(JsonFields.text(item, "text"), out);
            return;
        }
        projector.project(item).ifPresent(projection -> emitToolResult(projection, null, out));
    }
}
