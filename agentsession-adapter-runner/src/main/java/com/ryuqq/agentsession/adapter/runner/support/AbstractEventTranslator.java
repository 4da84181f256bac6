package com.ryuqq.agentsession.adapter.runner.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.agentsession.core.message.AssistantText;
import com.ryuqq.agentsession.core.message.AssistantToolUse;
import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.message.ResultMessage;
import com.ryuqq.agentsession.core.message.ResultSubtype;
import com.ryuqq.agentsession.core.message.SystemInit;
import com.ryuqq.agentsession.core.message.UserToolResult;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 백엔드 공통 정규화 규칙을 구현한 translator 기반 클래스.
 *
 * <p><strong>보장하는 규칙:</strong></p>
 * <ol>
 *   <li>SystemInit은 정확히 1회, 다른 어떤 메시지보다 먼저 발행 (확정 전 실패 시 "pending"으로 합성)</li>
 *   <li>도구 호출은 correlation id 당 최초 1회, 결과는 종료 시점 1회 ({@link ToolCallTracker})</li>
 *   <li>결과는 항상 해당 도구 호출 뒤에 발행</li>
 *   <li>백엔드가 보낸 result는 보류되었다가 종료 시 마지막으로 발행</li>
 *   <li>result가 없으면 종료 시 합성: 성공은 마지막 assistant 텍스트, 실패는 가장 구체적인 오류</li>
 *   <li>중단된 실행은 오류 Result를 합성하지 않음</li>
 * </ol>
 *
 * <p>하위 클래스는 {@link #handleEvent}에서 백엔드별 이벤트를 해석하고
 * {@code emit*} 헬퍼로만 메시지를 생성합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractEventTranslator implements EventTranslator {

    private static final Logger log = LoggerFactory.getLogger(AbstractEventTranslator.class);

    protected final BackendType backend;
    protected final RunnerConfig config;
    protected final PathNormalizer paths;
    protected final ToolCallTracker tools = new ToolCallTracker();
    protected final UsageAccumulator usage = new UsageAccumulator();

    private final long startedAtMillis;
    private final List<String> errorMessages = new ArrayList<>();

    private String sessionId;
    private String model;
    private boolean systemInitEmitted;
    private boolean resultEmitted;
    private boolean terminalEventSeen;
    private ResultMessage pendingResult;
    private String lastAssistantText;

    protected AbstractEventTranslator(BackendType backend, RunnerConfig config) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.backend = backend;
        this.config = config;
        this.paths = new PathNormalizer(config.workingDirectory());
        this.model = config.model();
        this.startedAtMillis = System.currentTimeMillis();
    }

    @Override
    public final List<CanonicalMessage> translate(String line) {
        List<CanonicalMessage> out = new ArrayList<>();
        if (resultEmitted || line == null || line.isBlank()) {
            return out;
        }
        JsonNode event = JsonFields.parseObject(line).orElse(null);
        if (event == null) {
            handleNonJson(line, out);
            return out;
        }
        handleEvent(event, out);
        return out;
    }

    @Override
    public final List<CanonicalMessage> finish(RunTermination termination) {
        List<CanonicalMessage> out = new ArrayList<>();
        if (resultEmitted) {
            return out;
        }
        beforeFinish(out);
        ensureSystemInit(out);

        ResultMessage result = pendingResult;
        if (result == null && !termination.stopped()) {
            if (termination.isFailure() || (failsOnErrorEvents() && !errorMessages.isEmpty())) {
                result = errorResult(mostSpecificError(termination));
            } else {
                result = successResult(successText());
            }
        }
        if (result != null) {
            out.add(result.withSessionId(currentSessionId()));
            resultEmitted = true;
        }
        return out;
    }

    @Override
    public boolean isTerminalEventSeen() {
        return terminalEventSeen;
    }

    @Override
    public String currentSessionId() {
        if (sessionId != null) {
            return sessionId;
        }
        if (config.isResume()) {
            return config.resumeSessionId();
        }
        return SystemInit.PENDING_SESSION_ID;
    }

    // ========================================
    // 하위 클래스 구현
    // ========================================

    /**
     * 백엔드 JSON 이벤트 1건 처리.
     *
     * @param event 이벤트 객체
     * @param out 발행할 메시지 목록
     */
    protected abstract void handleEvent(JsonNode event, List<CanonicalMessage> out);

    /**
     * JSON이 아닌 출력 줄 처리 (기본: 무시).
     *
     * @param line 출력 줄
     * @param out 발행할 메시지 목록
     */
    protected void handleNonJson(String line, List<CanonicalMessage> out) {
        log.debug("Ignoring non-JSON {} output line: {}", backend.key(), line);
    }

    /**
     * 종료 직전 버퍼 flush (기본: 없음).
     *
     * @param out 발행할 메시지 목록
     */
    protected void beforeFinish(List<CanonicalMessage> out) {
    }

    /**
     * 독립 error 이벤트만으로 실행을 실패로 볼지 여부 (기본: false).
     *
     * @return true면 errorMessages가 있을 때 오류 Result 합성
     */
    protected boolean failsOnErrorEvents() {
        return false;
    }

    /**
     * 성공 Result 본문의 마지막 fallback.
     *
     * @return 기본 성공 문자열
     */
    protected String defaultSuccessText() {
        return backend.displayName() + " session completed successfully";
    }

    /**
     * 오류 Result 본문의 마지막 fallback.
     *
     * @return 기본 실패 문자열
     */
    protected String defaultFailureText() {
        return backend.displayName() + " execution failed";
    }

    /**
     * 성공 Result 본문 결정.
     *
     * @return 마지막 assistant 텍스트, 없으면 기본 문자열
     */
    protected String successText() {
        return lastAssistantText != null ? lastAssistantText : defaultSuccessText();
    }

    // ========================================
    // 발행 헬퍼
    // ========================================

    /**
     * 세션 식별 확정.
     *
     * @param confirmedSessionId 백엔드 세션 ID (null이면 기존 값 유지)
     * @param confirmedModel 모델 (null이면 설정값 유지)
     * @param toolNames 사용 가능 도구
     * @param permissionMode 권한 모드
     * @param out 발행할 메시지 목록
     */
    protected void confirmSession(String confirmedSessionId, String confirmedModel, List<String> toolNames,
                                  String permissionMode, List<CanonicalMessage> out) {
        if (confirmedSessionId != null && !confirmedSessionId.isBlank()) {
            this.sessionId = confirmedSessionId;
        }
        if (confirmedModel != null && !confirmedModel.isBlank()) {
            this.model = confirmedModel;
        }
        if (!systemInitEmitted) {
            systemInitEmitted = true;
            out.add(new SystemInit(currentSessionId(), model, toolNames, permissionMode));
        }
    }

    /**
     * SystemInit이 아직 없으면 현재 최선의 ID로 발행.
     *
     * @param out 발행할 메시지 목록
     */
    protected void ensureSystemInit(List<CanonicalMessage> out) {
        if (!systemInitEmitted) {
            confirmSession(null, null, List.of(), null, out);
        }
    }

    protected void emitAssistantText(String text, String parentToolUseId, String sdkError, List<CanonicalMessage> out) {
        if (text == null) {
            return;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return;
        }
        ensureSystemInit(out);
        if (sdkError == null) {
            lastAssistantText = normalized;
        }
        out.add(new AssistantText(currentSessionId(), normalized, parentToolUseId, sdkError));
    }

    protected void emitAssistantText(String text, List<CanonicalMessage> out) {
        emitAssistantText(text, null, null, out);
    }

    /**
     * 도구 호출 발행 (id 당 최초 1회).
     *
     * <p>id가 없으면 버립니다. 이름이 없으면 입력의 {@code command}에서 추론합니다.</p>
     *
     * @param projection 투영 결과
     * @param parentToolUseId 상위 도구 호출 ID
     * @param out 발행할 메시지 목록
     */
    protected void emitToolUse(ToolProjection projection, String parentToolUseId, List<CanonicalMessage> out) {
        String toolUseId = projection.toolUseId();
        if (toolUseId == null || toolUseId.isBlank()) {
            log.warn("Dropping {} tool call without id", backend.key());
            return;
        }
        ensureSystemInit(out);
        if (tools.hasToolUse(toolUseId)) {
            return;
        }
        AssistantToolUse toolUse = new AssistantToolUse(currentSessionId(), toolUseId, toolNameOf(projection),
            paths.normalizeInput(projection.input()), parentToolUseId);
        tools.markToolUse(toolUseId);
        out.add(toolUse);
    }

    /**
     * 도구 결과 발행 (호출이 없었으면 먼저 호출 발행, id 당 최대 1회).
     *
     * @param projection 투영 결과
     * @param parentToolUseId 상위 도구 호출 ID
     * @param out 발행할 메시지 목록
     */
    protected void emitToolResult(ToolProjection projection, String parentToolUseId, List<CanonicalMessage> out) {
        String toolUseId = projection.toolUseId();
        if (toolUseId == null || toolUseId.isBlank()) {
            log.warn("Dropping {} tool result without id", backend.key());
            return;
        }
        emitToolUse(projection, parentToolUseId, out);
        if (tools.markResult(toolUseId)) {
            out.add(new UserToolResult(currentSessionId(), toolUseId, projection.result(), projection.isError()));
        } else {
            log.debug("Dropping duplicate {} tool result for {}", backend.key(), toolUseId);
        }
    }

    /**
     * 투영된 도구 이름, 비어 있으면 명령에서 추론.
     *
     * @param projection 투영 결과
     * @return 도구 이름
     */
    protected static String toolNameOf(ToolProjection projection) {
        String toolName = projection.toolName();
        if (toolName != null && !toolName.isBlank()) {
            return toolName;
        }
        Object command = projection.input() == null ? null : projection.input().get("command");
        return ToolNameInference.fromCommand(command instanceof String ? (String) command : null);
    }

    // ========================================
    // 종료 상태
    // ========================================

    protected void recordError(String message) {
        if (message != null && !message.isBlank()) {
            errorMessages.add(message);
        }
    }

    protected String lastErrorMessage() {
        return errorMessages.isEmpty() ? null : errorMessages.get(errorMessages.size() - 1);
    }

    /**
     * 백엔드가 보낸 종료 결과를 보류 (마지막 것이 유효).
     *
     * @param result 결과
     */
    protected void holdResult(ResultMessage result) {
        this.pendingResult = result;
        this.terminalEventSeen = true;
    }

    protected ResultMessage successResult(String text) {
        return ResultMessage.success(currentSessionId(), text, usage.current(), elapsedMillis());
    }

    protected ResultMessage errorResult(String message) {
        return errorResult(ResultSubtype.ERROR_DURING_EXECUTION, message);
    }

    protected ResultMessage errorResult(ResultSubtype subtype, String message) {
        return ResultMessage.error(currentSessionId(), subtype, message, usage.current(), elapsedMillis());
    }

    protected long elapsedMillis() {
        return Math.max(System.currentTimeMillis() - startedAtMillis, 0);
    }

    private String mostSpecificError(RunTermination termination) {
        String lastError = lastErrorMessage();
        if (lastError != null) {
            return lastError;
        }
        if (termination.failureMessage() != null) {
            return termination.failureMessage();
        }
        return defaultFailureText();
    }
}
