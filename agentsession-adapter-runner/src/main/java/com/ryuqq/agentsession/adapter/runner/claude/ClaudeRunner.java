package com.ryuqq.agentsession.adapter.runner.claude;

import com.ryuqq.agentsession.adapter.runner.AbstractCliRunner;
import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.ProcessLauncher;
import com.ryuqq.agentsession.adapter.runner.support.EventTranslator;
import com.ryuqq.agentsession.adapter.runner.support.JsonFields;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Claude Code CLI runner.
 *
 * <p>유일하게 스트리밍 입력을 지원하는 백엔드입니다. 스트리밍 모드에서는
 * {@code --input-format stream-json}으로 기동하고 stdin에 사용자 메시지를 한 줄씩 씁니다.
 * result 이벤트를 받으면 stdin을 닫아 더 이상의 입력을 받지 않습니다.</p>
 *
 * <pre>
 * claude -p --output-format stream-json --verbose
 *     [--input-format stream-json] [--model m] [--fallback-model f] [--resume id]
 *     [--max-turns n] [--allowedTools ...] [--disallowedTools ...] [--add-dir d]...
 *     [--append-system-prompt s] [prompt]
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ClaudeRunner extends AbstractCliRunner {

    public ClaudeRunner(RunnerConfig config, CliRunnerConfig cliConfig, ProcessLauncher launcher) {
        super(config, cliConfig, launcher);
    }

    @Override
    public BackendType backendType() {
        return BackendType.CLAUDE;
    }

    @Override
    public boolean supportsStreamingInput() {
        return true;
    }

    @Override
    protected List<String> buildCommand(String prompt, boolean streamingInput) {
        List<String> command = new ArrayList<>();
        command.add(cliConfig.claudePath());
        command.add("-p");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        if (streamingInput) {
            command.add("--input-format");
            command.add("stream-json");
        }
        addOption(command, "--model", config.model());
        addOption(command, "--fallback-model", config.fallbackModel());
        if (config.isResume()) {
            addOption(command, "--resume", config.resumeSessionId());
        }
        if (config.maxTurns() != null) {
            addOption(command, "--max-turns", String.valueOf(config.maxTurns()));
        }

        if (config.disallowAllTools()) {
            command.add("--tools");
            command.add("");
        } else {
            List<String> allowedTools = allowedToolsWithDirectories();
            if (!allowedTools.isEmpty()) {
                command.add("--allowedTools");
                command.addAll(allowedTools);
            }
            if (!config.disallowedTools().isEmpty()) {
                command.add("--disallowedTools");
                command.addAll(config.disallowedTools());
            }
        }
        for (Path directory : config.allowedDirectories()) {
            addOption(command, "--add-dir", directory.toString());
        }
        addOption(command, "--append-system-prompt", config.appendSystemPrompt());
        if (!streamingInput) {
            command.add("--");
            command.add(prompt);
        }
        return command;
    }

    @Override
    protected String formatStreamMessage(String text) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "user");
        message.put("content", text);
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", "user");
        envelope.put("message", message);
        return JsonFields.toJsonLine(envelope);
    }

    @Override
    protected EventTranslator createTranslator() {
        return new ClaudeEventTranslator(config);
    }

    @Override
    protected String exitFailureMessage(int exitCode) {
        return "Claude Code process exited with code " + exitCode;
    }

    /**
     * 허용 디렉터리를 Read 패턴으로 추가한 허용 도구 목록.
     *
     * <p>절대 경로는 Claude Code 권한 규칙에 맞도록 "/"를 한 번 더 붙입니다.</p>
     */
    private List<String> allowedToolsWithDirectories() {
        List<String> tools = new ArrayList<>(config.allowedTools());
        for (Path directory : config.allowedDirectories()) {
            String path = directory.toString();
            String prefixed = path.startsWith("/") ? "/" + path : path;
            tools.add("Read(" + prefixed + "/**)");
        }
        return tools;
    }

    private static void addOption(List<String> command, String option, String value) {
        if (value != null && !value.isBlank()) {
            command.add(option);
            command.add(value);
        }
    }
}
