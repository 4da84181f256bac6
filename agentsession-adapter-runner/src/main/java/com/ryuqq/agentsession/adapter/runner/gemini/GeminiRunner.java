package com.ryuqq.agentsession.adapter.runner.gemini;

import com.ryuqq.agentsession.adapter.runner.AbstractCliRunner;
import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.ProcessLauncher;
import com.ryuqq.agentsession.adapter.runner.support.EventTranslator;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Gemini CLI runner.
 *
 * <pre>
 * gemini --output-format stream-json --model {model} [-r {resume}] --yolo
 *     [--include-directories a,b] -p {prompt}
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GeminiRunner extends AbstractCliRunner {

    public GeminiRunner(RunnerConfig config, CliRunnerConfig cliConfig, ProcessLauncher launcher) {
        super(config, cliConfig, launcher);
    }

    @Override
    public BackendType backendType() {
        return BackendType.GEMINI;
    }

    @Override
    public boolean supportsStreamingInput() {
        return false;
    }

    @Override
    protected List<String> buildCommand(String prompt, boolean streamingInput) {
        List<String> command = new ArrayList<>();
        command.add(cliConfig.geminiPath());
        command.add("--output-format");
        command.add("stream-json");
        command.add("--model");
        command.add(config.model() != null ? config.model() : cliConfig.defaultGeminiModel());
        if (config.isResume()) {
            command.add("-r");
            command.add(config.resumeSessionId());
        }
        command.add("--yolo");
        if (!config.allowedDirectories().isEmpty()) {
            command.add("--include-directories");
            command.add(config.allowedDirectories().stream().map(Path::toString).collect(Collectors.joining(",")));
        }
        command.add("-p");
        command.add(prompt);
        return command;
    }

    @Override
    protected EventTranslator createTranslator() {
        return new GeminiEventTranslator(config);
    }

    @Override
    protected String exitFailureMessage(int exitCode) {
        return "Gemini CLI exited with code " + exitCode;
    }
}
