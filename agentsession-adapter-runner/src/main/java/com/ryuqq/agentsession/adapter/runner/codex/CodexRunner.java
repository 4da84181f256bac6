package com.ryuqq.agentsession.adapter.runner.codex;

import com.ryuqq.agentsession.adapter.runner.AbstractCliRunner;
import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.ProcessLauncher;
import com.ryuqq.agentsession.adapter.runner.support.EventTranslator;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Codex CLI runner.
 *
 * <p>실행 명령:</p>
 * <pre>
 * codex exec --json --skip-git-repo-check --sandbox workspace-write
 *     --cd {workingDirectory} --model {model} [--add-dir d]... [resume {sessionId}] {prompt}
 * </pre>
 *
 * <p>스트리밍 입력은 지원하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CodexRunner extends AbstractCliRunner {

    public CodexRunner(RunnerConfig config, CliRunnerConfig cliConfig, ProcessLauncher launcher) {
        super(config, cliConfig, launcher);
    }

    @Override
    public BackendType backendType() {
        return BackendType.CODEX;
    }

    @Override
    public boolean supportsStreamingInput() {
        return false;
    }

    @Override
    protected List<String> buildCommand(String prompt, boolean streamingInput) {
        List<String> command = new ArrayList<>();
        command.add(cliConfig.codexPath());
        command.add("exec");
        command.add("--json");
        command.add("--skip-git-repo-check");
        command.add("--sandbox");
        command.add("workspace-write");
        if (config.workingDirectory() != null) {
            command.add("--cd");
            command.add(config.workingDirectory().toString());
        }
        command.add("--model");
        command.add(config.model() != null ? config.model() : cliConfig.defaultCodexModel());
        for (Path directory : config.allowedDirectories()) {
            command.add("--add-dir");
            command.add(directory.toString());
        }
        if (config.isResume()) {
            command.add("resume");
            command.add(config.resumeSessionId());
        }
        command.add(prompt);
        return command;
    }

    @Override
    protected EventTranslator createTranslator() {
        return new CodexEventTranslator(config);
    }

    @Override
    protected String exitFailureMessage(int exitCode) {
        return "Codex CLI exited with code " + exitCode;
    }
}
