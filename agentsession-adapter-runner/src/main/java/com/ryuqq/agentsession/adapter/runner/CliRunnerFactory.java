package com.ryuqq.agentsession.adapter.runner;

import com.ryuqq.agentsession.adapter.runner.claude.ClaudeRunner;
import com.ryuqq.agentsession.adapter.runner.codex.CodexRunner;
import com.ryuqq.agentsession.adapter.runner.cursor.CursorRunner;
import com.ryuqq.agentsession.adapter.runner.gemini.GeminiRunner;
import com.ryuqq.agentsession.adapter.runner.process.ProcessBuilderLauncher;
import com.ryuqq.agentsession.adapter.runner.process.ProcessLauncher;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.spi.RunnerFactory;

/**
 * CLI 기반 RunnerFactory.
 *
 * <p>백엔드 종류에 맞는 runner를 생성합니다. 모든 runner는 같은 {@link ProcessLauncher}를 공유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CliRunnerFactory implements RunnerFactory {

    private final CliRunnerConfig cliConfig;
    private final ProcessLauncher launcher;

    public CliRunnerFactory() {
        this(new CliRunnerConfig(), new ProcessBuilderLauncher());
    }

    public CliRunnerFactory(CliRunnerConfig cliConfig, ProcessLauncher launcher) {
        if (cliConfig == null) {
            throw new IllegalArgumentException("cliConfig cannot be null");
        }
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        this.cliConfig = cliConfig;
        this.launcher = launcher;
    }

    @Override
    public RunnerAdapter create(BackendType backend, RunnerConfig config) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        return switch (backend) {
            case CLAUDE -> new ClaudeRunner(config, cliConfig, launcher);
            case CODEX -> new CodexRunner(config, cliConfig, launcher);
            case CURSOR -> new CursorRunner(config, cliConfig, launcher);
            case GEMINI -> new GeminiRunner(config, cliConfig, launcher);
        };
    }
}
