package com.ryuqq.agentsession.adapter.runner.claude;

import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.ScriptedProcessLauncher;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.testkit.contract.AbstractRunnerContractTest;

import java.nio.file.Path;
import java.util.List;

/**
 * ClaudeRunner 정규화 계약 테스트.
 */
class ClaudeRunnerContractTest extends AbstractRunnerContractTest {

    @Override
    protected RunnerAdapter createRunner(List<String> stdoutLines, int exitCode) {
        return new ClaudeRunner(RunnerConfig.of(Path.of("/repo")), new CliRunnerConfig(),
            new ScriptedProcessLauncher(stdoutLines, exitCode));
    }

    @Override
    protected List<String> successfulRunScript() {
        return List.of(
            "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"claude-1\",\"model\":\"claude-sonnet\",\"tools\":[\"Bash\"]}",
            "{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"Bash\",\"input\":{\"command\":\"git status\"}}]}}",
            "{\"type\":\"user\",\"message\":{\"content\":[{\"type\":\"tool_result\",\"tool_use_id\":\"toolu_1\",\"content\":\"clean\"}]}}",
            "{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"Working tree is clean\"}]}}",
            "{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"Working tree is clean\",\"duration_ms\":1500,\"num_turns\":1,\"usage\":{\"input_tokens\":20,\"output_tokens\":6}}"
        );
    }

    @Override
    protected String expectedSessionId() {
        return "claude-1";
    }
}
