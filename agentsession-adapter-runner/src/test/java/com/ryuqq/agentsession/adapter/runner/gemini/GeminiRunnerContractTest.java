package com.ryuqq.agentsession.adapter.runner.gemini;

import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.ScriptedProcessLauncher;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.testkit.contract.AbstractRunnerContractTest;

import java.nio.file.Path;
import java.util.List;

/**
 * GeminiRunner 정규화 계약 테스트.
 */
class GeminiRunnerContractTest extends AbstractRunnerContractTest {

    @Override
    protected RunnerAdapter createRunner(List<String> stdoutLines, int exitCode) {
        return new GeminiRunner(RunnerConfig.of(Path.of("/work")), new CliRunnerConfig(),
            new ScriptedProcessLauncher(stdoutLines, exitCode));
    }

    @Override
    protected List<String> successfulRunScript() {
        return List.of(
            "{\"type\":\"init\",\"session_id\":\"gem-1\",\"model\":\"gemini-2.5-pro\"}",
            "{\"type\":\"message\",\"role\":\"user\",\"content\":\"hello\"}",
            "{\"type\":\"tool_use\",\"tool_name\":\"list_directory\",\"tool_id\":\"ls-1\",\"parameters\":{\"dir_path\":\"/work\"}}",
            "{\"type\":\"tool_result\",\"tool_id\":\"ls-1\",\"status\":\"success\",\"output\":\"README.md\"}",
            "{\"type\":\"message\",\"role\":\"assistant\",\"content\":\"One file\",\"delta\":true}",
            "{\"type\":\"result\",\"status\":\"success\",\"stats\":{\"input_tokens\":3,\"output_tokens\":2}}"
        );
    }

    @Override
    protected String expectedSessionId() {
        return "gem-1";
    }
}
