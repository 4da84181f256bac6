package com.ryuqq.agentsession.adapter.runner.cursor;

import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.ScriptedProcessLauncher;
import com.ryuqq.agentsession.core.runner.RunnerAdapter;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.testkit.contract.AbstractRunnerContractTest;

import java.nio.file.Path;
import java.util.List;

/**
 * CursorRunner 정규화 계약 테스트 (버전 확인 생략).
 */
class CursorRunnerContractTest extends AbstractRunnerContractTest {

    @Override
    protected RunnerAdapter createRunner(List<String> stdoutLines, int exitCode) {
        return new CursorRunner(RunnerConfig.of(Path.of("/repo")),
            new CliRunnerConfig().withCursorAgentVersion(null),
            new ScriptedProcessLauncher(stdoutLines, exitCode));
    }

    @Override
    protected List<String> successfulRunScript() {
        return List.of(
            "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"cur-1\",\"model\":\"auto\"}",
            "{\"type\":\"tool_call\",\"subtype\":\"started\",\"call_id\":\"call_1\",\"tool_call\":{\"readToolCall\":{\"args\":{\"path\":\"/repo/README.md\"}}}}",
            "{\"type\":\"tool_call\",\"subtype\":\"completed\",\"call_id\":\"call_1\",\"tool_call\":{\"readToolCall\":{\"args\":{\"path\":\"/repo/README.md\"},\"result\":{\"success\":{\"text\":\"# Readme\"}}}}}",
            "{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"The readme is short.\"}]}}",
            "{\"type\":\"result\",\"usage\":{\"input_tokens\":7,\"output_tokens\":3}}"
        );
    }

    @Override
    protected String expectedSessionId() {
        return "cur-1";
    }
}
