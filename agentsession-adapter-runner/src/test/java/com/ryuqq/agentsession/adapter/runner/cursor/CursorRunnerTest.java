package com.ryuqq.agentsession.adapter.runner.cursor;

import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.ScriptedProcessLauncher;
import com.ryuqq.agentsession.adapter.runner.process.ScriptedProcessLauncher.Script;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.runner.RunnerStartException;
import com.ryuqq.agentsession.core.runner.RunnerState;
import com.ryuqq.agentsession.testkit.contract.RecordingListener;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CursorRunner 버전 확인과 명령 조립 테스트.
 */
class CursorRunnerTest {

    private static final RunnerConfig CONFIG = RunnerConfig.of(Path.of("/repo")).withModel("gpt-5");

    @Test
    void 버전이_다르면_메시지_없이_기동_실패() {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.stdout("2025.01.01-old"));
        CursorRunner runner = new CursorRunner(CONFIG, new CliRunnerConfig(), launcher);
        RecordingListener listener = new RecordingListener();
        runner.addListener(listener);

        // when & then
        assertThatThrownBy(() -> runner.start("hello"))
            .isInstanceOf(RunnerStartException.class)
            .hasMessageContaining("cursor-agent version mismatch: expected `2026.02.13-41ac335` (tested), got `2025.01.01-old`");
        assertThat(listener.messages()).isEmpty();
        assertThat(runner.getMessages()).isEmpty();
        assertThat(runner.state()).isEqualTo(RunnerState.FAILED);
        assertThat(launcher.commands()).containsExactly(List.of("cursor-agent", "--version"));
    }

    @Test
    void 버전_출력이_없으면_확인_실패_메시지() {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(List.of(), 0);
        CursorRunner runner = new CursorRunner(CONFIG, new CliRunnerConfig(), launcher);

        // when & then
        assertThatThrownBy(() -> runner.start("hello"))
            .isInstanceOf(RunnerStartException.class)
            .hasMessage("cursor-agent version check failed: no output from `cursor-agent --version`");
    }

    @Test
    void 버전이_일치하면_기동하고_모델_별칭을_변환() throws Exception {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.stdout(CliRunnerConfig.TESTED_CURSOR_AGENT_VERSION))
            .then(Script.of(List.of("{\"type\":\"init\",\"session_id\":\"cur-9\"}"), 0));
        CursorRunner runner = new CursorRunner(CONFIG, new CliRunnerConfig(), launcher);
        RecordingListener listener = new RecordingListener();
        runner.addListener(listener);

        // when
        runner.start("fix it").get(5, TimeUnit.SECONDS);

        // then
        assertThat(launcher.lastCommand()).containsExactly(
            "cursor-agent", "--print", "--output-format", "stream-json", "--trust",
            "--model", "auto", "--workspace", Path.of("/repo").toString(), "fix it");
        assertThat(runner.state()).isEqualTo(RunnerState.COMPLETED);
    }

    @Test
    void 비정상_종료_메시지() throws Exception {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(List.of(), 3);
        CursorRunner runner = new CursorRunner(CONFIG, new CliRunnerConfig().withCursorAgentVersion(null), launcher);
        RecordingListener listener = new RecordingListener();
        runner.addListener(listener);

        // when
        runner.start("hello").get(5, TimeUnit.SECONDS);

        // then
        assertThat(listener.errors()).hasSize(1);
        assertThat(listener.errors().get(0)).hasMessage("cursor-agent exited with code 3");
        assertThat(runner.state()).isEqualTo(RunnerState.FAILED);
    }
}
