package com.ryuqq.agentsession.adapter.runner.claude;

import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.ScriptedProcessLauncher;
import com.ryuqq.agentsession.adapter.runner.process.ScriptedProcessLauncher.Script;
import com.ryuqq.agentsession.adapter.runner.process.ScriptedProcessLauncher.ScriptedProcess;
import com.ryuqq.agentsession.core.message.CanonicalMessage;
import com.ryuqq.agentsession.core.message.ResultMessage;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.runner.RunnerSessionInfo;
import com.ryuqq.agentsession.core.runner.RunnerStartException;
import com.ryuqq.agentsession.core.runner.RunnerState;
import com.ryuqq.agentsession.core.runner.StreamingInputUnsupportedException;
import com.ryuqq.agentsession.testkit.contract.RecordingListener;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ClaudeRunner 실행 흐름 테스트 (명령 조립, 스트리밍 입력, 중단).
 */
class ClaudeRunnerTest {

    private static final String INIT =
        "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"c-9\",\"model\":\"claude-sonnet\"}";
    private static final String RESULT =
        "{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"done\"}";

    private final RunnerConfig baseConfig = RunnerConfig.of(Path.of("/repo"));

    @Test
    void 옵션이_모두_채워진_설정의_명령_조립() throws Exception {
        // given
        RunnerConfig config = baseConfig
            .withModel("opus")
            .withFallbackModel("sonnet")
            .withResumeSessionId("c-old")
            .withMaxTurns(5)
            .withAllowedTools(List.of("Bash(git:*)"))
            .withDisallowedTools(List.of("WebFetch"))
            .withAllowedDirectories(List.of(Path.of("/shared/docs")))
            .withAppendSystemPrompt("Be brief");
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(List.of(INIT, RESULT), 0);
        ClaudeRunner runner = new ClaudeRunner(config, new CliRunnerConfig().withClaudePath("/opt/claude"), launcher);

        // when
        runner.start("fix the bug").get(5, TimeUnit.SECONDS);

        // then
        assertThat(launcher.lastCommand()).containsExactly(
            "/opt/claude", "-p", "--output-format", "stream-json", "--verbose",
            "--model", "opus",
            "--fallback-model", "sonnet",
            "--resume", "c-old",
            "--max-turns", "5",
            "--allowedTools", "Bash(git:*)", "Read(//shared/docs/**)",
            "--disallowedTools", "WebFetch",
            "--add-dir", "/shared/docs",
            "--append-system-prompt", "Be brief",
            "--", "fix the bug");
        assertThat(launcher.lastProcess().isStdinClosed()).isTrue();
    }

    @Test
    void 모든_도구_차단은_빈_tools_옵션으로_전달() throws Exception {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(List.of(INIT, RESULT), 0);
        ClaudeRunner runner = new ClaudeRunner(
            baseConfig.withDisallowAllTools(true).withAllowedTools(List.of("Read")),
            new CliRunnerConfig(), launcher);

        // when
        runner.start("summarize").get(5, TimeUnit.SECONDS);

        // then
        List<String> command = launcher.lastCommand();
        int index = command.indexOf("--tools");
        assertThat(index).isPositive();
        assertThat(command.get(index + 1)).isEmpty();
        assertThat(command).doesNotContain("--allowedTools");
    }

    @Test
    void 스트리밍_입력은_JSON_줄로_쓰이고_result_이후_stdin이_닫힘() throws Exception {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.blocking(List.of(INIT)));
        ClaudeRunner runner = new ClaudeRunner(baseConfig, new CliRunnerConfig(), launcher);
        RecordingListener listener = new RecordingListener();
        runner.addListener(listener);

        // when
        CompletableFuture<RunnerSessionInfo> future = runner.startStreaming("first");
        runner.addStreamMessage("second");
        ScriptedProcess process = launcher.lastProcess();
        process.emitLine(RESULT);
        awaitUntil(process::isStdinClosed);
        process.finishOutput();
        RunnerSessionInfo info = future.get(5, TimeUnit.SECONDS);

        // then
        assertThat(launcher.lastCommand()).contains("--input-format").doesNotContain("--");
        assertThat(process.stdinText()).isEqualTo(
            "{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":\"first\"}}\n"
                + "{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":\"second\"}}\n");
        assertThat(info.streaming()).isTrue();
        assertThat(info.sessionId()).isEqualTo("c-9");
        assertThat(runner.state()).isEqualTo(RunnerState.COMPLETED);
        assertThatThrownBy(() -> runner.addStreamMessage("too late"))
            .isInstanceOf(StreamingInputUnsupportedException.class);
        assertThat(listener.messages().get(listener.messages().size() - 1)).isInstanceOf(ResultMessage.class);
    }

    @Test
    void 첫_프롬프트를_쓸_수_없으면_기동_실패로_끝나고_프로세스를_정리() {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.blocking(List.of(INIT)))
            .failStdinWith(new IOException("Broken pipe"));
        ClaudeRunner runner = new ClaudeRunner(baseConfig, new CliRunnerConfig(), launcher);
        RecordingListener listener = new RecordingListener();
        runner.addListener(listener);

        // when / then
        assertThatThrownBy(() -> runner.startStreaming("hello"))
            .isInstanceOf(RunnerStartException.class)
            .hasMessageContaining("Broken pipe")
            .hasCauseInstanceOf(IOException.class);
        assertThat(runner.state()).isEqualTo(RunnerState.FAILED);
        assertThat(runner.isRunning()).isFalse();
        assertThat(launcher.lastProcess().isDestroyed()).isTrue();
        assertThat(listener.messages()).isEmpty();
        assertThatThrownBy(() -> runner.addStreamMessage("more"))
            .isInstanceOf(StreamingInputUnsupportedException.class);
    }

    @Test
    void 스트리밍이_아닌_실행에는_메시지를_추가할_수_없음() {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.blocking(List.of(INIT)));
        ClaudeRunner runner = new ClaudeRunner(baseConfig, new CliRunnerConfig(), launcher);
        runner.start("one shot");

        // when / then
        assertThatThrownBy(() -> runner.addStreamMessage("more"))
            .isInstanceOf(StreamingInputUnsupportedException.class);
        runner.stop();
    }

    @Test
    void 실행_중_중단하면_STOPPED이고_Result를_합성하지_않음() throws Exception {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.blocking(List.of(INIT)));
        ClaudeRunner runner = new ClaudeRunner(baseConfig, new CliRunnerConfig(), launcher);
        RecordingListener listener = new RecordingListener();
        runner.addListener(listener);
        CompletableFuture<RunnerSessionInfo> future = runner.start("long task");
        awaitUntil(() -> !listener.messages().isEmpty());

        // when
        runner.stop();
        runner.stop();
        future.get(5, TimeUnit.SECONDS);

        // then
        assertThat(runner.state()).isEqualTo(RunnerState.STOPPED);
        assertThat(launcher.lastProcess().isDestroyed()).isTrue();
        List<CanonicalMessage> messages = listener.messages();
        assertThat(messages).noneMatch(CanonicalMessage::isResult);
        assertThat(listener.errors()).isEmpty();
        assertThat(listener.completeCount()).isEqualTo(1);
    }

    @Test
    void 시작_전_중단은_프로세스_없이_STOPPED() {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(List.of(INIT, RESULT), 0);
        ClaudeRunner runner = new ClaudeRunner(baseConfig, new CliRunnerConfig(), launcher);

        // when
        runner.stop();

        // then
        assertThat(runner.state()).isEqualTo(RunnerState.STOPPED);
        assertThat(launcher.commands()).isEmpty();
        assertThatThrownBy(() -> runner.start("hello")).isInstanceOf(RunnerStartException.class);
    }

    @Test
    void 프로세스_기동_실패는_RunnerStartException이고_메시지를_발행하지_않음() {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(List.of(), 0)
            .failWith(new IOException("No such file or directory"));
        ClaudeRunner runner = new ClaudeRunner(baseConfig, new CliRunnerConfig(), launcher);

        // when / then
        assertThatThrownBy(() -> runner.start("hello"))
            .isInstanceOf(RunnerStartException.class)
            .hasMessageContaining("No such file or directory");
        assertThat(runner.state()).isEqualTo(RunnerState.FAILED);
        assertThat(runner.getMessages()).isEmpty();
    }

    @Test
    void 실행_중_재시작은_거부() {
        // given
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(Script.blocking(List.of(INIT)));
        ClaudeRunner runner = new ClaudeRunner(baseConfig, new CliRunnerConfig(), launcher);
        runner.start("first");

        // when / then
        assertThatThrownBy(() -> runner.start("second"))
            .isInstanceOf(RunnerStartException.class)
            .hasMessageContaining("already running");
        runner.stop();
    }

    private static void awaitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met in time");
            }
            Thread.sleep(10);
        }
    }
}
