package com.ryuqq.agentsession.adapter.runner.cursor;

import com.ryuqq.agentsession.adapter.runner.AbstractCliRunner;
import com.ryuqq.agentsession.adapter.runner.CliRunnerConfig;
import com.ryuqq.agentsession.adapter.runner.process.LaunchedProcess;
import com.ryuqq.agentsession.adapter.runner.process.ProcessLauncher;
import com.ryuqq.agentsession.adapter.runner.support.EventTranslator;
import com.ryuqq.agentsession.core.runner.BackendType;
import com.ryuqq.agentsession.core.runner.RunnerConfig;
import com.ryuqq.agentsession.core.runner.RunnerStartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * cursor-agent runner.
 *
 * <p>기동 전에 {@code cursor-agent --version}을 동기 실행하여 설정된 버전과 비교합니다.
 * 불일치하면 어떤 메시지도 발행하지 않고 {@link RunnerStartException}으로 기동이 실패합니다.
 * 기대 버전이 null이면 확인을 건너뜁니다.</p>
 *
 * <p>실행 명령:</p>
 * <pre>
 * cursor-agent --print --output-format stream-json --trust
 *     [--model m] [--resume id] --workspace {workingDirectory} {prompt}
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CursorRunner extends AbstractCliRunner {

    private static final Logger log = LoggerFactory.getLogger(CursorRunner.class);

    public CursorRunner(RunnerConfig config, CliRunnerConfig cliConfig, ProcessLauncher launcher) {
        super(config, cliConfig, launcher);
    }

    @Override
    public BackendType backendType() {
        return BackendType.CURSOR;
    }

    @Override
    public boolean supportsStreamingInput() {
        return false;
    }

    @Override
    protected void preflight() {
        String expected = cliConfig.cursorAgentVersion();
        if (expected == null || expected.isBlank()) {
            return;
        }
        String error = checkVersion(expected.trim());
        if (error != null) {
            log.warn("cursor-agent preflight failed: {}", error);
            throw new RunnerStartException(error);
        }
    }

    @Override
    protected List<String> buildCommand(String prompt, boolean streamingInput) {
        List<String> command = new ArrayList<>();
        command.add(cliConfig.cursorPath());
        command.add("--print");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--trust");
        String model = normalizeModel(config.model());
        if (model != null) {
            command.add("--model");
            command.add(model);
        }
        if (config.isResume()) {
            command.add("--resume");
            command.add(config.resumeSessionId());
        }
        command.add("--workspace");
        command.add(config.workingDirectory().toString());
        command.add(prompt);
        return command;
    }

    @Override
    protected EventTranslator createTranslator() {
        return new CursorEventTranslator(config);
    }

    @Override
    protected String exitFailureMessage(int exitCode) {
        return "cursor-agent exited with code " + exitCode;
    }

    /**
     * cursor-agent가 더 이상 받지 않는 모델 별칭 변환.
     *
     * @param model 요청 모델 (null 가능)
     * @return 전달할 모델
     */
    static String normalizeModel(String model) {
        if (model == null || model.isBlank()) {
            return null;
        }
        return "gpt-5".equals(model.toLowerCase(Locale.ROOT)) ? "auto" : model;
    }

    private String checkVersion(String expected) {
        String cursorPath = cliConfig.cursorPath();
        String actual;
        try {
            LaunchedProcess versionProcess = launcher.launch(
                List.of(cursorPath, "--version"), config.workingDirectory(), environment());
            versionProcess.closeStdin();
            String stdout = readAll(versionProcess.stdout());
            String stderr = readAll(versionProcess.stderr());
            versionProcess.waitFor();
            actual = !stdout.isEmpty() ? stdout : stderr;
        } catch (IOException e) {
            log.debug("cursor-agent version check could not run: {}", e.getMessage());
            actual = "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunnerStartException("cursor-agent version check interrupted", e);
        }

        if (actual.isEmpty()) {
            return "cursor-agent version check failed: no output from `" + cursorPath + " --version`";
        }
        if (!actual.equals(expected)) {
            return "cursor-agent version mismatch: expected `" + expected + "` (tested), got `" + actual
                + "`. Set cursorAgentVersion to your version to skip this check, "
                + "or upgrade cursor-agent to the tested version.";
        }
        return null;
    }

    private static String readAll(InputStream stream) throws IOException {
        if (stream == null) {
            return "";
        }
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        }
    }
}
