package com.ryuqq.agentsession.adapter.runner.process;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * {@link ProcessBuilder} 기반 기본 launcher.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProcessBuilderLauncher implements ProcessLauncher {

    @Override
    public LaunchedProcess launch(List<String> command, Path workingDirectory, Map<String, String> environment)
        throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be null or empty");
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        if (environment != null) {
            builder.environment().putAll(environment);
        }
        return new JdkProcess(builder.start());
    }

    private static final class JdkProcess implements LaunchedProcess {

        private final Process process;

        private JdkProcess(Process process) {
            this.process = process;
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public OutputStream stdin() {
            return process.getOutputStream();
        }

        @Override
        public int waitFor() throws InterruptedException {
            return process.waitFor();
        }

        @Override
        public void destroy() {
            process.destroy();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }
    }
}
