package com.ryuqq.agentsession.adapter.runner.process;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * 스크립트된 출력을 돌려주는 테스트용 ProcessLauncher.
 *
 * <p>launch 호출마다 등록된 스크립트를 순서대로 사용하며, 마지막 스크립트는 반복됩니다.
 * {@link Script#blocking()} 스크립트는 destroy()가 호출될 때까지 stdout을 닫지 않습니다.</p>
 */
public class ScriptedProcessLauncher implements ProcessLauncher {

    private final Deque<Script> scripts = new ArrayDeque<>();
    private final List<List<String>> commands = new ArrayList<>();
    private final List<ScriptedProcess> processes = new ArrayList<>();
    private Script last;
    private IOException launchFailure;
    private IOException stdinFailure;

    public ScriptedProcessLauncher(List<String> stdoutLines, int exitCode) {
        then(Script.of(stdoutLines, exitCode));
    }

    public ScriptedProcessLauncher(Script first) {
        then(first);
    }

    public ScriptedProcessLauncher then(Script script) {
        scripts.addLast(script);
        return this;
    }

    public ScriptedProcessLauncher failWith(IOException failure) {
        this.launchFailure = failure;
        return this;
    }

    /**
     * 이후 실행되는 프로세스의 stdin 쓰기가 모두 실패하도록 설정 (프로세스가 입력 전에 종료된 경우).
     *
     * @param failure 쓰기 시 던질 예외
     * @return this
     */
    public ScriptedProcessLauncher failStdinWith(IOException failure) {
        this.stdinFailure = failure;
        return this;
    }

    @Override
    public synchronized LaunchedProcess launch(List<String> command, Path workingDirectory,
                                               Map<String, String> environment) throws IOException {
        commands.add(List.copyOf(command));
        if (launchFailure != null) {
            throw launchFailure;
        }
        Script script = scripts.isEmpty() ? last : scripts.pollFirst();
        last = script;
        ScriptedProcess process = new ScriptedProcess(script, stdinFailure);
        processes.add(process);
        return process;
    }

    public synchronized List<List<String>> commands() {
        return List.copyOf(commands);
    }

    public synchronized List<String> lastCommand() {
        return commands.get(commands.size() - 1);
    }

    public synchronized ScriptedProcess lastProcess() {
        return processes.get(processes.size() - 1);
    }

    /**
     * 한 번의 프로세스 실행 스크립트.
     */
    public record Script(List<String> stdoutLines, String stderr, int exitCode, boolean blocking) {

        public static Script of(List<String> stdoutLines, int exitCode) {
            return new Script(stdoutLines, "", exitCode, false);
        }

        public static Script blocking(List<String> stdoutLines) {
            return new Script(stdoutLines, "", 143, true);
        }

        public static Script stdout(String output) {
            return new Script(List.of(output), "", 0, false);
        }
    }

    /**
     * 스크립트 기반 프로세스.
     */
    public static final class ScriptedProcess implements LaunchedProcess {

        private final Script script;
        private final ControllableInputStream stdout;
        private final ByteArrayOutputStream stdinBuffer = new ByteArrayOutputStream();
        private final OutputStream stdin;
        private volatile boolean destroyed;
        private volatile boolean stdinClosed;

        ScriptedProcess(Script script, IOException stdinFailure) {
            this.script = script;
            this.stdout = new ControllableInputStream();
            for (String line : script.stdoutLines()) {
                stdout.append(line + "\n");
            }
            if (!script.blocking()) {
                stdout.close();
            }
            this.stdin = new OutputStream() {
                @Override
                public void write(int b) throws IOException {
                    if (stdinFailure != null) {
                        throw stdinFailure;
                    }
                    if (stdinClosed) {
                        throw new IOException("stdin closed");
                    }
                    synchronized (stdinBuffer) {
                        stdinBuffer.write(b);
                    }
                }

                @Override
                public void close() {
                    stdinClosed = true;
                }
            };
        }

        /**
         * 실행 중인 blocking 프로세스의 stdout에 줄 추가.
         *
         * @param line 출력 줄
         */
        public void emitLine(String line) {
            stdout.append(line + "\n");
        }

        /**
         * blocking 프로세스를 정상 종료시킴.
         */
        public void finishOutput() {
            stdout.close();
        }

        public String stdinText() {
            synchronized (stdinBuffer) {
                return stdinBuffer.toString(StandardCharsets.UTF_8);
            }
        }

        public boolean isStdinClosed() {
            return stdinClosed;
        }

        public boolean isDestroyed() {
            return destroyed;
        }

        @Override
        public InputStream stdout() {
            return stdout;
        }

        @Override
        public InputStream stderr() {
            return new ByteArrayInputStream(script.stderr().getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public OutputStream stdin() {
            return stdin;
        }

        @Override
        public int waitFor() {
            if (script.blocking()) {
                return destroyed ? 143 : 0;
            }
            return script.exitCode();
        }

        @Override
        public void destroy() {
            destroyed = true;
            stdout.close();
        }

        @Override
        public boolean isAlive() {
            return !destroyed && !stdout.isClosed();
        }
    }

    /**
     * close될 때까지 read가 대기하는 InputStream.
     */
    static final class ControllableInputStream extends InputStream {

        private final Deque<Byte> buffer = new ArrayDeque<>();
        private boolean closed;

        synchronized void append(String text) {
            for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
                buffer.addLast(b);
            }
            notifyAll();
        }

        synchronized boolean isClosed() {
            return closed;
        }

        @Override
        public synchronized int read() throws IOException {
            while (buffer.isEmpty() && !closed) {
                try {
                    wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while waiting for output", e);
                }
            }
            if (buffer.isEmpty()) {
                return -1;
            }
            return buffer.pollFirst() & 0xFF;
        }

        @Override
        public synchronized int read(byte[] target, int offset, int length) throws IOException {
            if (length == 0) {
                return 0;
            }
            int first = read();
            if (first == -1) {
                return -1;
            }
            target[offset] = (byte) first;
            int count = 1;
            while (count < length && !buffer.isEmpty()) {
                target[offset + count] = buffer.pollFirst();
                count++;
            }
            return count;
        }

        @Override
        public synchronized void close() {
            closed = true;
            notifyAll();
        }
    }
}
