package com.phillippitts.jukebox.testutil;

import com.phillippitts.jukebox.service.process.ProcessFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Fake processes and factories for hermetic tests of process-based backends.
 */
public final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param stdout stdout content to return
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param finishAfterMillis delay before process finishes (-1 means run until destroyed or exited)
     */
    public record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        public static ProcessBehavior succeeding(String stdout) {
            return new ProcessBehavior(stdout, "", 0, 0);
        }

        public static ProcessBehavior failing(String stderr, int exitCode) {
            return new ProcessBehavior("", stderr, exitCode, 0);
        }

        public static ProcessBehavior longRunning() {
            return new ProcessBehavior("", "", 0, -1);
        }
    }

    /**
     * Factory recording every command line and answering with processes built per call.
     */
    public static final class RecordingProcessFactory implements ProcessFactory {
        private final Function<List<String>, TestProcess> behavior;
        public final List<List<String>> commands = new CopyOnWriteArrayList<>();
        public final List<TestProcess> started = new CopyOnWriteArrayList<>();
        private volatile boolean failToStart;

        public RecordingProcessFactory(Function<List<String>, TestProcess> behavior) {
            this.behavior = behavior;
        }

        /** Every call returns a fresh long-running process. */
        public static RecordingProcessFactory longRunning() {
            return new RecordingProcessFactory(cmd -> new TestProcess(ProcessBehavior.longRunning()));
        }

        /** Calls answer with the given processes in order. */
        public static RecordingProcessFactory sequence(TestProcess... processes) {
            Deque<TestProcess> queue = new ArrayDeque<>(List.of(processes));
            return new RecordingProcessFactory(cmd -> {
                synchronized (queue) {
                    TestProcess next = queue.poll();
                    return next != null ? next : new TestProcess(ProcessBehavior.succeeding(""));
                }
            });
        }

        public void failToStart(boolean fail) {
            this.failToStart = fail;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            return launch(command);
        }

        @Override
        public Process startDetached(List<String> command) throws IOException {
            return launch(command);
        }

        private Process launch(List<String> command) throws IOException {
            commands.add(List.copyOf(command));
            if (failToStart) {
                throw new IOException("No such file or directory: " + command.get(0));
            }
            TestProcess p = behavior.apply(command);
            started.add(p);
            return p;
        }

        public TestProcess last() {
            return started.get(started.size() - 1);
        }
    }

    /**
     * Minimal fake Process that allows controlling stdout/stderr, exit code, and termination timing.
     */
    public static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
        private volatile boolean alive = true;
        private volatile boolean destroyCalled;

        public TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            long finishAfterMillis = behavior.finishAfterMillis();

            if (finishAfterMillis == 0) {
                this.alive = false;
            } else if (finishAfterMillis > 0) {
                Thread finisher = new Thread(() -> {
                    try {
                        Thread.sleep(finishAfterMillis);
                        alive = false;
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }, "test-proc-finisher");
                finisher.setDaemon(true);
                finisher.start();
            }
        }

        /** Simulates the process ending on its own. */
        public void exit() {
            alive = false;
        }

        public boolean wasDestroyCalled() {
            return destroyCalled;
        }

        public String stdinText() {
            return stdin.toString(StandardCharsets.UTF_8);
        }

        @Override
        public OutputStream getOutputStream() {
            return stdin;
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() throws InterruptedException {
            while (alive) {
                Thread.sleep(5);
            }
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long deadline = System.nanoTime() + unit.toNanos(timeout);
            while (alive) {
                if (System.nanoTime() - deadline >= 0) {
                    return false;
                }
                Thread.sleep(5);
            }
            return true;
        }

        @Override
        public int exitValue() {
            if (alive) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
