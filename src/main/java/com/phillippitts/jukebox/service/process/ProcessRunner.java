package com.phillippitts.jukebox.service.process;

import com.phillippitts.jukebox.exception.ProcessFailureException;
import com.phillippitts.jukebox.exception.ProcessFailureExceptionBuilder;
import com.phillippitts.jukebox.exception.ResourceUnavailableException;
import com.phillippitts.jukebox.util.ProcessTimeouts;
import com.phillippitts.jukebox.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs short-lived helper tools (yt-dlp, piper) to completion and returns their stdout.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Feed optional text on stdin, then close it
 * - Capture stdout and stderr concurrently
 * - Enforce a timeout and terminate runaway processes
 * - Provide structured error context in {@link ProcessFailureException}
 *
 * <p>Stateless apart from the factory; safe to share between worker threads.
 */
@Component
public class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    static final int STDOUT_MAX_CHARS = 1_048_576;
    static final int STDERR_MAX_CHARS = 65_536;
    static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private final ProcessFactory processFactory;

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    /**
     * Executes {@code command} and returns its stdout.
     *
     * @param tool      short tool name used in errors and logs
     * @param command   full command line
     * @param stdinText text written to the process stdin, or null for none
     * @param timeout   maximum run time
     * @return stdout content (may be empty)
     * @throws ResourceUnavailableException if the executable cannot be started
     * @throws ProcessFailureException on timeout, non-zero exit, or I/O error while running
     */
    public String run(String tool, List<String> command, String stdinText, Duration timeout) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        long startTime = System.nanoTime();

        ProcessExecution exec;
        try {
            exec = startProcessWithGobblers(command, tool);
        } catch (IOException e) {
            throw new ResourceUnavailableException(command.get(0), "Cannot start " + tool, e);
        }

        try {
            writeStdin(exec.process(), stdinText);
            waitForProcessCompletion(exec, tool, timeout, startTime);
            return handleProcessResult(exec, tool, startTime);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw processError("I/O failure: " + e.getMessage(), tool, -1, exec.stderr(), startTime, e);
        } finally {
            if (exec.process().isAlive()) {
                destroyProcess(exec.process());
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    private ProcessExecution startProcessWithGobblers(List<String> command, String tool) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, null);

        // Start gobblers before waiting to avoid deadlock
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, tool + "-out", STDOUT_MAX_CHARS);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, tool + "-err", STDERR_MAX_CHARS);

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private static void writeStdin(Process process, String stdinText) throws IOException {
        try (OutputStream stdin = process.getOutputStream()) {
            if (stdinText != null) {
                stdin.write(stdinText.getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }
        }
    }

    private void waitForProcessCompletion(ProcessExecution exec, String tool, Duration timeout, long startTime)
            throws InterruptedException {
        boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            throw processError("Timeout after " + timeout.toMillis() + "ms", tool, -1, exec.stderr(), startTime, null);
        }

        // Ensure gobblers have a moment to flush
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private String handleProcessResult(ProcessExecution exec, String tool, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw processError("Non-zero exit: " + exitCode, tool, exitCode, exec.stderr(), startTime, null);
        }
        String output;
        synchronized (exec.stdout()) {
            output = exec.stdout().toString();
        }
        LOG.debug("{} finished in {}ms, stdout size={} chars", tool, TimeUtils.elapsedMillis(startTime),
                output.length());
        return output;
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxChars);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines from an input stream into a StringBuilder until capacity is reached, then keeps
     * draining without accumulating so the child process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxChars;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxChars) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxChars = maxChars;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxChars) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxChars - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private ProcessFailureException processError(String msg, String tool, int exitCode,
                                                 StringBuilder stderr, long startNano, Throwable cause) {
        String stderrSnippet;
        synchronized (stderr) {
            stderrSnippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        ProcessFailureExceptionBuilder builder = ProcessFailureExceptionBuilder.create(msg)
                .tool(tool)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("stderr", stderrSnippet.isEmpty() ? null : stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
