package com.phillippitts.jukebox.service.process;

import com.phillippitts.jukebox.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * Scoped handle on a running media player process.
 *
 * <p>{@link #close()} always ends the process: a graceful terminate first, then a forced kill
 * once the grace period has passed. Closing is idempotent, so a handle can be closed on every
 * exit path of its owner.
 *
 * <p>Owned by a single worker thread.
 */
public final class PlayerProcess implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(PlayerProcess.class);

    private final Process process;
    private final String label;
    private final Duration terminateGrace;
    private boolean closed;

    public PlayerProcess(Process process, String label, Duration terminateGrace) {
        this.process = Objects.requireNonNull(process, "process");
        this.label = Objects.requireNonNull(label, "label");
        this.terminateGrace = terminateGrace != null ? terminateGrace : ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT;
    }

    public boolean isRunning() {
        return process.isAlive();
    }

    /** Exit code once the process has finished. */
    public OptionalInt exitCode() {
        if (process.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(process.exitValue());
    }

    public String label() {
        return label;
    }

    /**
     * Terminates the process if still running, waiting up to the grace period before killing it.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(terminateGrace.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                LOG.warn("Player '{}' ignored terminate for {}ms; killing", label, terminateGrace.toMillis());
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Player '{}' still alive after destroyForcibly", label);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            LOG.warn("Interrupted while stopping player '{}'", label);
        }
        LOG.debug("Player '{}' stopped", label);
    }
}
