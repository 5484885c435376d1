package com.phillippitts.jukebox.util;

import java.time.Duration;

/**
 * Standard timeout values for external process and thread management.
 *
 * <p>Used by {@link com.phillippitts.jukebox.service.process.PlayerProcess} and
 * {@link com.phillippitts.jukebox.service.process.ProcessRunner}.
 *
 * @see com.phillippitts.jukebox.service.process.PlayerProcess
 * @see com.phillippitts.jukebox.service.process.ProcessRunner
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort, daemon threads).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Grace period after {@link Process#destroy()} before a player is killed forcibly.
     *
     * <p>Media players flush audio buffers and release the sound device on SIGTERM;
     * most exit well inside this window.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Deadline for {@link Process#destroyForcibly()} to take effect.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
