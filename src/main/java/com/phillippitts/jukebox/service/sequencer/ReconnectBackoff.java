package com.phillippitts.jukebox.service.sequencer;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection phase and geometric reconnect delay of a persistent-connection worker.
 *
 * <p>The delay stays within {@code [base, max]}: it grows by a factor of 1.5 after each failed
 * attempt and returns to {@code base} after a successful connection.
 *
 * <p>Not thread-safe; owned and mutated by a single worker thread.
 */
public final class ReconnectBackoff {

    static final double MULTIPLIER = 1.5;

    public enum Phase { DISCONNECTED, CONNECTING, CONNECTED }

    private final Duration baseDelay;
    private final Duration maxDelay;
    private Duration currentDelay;
    private Phase phase = Phase.DISCONNECTED;

    public ReconnectBackoff(Duration baseDelay, Duration maxDelay) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("require 0 <= baseDelay <= maxDelay");
        }
        this.currentDelay = baseDelay;
    }

    public void connecting() {
        phase = Phase.CONNECTING;
    }

    /** Marks the connection established and resets the delay to base. */
    public void onSuccess() {
        phase = Phase.CONNECTED;
        currentDelay = baseDelay;
    }

    /**
     * Marks the attempt failed.
     *
     * @return the delay to wait before the next attempt; the stored delay then grows
     */
    public Duration onFailure() {
        phase = Phase.DISCONNECTED;
        Duration wait = currentDelay;
        long grown = (long) (currentDelay.toNanos() * MULTIPLIER);
        currentDelay = Duration.ofNanos(Math.min(grown, maxDelay.toNanos()));
        return wait;
    }

    /** Drops an established connection without touching the delay. */
    public void onDisconnect() {
        phase = Phase.DISCONNECTED;
    }

    public Phase phase() {
        return phase;
    }

    public boolean isConnected() {
        return phase == Phase.CONNECTED;
    }

    public Duration currentDelay() {
        return currentDelay;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }
}
