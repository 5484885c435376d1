package com.phillippitts.jukebox.service.worker;

import com.phillippitts.jukebox.service.metrics.PlayerMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO of commands for a single worker.
 *
 * <p>Producers never block: {@link #enqueue} returns immediately and, when the queue is full,
 * drops the new command with a warning and a metric. Only the owning worker consumes.
 *
 * @param <C> command type of the worker
 */
public final class CommandQueue<C> {

    private static final Logger LOG = LogManager.getLogger(CommandQueue.class);

    private final String name;
    private final BlockingQueue<C> queue;
    private final int capacity;
    private final PlayerMetrics metrics;

    public CommandQueue(String name, int capacity, PlayerMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Offers a command without blocking.
     *
     * @param command command to queue
     * @return false if the queue was full and the command was dropped
     */
    public boolean enqueue(C command) {
        Objects.requireNonNull(command, "command");
        if (queue.offer(command)) {
            return true;
        }
        LOG.warn("{} command queue full (capacity={}), dropping {}", name, capacity, command);
        metrics.commandDropped(name);
        return false;
    }

    /**
     * Waits up to {@code timeout} for the next command.
     *
     * @return next command, or null on timeout
     */
    C poll(Duration timeout) throws InterruptedException {
        long nanos = Math.max(0L, timeout.toNanos());
        return queue.poll(nanos, TimeUnit.NANOSECONDS);
    }

    /** Removes and returns all pending commands in FIFO order. */
    List<C> drain() {
        List<C> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        return remaining;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }
}
