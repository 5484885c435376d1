package com.phillippitts.jukebox.service.worker;

import com.phillippitts.jukebox.config.properties.WorkerProperties;
import com.phillippitts.jukebox.service.metrics.PlayerMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-lived worker owning one playback backend, driven by a bounded command queue.
 *
 * <p>Each worker runs on its own daemon thread. An iteration of the loop:
 * <ol>
 *   <li>asks {@link #ready()} whether commands may be processed (a worker may use it to connect
 *       and back off),</li>
 *   <li>blocks on the queue until the next status poll is due (capped by the dequeue timeout)
 *       and processes at most one command,</li>
 *   <li>calls {@link #pollStatus()} when the poll interval has elapsed.</li>
 * </ol>
 *
 * <p>Shutdown is a command ({@link #shutdownCommand()}), so work queued before a stop request is
 * processed first. If the queue was saturated and the shutdown command got dropped, the worker
 * still exits as soon as its queue runs empty after {@link #stop()}.
 *
 * <p>Subclasses mutate their own backend state only from the worker thread.
 *
 * @param <C> command type understood by this worker
 */
public abstract class BackendWorker<C> {

    private static final Logger LOG = LogManager.getLogger(BackendWorker.class);

    private final String name;
    private final CommandQueue<C> queue;
    private final PlayerMetrics metrics;
    private final Duration pollInterval;
    private final Duration dequeueTimeout;
    private final Duration joinTimeout;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch stopRequested = new CountDownLatch(1);
    private volatile boolean running;
    private volatile Thread thread;
    private long nextPollNanos;

    protected BackendWorker(String name,
                            PlayerMetrics metrics,
                            Duration pollInterval,
                            WorkerProperties workerProps) {
        this.name = Objects.requireNonNull(name, "name");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.dequeueTimeout = workerProps.getDequeueTimeout();
        this.joinTimeout = workerProps.getJoinTimeout();
        this.queue = new CommandQueue<>(name, workerProps.getQueueCapacity(), metrics);
    }

    /**
     * Queues a command without blocking. A full queue drops the command (logged, counted).
     *
     * @return whether the command was accepted
     */
    public boolean enqueue(C command) {
        return queue.enqueue(command);
    }

    /** Starts the worker thread. Idempotent. */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        running = true;
        Thread t = new Thread(this::runLoop, name);
        t.setDaemon(true);
        thread = t;
        t.start();
        LOG.info("{} started", name);
    }

    /**
     * Requests shutdown through the queue and waits up to the join timeout.
     * Logs a warning, without throwing, if the thread is still alive afterwards.
     */
    public void stop() {
        Thread t = thread;
        if (t == null || !t.isAlive()) {
            return;
        }
        stopRequested.countDown();
        queue.enqueue(shutdownCommand());
        try {
            t.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.warn("{} did not stop within {}ms", name, joinTimeout.toMillis());
        }
    }

    /** True once {@link #start()} has been called, even if the thread has since finished. */
    public boolean hasStarted() {
        return started.get();
    }

    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public String name() {
        return name;
    }

    public int pendingCommands() {
        return queue.size();
    }

    // ---- hooks ------------------------------------------------------------------------------

    /** Executes one command on the worker thread. */
    protected abstract void handle(C command);

    /** True when the command is this worker's shutdown command. */
    protected abstract boolean isShutdown(C command);

    /** Creates the shutdown command sent by {@link #stop()}. */
    protected abstract C shutdownCommand();

    /** Periodic status check; exceptions are logged at debug level and skipped. */
    protected void pollStatus() {
    }

    /**
     * Called before each receive. Returning false skips the receive for this iteration.
     */
    protected boolean ready() throws InterruptedException {
        return true;
    }

    /** Called on the worker thread before the first iteration. */
    protected void onStart() {
    }

    /** Called on the worker thread after the loop ends; releases owned resources. */
    protected void onStop() {
    }

    /** Called after an unexpected exception escaped an iteration. */
    protected void onLoopError(RuntimeException e) {
    }

    /** Called for each command still queued when the worker exits. */
    protected void discard(C command) {
        LOG.debug("{} discarding {} on shutdown", name, command);
    }

    /**
     * Sleeps for {@code delay} unless a stop is requested meanwhile.
     * A stop request ends the loop; queued commands are discarded.
     *
     * @return true if the worker is stopping
     */
    protected final boolean sleepUnlessStopping(Duration delay) throws InterruptedException {
        if (stopRequested.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
            running = false;
            return true;
        }
        return false;
    }

    // ---- loop -------------------------------------------------------------------------------

    private void runLoop() {
        ThreadContext.put("worker", name);
        try {
            onStart();
            nextPollNanos = System.nanoTime() + pollInterval.toNanos();
            while (running) {
                try {
                    runIteration();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("{} interrupted; stopping", name);
                    running = false;
                } catch (RuntimeException e) {
                    LOG.error("{} loop error: {}", name, e.toString(), e);
                    onLoopError(e);
                }
            }
        } finally {
            for (C pending : queue.drain()) {
                discard(pending);
            }
            try {
                onStop();
            } catch (RuntimeException e) {
                LOG.warn("{} cleanup failed: {}", name, e.toString());
            }
            LOG.info("{} stopped", name);
            ThreadContext.clearAll();
        }
    }

    private void runIteration() throws InterruptedException {
        if (!ready()) {
            return;
        }
        C command = queue.poll(nextWait());
        if (command != null) {
            dispatch(command);
        } else if (stopRequested.getCount() == 0) {
            running = false;
            return;
        }
        if (running && System.nanoTime() - nextPollNanos >= 0) {
            try {
                pollStatus();
            } catch (RuntimeException e) {
                LOG.debug("{} status poll failed: {}", name, e.toString());
            }
            nextPollNanos = System.nanoTime() + pollInterval.toNanos();
        }
    }

    private Duration nextWait() {
        long untilPoll = nextPollNanos - System.nanoTime();
        return Duration.ofNanos(Math.max(0L, Math.min(untilPoll, dequeueTimeout.toNanos())));
    }

    private void dispatch(C command) {
        if (isShutdown(command)) {
            LOG.debug("{} received shutdown", name);
            running = false;
            return;
        }
        handle(command);
        metrics.commandProcessed(name);
    }
}
