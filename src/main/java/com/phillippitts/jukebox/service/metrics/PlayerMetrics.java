package com.phillippitts.jukebox.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer instrumentation for the playback workers.
 *
 * <p>Provides counters for:
 * <ul>
 *   <li>Commands processed and dropped per worker</li>
 *   <li>Sequencer reconnect attempts and successful connections</li>
 *   <li>Video items skipped because their stream could not be resolved</li>
 * </ul>
 *
 * <p>Exposed via /actuator/prometheus.
 */
@Component
public class PlayerMetrics {

    private static final String METRIC_PREFIX = "jukebox";

    private final MeterRegistry registry;

    public PlayerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void commandProcessed(String worker) {
        Counter.builder(METRIC_PREFIX + ".worker.commands.processed")
                .description("Commands taken from a worker queue and executed")
                .tag("worker", worker)
                .register(registry)
                .increment();
    }

    public void commandDropped(String worker) {
        Counter.builder(METRIC_PREFIX + ".worker.commands.dropped")
                .description("Commands dropped because the worker queue was full")
                .tag("worker", worker)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success" or "failure"
     */
    public void connectionAttempt(String backend, String outcome) {
        Counter.builder(METRIC_PREFIX + ".backend.connections")
                .description("Backend connection attempts")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void itemSkipped(String reason) {
        Counter.builder(METRIC_PREFIX + ".video.items.skipped")
                .description("Video items skipped during selection")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
