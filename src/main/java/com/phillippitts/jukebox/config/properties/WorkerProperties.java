package com.phillippitts.jukebox.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings shared by all backend workers (command queue sizing and thread lifecycle).
 *
 * <p>Example application.properties:
 * <pre>
 * jukebox.worker.queue-capacity=64
 * jukebox.worker.dequeue-timeout=100ms
 * jukebox.worker.join-timeout=5s
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.worker")
public class WorkerProperties {

    /** Maximum number of pending commands per worker; newer commands are dropped beyond this. */
    @Positive(message = "Queue capacity must be positive")
    private int queueCapacity = 64;

    /** Upper bound for a single blocking receive on the command queue. */
    @NotNull
    private Duration dequeueTimeout = Duration.ofMillis(100);

    /** How long stop() waits for a worker thread to finish. */
    @NotNull
    private Duration joinTimeout = Duration.ofSeconds(5);

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public Duration getDequeueTimeout() {
        return dequeueTimeout;
    }

    public void setDequeueTimeout(Duration dequeueTimeout) {
        this.dequeueTimeout = dequeueTimeout;
    }

    public Duration getJoinTimeout() {
        return joinTimeout;
    }

    public void setJoinTimeout(Duration joinTimeout) {
        this.joinTimeout = joinTimeout;
    }
}
