package com.phillippitts.jukebox.service.health;

import com.phillippitts.jukebox.service.announce.AnnouncerWorker;
import com.phillippitts.jukebox.service.sequencer.SequencerWorker;
import com.phillippitts.jukebox.service.video.VideoWorker;
import com.phillippitts.jukebox.service.worker.BackendWorker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the playback workers.
 *
 * <ul>
 *   <li>UP: every worker running, sequencer connected, video and announcements enabled</li>
 *   <li>DEGRADED: workers running but a backend is disconnected or disabled</li>
 *   <li>DOWN: a worker was never started or its thread died</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class PlayerHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final SequencerWorker sequencer;
    private final VideoWorker video;
    private final AnnouncerWorker announcer;

    public PlayerHealthIndicator(SequencerWorker sequencer,
                                 VideoWorker video,
                                 AnnouncerWorker announcer) {
        this.sequencer = sequencer;
        this.video = video;
        this.announcer = announcer;
    }

    @Override
    public Health health() {
        boolean allRunning = running(sequencer) && running(video) && running(announcer);
        boolean connected = sequencer.isConnected();
        boolean videoEnabled = !video.isDisabled();
        boolean announcerEnabled = !announcer.isDisabled();

        Health.Builder builder = new Health.Builder();
        if (!allRunning) {
            builder.down().withDetail("status", "Playback workers not running");
        } else if (connected && videoEnabled && announcerEnabled) {
            builder.up().withDetail("status", "All backends operational");
        } else {
            builder.status(DEGRADED).withDetail("status", "Partial backend availability");
        }

        return builder
                .withDetail("sequencer", workerStatus(sequencer, connected ? "connected" : "disconnected"))
                .withDetail("video", workerStatus(video, videoEnabled ? "ready" : "disabled"))
                .withDetail("announcer", workerStatus(announcer, announcerEnabled ? "ready" : "disabled"))
                .build();
    }

    private static boolean running(BackendWorker<?> worker) {
        return worker.hasStarted() && worker.isAlive();
    }

    private static String workerStatus(BackendWorker<?> worker, String backendStatus) {
        if (!worker.hasStarted()) {
            return "not started";
        }
        return worker.isAlive() ? backendStatus : "stopped";
    }
}
