package com.phillippitts.jukebox.service.sequencer;

import com.phillippitts.jukebox.config.properties.SequencerProperties;
import com.phillippitts.jukebox.domain.PlaybackState;
import com.phillippitts.jukebox.domain.SourceKind;
import com.phillippitts.jukebox.domain.TrackInfo;
import com.phillippitts.jukebox.service.metrics.PlayerMetrics;
import com.phillippitts.jukebox.service.state.SharedPlaybackState;
import com.phillippitts.jukebox.testutil.TestWorkerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SequencerWorkerTest {

    private FakeSequencerClient client;
    private SharedPlaybackState state;
    private SimpleMeterRegistry registry;
    private SequencerWorker worker;

    @BeforeEach
    void setUp() {
        client = new FakeSequencerClient();
        state = new SharedPlaybackState(10);
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop();
        }
    }

    private SequencerWorker newWorker(Duration baseDelay, Duration maxDelay) {
        SequencerProperties props = new SequencerProperties("localhost", 6600, Duration.ofSeconds(1),
                Duration.ofMillis(20), baseDelay, maxDelay, Duration.ofMillis(500));
        return new SequencerWorker(client, props, TestWorkerProperties.fast(), state,
                new PlayerMetrics(registry));
    }

    @Test
    void volumeQueriesFailFastWhileDisconnected() {
        client.reachable = false;
        worker = newWorker(Duration.ofSeconds(5), Duration.ofSeconds(60));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(() -> client.connectAttempts.get() >= 1);

        long start = System.nanoTime();
        OptionalInt volume = worker.getVolume(Duration.ofSeconds(2));
        boolean applied = worker.setVolumeSync(50, Duration.ofSeconds(2));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(volume).isEmpty();
        assertThat(applied).isFalse();
        assertThat(elapsedMs).isLessThan(500);
    }

    @Test
    void commandsQueuedWhileDisconnectedRunAfterReconnect() {
        client.reachable = false;
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        worker.loadPlaylist("spotify:playlist:abc", true, true);
        worker.next();
        await().atMost(1, TimeUnit.SECONDS).until(() -> client.connectAttempts.get() >= 2);
        assertThat(client.calls).isEmpty();

        client.reachable = true;

        await().atMost(2, TimeUnit.SECONDS).until(() -> client.calls.size() >= 2);
        assertThat(client.calls).containsExactly("load spotify:playlist:abc shuffle=true", "next");
        assertThat(worker.isConnected()).isTrue();
    }

    @Test
    void toggleFollowsBackendPhase() {
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        client.phase = SequencerPhase.PLAYING;
        worker.start();

        worker.toggle();
        await().atMost(1, TimeUnit.SECONDS).until(() -> client.calls.contains("pause"));

        worker.toggle();
        await().atMost(1, TimeUnit.SECONDS).until(() -> client.calls.contains("play"));
        assertThat(client.calls).containsExactly("pause", "play");
    }

    @Test
    void synchronousVolumeRoundTripWhenConnected() {
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);

        assertThat(worker.setVolumeSync(35)).isTrue();
        assertThat(worker.getVolume()).hasValue(35);
    }

    @Test
    void missingMixerReportsNoVolume() {
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        client.volume = -1;
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);

        assertThat(worker.getVolume()).isEmpty();
    }

    @Test
    void connectionLossDuringCommandTriggersReconnect() {
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);
        client.failOnce = "next";

        worker.next();
        worker.previous();

        await().atMost(2, TimeUnit.SECONDS).until(() -> client.calls.contains("previous"));
        assertThat(client.connectAttempts.get()).isGreaterThanOrEqualTo(2);
        assertThat(client.calls).doesNotContain("next");
        assertThat(registry.find("jukebox.backend.connections").tag("outcome", "success").counter().count())
                .isGreaterThanOrEqualTo(2.0);
    }

    @Test
    void statusPollMirrorsBackendIntoSharedState() {
        state.mutate(s -> s.withActiveSourceKind(SourceKind.SEQUENCER));
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        client.phase = SequencerPhase.PLAYING;
        client.current = new TrackInfo("Song", "Artist", "Album", "spotify:track:1");
        client.time = new PlaybackTime(12.5, 180.0);
        worker.start();

        await().atMost(2, TimeUnit.SECONDS).until(() -> state.getSnapshot().playing());
        PlaybackState s = state.getSnapshot();
        assertThat(s.track()).map(TrackInfo::title).contains("Song");
        assertThat(s.position()).isEqualTo(12.5);
        assertThat(s.duration()).isEqualTo(180.0);

        client.phase = SequencerPhase.STOPPED;
        client.current = null;
        await().atMost(2, TimeUnit.SECONDS).until(() -> state.getSnapshot().track().isEmpty());
        assertThat(state.getSnapshot().playing()).isFalse();
    }

    @Test
    void statusPollLeavesStateAloneWhileVideoIsActive() {
        TrackInfo videoTrack = new TrackInfo("Live", "YouTube", "", "https://www.youtube.com/watch?v=x");
        state.mutate(s -> s.withActiveSourceKind(SourceKind.VIDEO).withPlaying(true).withCurrentTrack(videoTrack));
        client.phase = SequencerPhase.STOPPED;
        client.current = null;
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);

        await().during(300, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS)
                .until(() -> state.getSnapshot().playing());

        PlaybackState s = state.getSnapshot();
        assertThat(s.activeSourceKind()).isEqualTo(SourceKind.VIDEO);
        assertThat(s.track()).contains(videoTrack);
    }

    @Test
    void unexpectedFailureCompletesPendingVolumeReplyPromptly() {
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);
        client.volumeBug = new IllegalStateException("mixer parser bug");

        long start = System.nanoTime();
        OptionalInt volume = worker.getVolume(Duration.ofSeconds(5));

        assertThat(volume).isEmpty();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1000);
        await().atMost(2, TimeUnit.SECONDS).until(worker::isConnected);
    }

    @Test
    void volumeStepsStayWithinZeroAndMaxLimit() {
        client.volume = 78;
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);

        assertThat(worker.adjustVolume(5, 80)).hasValue(80);
        assertThat(worker.adjustVolume(5, 80)).hasValue(80);
        client.volume = 3;
        assertThat(worker.adjustVolume(-5, 80)).hasValue(0);
        assertThat(client.volume).isZero();
    }

    @Test
    void muteRemembersLevelAndRestoresIt() {
        client.volume = 60;
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);

        assertThat(worker.toggleMute()).contains(true);
        assertThat(worker.isMuted()).isTrue();
        assertThat(client.volume).isZero();

        assertThat(worker.toggleMute()).contains(false);
        assertThat(worker.isMuted()).isFalse();
        assertThat(client.volume).isEqualTo(60);
    }

    @Test
    void volumeStepWhileMutedStartsFromRememberedLevel() {
        client.volume = 40;
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);
        worker.toggleMute();

        assertThat(worker.adjustVolume(5, 100)).hasValue(45);
        assertThat(worker.isMuted()).isFalse();
    }

    @Test
    void muteWithoutMixerIsUnavailable() {
        client.volume = -1;
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);

        assertThat(worker.toggleMute()).isEqualTo(Optional.empty());
        assertThat(worker.adjustVolume(5, 100)).isEmpty();
        assertThat(worker.isConnected()).isTrue();
    }

    @Test
    void stepsAndMuteFailFastWhileDisconnected() {
        client.reachable = false;
        worker = newWorker(Duration.ofSeconds(5), Duration.ofSeconds(60));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(() -> client.connectAttempts.get() >= 1);

        assertThat(worker.adjustVolume(5, 100)).isEmpty();
        assertThat(worker.toggleMute()).isEmpty();
    }

    @Test
    void stopDisconnectsClient() {
        worker = newWorker(Duration.ofMillis(20), Duration.ofMillis(50));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(worker::isConnected);

        worker.stop();

        assertThat(worker.isAlive()).isFalse();
        assertThat(client.isConnected()).isFalse();
        assertThat(worker.isConnected()).isFalse();
    }

    @Test
    void stopInterruptsReconnectWait() {
        client.reachable = false;
        worker = newWorker(Duration.ofSeconds(30), Duration.ofSeconds(60));
        worker.start();
        await().atMost(1, TimeUnit.SECONDS).until(() -> client.connectAttempts.get() >= 1);

        long start = System.nanoTime();
        worker.stop();

        assertThat(worker.isAlive()).isFalse();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(2000);
    }
}
