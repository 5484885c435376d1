package com.phillippitts.jukebox.service.process;

import com.phillippitts.jukebox.config.properties.PlayerProcessProperties;
import com.phillippitts.jukebox.exception.ResourceUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.phillippitts.jukebox.testutil.ProcessTestDoubles.ProcessBehavior;
import static com.phillippitts.jukebox.testutil.ProcessTestDoubles.RecordingProcessFactory;
import static com.phillippitts.jukebox.testutil.ProcessTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlayerProcessTest {

    private final PlayerProcessProperties props =
            new PlayerProcessProperties("mpv", List.of("--no-video", "--really-quiet"), Duration.ofMillis(200));

    @Test
    void launcherPassesConfiguredArgumentsBeforeTarget() {
        RecordingProcessFactory factory = RecordingProcessFactory.longRunning();
        MediaPlayerLauncher launcher = new MediaPlayerLauncher(props, factory);

        try (PlayerProcess player = launcher.play("https://stream.example/audio", "Video A")) {
            assertThat(player.isRunning()).isTrue();
            assertThat(player.label()).isEqualTo("Video A");
        }

        assertThat(factory.commands).containsExactly(
                List.of("mpv", "--no-video", "--really-quiet", "https://stream.example/audio"));
        assertThat(factory.last().wasDestroyCalled()).isTrue();
    }

    @Test
    void closeIsIdempotentAndSkipsFinishedProcess() {
        TestProcess tp = new TestProcess(ProcessBehavior.longRunning());
        PlayerProcess player = new PlayerProcess(tp, "clip", Duration.ofMillis(100));
        tp.exit();

        assertThat(player.exitCode()).hasValue(0);
        player.close();
        player.close();

        assertThat(tp.wasDestroyCalled()).isFalse();
    }

    @Test
    void missingPlayerBinaryIsResourceUnavailable() {
        RecordingProcessFactory factory = RecordingProcessFactory.longRunning();
        factory.failToStart(true);
        MediaPlayerLauncher launcher = new MediaPlayerLauncher(props, factory);

        assertThatThrownBy(() -> launcher.play("/tmp/a.wav", "announcement"))
                .isInstanceOf(ResourceUnavailableException.class)
                .hasMessageContaining("mpv");
    }
}
