package com.phillippitts.jukebox;

import com.phillippitts.jukebox.service.button.ButtonHook;
import com.phillippitts.jukebox.service.button.NoopButtonHook;
import com.phillippitts.jukebox.service.player.PlayerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        // nothing listens on port 1, so the sequencer stays disconnected
        "jukebox.sequencer.port=1",
        "jukebox.sources.data-dir=target/test-data/context",
        "jukebox.announcer.enabled=false",
        "jukebox.video.resolver-binary=jukebox-test-missing-yt-dlp"
    }
)
class JukeboxApplicationTests {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private PlayerService player;

    @Autowired
    private ButtonHook buttonHook;

    @Test
    void contextLoads() {
        assertThat(player.isRunning()).isTrue();
        assertThat(player.isReady()).isTrue();
        assertThat(buttonHook).isInstanceOf(NoopButtonHook.class);
    }

    @Test
    void healthIsDegradedButServed() {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator/health", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("\"player\"").contains("DEGRADED");
    }

    @Test
    void defaultSourcesAreServed() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/sources", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("spotify_playlist").contains("youtube_channel");
    }
}
