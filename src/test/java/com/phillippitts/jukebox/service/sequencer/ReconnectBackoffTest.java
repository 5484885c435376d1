package com.phillippitts.jukebox.service.sequencer;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectBackoffTest {

    @Test
    void delayGrowsByHalfAndCapsAtMax() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(5), Duration.ofSeconds(60));

        assertThat(backoff.onFailure()).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.onFailure()).isEqualTo(Duration.ofMillis(7500));
        assertThat(backoff.onFailure()).isEqualTo(Duration.ofMillis(11250));
        for (int i = 0; i < 10; i++) {
            backoff.onFailure();
        }
        assertThat(backoff.currentDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.onFailure()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void successResetsDelayToBase() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(5), Duration.ofSeconds(60));
        backoff.onFailure();
        backoff.onFailure();

        backoff.connecting();
        assertThat(backoff.phase()).isEqualTo(ReconnectBackoff.Phase.CONNECTING);
        backoff.onSuccess();

        assertThat(backoff.isConnected()).isTrue();
        assertThat(backoff.currentDelay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void disconnectKeepsDelay() {
        ReconnectBackoff backoff = new ReconnectBackoff(Duration.ofSeconds(5), Duration.ofSeconds(60));
        backoff.onSuccess();
        backoff.onDisconnect();

        assertThat(backoff.phase()).isEqualTo(ReconnectBackoff.Phase.DISCONNECTED);
        assertThat(backoff.currentDelay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void rejectsMaxBelowBase() {
        assertThatThrownBy(() -> new ReconnectBackoff(Duration.ofSeconds(10), Duration.ofSeconds(5)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
