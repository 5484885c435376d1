package com.phillippitts.jukebox.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection and timing settings for the music sequencer (MPD protocol server, e.g. Mopidy).
 *
 * @param host               sequencer host name
 * @param port               sequencer TCP port
 * @param connectTimeout     socket connect and read timeout
 * @param pollInterval       interval between status polls while connected
 * @param reconnectBaseDelay first delay after a failed connection attempt
 * @param reconnectMaxDelay  cap for the geometric reconnect backoff
 * @param volumeTimeout      how long a synchronous volume request may block its caller
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.sequencer")
public record SequencerProperties(
        @DefaultValue("localhost")
        @NotBlank(message = "Sequencer host must not be blank")
        String host,

        @DefaultValue("6600")
        @Min(1) @Max(65535)
        int port,

        @DefaultValue("3s")
        Duration connectTimeout,

        @DefaultValue("1500ms")
        Duration pollInterval,

        @DefaultValue("5s")
        Duration reconnectBaseDelay,

        @DefaultValue("60s")
        Duration reconnectMaxDelay,

        @DefaultValue("2s")
        Duration volumeTimeout
) {
    public SequencerProperties {
        if (reconnectMaxDelay.compareTo(reconnectBaseDelay) < 0) {
            throw new IllegalArgumentException("reconnectMaxDelay must not be shorter than reconnectBaseDelay");
        }
    }
}
