package com.phillippitts.jukebox.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * External media player used for video streams and announcements (mpv by default).
 *
 * @param binary        player executable
 * @param arguments     arguments placed before the playback target
 * @param terminateGrace time between a graceful terminate and a forced kill
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.player")
public record PlayerProcessProperties(
        @DefaultValue("mpv")
        @NotBlank
        String binary,

        @DefaultValue({"--no-video", "--really-quiet"})
        List<String> arguments,

        @DefaultValue("5s")
        Duration terminateGrace
) {
    public PlayerProcessProperties {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
