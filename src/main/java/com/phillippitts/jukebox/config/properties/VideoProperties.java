package com.phillippitts.jukebox.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for channel-based video playback (yt-dlp for listing and stream resolution).
 *
 * @param resolverBinary yt-dlp executable
 * @param maxItems       maximum number of items fetched from a channel
 * @param pollInterval   how often the worker checks whether the player process finished
 * @param listTimeout    timeout for listing a channel
 * @param resolveTimeout timeout for resolving a playable stream URL
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.video")
public record VideoProperties(
        @DefaultValue("yt-dlp")
        @NotBlank
        String resolverBinary,

        @DefaultValue("50")
        @Positive
        int maxItems,

        @DefaultValue("500ms")
        Duration pollInterval,

        @DefaultValue("30s")
        Duration listTimeout,

        @DefaultValue("30s")
        Duration resolveTimeout
) {
}
