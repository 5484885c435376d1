package com.phillippitts.jukebox.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Source rotation and persistence settings.
 *
 * @param dataDir      directory holding sources.json, state.json and watched_videos.json
 * @param saveDebounce delay that coalesces rapid rotations into one index write
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.sources")
public record SourceProperties(
        @DefaultValue("data")
        @NotBlank
        String dataDir,

        @DefaultValue("500ms")
        Duration saveDebounce
) {
}
