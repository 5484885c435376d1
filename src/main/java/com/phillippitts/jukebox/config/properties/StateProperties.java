package com.phillippitts.jukebox.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Shared playback state settings.
 *
 * @param eventLogCapacity number of button events retained; oldest are evicted first
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.state")
public record StateProperties(
        @DefaultValue("100")
        @Positive
        int eventLogCapacity
) {
}
