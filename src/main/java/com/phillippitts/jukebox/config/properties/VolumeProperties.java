package com.phillippitts.jukebox.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Volume control settings shared by the buttons, the rotary encoder bridge and the HTTP API.
 *
 * @param maxLimit upper bound for every volume change, 0-100; can be changed at runtime
 * @param step     change applied by one volume up or down step
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.volume")
public record VolumeProperties(
        @DefaultValue("100")
        @Min(0) @Max(100)
        int maxLimit,

        @DefaultValue("5")
        @Min(1) @Max(10)
        int step
) {
}
