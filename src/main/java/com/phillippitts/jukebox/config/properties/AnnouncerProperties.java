package com.phillippitts.jukebox.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for spoken announcements (Piper text-to-speech).
 *
 * <p>Example application.properties:
 * <pre>
 * jukebox.announcer.cache-dir=data/piper
 * jukebox.announcer.voice-model-path=models/en_US-lessac-medium.onnx
 * jukebox.announcer.duck-volume=40
 * </pre>
 *
 * @param enabled            announcements on/off
 * @param cacheDir           directory of synthesized audio, keyed by text hash
 * @param voiceModelPath     Piper voice model; announcements are disabled when missing
 * @param synthesizerBinary  Piper executable
 * @param synthesisTimeout   timeout for a single synthesis run
 * @param pollInterval       how often the worker checks whether the announcement finished
 * @param duckVolume         sequencer volume while an announcement plays; 0 disables ducking
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.announcer")
public record AnnouncerProperties(
        @DefaultValue("true")
        boolean enabled,

        @DefaultValue("data/piper")
        @NotBlank
        String cacheDir,

        String voiceModelPath,

        @DefaultValue("piper")
        @NotBlank
        String synthesizerBinary,

        @DefaultValue("30s")
        Duration synthesisTimeout,

        @DefaultValue("200ms")
        Duration pollInterval,

        @DefaultValue("0")
        @Min(0) @Max(100)
        int duckVolume
) {
}
