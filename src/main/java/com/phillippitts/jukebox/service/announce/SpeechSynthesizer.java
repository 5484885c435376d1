package com.phillippitts.jukebox.service.announce;

import java.nio.file.Path;

/**
 * Text-to-speech backend writing audio files.
 */
public interface SpeechSynthesizer {

    /**
     * Synthesizes {@code text} into {@code target}.
     *
     * @return the written file
     * @throws com.phillippitts.jukebox.exception.SynthesisException if no audio was produced
     * @throws com.phillippitts.jukebox.exception.ResourceUnavailableException if the voice model
     *         or the synthesizer binary is missing
     */
    Path synthesize(String text, Path target);
}
