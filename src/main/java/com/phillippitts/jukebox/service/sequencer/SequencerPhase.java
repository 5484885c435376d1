package com.phillippitts.jukebox.service.sequencer;

/**
 * Transport state reported by the sequencer.
 */
public enum SequencerPhase {
    PLAYING,
    PAUSED,
    STOPPED;

    /**
     * Maps the MPD {@code state} field ({@code play}, {@code pause}, {@code stop}).
     * Unknown or missing values are treated as stopped.
     */
    public static SequencerPhase fromMpdState(String state) {
        if ("play".equals(state)) {
            return PLAYING;
        }
        if ("pause".equals(state)) {
            return PAUSED;
        }
        return STOPPED;
    }
}
