package com.phillippitts.jukebox.service.sequencer;

/**
 * Elapsed time and total length of the current item, in seconds. Either may be null when unknown.
 */
public record PlaybackTime(Double position, Double duration) {

    private static final PlaybackTime UNKNOWN = new PlaybackTime(null, null);

    public static PlaybackTime unknown() {
        return UNKNOWN;
    }
}
