package com.phillippitts.jukebox.domain;

/**
 * Kind of a configured media source and the backend that plays it.
 */
public enum MediaSourceKind {
    SEQUENCER_PLAYLIST("spotify_playlist", SourceKind.SEQUENCER),
    VIDEO_CHANNEL("youtube_channel", SourceKind.VIDEO);

    private final String wireName;
    private final SourceKind sourceKind;

    MediaSourceKind(String wireName, SourceKind sourceKind) {
        this.wireName = wireName;
        this.sourceKind = sourceKind;
    }

    /** Name used in persisted source lists. */
    public String wireName() {
        return wireName;
    }

    /** Backend that owns playback for sources of this kind. */
    public SourceKind sourceKind() {
        return sourceKind;
    }

    /**
     * Resolves a persisted type name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MediaSourceKind fromWireName(String name) {
        for (MediaSourceKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown media source type: " + name);
    }
}
