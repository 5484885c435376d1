package com.phillippitts.jukebox.domain;

/**
 * Which backend currently owns audio output. At most one kind is active at a time.
 */
public enum SourceKind {
    NONE,
    SEQUENCER,
    VIDEO
}
