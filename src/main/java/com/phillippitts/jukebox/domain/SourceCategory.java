package com.phillippitts.jukebox.domain;

import java.util.Locale;

/**
 * Category of a media source, spoken as the first word of a source announcement.
 */
public enum SourceCategory {
    MUSIC,
    NEWS;

    /** Lower-case name used in persisted data and announcements. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MUSIC;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
