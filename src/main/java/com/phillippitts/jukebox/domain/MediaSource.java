package com.phillippitts.jukebox.domain;

import java.util.Objects;

/**
 * A playable source in the rotation: a sequencer playlist or a video channel.
 *
 * @param kind        playlist or channel
 * @param displayName human-readable name, spoken when the source is selected
 * @param locator     playlist URI or channel URL
 * @param category    music or news
 */
public record MediaSource(MediaSourceKind kind, String displayName, String locator, SourceCategory category) {

    public MediaSource {
        Objects.requireNonNull(kind, "kind must not be null");
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName must not be blank");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator must not be blank");
        }
        category = category == null ? SourceCategory.MUSIC : category;
    }

    public static MediaSource playlist(String displayName, String uri, SourceCategory category) {
        return new MediaSource(MediaSourceKind.SEQUENCER_PLAYLIST, displayName, uri, category);
    }

    public static MediaSource channel(String displayName, String url, SourceCategory category) {
        return new MediaSource(MediaSourceKind.VIDEO_CHANNEL, displayName, url, category);
    }

    /** Text spoken when this source becomes current, e.g. {@code "news, Morning Briefing"}. */
    public String announcementText() {
        return category.label() + ", " + displayName;
    }
}
