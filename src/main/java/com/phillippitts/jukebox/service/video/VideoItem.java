package com.phillippitts.jukebox.service.video;

import java.util.Objects;

/**
 * One entry of a channel listing.
 *
 * @param id    stable item id, used for watched tracking
 * @param title display title
 * @param url   page URL from which a playable stream is resolved
 */
public record VideoItem(String id, String title, String url) {

    static final String WATCH_URL_PREFIX = "https://www.youtube.com/watch?v=";

    public VideoItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        title = title == null || title.isBlank() ? "Unknown" : title;
        Objects.requireNonNull(url, "url");
    }

    /** Builds an item whose page URL is derived from its id. */
    public static VideoItem ofId(String id, String title) {
        return new VideoItem(id, title, WATCH_URL_PREFIX + id);
    }
}
