package com.phillippitts.jukebox.domain;

import java.util.Objects;

/**
 * Metadata of the item currently playing on a backend.
 *
 * @param title  track or video title
 * @param artist artist name ("YouTube" for video items)
 * @param album  album name, empty when unknown
 * @param uri    backend-specific locator of the item
 */
public record TrackInfo(String title, String artist, String album, String uri) {

    public TrackInfo {
        title = Objects.requireNonNullElse(title, "Unknown");
        artist = Objects.requireNonNullElse(artist, "Unknown Artist");
        album = Objects.requireNonNullElse(album, "");
        uri = Objects.requireNonNullElse(uri, "");
    }
}
