package com.phillippitts.jukebox.service.persistence;

import com.phillippitts.jukebox.domain.MediaSource;
import com.phillippitts.jukebox.domain.SourceCategory;

import java.util.List;

/**
 * Built-in rotation used when no sources are persisted: one playlist and one channel.
 */
public final class DefaultSources {

    private DefaultSources() {}

    public static List<MediaSource> list() {
        return List.of(
                MediaSource.playlist("My Favorite Playlist",
                        "spotify:playlist:37i9dQZF1DXcBWIGoYBM5M", SourceCategory.MUSIC),
                MediaSource.channel("Lofi Hip Hop",
                        "https://www.youtube.com/@LofiGirl", SourceCategory.MUSIC));
    }
}
