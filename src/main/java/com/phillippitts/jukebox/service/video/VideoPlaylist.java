package com.phillippitts.jukebox.service.video;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Items of the current channel plus a cursor, with the unwatched-first selection rules.
 *
 * <p>Selection scans circularly from the cursor and stops at the first unwatched item. When every
 * item has been watched, the cursor returns to the first item so the channel loops.
 */
public final class VideoPlaylist {

    private static final Logger LOG = LogManager.getLogger(VideoPlaylist.class);

    private final List<VideoItem> items;
    private int index;

    public VideoPlaylist(List<VideoItem> items) {
        this.items = List.copyOf(items);
        this.index = 0;
    }

    public static VideoPlaylist empty() {
        return new VideoPlaylist(List.of());
    }

    /**
     * Moves the cursor to the first unwatched item at or after it.
     *
     * @param watched tells whether an item id has been played
     * @return selected item; empty only for an empty playlist
     */
    public Optional<VideoItem> selectNextUnwatched(Predicate<String> watched) {
        if (items.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < items.size(); i++) {
            int idx = (index + i) % items.size();
            if (!watched.test(items.get(idx).id())) {
                index = idx;
                return Optional.of(items.get(idx));
            }
        }
        LOG.info("All {} items watched, looping to the first", items.size());
        index = 0;
        return Optional.of(items.get(0));
    }

    /** Steps past the current item and selects the next unwatched one. */
    public Optional<VideoItem> advance(Predicate<String> watched) {
        if (items.isEmpty()) {
            return Optional.empty();
        }
        index = (index + 1) % items.size();
        return selectNextUnwatched(watched);
    }

    /** Steps back one item; the previous item is returned even if already watched. */
    public Optional<VideoItem> retreat() {
        if (items.isEmpty()) {
            return Optional.empty();
        }
        index = Math.floorMod(index - 1, items.size());
        return Optional.of(items.get(index));
    }

    public Optional<VideoItem> current() {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(index));
    }

    public int currentIndex() {
        return index;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
