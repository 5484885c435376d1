package com.phillippitts.jukebox.service.video;

import java.util.List;

/**
 * Lists the items of a channel and resolves them to playable streams.
 *
 * <p>Both operations throw {@link com.phillippitts.jukebox.exception.ResourceUnavailableException}
 * when the underlying tool is missing.
 */
public interface VideoSource {

    /**
     * Lists up to {@code maxCount} items of a channel, newest first.
     *
     * @return items; empty when the channel cannot be listed
     */
    List<VideoItem> listItems(String locator, int maxCount);

    /**
     * Resolves the direct audio stream URL of an item.
     *
     * @throws com.phillippitts.jukebox.exception.StreamUnavailableException when no stream can be
     *         resolved, e.g. for a live stream that has not started yet
     */
    String resolvePlayableUrl(String itemUrl);
}
