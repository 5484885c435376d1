package com.phillippitts.jukebox.service.persistence;

import com.phillippitts.jukebox.domain.MediaSource;

import java.util.Collection;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Durable storage for the source list, the current source index and watched video ids.
 *
 * <p>All methods throw {@link com.phillippitts.jukebox.exception.PersistenceException} when the
 * store is unavailable. Callers fall back to in-memory values and log a warning; persistence
 * problems never stop playback.
 */
public interface PersistenceStore {

    /**
     * @return persisted sources in rotation order; empty when none are stored
     */
    List<MediaSource> loadSources();

    void saveSources(List<MediaSource> sources);

    /**
     * @return persisted current source index, empty when never saved
     */
    OptionalInt loadCurrentIndex();

    void saveCurrentIndex(int index);

    Set<String> loadWatchedIds();

    /** Replaces the stored watched ids with {@code ids}. */
    void saveWatchedIds(Collection<String> ids);
}
