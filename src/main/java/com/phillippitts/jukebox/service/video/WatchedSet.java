package com.phillippitts.jukebox.service.video;

import com.phillippitts.jukebox.exception.PersistenceException;
import com.phillippitts.jukebox.service.persistence.PersistenceStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Ids of video items that have been played. Grows monotonically; each addition is persisted.
 *
 * <p>Confined to the video worker thread.
 */
public final class WatchedSet {

    private static final Logger LOG = LogManager.getLogger(WatchedSet.class);

    private final PersistenceStore store;
    private final Set<String> ids;

    private WatchedSet(PersistenceStore store, Set<String> ids) {
        this.store = store;
        this.ids = ids;
    }

    /**
     * Loads the persisted ids, starting empty when the store is unavailable.
     */
    public static WatchedSet load(PersistenceStore store) {
        Objects.requireNonNull(store, "store");
        Set<String> ids = new LinkedHashSet<>();
        try {
            ids.addAll(store.loadWatchedIds());
        } catch (PersistenceException e) {
            LOG.warn("Failed to load watched items, starting empty: {}", e.getMessage());
        }
        LOG.info("Watched set initialized with {} items", ids.size());
        return new WatchedSet(store, ids);
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    /**
     * Adds {@code id} and persists the set when it changed.
     *
     * @return true if the id was not watched before
     */
    public boolean add(String id) {
        if (!ids.add(id)) {
            return false;
        }
        try {
            store.saveWatchedIds(ids);
        } catch (PersistenceException e) {
            LOG.error("Failed to save watched items: {}", e.getMessage());
        }
        return true;
    }

    public int size() {
        return ids.size();
    }
}
