package com.phillippitts.jukebox.testutil;

import com.phillippitts.jukebox.domain.MediaSource;
import com.phillippitts.jukebox.exception.PersistenceException;
import com.phillippitts.jukebox.service.persistence.PersistenceStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory store recording every save, optionally failing all operations.
 */
public class InMemoryPersistenceStore implements PersistenceStore {

    private List<MediaSource> sources = new ArrayList<>();
    private Integer currentIndex;
    private Set<String> watched = new LinkedHashSet<>();
    private volatile boolean unavailable;

    public final List<Integer> savedIndexes = new CopyOnWriteArrayList<>();
    public final List<List<MediaSource>> savedSourceLists = new CopyOnWriteArrayList<>();
    public final List<Set<String>> savedWatched = new CopyOnWriteArrayList<>();

    public InMemoryPersistenceStore() {
    }

    public InMemoryPersistenceStore(List<MediaSource> sources, Integer currentIndex) {
        this.sources = new ArrayList<>(sources);
        this.currentIndex = currentIndex;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public synchronized void setWatched(Collection<String> ids) {
        this.watched = new LinkedHashSet<>(ids);
    }

    @Override
    public synchronized List<MediaSource> loadSources() {
        check();
        return List.copyOf(sources);
    }

    @Override
    public synchronized void saveSources(List<MediaSource> list) {
        check();
        sources = new ArrayList<>(list);
        savedSourceLists.add(List.copyOf(list));
    }

    @Override
    public synchronized OptionalInt loadCurrentIndex() {
        check();
        return currentIndex == null ? OptionalInt.empty() : OptionalInt.of(currentIndex);
    }

    @Override
    public synchronized void saveCurrentIndex(int index) {
        check();
        currentIndex = index;
        savedIndexes.add(index);
    }

    @Override
    public synchronized Set<String> loadWatchedIds() {
        check();
        return Set.copyOf(watched);
    }

    @Override
    public synchronized void saveWatchedIds(Collection<String> ids) {
        check();
        watched = new LinkedHashSet<>(ids);
        savedWatched.add(Set.copyOf(ids));
    }

    private void check() {
        if (unavailable) {
            throw new PersistenceException("store unavailable");
        }
    }
}
