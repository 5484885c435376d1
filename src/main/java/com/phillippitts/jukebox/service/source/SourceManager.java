package com.phillippitts.jukebox.service.source;

import com.phillippitts.jukebox.config.ThreadPoolConfig;
import com.phillippitts.jukebox.config.properties.SourceProperties;
import com.phillippitts.jukebox.domain.MediaSource;
import com.phillippitts.jukebox.exception.NoSourcesException;
import com.phillippitts.jukebox.exception.PersistenceException;
import com.phillippitts.jukebox.service.persistence.DefaultSources;
import com.phillippitts.jukebox.service.persistence.PersistenceStore;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered rotation of media sources with the current position persisted.
 *
 * <p>Rotations are cheap and frequent (a button held down, repeated presses), so the current index
 * is written through a debounce: the first rotation schedules a save after the debounce delay,
 * later rotations only update the pending value, and the save writes whatever is latest.
 * {@link #flush()} writes a pending value immediately and runs on shutdown.
 *
 * <p><b>Thread Safety:</b> all methods may be called from any thread.
 */
@Component
public class SourceManager {

    private static final Logger LOG = LogManager.getLogger(SourceManager.class);
    private static final TaskDecorator MDC = ThreadPoolConfig.mdcPropagatingDecorator();

    private final PersistenceStore store;
    private final TaskScheduler scheduler;
    private final Duration saveDebounce;

    private final Lock lock = new ReentrantLock();
    private final Lock persistLock = new ReentrantLock();
    private final List<MediaSource> sources = new ArrayList<>();
    private int currentIndex;
    private Integer pendingIndex;
    private ScheduledFuture<?> pendingSave;

    public SourceManager(PersistenceStore store,
                         @Qualifier("persistenceScheduler") TaskScheduler scheduler,
                         SourceProperties props) {
        this.store = Objects.requireNonNull(store, "store");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.saveDebounce = props.saveDebounce();
        load();
    }

    private void load() {
        List<MediaSource> loaded;
        try {
            loaded = store.loadSources();
        } catch (PersistenceException e) {
            LOG.warn("Failed to load sources: {}", e.getMessage());
            loaded = List.of();
        }
        if (loaded.isEmpty()) {
            LOG.warn("No sources configured, using defaults");
            loaded = DefaultSources.list();
        }
        sources.addAll(loaded);

        int index;
        try {
            index = store.loadCurrentIndex().orElse(0);
        } catch (PersistenceException e) {
            LOG.warn("Failed to load current source index: {}", e.getMessage());
            index = 0;
        }
        if (index >= sources.size()) {
            LOG.warn("Current source index {} out of bounds, resetting to 0", index);
            index = 0;
        }
        currentIndex = index;
        LOG.info("SourceManager initialized with {} sources (current index: {})", sources.size(), currentIndex);
    }

    public Optional<MediaSource> getCurrent() {
        lock.lock();
        try {
            return sources.isEmpty() ? Optional.empty() : Optional.of(sources.get(currentIndex));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rotates forward, wrapping to the first source.
     *
     * @throws NoSourcesException if the rotation is empty
     */
    public MediaSource next() {
        return rotate(1);
    }

    /**
     * Rotates backward, wrapping to the last source.
     *
     * @throws NoSourcesException if the rotation is empty
     */
    public MediaSource previous() {
        return rotate(-1);
    }

    private MediaSource rotate(int step) {
        MediaSource source;
        lock.lock();
        try {
            if (sources.isEmpty()) {
                throw new NoSourcesException();
            }
            currentIndex = Math.floorMod(currentIndex + step, sources.size());
            source = sources.get(currentIndex);
            schedulePersist(currentIndex);
        } finally {
            lock.unlock();
        }
        LOG.info("Cycled to source: {} ({})", source.displayName(), source.kind().wireName());
        return source;
    }

    public List<MediaSource> getSources() {
        lock.lock();
        try {
            return List.copyOf(sources);
        } finally {
            lock.unlock();
        }
    }

    public int getCurrentIndex() {
        lock.lock();
        try {
            return currentIndex;
        } finally {
            lock.unlock();
        }
    }

    /** Appends a source to the rotation and persists the list. */
    public void addSource(MediaSource source) {
        Objects.requireNonNull(source, "source");
        List<MediaSource> snapshot;
        lock.lock();
        try {
            sources.add(source);
            snapshot = List.copyOf(sources);
        } finally {
            lock.unlock();
        }
        LOG.info("Added source: {}", source.displayName());
        saveSources(snapshot);
    }

    /**
     * Removes the source at {@code index}; the current index resets to 0 when it falls off the end.
     *
     * @return removed source, empty when the index is out of range
     */
    public Optional<MediaSource> removeSource(int index) {
        MediaSource removed;
        List<MediaSource> snapshot;
        lock.lock();
        try {
            if (index < 0 || index >= sources.size()) {
                return Optional.empty();
            }
            removed = sources.remove(index);
            if (currentIndex >= sources.size()) {
                currentIndex = 0;
            }
            snapshot = List.copyOf(sources);
            schedulePersist(currentIndex);
        } finally {
            lock.unlock();
        }
        LOG.info("Removed source: {}", removed.displayName());
        saveSources(snapshot);
        return Optional.of(removed);
    }

    /**
     * Writes a pending index now, cancelling the scheduled save.
     */
    @PreDestroy
    public void flush() {
        lock.lock();
        try {
            if (pendingSave != null) {
                pendingSave.cancel(false);
            }
        } finally {
            lock.unlock();
        }
        flushPending();
    }

    /** Caller holds {@link #lock}. */
    private void schedulePersist(int index) {
        pendingIndex = index;
        if (pendingSave == null) {
            pendingSave = scheduler.schedule(MDC.decorate(this::flushPending), Instant.now().plus(saveDebounce));
        }
    }

    private void flushPending() {
        persistLock.lock();
        try {
            Integer index;
            lock.lock();
            try {
                index = pendingIndex;
                pendingIndex = null;
                pendingSave = null;
            } finally {
                lock.unlock();
            }
            if (index == null) {
                return;
            }
            try {
                store.saveCurrentIndex(index);
                LOG.debug("Persisted current source index {}", index);
            } catch (PersistenceException e) {
                LOG.warn("Failed to save current source index: {}", e.getMessage());
            }
        } finally {
            persistLock.unlock();
        }
    }

    private void saveSources(List<MediaSource> snapshot) {
        try {
            store.saveSources(snapshot);
        } catch (PersistenceException e) {
            LOG.warn("Failed to save sources: {}", e.getMessage());
        }
    }
}
