package com.phillippitts.jukebox.service.state;

import com.phillippitts.jukebox.config.properties.StateProperties;
import com.phillippitts.jukebox.domain.ButtonEvent;
import com.phillippitts.jukebox.domain.ButtonPhase;
import com.phillippitts.jukebox.domain.PlaybackState;
import com.phillippitts.jukebox.domain.SourceKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Single thread-safe holder of the jukebox playback state.
 *
 * <p>Every mutation goes through {@link #mutate(UnaryOperator)} or {@link #addEvent}; readers
 * receive copies from {@link #getSnapshot()}. Components must not cache a snapshot and write it
 * back later, since that would overwrite concurrent updates from other workers.
 *
 * <p><b>Thread Safety:</b> one {@link ReentrantLock} guards all fields. Transformations passed
 * to {@code mutate} run while the lock is held and must not block.
 */
@Component
public class SharedPlaybackState {

    private static final Logger LOG = LogManager.getLogger(SharedPlaybackState.class);

    private final Lock lock = new ReentrantLock();
    private final int eventLogCapacity;
    private final Deque<ButtonEvent> eventLog;
    private final Map<Integer, ButtonPhase> pinPhases = new TreeMap<>();
    private PlaybackState state = PlaybackState.initial();

    @Autowired
    public SharedPlaybackState(StateProperties props) {
        this(props.eventLogCapacity());
    }

    public SharedPlaybackState(int eventLogCapacity) {
        if (eventLogCapacity <= 0) {
            throw new IllegalArgumentException("eventLogCapacity must be positive");
        }
        this.eventLogCapacity = eventLogCapacity;
        this.eventLog = new ArrayDeque<>(eventLogCapacity);
    }

    /**
     * Returns a consistent copy of the current state, including the event log.
     */
    public PlaybackState getSnapshot() {
        lock.lock();
        try {
            return state.withEventLog(new ArrayList<>(eventLog));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a transformation to the state under the lock and returns the resulting snapshot.
     *
     * <p>The event log is append-only through {@link #addEvent}; changes the function makes to
     * {@link PlaybackState#eventLog()} are ignored.
     *
     * @param fn transformation, must not return null
     * @return state after the transformation
     */
    public PlaybackState mutate(UnaryOperator<PlaybackState> fn) {
        Objects.requireNonNull(fn, "fn");
        lock.lock();
        try {
            PlaybackState next = Objects.requireNonNull(fn.apply(state), "mutation returned null");
            state = next.withEventLog(List.of());
            return next.withEventLog(new ArrayList<>(eventLog));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies {@code fn} only while {@code owner} is the active source kind. The check and the
     * update happen under the same lock hold, so a backend that lost ownership cannot overwrite
     * the transport fields of the one that replaced it.
     *
     * @return true if the transformation was applied
     */
    public boolean mutateIfActive(SourceKind owner, UnaryOperator<PlaybackState> fn) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(fn, "fn");
        lock.lock();
        try {
            if (state.activeSourceKind() != owner) {
                return false;
            }
            state = Objects.requireNonNull(fn.apply(state), "mutation returned null").withEventLog(List.of());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a button event, evicting the oldest entry beyond capacity.
     *
     * @param pinId  pin that changed
     * @param phase  pressed or released
     * @param action bound action name, may be null
     * @return the recorded event
     */
    public ButtonEvent addEvent(int pinId, ButtonPhase phase, String action) {
        ButtonEvent event = ButtonEvent.of(pinId, phase, action);
        lock.lock();
        try {
            while (eventLog.size() >= eventLogCapacity) {
                eventLog.removeFirst();
            }
            eventLog.addLast(event);
            pinPhases.put(pinId, phase);
        } finally {
            lock.unlock();
        }
        LOG.debug("Button event: pin={}, phase={}, action={}", pinId, phase, event.action().orElse("-"));
        return event;
    }

    /**
     * Returns up to {@code limit} most recent events, oldest first.
     */
    public List<ButtonEvent> getRecentEvents(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            List<ButtonEvent> all = new ArrayList<>(eventLog);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Last observed phase per pin, ordered by pin. Pins never seen are absent.
     */
    public Map<Integer, ButtonPhase> getPinPhases() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(pinPhases));
        } finally {
            lock.unlock();
        }
    }

    public int getEventLogCapacity() {
        return eventLogCapacity;
    }
}
