package com.phillippitts.jukebox.service.player;

import com.phillippitts.jukebox.config.properties.AnnouncerProperties;
import com.phillippitts.jukebox.config.properties.VolumeProperties;
import com.phillippitts.jukebox.domain.ButtonEvent;
import com.phillippitts.jukebox.domain.MediaSource;
import com.phillippitts.jukebox.domain.PlaybackState;
import com.phillippitts.jukebox.domain.SourceKind;
import com.phillippitts.jukebox.exception.NoSourcesException;
import com.phillippitts.jukebox.exception.ServiceNotReadyException;
import com.phillippitts.jukebox.service.announce.AnnouncerWorker;
import com.phillippitts.jukebox.service.sequencer.SequencerWorker;
import com.phillippitts.jukebox.service.source.SourceManager;
import com.phillippitts.jukebox.service.state.SharedPlaybackState;
import com.phillippitts.jukebox.service.video.VideoWorker;
import com.phillippitts.jukebox.service.worker.BackendWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Front door for every user action (buttons and HTTP): routes transport commands to the worker
 * of the active source and orchestrates source changes.
 *
 * <p>Transport commands only enqueue and return immediately. {@link #cycleSource()} is serialized
 * so concurrent callers queue up; within one cycle the previously active backend is told to stop
 * before the new one is told to load, and the active source kind changes in a single state
 * update, so a snapshot never shows two active kinds.
 */
@Service
public class PlayerService implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(PlayerService.class);

    /** Starts before the button input so buttons never hit stopped workers. */
    public static final int PHASE = 0;

    static final int FULL_VOLUME = 100;

    private final SequencerWorker sequencer;
    private final VideoWorker video;
    private final AnnouncerWorker announcer;
    private final SourceManager sourceManager;
    private final SharedPlaybackState state;
    private final AnnouncerProperties announcerProps;
    private final int volumeStep;

    private final Lock cycleLock = new ReentrantLock();
    private volatile boolean running;
    private volatile int maxVolume;

    public PlayerService(SequencerWorker sequencer,
                         VideoWorker video,
                         AnnouncerWorker announcer,
                         SourceManager sourceManager,
                         SharedPlaybackState state,
                         AnnouncerProperties announcerProps,
                         VolumeProperties volumeProps) {
        this.sequencer = sequencer;
        this.video = video;
        this.announcer = announcer;
        this.sourceManager = sourceManager;
        this.state = state;
        this.announcerProps = announcerProps;
        this.volumeStep = volumeProps.step();
        this.maxVolume = volumeProps.maxLimit();
    }

    // ---- lifecycle ---------------------------------------------------------------------------

    @Override
    public void start() {
        if (running) {
            return;
        }
        sequencer.start();
        video.start();
        announcer.start();
        if (announcerProps.duckVolume() > 0) {
            announcer.setListener(new VolumeDucker(sequencer, state, announcerProps.duckVolume()));
        }
        running = true;
        LOG.info("PlayerService started");
        loadCurrentSource();
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        sourceManager.flush();
        announcer.stop();
        video.stop();
        sequencer.stop();
        LOG.info("PlayerService stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    /** True when every worker has been started. */
    public boolean isReady() {
        return sequencer.hasStarted() && video.hasStarted() && announcer.hasStarted();
    }

    // ---- transport ---------------------------------------------------------------------------

    public void togglePlay() {
        requireReady();
        PlaybackState snapshot = state.getSnapshot();
        switch (snapshot.activeSourceKind()) {
            case SEQUENCER -> sequencer.toggle();
            case VIDEO -> {
                if (snapshot.playing()) {
                    video.pause();
                } else {
                    video.resume();
                }
            }
            case NONE -> LOG.info("Toggle ignored: no active source");
        }
        LOG.debug("Toggle play for {}", snapshot.activeSourceKind());
    }

    public void next() {
        requireReady();
        SourceKind kind = state.getSnapshot().activeSourceKind();
        switch (kind) {
            case SEQUENCER -> sequencer.next();
            case VIDEO -> video.next();
            case NONE -> LOG.info("Next ignored: no active source");
        }
    }

    public void previous() {
        requireReady();
        SourceKind kind = state.getSnapshot().activeSourceKind();
        switch (kind) {
            case SEQUENCER -> sequencer.previous();
            case VIDEO -> video.previous();
            case NONE -> LOG.info("Previous ignored: no active source");
        }
    }

    // ---- sources -----------------------------------------------------------------------------

    /**
     * Switches to the next source in the rotation and announces it.
     *
     * @return the new current source
     * @throws NoSourcesException if the rotation is empty
     */
    public MediaSource cycleSource() {
        requireReady();
        cycleLock.lock();
        try {
            SourceKind previousKind = state.getSnapshot().activeSourceKind();
            MediaSource next = sourceManager.next();
            announcer.announce(next.announcementText());
            stopBackend(previousKind);
            activate(next);
            LOG.info("Cycled from {} to '{}'", previousKind, next.displayName());
            return next;
        } finally {
            cycleLock.unlock();
        }
    }

    public Optional<MediaSource> getCurrentSource() {
        return sourceManager.getCurrent();
    }

    public List<MediaSource> getSources() {
        return sourceManager.getSources();
    }

    private void loadCurrentSource() {
        cycleLock.lock();
        try {
            Optional<MediaSource> current = sourceManager.getCurrent();
            if (current.isEmpty()) {
                LOG.warn("No current source available");
                return;
            }
            activate(current.get());
            LOG.info("Loaded source '{}'", current.get().displayName());
        } finally {
            cycleLock.unlock();
        }
    }

    private void stopBackend(SourceKind kind) {
        switch (kind) {
            case SEQUENCER -> sequencer.stopPlayback();
            case VIDEO -> video.stopPlayback();
            case NONE -> { }
        }
    }

    /** Caller holds {@link #cycleLock}. */
    private void activate(MediaSource source) {
        SourceKind kind = source.kind().sourceKind();
        state.mutate(s -> s.withActiveSourceKind(kind)
                .withPlaying(false)
                .withCurrentTrack(null)
                .withTime(null, null));
        switch (source.kind()) {
            case SEQUENCER_PLAYLIST -> {
                if (!sequencer.setVolumeSync(Math.min(FULL_VOLUME, maxVolume))) {
                    LOG.debug("Could not reset sequencer volume before loading '{}'", source.displayName());
                }
                sequencer.loadPlaylist(source.locator(), true, true);
            }
            case VIDEO_CHANNEL -> video.playChannel(source.locator());
        }
    }

    // ---- volume and announcements ------------------------------------------------------------

    /**
     * @return sequencer volume, empty when it cannot be read in time
     */
    public OptionalInt getCurrentVolume() {
        requireReady();
        return sequencer.getVolume();
    }

    /**
     * Sets the sequencer volume, capped at the max volume limit.
     *
     * @param synchronous wait until the backend applied it
     * @return false only when a synchronous set failed or timed out
     */
    public boolean setVolume(int level, boolean synchronous) {
        requireReady();
        int capped = Math.min(level, maxVolume);
        if (synchronous) {
            return sequencer.setVolumeSync(capped);
        }
        sequencer.setVolume(capped);
        return true;
    }

    /** One volume step up, never above the max limit. */
    public OptionalInt volumeUp() {
        requireReady();
        return sequencer.adjustVolume(volumeStep, maxVolume);
    }

    /** One volume step down. */
    public OptionalInt volumeDown() {
        requireReady();
        return sequencer.adjustVolume(-volumeStep, maxVolume);
    }

    /**
     * @return the new muted flag, empty when the sequencer could not apply it
     */
    public Optional<Boolean> toggleMute() {
        requireReady();
        return sequencer.toggleMute();
    }

    public boolean isMuted() {
        return sequencer.isMuted();
    }

    public int getMaxVolume() {
        return maxVolume;
    }

    /**
     * Changes the max volume limit and lowers the current volume when it is above the new limit.
     *
     * @param limit new limit, clamped to 0-100
     * @return the limit in effect
     */
    public int setMaxVolume(int limit) {
        requireReady();
        int clamped = Math.max(0, Math.min(100, limit));
        maxVolume = clamped;
        OptionalInt current = sequencer.getVolume();
        if (current.isPresent() && current.getAsInt() > clamped) {
            sequencer.setVolume(clamped);
            LOG.info("Volume reduced to max limit {}", clamped);
        }
        LOG.info("Max volume limit set to {}", clamped);
        return clamped;
    }

    /**
     * Speaks {@code text}, interrupting any announcement in progress.
     *
     * @return false if announcements are disabled or busy
     * @throws IllegalArgumentException if text is blank
     */
    public boolean announce(String text) {
        requireReady();
        return announcer.announce(text);
    }

    // ---- state -------------------------------------------------------------------------------

    public PlaybackState getSnapshot() {
        return state.getSnapshot();
    }

    public List<ButtonEvent> getRecentEvents(int limit) {
        return state.getRecentEvents(limit);
    }

    private void requireReady() {
        requireStarted(sequencer);
        requireStarted(video);
        requireStarted(announcer);
    }

    private static void requireStarted(BackendWorker<?> worker) {
        if (!worker.hasStarted()) {
            throw new ServiceNotReadyException(worker.name());
        }
    }
}
