package com.phillippitts.jukebox.service.video;

import com.phillippitts.jukebox.config.properties.VideoProperties;
import com.phillippitts.jukebox.config.properties.WorkerProperties;
import com.phillippitts.jukebox.domain.SourceKind;
import com.phillippitts.jukebox.domain.TrackInfo;
import com.phillippitts.jukebox.exception.ResourceUnavailableException;
import com.phillippitts.jukebox.exception.StreamUnavailableException;
import com.phillippitts.jukebox.service.metrics.PlayerMetrics;
import com.phillippitts.jukebox.service.persistence.PersistenceStore;
import com.phillippitts.jukebox.service.process.MediaPlayerLauncher;
import com.phillippitts.jukebox.service.process.PlayerProcess;
import com.phillippitts.jukebox.service.state.SharedPlaybackState;
import com.phillippitts.jukebox.service.worker.BackendWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Worker playing the items of a video channel through an external audio player.
 *
 * <p>At most one player process exists at a time and it is stopped before another is started.
 * When the process exits on its own, the next unwatched item starts automatically. Items whose
 * stream cannot be resolved are marked watched and skipped, trying each item of the channel at
 * most once per selection.
 *
 * <p>If the resolver or player binary is missing, video playback is disabled for the lifetime
 * of the process after a single warning.
 */
@Component
public class VideoWorker extends BackendWorker<VideoCommand> {

    private static final Logger LOG = LogManager.getLogger(VideoWorker.class);

    static final String NAME = "video-worker";
    static final String ARTIST = "YouTube";

    private final VideoSource source;
    private final MediaPlayerLauncher launcher;
    private final VideoProperties props;
    private final SharedPlaybackState state;
    private final PlayerMetrics metrics;
    private final WatchedSet watched;

    private volatile VideoPlaylist playlist = VideoPlaylist.empty();
    private PlayerProcess current;
    private volatile boolean disabled;

    public VideoWorker(VideoSource source,
                       MediaPlayerLauncher launcher,
                       PersistenceStore store,
                       VideoProperties props,
                       WorkerProperties workerProps,
                       SharedPlaybackState state,
                       PlayerMetrics metrics) {
        super(NAME, metrics, props.pollInterval(), workerProps);
        this.source = Objects.requireNonNull(source, "source");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.props = props;
        this.state = Objects.requireNonNull(state, "state");
        this.metrics = metrics;
        this.watched = WatchedSet.load(store);
    }

    public void playChannel(String locator) {
        enqueue(new VideoCommand.PlayChannel(locator));
    }

    public void next() {
        enqueue(new VideoCommand.Next());
    }

    public void previous() {
        enqueue(new VideoCommand.Previous());
    }

    public void stopPlayback() {
        enqueue(new VideoCommand.Stop());
    }

    public void pause() {
        enqueue(new VideoCommand.Pause());
    }

    public void resume() {
        enqueue(new VideoCommand.Resume());
    }

    /** True once a missing binary has disabled video playback. */
    public boolean isDisabled() {
        return disabled;
    }

    @Override
    protected void handle(VideoCommand command) {
        if (disabled) {
            LOG.debug("Video playback disabled, ignoring {}", command);
            return;
        }
        try {
            execute(command);
        } catch (ResourceUnavailableException e) {
            disabled = true;
            closeCurrent();
            LOG.warn("Video playback disabled: {}", e.getMessage());
        }
    }

    private void execute(VideoCommand command) {
        if (command instanceof VideoCommand.PlayChannel play) {
            playChannel0(play.locator());
        } else if (command instanceof VideoCommand.Next) {
            if (requireItems("next")) {
                playSelected(playlist.advance(watched::contains));
            }
        } else if (command instanceof VideoCommand.Previous) {
            if (requireItems("previous")) {
                playSelected(playlist.retreat());
            }
        } else if (command instanceof VideoCommand.Stop || command instanceof VideoCommand.Pause) {
            stopCurrent();
        } else if (command instanceof VideoCommand.Resume) {
            playSelected(playlist.current());
        } else {
            LOG.warn("Unknown video command: {}", command);
        }
    }

    private void playChannel0(String locator) {
        LOG.info("Play channel '{}'", locator);
        stopCurrent();
        List<VideoItem> items = source.listItems(locator, props.maxItems());
        playlist = new VideoPlaylist(items);
        if (playlist.isEmpty()) {
            LOG.error("No items found in channel '{}'", locator);
            return;
        }
        playSelected(playlist.selectNextUnwatched(watched::contains));
    }

    /**
     * Plays the selected item, skipping forward past unresolvable items. Tries at most one
     * candidate per playlist entry.
     */
    private void playSelected(Optional<VideoItem> selected) {
        Optional<VideoItem> candidate = selected;
        for (int attempt = 0; attempt < playlist.size() && candidate.isPresent(); attempt++) {
            if (tryPlay(candidate.get())) {
                return;
            }
            candidate = playlist.advance(watched::contains);
        }
        if (selected.isPresent()) {
            LOG.warn("No playable item found after trying {} candidates", playlist.size());
        }
    }

    private boolean tryPlay(VideoItem item) {
        stopCurrent();
        String streamUrl;
        try {
            streamUrl = source.resolvePlayableUrl(item.url());
        } catch (StreamUnavailableException e) {
            LOG.warn("Skipping '{}': {}", item.title(), e.getMessage());
            watched.add(item.id());
            metrics.itemSkipped("stream_unavailable");
            return false;
        }
        current = launcher.play(streamUrl, item.title());
        watched.add(item.id());
        TrackInfo track = new TrackInfo(item.title(), ARTIST, "", item.url());
        state.mutateIfActive(SourceKind.VIDEO, s -> s.withPlaying(true).withCurrentTrack(track).withTime(null, null));
        LOG.info("Playing: {}", item.title());
        return true;
    }

    @Override
    protected void pollStatus() {
        if (current == null || current.isRunning()) {
            return;
        }
        LOG.info("Player finished with code {}", current.exitCode().orElse(-1));
        current = null;
        state.mutateIfActive(SourceKind.VIDEO, s -> s.withPlaying(false));
        if (!playlist.isEmpty() && !disabled) {
            try {
                playSelected(playlist.advance(watched::contains));
            } catch (ResourceUnavailableException e) {
                disabled = true;
                LOG.warn("Video playback disabled: {}", e.getMessage());
            }
        }
    }

    @Override
    protected boolean isShutdown(VideoCommand command) {
        return command instanceof VideoCommand.Shutdown;
    }

    @Override
    protected VideoCommand shutdownCommand() {
        return new VideoCommand.Shutdown();
    }

    @Override
    protected void onStop() {
        closeCurrent();
    }

    private boolean requireItems(String action) {
        if (playlist.isEmpty()) {
            LOG.warn("Cannot {}: no items loaded", action);
            return false;
        }
        return true;
    }

    private void stopCurrent() {
        if (current == null) {
            return;
        }
        closeCurrent();
        state.mutateIfActive(SourceKind.VIDEO, s -> s.withPlaying(false));
    }

    private void closeCurrent() {
        PlayerProcess process = current;
        current = null;
        if (process != null) {
            process.close();
        }
    }

    VideoPlaylist playlist() {
        return playlist;
    }
}
