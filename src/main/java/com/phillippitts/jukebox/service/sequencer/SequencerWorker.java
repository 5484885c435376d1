package com.phillippitts.jukebox.service.sequencer;

import com.phillippitts.jukebox.config.properties.SequencerProperties;
import com.phillippitts.jukebox.config.properties.WorkerProperties;
import com.phillippitts.jukebox.domain.SourceKind;
import com.phillippitts.jukebox.domain.TrackInfo;
import com.phillippitts.jukebox.exception.BackendConnectionException;
import com.phillippitts.jukebox.exception.CommandFailedException;
import com.phillippitts.jukebox.service.metrics.PlayerMetrics;
import com.phillippitts.jukebox.service.state.SharedPlaybackState;
import com.phillippitts.jukebox.service.worker.BackendWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Worker owning the persistent connection to the music sequencer.
 *
 * <p>While disconnected, each iteration makes one connection attempt and then waits for the
 * current reconnect delay (5s growing by 1.5x up to 60s by default); queued commands stay queued
 * until the connection is back. While connected, commands run in FIFO order and the backend
 * status is mirrored into {@link SharedPlaybackState} every poll interval, but only while the
 * sequencer is the active source.
 *
 * <p>Any failed command drops the connection so the next iteration reconnects.
 */
@Component
public class SequencerWorker extends BackendWorker<SequencerCommand> {

    private static final Logger LOG = LogManager.getLogger(SequencerWorker.class);

    static final String NAME = "sequencer-worker";

    private final SequencerClient client;
    private final SequencerProperties props;
    private final SharedPlaybackState state;
    private final PlayerMetrics metrics;
    private final ReconnectBackoff backoff;

    private volatile boolean connected;
    private volatile boolean muted;
    /** Level to restore on unmute; worker thread only. */
    private int levelBeforeMute = -1;

    public SequencerWorker(SequencerClient client,
                           SequencerProperties props,
                           WorkerProperties workerProps,
                           SharedPlaybackState state,
                           PlayerMetrics metrics) {
        super(NAME, metrics, props.pollInterval(), workerProps);
        this.client = Objects.requireNonNull(client, "client");
        this.props = props;
        this.state = Objects.requireNonNull(state, "state");
        this.metrics = metrics;
        this.backoff = new ReconnectBackoff(props.reconnectBaseDelay(), props.reconnectMaxDelay());
    }

    // ---- public API (any thread) -------------------------------------------------------------

    public void play() {
        enqueue(new SequencerCommand.Play());
    }

    public void pause() {
        enqueue(new SequencerCommand.Pause());
    }

    public void toggle() {
        enqueue(new SequencerCommand.Toggle());
    }

    public void next() {
        enqueue(new SequencerCommand.Next());
    }

    public void previous() {
        enqueue(new SequencerCommand.Previous());
    }

    public void stopPlayback() {
        enqueue(new SequencerCommand.Stop());
    }

    public void loadPlaylist(String locator, boolean shuffle, boolean autoplay) {
        enqueue(new SequencerCommand.LoadPlaylist(locator, shuffle, autoplay));
    }

    /** Sets the volume asynchronously. */
    public void setVolume(int level) {
        enqueue(new SequencerCommand.SetVolume(level));
    }

    /** Reads the volume waiting up to the configured volume timeout. */
    public OptionalInt getVolume() {
        return getVolume(props.volumeTimeout());
    }

    /**
     * Reads the mixer volume through the worker.
     *
     * @return volume 0-100; empty when disconnected (immediately), on timeout, on failure,
     *         or when the backend has no mixer
     */
    public OptionalInt getVolume(Duration timeout) {
        if (!connected) {
            LOG.debug("Cannot get volume: sequencer not connected");
            return OptionalInt.empty();
        }
        CompletableFuture<Integer> reply = new CompletableFuture<>();
        if (!enqueue(new SequencerCommand.GetVolume(reply))) {
            return OptionalInt.empty();
        }
        try {
            int volume = reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return volume < 0 ? OptionalInt.empty() : OptionalInt.of(volume);
        } catch (TimeoutException e) {
            LOG.warn("Get volume timed out after {}ms", timeout.toMillis());
            return OptionalInt.empty();
        } catch (ExecutionException e) {
            LOG.debug("Get volume failed: {}", e.getCause().toString());
            return OptionalInt.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OptionalInt.empty();
        }
    }

    public boolean setVolumeSync(int level) {
        return setVolumeSync(level, props.volumeTimeout());
    }

    /**
     * Sets the volume and waits for the backend to apply it.
     *
     * @return true once applied; false when disconnected, on timeout, or on failure
     */
    public boolean setVolumeSync(int level, Duration timeout) {
        if (!connected) {
            LOG.debug("Cannot set volume: sequencer not connected");
            return false;
        }
        CompletableFuture<Boolean> ack = new CompletableFuture<>();
        if (!enqueue(new SequencerCommand.SetVolume(level, Optional.of(ack)))) {
            return false;
        }
        try {
            return ack.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Set volume to {} timed out after {}ms", level, timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Steps the volume by {@code delta}, never above {@code maxLevel}, and unmutes.
     *
     * @return the applied level; empty when disconnected, on timeout, on failure, or without a mixer
     */
    public OptionalInt adjustVolume(int delta, int maxLevel) {
        if (!connected) {
            LOG.debug("Cannot adjust volume: sequencer not connected");
            return OptionalInt.empty();
        }
        CompletableFuture<Integer> reply = new CompletableFuture<>();
        if (!enqueue(new SequencerCommand.AdjustVolume(delta, maxLevel, reply))) {
            return OptionalInt.empty();
        }
        return awaitReply(reply, "Adjust volume")
                .filter(level -> level >= 0)
                .map(OptionalInt::of)
                .orElse(OptionalInt.empty());
    }

    /**
     * Toggles mute. The sequencer has no mute switch, so muting stores the level and sets 0.
     *
     * @return the new muted flag; empty when disconnected, on timeout or on failure
     */
    public Optional<Boolean> toggleMute() {
        if (!connected) {
            LOG.debug("Cannot toggle mute: sequencer not connected");
            return Optional.empty();
        }
        CompletableFuture<Boolean> reply = new CompletableFuture<>();
        if (!enqueue(new SequencerCommand.ToggleMute(reply))) {
            return Optional.empty();
        }
        return awaitReply(reply, "Toggle mute");
    }

    public boolean isMuted() {
        return muted;
    }

    public boolean isConnected() {
        return connected;
    }

    private <T> Optional<T> awaitReply(CompletableFuture<T> reply, String operation) {
        Duration timeout = props.volumeTimeout();
        try {
            return Optional.ofNullable(reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            LOG.warn("{} timed out after {}ms", operation, timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            LOG.debug("{} failed: {}", operation, e.getCause().toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    // ---- worker thread -----------------------------------------------------------------------

    @Override
    protected boolean ready() throws InterruptedException {
        if (backoff.isConnected()) {
            return true;
        }
        backoff.connecting();
        try {
            client.connect(props.host(), props.port());
            backoff.onSuccess();
            connected = true;
            metrics.connectionAttempt("sequencer", "success");
            return true;
        } catch (BackendConnectionException e) {
            Duration delay = backoff.onFailure();
            connected = false;
            metrics.connectionAttempt("sequencer", "failure");
            LOG.warn("Sequencer unavailable at {}:{} ({}); retrying in {}ms",
                    props.host(), props.port(), e.getMessage(), delay.toMillis());
            sleepUnlessStopping(delay);
            return false;
        }
    }

    @Override
    protected void handle(SequencerCommand command) {
        try {
            execute(command);
        } catch (BackendConnectionException | CommandFailedException e) {
            LOG.error("Sequencer command {} failed: {}", command, e.getMessage());
            fail(command, e);
            markDisconnected();
        } catch (RuntimeException e) {
            LOG.error("Sequencer command {} failed unexpectedly", command, e);
            fail(command, e);
            markDisconnected();
        }
    }

    private void execute(SequencerCommand command) {
        if (command instanceof SequencerCommand.Play) {
            client.play();
        } else if (command instanceof SequencerCommand.Pause) {
            client.pause();
        } else if (command instanceof SequencerCommand.Toggle) {
            toggle(client.getPhase());
        } else if (command instanceof SequencerCommand.Next) {
            client.next();
        } else if (command instanceof SequencerCommand.Previous) {
            client.previous();
        } else if (command instanceof SequencerCommand.Stop) {
            client.stop();
        } else if (command instanceof SequencerCommand.LoadPlaylist load) {
            client.load(load.locator(), load.shuffle(), load.autoplay());
        } else if (command instanceof SequencerCommand.GetVolume get) {
            get.reply().complete(client.getVolume());
        } else if (command instanceof SequencerCommand.SetVolume set) {
            client.setVolume(set.level());
            clearMute();
            set.ack().ifPresent(ack -> ack.complete(true));
        } else if (command instanceof SequencerCommand.AdjustVolume adjust) {
            adjust.reply().complete(adjustVolume(adjust));
        } else if (command instanceof SequencerCommand.ToggleMute toggle) {
            toggleMute(toggle.reply());
        } else {
            LOG.warn("Unknown sequencer command: {}", command);
        }
    }

    private int adjustVolume(SequencerCommand.AdjustVolume adjust) {
        int base = muted && levelBeforeMute >= 0 ? levelBeforeMute : client.getVolume();
        if (base < 0) {
            return -1;
        }
        int level = Math.max(0, Math.min(adjust.maxLevel(), base + adjust.delta()));
        client.setVolume(level);
        clearMute();
        LOG.debug("Volume {} -> {} (max {})", base, level, adjust.maxLevel());
        return level;
    }

    private void toggleMute(CompletableFuture<Boolean> reply) {
        if (muted) {
            client.setVolume(Math.max(0, levelBeforeMute));
            clearMute();
            LOG.info("Sequencer unmuted");
            reply.complete(false);
            return;
        }
        int current = client.getVolume();
        if (current < 0) {
            reply.completeExceptionally(new CommandFailedException("toggleMute", "Sequencer has no mixer"));
            return;
        }
        client.setVolume(0);
        levelBeforeMute = current;
        muted = true;
        LOG.info("Sequencer muted (was {})", current);
        reply.complete(true);
    }

    private void clearMute() {
        muted = false;
        levelBeforeMute = -1;
    }

    private void toggle(SequencerPhase phase) {
        if (phase == SequencerPhase.PLAYING) {
            client.pause();
            LOG.debug("Toggled from playing to paused");
        } else {
            client.play();
            LOG.debug("Toggled from {} to playing", phase);
        }
    }

    @Override
    protected void pollStatus() {
        if (!connected) {
            return;
        }
        try {
            SequencerPhase phase = client.getPhase();
            Optional<TrackInfo> item = client.getCurrentItem();
            PlaybackTime time = client.getTime();
            state.mutateIfActive(SourceKind.SEQUENCER, s -> {
                TrackInfo track = item.orElse(phase == SequencerPhase.STOPPED ? null : s.currentTrack());
                return s.withPlaying(phase == SequencerPhase.PLAYING)
                        .withCurrentTrack(track)
                        .withTime(time.position(), time.duration());
            });
        } catch (BackendConnectionException e) {
            LOG.debug("Sequencer status poll lost connection: {}", e.getMessage());
            markDisconnected();
        } catch (CommandFailedException e) {
            LOG.debug("Sequencer status poll failed: {}", e.getMessage());
        }
    }

    @Override
    protected boolean isShutdown(SequencerCommand command) {
        return command instanceof SequencerCommand.Shutdown;
    }

    @Override
    protected SequencerCommand shutdownCommand() {
        return new SequencerCommand.Shutdown();
    }

    @Override
    protected void onLoopError(RuntimeException e) {
        markDisconnected();
    }

    @Override
    protected void discard(SequencerCommand command) {
        fail(command, new BackendConnectionException("sequencer", "Worker stopped"));
    }

    @Override
    protected void onStop() {
        connected = false;
        client.disconnect();
    }

    private void fail(SequencerCommand command, RuntimeException cause) {
        if (command instanceof SequencerCommand.GetVolume get) {
            get.reply().completeExceptionally(cause);
        } else if (command instanceof SequencerCommand.SetVolume set) {
            set.ack().ifPresent(ack -> ack.complete(false));
        } else if (command instanceof SequencerCommand.AdjustVolume adjust) {
            adjust.reply().completeExceptionally(cause);
        } else if (command instanceof SequencerCommand.ToggleMute toggle) {
            toggle.reply().completeExceptionally(cause);
        }
    }

    private void markDisconnected() {
        connected = false;
        backoff.onDisconnect();
        try {
            client.disconnect();
        } catch (RuntimeException e) {
            LOG.debug("Error disconnecting sequencer: {}", e.toString());
        }
    }

    ReconnectBackoff backoff() {
        return backoff;
    }
}
