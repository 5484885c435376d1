package com.phillippitts.jukebox.service.announce;

import com.phillippitts.jukebox.config.properties.AnnouncerProperties;
import com.phillippitts.jukebox.config.properties.WorkerProperties;
import com.phillippitts.jukebox.exception.ResourceUnavailableException;
import com.phillippitts.jukebox.exception.SynthesisException;
import com.phillippitts.jukebox.service.metrics.PlayerMetrics;
import com.phillippitts.jukebox.service.process.MediaPlayerLauncher;
import com.phillippitts.jukebox.service.process.PlayerProcess;
import com.phillippitts.jukebox.service.worker.BackendWorker;
import com.phillippitts.jukebox.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Worker speaking short texts through the speech synthesizer and the external audio player.
 *
 * <p>A new announcement interrupts the one playing: the old player is terminated before the new
 * one starts, so only the latest text is audible. Synthesized audio is cached by text.
 *
 * <p>A missing voice model or binary disables announcements for the lifetime of the process
 * after a single warning.
 */
@Component
public class AnnouncerWorker extends BackendWorker<AnnouncerCommand> {

    private static final Logger LOG = LogManager.getLogger(AnnouncerWorker.class);

    static final String NAME = "announcer-worker";

    private final SpeechSynthesizer synthesizer;
    private final MediaPlayerLauncher launcher;
    private final AnnouncementCache cache;

    private volatile boolean disabled;
    private volatile AnnouncementListener listener;
    private PlayerProcess current;

    @Autowired
    public AnnouncerWorker(AnnouncerProperties props,
                           SpeechSynthesizer synthesizer,
                           MediaPlayerLauncher launcher,
                           WorkerProperties workerProps,
                           PlayerMetrics metrics) {
        this(props, new AnnouncementCache(Paths.get(props.cacheDir())), synthesizer, launcher, workerProps, metrics);
    }

    AnnouncerWorker(AnnouncerProperties props,
                    AnnouncementCache cache,
                    SpeechSynthesizer synthesizer,
                    MediaPlayerLauncher launcher,
                    WorkerProperties workerProps,
                    PlayerMetrics metrics) {
        super(NAME, metrics, props.pollInterval(), workerProps);
        this.cache = Objects.requireNonNull(cache, "cache");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.disabled = !props.enabled();
        if (disabled) {
            LOG.info("Announcements disabled by configuration");
        }
    }

    /**
     * Queues {@code text} for speaking.
     *
     * @return false if announcements are disabled or the queue is full
     * @throws IllegalArgumentException if text is blank
     */
    public boolean announce(String text) {
        AnnouncerCommand.Announce command = new AnnouncerCommand.Announce(text);
        if (disabled) {
            LOG.debug("Announcements disabled, skipping: {}", LogSanitizer.preview(text));
            return false;
        }
        return enqueue(command);
    }

    /** Sets the single, non-owning playback listener (null to clear). */
    public void setListener(AnnouncementListener listener) {
        this.listener = listener;
    }

    public boolean isDisabled() {
        return disabled;
    }

    @Override
    protected void handle(AnnouncerCommand command) {
        if (!(command instanceof AnnouncerCommand.Announce announce)) {
            LOG.warn("Unknown announcer command: {}", command);
            return;
        }
        if (disabled) {
            return;
        }
        try {
            speak(announce.text());
        } catch (ResourceUnavailableException e) {
            disabled = true;
            stopCurrent();
            LOG.warn("Announcements disabled: {}", e.getMessage());
        }
    }

    private void speak(String text) {
        Path audio = cache.pathFor(text);
        if (cache.contains(text)) {
            LOG.debug("Using cached audio for: {}", LogSanitizer.preview(text));
        } else {
            try {
                cache.ensureDirectory();
                synthesizer.synthesize(text, audio);
            } catch (SynthesisException e) {
                LOG.error("Cannot synthesize announcement: {}", e.getMessage());
                return;
            } catch (IOException e) {
                LOG.error("Cannot create announcement cache {}: {}", cache.directory(), e.toString());
                return;
            }
        }
        boolean wasPlaying = closeCurrent();
        current = launcher.play(audio.toString(), "announcement");
        LOG.info("Announcing: {}", LogSanitizer.preview(text));
        if (!wasPlaying) {
            notifyStarted(text);
        }
    }

    @Override
    protected void pollStatus() {
        if (current != null && !current.isRunning()) {
            LOG.debug("Announcement finished with code {}", current.exitCode().orElse(-1));
            current = null;
            notifyFinished();
        }
    }

    @Override
    protected boolean isShutdown(AnnouncerCommand command) {
        return command instanceof AnnouncerCommand.Shutdown;
    }

    @Override
    protected AnnouncerCommand shutdownCommand() {
        return new AnnouncerCommand.Shutdown();
    }

    @Override
    protected void onStop() {
        stopCurrent();
    }

    private void stopCurrent() {
        if (closeCurrent()) {
            notifyFinished();
        }
    }

    /** @return whether an announcement was active (listener not yet told it finished) */
    private boolean closeCurrent() {
        PlayerProcess process = current;
        current = null;
        if (process == null) {
            return false;
        }
        process.close();
        return true;
    }

    private void notifyStarted(String text) {
        AnnouncementListener l = listener;
        if (l == null) {
            return;
        }
        try {
            l.onAnnouncementStarted(text);
        } catch (RuntimeException e) {
            LOG.warn("Announcement listener failed: {}", e.toString());
        }
    }

    private void notifyFinished() {
        AnnouncementListener l = listener;
        if (l == null) {
            return;
        }
        try {
            l.onAnnouncementFinished();
        } catch (RuntimeException e) {
            LOG.warn("Announcement listener failed: {}", e.toString());
        }
    }
}
