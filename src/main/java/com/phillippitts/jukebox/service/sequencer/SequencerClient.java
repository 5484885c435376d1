package com.phillippitts.jukebox.service.sequencer;

import com.phillippitts.jukebox.domain.TrackInfo;

import java.util.Optional;

/**
 * Connection to the music sequencer backend.
 *
 * <p>Implementations are confined to the sequencer worker thread and need not be thread-safe.
 * Every operation may throw {@link com.phillippitts.jukebox.exception.BackendConnectionException}
 * when the connection is lost, or {@link com.phillippitts.jukebox.exception.CommandFailedException}
 * when the backend rejects the request.
 */
public interface SequencerClient {

    /** Opens the connection; a no-op when already connected and responsive. */
    void connect(String host, int port);

    /** Closes the connection. Never throws. */
    void disconnect();

    boolean isConnected();

    void play();

    void pause();

    void next();

    void previous();

    void stop();

    /**
     * Replaces the queue with the items of {@code locator}.
     *
     * @param locator  playlist URI understood by the backend
     * @param shuffle  enable random order
     * @param autoplay start playback after loading
     */
    void load(String locator, boolean shuffle, boolean autoplay);

    /**
     * @return mixer volume 0-100, or -1 when the backend has no mixer
     */
    int getVolume();

    /**
     * @param level volume 0-100
     */
    void setVolume(int level);

    SequencerPhase getPhase();

    Optional<TrackInfo> getCurrentItem();

    PlaybackTime getTime();
}
