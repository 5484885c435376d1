package com.phillippitts.jukebox.exception;

/**
 * Thrown when a playback backend cannot be reached or the connection drops mid-operation.
 * Workers react by transitioning to disconnected and backing off; callers of enqueue never see it.
 */
public class BackendConnectionException extends JukeboxException {

    private final String backend;

    public BackendConnectionException(String backend, String message) {
        super(message + " (backend: " + backend + ")");
        this.backend = backend;
    }

    public BackendConnectionException(String backend, String message, Throwable cause) {
        super(message + " (backend: " + backend + ")", cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
