package com.phillippitts.jukebox.exception;

/**
 * Thrown at the API boundary when a playback worker has never been started.
 */
public class ServiceNotReadyException extends JukeboxException {

    private final String component;

    public ServiceNotReadyException(String component) {
        super("Service not ready: " + component + " has not started");
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
