package com.phillippitts.jukebox.exception;

/**
 * Thrown when a source rotation is requested but no media sources are configured.
 */
public class NoSourcesException extends JukeboxException {

    public NoSourcesException() {
        super("No media sources available");
    }
}
