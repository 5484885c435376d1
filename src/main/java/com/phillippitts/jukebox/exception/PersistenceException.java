package com.phillippitts.jukebox.exception;

/**
 * Thrown when the persistence store cannot be read or written.
 * Callers fall back to in-memory defaults.
 */
public class PersistenceException extends JukeboxException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
