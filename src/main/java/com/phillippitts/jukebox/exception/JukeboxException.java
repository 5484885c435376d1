package com.phillippitts.jukebox.exception;

/**
 * Base exception for all jukebox application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class JukeboxException extends RuntimeException {

    public JukeboxException(String message) {
        super(message);
    }

    public JukeboxException(String message, Throwable cause) {
        super(message, cause);
    }

    public JukeboxException(Throwable cause) {
        super(cause);
    }
}
