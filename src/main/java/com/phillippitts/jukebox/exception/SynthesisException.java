package com.phillippitts.jukebox.exception;

/**
 * Thrown when the speech synthesis backend fails to produce audio for a given text.
 */
public class SynthesisException extends JukeboxException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
