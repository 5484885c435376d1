package com.phillippitts.jukebox.exception;

/**
 * Thrown when an external binary or data file required by a feature is missing.
 * The affected feature is disabled for the lifetime of the process.
 */
public class ResourceUnavailableException extends JukeboxException {

    private final String resource;

    public ResourceUnavailableException(String resource, String message) {
        super(message + " (resource: " + resource + ")");
        this.resource = resource;
    }

    public ResourceUnavailableException(String resource, String message, Throwable cause) {
        super(message + " (resource: " + resource + ")", cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
