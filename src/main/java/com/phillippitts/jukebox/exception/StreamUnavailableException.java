package com.phillippitts.jukebox.exception;

/**
 * Thrown when a playable stream URL cannot be resolved for a video item,
 * for example a scheduled live stream that has not started yet.
 */
public class StreamUnavailableException extends JukeboxException {

    private final String itemUrl;

    public StreamUnavailableException(String itemUrl, String message, Throwable cause) {
        super("Stream unavailable for " + itemUrl + ": " + message, cause);
        this.itemUrl = itemUrl;
    }

    public String getItemUrl() {
        return itemUrl;
    }
}
