package com.phillippitts.jukebox.exception;

/**
 * Thrown when the backend is connected but rejects or fails a specific operation.
 */
public class CommandFailedException extends JukeboxException {

    private final String command;

    public CommandFailedException(String command, String message) {
        super("Command '" + command + "' failed: " + message);
        this.command = command;
    }

    public CommandFailedException(String command, String message, Throwable cause) {
        super("Command '" + command + "' failed: " + message, cause);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
