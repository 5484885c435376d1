package com.phillippitts.jukebox.exception;

/**
 * Thrown when an external helper process (resolver, synthesizer) exits abnormally,
 * times out, or cannot be started.
 */
public class ProcessFailureException extends JukeboxException {

    private final String tool;
    private final int exitCode;

    public ProcessFailureException(String message, String tool, int exitCode) {
        super(message + " (tool: " + tool + ")");
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public ProcessFailureException(String message, String tool, int exitCode, Throwable cause) {
        super(message + " (tool: " + tool + ")", cause);
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public String getTool() {
        return tool;
    }

    /** Exit code of the process, or -1 when it did not exit on its own. */
    public int getExitCode() {
        return exitCode;
    }
}
