package com.phillippitts.jukebox.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ProcessFailureException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ProcessFailureExceptionBuilder.create("Non-zero exit")
 *         .tool("yt-dlp")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class ProcessFailureExceptionBuilder {

    private final String message;
    private String tool;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProcessFailureExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ProcessFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProcessFailureExceptionBuilder(message);
    }

    public ProcessFailureExceptionBuilder tool(String tool) {
        this.tool = tool;
        return this;
    }

    public ProcessFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProcessFailureExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ProcessFailureExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the exception message. Null keys or values are ignored.
     */
    public ProcessFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    public ProcessFailureException build() {
        String detailedMessage = buildDetailedMessage();
        String toolName = tool != null ? tool : "unknown";
        int code = exitCode != null ? exitCode : -1;

        if (cause != null) {
            return new ProcessFailureException(detailedMessage, toolName, code, cause);
        }
        return new ProcessFailureException(detailedMessage, toolName, code);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
