/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.jukebox.exception.JukeboxException} and are unchecked:
 * <ul>
 *   <li>{@link com.phillippitts.jukebox.exception.BackendConnectionException} - backend unreachable;
 *       the owning worker backs off and reconnects</li>
 *   <li>{@link com.phillippitts.jukebox.exception.CommandFailedException} - connected, but an operation failed</li>
 *   <li>{@link com.phillippitts.jukebox.exception.ResourceUnavailableException} - missing binary or voice data;
 *       the feature is disabled once</li>
 *   <li>{@link com.phillippitts.jukebox.exception.StreamUnavailableException} - a video item cannot be streamed (yet)</li>
 *   <li>{@link com.phillippitts.jukebox.exception.NoSourcesException} - source rotation with an empty list</li>
 *   <li>{@link com.phillippitts.jukebox.exception.ServiceNotReadyException} - a worker never started</li>
 * </ul>
 *
 * <p>Exceptions reaching the REST boundary are mapped to HTTP status codes by
 * {@code presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.jukebox.exception;
