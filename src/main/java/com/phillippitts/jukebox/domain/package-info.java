/**
 * Immutable value types shared by the playback workers, the orchestrator and the REST layer.
 *
 * <p>All types are records or enums and validate their invariants on construction:
 * <ul>
 *   <li>{@link com.phillippitts.jukebox.domain.PlaybackState} - snapshot of the shared playback state</li>
 *   <li>{@link com.phillippitts.jukebox.domain.MediaSource} - a playlist or channel in the rotation</li>
 *   <li>{@link com.phillippitts.jukebox.domain.ButtonEvent} - one entry of the bounded button event log</li>
 * </ul>
 */
package com.phillippitts.jukebox.domain;
