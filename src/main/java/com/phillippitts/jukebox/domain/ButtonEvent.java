package com.phillippitts.jukebox.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of a single button edge, kept in the bounded event log of the playback state.
 *
 * @param pinId     GPIO pin (or virtual pin) that changed
 * @param phase     pressed or released
 * @param action    action name bound to the pin, if any
 * @param timestamp when the edge was observed
 */
public record ButtonEvent(int pinId, ButtonPhase phase, Optional<String> action, Instant timestamp) {

    public ButtonEvent {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        action = action == null ? Optional.empty() : action.filter(a -> !a.isBlank());
    }

    public static ButtonEvent of(int pinId, ButtonPhase phase, String action) {
        return new ButtonEvent(pinId, phase, Optional.ofNullable(action), Instant.now());
    }
}
