package com.phillippitts.jukebox.service.button;

import com.phillippitts.jukebox.domain.ButtonPhase;

import java.util.Objects;

/**
 * Edge reported by a button hook: a pin went down or up.
 */
public record ButtonSignal(int pinId, ButtonPhase phase, long whenMillis) {

    public ButtonSignal {
        Objects.requireNonNull(phase, "phase");
    }
}
