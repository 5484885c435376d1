package com.phillippitts.jukebox.service.button;

import java.util.Locale;

/**
 * Action bound to a physical (or emulated) button.
 */
public enum ButtonAction {
    TOGGLE_PLAY,
    PREVIOUS,
    NEXT,
    CYCLE_SOURCE,
    /** One clockwise step of the volume encoder. */
    VOLUME_UP,
    /** One counter-clockwise step of the volume encoder. */
    VOLUME_DOWN,
    /** Encoder push switch. */
    TOGGLE_MUTE;

    /** Lower-case name recorded in the button event log, e.g. {@code cycle_source}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
