package com.phillippitts.jukebox.domain;

/** Edge of a physical (or emulated) button. */
public enum ButtonPhase {
    PRESSED,
    RELEASED
}
