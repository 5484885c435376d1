package com.phillippitts.jukebox.service.button;

import com.phillippitts.jukebox.domain.ButtonPhase;

/**
 * Current state of one bound pin.
 *
 * @param pin    pin number
 * @param action bound action label
 * @param phase  last observed edge, {@link ButtonPhase#RELEASED} until the first edge arrives
 */
public record PinStatus(int pin, String action, ButtonPhase phase) {
}
