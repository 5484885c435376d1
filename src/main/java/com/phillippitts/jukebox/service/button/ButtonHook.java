package com.phillippitts.jukebox.service.button;

import java.util.function.Consumer;

/**
 * Source of button edges (GPIO bridge, keyboard emulation).
 *
 * <p>Provides a test seam so unit tests can inject a fake implementation and stay hermetic.
 */
public interface ButtonHook {

    /** Start delivering signals. Idempotent. */
    void register();

    /** Stop delivering signals. Idempotent. */
    void unregister();

    /** Sets the single listener receiving signals. */
    void addListener(Consumer<ButtonSignal> listener);
}
