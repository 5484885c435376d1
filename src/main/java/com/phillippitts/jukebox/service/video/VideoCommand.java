package com.phillippitts.jukebox.service.video;

/**
 * Commands accepted by {@link VideoWorker}.
 */
public sealed interface VideoCommand {

    /** Lists the channel, resets the cursor to its first item and plays the first unwatched one. */
    record PlayChannel(String locator) implements VideoCommand {
        public PlayChannel {
            if (locator == null || locator.isBlank()) {
                throw new IllegalArgumentException("locator must not be blank");
            }
        }
    }

    record Next() implements VideoCommand {}

    record Previous() implements VideoCommand {}

    record Stop() implements VideoCommand {}

    /** Stops the player but keeps the cursor, so {@link Resume} restarts the same item. */
    record Pause() implements VideoCommand {}

    record Resume() implements VideoCommand {}

    record Shutdown() implements VideoCommand {}
}
