package com.phillippitts.jukebox.service.announce;

/**
 * Commands accepted by {@link AnnouncerWorker}.
 */
public sealed interface AnnouncerCommand {

    record Announce(String text) implements AnnouncerCommand {
        public Announce {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("Announcement text must not be blank");
            }
        }
    }

    record Shutdown() implements AnnouncerCommand {}
}
