package com.phillippitts.jukebox.service.sequencer;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Commands accepted by {@link SequencerWorker}.
 */
public sealed interface SequencerCommand {

    record Play() implements SequencerCommand {}

    record Pause() implements SequencerCommand {}

    /** Pauses when playing, otherwise starts playback; decided from the backend's actual phase. */
    record Toggle() implements SequencerCommand {}

    record Next() implements SequencerCommand {}

    record Previous() implements SequencerCommand {}

    record Stop() implements SequencerCommand {}

    record LoadPlaylist(String locator, boolean shuffle, boolean autoplay) implements SequencerCommand {
        public LoadPlaylist {
            if (locator == null || locator.isBlank()) {
                throw new IllegalArgumentException("locator must not be blank");
            }
        }
    }

    /** Reads the mixer volume; the reply completes exceptionally when the backend fails. */
    record GetVolume(CompletableFuture<Integer> reply) implements SequencerCommand {
        public GetVolume {
            Objects.requireNonNull(reply, "reply");
        }
    }

    /**
     * Sets the mixer volume, clamped to 0-100. The optional ack completes with the outcome.
     */
    record SetVolume(int level, Optional<CompletableFuture<Boolean>> ack) implements SequencerCommand {
        public SetVolume {
            level = Math.max(0, Math.min(100, level));
            ack = ack == null ? Optional.empty() : ack;
        }

        public SetVolume(int level) {
            this(level, Optional.empty());
        }
    }

    /**
     * Changes the volume relative to the current level, bounded by 0 and {@code maxLevel}. The
     * reply carries the applied level, or -1 when the backend has no mixer.
     */
    record AdjustVolume(int delta, int maxLevel, CompletableFuture<Integer> reply) implements SequencerCommand {
        public AdjustVolume {
            Objects.requireNonNull(reply, "reply");
            maxLevel = Math.max(0, Math.min(100, maxLevel));
        }
    }

    /** Mutes by remembering the level and setting 0, or restores the remembered level. Replies with the new muted flag. */
    record ToggleMute(CompletableFuture<Boolean> reply) implements SequencerCommand {
        public ToggleMute {
            Objects.requireNonNull(reply, "reply");
        }
    }

    record Shutdown() implements SequencerCommand {}
}
