package com.phillippitts.jukebox.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time copy of what the jukebox is doing.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies and are meant
 * to be used inside {@code SharedPlaybackState.mutate}. {@code currentTrack}, {@code position}
 * and {@code duration} may be null when unknown.
 */
public record PlaybackState(
        boolean playing,
        TrackInfo currentTrack,
        SourceKind activeSourceKind,
        Double position,
        Double duration,
        List<ButtonEvent> eventLog
) {

    public PlaybackState {
        activeSourceKind = Objects.requireNonNullElse(activeSourceKind, SourceKind.NONE);
        eventLog = eventLog == null ? List.of() : List.copyOf(eventLog);
    }

    public static PlaybackState initial() {
        return new PlaybackState(false, null, SourceKind.NONE, null, null, List.of());
    }

    public Optional<TrackInfo> track() {
        return Optional.ofNullable(currentTrack);
    }

    public PlaybackState withPlaying(boolean value) {
        return new PlaybackState(value, currentTrack, activeSourceKind, position, duration, eventLog);
    }

    public PlaybackState withCurrentTrack(TrackInfo value) {
        return new PlaybackState(playing, value, activeSourceKind, position, duration, eventLog);
    }

    public PlaybackState withActiveSourceKind(SourceKind value) {
        return new PlaybackState(playing, currentTrack, value, position, duration, eventLog);
    }

    public PlaybackState withTime(Double newPosition, Double newDuration) {
        return new PlaybackState(playing, currentTrack, activeSourceKind, newPosition, newDuration, eventLog);
    }

    public PlaybackState withEventLog(List<ButtonEvent> value) {
        return new PlaybackState(playing, currentTrack, activeSourceKind, position, duration, value);
    }
}
