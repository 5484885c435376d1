package com.phillippitts.jukebox.presentation.controller;

import com.phillippitts.jukebox.domain.ButtonEvent;
import com.phillippitts.jukebox.domain.PlaybackState;
import com.phillippitts.jukebox.domain.TrackInfo;
import com.phillippitts.jukebox.service.player.PlayerService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read-only views of the playback state, the button event log and the source rotation.
 */
@RestController
@Validated
@RequestMapping("/api")
class StateController {

    private final PlayerService player;

    StateController(PlayerService player) {
        this.player = player;
    }

    @GetMapping("/state")
    ResponseEntity<StateView> state() {
        PlaybackState s = player.getSnapshot();
        return ResponseEntity.ok(new StateView(
                s.playing(),
                s.track().orElse(null),
                s.activeSourceKind().name(),
                s.position(),
                s.duration(),
                player.getCurrentSource().map(SourceView::of).orElse(null)));
    }

    @GetMapping("/events")
    ResponseEntity<List<EventView>> events(
            @RequestParam(defaultValue = "10") @Min(1) @Max(1000) int limit) {
        List<EventView> events = player.getRecentEvents(limit).stream()
                .map(EventView::of)
                .toList();
        return ResponseEntity.ok(events);
    }

    @GetMapping("/sources")
    ResponseEntity<List<SourceView>> sources() {
        return ResponseEntity.ok(player.getSources().stream().map(SourceView::of).toList());
    }

    record StateView(boolean playing,
                     TrackInfo currentTrack,
                     String activeSource,
                     Double position,
                     Double duration,
                     SourceView currentSource) {
    }

    record EventView(int pin, String phase, String action, Instant timestamp) {

        static EventView of(ButtonEvent event) {
            return new EventView(event.pinId(), event.phase().name(), event.action().orElse(null),
                    event.timestamp());
        }
    }
}
