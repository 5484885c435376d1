package com.phillippitts.jukebox.presentation.controller;

import com.phillippitts.jukebox.domain.MediaSource;
import com.phillippitts.jukebox.service.player.PlayerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Transport, source cycling, volume and announcement commands.
 *
 * <p>Transport endpoints answer 202 because the command is only queued.
 */
@RestController
@RequestMapping("/api/player")
class PlayerController {

    private static final Logger LOG = LogManager.getLogger(PlayerController.class);

    private final PlayerService player;

    PlayerController(PlayerService player) {
        this.player = player;
    }

    @PostMapping("/toggle")
    ResponseEntity<Void> toggle() {
        player.togglePlay();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/next")
    ResponseEntity<Void> next() {
        player.next();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/previous")
    ResponseEntity<Void> previous() {
        player.previous();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/cycle-source")
    ResponseEntity<SourceView> cycleSource() {
        MediaSource source = player.cycleSource();
        LOG.info("Source cycled via API to '{}'", source.displayName());
        return ResponseEntity.ok(SourceView.of(source));
    }

    @GetMapping("/volume")
    ResponseEntity<Map<String, Object>> volume() {
        OptionalInt level = player.getCurrentVolume();
        if (level.isEmpty()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("available", false));
        }
        return ResponseEntity.ok(Map.of("available", true, "level", level.getAsInt()));
    }

    @PutMapping("/volume")
    ResponseEntity<Map<String, Object>> setVolume(@Valid @RequestBody VolumeRequest request) {
        boolean applied = player.setVolume(request.level(), request.synchronous());
        HttpStatus status = applied ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(Map.of("applied", applied, "level", request.level()));
    }

    @PostMapping("/volume/up")
    ResponseEntity<Map<String, Object>> volumeUp() {
        return stepResult(player.volumeUp());
    }

    @PostMapping("/volume/down")
    ResponseEntity<Map<String, Object>> volumeDown() {
        return stepResult(player.volumeDown());
    }

    @PostMapping("/volume/mute")
    ResponseEntity<Map<String, Object>> toggleMute() {
        Optional<Boolean> muted = player.toggleMute();
        if (muted.isEmpty()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("available", false));
        }
        return ResponseEntity.ok(Map.of("available", true, "muted", muted.get()));
    }

    @GetMapping("/volume/max")
    ResponseEntity<Map<String, Object>> maxVolume() {
        return ResponseEntity.ok(Map.of("maxLimit", player.getMaxVolume()));
    }

    @PutMapping("/volume/max")
    ResponseEntity<Map<String, Object>> setMaxVolume(@Valid @RequestBody MaxVolumeRequest request) {
        int limit = player.setMaxVolume(request.limit());
        return ResponseEntity.ok(Map.of("maxLimit", limit));
    }

    private static ResponseEntity<Map<String, Object>> stepResult(OptionalInt level) {
        if (level.isEmpty()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("available", false));
        }
        return ResponseEntity.ok(Map.of("available", true, "level", level.getAsInt()));
    }

    @PostMapping("/announce")
    ResponseEntity<Map<String, Object>> announce(@Valid @RequestBody AnnounceRequest request) {
        boolean accepted = player.announce(request.text());
        return ResponseEntity.status(accepted ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("accepted", accepted));
    }

    record VolumeRequest(@NotNull @Min(0) @Max(100) Integer level, boolean synchronous) {
    }

    record MaxVolumeRequest(@NotNull @Min(0) @Max(100) Integer limit) {
    }

    record AnnounceRequest(@NotBlank String text) {
    }
}
