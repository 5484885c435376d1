package com.phillippitts.jukebox.presentation.controller;

import com.phillippitts.jukebox.domain.ButtonPhase;
import com.phillippitts.jukebox.service.button.ButtonManager;
import com.phillippitts.jukebox.service.button.ButtonSignal;
import com.phillippitts.jukebox.service.button.PinStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Entry point for external edge detectors (GPIO daemons) reporting button edges, plus the
 * per-pin status view.
 */
@RestController
@RequestMapping("/api/buttons")
class ButtonController {

    private final ButtonManager buttons;

    ButtonController(ButtonManager buttons) {
        this.buttons = buttons;
    }

    @GetMapping("/status")
    ResponseEntity<StatusView> status() {
        return ResponseEntity.ok(new StatusView(buttons.getPinStatus(), buttons.isRunning()));
    }

    @PostMapping("/{pin}/press")
    ResponseEntity<Void> press(@PathVariable int pin) {
        buttons.onSignal(new ButtonSignal(pin, ButtonPhase.PRESSED, System.currentTimeMillis()));
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{pin}/release")
    ResponseEntity<Void> release(@PathVariable int pin) {
        buttons.onSignal(new ButtonSignal(pin, ButtonPhase.RELEASED, System.currentTimeMillis()));
        return ResponseEntity.accepted().build();
    }

    record StatusView(List<PinStatus> pins, boolean monitorRunning) {
    }
}
