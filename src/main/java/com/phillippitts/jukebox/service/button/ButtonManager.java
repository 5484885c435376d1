package com.phillippitts.jukebox.service.button;

import com.phillippitts.jukebox.config.properties.ButtonProperties;
import com.phillippitts.jukebox.domain.ButtonPhase;
import com.phillippitts.jukebox.exception.JukeboxException;
import com.phillippitts.jukebox.service.player.PlayerService;
import com.phillippitts.jukebox.service.state.SharedPlaybackState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;

import java.util.List;
import java.util.Map;

/**
 * Turns button edges into event log entries and player actions.
 *
 * <p>Every edge is recorded. A press of a bound pin records its action name and triggers the
 * action; releases are recorded without an action. Unbound pins are only recorded.
 * Tests inject a fake {@link ButtonHook} and emit signals to the registered listener.
 */
@Service
public class ButtonManager implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ButtonManager.class);

    private final ButtonHook hook;
    private final ButtonProperties props;
    private final SharedPlaybackState state;
    private final PlayerService player;

    private volatile boolean running;

    public ButtonManager(ButtonHook hook,
                         ButtonProperties props,
                         SharedPlaybackState state,
                         PlayerService player) {
        this.hook = hook;
        this.props = props;
        this.state = state;
        this.player = player;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        try {
            hook.addListener(this::onSignal);
            hook.register();
            running = true;
            LOG.info("ButtonManager started with pins {}", props.getPins());
        } catch (SecurityException se) {
            LOG.warn("Button hook permission denied: {}", se.toString());
        } catch (RuntimeException e) {
            // buttons stay unavailable; the HTTP surface still works
            LOG.error("Failed to start ButtonManager", e);
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            hook.unregister();
        } catch (RuntimeException e) {
            LOG.debug("Error unregistering button hook: {}", e.toString());
        }
        running = false;
        LOG.info("ButtonManager stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PlayerService.PHASE + 100;
    }

    /**
     * Handles one edge. Player failures are logged and do not propagate to the hook.
     */
    public void onSignal(ButtonSignal signal) {
        ButtonAction action = props.getPins().get(signal.pinId());
        boolean press = signal.phase() == ButtonPhase.PRESSED;
        state.addEvent(signal.pinId(), signal.phase(), press && action != null ? action.label() : null);
        if (!press || action == null) {
            return;
        }
        LOG.info("Button {} pressed: {}", signal.pinId(), action.label());
        try {
            dispatch(action);
        } catch (JukeboxException e) {
            LOG.warn("Button action {} failed: {}", action.label(), e.getMessage());
        }
    }

    private void dispatch(ButtonAction action) {
        switch (action) {
            case TOGGLE_PLAY -> player.togglePlay();
            case PREVIOUS -> player.previous();
            case NEXT -> player.next();
            case CYCLE_SOURCE -> player.cycleSource();
            case VOLUME_UP -> player.volumeUp();
            case VOLUME_DOWN -> player.volumeDown();
            case TOGGLE_MUTE -> player.toggleMute();
        }
    }

    /**
     * Status of every bound pin ordered by pin number.
     */
    public List<PinStatus> getPinStatus() {
        Map<Integer, ButtonPhase> phases = state.getPinPhases();
        return props.getPins().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> new PinStatus(e.getKey(), e.getValue().label(),
                        phases.getOrDefault(e.getKey(), ButtonPhase.RELEASED)))
                .toList();
    }
}
