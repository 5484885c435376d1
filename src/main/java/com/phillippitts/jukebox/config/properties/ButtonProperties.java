package com.phillippitts.jukebox.config.properties;

import com.phillippitts.jukebox.service.button.ButtonAction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Button wiring: which pin triggers which action, and the optional keyboard emulation.
 *
 * <p>Example application.properties:
 * <pre>
 * jukebox.buttons.pins.17=TOGGLE_PLAY
 * jukebox.buttons.pins.27=PREVIOUS
 * jukebox.buttons.pins.13=TOGGLE_MUTE
 * jukebox.buttons.keyboard.enabled=true
 * jukebox.buttons.keyboard.keys.SPACE=17
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.buttons")
public class ButtonProperties {

    /** Pin number to action. */
    @NotNull
    private Map<Integer, ButtonAction> pins = defaultPins();

    @Valid
    private Keyboard keyboard = new Keyboard();

    private static Map<Integer, ButtonAction> defaultPins() {
        Map<Integer, ButtonAction> pins = new LinkedHashMap<>();
        pins.put(17, ButtonAction.TOGGLE_PLAY);
        pins.put(27, ButtonAction.PREVIOUS);
        pins.put(22, ButtonAction.NEXT);
        pins.put(23, ButtonAction.CYCLE_SOURCE);
        pins.put(5, ButtonAction.VOLUME_UP);
        pins.put(6, ButtonAction.VOLUME_DOWN);
        pins.put(13, ButtonAction.TOGGLE_MUTE);
        return pins;
    }

    public Map<Integer, ButtonAction> getPins() {
        return pins;
    }

    public void setPins(Map<Integer, ButtonAction> pins) {
        this.pins = pins;
    }

    public Keyboard getKeyboard() {
        return keyboard;
    }

    public void setKeyboard(Keyboard keyboard) {
        this.keyboard = keyboard;
    }

    /**
     * Keyboard emulation of the buttons for machines without GPIO.
     */
    public static class Keyboard {

        private boolean enabled = false;

        /** Key name (as reported by the native hook, upper case) to virtual pin. */
        @NotNull
        private Map<String, Integer> keys = defaultKeys();

        private static Map<String, Integer> defaultKeys() {
            Map<String, Integer> keys = new LinkedHashMap<>();
            keys.put("SPACE", 17);
            keys.put("LEFT", 27);
            keys.put("RIGHT", 22);
            keys.put("TAB", 23);
            keys.put("UP", 5);
            keys.put("DOWN", 6);
            keys.put("M", 13);
            return keys;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, Integer> getKeys() {
            return keys;
        }

        public void setKeys(Map<String, Integer> keys) {
            this.keys = keys;
        }
    }
}
