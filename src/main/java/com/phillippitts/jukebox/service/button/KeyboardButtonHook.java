package com.phillippitts.jukebox.service.button;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.phillippitts.jukebox.config.properties.ButtonProperties;
import com.phillippitts.jukebox.domain.ButtonPhase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link ButtonHook} emulating the buttons with global key presses via JNativeHook.
 *
 * <p>Configured keys map to virtual pins. Auto-repeat presses of a held key are suppressed, so a
 * held key produces one press and one release like a physical button.
 */
@Component
@ConditionalOnProperty(prefix = "jukebox.buttons.keyboard", name = "enabled", havingValue = "true")
public class KeyboardButtonHook implements ButtonHook, NativeKeyListener {

    private static final Logger LOG = LogManager.getLogger(KeyboardButtonHook.class);

    private final Map<String, Integer> keyToPin;
    private final Set<Integer> pinsDown = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean registered = new AtomicBoolean(false);
    private volatile Consumer<ButtonSignal> listener;

    public KeyboardButtonHook(ButtonProperties props) {
        Map<String, Integer> normalized = new ConcurrentHashMap<>();
        props.getKeyboard().getKeys().forEach((key, pin) -> normalized.put(normalizeKey(key), pin));
        this.keyToPin = Map.copyOf(normalized);
    }

    @Override
    public void register() {
        if (registered.get()) {
            return;
        }
        try {
            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            registered.set(true);
            LOG.info("Registered keyboard button emulation for keys {}", keyToPin.keySet());
        } catch (NativeHookException | UnsatisfiedLinkError e) {
            throw new SecurityException("Failed to register global key hook: " + e.getMessage(), e);
        }
    }

    @Override
    public void unregister() {
        if (!registered.get()) {
            return;
        }
        try {
            GlobalScreen.removeNativeKeyListener(this);
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            LOG.debug("Error unregistering native hook", e);
        } finally {
            registered.set(false);
            pinsDown.clear();
        }
    }

    @Override
    public void addListener(Consumer<ButtonSignal> listener) {
        this.listener = listener;
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent nativeEvent) {
        keyPressed(NativeKeyEvent.getKeyText(nativeEvent.getKeyCode()));
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent nativeEvent) {
        keyReleased(NativeKeyEvent.getKeyText(nativeEvent.getKeyCode()));
    }

    @Override public void nativeKeyTyped(NativeKeyEvent nativeEvent) { /* ignore */ }

    void keyPressed(String keyText) {
        Integer pin = keyToPin.get(normalizeKey(keyText));
        if (pin != null && pinsDown.add(pin)) {
            emit(new ButtonSignal(pin, ButtonPhase.PRESSED, System.currentTimeMillis()));
        }
    }

    void keyReleased(String keyText) {
        Integer pin = keyToPin.get(normalizeKey(keyText));
        if (pin != null && pinsDown.remove(pin)) {
            emit(new ButtonSignal(pin, ButtonPhase.RELEASED, System.currentTimeMillis()));
        }
    }

    private void emit(ButtonSignal signal) {
        Consumer<ButtonSignal> l = this.listener;
        if (l == null) {
            return;
        }
        try {
            l.accept(signal);
        } catch (RuntimeException ex) {
            LOG.warn("Listener error for {}: {}", signal, ex.toString());
        }
    }

    /** Canonical key name: upper case, spaces to underscores. */
    static String normalizeKey(String keyText) {
        if (keyText == null) {
            return "UNKNOWN";
        }
        return keyText.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    }
}
