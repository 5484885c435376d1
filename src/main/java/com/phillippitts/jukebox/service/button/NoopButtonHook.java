package com.phillippitts.jukebox.service.button;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Hook used when keyboard emulation is off. Hardware edges arrive through the REST surface instead.
 */
@Component
@ConditionalOnProperty(prefix = "jukebox.buttons.keyboard", name = "enabled", havingValue = "false",
        matchIfMissing = true)
public class NoopButtonHook implements ButtonHook {

    private static final Logger LOG = LogManager.getLogger(NoopButtonHook.class);

    @Override
    public void register() {
        LOG.info("Keyboard button emulation disabled; expecting button signals over HTTP");
    }

    @Override
    public void unregister() {
    }

    @Override
    public void addListener(Consumer<ButtonSignal> listener) {
    }
}
