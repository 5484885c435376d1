package com.phillippitts.jukebox.service.process;

import com.phillippitts.jukebox.config.properties.PlayerProcessProperties;
import com.phillippitts.jukebox.exception.ResourceUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Spawns the external audio player (mpv by default) for a stream URL or a local file.
 */
@Component
public class MediaPlayerLauncher {

    private static final Logger LOG = LogManager.getLogger(MediaPlayerLauncher.class);

    private final PlayerProcessProperties props;
    private final ProcessFactory processFactory;

    public MediaPlayerLauncher(PlayerProcessProperties props, ProcessFactory processFactory) {
        this.props = Objects.requireNonNull(props, "props");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Starts playing {@code target}.
     *
     * @param target stream URL or file path
     * @param label  short description used in logs
     * @return handle owning the started process
     * @throws ResourceUnavailableException if the player binary cannot be started
     */
    public PlayerProcess play(String target, String label) {
        Objects.requireNonNull(target, "target");
        List<String> command = new ArrayList<>();
        command.add(props.binary());
        command.addAll(props.arguments());
        command.add(target);
        try {
            Process process = processFactory.startDetached(command);
            LOG.debug("Started player for '{}'", label);
            return new PlayerProcess(process, label, props.terminateGrace());
        } catch (IOException e) {
            throw new ResourceUnavailableException(props.binary(), "Cannot start media player", e);
        }
    }
}
