package com.phillippitts.jukebox.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of process-based backends.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub returning a fake
 * {@link Process} with controlled stdout/stderr/exit behavior.
 */
public interface ProcessFactory {

    /**
     * Starts a process whose stdin/stdout/stderr are pipes owned by the caller.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;

    /**
     * Starts a long-running process whose output is discarded, e.g. a media player.
     *
     * @param command full command line, with the executable as the first element
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process startDetached(List<String> command) throws IOException;
}
