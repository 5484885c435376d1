/**
 * External process plumbing: spawning through a testable {@link com.phillippitts.jukebox.service.process.ProcessFactory},
 * run-to-completion helpers ({@link com.phillippitts.jukebox.service.process.ProcessRunner}) and scoped long-running
 * players ({@link com.phillippitts.jukebox.service.process.PlayerProcess}).
 */
package com.phillippitts.jukebox.service.process;
