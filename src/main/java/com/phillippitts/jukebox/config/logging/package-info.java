/**
 * Logging infrastructure: per-request MDC population for the control API.
 */
package com.phillippitts.jukebox.config.logging;
