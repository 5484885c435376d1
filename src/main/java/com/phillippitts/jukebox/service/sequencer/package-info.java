/**
 * Music sequencer backend: the MPD protocol client, reconnect backoff and the worker that owns
 * the connection.
 */
package com.phillippitts.jukebox.service.sequencer;
