/**
 * Spoken announcements: Piper synthesis, the text-keyed audio cache and the interrupting
 * announcer worker.
 */
package com.phillippitts.jukebox.service.announce;
