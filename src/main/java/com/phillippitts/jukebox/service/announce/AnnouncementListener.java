package com.phillippitts.jukebox.service.announce;

/**
 * Callback for announcement playback. Invoked on the announcer worker thread; implementations
 * must return quickly.
 */
public interface AnnouncementListener {

    /** An announcement started while none was playing. */
    void onAnnouncementStarted(String text);

    /** The last announcement finished or was stopped, and none is playing now. */
    void onAnnouncementFinished();
}
