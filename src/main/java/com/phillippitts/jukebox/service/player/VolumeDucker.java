package com.phillippitts.jukebox.service.player;

import com.phillippitts.jukebox.domain.SourceKind;
import com.phillippitts.jukebox.service.announce.AnnouncementListener;
import com.phillippitts.jukebox.service.sequencer.SequencerWorker;
import com.phillippitts.jukebox.service.state.SharedPlaybackState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.OptionalInt;

/**
 * Lowers the sequencer volume while an announcement plays and restores it afterwards.
 * Only acts while the sequencer is the active source.
 *
 * <p>Called on the announcer worker thread only.
 */
final class VolumeDucker implements AnnouncementListener {

    private static final Logger LOG = LogManager.getLogger(VolumeDucker.class);

    private final SequencerWorker sequencer;
    private final SharedPlaybackState state;
    private final int duckVolume;
    private OptionalInt restoreLevel = OptionalInt.empty();

    VolumeDucker(SequencerWorker sequencer, SharedPlaybackState state, int duckVolume) {
        this.sequencer = sequencer;
        this.state = state;
        this.duckVolume = duckVolume;
    }

    @Override
    public void onAnnouncementStarted(String text) {
        if (state.getSnapshot().activeSourceKind() != SourceKind.SEQUENCER) {
            return;
        }
        OptionalInt level = sequencer.getVolume();
        if (level.isPresent() && level.getAsInt() > duckVolume) {
            restoreLevel = level;
            sequencer.setVolume(duckVolume);
            LOG.debug("Ducked sequencer volume {} -> {}", level.getAsInt(), duckVolume);
        }
    }

    @Override
    public void onAnnouncementFinished() {
        if (restoreLevel.isPresent()) {
            sequencer.setVolume(restoreLevel.getAsInt());
            LOG.debug("Restored sequencer volume to {}", restoreLevel.getAsInt());
            restoreLevel = OptionalInt.empty();
        }
    }
}
