/**
 * Generic worker pattern shared by the sequencer, video and announcer backends.
 *
 * <p>A {@link com.phillippitts.jukebox.service.worker.BackendWorker} owns one thread and one
 * bounded {@link com.phillippitts.jukebox.service.worker.CommandQueue}. Producers never block:
 * a saturated queue drops the newest command. Commands of one worker run strictly FIFO; there is
 * no ordering between workers, so cross-worker sequencing (stop before load) is the orchestrator's job.
 */
package com.phillippitts.jukebox.service.worker;
