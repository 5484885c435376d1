/**
 * Channel-based video playback: listing and stream resolution, unwatched-first selection and the
 * worker that owns the player process.
 */
package com.phillippitts.jukebox.service.video;
