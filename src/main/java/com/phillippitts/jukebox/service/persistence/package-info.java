/**
 * Persistence of the source rotation and watched video ids.
 *
 * <p>Failures surface as {@link com.phillippitts.jukebox.exception.PersistenceException}; every
 * caller falls back to in-memory state.
 */
package com.phillippitts.jukebox.service.persistence;
