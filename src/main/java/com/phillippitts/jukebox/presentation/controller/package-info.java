/**
 * REST controllers of the control API. Controllers only translate HTTP to
 * {@link com.phillippitts.jukebox.service.player.PlayerService} calls.
 */
package com.phillippitts.jukebox.presentation.controller;
