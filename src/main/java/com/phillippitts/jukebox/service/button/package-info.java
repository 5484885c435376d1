/**
 * Button input: hooks delivering pin edges and the manager mapping pins to player actions.
 */
package com.phillippitts.jukebox.service.button;
