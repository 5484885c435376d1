/**
 * Maps application exceptions to HTTP responses.
 */
package com.phillippitts.jukebox.presentation.exception;
