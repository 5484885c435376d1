/**
 * HTTP control surface: controllers and error mapping.
 */
package com.phillippitts.jukebox.presentation;
