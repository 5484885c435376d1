/**
 * Spring configuration: thread pools and typed property bindings ({@code config.properties}).
 */
package com.phillippitts.jukebox.config;
