package com.phillippitts.jukebox.presentation.controller;

import com.phillippitts.jukebox.domain.MediaSource;

/**
 * JSON shape of a source, using the persisted wire names.
 */
record SourceView(String name, String type, String uri, String sourceType) {

    static SourceView of(MediaSource source) {
        return new SourceView(source.displayName(), source.kind().wireName(), source.locator(),
                source.category().label());
    }
}
