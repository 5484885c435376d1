package com.phillippitts.jukebox.service.video;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VideoPlaylistTest {

    private final List<VideoItem> items = List.of(
            VideoItem.ofId("a", "A"),
            VideoItem.ofId("b", "B"),
            VideoItem.ofId("c", "C"));

    @Test
    void selectsFirstUnwatchedFromCursor() {
        VideoPlaylist playlist = new VideoPlaylist(items);

        assertThat(playlist.selectNextUnwatched(Set.of("a")::contains)).map(VideoItem::id).contains("b");
        assertThat(playlist.currentIndex()).isEqualTo(1);
    }

    @Test
    void loopsToFirstItemWhenAllWatched() {
        VideoPlaylist playlist = new VideoPlaylist(items);
        playlist.advance(id -> false);
        playlist.advance(id -> false);

        assertThat(playlist.selectNextUnwatched(id -> true)).map(VideoItem::id).contains("a");
        assertThat(playlist.currentIndex()).isZero();
    }

    @Test
    void advanceWrapsAroundSkippingWatched() {
        VideoPlaylist playlist = new VideoPlaylist(items);
        playlist.advance(id -> false);
        playlist.advance(id -> false);

        assertThat(playlist.advance(Set.of("a")::contains)).map(VideoItem::id).contains("b");
    }

    @Test
    void retreatWrapsAndIgnoresWatched() {
        VideoPlaylist playlist = new VideoPlaylist(items);

        assertThat(playlist.retreat()).map(VideoItem::id).contains("c");
        assertThat(playlist.retreat()).map(VideoItem::id).contains("b");
    }

    @Test
    void emptyPlaylistSelectsNothing() {
        VideoPlaylist playlist = VideoPlaylist.empty();

        assertThat(playlist.selectNextUnwatched(id -> false)).isEmpty();
        assertThat(playlist.advance(id -> false)).isEmpty();
        assertThat(playlist.retreat()).isEmpty();
        assertThat(playlist.current()).isEmpty();
    }
}
