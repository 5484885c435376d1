package com.phillippitts.jukebox.service.button;

import com.phillippitts.jukebox.config.properties.ButtonProperties;
import com.phillippitts.jukebox.domain.ButtonEvent;
import com.phillippitts.jukebox.domain.ButtonPhase;
import com.phillippitts.jukebox.exception.NoSourcesException;
import com.phillippitts.jukebox.exception.ServiceNotReadyException;
import com.phillippitts.jukebox.service.player.PlayerService;
import com.phillippitts.jukebox.service.state.SharedPlaybackState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ButtonManagerTest {

    private FakeHook hook;
    private SharedPlaybackState state;
    private PlayerService player;
    private ButtonManager manager;

    @BeforeEach
    void setUp() {
        hook = new FakeHook();
        state = new SharedPlaybackState(10);
        player = mock(PlayerService.class);
        manager = new ButtonManager(hook, new ButtonProperties(), state, player);
    }

    @Test
    void startRegistersHookAndStopUnregisters() {
        manager.start();
        assertThat(hook.reg.get()).isTrue();
        assertThat(manager.isRunning()).isTrue();

        manager.stop();
        assertThat(hook.reg.get()).isFalse();
        assertThat(manager.isRunning()).isFalse();
    }

    @Test
    void startsAfterPlayerService() {
        assertThat(manager.getPhase()).isGreaterThan(PlayerService.PHASE);
    }

    @Test
    void pressOfBoundPinRecordsActionAndDispatches() {
        manager.start();

        hook.emit(new ButtonSignal(17, ButtonPhase.PRESSED, 1L));
        hook.emit(new ButtonSignal(22, ButtonPhase.PRESSED, 2L));
        hook.emit(new ButtonSignal(27, ButtonPhase.PRESSED, 3L));
        hook.emit(new ButtonSignal(23, ButtonPhase.PRESSED, 4L));

        verify(player).togglePlay();
        verify(player).next();
        verify(player).previous();
        verify(player).cycleSource();
        assertThat(state.getRecentEvents(10))
                .extracting(e -> e.action().orElse(null))
                .containsExactly("toggle_play", "next", "previous", "cycle_source");
    }

    @Test
    void releaseIsRecordedWithoutAction() {
        manager.start();

        hook.emit(new ButtonSignal(17, ButtonPhase.RELEASED, 1L));

        List<ButtonEvent> events = state.getRecentEvents(10);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).phase()).isEqualTo(ButtonPhase.RELEASED);
        assertThat(events.get(0).action()).isEmpty();
        verifyNoInteractions(player);
    }

    @Test
    void unboundPinIsOnlyRecorded() {
        hook.emit(new ButtonSignal(9, ButtonPhase.PRESSED, 1L));
        manager.onSignal(new ButtonSignal(9, ButtonPhase.PRESSED, 1L));

        assertThat(state.getRecentEvents(10)).singleElement()
                .satisfies(e -> {
                    assertThat(e.pinId()).isEqualTo(9);
                    assertThat(e.action()).isEmpty();
                });
        verifyNoInteractions(player);
    }

    @Test
    void playerFailureIsSwallowed() {
        manager.start();
        when(player.cycleSource()).thenThrow(new NoSourcesException());
        doThrow(new ServiceNotReadyException("video-worker")).when(player).togglePlay();

        hook.emit(new ButtonSignal(23, ButtonPhase.PRESSED, 1L));
        hook.emit(new ButtonSignal(17, ButtonPhase.PRESSED, 2L));

        assertThat(state.getRecentEvents(10)).hasSize(2);
    }

    @Test
    void hookPermissionFailureLeavesManagerStopped() {
        ButtonManager denied = new ButtonManager(new DeniedHook(), new ButtonProperties(), state, player);

        denied.start();

        assertThat(denied.isRunning()).isFalse();
    }

    @Test
    void customPinMapping() {
        ButtonProperties props = new ButtonProperties();
        props.setPins(Map.of(5, ButtonAction.NEXT));
        ButtonManager custom = new ButtonManager(hook, props, state, player);
        custom.start();

        hook.emit(new ButtonSignal(5, ButtonPhase.PRESSED, 1L));
        hook.emit(new ButtonSignal(22, ButtonPhase.PRESSED, 2L));

        verify(player).next();
        assertThat(state.getRecentEvents(10).get(1).action()).isEmpty();
    }

    @Test
    void volumeEncoderPinsDispatchVolumeActions() {
        manager.start();

        hook.emit(new ButtonSignal(5, ButtonPhase.PRESSED, 1L));
        hook.emit(new ButtonSignal(5, ButtonPhase.PRESSED, 2L));
        hook.emit(new ButtonSignal(6, ButtonPhase.PRESSED, 3L));
        hook.emit(new ButtonSignal(13, ButtonPhase.PRESSED, 4L));

        verify(player, times(2)).volumeUp();
        verify(player).volumeDown();
        verify(player).toggleMute();
        assertThat(state.getRecentEvents(10))
                .extracting(e -> e.action().orElse(null))
                .containsExactly("volume_up", "volume_up", "volume_down", "toggle_mute");
    }

    @Test
    void pinStatusListsBoundPinsInOrderWithLastPhase() {
        manager.start();
        hook.emit(new ButtonSignal(22, ButtonPhase.PRESSED, 1L));
        hook.emit(new ButtonSignal(17, ButtonPhase.PRESSED, 2L));
        hook.emit(new ButtonSignal(17, ButtonPhase.RELEASED, 3L));
        hook.emit(new ButtonSignal(9, ButtonPhase.PRESSED, 4L));

        List<PinStatus> status = manager.getPinStatus();

        assertThat(status).extracting(PinStatus::pin).containsExactly(5, 6, 13, 17, 22, 23, 27);
        assertThat(status).filteredOn(p -> p.pin() == 22).singleElement()
                .satisfies(p -> {
                    assertThat(p.action()).isEqualTo("next");
                    assertThat(p.phase()).isEqualTo(ButtonPhase.PRESSED);
                });
        assertThat(status).filteredOn(p -> p.pin() != 22)
                .extracting(PinStatus::phase)
                .containsOnly(ButtonPhase.RELEASED);
    }

    static class FakeHook implements ButtonHook {
        final AtomicBoolean reg = new AtomicBoolean();
        private volatile Consumer<ButtonSignal> listener;
        @Override public void register() { reg.set(true); }
        @Override public void unregister() { reg.set(false); }
        @Override public void addListener(Consumer<ButtonSignal> listener) { this.listener = listener; }
        void emit(ButtonSignal s) { Consumer<ButtonSignal> l = listener; if (l != null) l.accept(s); }
    }

    static class DeniedHook implements ButtonHook {
        @Override public void register() { throw new SecurityException("accessibility permission missing"); }
        @Override public void unregister() { }
        @Override public void addListener(Consumer<ButtonSignal> listener) { }
    }
}
