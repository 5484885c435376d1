package com.phillippitts.jukebox.service.sequencer;

import com.phillippitts.jukebox.domain.TrackInfo;
import com.phillippitts.jukebox.exception.BackendConnectionException;
import com.phillippitts.jukebox.exception.CommandFailedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the client against a scripted MPD server on a loopback socket.
 */
class MpdSequencerClientTest {

    private ScriptedMpdServer server;
    private MpdSequencerClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new ScriptedMpdServer("OK MPD 0.19.0");
        server.start();
        client = new MpdSequencerClient(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() throws IOException {
        client.disconnect();
        server.close();
    }

    @Test
    void connectReadsGreeting() {
        client.connect("127.0.0.1", server.port());

        assertThat(client.isConnected()).isTrue();
        assertThat(client.serverVersion()).isEqualTo("0.19.0");
    }

    @Test
    void loadReplacesQueueShufflesAndPlays() {
        client.connect("127.0.0.1", server.port());

        client.load("spotify:playlist:37i9dQZF1DXcBWIGoYBM5M", true, true);

        assertThat(server.received).containsExactly(
                "clear",
                "add \"spotify:playlist:37i9dQZF1DXcBWIGoYBM5M\"",
                "random \"1\"",
                "play");
    }

    @Test
    void parsesStatusAndCurrentSong() {
        server.respond("status", "volume: 65", "state: play", "elapsed: 42.250", "duration: 200.000");
        server.respond("currentsong", "file: spotify:track:xyz", "Title: Song", "Artist: Band", "Album: Record");
        client.connect("127.0.0.1", server.port());

        assertThat(client.getVolume()).isEqualTo(65);
        assertThat(client.getPhase()).isEqualTo(SequencerPhase.PLAYING);
        assertThat(client.getTime()).isEqualTo(new PlaybackTime(42.25, 200.0));
        assertThat(client.getCurrentItem()).contains(new TrackInfo("Song", "Band", "Record", "spotify:track:xyz"));
    }

    @Test
    void fallsBackToLegacyTimeField() {
        server.respond("status", "state: pause", "time: 10:120");
        client.connect("127.0.0.1", server.port());

        assertThat(client.getTime()).isEqualTo(new PlaybackTime(10.0, 120.0));
        assertThat(client.getPhase()).isEqualTo(SequencerPhase.PAUSED);
    }

    @Test
    void statusWithoutVolumeMeansNoMixer() {
        server.respond("status", "state: stop");
        client.connect("127.0.0.1", server.port());

        assertThat(client.getVolume()).isEqualTo(-1);
        assertThat(client.getCurrentItem()).isEmpty();
    }

    @Test
    void volumeIsClamped() {
        client.connect("127.0.0.1", server.port());

        client.setVolume(150);

        assertThat(server.received).containsExactly("setvol \"100\"");
    }

    @Test
    void ackBecomesCommandFailure() {
        server.fail("add", "ACK [50@0] {add} No such playlist");
        client.connect("127.0.0.1", server.port());

        assertThatThrownBy(() -> client.load("spotify:playlist:missing", false, false))
                .isInstanceOf(CommandFailedException.class)
                .hasMessageContaining("No such playlist");
    }

    @Test
    void unreachableServerIsConnectionFailure() throws IOException {
        int port = server.port();
        server.close();

        assertThatThrownBy(() -> client.connect("127.0.0.1", port))
                .isInstanceOf(BackendConnectionException.class);
        assertThat(client.isConnected()).isFalse();
    }

    @Test
    void commandsWithoutConnectionFail() {
        assertThatThrownBy(client::play).isInstanceOf(BackendConnectionException.class);
    }

    @Test
    void quotesArguments() {
        assertThat(MpdSequencerClient.quote("a \"b\" \\c")).isEqualTo("\"a \\\"b\\\" \\\\c\"");
    }

    /**
     * Single-connection MPD server answering OK, or scripted lines, per command.
     */
    static final class ScriptedMpdServer {
        private final String greeting;
        private final ServerSocket serverSocket;
        private final Map<String, List<String>> responses = new ConcurrentHashMap<>();
        private final Map<String, String> failures = new ConcurrentHashMap<>();
        final List<String> received = new CopyOnWriteArrayList<>();

        ScriptedMpdServer(String greeting) throws IOException {
            this.greeting = greeting;
            this.serverSocket = new ServerSocket(0);
        }

        int port() {
            return serverSocket.getLocalPort();
        }

        void respond(String command, String... lines) {
            responses.put(command, List.of(lines));
        }

        void fail(String command, String ackLine) {
            failures.put(command, ackLine);
        }

        void start() {
            Thread t = new Thread(this::serve, "scripted-mpd");
            t.setDaemon(true);
            t.start();
        }

        void close() throws IOException {
            serverSocket.close();
        }

        private void serve() {
            while (!serverSocket.isClosed()) {
                try (Socket socket = serverSocket.accept();
                     BufferedReader in = new BufferedReader(
                             new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                     PrintWriter out = new PrintWriter(
                             new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8), true)) {
                    out.print(greeting + "\n");
                    out.flush();
                    String line;
                    while ((line = in.readLine()) != null) {
                        if ("close".equals(line)) {
                            break;
                        }
                        String command = line.split(" ", 2)[0];
                        if (!"status".equals(command) && !"currentsong".equals(command) && !"ping".equals(command)) {
                            received.add(line);
                        }
                        String ack = failures.get(command);
                        if (ack != null) {
                            out.print(ack + "\n");
                        } else {
                            for (String r : responses.getOrDefault(command, List.of())) {
                                out.print(r + "\n");
                            }
                            out.print("OK\n");
                        }
                        out.flush();
                    }
                } catch (IOException e) {
                    return;
                }
            }
        }
    }
}
