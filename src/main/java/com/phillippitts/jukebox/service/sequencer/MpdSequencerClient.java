package com.phillippitts.jukebox.service.sequencer;

import com.phillippitts.jukebox.config.properties.SequencerProperties;
import com.phillippitts.jukebox.domain.TrackInfo;
import com.phillippitts.jukebox.exception.BackendConnectionException;
import com.phillippitts.jukebox.exception.CommandFailedException;
import com.phillippitts.jukebox.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SequencerClient} speaking the MPD text protocol (Mopidy's MPD frontend, or plain MPD).
 *
 * <p>Each request is one line; the server answers with {@code key: value} lines terminated by
 * {@code OK}, or a single {@code ACK [code@index] {command} message} line on error.
 *
 * <p>Not thread-safe; used only from the sequencer worker thread.
 */
@Component
public class MpdSequencerClient implements SequencerClient {

    private static final Logger LOG = LogManager.getLogger(MpdSequencerClient.class);

    static final String BACKEND = "sequencer";
    private static final String GREETING_PREFIX = "OK MPD ";
    private static final String OK = "OK";
    private static final String ACK_PREFIX = "ACK ";

    private final Duration ioTimeout;

    private Socket socket;
    private BufferedReader reader;
    private BufferedWriter writer;
    private String serverVersion;

    @Autowired
    public MpdSequencerClient(SequencerProperties props) {
        this(props.connectTimeout());
    }

    MpdSequencerClient(Duration ioTimeout) {
        this.ioTimeout = ioTimeout;
    }

    @Override
    public void connect(String host, int port) {
        if (isConnected()) {
            try {
                execute("ping");
                return;
            } catch (BackendConnectionException | CommandFailedException e) {
                LOG.debug("Stale sequencer connection, reconnecting: {}", e.getMessage());
                disconnect();
            }
        }
        Socket s = new Socket();
        try {
            int timeoutMs = (int) ioTimeout.toMillis();
            s.connect(new InetSocketAddress(host, port), timeoutMs);
            s.setSoTimeout(timeoutMs);
            BufferedReader in = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
            BufferedWriter out = new BufferedWriter(new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8));
            String greeting = in.readLine();
            if (greeting == null || !greeting.startsWith(GREETING_PREFIX)) {
                closeQuietly(s);
                throw new BackendConnectionException(BACKEND, "Unexpected greeting from " + host + ":" + port
                        + ": " + greeting);
            }
            this.socket = s;
            this.reader = in;
            this.writer = out;
            this.serverVersion = greeting.substring(GREETING_PREFIX.length()).trim();
            LOG.info("Connected to sequencer at {}:{} (protocol {})", host, port, serverVersion);
        } catch (IOException e) {
            closeQuietly(s);
            throw new BackendConnectionException(BACKEND, "Cannot connect to " + host + ":" + port, e);
        }
    }

    @Override
    public void disconnect() {
        if (socket == null) {
            return;
        }
        try {
            writer.write("close\n");
            writer.flush();
        } catch (IOException e) {
            LOG.debug("Error sending close: {}", e.toString());
        }
        closeQuietly(socket);
        socket = null;
        reader = null;
        writer = null;
        LOG.debug("Disconnected from sequencer");
    }

    @Override
    public boolean isConnected() {
        return socket != null && !socket.isClosed();
    }

    @Override
    public void play() {
        execute("play");
    }

    @Override
    public void pause() {
        execute("pause", "1");
    }

    @Override
    public void next() {
        execute("next");
    }

    @Override
    public void previous() {
        execute("previous");
    }

    @Override
    public void stop() {
        execute("stop");
    }

    @Override
    public void load(String locator, boolean shuffle, boolean autoplay) {
        execute("clear");
        execute("add", locator);
        execute("random", shuffle ? "1" : "0");
        if (autoplay) {
            execute("play");
        }
        LOG.info("Loaded playlist '{}' (shuffle={}, autoplay={})", locator, shuffle, autoplay);
    }

    @Override
    public int getVolume() {
        String raw = execute("status").get("volume");
        if (raw == null) {
            return -1;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new CommandFailedException("status", "Malformed volume '" + raw + "'", e);
        }
    }

    @Override
    public void setVolume(int level) {
        int clamped = Math.max(0, Math.min(100, level));
        execute("setvol", String.valueOf(clamped));
    }

    @Override
    public SequencerPhase getPhase() {
        return SequencerPhase.fromMpdState(execute("status").get("state"));
    }

    @Override
    public Optional<TrackInfo> getCurrentItem() {
        Map<String, String> song = execute("currentsong");
        if (song.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TrackInfo(song.get("Title"), song.get("Artist"), song.get("Album"), song.get("file")));
    }

    @Override
    public PlaybackTime getTime() {
        Map<String, String> status = execute("status");
        Double position = TimeUtils.parseSeconds(status.get("elapsed"));
        Double duration = TimeUtils.parseSeconds(status.get("duration"));
        String legacy = status.get("time");
        if ((position == null || duration == null) && legacy != null && legacy.contains(":")) {
            // Older servers report "elapsed:total" in whole seconds
            String[] parts = legacy.split(":", 2);
            position = position != null ? position : TimeUtils.parseSeconds(parts[0]);
            duration = duration != null ? duration : TimeUtils.parseSeconds(parts[1]);
        }
        return new PlaybackTime(position, duration);
    }

    /**
     * Sends one command and collects its {@code key: value} response.
     * Keys are case-sensitive as sent by the server; the first occurrence of a key wins.
     */
    Map<String, String> execute(String command, String... args) {
        if (!isConnected()) {
            throw new BackendConnectionException(BACKEND, "Not connected");
        }
        StringBuilder line = new StringBuilder(command);
        for (String arg : args) {
            line.append(' ').append(quote(arg));
        }
        try {
            writer.write(line.append('\n').toString());
            writer.flush();
            Map<String, String> response = new LinkedHashMap<>();
            String reply;
            while ((reply = reader.readLine()) != null) {
                if (OK.equals(reply)) {
                    return response;
                }
                if (reply.startsWith(ACK_PREFIX)) {
                    throw new CommandFailedException(command, reply.substring(ACK_PREFIX.length()));
                }
                int sep = reply.indexOf(": ");
                if (sep > 0) {
                    response.putIfAbsent(reply.substring(0, sep), reply.substring(sep + 2));
                }
            }
            throw new IOException("Connection closed by server");
        } catch (IOException e) {
            closeQuietly(socket);
            socket = null;
            throw new BackendConnectionException(BACKEND, "I/O failure during '" + command + "'", e);
        }
    }

    static String quote(String arg) {
        return '"' + arg.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    String serverVersion() {
        return serverVersion;
    }

    private static void closeQuietly(Socket s) {
        if (s == null) {
            return;
        }
        try {
            s.close();
        } catch (IOException e) {
            LOG.debug("Error closing sequencer socket: {}", e.toString());
        }
    }
}
