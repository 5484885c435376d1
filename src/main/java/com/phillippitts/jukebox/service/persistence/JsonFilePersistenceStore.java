package com.phillippitts.jukebox.service.persistence;

import com.phillippitts.jukebox.config.properties.SourceProperties;
import com.phillippitts.jukebox.domain.MediaSource;
import com.phillippitts.jukebox.domain.MediaSourceKind;
import com.phillippitts.jukebox.domain.SourceCategory;
import com.phillippitts.jukebox.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * {@link PersistenceStore} backed by JSON files in a data directory.
 *
 * <p>Files:
 * <pre>
 * sources.json         [{"type": "spotify_playlist", "name": "...", "uri": "...", "source_type": "music"}, ...]
 * state.json           {"current_source_index": 2}
 * watched_videos.json  {"watched": ["id1", "id2"]}
 * </pre>
 *
 * <p>Writes go to a temporary file that is then moved over the target, so readers never see a
 * half-written file. Invalid source entries are skipped with an error log.
 */
@Component
public class JsonFilePersistenceStore implements PersistenceStore {

    private static final Logger LOG = LogManager.getLogger(JsonFilePersistenceStore.class);

    static final String SOURCES_FILE = "sources.json";
    static final String STATE_FILE = "state.json";
    static final String WATCHED_FILE = "watched_videos.json";
    static final String INDEX_KEY = "current_source_index";
    static final String WATCHED_KEY = "watched";

    private final Path dataDir;

    @Autowired
    public JsonFilePersistenceStore(SourceProperties props) {
        this(Path.of(props.dataDir()));
    }

    public JsonFilePersistenceStore(Path dataDir) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
    }

    @Override
    public synchronized List<MediaSource> loadSources() {
        Path file = dataDir.resolve(SOURCES_FILE);
        if (!Files.exists(file)) {
            LOG.info("No sources file at {}", file);
            return List.of();
        }
        JSONArray array;
        try {
            array = new JSONArray(read(file));
        } catch (JSONException e) {
            throw new PersistenceException("Malformed " + file, e);
        }
        List<MediaSource> sources = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                LOG.error("Invalid source entry at position {} in {}: not an object", i, file);
                continue;
            }
            try {
                sources.add(new MediaSource(
                        MediaSourceKind.fromWireName(item.getString("type")),
                        item.getString("name"),
                        item.getString("uri"),
                        SourceCategory.fromLabel(item.optString("source_type", "music"))));
            } catch (JSONException | IllegalArgumentException e) {
                LOG.error("Invalid source entry in {}: {} ({})", file, item, e.getMessage());
            }
        }
        LOG.info("Loaded {} sources from {}", sources.size(), file);
        return sources;
    }

    @Override
    public synchronized void saveSources(List<MediaSource> sources) {
        JSONArray array = new JSONArray();
        for (MediaSource source : sources) {
            array.put(new JSONObject()
                    .put("type", source.kind().wireName())
                    .put("name", source.displayName())
                    .put("uri", source.locator())
                    .put("source_type", source.category().label()));
        }
        write(dataDir.resolve(SOURCES_FILE), array.toString(2));
    }

    @Override
    public synchronized OptionalInt loadCurrentIndex() {
        Path file = dataDir.resolve(STATE_FILE);
        if (!Files.exists(file)) {
            return OptionalInt.empty();
        }
        try {
            JSONObject state = new JSONObject(read(file));
            if (!state.has(INDEX_KEY)) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(Math.max(0, state.getInt(INDEX_KEY)));
        } catch (JSONException e) {
            throw new PersistenceException("Malformed " + file, e);
        }
    }

    @Override
    public synchronized void saveCurrentIndex(int index) {
        write(dataDir.resolve(STATE_FILE), new JSONObject().put(INDEX_KEY, index).toString());
        LOG.debug("Saved {}={}", INDEX_KEY, index);
    }

    @Override
    public synchronized Set<String> loadWatchedIds() {
        Path file = dataDir.resolve(WATCHED_FILE);
        if (!Files.exists(file)) {
            return Set.of();
        }
        try {
            JSONArray ids = new JSONObject(read(file)).optJSONArray(WATCHED_KEY);
            Set<String> watched = new LinkedHashSet<>();
            if (ids != null) {
                for (int i = 0; i < ids.length(); i++) {
                    String id = ids.optString(i, "");
                    if (!id.isBlank()) {
                        watched.add(id);
                    }
                }
            }
            return watched;
        } catch (JSONException e) {
            throw new PersistenceException("Malformed " + file, e);
        }
    }

    @Override
    public synchronized void saveWatchedIds(Collection<String> ids) {
        JSONObject doc = new JSONObject().put(WATCHED_KEY, new JSONArray(ids));
        write(dataDir.resolve(WATCHED_FILE), doc.toString());
    }

    public Path dataDir() {
        return dataDir;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("Cannot read " + file, e);
        }
    }

    private void write(Path target, String content) {
        try {
            Files.createDirectories(dataDir);
            Path tmp = Files.createTempFile(dataDir, target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot write " + target, e);
        }
    }
}
