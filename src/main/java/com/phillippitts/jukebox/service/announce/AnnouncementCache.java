package com.phillippitts.jukebox.service.announce;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Directory of synthesized announcements, keyed by the SHA-256 of the exact UTF-8 text.
 *
 * <p>The same text always maps to the same {@code <hash>.wav}, so a phrase is synthesized once.
 */
public final class AnnouncementCache {

    static final String EXTENSION = ".wav";

    private final Path directory;

    public AnnouncementCache(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /** Lower-case hex SHA-256 of {@code text}. */
    public static String key(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Path pathFor(String text) {
        return directory.resolve(key(text) + EXTENSION);
    }

    public boolean contains(String text) {
        return Files.isRegularFile(pathFor(text));
    }

    /** Creates the cache directory if needed. */
    public void ensureDirectory() throws IOException {
        Files.createDirectories(directory);
    }

    public Path directory() {
        return directory;
    }
}
