package com.phillippitts.jukebox.service.video;

import com.phillippitts.jukebox.config.properties.VideoProperties;
import com.phillippitts.jukebox.exception.ProcessFailureException;
import com.phillippitts.jukebox.exception.StreamUnavailableException;
import com.phillippitts.jukebox.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link VideoSource} backed by the yt-dlp command line tool.
 *
 * <p>CLI contract:
 * <pre>
 * yt-dlp --flat-playlist --print '%(id)s|%(title)s' --playlist-end N CHANNEL_URL
 * yt-dlp -f bestaudio/best -g ITEM_URL
 * </pre>
 */
@Component
public class YtDlpVideoSource implements VideoSource {

    private static final Logger LOG = LogManager.getLogger(YtDlpVideoSource.class);

    private static final String TOOL = "yt-dlp";
    static final String LISTING_FORMAT = "%(id)s|%(title)s";

    private final VideoProperties props;
    private final ProcessRunner runner;

    public YtDlpVideoSource(VideoProperties props, ProcessRunner runner) {
        this.props = Objects.requireNonNull(props, "props");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public List<VideoItem> listItems(String locator, int maxCount) {
        String url = normalizeLocator(locator);
        List<String> command = List.of(props.resolverBinary(),
                "--flat-playlist",
                "--print", LISTING_FORMAT,
                "--playlist-end", String.valueOf(maxCount),
                url);
        LOG.debug("Listing channel {}", url);
        try {
            List<VideoItem> items = parseListing(runner.run(TOOL, command, null, props.listTimeout()));
            LOG.info("Fetched {} items from {}", items.size(), url);
            return items;
        } catch (ProcessFailureException e) {
            LOG.error("Failed to list channel {}: {}", url, e.getMessage());
            return List.of();
        }
    }

    @Override
    public String resolvePlayableUrl(String itemUrl) {
        List<String> command = List.of(props.resolverBinary(), "-f", "bestaudio/best", "-g", itemUrl);
        String output;
        try {
            output = runner.run(TOOL, command, null, props.resolveTimeout());
        } catch (ProcessFailureException e) {
            throw new StreamUnavailableException(itemUrl, "resolver failed", e);
        }
        for (String line : output.split("\n")) {
            if (!line.isBlank()) {
                return line.trim();
            }
        }
        throw new StreamUnavailableException(itemUrl, "resolver returned no URL", null);
    }

    /** Collapses the doubled {@code @@} that appears when a handle is pasted after a URL ending in {@code @}. */
    static String normalizeLocator(String locator) {
        return locator.replace("@@", "@");
    }

    /**
     * Parses {@code id|title} lines. Lines without a separator are ids with an unknown title;
     * titles may themselves contain {@code |}.
     */
    static List<VideoItem> parseListing(String stdout) {
        List<VideoItem> items = new ArrayList<>();
        if (stdout == null) {
            return items;
        }
        for (String line : stdout.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.split("\\|", 2);
            String id = parts[0].trim();
            if (id.isEmpty()) {
                LOG.warn("Skipping listing line without id: '{}'", line);
                continue;
            }
            String title = parts.length > 1 ? parts[1].trim() : "Unknown";
            items.add(VideoItem.ofId(id, title));
        }
        return items;
    }
}
