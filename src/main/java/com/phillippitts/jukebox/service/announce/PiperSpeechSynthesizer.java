package com.phillippitts.jukebox.service.announce;

import com.phillippitts.jukebox.config.properties.AnnouncerProperties;
import com.phillippitts.jukebox.exception.ProcessFailureException;
import com.phillippitts.jukebox.exception.ResourceUnavailableException;
import com.phillippitts.jukebox.exception.SynthesisException;
import com.phillippitts.jukebox.service.process.ProcessRunner;
import com.phillippitts.jukebox.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * {@link SpeechSynthesizer} running the Piper command line tool.
 *
 * <p>CLI contract (text on stdin):
 * <pre>
 * piper --model VOICE.onnx --output_file TARGET.wav.part
 * </pre>
 *
 * <p>Piper writes to a {@code .part} file next to the target, which is moved into place only
 * after a successful run. A failed or interrupted run never leaves a file at the target path.
 */
@Component
public class PiperSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger LOG = LogManager.getLogger(PiperSpeechSynthesizer.class);

    private static final String TOOL = "piper";
    static final String PARTIAL_SUFFIX = ".part";

    private final AnnouncerProperties props;
    private final ProcessRunner runner;

    public PiperSpeechSynthesizer(AnnouncerProperties props, ProcessRunner runner) {
        this.props = Objects.requireNonNull(props, "props");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public Path synthesize(String text, Path target) {
        Path model = requireVoiceModel();
        Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
        List<String> command = List.of(props.synthesizerBinary(),
                "--model", model.toString(),
                "--output_file", partial.toAbsolutePath().toString());
        LOG.info("Synthesizing: {}", LogSanitizer.preview(text));
        try {
            runner.run(TOOL, command, text, props.synthesisTimeout());
            if (!isNonEmptyFile(partial)) {
                throw new SynthesisException("Piper succeeded but " + target + " was not written");
            }
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return target;
        } catch (ProcessFailureException e) {
            throw new SynthesisException("Piper failed for '" + LogSanitizer.preview(text) + "'", e);
        } catch (IOException e) {
            throw new SynthesisException("Cannot move synthesized audio to " + target, e);
        } finally {
            deleteQuietly(partial);
        }
    }

    private static boolean isNonEmptyFile(Path path) throws IOException {
        return Files.isRegularFile(path) && Files.size(path) > 0;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete partial audio {}: {}", path, e.toString());
        }
    }

    private Path requireVoiceModel() {
        String configured = props.voiceModelPath();
        if (configured == null || configured.isBlank()) {
            throw new ResourceUnavailableException("voice-model", "Voice model path not configured");
        }
        Path model = Path.of(configured);
        if (!Files.isRegularFile(model)) {
            throw new ResourceUnavailableException(configured, "Voice model not found");
        }
        return model;
    }
}
