package com.phillippitts.jukebox.service.process;

import com.phillippitts.jukebox.exception.ProcessFailureException;
import com.phillippitts.jukebox.exception.ResourceUnavailableException;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.jukebox.testutil.ProcessTestDoubles.ProcessBehavior;
import static com.phillippitts.jukebox.testutil.ProcessTestDoubles.RecordingProcessFactory;
import static com.phillippitts.jukebox.testutil.ProcessTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessRunnerTest {

    @Test
    void successReturnsStdoutAndFeedsStdin() {
        TestProcess tp = new TestProcess(ProcessBehavior.succeeding("line one\nline two"));
        ProcessRunner runner = new ProcessRunner(RecordingProcessFactory.sequence(tp));

        String out = runner.run("piper", List.of("piper", "--model", "m.onnx"), "hello", Duration.ofSeconds(2));

        assertThat(out).isEqualTo("line one\nline two");
        assertThat(tp.stdinText()).isEqualTo("hello");
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippet() {
        TestProcess tp = new TestProcess(ProcessBehavior.failing("ERROR: Private video", 1));
        ProcessRunner runner = new ProcessRunner(RecordingProcessFactory.sequence(tp));

        assertThatThrownBy(() -> runner.run("yt-dlp", List.of("yt-dlp", "-g", "x"), null, Duration.ofSeconds(2)))
                .isInstanceOf(ProcessFailureException.class)
                .hasMessageContaining("Non-zero exit")
                .hasMessageContaining("stderr=ERROR: Private video")
                .hasMessageContaining("tool: yt-dlp");
    }

    @Test
    void timeoutKillsProcessAndThrows() {
        TestProcess tp = new TestProcess(ProcessBehavior.longRunning());
        ProcessRunner runner = new ProcessRunner(RecordingProcessFactory.sequence(tp));

        long start = System.nanoTime();
        assertThatThrownBy(() -> runner.run("yt-dlp", List.of("yt-dlp"), null, Duration.ofMillis(200)))
                .isInstanceOf(ProcessFailureException.class)
                .hasMessageContaining("Timeout after 200ms");
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5000);

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(tp::wasDestroyCalled);
    }

    @Test
    void missingExecutableIsResourceUnavailable() {
        RecordingProcessFactory factory = RecordingProcessFactory.longRunning();
        factory.failToStart(true);
        ProcessRunner runner = new ProcessRunner(factory);

        assertThatThrownBy(() -> runner.run("piper", List.of("/opt/piper/piper"), null, Duration.ofSeconds(1)))
                .isInstanceOf(ResourceUnavailableException.class)
                .hasMessageContaining("/opt/piper/piper");
    }
}
