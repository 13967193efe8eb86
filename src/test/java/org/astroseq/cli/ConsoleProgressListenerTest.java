package org.astroseq.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ConsoleProgressListenerTest {

    @Test
    void printsBarAndAlwaysPrintsCompletion() {
        StringWriter out = new StringWriter();
        ConsoleProgressListener listener = new ConsoleProgressListener(new PrintWriter(out), Duration.ofHours(1));

        listener.onStart("lights", 4);
        listener.onProgress(1, 4);
        listener.onProgress(2, 4);
        listener.onProgress(4, 4);
        listener.onFinish(null);

        String output = out.toString();
        assertThat(output).contains("lights [==========", "25% | Frame 1/4", "100% | Frame 4/4");
        // Throttled
        assertThat(output).doesNotContain("Frame 2/4");
        assertThat(output).endsWith(System.lineSeparator());
    }

    @Test
    void printsNothingWithoutProgress() {
        StringWriter out = new StringWriter();
        ConsoleProgressListener listener = new ConsoleProgressListener(new PrintWriter(out), Duration.ofMillis(500));

        listener.onStart("lights", 4);
        listener.onFinish(null);

        assertThat(out.toString()).isEmpty();
    }

    @Test
    void formatsTime() {
        assertThat(ConsoleProgressListener.formatTime(65_000)).isEqualTo("1:05");
        assertThat(ConsoleProgressListener.formatTime(3_661_000)).isEqualTo("1:01:01");
        assertThat(ConsoleProgressListener.formatTime(-1)).isEqualTo("?");
    }
}
