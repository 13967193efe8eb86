package org.astroseq.engine.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;

import org.astroseq.api.sequence.Frame;
import org.astroseq.engine.RunContext;
import org.astroseq.engine.RunCounters;
import org.astroseq.engine.memory.MemoryAdmissionController;
import org.astroseq.junit.extensions.logging.ExpectLog;
import org.astroseq.junit.extensions.logging.LogLevel;
import org.astroseq.junit.extensions.logging.LogWatchExtension;
import org.astroseq.test.utils.RecordingContainerWriter;
import org.astroseq.test.utils.RecordingContainerWriter.Entry;
import org.astroseq.test.utils.TestFrames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DirectFrameOutputTest {

    private RunContext context;

    @BeforeEach
    void setUp() {
        context = new RunContext(new RunCounters(10), new MemoryAdmissionController(), true);
    }

    private DirectFrameOutput output(RecordingContainerWriter format) throws IOException {
        return new DirectFrameOutput("files", format.open(Path.of("files"), -1), format, context);
    }

    @Test
    void writesImmediatelyUsingInputIndex() throws IOException {
        RecordingContainerWriter format = RecordingContainerWriter.perFrame();
        DirectFrameOutput output = output(format);
        Frame frame = TestFrames.tagged(TestFrames.MONO, 7);

        output.submit(new PendingWrite(1, 7, frame));
        output.submit(PendingWrite.skip(0, 3));
        WriterResult result = output.finish(false);

        assertThat(format.handle().entries()).containsExactly(new Entry(false, 7, 7, 8), new Entry(true, 3, -1, 0));
        assertThat(frame.isReleased()).isTrue();
        assertThat(result.status()).isEqualTo(WriterStatus.COMPLETED);
        assertThat(result.framesWritten()).isEqualTo(1);
        assertThat(result.framesSkipped()).isEqualTo(1);
        assertThat(output.isQueued()).isFalse();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*DirectFrameOutput", messagePattern = "Failed to write frame 4 to output 'files': disk full. Aborting run")
    void writeErrorIsRethrownAndAbortsRun() throws IOException {
        RecordingContainerWriter format = RecordingContainerWriter.perFrame().failingWritesAt(4);
        DirectFrameOutput output = output(format);
        Frame frame = TestFrames.tagged(TestFrames.MONO, 4);

        assertThatThrownBy(() -> output.submit(new PendingWrite(0, 4, frame))).isInstanceOf(IOException.class);

        assertThat(frame.isReleased()).isTrue();
        assertThat(context.isAbortRequested()).isTrue();
        assertThat(output.finish(true).status()).isEqualTo(WriterStatus.FAILED);
        assertThat(format.handle().isDeleted()).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*DirectFrameOutput", messagePattern = "Run aborted, output 'files' kept with 0 frame\\(s\\)")
    void framesAfterAbortAreReleasedWithoutWriting() throws IOException {
        RecordingContainerWriter format = RecordingContainerWriter.perFrame();
        DirectFrameOutput output = output(format);
        context.requestAbort("test");
        Frame frame = TestFrames.tagged(TestFrames.MONO, 1);

        output.submit(new PendingWrite(0, 1, frame));

        assertThat(frame.isReleased()).isTrue();
        assertThat(format.handle().entries()).isEmpty();
        assertThat(output.finish(true).status()).isEqualTo(WriterStatus.TRUNCATED);
    }
}
