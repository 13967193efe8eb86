package org.astroseq.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import org.astroseq.api.container.IContainerHandle;
import org.astroseq.api.sequence.FrameGeometry;
import org.astroseq.api.sequence.IFrameReader;
import org.astroseq.test.utils.TestFrames;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class FileSequenceTest {

    @TempDir
    Path tempDir;

    private static void writeStack(Path path, FrameGeometry geometry, int firstTag, int count) throws IOException {
        IContainerHandle handle = new FrameStackWriter().open(path, -1);
        for (int i = 0; i < count; i++) {
            handle.writeFrame(TestFrames.tagged(geometry, firstTag + i), i);
        }
        handle.close(count);
    }

    @Test
    void opensSingleStackFile() throws IOException {
        Path file = tempDir.resolve("lights.fstk");
        writeStack(file, TestFrames.MONO, 0, 3);

        FileSequence sequence = FileSequence.open(file);

        assertThat(sequence.getName()).isEqualTo("lights");
        assertThat(sequence.getFrameCount()).isEqualTo(3);
        assertThat(sequence.getContainers()).hasSize(1);
        assertThat(sequence.getFrameGeometry()).contains(TestFrames.MONO);
    }

    @Test
    void directoryFilesFormSequenceInNameOrder() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("night1"));
        writeStack(dir.resolve("b.fstk"), TestFrames.MONO, 10, 2);
        writeStack(dir.resolve("a.fstk"), TestFrames.MONO, 0, 3);
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        FileSequence sequence = FileSequence.open(dir);

        assertThat(sequence.getName()).isEqualTo("night1");
        assertThat(sequence.getFrameCount()).isEqualTo(5);
        assertThat(sequence.getContainers()).extracting(c -> c.getName()).containsExactly("a.fstk", "b.fstk");
        try (IFrameReader reader = sequence.getContainers().get(1).open()) {
            assertThat(TestFrames.tagOf(reader.readFrame(1))).isEqualTo(11);
        }
    }

    @Test
    void mixedGeometryHasNoSequenceGeometry() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("mixed"));
        writeStack(dir.resolve("a.fstk"), TestFrames.MONO, 0, 1);
        writeStack(dir.resolve("b.fstk"), TestFrames.RGB, 0, 1);

        assertThat(FileSequence.open(dir).getFrameGeometry()).isEmpty();
    }

    @Test
    void excludedFramesAreNotIncluded() throws IOException {
        Path file = tempDir.resolve("lights.fstk");
        writeStack(file, TestFrames.MONO, 0, 4);

        FileSequence sequence = FileSequence.open(file).withExcluded(Set.of(1, 2));

        assertThat(sequence.isIncluded(0)).isTrue();
        assertThat(sequence.isIncluded(1)).isFalse();
        assertThat(sequence.isIncluded(3)).isTrue();
    }

    @Test
    void readerRejectsIndexOutOfRange() throws IOException {
        Path file = tempDir.resolve("lights.fstk");
        writeStack(file, TestFrames.MONO, 0, 2);

        try (IFrameReader reader = FileSequence.open(file).getContainers().get(0).open()) {
            assertThatThrownBy(() -> reader.readFrame(2)).isInstanceOf(IOException.class)
                    .hasMessageContaining("out of range");
        }
    }

    @Test
    void rejectsFilesThatAreNotStacks() throws IOException {
        Path file = Files.write(tempDir.resolve("junk.fstk"), new byte[64]);

        assertThatThrownBy(() -> FileSequence.open(file)).isInstanceOf(IOException.class)
                .hasMessageContaining("Not a frame stack");
    }

    @Test
    void rejectsMissingInputAndEmptyDirectory() throws IOException {
        assertThatThrownBy(() -> FileSequence.open(tempDir.resolve("missing.fstk")))
                .isInstanceOf(IOException.class).hasMessageContaining("does not exist");
        Path empty = Files.createDirectory(tempDir.resolve("empty"));
        assertThatThrownBy(() -> FileSequence.open(empty))
                .isInstanceOf(IOException.class).hasMessageContaining("No .fstk file found");
    }
}
