package org.astroseq.engine.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.IntStream;

import org.astroseq.api.sequence.ISequence;
import org.astroseq.api.sequence.RegistrationData;
import org.astroseq.test.utils.InMemorySequence;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class SequenceFiltersTest {

    @TempDir
    Path tempDir;

    private static int[] accepted(ISequence sequence, ISequenceFilter filter) {
        return IntStream.range(0, sequence.getFrameCount()).filter(i -> filter.accept(sequence, i)).toArray();
    }

    @Test
    void allAcceptsEveryFrame() {
        ISequence sequence = InMemorySequence.builder(4).excluded(1).build();

        assertThat(accepted(sequence, SequenceFilters.all())).containsExactly(0, 1, 2, 3);
    }

    @Test
    void includedHonoursSelection() {
        ISequence sequence = InMemorySequence.builder(5).excluded(1, 3).build();

        assertThat(accepted(sequence, SequenceFilters.included())).containsExactly(0, 2, 4);
    }

    @Test
    void registrationFiltersRejectFramesWithoutMeasurements() {
        ISequence sequence = InMemorySequence.builder(4)
                .registration(0, new RegistrationData(2.0, 0.9, 0.8))
                .registration(1, new RegistrationData(4.0, 0.5, 0.95))
                .registration(2, new RegistrationData(0.0, 0.0, 0.0))
                .build();

        assertThat(accepted(sequence, SequenceFilters.maxFwhm(3.0))).containsExactly(0);
        assertThat(accepted(sequence, SequenceFilters.minQuality(0.6))).containsExactly(0);
        assertThat(accepted(sequence, SequenceFilters.minRoundness(0.9))).containsExactly(1);
    }

    @Test
    void allOfCombinesFilters() {
        ISequence sequence = InMemorySequence.builder(4)
                .excluded(0)
                .registration(0, new RegistrationData(2.0, 1, 1))
                .registration(1, new RegistrationData(2.5, 1, 1))
                .registration(2, new RegistrationData(5.0, 1, 1))
                .registration(3, new RegistrationData(1.0, 1, 1))
                .build();

        ISequenceFilter filter = SequenceFilters.allOf(SequenceFilters.included(), SequenceFilters.maxFwhm(3.0));

        assertThat(accepted(sequence, filter)).containsExactly(1, 3);
        assertThat(filter.describe()).isEqualTo("included frames and FWHM <= 3.0");
    }

    @Test
    void allOfWithoutFiltersAcceptsEverything() {
        ISequence sequence = InMemorySequence.builder(2).excluded(0).build();

        assertThat(accepted(sequence, SequenceFilters.allOf())).containsExactly(0, 1);
    }

    @Test
    void missingOutputSkipsFramesAlreadyWritten() throws IOException {
        ISequence sequence = InMemorySequence.builder(3).build();
        Files.createFile(tempDir.resolve("out_1"));

        ISequenceFilter filter = SequenceFilters.missingOutput(i -> tempDir.resolve("out_" + i));

        assertThat(accepted(sequence, filter)).containsExactly(0, 2);
    }
}
