package org.astroseq.engine.filter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

import org.astroseq.api.sequence.ISequence;
import org.astroseq.api.sequence.RegistrationData;

/**
 * Factory for the standard sequence filters.
 * <p>
 * Filters based on registration data reject frames that have no data or a non-positive value,
 * because such frames were never measured successfully.
 */
public final class SequenceFilters {

    private SequenceFilters() {
    }

    public static ISequenceFilter all() {
        return new Named("all frames", (seq, i) -> true);
    }

    public static ISequenceFilter included() {
        return new Named("included frames", ISequence::isIncluded);
    }

    /**
     * Keeps frames whose FWHM is at most {@code max}.
     */
    public static ISequenceFilter maxFwhm(double max) {
        return new Named("FWHM <= " + max,
                (seq, i) -> measured(seq, i, RegistrationData::fwhm).map(v -> v <= max).orElse(false));
    }

    /**
     * Keeps frames whose registration quality is at least {@code min}.
     */
    public static ISequenceFilter minQuality(double min) {
        return new Named("quality >= " + min,
                (seq, i) -> measured(seq, i, RegistrationData::quality).map(v -> v >= min).orElse(false));
    }

    /**
     * Keeps frames whose star roundness is at least {@code min}.
     */
    public static ISequenceFilter minRoundness(double min) {
        return new Named("roundness >= " + min,
                (seq, i) -> measured(seq, i, RegistrationData::roundness).map(v -> v >= min).orElse(false));
    }

    /**
     * Keeps frames whose per-frame output file does not exist yet, so an interrupted run can
     * be resumed.
     *
     * @param outputPathOf Maps an input index to the path its output would be written to.
     */
    public static ISequenceFilter missingOutput(IntFunction<Path> outputPathOf) {
        return new Named("output not yet written",
                (seq, i) -> !Files.exists(outputPathOf.apply(i)));
    }

    /**
     * Keeps frames accepted by every given filter.
     */
    public static ISequenceFilter allOf(ISequenceFilter... filters) {
        List<ISequenceFilter> parts = List.copyOf(Arrays.asList(filters));
        if (parts.isEmpty()) {
            return all();
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        String description = parts.stream().map(ISequenceFilter::describe).collect(Collectors.joining(" and "));
        return new Named(description, (seq, i) -> {
            for (ISequenceFilter part : parts) {
                if (!part.accept(seq, i)) {
                    return false;
                }
            }
            return true;
        });
    }

    private static Optional<Double> measured(ISequence sequence, int index, ToDoubleFunction<RegistrationData> value) {
        return sequence.getRegistrationData(index)
                .map(value::applyAsDouble)
                .filter(v -> v > 0.0);
    }

    @FunctionalInterface
    private interface Predicate {
        boolean test(ISequence sequence, int index);
    }

    private record Named(String description, Predicate predicate) implements ISequenceFilter {

        @Override
        public boolean accept(ISequence sequence, int index) {
            return predicate.test(sequence, index);
        }

        @Override
        public String describe() {
            return description;
        }
    }
}
