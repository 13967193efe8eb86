package org.astroseq.engine.filter;

import java.util.Arrays;

import org.astroseq.api.sequence.ISequence;

/**
 * Dense mapping from output index {@code 0..M-1} to the input index of each selected frame,
 * in input order. Built once before any frame is dispatched.
 */
public final class IndexMapping {

    private final int[] inputIndices;
    private final int totalInputFrames;
    private final String filterDescription;

    private IndexMapping(int[] inputIndices, int totalInputFrames, String filterDescription) {
        this.inputIndices = inputIndices;
        this.totalInputFrames = totalInputFrames;
        this.filterDescription = filterDescription;
    }

    public static IndexMapping build(ISequence sequence, ISequenceFilter filter) {
        int total = sequence.getFrameCount();
        int[] selected = new int[total];
        int count = 0;
        for (int i = 0; i < total; i++) {
            if (filter.accept(sequence, i)) {
                selected[count++] = i;
            }
        }
        return new IndexMapping(Arrays.copyOf(selected, count), total, filter.describe());
    }

    /**
     * Number of selected frames (M).
     */
    public int size() {
        return inputIndices.length;
    }

    public boolean isEmpty() {
        return inputIndices.length == 0;
    }

    public int inputIndexOf(int outputIndex) {
        return inputIndices[outputIndex];
    }

    public int getTotalInputFrames() {
        return totalInputFrames;
    }

    /**
     * Number of input frames rejected by the filter.
     */
    public int getExcludedCount() {
        return totalInputFrames - inputIndices.length;
    }

    public String getFilterDescription() {
        return filterDescription;
    }

    public int[] toArray() {
        return inputIndices.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexMapping other)) {
            return false;
        }
        return totalInputFrames == other.totalInputFrames && Arrays.equals(inputIndices, other.inputIndices);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(inputIndices) + totalInputFrames;
    }

    @Override
    public String toString() {
        return "IndexMapping{" + inputIndices.length + "/" + totalInputFrames + " frames, " + filterDescription + "}";
    }
}
