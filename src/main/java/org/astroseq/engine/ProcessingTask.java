package org.astroseq.engine;

/**
 * Unit of work for one selected input frame.
 *
 * @param outputIndex    Dense index in the output sequence.
 * @param inputIndex     Index in the input sequence.
 * @param containerIndex Index of the physical container holding the input frame.
 */
public record ProcessingTask(int outputIndex, int inputIndex, int containerIndex) {
}
