package org.astroseq.api.transform;

/**
 * Position of the frame being transformed.
 *
 * @param outputIndex Dense index in the output sequence.
 * @param inputIndex  Original index in the input sequence.
 */
public record FrameRef(int outputIndex, int inputIndex) {
}
