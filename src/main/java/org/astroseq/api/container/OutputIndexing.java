package org.astroseq.api.container;

/**
 * Which index a container writer expects in {@link IContainerHandle#writeFrame}.
 */
public enum OutputIndexing {
    /** Dense position in the output sequence, {@code 0..M-1}. */
    OUTPUT,
    /** Original index of the frame in the input sequence. */
    INPUT
}
