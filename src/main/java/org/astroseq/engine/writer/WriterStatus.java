package org.astroseq.engine.writer;

/**
 * Final state of an output container.
 */
public enum WriterStatus {
    /** All slots processed, container finalized. */
    COMPLETED,
    /** Run aborted, container kept as a valid shorter sequence. */
    TRUNCATED,
    /** Run aborted and the container format requires the full count, so it was deleted. */
    DELETED,
    /** Writing or finalizing failed; partial output deleted. */
    FAILED
}
