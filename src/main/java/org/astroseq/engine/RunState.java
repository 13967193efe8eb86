package org.astroseq.engine;

/**
 * Lifecycle of a run. {@link #SUCCEEDED}, {@link #PARTIAL} and {@link #FAILED} are the possible
 * outcomes reported in a {@link RunResult}.
 */
public enum RunState {
    INIT,
    PREPARED,
    RUNNING,
    /** Every selected frame was converted. */
    SUCCEEDED,
    /** Some frames failed and were skipped, at least one was converted. */
    PARTIAL,
    /** The run did not start, was aborted, or converted nothing. */
    FAILED,
    FINALIZED
}
