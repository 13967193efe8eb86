package org.astroseq.engine.source;

/**
 * Lifecycle of one input container during a run.
 */
public enum ContainerState {
    /** Not opened yet. */
    CLOSED,
    OPEN,
    /** All mapped frames consumed, reader closed. */
    EXHAUSTED,
    /** Could not be opened; its frames are skipped. */
    FAILED
}
