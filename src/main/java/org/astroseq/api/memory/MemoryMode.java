package org.astroseq.api.memory;

/**
 * How the memory budget of a run is derived.
 */
public enum MemoryMode {
    /** A ratio of the heap that is currently free. */
    RATIO,
    /** A fixed number of bytes. */
    AMOUNT,
    /** No limit: admission never blocks. */
    UNLIMITED
}
