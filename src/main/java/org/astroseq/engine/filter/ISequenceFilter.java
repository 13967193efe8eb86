package org.astroseq.engine.filter;

import org.astroseq.api.sequence.ISequence;

/**
 * Predicate that selects which frames of a sequence are processed.
 * <p>
 * Implementations must be pure: the same sequence state always yields the same result.
 */
public interface ISequenceFilter {

    boolean accept(ISequence sequence, int index);

    /**
     * Short description for log messages, e.g. {@code "included frames"}.
     */
    String describe();
}
