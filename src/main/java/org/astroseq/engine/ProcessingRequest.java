package org.astroseq.engine;

import java.util.List;

import org.astroseq.api.sequence.ISequence;
import org.astroseq.api.transform.ITransform;
import org.astroseq.engine.filter.ISequenceFilter;

/**
 * What to process: the input sequence, the frame selection, the operation and the outputs, one
 * per output slot of the transform.
 */
public record ProcessingRequest(ISequence sequence, ISequenceFilter filter, ITransform transform,
                                List<OutputSpec> outputs) {

    public ProcessingRequest {
        if (sequence == null || filter == null || transform == null) {
            throw new IllegalArgumentException("sequence, filter and transform are required");
        }
        outputs = List.copyOf(outputs);
        if (outputs.size() != transform.getOutputCount()) {
            throw new IllegalArgumentException("Transform '" + transform.getName() + "' produces "
                    + transform.getOutputCount() + " output(s) but " + outputs.size() + " were given");
        }
    }
}
