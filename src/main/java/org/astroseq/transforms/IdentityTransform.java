package org.astroseq.transforms;

import java.util.List;

import org.astroseq.api.sequence.Frame;
import org.astroseq.api.transform.FrameRef;
import org.astroseq.api.transform.ITransform;
import org.astroseq.api.transform.TransformContext;

/**
 * Passes every frame through unchanged. Used to convert or extract sub-sequences.
 */
public final class IdentityTransform implements ITransform {

    @Override
    public String getName() {
        return "copy";
    }

    @Override
    public List<Frame> transformOne(FrameRef ref, Frame input, TransformContext context) {
        return List.of(input);
    }
}
