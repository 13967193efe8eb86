package org.astroseq.api.transform;

import java.util.List;
import java.util.Optional;

import org.astroseq.api.sequence.Frame;
import org.astroseq.api.sequence.FrameGeometry;

/**
 * Per-frame operation applied by the engine.
 * <p>
 * {@link #transformOne} is called concurrently from several worker threads and must be
 * thread-safe. {@link #prepare} and {@link #finish} are called once, on the driver thread.
 */
public interface ITransform {

    /**
     * Name used in logs.
     */
    String getName();

    /**
     * Number of output sequences this transform produces per input frame.
     */
    default int getOutputCount() {
        return 1;
    }

    /**
     * Geometry of the frames written to output {@code outputSlot} for the given input
     * geometry. Used for memory and disk-space estimates only.
     */
    default Optional<FrameGeometry> getOutputGeometry(FrameGeometry input, int outputSlot) {
        return Optional.of(input);
    }

    /**
     * Called once before any frame is dispatched.
     *
     * @throws TransformException to fail the run before it starts.
     */
    default void prepare(TransformContext context) throws TransformException {
    }

    /**
     * Transforms one frame.
     * <p>
     * The engine releases {@code input} after this call unless the same instance is returned
     * as one of the outputs. Returned frames are owned by the engine.
     *
     * @param ref     Output and input index of the frame.
     * @param input   Decoded input frame.
     * @param context Run context.
     * @return Exactly {@link #getOutputCount()} frames, one per output sequence in order.
     * @throws TransformException if the frame cannot be processed.
     */
    List<Frame> transformOne(FrameRef ref, Frame input, TransformContext context) throws TransformException;

    /**
     * Called once after all workers and writers have stopped, also for failed runs.
     *
     * @param context   Run context.
     * @param succeeded Whether the run ended without a fatal error.
     */
    default void finish(TransformContext context, boolean succeeded) {
    }
}
