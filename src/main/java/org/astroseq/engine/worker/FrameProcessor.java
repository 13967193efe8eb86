package org.astroseq.engine.worker;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.astroseq.api.memory.ByteSizes;
import org.astroseq.api.sequence.Frame;
import org.astroseq.api.transform.FrameRef;
import org.astroseq.api.transform.ITransform;
import org.astroseq.api.transform.TransformContext;
import org.astroseq.api.transform.TransformException;
import org.astroseq.engine.IProgressListener;
import org.astroseq.engine.ProcessingTask;
import org.astroseq.engine.RunContext;
import org.astroseq.engine.memory.ConcurrencyPlan;
import org.astroseq.engine.memory.ConcurrencyPlanner;
import org.astroseq.engine.source.ContainerUnavailableException;
import org.astroseq.engine.source.FrameSourceAdapter;
import org.astroseq.engine.writer.IFrameOutput;
import org.astroseq.engine.writer.OutputSynchronizer;
import org.astroseq.engine.writer.PendingWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes one task on a worker thread: read, transform, hand the results to the outputs.
 * <p>
 * Every task produces exactly one {@link PendingWrite} per output, a frame or a skip marker,
 * on every path. Nothing thrown by the source, the transform or an output escapes
 * {@link #process}; failures become counters or an abort of the run.
 */
public final class FrameProcessor {

    private static final Logger log = LoggerFactory.getLogger(FrameProcessor.class);

    private final RunContext context;
    private final FrameSourceAdapter source;
    private final ITransform transform;
    private final TransformContext transformContext;
    private final List<IFrameOutput> outputs;
    private final int queuedOutputs;
    private final OutputSynchronizer synchronizer;
    private final IProgressListener progress;
    private final ConcurrencyPlan plan;
    private final int queueFactor;
    private final int frameCount;

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicBoolean sized = new AtomicBoolean(false);

    public FrameProcessor(RunContext context, FrameSourceAdapter source, ITransform transform,
                          TransformContext transformContext, List<IFrameOutput> outputs,
                          OutputSynchronizer synchronizer, IProgressListener progress,
                          ConcurrencyPlan plan, int queueFactor, int frameCount) {
        this.context = context;
        this.source = source;
        this.transform = transform;
        this.transformContext = transformContext;
        this.outputs = List.copyOf(outputs);
        this.queuedOutputs = (int) outputs.stream().filter(IFrameOutput::isQueued).count();
        this.synchronizer = synchronizer;
        this.progress = progress;
        this.plan = plan;
        this.queueFactor = queueFactor;
        this.frameCount = frameCount;
    }

    /**
     * Takes the admission credit for a task. Called by the pool in task order.
     *
     * @return {@code true} if a credit was taken and must be registered by {@link #process}.
     */
    boolean admit(ProcessingTask task) {
        if (queuedOutputs == 0 || context.isAbortRequested()) {
            return false;
        }
        try {
            context.getAdmission().acquire();
            return true;
        } catch (InterruptedException e) {
            log.debug("Interrupted while waiting for memory admission of frame {}", task.inputIndex());
            Thread.currentThread().interrupt();
            context.requestAbort("interrupted");
            return false;
        }
    }

    /**
     * Processes a task whose credit, if any, has been taken by {@link #admit}.
     */
    void process(ProcessingTask task, boolean credit) {
        if (credit) {
            synchronizer.register(task.outputIndex(), queuedOutputs);
        }
        int emitted = 0;
        try {
            if (context.isAbortRequested()) {
                source.skip(task);
                return;
            }

            Frame input = read(task);
            if (input == null) {
                return;
            }
            sizeAdmissionFrom(input);

            List<Frame> results = transform(task, input);
            if (results == null) {
                return;
            }
            if (results.stream().noneMatch(result -> result == input)) {
                input.release();
            }

            emitted = submit(task, results);
            if (emitted == outputs.size() && !context.isAbortRequested()) {
                context.getCounters().recordConverted();
            }
        } catch (RuntimeException e) {
            context.getCounters().recordFailure();
            log.error("Unexpected error while processing frame {}: {}. Aborting run", task.inputIndex(), e.getMessage());
            log.debug("Processing failure on frame {}", task.inputIndex(), e);
            context.requestAbort("unexpected error on frame " + task.inputIndex() + ": " + e.getMessage());
        } finally {
            emitSkips(task, emitted);
            progress.onProgress(completed.incrementAndGet(), frameCount);
        }
    }

    private Frame read(ProcessingTask task) {
        try {
            return source.readFrame(task);
        } catch (ContainerUnavailableException e) {
            log.debug("Skipping frame {}: {}", task.inputIndex(), e.getMessage());
            context.getCounters().recordFailure();
            return null;
        } catch (IOException e) {
            log.warn("Failed to read frame {}: {}. Skipping frame", task.inputIndex(), e.getMessage());
            log.debug("Read failure on frame {}", task.inputIndex(), e);
            context.getCounters().recordFailure();
            return null;
        }
    }

    private List<Frame> transform(ProcessingTask task, Frame input) {
        List<Frame> results;
        try {
            results = transform.transformOne(new FrameRef(task.outputIndex(), task.inputIndex()), input, transformContext);
        } catch (TransformException | RuntimeException e) {
            if (!input.isReleased()) {
                input.release();
            }
            context.getCounters().recordFailure();
            if (context.isStopOnError()) {
                log.error("Transform '{}' failed on frame {}: {}. Aborting run",
                        transform.getName(), task.inputIndex(), e.getMessage());
                context.requestAbort("transform failed on frame " + task.inputIndex() + ": " + e.getMessage());
            } else {
                log.warn("Transform '{}' failed on frame {}: {}. Skipping frame",
                        transform.getName(), task.inputIndex(), e.getMessage());
            }
            log.debug("Transform failure on frame {}", task.inputIndex(), e);
            return null;
        }
        if (results == null || results.size() != outputs.size()) {
            if (!input.isReleased()) {
                input.release();
            }
            releaseAll(results, 0);
            throw new IllegalStateException("Transform '" + transform.getName() + "' returned "
                    + (results == null ? "null" : results.size() + " frame(s)") + ", expected " + outputs.size());
        }
        return results;
    }

    /**
     * Hands each result to its output.
     *
     * @return Number of outputs that received their frame.
     */
    private int submit(ProcessingTask task, List<Frame> results) {
        for (int slot = 0; slot < outputs.size(); slot++) {
            PendingWrite write = new PendingWrite(task.outputIndex(), task.inputIndex(), results.get(slot));
            try {
                outputs.get(slot).submit(write);
            } catch (IOException e) {
                // The output has logged the failure and aborted the run.
                releaseAll(results, slot + 1);
                return slot + 1;
            }
        }
        return outputs.size();
    }

    private void emitSkips(ProcessingTask task, int fromSlot) {
        for (int slot = fromSlot; slot < outputs.size(); slot++) {
            try {
                outputs.get(slot).submit(PendingWrite.skip(task.outputIndex(), task.inputIndex()));
            } catch (IOException e) {
                log.debug("Skip marker for frame {} rejected by output '{}': {}",
                        task.inputIndex(), outputs.get(slot).getName(), e.getMessage());
            }
        }
    }

    private void sizeAdmissionFrom(Frame frame) {
        if (!plan.deferred() || !sized.compareAndSet(false, true)) {
            return;
        }
        long perFrameBytes = frame.getGeometry().bytesPerFrame();
        int limit = ConcurrencyPlanner.deferredLimit(plan.poolSize(), perFrameBytes, plan.availableBytes(), queueFactor);
        if (context.getAdmission().applyDeferredLimit(limit)) {
            log.debug("First frame is {} ({}), admission limit set to {}",
                    frame.getGeometry(), ByteSizes.formatBytes(perFrameBytes), limit);
        }
    }

    private static void releaseAll(List<Frame> frames, int fromIndex) {
        if (frames == null) {
            return;
        }
        for (int i = fromIndex; i < frames.size(); i++) {
            Frame frame = frames.get(i);
            if (frame != null && !frame.isReleased()) {
                frame.release();
            }
        }
    }
}
