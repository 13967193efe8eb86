package org.astroseq.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.astroseq.api.container.IContainerHandle;
import org.astroseq.api.memory.ByteSizes;
import org.astroseq.api.memory.IMemoryEstimator;
import org.astroseq.api.sequence.FrameGeometry;
import org.astroseq.api.sequence.ISequence;
import org.astroseq.api.transform.ITransform;
import org.astroseq.api.transform.TransformContext;
import org.astroseq.api.transform.TransformException;
import org.astroseq.engine.filter.IndexMapping;
import org.astroseq.engine.memory.ConcurrencyPlan;
import org.astroseq.engine.memory.ConcurrencyPlanner;
import org.astroseq.engine.memory.MemoryAdmissionController;
import org.astroseq.engine.source.FrameSourceAdapter;
import org.astroseq.engine.worker.FrameProcessor;
import org.astroseq.engine.worker.FrameWorkerPool;
import org.astroseq.engine.writer.DirectFrameOutput;
import org.astroseq.engine.writer.IFrameOutput;
import org.astroseq.engine.writer.OutputSynchronizer;
import org.astroseq.engine.writer.SequenceWriter;
import org.astroseq.engine.writer.WriterResult;
import org.astroseq.engine.writer.WriterStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a transform over a sequence with bounded concurrency.
 * <p>
 * A run walks through {@code INIT -> PREPARED -> RUNNING -> outcome -> FINALIZED}:
 * <ol>
 *   <li>select frames, prepare the transform, size the worker pool and admission limit from
 *       the memory budget, check disk space and create the outputs;</li>
 *   <li>submit one task per selected frame, in output order;</li>
 *   <li>wait for the workers, finalize the outputs, close the inputs and report.</li>
 * </ol>
 * Runs on the caller's thread. One engine may be used for several runs, one at a time.
 */
public class SequenceProcessingEngine {

    private static final Logger log = LoggerFactory.getLogger(SequenceProcessingEngine.class);

    private final EngineOptions options;
    private final IMemoryEstimator memoryEstimator;
    private final DiskSpaceChecker diskSpaceChecker;
    private final IProgressListener progressListener;

    private volatile RunContext currentRun;

    public SequenceProcessingEngine(EngineOptions options, IMemoryEstimator memoryEstimator) {
        this(options, memoryEstimator, new DiskSpaceChecker(), IProgressListener.NONE);
    }

    public SequenceProcessingEngine(EngineOptions options, IMemoryEstimator memoryEstimator,
                                    DiskSpaceChecker diskSpaceChecker, IProgressListener progressListener) {
        this.options = options;
        this.memoryEstimator = memoryEstimator;
        this.diskSpaceChecker = diskSpaceChecker;
        this.progressListener = progressListener;
    }

    /**
     * Aborts the run in progress, if any. Safe to call from any thread, e.g. a shutdown hook.
     *
     * @return {@code true} if a running run was told to abort.
     */
    public boolean requestAbort(String reason) {
        RunContext run = currentRun;
        return run != null && run.requestAbort(reason);
    }

    /**
     * Processes a request to completion.
     *
     * @return The outcome. Failures are reported here; this method only throws for requests
     *         that cannot be run at all.
     * @throws EngineException if the sequence's containers do not match its frame count.
     */
    public RunResult run(ProcessingRequest request) {
        long startNanos = System.nanoTime();
        ISequence sequence = request.sequence();
        ITransform transform = request.transform();
        RunState state = RunState.INIT;

        IndexMapping mapping = IndexMapping.build(sequence, request.filter());
        RunCounters counters = new RunCounters(sequence.getFrameCount());
        counters.addExcluded(mapping.getExcludedCount());
        int frameCount = mapping.size();
        if (mapping.isEmpty()) {
            log.warn("Nothing to process in sequence '{}': none of its {} frame(s) match {}",
                    sequence.getName(), sequence.getFrameCount(), mapping.getFilterDescription());
            return RunResult.notStarted(counters, "nothing to process", startNanos);
        }

        FrameSourceAdapter source;
        try {
            source = new FrameSourceAdapter(sequence, mapping);
        } catch (IllegalArgumentException e) {
            throw new EngineException(e.getMessage(), e);
        }

        Optional<FrameGeometry> geometry = sequence.getFrameGeometry();
        long perFrameBytes = geometry.map(FrameGeometry::bytesPerFrame).orElse(-1L);
        long availableBytes = memoryEstimator.availableBytes();
        ConcurrencyPlan plan = ConcurrencyPlanner.plan(
                options.resolvedThreads(), perFrameBytes, availableBytes, options.writerQueueFactor());

        MemoryAdmissionController admission = new MemoryAdmissionController();
        RunContext context = new RunContext(counters, admission, options.stopOnError());
        TransformContext transformContext = new TransformContext(sequence.getName(), frameCount,
                plan.poolSize(), geometry.orElse(null), context::isAbortRequested);

        try {
            transform.prepare(transformContext);
        } catch (TransformException e) {
            log.error("Failed to prepare transform '{}' for sequence '{}': {}",
                    transform.getName(), sequence.getName(), e.getMessage());
            log.debug("Prepare failure", e);
            return RunResult.notStarted(counters, "prepare failed: " + e.getMessage(), startNanos);
        }

        if (options.checkDiskSpace() && geometry.isPresent()
                && !hasDiskSpace(request, geometry.get(), frameCount)) {
            transform.finish(transformContext, false);
            return RunResult.notStarted(counters, "not enough disk space", startNanos);
        }

        List<IContainerHandle> handles = openOutputs(request.outputs(), frameCount);
        if (handles == null) {
            transform.finish(transformContext, false);
            return RunResult.notStarted(counters, "cannot create output", startNanos);
        }

        if (plan.deferred()) {
            admission.configureDeferred();
        } else {
            admission.configure(plan.maxActiveBlocks());
        }
        OutputSynchronizer synchronizer = new OutputSynchronizer(frameCount, admission);
        List<IFrameOutput> outputs = createOutputs(request.outputs(), handles, context, frameCount, synchronizer);
        state = transition(state, RunState.PREPARED);

        currentRun = context;
        outputs.forEach(IFrameOutput::start);
        FrameProcessor processor = new FrameProcessor(context, source, transform, transformContext, outputs,
                synchronizer, progressListener, plan, options.writerQueueFactor(), frameCount);
        FrameWorkerPool pool = new FrameWorkerPool(plan.poolSize(), processor);

        log.info("Processing {} of {} frame(s) of '{}' ({}) with '{}' on {} thread(s), admission limit {}",
                frameCount, sequence.getFrameCount(), sequence.getName(), mapping.getFilterDescription(),
                transform.getName(), plan.poolSize(), describeLimit(plan));
        progressListener.onStart(sequence.getName(), frameCount);
        state = transition(state, RunState.RUNNING);

        try {
            for (int outputIndex = 0; outputIndex < frameCount; outputIndex++) {
                int inputIndex = mapping.inputIndexOf(outputIndex);
                pool.submit(new ProcessingTask(outputIndex, inputIndex, source.containerOf(inputIndex)));
            }
            pool.shutdownAndAwait();
        } catch (InterruptedException e) {
            log.debug("Interrupted while waiting for workers");
            Thread.currentThread().interrupt();
            context.requestAbort("interrupted");
            int dropped = pool.shutdownNow();
            log.debug("{} task(s) dropped", dropped);
        }

        List<WriterResult> results = new ArrayList<>();
        for (IFrameOutput output : outputs) {
            results.add(output.finish(context.isAbortRequested()));
        }
        source.closeAll();
        admission.unblockAll();
        currentRun = null;

        // An abort may arrive while the writers drain, so read it only once they are joined.
        boolean aborted = context.isAbortRequested();
        RunState outcome = outcomeOf(aborted, context, results);
        transform.finish(transformContext, outcome != RunState.FAILED);
        state = transition(state, outcome);

        RunResult result = new RunResult(outcome, counters.snapshot(), results,
                Duration.ofNanos(System.nanoTime() - startNanos),
                aborted ? context.getAbortReason() : null, plan.poolSize(), admission.getPeakActiveBlocks());
        progressListener.onFinish(result);
        logSummary(sequence, result);
        transition(state, RunState.FINALIZED);
        return result;
    }

    private boolean hasDiskSpace(ProcessingRequest request, FrameGeometry inputGeometry, int frameCount) {
        Map<Path, Long> requiredPerDirectory = new LinkedHashMap<>();
        for (int slot = 0; slot < request.outputs().size(); slot++) {
            OutputSpec spec = request.outputs().get(slot);
            long frameBytes = request.transform().getOutputGeometry(inputGeometry, slot)
                    .map(FrameGeometry::bytesPerFrame)
                    .orElse(inputGeometry.bytesPerFrame());
            Path directory = spec.path().toAbsolutePath().getParent();
            if (directory != null) {
                requiredPerDirectory.merge(directory, frameBytes * frameCount, Long::sum);
            }
        }
        for (Map.Entry<Path, Long> entry : requiredPerDirectory.entrySet()) {
            if (!diskSpaceChecker.hasSpaceFor(entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Creates all output containers, or none.
     *
     * @return The handles in output order, or {@code null} if one could not be created.
     */
    private List<IContainerHandle> openOutputs(List<OutputSpec> specs, int frameCount) {
        List<IContainerHandle> handles = new ArrayList<>();
        for (OutputSpec spec : specs) {
            int expectedCount = spec.format().isCountMandatory() ? frameCount : -1;
            try {
                handles.add(spec.format().open(spec.path(), expectedCount));
                log.debug("Created {} output '{}' at '{}'", spec.format().getFormatName(), spec.name(), spec.path());
            } catch (IOException e) {
                log.error("Cannot create output '{}' at '{}': {}", spec.name(), spec.path(), e.getMessage());
                log.debug("Output creation failure", e);
                for (IContainerHandle handle : handles) {
                    try {
                        handle.abortAndDelete();
                    } catch (IOException deleteError) {
                        log.warn("Failed to delete output '{}': {}", handle.getPath(), deleteError.getMessage());
                    }
                }
                return null;
            }
        }
        return handles;
    }

    private static List<IFrameOutput> createOutputs(List<OutputSpec> specs, List<IContainerHandle> handles,
                                                    RunContext context, int frameCount,
                                                    OutputSynchronizer synchronizer) {
        List<IFrameOutput> outputs = new ArrayList<>();
        for (int i = 0; i < specs.size(); i++) {
            OutputSpec spec = specs.get(i);
            if (spec.format().isContiguous()) {
                outputs.add(new SequenceWriter(spec.name(), handles.get(i), spec.format(), context,
                        frameCount, synchronizer));
            } else {
                outputs.add(new DirectFrameOutput(spec.name(), handles.get(i), spec.format(), context));
            }
        }
        return outputs;
    }

    private static RunState outcomeOf(boolean aborted, RunContext context, List<WriterResult> results) {
        if (aborted) {
            return RunState.FAILED;
        }
        for (WriterResult result : results) {
            if (result.status() == WriterStatus.FAILED || result.status() == WriterStatus.DELETED) {
                return RunState.FAILED;
            }
        }
        RunCounters counters = context.getCounters();
        if (counters.getFailed() > 0) {
            return counters.getConverted() > 0 ? RunState.PARTIAL : RunState.FAILED;
        }
        return RunState.SUCCEEDED;
    }

    private static RunState transition(RunState from, RunState to) {
        log.debug("Run state {} -> {}", from, to);
        return to;
    }

    private static String describeLimit(ConcurrencyPlan plan) {
        if (plan.deferred()) {
            return "set after the first frame";
        }
        if (plan.maxActiveBlocks() <= 0) {
            return "unlimited";
        }
        return plan.maxActiveBlocks() + " frame(s) of " + ByteSizes.formatBytes(plan.perFrameBytes());
    }

    private static void logSummary(ISequence sequence, RunResult result) {
        RunCounters.Snapshot c = result.counters();
        String elapsed = formatTime(result.elapsed().toMillis());
        switch (result.outcome()) {
            case SUCCEEDED -> log.info("Sequence '{}' processed: {} frame(s) converted, {} excluded, in {}",
                    sequence.getName(), c.converted(), c.excluded(), elapsed);
            case PARTIAL -> log.warn("Sequence '{}' processed with errors: {} converted, {} failed, {} excluded, in {}",
                    sequence.getName(), c.converted(), c.failed(), c.excluded(), elapsed);
            default -> log.warn("Processing of sequence '{}' failed{}: {} converted, {} failed, {} excluded, in {}",
                    sequence.getName(), result.abortReason() != null ? " (" + result.abortReason() + ")" : "",
                    c.converted(), c.failed(), c.excluded(), elapsed);
        }
    }

    static String formatTime(long ms) {
        if (ms < 0) {
            return "?";
        }
        long sec = ms / 1000;
        long h = sec / 3600;
        long m = (sec % 3600) / 60;
        long s = sec % 60;
        if (h == 0 && m == 0) {
            return String.format("%d.%03ds", s, ms % 1000);
        }
        return h > 0 ? String.format("%d:%02d:%02d", h, m, s) : String.format("%d:%02d", m, s);
    }
}
