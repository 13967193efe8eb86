package org.astroseq.engine;

import java.time.Duration;
import java.util.List;

import org.astroseq.engine.writer.WriterResult;

/**
 * Report of a finished run.
 *
 * @param outcome          {@link RunState#SUCCEEDED}, {@link RunState#PARTIAL} or {@link RunState#FAILED}.
 * @param counters         Final frame counters.
 * @param outputs          One result per output sequence, empty if no output was created.
 * @param elapsed          Wall-clock duration of the run.
 * @param abortReason      Why the run failed or was aborted, {@code null} otherwise.
 * @param poolSize         Number of worker threads used.
 * @param peakActiveBlocks Highest number of frames in flight at the same time.
 */
public record RunResult(RunState outcome,
                        RunCounters.Snapshot counters,
                        List<WriterResult> outputs,
                        Duration elapsed,
                        String abortReason,
                        int poolSize,
                        int peakActiveBlocks) {

    public RunResult {
        outputs = List.copyOf(outputs);
    }

    public boolean isSuccess() {
        return outcome == RunState.SUCCEEDED;
    }

    static RunResult notStarted(RunCounters counters, String reason, long startNanos) {
        return new RunResult(RunState.FAILED, counters.snapshot(), List.of(),
                Duration.ofNanos(System.nanoTime() - startNanos), reason, 0, 0);
    }
}
