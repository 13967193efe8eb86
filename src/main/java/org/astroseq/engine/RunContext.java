package org.astroseq.engine;

import java.util.concurrent.atomic.AtomicBoolean;

import org.astroseq.engine.memory.MemoryAdmissionController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared state of one run: the abort flag, the counters and the admission controller.
 * <p>
 * Passed explicitly to every component of the run. Cancellation is cooperative: workers and
 * writers check {@link #isAbortRequested()} at the start of every unit of work.
 */
public final class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final AtomicBoolean abortRequested = new AtomicBoolean(false);
    private final RunCounters counters;
    private final MemoryAdmissionController admission;
    private final boolean stopOnError;
    private volatile String abortReason;

    public RunContext(RunCounters counters, MemoryAdmissionController admission, boolean stopOnError) {
        this.counters = counters;
        this.admission = admission;
        this.stopOnError = stopOnError;
    }

    /**
     * Sets the abort flag and wakes every thread blocked on admission.
     *
     * @return {@code true} if this call set the flag, {@code false} if the run was already aborting.
     */
    public boolean requestAbort(String reason) {
        if (!abortRequested.compareAndSet(false, true)) {
            return false;
        }
        abortReason = reason;
        log.debug("Abort requested: {}", reason);
        admission.unblockAll();
        return true;
    }

    public boolean isAbortRequested() {
        return abortRequested.get();
    }

    /**
     * Reason passed to the first {@link #requestAbort(String)}, or {@code null}.
     */
    public String getAbortReason() {
        return abortReason;
    }

    public RunCounters getCounters() {
        return counters;
    }

    public MemoryAdmissionController getAdmission() {
        return admission;
    }

    public boolean isStopOnError() {
        return stopOnError;
    }
}
