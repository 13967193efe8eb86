package org.astroseq.engine.writer;

import java.util.concurrent.atomic.AtomicIntegerArray;

import org.astroseq.engine.memory.MemoryAdmissionController;

/**
 * Releases the admission credit of a logical frame once every queued output has written or
 * skipped it.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe. Confirmations for an index that holds no credit
 * are ignored.
 */
public final class OutputSynchronizer {

    private final AtomicIntegerArray pendingOutputs;
    private final MemoryAdmissionController admission;

    public OutputSynchronizer(int frameCount, MemoryAdmissionController admission) {
        this.pendingOutputs = new AtomicIntegerArray(frameCount);
        this.admission = admission;
    }

    /**
     * Registers the credit held for {@code outputIndex}. Must happen before the first
     * confirmation of that index.
     *
     * @param queuedOutputs Number of outputs that will confirm the index.
     */
    public void register(int outputIndex, int queuedOutputs) {
        if (queuedOutputs <= 0) {
            admission.release();
            return;
        }
        pendingOutputs.set(outputIndex, queuedOutputs);
    }

    /**
     * Called by a queued output after the frame at {@code outputIndex} has been written, skipped
     * or discarded.
     */
    public void confirm(int outputIndex) {
        while (true) {
            int pending = pendingOutputs.get(outputIndex);
            if (pending <= 0) {
                return;
            }
            if (pendingOutputs.compareAndSet(outputIndex, pending, pending - 1)) {
                if (pending == 1) {
                    admission.release();
                }
                return;
            }
        }
    }

    public int pendingConfirmations(int outputIndex) {
        return pendingOutputs.get(outputIndex);
    }
}
