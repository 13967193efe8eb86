package org.astroseq.engine.source;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.astroseq.api.sequence.Frame;
import org.astroseq.api.sequence.IFrameContainer;
import org.astroseq.api.sequence.IFrameReader;
import org.astroseq.api.sequence.ISequence;
import org.astroseq.engine.ProcessingTask;
import org.astroseq.engine.filter.IndexMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves global frame indices to physical containers and reads frames from them.
 * <p>
 * Containers are opened lazily on their first read and closed as soon as every selected frame
 * they hold has been consumed. Reads from the same container are serialised; reads from
 * different containers run in parallel. A container that fails to open is reported once, and
 * every frame it holds then fails fast with {@link ContainerUnavailableException}.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe. Each task must be consumed exactly once, either
 * through {@link #readFrame} or through {@link #skip}.
 */
public final class FrameSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(FrameSourceAdapter.class);

    private final String sequenceName;
    private final Slot[] slots;
    private final int[] ends;
    private final int frameCount;

    public FrameSourceAdapter(ISequence sequence, IndexMapping mapping) {
        this.sequenceName = sequence.getName();
        List<IFrameContainer> containers = sequence.getContainers();
        this.slots = new Slot[containers.size()];
        this.ends = new int[containers.size()];
        this.frameCount = sequence.getFrameCount();

        int[] offsets = new int[containers.size()];
        int offset = 0;
        for (int c = 0; c < containers.size(); c++) {
            offsets[c] = offset;
            offset += containers.get(c).getFrameCount();
            ends[c] = offset;
        }
        if (offset != frameCount) {
            throw new IllegalArgumentException("Containers of sequence '" + sequenceName + "' hold "
                    + offset + " frames, sequence declares " + frameCount);
        }

        int[] pending = new int[containers.size()];
        for (int o = 0; o < mapping.size(); o++) {
            pending[containerOf(mapping.inputIndexOf(o))]++;
        }
        for (int c = 0; c < containers.size(); c++) {
            slots[c] = new Slot(containers.get(c), offsets[c], new SequenceCounter(pending[c]));
        }
    }

    /**
     * Index of the container holding a global frame index.
     */
    public int containerOf(int inputIndex) {
        if (inputIndex < 0 || inputIndex >= frameCount) {
            throw new IndexOutOfBoundsException("Frame " + inputIndex + " is outside sequence '" + sequenceName + "'");
        }
        // First container whose exclusive end lies beyond the index.
        int low = 0;
        int high = ends.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (ends[mid] > inputIndex) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    /**
     * Reads the input frame of a task and counts the read against its container.
     *
     * @throws ContainerUnavailableException if the container could not be opened.
     * @throws IOException                   if the frame cannot be read or decoded.
     */
    public Frame readFrame(ProcessingTask task) throws IOException {
        Slot slot = slots[task.containerIndex()];
        slot.lock.lock();
        try {
            if (slot.state == ContainerState.CLOSED) {
                open(slot);
            }
            if (slot.state == ContainerState.FAILED) {
                throw new ContainerUnavailableException("Container '" + slot.container.getName()
                        + "' is unavailable", slot.openFailure);
            }
            if (slot.state == ContainerState.EXHAUSTED) {
                throw new IllegalStateException("Container '" + slot.container.getName() + "' is already exhausted");
            }
            return slot.reader.readFrame(task.inputIndex() - slot.offset);
        } finally {
            consumed(slot);
            slot.lock.unlock();
        }
    }

    /**
     * Counts a frame that will not be read (aborted run) against its container.
     */
    public void skip(ProcessingTask task) {
        Slot slot = slots[task.containerIndex()];
        slot.lock.lock();
        try {
            consumed(slot);
        } finally {
            slot.lock.unlock();
        }
    }

    public ContainerState getState(int containerIndex) {
        Slot slot = slots[containerIndex];
        slot.lock.lock();
        try {
            return slot.state;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Closes every container that is still open. Called at the end of a run, including aborted runs.
     */
    public void closeAll() {
        for (Slot slot : slots) {
            slot.lock.lock();
            try {
                if (slot.state == ContainerState.OPEN) {
                    close(slot);
                }
            } finally {
                slot.lock.unlock();
            }
        }
    }

    private void open(Slot slot) {
        try {
            slot.reader = slot.container.open();
            slot.state = ContainerState.OPEN;
            log.debug("Opened container '{}' of sequence '{}'", slot.container.getName(), sequenceName);
        } catch (IOException e) {
            slot.state = ContainerState.FAILED;
            slot.openFailure = e;
            log.warn("Cannot open container '{}' of sequence '{}': {}. Its {} selected frame(s) will be skipped",
                    slot.container.getName(), sequenceName, e.getMessage(), slot.pending.remaining());
            log.debug("Open failure of '{}'", slot.container.getName(), e);
        }
    }

    private void consumed(Slot slot) {
        if (slot.pending.countDown() && slot.state == ContainerState.OPEN) {
            close(slot);
        }
    }

    private void close(Slot slot) {
        try {
            slot.reader.close();
        } catch (IOException e) {
            log.warn("Failed to close container '{}': {}", slot.container.getName(), e.getMessage());
        } finally {
            slot.reader = null;
            slot.state = ContainerState.EXHAUSTED;
        }
        log.debug("Closed container '{}' of sequence '{}'", slot.container.getName(), sequenceName);
    }

    private static final class Slot {
        private final IFrameContainer container;
        private final int offset;
        private final SequenceCounter pending;
        private final ReentrantLock lock = new ReentrantLock();
        private ContainerState state = ContainerState.CLOSED;
        private IFrameReader reader;
        private IOException openFailure;

        private Slot(IFrameContainer container, int offset, SequenceCounter pending) {
            this.container = container;
            this.offset = offset;
            this.pending = pending;
        }
    }
}
