package org.astroseq.engine.writer;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.astroseq.api.container.IContainerHandle;
import org.astroseq.api.container.IContainerWriter;
import org.astroseq.api.container.OutputIndexing;
import org.astroseq.engine.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finalization policy shared by all outputs.
 * <p>
 * A completed output is closed with the number of frames written. After an abort, containers
 * whose format needs the frame count are deleted, all others are kept as a shorter sequence.
 * After a write error the partial container is always deleted.
 */
abstract class AbstractFrameOutput implements IFrameOutput {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final String name;
    protected final IContainerHandle handle;
    protected final IContainerWriter format;
    protected final RunContext context;

    protected final AtomicInteger framesWritten = new AtomicInteger();
    protected final AtomicInteger framesSkipped = new AtomicInteger();
    protected final AtomicBoolean writeFailed = new AtomicBoolean(false);

    protected AbstractFrameOutput(String name, IContainerHandle handle, IContainerWriter format, RunContext context) {
        this.name = name;
        this.handle = handle;
        this.format = format;
        this.context = context;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Index passed to the container for a pending write.
     */
    protected int containerIndex(PendingWrite write) {
        return format.getIndexing() == OutputIndexing.OUTPUT ? write.outputIndex() : write.inputIndex();
    }

    /**
     * Records a write error and aborts the run. Only the first error is logged at error level.
     */
    protected void onWriteError(PendingWrite write, IOException e) {
        if (writeFailed.compareAndSet(false, true)) {
            log.error("Failed to write frame {} to output '{}': {}. Aborting run",
                    write.inputIndex(), name, e.getMessage());
            log.debug("Write failure on '{}'", name, e);
        } else {
            log.debug("Further write failure on '{}': {}", name, e.getMessage());
        }
        context.requestAbort("write error on output '" + name + "': " + e.getMessage());
    }

    protected WriterResult finalizeContainer(boolean aborted) {
        if (writeFailed.get()) {
            deleteQuietly();
            return result(WriterStatus.FAILED);
        }
        if (aborted && format.isCountMandatory()) {
            log.error("Output '{}' requires a complete frame count and was deleted after the run was aborted", name);
            deleteQuietly();
            return result(WriterStatus.DELETED);
        }
        try {
            handle.close(framesWritten.get());
        } catch (IOException e) {
            log.error("Failed to finalize output '{}': {}", name, e.getMessage());
            log.debug("Finalize failure on '{}'", name, e);
            deleteQuietly();
            return result(WriterStatus.FAILED);
        }
        if (aborted) {
            log.warn("Run aborted, output '{}' kept with {} frame(s)", name, framesWritten.get());
            return result(WriterStatus.TRUNCATED);
        }
        log.debug("Output '{}' finalized with {} frame(s)", name, framesWritten.get());
        return result(WriterStatus.COMPLETED);
    }

    private void deleteQuietly() {
        try {
            handle.abortAndDelete();
        } catch (IOException e) {
            log.warn("Failed to delete partial output '{}' at '{}': {}", name, handle.getPath(), e.getMessage());
        }
    }

    private WriterResult result(WriterStatus status) {
        return new WriterResult(name, handle.getPath(), status, framesWritten.get(), framesSkipped.get());
    }
}
