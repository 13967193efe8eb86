package org.astroseq.engine.writer;

import java.io.IOException;

import org.astroseq.api.container.IContainerHandle;
import org.astroseq.api.container.IContainerWriter;
import org.astroseq.engine.RunContext;

/**
 * Output for non-contiguous formats. Workers write their frames directly, in any order; the
 * container handle must accept concurrent writes.
 */
public final class DirectFrameOutput extends AbstractFrameOutput {

    public DirectFrameOutput(String name, IContainerHandle handle, IContainerWriter format, RunContext context) {
        super(name, handle, format, context);
    }

    @Override
    public boolean isQueued() {
        return false;
    }

    @Override
    public void submit(PendingWrite write) throws IOException {
        try {
            if (write.isSkip()) {
                framesSkipped.incrementAndGet();
                if (!context.isAbortRequested()) {
                    handle.writeSkip(containerIndex(write));
                }
            } else if (!context.isAbortRequested() && !writeFailed.get()) {
                handle.writeFrame(write.frame(), containerIndex(write));
                framesWritten.incrementAndGet();
            }
        } catch (IOException e) {
            onWriteError(write, e);
            throw e;
        } finally {
            write.releaseFrame();
        }
    }

    @Override
    public WriterResult finish(boolean aborted) {
        return finalizeContainer(aborted);
    }
}
