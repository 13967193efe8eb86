package org.astroseq.engine.writer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.astroseq.api.container.IContainerHandle;
import org.astroseq.api.container.IContainerWriter;
import org.astroseq.engine.RunContext;

/**
 * Reorder-and-write queue of a contiguous output container.
 * <p>
 * Workers enqueue frames in completion order. A single writer thread keeps frames that arrive
 * early in a min-heap keyed by output index and appends them to the container strictly in
 * output order, so the container is written by one thread only. After each slot the admission
 * credit of the frame is confirmed through the {@link OutputSynchronizer}.
 * <p>
 * The thread stops once all {@code frameCount} slots are consumed or when
 * {@link PendingWrite#ABORT} arrives. Once the run is aborted, frames are released instead of
 * written.
 */
public final class SequenceWriter extends AbstractFrameOutput {

    private final int frameCount;
    private final OutputSynchronizer synchronizer;
    private final LinkedBlockingQueue<PendingWrite> incoming = new LinkedBlockingQueue<>();
    private final PriorityQueue<PendingWrite> waiting =
            new PriorityQueue<>(Comparator.comparingInt(PendingWrite::outputIndex));

    private Thread writerThread;
    private int nextIndexToWrite;
    private volatile boolean stopped;

    public SequenceWriter(String name, IContainerHandle handle, IContainerWriter format, RunContext context,
                          int frameCount, OutputSynchronizer synchronizer) {
        super(name, handle, format, context);
        this.frameCount = frameCount;
        this.synchronizer = synchronizer;
    }

    @Override
    public boolean isQueued() {
        return true;
    }

    @Override
    public void start() {
        if (writerThread != null) {
            throw new IllegalStateException("Writer '" + name + "' already started");
        }
        writerThread = new Thread(this::runWriter, "seq-writer-" + name);
        writerThread.start();
    }

    @Override
    public void submit(PendingWrite write) {
        incoming.add(write);
        if (stopped) {
            discardIncoming();
        }
    }

    @Override
    public WriterResult finish(boolean aborted) {
        if (aborted) {
            incoming.add(PendingWrite.ABORT);
        }
        boolean interrupted = false;
        while (writerThread != null && writerThread.isAlive()) {
            try {
                writerThread.join();
            } catch (InterruptedException e) {
                interrupted = true;
                context.requestAbort("interrupted while waiting for writer '" + name + "'");
                incoming.add(PendingWrite.ABORT);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return finalizeContainer(aborted || context.isAbortRequested());
    }

    /**
     * Number of frames currently held in the reorder heap. Only meaningful on the writer thread
     * or after it has terminated.
     */
    int waitingCount() {
        return waiting.size();
    }

    private void runWriter() {
        log.debug("Writer '{}' started for {} frame(s)", name, frameCount);
        try {
            while (nextIndexToWrite < frameCount) {
                PendingWrite write = incoming.take();
                if (write.isAbort()) {
                    log.debug("Writer '{}' received abort at slot {}", name, nextIndexToWrite);
                    break;
                }
                if (write.outputIndex() < nextIndexToWrite || write.outputIndex() >= frameCount) {
                    log.warn("Writer '{}' ignored frame for slot {}, expected slot {} or later",
                            name, write.outputIndex(), nextIndexToWrite);
                    write.releaseFrame();
                    continue;
                }
                waiting.add(write);
                while (!waiting.isEmpty() && waiting.peek().outputIndex() == nextIndexToWrite) {
                    consume(waiting.poll());
                    nextIndexToWrite++;
                }
            }
        } catch (InterruptedException e) {
            log.debug("Writer '{}' interrupted", name);
            Thread.currentThread().interrupt();
            context.requestAbort("writer '" + name + "' interrupted");
        } catch (RuntimeException e) {
            log.error("Writer '{}' stopped unexpectedly: {}", name, e.getMessage());
            log.debug("Writer failure on '{}'", name, e);
            writeFailed.set(true);
            context.requestAbort("writer '" + name + "' failed: " + e.getMessage());
        } finally {
            discardRemaining();
        }
        log.debug("Writer '{}' stopped after {} written, {} skipped", name, framesWritten.get(), framesSkipped.get());
    }

    private void consume(PendingWrite write) {
        try {
            if (write.isSkip()) {
                framesSkipped.incrementAndGet();
                if (!writeFailed.get() && !context.isAbortRequested()) {
                    handle.writeSkip(containerIndex(write));
                }
            } else if (!writeFailed.get() && !context.isAbortRequested()) {
                handle.writeFrame(write.frame(), containerIndex(write));
                framesWritten.incrementAndGet();
            }
        } catch (IOException e) {
            onWriteError(write, e);
        } finally {
            write.releaseFrame();
            synchronizer.confirm(write.outputIndex());
        }
    }

    private void discardRemaining() {
        List<PendingWrite> leftovers = new ArrayList<>(waiting);
        waiting.clear();
        discard(leftovers);
        stopped = true;
        discardIncoming();
    }

    private void discardIncoming() {
        List<PendingWrite> leftovers = new ArrayList<>();
        incoming.drainTo(leftovers);
        discard(leftovers);
    }

    private void discard(List<PendingWrite> writes) {
        for (PendingWrite write : writes) {
            if (write.isAbort()) {
                continue;
            }
            write.releaseFrame();
            synchronizer.confirm(write.outputIndex());
        }
    }
}
