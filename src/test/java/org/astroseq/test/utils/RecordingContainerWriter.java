package org.astroseq.test.utils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.astroseq.api.container.IContainerHandle;
import org.astroseq.api.container.IContainerWriter;
import org.astroseq.api.container.OutputIndexing;
import org.astroseq.api.sequence.Frame;

/**
 * Container format that records every call instead of writing files.
 */
public final class RecordingContainerWriter implements IContainerWriter {

    /**
     * One call received by a handle. {@code tag} is the frame's tag, or -1 for a skip.
     */
    public record Entry(boolean skip, int index, int tag, int size) {
    }

    private final boolean contiguous;
    private final OutputIndexing indexing;
    private final boolean countMandatory;
    private final List<Handle> handles = new CopyOnWriteArrayList<>();
    private volatile boolean failOpen;
    private volatile Set<Integer> failingWrites = Set.of();
    private volatile CountDownLatch writeGate;
    private volatile long writeDelayMillis;

    private RecordingContainerWriter(boolean contiguous, OutputIndexing indexing, boolean countMandatory) {
        this.contiguous = contiguous;
        this.indexing = indexing;
        this.countMandatory = countMandatory;
    }

    /**
     * A single-file format written in output order.
     */
    public static RecordingContainerWriter contiguous() {
        return new RecordingContainerWriter(true, OutputIndexing.OUTPUT, false);
    }

    /**
     * A single-file format whose header needs the final frame count.
     */
    public static RecordingContainerWriter contiguousWithMandatoryCount() {
        return new RecordingContainerWriter(true, OutputIndexing.OUTPUT, true);
    }

    /**
     * A one-file-per-frame format indexed by input index.
     */
    public static RecordingContainerWriter perFrame() {
        return new RecordingContainerWriter(false, OutputIndexing.INPUT, false);
    }

    public RecordingContainerWriter failingOpen() {
        this.failOpen = true;
        return this;
    }

    /**
     * Makes {@code writeFrame} throw for the given container indices.
     */
    public RecordingContainerWriter failingWritesAt(Integer... indices) {
        this.failingWrites = Set.of(indices);
        return this;
    }

    /**
     * Blocks every {@code writeFrame} until the latch is released.
     */
    public RecordingContainerWriter gatedBy(CountDownLatch gate) {
        this.writeGate = gate;
        return this;
    }

    public RecordingContainerWriter withWriteDelay(long millis) {
        this.writeDelayMillis = millis;
        return this;
    }

    @Override
    public String getFormatName() {
        return "recording";
    }

    @Override
    public boolean isContiguous() {
        return contiguous;
    }

    @Override
    public OutputIndexing getIndexing() {
        return indexing;
    }

    @Override
    public boolean isCountMandatory() {
        return countMandatory;
    }

    @Override
    public Path resolveOutput(Path directory, String prefix, String sequenceName) {
        return directory.resolve(prefix + sequenceName);
    }

    @Override
    public IContainerHandle open(Path path, int expectedCount) throws IOException {
        if (failOpen) {
            throw new IOException("read-only file system");
        }
        Handle handle = new Handle(path, expectedCount);
        handles.add(handle);
        return handle;
    }

    public List<Handle> handles() {
        return handles;
    }

    public Handle handle() {
        if (handles.size() != 1) {
            throw new IllegalStateException(handles.size() + " handles opened");
        }
        return handles.get(0);
    }

    public final class Handle implements IContainerHandle {

        private final Path path;
        private final int expectedCount;
        private final List<Entry> entries = Collections.synchronizedList(new ArrayList<>());
        private final AtomicInteger concurrentWrites = new AtomicInteger();
        private final AtomicInteger maxConcurrentWrites = new AtomicInteger();
        private volatile Integer closedWith;
        private volatile boolean deleted;

        private Handle(Path path, int expectedCount) {
            this.path = path;
            this.expectedCount = expectedCount;
        }

        @Override
        public Path getPath() {
            return path;
        }

        @Override
        public void writeFrame(Frame frame, int index) throws IOException {
            int running = concurrentWrites.incrementAndGet();
            maxConcurrentWrites.accumulateAndGet(running, Math::max);
            try {
                awaitGate();
                if (writeDelayMillis > 0) {
                    Thread.sleep(writeDelayMillis);
                }
                if (failingWrites.contains(index)) {
                    throw new IOException("disk full");
                }
                entries.add(new Entry(false, index, TestFrames.tagOf(frame), frame.getData().length));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            } finally {
                concurrentWrites.decrementAndGet();
            }
        }

        @Override
        public void writeSkip(int index) {
            entries.add(new Entry(true, index, -1, 0));
        }

        @Override
        public void close(int actualCount) {
            closedWith = actualCount;
        }

        @Override
        public void abortAndDelete() {
            deleted = true;
        }

        private void awaitGate() throws InterruptedException, IOException {
            CountDownLatch gate = writeGate;
            if (gate != null && !gate.await(10, TimeUnit.SECONDS)) {
                throw new IOException("write gate never opened");
            }
        }

        public List<Entry> entries() {
            synchronized (entries) {
                return List.copyOf(entries);
            }
        }

        /**
         * Tags of the written frames in call order.
         */
        public List<Integer> writtenTags() {
            return entries().stream().filter(e -> !e.skip()).map(Entry::tag).toList();
        }

        public int expectedCount() {
            return expectedCount;
        }

        public Integer closedWith() {
            return closedWith;
        }

        public boolean isDeleted() {
            return deleted;
        }

        public int maxConcurrentWrites() {
            return maxConcurrentWrites.get();
        }
    }
}
