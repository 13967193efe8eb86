package org.astroseq.engine.worker;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import org.astroseq.engine.ProcessingTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size pool of worker threads that process tasks in submission order.
 * <p>
 * Each worker claims the next task and takes its admission credit while holding the claim, so
 * credits are granted strictly in output-index order. A frame with a higher index can therefore
 * never hold the credit the lowest unwritten frame is waiting for.
 * <p>
 * <strong>Thread Safety:</strong> {@link #submit} and the shutdown methods are called from the
 * driver thread only.
 */
public final class FrameWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(FrameWorkerPool.class);

    private final ExecutorService executor;
    private final FrameProcessor processor;
    private final int poolSize;
    private final Deque<ProcessingTask> pending = new ArrayDeque<>();
    private final ReentrantLock claimLock = new ReentrantLock(true);

    public FrameWorkerPool(int poolSize, FrameProcessor processor) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1, got " + poolSize);
        }
        this.poolSize = poolSize;
        this.processor = processor;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, "seq-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void submit(ProcessingTask task) {
        claimLock.lock();
        try {
            pending.addLast(task);
        } finally {
            claimLock.unlock();
        }
        executor.execute(this::runNext);
    }

    /**
     * Stops accepting tasks and waits until every submitted task has been processed.
     *
     * @throws InterruptedException if the driver thread is interrupted while waiting.
     */
    public void shutdownAndAwait() throws InterruptedException {
        executor.shutdown();
        while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
            log.trace("Waiting for workers to finish");
        }
    }

    /**
     * Interrupts the workers and drops tasks that have not started.
     *
     * @return Number of tasks that were never processed.
     */
    public int shutdownNow() {
        executor.shutdownNow();
        claimLock.lock();
        try {
            int dropped = pending.size();
            pending.clear();
            return dropped;
        } finally {
            claimLock.unlock();
        }
    }

    private void runNext() {
        ProcessingTask task;
        boolean credit;
        claimLock.lock();
        try {
            task = pending.pollFirst();
            if (task == null) {
                return;
            }
            credit = processor.admit(task);
        } finally {
            claimLock.unlock();
        }
        processor.process(task, credit);
    }
}
