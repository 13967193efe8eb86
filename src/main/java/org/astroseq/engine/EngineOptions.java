package org.astroseq.engine;

import java.time.Duration;
import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tuning of the processing engine.
 *
 * @param threads           Worker threads, {@code 0} for the number of available processors.
 * @param stopOnError       Abort the run on the first per-frame failure.
 * @param writerQueueFactor Frames in flight per worker for queued outputs.
 * @param checkDiskSpace    Check the free space of output directories before starting.
 */
public record EngineOptions(int threads, boolean stopOnError, int writerQueueFactor, boolean checkDiskSpace) {

    public EngineOptions {
        if (threads < 0) {
            throw new IllegalArgumentException("threads must be >= 0, got " + threads);
        }
        if (writerQueueFactor < 1) {
            throw new IllegalArgumentException("writer-queue-factor must be >= 1, got " + writerQueueFactor);
        }
    }

    public static EngineOptions defaults() {
        return new EngineOptions(0, true, 3, true);
    }

    /**
     * Reads the options from an {@code astroseq.engine} config block.
     *
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static EngineOptions fromConfig(Config engineConfig) {
        Config config = engineConfig.withFallback(ConfigFactory.parseMap(Map.of(
                "threads", 0,
                "stop-on-error", true,
                "writer-queue-factor", 3,
                "check-disk-space", true)));
        return new EngineOptions(
                config.getInt("threads"),
                config.getBoolean("stop-on-error"),
                config.getInt("writer-queue-factor"),
                config.getBoolean("check-disk-space"));
    }

    public EngineOptions withThreads(int newThreads) {
        return new EngineOptions(newThreads, stopOnError, writerQueueFactor, checkDiskSpace);
    }

    public EngineOptions withStopOnError(boolean newStopOnError) {
        return new EngineOptions(threads, newStopOnError, writerQueueFactor, checkDiskSpace);
    }

    /**
     * Number of worker threads to request, resolving {@code 0} to the processor count.
     */
    public int resolvedThreads() {
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Reads {@code progress-interval} from the same block, defaulting to 500ms.
     */
    public static Duration progressInterval(Config engineConfig) {
        return engineConfig.hasPath("progress-interval")
                ? engineConfig.getDuration("progress-interval")
                : Duration.ofMillis(500);
    }
}
