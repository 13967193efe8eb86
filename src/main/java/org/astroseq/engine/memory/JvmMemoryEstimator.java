package org.astroseq.engine.memory;

import java.util.Map;
import java.util.function.LongSupplier;

import org.astroseq.api.memory.IMemoryEstimator;
import org.astroseq.api.memory.MemoryMode;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Memory budget derived from the JVM heap.
 * <p>
 * In {@link MemoryMode#RATIO} mode the budget is {@code ratio * (maxMemory - usedMemory)},
 * sampled when a run starts. {@link MemoryMode#AMOUNT} returns a fixed number of bytes and
 * {@link MemoryMode#UNLIMITED} disables admission limits.
 */
public final class JvmMemoryEstimator implements IMemoryEstimator {

    private final MemoryMode mode;
    private final double ratio;
    private final long amount;
    private final LongSupplier freeHeap;

    public JvmMemoryEstimator(MemoryMode mode, double ratio, long amount) {
        this(mode, ratio, amount, JvmMemoryEstimator::freeHeapBytes);
    }

    JvmMemoryEstimator(MemoryMode mode, double ratio, long amount, LongSupplier freeHeap) {
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        if (mode == MemoryMode.RATIO && (ratio <= 0.0 || ratio > 1.0)) {
            throw new IllegalArgumentException("memory ratio must be in (0, 1], got " + ratio);
        }
        if (mode == MemoryMode.AMOUNT && amount <= 0) {
            throw new IllegalArgumentException("memory amount must be positive, got " + amount);
        }
        this.mode = mode;
        this.ratio = ratio;
        this.amount = amount;
        this.freeHeap = freeHeap;
    }

    /**
     * Reads {@code mode}, {@code ratio} and {@code amount} from a memory config block.
     *
     * @throws IllegalArgumentException if a value is invalid.
     */
    public static JvmMemoryEstimator fromConfig(Config memoryConfig) {
        Config config = memoryConfig.withFallback(ConfigFactory.parseMap(Map.of(
                "mode", "RATIO",
                "ratio", 0.9,
                "amount", "4G")));
        MemoryMode mode;
        try {
            mode = MemoryMode.valueOf(config.getString("mode").toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown memory mode '" + config.getString("mode")
                    + "', expected one of RATIO, AMOUNT, UNLIMITED");
        }
        return new JvmMemoryEstimator(mode, config.getDouble("ratio"), config.getBytes("amount"));
    }

    @Override
    public long availableBytes() {
        return switch (mode) {
            case RATIO -> (long) (ratio * freeHeap.getAsLong());
            case AMOUNT -> amount;
            case UNLIMITED -> -1L;
        };
    }

    public MemoryMode getMode() {
        return mode;
    }

    private static long freeHeapBytes() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return Math.max(0L, runtime.maxMemory() - used);
    }
}
