package org.astroseq.engine.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SequenceCounterTest {

    @Test
    void exactlyOneCallerReachesZero() throws Exception {
        SequenceCounter counter = new SequenceCounter(1000);
        AtomicInteger zeroHits = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 1000; i++) {
            executor.execute(() -> {
                if (counter.countDown()) {
                    zeroHits.incrementAndGet();
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(zeroHits.get()).isEqualTo(1);
        assertThat(counter.remaining()).isZero();
    }

    @Test
    void countingPastZeroIsAnError() {
        SequenceCounter counter = new SequenceCounter(0);

        assertThatThrownBy(counter::countDown).isInstanceOf(IllegalStateException.class);
        assertThat(counter.remaining()).isZero();
    }
}
