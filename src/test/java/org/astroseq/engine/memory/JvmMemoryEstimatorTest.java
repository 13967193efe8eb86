package org.astroseq.engine.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.astroseq.api.memory.MemoryMode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class JvmMemoryEstimatorTest {

    @Test
    void ratioAppliesToFreeHeap() {
        JvmMemoryEstimator estimator = new JvmMemoryEstimator(MemoryMode.RATIO, 0.5, 0, () -> 1000L);

        assertThat(estimator.availableBytes()).isEqualTo(500L);
    }

    @Test
    void amountIsFixed() {
        JvmMemoryEstimator estimator = new JvmMemoryEstimator(MemoryMode.AMOUNT, 0.9, 4096, () -> 1L);

        assertThat(estimator.availableBytes()).isEqualTo(4096L);
    }

    @Test
    void unlimitedIsNegative() {
        JvmMemoryEstimator estimator = new JvmMemoryEstimator(MemoryMode.UNLIMITED, 0.9, 0);

        assertThat(estimator.availableBytes()).isNegative();
    }

    @Test
    void realHeapGivesPositiveBudget() {
        JvmMemoryEstimator estimator = new JvmMemoryEstimator(MemoryMode.RATIO, 0.9, 0);

        assertThat(estimator.availableBytes()).isPositive();
    }

    @Test
    void readsHoconSizes() {
        JvmMemoryEstimator estimator = JvmMemoryEstimator.fromConfig(
                ConfigFactory.parseString("mode = amount\namount = 64M"));

        assertThat(estimator.getMode()).isEqualTo(MemoryMode.AMOUNT);
        assertThat(estimator.availableBytes()).isEqualTo(64L * 1024 * 1024);
    }

    @Test
    void defaultsToRatio() {
        JvmMemoryEstimator estimator = JvmMemoryEstimator.fromConfig(ConfigFactory.empty());

        assertThat(estimator.getMode()).isEqualTo(MemoryMode.RATIO);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> JvmMemoryEstimator.fromConfig(ConfigFactory.parseString("mode = plenty")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("plenty");
        assertThatThrownBy(() -> new JvmMemoryEstimator(MemoryMode.RATIO, 1.5, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JvmMemoryEstimator(MemoryMode.AMOUNT, 0.9, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
