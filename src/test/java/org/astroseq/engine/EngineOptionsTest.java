package org.astroseq.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class EngineOptionsTest {

    @Test
    void readsValuesAndFallsBackToDefaults() {
        Config config = ConfigFactory.parseString("threads = 6\nstop-on-error = false");

        EngineOptions options = EngineOptions.fromConfig(config);

        assertThat(options).isEqualTo(new EngineOptions(6, false, 3, true));
    }

    @Test
    void bundledReferenceConfigMatchesDefaults() {
        Config engine = ConfigFactory.defaultReference().getConfig("astroseq.engine");

        assertThat(EngineOptions.fromConfig(engine)).isEqualTo(EngineOptions.defaults());
        assertThat(EngineOptions.progressInterval(engine)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void zeroThreadsResolvesToProcessorCount() {
        assertThat(EngineOptions.defaults().resolvedThreads()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(EngineOptions.defaults().withThreads(2).resolvedThreads()).isEqualTo(2);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> EngineOptions.fromConfig(ConfigFactory.parseString("threads = -1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threads");
        assertThatThrownBy(() -> EngineOptions.fromConfig(ConfigFactory.parseString("writer-queue-factor = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("writer-queue-factor");
    }

    @Test
    void progressIntervalAcceptsDurations() {
        assertThat(EngineOptions.progressInterval(ConfigFactory.parseString("progress-interval = 2s")))
                .isEqualTo(Duration.ofSeconds(2));
        assertThat(EngineOptions.progressInterval(ConfigFactory.empty())).isEqualTo(Duration.ofMillis(500));
    }
}
