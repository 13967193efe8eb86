package org.astroseq.engine.writer;

import static org.assertj.core.api.Assertions.assertThat;

import org.astroseq.engine.memory.MemoryAdmissionController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class OutputSynchronizerTest {

    private MemoryAdmissionController admission;
    private OutputSynchronizer synchronizer;

    @BeforeEach
    void setUp() throws InterruptedException {
        admission = new MemoryAdmissionController();
        admission.configure(3);
        synchronizer = new OutputSynchronizer(3, admission);
    }

    @Test
    void creditReleasedOnlyAfterEveryOutputConfirms() throws InterruptedException {
        admission.acquire();
        synchronizer.register(0, 2);

        synchronizer.confirm(0);
        assertThat(admission.getActiveBlocks()).isEqualTo(1);
        assertThat(synchronizer.pendingConfirmations(0)).isEqualTo(1);

        synchronizer.confirm(0);
        assertThat(admission.getActiveBlocks()).isZero();
    }

    @Test
    void laggingOutputHoldsCreditsOfAllFramesItHasNotWritten() throws InterruptedException {
        for (int i = 0; i < 3; i++) {
            admission.acquire();
            synchronizer.register(i, 2);
        }

        // Output B is two frames ahead of output A.
        synchronizer.confirm(0);
        synchronizer.confirm(1);
        assertThat(admission.getActiveBlocks()).isEqualTo(3);

        synchronizer.confirm(0);
        assertThat(admission.getActiveBlocks()).isEqualTo(2);
    }

    @Test
    void confirmWithoutCreditIsIgnored() throws InterruptedException {
        admission.acquire();

        synchronizer.confirm(1);
        synchronizer.confirm(1);

        assertThat(admission.getActiveBlocks()).isEqualTo(1);
    }

    @Test
    void registeringForNoQueuedOutputReleasesImmediately() throws InterruptedException {
        admission.acquire();

        synchronizer.register(0, 0);

        assertThat(admission.getActiveBlocks()).isZero();
    }
}
