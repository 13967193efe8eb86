package org.astroseq.transforms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.astroseq.api.sequence.Frame;
import org.astroseq.api.transform.FrameRef;
import org.astroseq.api.transform.TransformContext;
import org.astroseq.api.transform.TransformException;
import org.astroseq.test.utils.TestFrames;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ChannelSplitTransformTest {

    private static TransformContext context(boolean knownGeometry) {
        return new TransformContext("lights", 4, 2, knownGeometry ? TestFrames.RGB : null, () -> false);
    }

    @Test
    void splitsPlanesIntoOneFramePerChannel() throws TransformException {
        ChannelSplitTransform split = new ChannelSplitTransform(3);

        List<Frame> planes = split.transformOne(new FrameRef(0, 5), TestFrames.planes(TestFrames.RGB, 10), context(true));

        assertThat(planes).hasSize(3);
        for (int c = 0; c < 3; c++) {
            assertThat(planes.get(c).getGeometry()).isEqualTo(TestFrames.RGB.withChannels(1));
            assertThat(planes.get(c).getData()).containsOnly((byte) (10 + c));
        }
    }

    @Test
    void describesOutputs() {
        ChannelSplitTransform split = new ChannelSplitTransform(3);

        assertThat(split.getOutputCount()).isEqualTo(3);
        assertThat(split.getOutputGeometry(TestFrames.RGB, 2)).contains(TestFrames.MONO);
    }

    @Test
    void prepareRejectsWrongChannelCount() {
        ChannelSplitTransform split = new ChannelSplitTransform(2);

        assertThatThrownBy(() -> split.prepare(context(true)))
                .isInstanceOf(TransformException.class)
                .hasMessage("Sequence 'lights' has 3 channel(s), expected 2");
    }

    @Test
    void frameWithWrongChannelCountFailsWhenGeometryWasUnknown() throws TransformException {
        ChannelSplitTransform split = new ChannelSplitTransform(3);
        split.prepare(context(false));

        assertThatThrownBy(() -> split.transformOne(new FrameRef(1, 1), TestFrames.tagged(TestFrames.MONO, 1), context(false)))
                .isInstanceOf(TransformException.class)
                .hasMessage("Frame 1 has 1 channel(s), expected 3");
    }

    @Test
    void identityReturnsTheInputFrame() {
        Frame frame = TestFrames.tagged(TestFrames.MONO, 3);

        assertThat(new IdentityTransform().transformOne(new FrameRef(0, 0), frame, context(false))).containsExactly(frame);
    }
}
