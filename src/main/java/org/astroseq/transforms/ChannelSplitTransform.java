package org.astroseq.transforms;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.astroseq.api.sequence.Frame;
import org.astroseq.api.sequence.FrameGeometry;
import org.astroseq.api.transform.FrameRef;
import org.astroseq.api.transform.ITransform;
import org.astroseq.api.transform.TransformContext;
import org.astroseq.api.transform.TransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits each multi-channel frame into one single-channel frame per channel, each written to
 * its own output sequence.
 */
public final class ChannelSplitTransform implements ITransform {

    private static final Logger log = LoggerFactory.getLogger(ChannelSplitTransform.class);

    private final int channels;

    public ChannelSplitTransform(int channels) {
        if (channels < 1) {
            throw new IllegalArgumentException("channels must be >= 1, got " + channels);
        }
        this.channels = channels;
    }

    @Override
    public String getName() {
        return "split";
    }

    @Override
    public int getOutputCount() {
        return channels;
    }

    @Override
    public Optional<FrameGeometry> getOutputGeometry(FrameGeometry input, int outputSlot) {
        return Optional.of(input.withChannels(1));
    }

    @Override
    public void prepare(TransformContext context) throws TransformException {
        Optional<FrameGeometry> geometry = context.getInputGeometry();
        if (geometry.isPresent() && geometry.get().channels() != channels) {
            throw new TransformException("Sequence '" + context.getSequenceName() + "' has "
                    + geometry.get().channels() + " channel(s), expected " + channels);
        }
        log.debug("Splitting {} frame(s) of '{}' into {} channel(s)",
                context.getFrameCount(), context.getSequenceName(), channels);
    }

    @Override
    public List<Frame> transformOne(FrameRef ref, Frame input, TransformContext context) throws TransformException {
        FrameGeometry geometry = input.getGeometry();
        if (geometry.channels() != channels) {
            throw new TransformException("Frame " + ref.inputIndex() + " has " + geometry.channels()
                    + " channel(s), expected " + channels);
        }
        FrameGeometry planeGeometry = geometry.withChannels(1);
        int planeBytes = (int) geometry.bytesPerPlane();
        byte[] data = input.getData();
        List<Frame> planes = new ArrayList<>(channels);
        for (int c = 0; c < channels; c++) {
            byte[] plane = new byte[planeBytes];
            System.arraycopy(data, c * planeBytes, plane, 0, planeBytes);
            planes.add(new Frame(planeGeometry, plane));
        }
        return planes;
    }
}
