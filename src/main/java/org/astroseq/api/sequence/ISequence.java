package org.astroseq.api.sequence;

import java.util.List;
import java.util.Optional;

/**
 * An ordered, indexed list of frames of one observation, stored in one or more physical
 * containers.
 * <p>
 * Global frame index {@code i} maps to the containers in order: the first container holds
 * indices {@code [0, c0)}, the second {@code [c0, c0 + c1)} and so on. The container frame
 * counts must sum up to {@link #getFrameCount()}.
 */
public interface ISequence {

    String getName();

    int getFrameCount();

    /**
     * Whether the frame is marked as included (selected) in the sequence.
     */
    boolean isIncluded(int index);

    List<IFrameContainer> getContainers();

    /**
     * Frame geometry if it is known without decoding a frame. Sequences whose frames are only
     * sized after decoding (e.g. raw camera files) return empty.
     */
    default Optional<FrameGeometry> getFrameGeometry() {
        return Optional.empty();
    }

    /**
     * Registration measurements of a frame, if a registration pass has been run.
     */
    default Optional<RegistrationData> getRegistrationData(int index) {
        return Optional.empty();
    }
}
