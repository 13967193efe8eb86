package org.astroseq.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.astroseq.api.sequence.FrameGeometry;
import org.astroseq.api.sequence.IFrameContainer;
import org.astroseq.api.sequence.ISequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequence read from {@code .fstk} files: either one multi-frame file, or a directory whose
 * stack files, sorted by name, form the sequence in order.
 */
public final class FileSequence implements ISequence {

    private static final Logger log = LoggerFactory.getLogger(FileSequence.class);

    private final String name;
    private final List<FrameStackContainer> containers;
    private final int frameCount;
    private final Set<Integer> excluded;

    private FileSequence(String name, List<FrameStackContainer> containers, Set<Integer> excluded) {
        this.name = name;
        this.containers = List.copyOf(containers);
        this.frameCount = containers.stream().mapToInt(FrameStackContainer::getFrameCount).sum();
        this.excluded = Set.copyOf(excluded);
    }

    /**
     * Opens a sequence from a stack file or a directory of stack files.
     *
     * @throws IOException if the input does not exist, holds no stack file, or a header is invalid.
     */
    public static FileSequence open(Path input) throws IOException {
        if (Files.isDirectory(input)) {
            List<Path> files;
            try (Stream<Path> listing = Files.list(input)) {
                files = listing
                        .filter(Files::isRegularFile)
                        .filter(path -> path.getFileName().toString().endsWith(FrameStackCodec.EXTENSION))
                        .sorted()
                        .collect(Collectors.toList());
            }
            if (files.isEmpty()) {
                throw new IOException("No " + FrameStackCodec.EXTENSION + " file found in '" + input + "'");
            }
            List<FrameStackContainer> containers = new ArrayList<>();
            for (Path file : files) {
                containers.add(FrameStackContainer.probe(file));
            }
            log.debug("Sequence '{}' opened from {} file(s)", input.getFileName(), containers.size());
            return new FileSequence(input.getFileName().toString(), containers, Set.of());
        }
        if (!Files.exists(input)) {
            throw new IOException("Input '" + input + "' does not exist");
        }
        String fileName = input.getFileName().toString();
        String baseName = fileName.endsWith(FrameStackCodec.EXTENSION)
                ? fileName.substring(0, fileName.length() - FrameStackCodec.EXTENSION.length())
                : fileName;
        return new FileSequence(baseName, List.of(FrameStackContainer.probe(input)), Set.of());
    }

    /**
     * Returns a copy of this sequence in which the given frames are marked as not included.
     */
    public FileSequence withExcluded(Set<Integer> excludedIndices) {
        return new FileSequence(name, containers, excludedIndices);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getFrameCount() {
        return frameCount;
    }

    @Override
    public boolean isIncluded(int index) {
        return !excluded.contains(index);
    }

    @Override
    public List<IFrameContainer> getContainers() {
        return List.copyOf(containers);
    }

    /**
     * Geometry shared by all containers, or empty if the containers differ.
     */
    @Override
    public Optional<FrameGeometry> getFrameGeometry() {
        FrameGeometry first = containers.get(0).getHeader().geometry();
        for (FrameStackContainer container : containers) {
            if (!container.getHeader().geometry().equals(first)) {
                return Optional.empty();
            }
        }
        return Optional.of(first);
    }
}
