package org.astroseq.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.astroseq.api.memory.ByteSizes;
import org.astroseq.api.sequence.IFrameContainer;
import org.astroseq.io.FileSequence;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints the geometry and frame counts of a sequence.
 */
@Command(
    name = "inspect",
    description = "Show the frames and containers of a sequence"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "INPUT",
        description = "A .fstk file, or a directory of .fstk files")
    private Path input;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        FileSequence sequence;
        try {
            sequence = FileSequence.open(input);
        } catch (IOException e) {
            err.println("Error: cannot read sequence '" + input + "': " + e.getMessage());
            return 1;
        }

        out.printf("Sequence:   %s%n", sequence.getName());
        out.printf("Frames:     %d%n", sequence.getFrameCount());
        sequence.getFrameGeometry().ifPresentOrElse(
                geometry -> out.printf("Geometry:   %s (%s per frame)%n", geometry,
                        ByteSizes.formatBytes(geometry.bytesPerFrame())),
                () -> out.println("Geometry:   mixed"));
        out.printf("Containers: %d%n", sequence.getContainers().size());
        for (IFrameContainer container : sequence.getContainers()) {
            out.printf("  %-40s %6d frame(s)%n", container.getName(), container.getFrameCount());
        }
        out.flush();
        return 0;
    }
}
