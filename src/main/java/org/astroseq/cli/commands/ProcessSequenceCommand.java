package org.astroseq.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;

import org.astroseq.api.container.IContainerWriter;
import org.astroseq.api.sequence.FrameGeometry;
import org.astroseq.api.transform.ITransform;
import org.astroseq.cli.CommandLineInterface;
import org.astroseq.cli.ConsoleProgressListener;
import org.astroseq.engine.DiskSpaceChecker;
import org.astroseq.engine.EngineOptions;
import org.astroseq.engine.OutputSpec;
import org.astroseq.engine.ProcessingRequest;
import org.astroseq.engine.RunResult;
import org.astroseq.engine.SequenceProcessingEngine;
import org.astroseq.engine.filter.ISequenceFilter;
import org.astroseq.engine.filter.SequenceFilters;
import org.astroseq.engine.memory.JvmMemoryEstimator;
import org.astroseq.engine.writer.WriterResult;
import org.astroseq.io.FileSequence;
import org.astroseq.io.FrameFileWriter;
import org.astroseq.io.FrameStackWriter;
import org.astroseq.transforms.ChannelSplitTransform;
import org.astroseq.transforms.IdentityTransform;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that runs a transform over a sequence of frame stack files.
 * <p>
 * Exit codes: 0 when every selected frame was converted, 2 when some frames failed and were
 * skipped, 1 when the run failed.
 */
@Command(
    name = "process",
    description = "Apply an operation to every selected frame of a sequence and write the result as a new sequence"
)
public class ProcessSequenceCommand implements Callable<Integer> {

    static final int EXIT_PARTIAL = 2;

    enum TransformName { COPY, SPLIT }

    enum FilterName { ALL, INCLUDED }

    enum FormatName { STACK, FILES }

    @Parameters(index = "0", paramLabel = "INPUT",
        description = "A .fstk file, or a directory whose .fstk files form the sequence")
    private Path input;

    @Option(names = {"-o", "--out-dir"},
        description = "Output directory (default: the input directory)")
    private Path outDir;

    @Option(names = {"-p", "--prefix"},
        description = "Prefix of the output sequence name (default: astroseq.output.prefix)")
    private String prefix;

    @Option(names = {"-t", "--transform"}, defaultValue = "COPY",
        description = "Operation: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private TransformName transformName;

    @Option(names = {"--channels"},
        description = "Channels to split into (default: channels of the input frames)")
    private Integer channels;

    @Option(names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: astroseq.output.format)")
    private FormatName format;

    @Option(names = {"--filter"}, defaultValue = "INCLUDED",
        description = "Frames to process: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private FilterName filterName;

    @Option(names = {"--exclude"}, split = ",", paramLabel = "INDEX",
        description = "Comma-separated frame indices to mark as not included")
    private List<Integer> excluded = new ArrayList<>();

    @Option(names = {"--skip-existing"},
        description = "With --format files, skip frames whose output file already exists")
    private boolean skipExisting;

    @Option(names = {"-j", "--threads"},
        description = "Worker threads (default: astroseq.engine.threads, 0 = all processors)")
    private Integer threads;

    @Option(names = {"--stop-on-error"}, negatable = true,
        description = "Abort on the first failed frame (default: astroseq.engine.stop-on-error)")
    private Boolean stopOnError;

    @Option(names = {"--count-mandatory"},
        description = "Delete the output stack instead of keeping a shorter one when the run is aborted")
    private Boolean countMandatory;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config = parent.getConfig();
        Config engineConfig = config.getConfig("astroseq.engine");
        Config outputConfig = config.getConfig("astroseq.output");

        EngineOptions options = EngineOptions.fromConfig(engineConfig);
        if (threads != null) {
            options = options.withThreads(threads);
        }
        if (stopOnError != null) {
            options = options.withStopOnError(stopOnError);
        }

        FileSequence sequence;
        try {
            sequence = FileSequence.open(input).withExcluded(new HashSet<>(excluded));
        } catch (IOException e) {
            err.println("Error: cannot read sequence '" + input + "': " + e.getMessage());
            return 1;
        }

        ITransform transform = createTransform(sequence);
        IContainerWriter writer = createWriter(outputConfig);
        String outputPrefix = prefix != null ? prefix : outputConfig.getString("prefix");
        Path directory = outDir != null ? outDir : (Files.isDirectory(input) ? input : input.toAbsolutePath().getParent());

        List<OutputSpec> outputs = new ArrayList<>();
        if (transform.getOutputCount() == 1) {
            outputs.add(new OutputSpec(sequence.getName(),
                    writer.resolveOutput(directory, outputPrefix, sequence.getName()), writer));
        } else {
            for (int c = 0; c < transform.getOutputCount(); c++) {
                String name = sequence.getName() + "_c" + c;
                outputs.add(new OutputSpec(name, writer.resolveOutput(directory, outputPrefix, name), writer));
            }
        }

        ISequenceFilter filter = filterName == FilterName.ALL ? SequenceFilters.all() : SequenceFilters.included();
        if (skipExisting) {
            if (writer.isContiguous() || outputs.size() != 1) {
                err.println("Error: --skip-existing requires --format files and a single output");
                return 1;
            }
            Path base = outputs.get(0).path();
            filter = SequenceFilters.allOf(filter,
                    SequenceFilters.missingOutput(index -> FrameFileWriter.frameFile(base, index)));
        }

        SequenceProcessingEngine engine = new SequenceProcessingEngine(options,
                JvmMemoryEstimator.fromConfig(engineConfig.getConfig("memory")),
                new DiskSpaceChecker(),
                new ConsoleProgressListener(out, EngineOptions.progressInterval(engineConfig)));

        Thread shutdownHook = new Thread(() -> engine.requestAbort("shutdown requested"), "astroseq-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        RunResult result;
        try {
            result = engine.run(new ProcessingRequest(sequence, filter, transform, outputs));
        } finally {
            removeShutdownHook(shutdownHook);
        }

        printSummary(out, result);
        return switch (result.outcome()) {
            case SUCCEEDED -> 0;
            case PARTIAL -> EXIT_PARTIAL;
            default -> 1;
        };
    }

    private ITransform createTransform(FileSequence sequence) {
        return switch (transformName) {
            case COPY -> new IdentityTransform();
            case SPLIT -> new ChannelSplitTransform(channels != null
                    ? channels
                    : sequence.getFrameGeometry().map(FrameGeometry::channels).orElse(3));
        };
    }

    private IContainerWriter createWriter(Config outputConfig) {
        FormatName chosen = format != null
                ? format
                : FormatName.valueOf(outputConfig.getString("format").toUpperCase());
        boolean mandatory = countMandatory != null ? countMandatory : outputConfig.getBoolean("count-mandatory");
        return chosen == FormatName.FILES ? new FrameFileWriter() : new FrameStackWriter(mandatory);
    }

    private static void printSummary(PrintWriter out, RunResult result) {
        var counters = result.counters();
        out.printf("%nResult: %s%n", result.outcome());
        out.printf("  Converted: %d%n", counters.converted());
        out.printf("  Failed:    %d%n", counters.failed());
        out.printf("  Excluded:  %d of %d%n", counters.excluded(), counters.totalInput());
        if (result.abortReason() != null) {
            out.printf("  Reason:    %s%n", result.abortReason());
        }
        for (WriterResult output : result.outputs()) {
            out.printf("  Output %s: %s, %d frame(s) -> %s%n",
                    output.name(), output.status(), output.framesWritten(), output.path());
        }
        out.flush();
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ignored) {
            // JVM is already shutting down.
        }
    }
}
