package org.xenon.lax.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenon.lax.cli.CommandLineInterface;
import org.xenon.lax.cli.config.LoggingConfigurator;
import org.xenon.lax.datapipeline.api.errors.ConfigurationException;
import org.xenon.lax.datapipeline.api.errors.LaxException;
import org.xenon.lax.datapipeline.api.run.RunRequest;
import org.xenon.lax.datapipeline.resources.minitree.ParquetMinitreeLoader;
import org.xenon.lax.datapipeline.resources.output.ParquetDatasetWriter;
import org.xenon.lax.datapipeline.services.CutSelectionJob;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the cut selection for one run (or one simulated minitree set) and writes the
 * augmented dataset.
 * <p>
 * Exit codes follow the failing stage: 2 configuration, 3 load, 4 evaluation, 5 write,
 * 1 for anything unexpected.
 */
@Command(
    name = "process",
    description = "Evaluate the science-run cut groups on a run's minitrees and write the cut results"
)
public class ProcessCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommand.class);

    static final int EXIT_UNEXPECTED = 1;

    @Option(
        names = {"-r", "--run-number"},
        required = true,
        description = "Run number, or " + RunRequest.SIMULATION_RUN + " for simulated data (requires --filename)"
    )
    private int runNumber;

    @Option(
        names = {"-s", "--science-run"},
        required = true,
        description = "Science run (0 or 1)"
    )
    private int scienceRun;

    @Option(
        names = {"-p", "--pax-version"},
        required = true,
        description = "Processor version the minitrees must have been produced with (ignored for simulated data)"
    )
    private String paxVersion;

    @Option(
        names = {"-m", "--minitree-path"},
        required = true,
        description = "Directory holding the minitree files"
    )
    private Path minitreePath;

    @Option(
        names = {"-f", "--filename"},
        description = "Minitree file stem of simulated data"
    )
    private String filename;

    @Option(
        names = {"-o", "--output"},
        description = "Output base name (default: <run>_lax)"
    )
    private String output;

    @Option(
        names = {"-d", "--output-dir"},
        description = "Output directory (default: lax.output.directory)"
    )
    private Path outputDirectory;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log cut-group and pruning details"
    )
    private boolean verbose;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            if (verbose) {
                LoggingConfigurator.enableVerbose();
            }

            CutSelectionJob job = createJob(config);
            CutSelectionJob.Result result = job.run(
                new RunRequest(runNumber, scienceRun, paxVersion, filename, output));

            out.printf("Wrote %d events to %s (table %s)%n",
                result.summary().getEvents(), result.outputFile(), result.config().output().tableName());
            if (result.summaryFile() != null) {
                out.printf("Summary: %s%n", result.summaryFile());
            }
            out.flush();
            return 0;
        } catch (LaxException e) {
            log.error(e.describe());
            err.println("Error: " + e.describe());
            return e.getStage().getExitCode();
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            err.println("Error: " + e.getMessage());
            return EXIT_UNEXPECTED;
        }
    }

    private CutSelectionJob createJob(Config config) {
        Path outputDir = outputDirectory != null
            ? outputDirectory
            : Path.of(config.getString("lax.output.directory"));
        boolean writeSummary = config.getBoolean("lax.output.write-summary");

        try {
            ParquetMinitreeLoader loader = ParquetMinitreeLoader.fromConfig(minitreePath, config);
            ParquetDatasetWriter writer = ParquetDatasetWriter.fromConfig(config);
            return new CutSelectionJob(loader, writer, outputDir, writeSummary);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("lax", e.getMessage());
        }
    }
}
