package org.xenon.lax.datapipeline.services;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenon.lax.datapipeline.api.cuts.CutGroup;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.WriteException;
import org.xenon.lax.datapipeline.api.resources.IDatasetLoader;
import org.xenon.lax.datapipeline.api.resources.IDatasetWriter;
import org.xenon.lax.datapipeline.api.run.RunConfig;
import org.xenon.lax.datapipeline.api.run.RunRequest;
import org.xenon.lax.datapipeline.cuts.CutSetRegistry;
import org.xenon.lax.datapipeline.cuts.PruneResult;
import org.xenon.lax.datapipeline.cuts.SimulationPruner;
import org.xenon.lax.datapipeline.run.RunContextResolver;

/**
 * One cut-selection run from raw parameters to the written output.
 * <p>
 * Stages, in order: resolve the run configuration, look up the science run's cut groups,
 * prune them for simulated data, load the minitrees, evaluate the groups, write the result
 * and (optionally) its summary. Every stage failure surfaces as the stage's
 * {@link org.xenon.lax.datapipeline.api.errors.LaxException}; a failed run leaves no output
 * file and no summary behind.
 */
public class CutSelectionJob {

    private static final Logger log = LoggerFactory.getLogger(CutSelectionJob.class);

    public static final String SUMMARY_EXTENSION = ".summary.json";

    private final RunContextResolver resolver;
    private final CutSetRegistry registry;
    private final SimulationPruner pruner;
    private final PipelineExecutor executor;
    private final IDatasetLoader loader;
    private final IDatasetWriter writer;
    private final Path outputDirectory;
    private final boolean writeSummary;

    public CutSelectionJob(RunContextResolver resolver, CutSetRegistry registry, SimulationPruner pruner,
                           PipelineExecutor executor, IDatasetLoader loader, IDatasetWriter writer,
                           Path outputDirectory, boolean writeSummary) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pruner = Objects.requireNonNull(pruner, "pruner");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
        this.writeSummary = writeSummary;
    }

    /**
     * Convenience constructor wiring the default core components.
     */
    public CutSelectionJob(IDatasetLoader loader, IDatasetWriter writer, Path outputDirectory, boolean writeSummary) {
        this(new RunContextResolver(), new CutSetRegistry(), new SimulationPruner(), new PipelineExecutor(),
            loader, writer, outputDirectory, writeSummary);
    }

    /**
     * @param request raw run parameters
     * @return where the output went and what it contains
     */
    public Result run(RunRequest request) {
        RunConfig config = resolver.resolve(request);
        log.info("Processing {} for {}{}", config.runIdentifier(), config.scienceRun(),
            config.simulation() ? " (simulated data)" : "");

        List<CutGroup> registered = registry.resolve(config.scienceRun());
        PruneResult pruned = pruner.prune(registered, config.simulation());
        if (pruned.anyRemoved()) {
            log.info("Removed detector-condition cuts from {} groups for simulated data", pruned.removed().size());
        }

        Dataset input = loader.load(config.runIdentifier(), config.requiredGroups(), config.versionPolicy());
        Dataset result = executor.run(input, pruned.groups());
        log.info("Evaluated {} cut groups on {} events ({} cut columns)",
            pruned.groups().size(), result.rowCount(), result.cutColumnNames().size());

        Path outputFile = config.output().resolve(outputDirectory, writer.fileExtension());
        RunSummary summary = RunSummary.of(config, pruned.groups(), result,
            outputFile.getFileName().toString(), pruned.removed());
        Path summaryFile = writeSummary ? config.output().resolve(outputDirectory, SUMMARY_EXTENSION) : null;

        Path stagedSummary = summaryFile == null ? null : stageSummary(summary, summaryFile);
        try {
            writer.write(result, outputFile, config.output().tableName());
            log.info("Wrote {} (table {})", outputFile, config.output().tableName());
            if (stagedSummary != null) {
                publishSummary(stagedSummary, summaryFile, outputFile);
                stagedSummary = null;
            }
        } finally {
            deleteQuietly(stagedSummary);
        }
        return new Result(config, outputFile, summaryFile, summary);
    }

    /**
     * Writes the summary to a temporary file beside its final location.
     */
    private static Path stageSummary(RunSummary summary, Path file) {
        Path staged = null;
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            staged = Files.createTempFile(file.toAbsolutePath().getParent(), "." + file.getFileName() + "_", ".tmp");
            Files.writeString(staged, summary.toJson(), StandardCharsets.UTF_8);
            return staged;
        } catch (IOException e) {
            deleteQuietly(staged);
            throw new WriteException(file.toString(), "Cannot write run summary: " + e.getMessage(), e);
        }
    }

    /**
     * Moves the staged summary onto its final name, removing the written dataset if that fails.
     */
    private static void publishSummary(Path staged, Path file, Path outputFile) {
        try {
            try {
                Files.move(staged, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(staged, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(outputFile);
            throw new WriteException(file.toString(), "Cannot write run summary: " + e.getMessage(), e);
        }
        log.debug("Wrote run summary {}", file);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", file, e.getMessage());
        }
    }

    /**
     * @param config      the resolved run
     * @param outputFile  the written dataset
     * @param summaryFile the summary sidecar, or null if none was written
     * @param summary     the run summary
     */
    public record Result(RunConfig config, Path outputFile, Path summaryFile, RunSummary summary) {
    }
}
