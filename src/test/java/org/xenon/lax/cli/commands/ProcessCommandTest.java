package org.xenon.lax.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.xenon.lax.cli.CommandLineInterface;
import org.xenon.lax.datapipeline.api.run.MinitreeGroup;
import org.xenon.lax.datapipeline.cuts.CutSetRegistry;
import org.xenon.lax.test.utils.DatasetFixtures;

import picocli.CommandLine;

/**
 * Tests for the process command: argument validation, exit codes and a full run on
 * DuckDB-written minitrees.
 */
@Tag("integration")
class ProcessCommandTest {

    private static final long[] EVENTS = {100, 101, 102, 103};

    @TempDir
    Path tempDir;

    private Path minitrees;
    private Path outputDir;
    private Path configFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        minitrees = Files.createDirectory(tempDir.resolve("minitrees"));
        outputDir = tempDir.resolve("output");
        configFile = tempDir.resolve("lax.conf");
        Files.writeString(configFile, "logging.format = \"PLAIN\"\nlax.output.write-summary = true\n");
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    /**
     * Writes one file per minitree group; every field the science run needs goes into the first.
     */
    private void writeMinitrees(String identifier, String version, Iterable<MinitreeGroup> groups) throws Exception {
        Random random = new Random(11);
        Map<String, double[]> fields = new LinkedHashMap<>();
        for (String field : DatasetFixtures.requiredFields(new CutSetRegistry().resolve(1))) {
            double[] values = new double[EVENTS.length];
            for (int i = 0; i < values.length; i++) {
                values[i] = random.nextDouble() * 1000;
            }
            fields.put(field, values);
        }
        boolean first = true;
        for (MinitreeGroup group : groups) {
            Path file = minitrees.resolve(identifier + "_" + group.getTreeName() + ".parquet");
            DatasetFixtures.writeMinitree(file, version, EVENTS, first ? fields : Map.of());
            first = false;
        }
    }

    @Test
    void testCommandParses() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKey("process");
    }

    @Test
    void testHelpOutput() {
        execute("process", "--help");

        assertThat(out.toString() + err.toString())
            .contains("--run-number", "--science-run", "--pax-version", "--minitree-path", "--filename",
                "--output", "--output-dir", "--verbose");
    }

    @Test
    void testMissingRequiredOption_IsUsageError() {
        int exitCode = execute("process", "-r", "6731", "-s", "0", "-p", "6.8.0");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--minitree-path");
    }

    @Test
    void testUnsupportedScienceRun_ExitsWithConfigurationCode() {
        int exitCode = execute("-c", configFile.toString(), "process",
            "-r", "6731", "-s", "3", "-p", "6.8.0", "-m", minitrees.toString(), "-d", outputDir.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("resolution failed for 'SR3'");
    }

    @Test
    void testSimulationWithoutFilename_ExitsWithConfigurationCode() {
        int exitCode = execute("-c", configFile.toString(), "process",
            "-r", "-1", "-s", "1", "-p", "6.8.0", "-m", minitrees.toString(), "-d", outputDir.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("filename");
    }

    @Test
    void testMissingConfigFile_ExitsWithConfigurationCode() {
        int exitCode = execute("-c", tempDir.resolve("nope.conf").toString(), "process",
            "-r", "6731", "-s", "0", "-p", "6.8.0", "-m", minitrees.toString());

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void testMissingMinitrees_ExitsWithLoadCode() {
        int exitCode = execute("-c", configFile.toString(), "process",
            "-r", "6731", "-s", "0", "-p", "6.8.0", "-m", minitrees.toString(), "-d", outputDir.toString());

        assertThat(exitCode).isEqualTo(3);
        assertThat(err.toString()).contains("load failed for 'Fundamentals'");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testMissingMinitreeDirectory_ExitsWithLoadCode() {
        Path missing = tempDir.resolve("no-minitrees");

        int exitCode = execute("-c", configFile.toString(), "process",
            "-r", "6731", "-s", "0", "-p", "6.8.0", "-m", missing.toString(), "-d", outputDir.toString());

        assertThat(exitCode).isEqualTo(3);
        assertThat(err.toString()).contains("load failed for '" + missing + "'");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void testVersionMismatch_ExitsWithLoadCode() throws Exception {
        writeMinitrees("6731", "6.6.5", MinitreeGroup.requiredFor(false));

        int exitCode = execute("-c", configFile.toString(), "process",
            "-r", "6731", "-s", "0", "-p", "6.8.0", "-m", minitrees.toString(), "-d", outputDir.toString());

        assertThat(exitCode).isEqualTo(3);
    }

    @Test
    void testDetectorRun_WritesOutputAndSummary() throws Exception {
        writeMinitrees("6731", "6.8.0", MinitreeGroup.requiredFor(false));

        int exitCode = execute("-c", configFile.toString(), "process",
            "-r", "6731", "-s", "0", "-p", "6.8.0", "-m", minitrees.toString(), "-d", outputDir.toString());

        assertThat(exitCode).as(err.toString()).isEqualTo(0);
        assertThat(outputDir.resolve("6731_lax_SR0.parquet")).exists();
        assertThat(outputDir.resolve("6731_lax_SR0.summary.json")).exists();
        assertThat(out.toString()).contains("Wrote 4 events").contains("table tree");
    }

    @Test
    void testSimulatedRun_UsesFilenameAndMcTable() throws Exception {
        writeMinitrees("sim001", "anything", MinitreeGroup.requiredFor(true));

        int exitCode = execute("-c", configFile.toString(), "process",
            "-r", "-1", "-s", "1", "-p", "6.8.0", "-f", "sim001", "-m", minitrees.toString(),
            "-d", outputDir.toString(), "-o", "mc_out", "--verbose");

        assertThat(exitCode).as(err.toString()).isEqualTo(0);
        assertThat(outputDir.resolve("mc_out_SR1.parquet")).exists();
        assertThat(out.toString()).contains("table treemc");
    }
}
