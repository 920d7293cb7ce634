package org.xenon.lax.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.xenon.lax.cli.CommandLineInterface;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import picocli.CommandLine;

/**
 * Tests for the cuts listing command.
 */
@Tag("unit")
class CutsCommandTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmdLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @Test
    void testListsGroupsAndNestedParts() {
        int exitCode = cmdLine.execute("cuts", "-s", "0");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
            .contains("Science run SR0")
            .contains("AllEnergy (13 cuts, column CutAllEnergy)")
            .contains("LowEnergyBackground")
            .contains("EndOfRunCheck")
            .doesNotContain("LowEnergyNG")
            .doesNotContain("removed for simulated data");
    }

    @Test
    void testSimulationShowsRemovedCuts() {
        int exitCode = cmdLine.execute("cuts", "-s", "1", "--mc");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
            .contains("(simulated data)")
            .contains("LowEnergyNG")
            .contains("removed for simulated data: DAQVeto, Flash, S2Tails, MuonVeto");
    }

    @Test
    void testJsonOutput() {
        int exitCode = cmdLine.execute("cuts", "-s", "1", "--mc", "--json");

        assertThat(exitCode).isEqualTo(0);
        JsonArray groups = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertThat(groups).hasSize(5);
        JsonObject allEnergy = groups.get(0).getAsJsonObject();
        assertThat(allEnergy.get("name").getAsString()).isEqualTo("AllEnergy");
        assertThat(allEnergy.getAsJsonArray("cuts")).hasSize(11);
        assertThat(allEnergy.getAsJsonArray("removed")).hasSize(2);
    }

    @Test
    void testUnknownScienceRun() {
        int exitCode = cmdLine.execute("cuts", "-s", "9");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("SR9");
    }
}
