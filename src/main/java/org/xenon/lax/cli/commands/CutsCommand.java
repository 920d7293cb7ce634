package org.xenon.lax.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.xenon.lax.datapipeline.api.cuts.Cut;
import org.xenon.lax.datapipeline.api.cuts.CutGroup;
import org.xenon.lax.datapipeline.api.errors.LaxException;
import org.xenon.lax.datapipeline.cuts.CutSetRegistry;
import org.xenon.lax.datapipeline.cuts.PruneResult;
import org.xenon.lax.datapipeline.cuts.SimulationPruner;

import com.google.gson.GsonBuilder;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Lists the cut groups evaluated for a science run.
 */
@Command(
    name = "cuts",
    description = "List the cut groups of a science run, optionally as applied to simulated data"
)
public class CutsCommand implements Callable<Integer> {

    @Option(
        names = {"-s", "--science-run"},
        required = true,
        description = "Science run (0 or 1)"
    )
    private int scienceRun;

    @Option(
        names = {"--mc"},
        description = "Show the groups after removing cuts that do not apply to simulated data"
    )
    private boolean simulation;

    @Option(
        names = {"--json"},
        description = "Print JSON instead of text"
    )
    private boolean json;

    @Spec
    private CommandSpec spec;

    private final CutSetRegistry registry = new CutSetRegistry();
    private final SimulationPruner pruner = new SimulationPruner();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        PruneResult result;
        try {
            result = pruner.prune(registry.resolve(scienceRun), simulation);
        } catch (LaxException e) {
            err.println("Error: " + e.describe());
            return e.getStage().getExitCode();
        }

        if (json) {
            out.println(new GsonBuilder().setPrettyPrinting().create().toJson(toListing(result)));
        } else {
            printText(out, result);
        }
        out.flush();
        return 0;
    }

    private void printText(PrintWriter out, PruneResult result) {
        out.printf("Science run SR%d%s%n", scienceRun, simulation ? " (simulated data)" : "");
        for (CutGroup group : result.groups()) {
            out.printf("%n%s (%d cuts, column %s)%n", group.getName(), group.getCuts().size(), group.aggregateColumn());
            for (Cut cut : group.getCuts()) {
                printCut(out, cut, "  ");
            }
            List<String> removed = result.removed().get(group.getName());
            if (removed != null) {
                out.printf("  removed for simulated data: %s%n", String.join(", ", removed));
            }
        }
    }

    private static void printCut(PrintWriter out, Cut cut, String indent) {
        out.printf("%s%-32s %-12s v%d%n", indent, cut.getName(), cut.getCategory(), cut.getVersion());
        for (Cut part : cut.getParts()) {
            printCut(out, part, indent + "  ");
        }
    }

    private static List<GroupListing> toListing(PruneResult result) {
        List<GroupListing> groups = new ArrayList<>();
        for (CutGroup group : result.groups()) {
            List<CutListing> cuts = new ArrayList<>();
            for (Cut cut : group.getCuts()) {
                cuts.add(CutListing.of(cut));
            }
            groups.add(new GroupListing(group.getName(), group.aggregateColumn(), cuts,
                result.removed().getOrDefault(group.getName(), List.of())));
        }
        return groups;
    }

    private static final class GroupListing {
        final String name;
        final String column;
        final List<CutListing> cuts;
        final List<String> removed;

        GroupListing(String name, String column, List<CutListing> cuts, List<String> removed) {
            this.name = name;
            this.column = column;
            this.cuts = cuts;
            this.removed = removed;
        }
    }

    private static final class CutListing {
        final String name;
        final String column;
        final String category;
        final int version;
        final List<CutListing> parts;

        private CutListing(String name, String column, String category, int version, List<CutListing> parts) {
            this.name = name;
            this.column = column;
            this.category = category;
            this.version = version;
            this.parts = parts;
        }

        static CutListing of(Cut cut) {
            List<CutListing> parts = new ArrayList<>();
            for (Cut part : cut.getParts()) {
                parts.add(of(part));
            }
            return new CutListing(cut.getName(), cut.columnName(), cut.getCategory().name(), cut.getVersion(), parts);
        }
    }
}
