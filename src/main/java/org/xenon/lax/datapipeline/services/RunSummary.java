package org.xenon.lax.datapipeline.services;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.xenon.lax.datapipeline.api.cuts.CutGroup;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.run.RunConfig;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Sidecar describing a finished run: what was evaluated and how many events passed.
 * Serialized with Gson next to the output file.
 */
public final class RunSummary {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .create();

    private final String run;
    private final int scienceRun;
    private final boolean simulation;
    private final String dataVersion;
    private final String output;
    private final String table;
    private final int events;
    private final List<String> groups;
    private final Map<String, Integer> passCounts;
    private final Map<String, List<String>> prunedCuts;

    private RunSummary(String run, int scienceRun, boolean simulation, String dataVersion, String output,
                       String table, int events, List<String> groups, Map<String, Integer> passCounts,
                       Map<String, List<String>> prunedCuts) {
        this.run = run;
        this.scienceRun = scienceRun;
        this.simulation = simulation;
        this.dataVersion = dataVersion;
        this.output = output;
        this.table = table;
        this.events = events;
        this.groups = groups;
        this.passCounts = passCounts;
        this.prunedCuts = prunedCuts;
    }

    /**
     * @param config     the resolved run
     * @param groups     the groups that were evaluated
     * @param result     the final dataset
     * @param outputFile file name of the written dataset
     * @param prunedCuts cuts removed for simulated data, per group
     * @return the summary
     */
    public static RunSummary of(RunConfig config, List<CutGroup> groups, Dataset result,
                                String outputFile, Map<String, List<String>> prunedCuts) {
        Map<String, Integer> passCounts = new LinkedHashMap<>();
        for (String column : result.cutColumnNames()) {
            passCounts.put(column, result.column(column).countTrue());
        }
        return new RunSummary(
            config.runIdentifier().asString(),
            config.scienceRun().getNumber(),
            config.simulation(),
            config.versionPolicy().describe(),
            outputFile,
            config.output().tableName(),
            result.rowCount(),
            groups.stream().map(CutGroup::getName).collect(Collectors.toList()),
            passCounts,
            prunedCuts);
    }

    public String getRun() {
        return run;
    }

    public String getTable() {
        return table;
    }

    public boolean isSimulation() {
        return simulation;
    }

    public List<String> getGroups() {
        return groups;
    }

    public int getEvents() {
        return events;
    }

    public Map<String, Integer> getPassCounts() {
        return passCounts;
    }

    public Map<String, List<String>> getPrunedCuts() {
        return prunedCuts;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public static RunSummary fromJson(String json) {
        return GSON.fromJson(json, RunSummary.class);
    }
}
