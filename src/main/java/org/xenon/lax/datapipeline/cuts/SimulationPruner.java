package org.xenon.lax.datapipeline.cuts;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenon.lax.datapipeline.api.cuts.Cut;
import org.xenon.lax.datapipeline.api.cuts.CutCategory;
import org.xenon.lax.datapipeline.api.cuts.CutGroup;

/**
 * Removes cuts that depend on detector-monitoring information from the cut groups
 * applied to simulated data.
 * <p>
 * Cuts are matched by category, never by name. Input groups are never modified; group
 * names and the order of surviving cuts are preserved, and pruning twice gives the
 * same result as pruning once.
 */
public class SimulationPruner {

    private static final Logger log = LoggerFactory.getLogger(SimulationPruner.class);

    /** Categories that have no meaning for simulated events. */
    public static final Set<CutCategory> SIMULATION_EXCLUDED =
        EnumSet.of(CutCategory.DAQ_VETO, CutCategory.S2_TAIL, CutCategory.FLASH, CutCategory.MUON_VETO);

    /**
     * @param groups     the groups resolved for the science run
     * @param simulation whether simulated data is processed
     * @return the groups to evaluate plus a report of what was removed
     */
    public PruneResult prune(List<CutGroup> groups, boolean simulation) {
        if (!simulation) {
            return PruneResult.unchanged(groups);
        }

        List<CutGroup> pruned = new ArrayList<>(groups.size());
        Map<String, List<String>> removed = new LinkedHashMap<>();
        for (CutGroup group : groups) {
            List<String> dropped = group.getCuts().stream()
                .filter(SimulationPruner::isExcluded)
                .map(Cut::getName)
                .collect(Collectors.toList());
            if (!dropped.isEmpty()) {
                removed.put(group.getName(), dropped);
                log.debug("Removed {} from cut group {} for simulated data", dropped, group.getName());
            }
            pruned.add(group.withoutCuts(SimulationPruner::isExcluded));
        }
        return new PruneResult(pruned, removed);
    }

    private static boolean isExcluded(Cut cut) {
        return SIMULATION_EXCLUDED.contains(cut.getCategory());
    }
}
