package org.xenon.lax.datapipeline.cuts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.xenon.lax.datapipeline.api.cuts.CutGroup;

/**
 * Outcome of {@link SimulationPruner#prune(List, boolean)}.
 *
 * @param groups  the groups to evaluate, in the original order
 * @param removed group name to the names of the cuts taken out of it; only groups that
 *                lost cuts appear
 */
public record PruneResult(List<CutGroup> groups, Map<String, List<String>> removed) {

    public PruneResult {
        groups = List.copyOf(groups);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        removed.forEach((group, cuts) -> copy.put(group, List.copyOf(cuts)));
        removed = Collections.unmodifiableMap(copy);
    }

    static PruneResult unchanged(List<CutGroup> groups) {
        return new PruneResult(groups, Map.of());
    }

    public boolean anyRemoved() {
        return !removed.isEmpty();
    }
}
