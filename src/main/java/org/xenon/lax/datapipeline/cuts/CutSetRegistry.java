package org.xenon.lax.datapipeline.cuts;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.xenon.lax.datapipeline.api.cuts.CutGroup;
import org.xenon.lax.datapipeline.api.errors.ConfigurationException;
import org.xenon.lax.datapipeline.api.run.ScienceRun;

/**
 * Closed lookup from a science run to the ordered cut groups applied to its data.
 * <p>
 * Later science runs only ever append groups: SR1 evaluates the SR0 groups in the same
 * order and adds the neutron-generator calibration selection.
 * <p>
 * <strong>Thread Safety:</strong> immutable after construction.
 */
public class CutSetRegistry {

    private final Map<ScienceRun, List<CutGroup>> groupsByRun = new EnumMap<>(ScienceRun.class);

    public CutSetRegistry() {
        register(ScienceRun.SR0, List.of(
            QualityCuts.allEnergy(),
            QualityCuts.lowEnergyRn220(),
            QualityCuts.lowEnergyAmBe(),
            QualityCuts.lowEnergyBackground()));
        register(ScienceRun.SR1, List.of(
            QualityCuts.allEnergy(),
            QualityCuts.lowEnergyRn220(),
            QualityCuts.lowEnergyAmBe(),
            QualityCuts.lowEnergyBackground(),
            QualityCuts.lowEnergyNG()));
    }

    private void register(ScienceRun run, List<CutGroup> groups) {
        Set<String> names = new HashSet<>();
        for (CutGroup group : groups) {
            if (!names.add(group.getName())) {
                throw new IllegalStateException("Duplicate cut group " + group.getName() + " for " + run);
            }
        }
        groupsByRun.put(run, List.copyOf(groups));
    }

    /**
     * @param run the science run
     * @return its cut groups in evaluation order (unmodifiable)
     */
    public List<CutGroup> resolve(ScienceRun run) {
        List<CutGroup> groups = groupsByRun.get(run);
        if (groups == null) {
            throw new ConfigurationException(run.name(), "No cut groups registered for " + run);
        }
        return groups;
    }

    /**
     * @param scienceRun the science-run number
     * @return its cut groups in evaluation order (unmodifiable)
     * @throws ConfigurationException if the number is not a supported science run
     */
    public List<CutGroup> resolve(int scienceRun) {
        ScienceRun run = ScienceRun.fromNumber(scienceRun)
            .orElseThrow(() -> new ConfigurationException("SR" + scienceRun,
                "Unsupported science run " + scienceRun + ", supported: " + supportedRuns()));
        return resolve(run);
    }

    /**
     * @return the science runs this registry knows, in ascending order
     */
    public Set<ScienceRun> supportedRuns() {
        return Collections.unmodifiableSet(groupsByRun.keySet());
    }
}
