package org.xenon.lax.datapipeline.api.run;

import java.util.List;
import java.util.Objects;

/**
 * Validated, immutable configuration of one cut-selection run.
 *
 * @param runIdentifier  effective identifier (run number or simulated file stem)
 * @param scienceRun     the epoch selecting the cut groups
 * @param versionPolicy  which data versions the loader accepts
 * @param simulation     whether simulated data is processed
 * @param requiredGroups minitree groups to load, in loading order
 * @param output         output naming
 */
public record RunConfig(RunIdentifier runIdentifier,
                        ScienceRun scienceRun,
                        DataVersionPolicy versionPolicy,
                        boolean simulation,
                        List<MinitreeGroup> requiredGroups,
                        OutputTarget output) {

    public RunConfig {
        Objects.requireNonNull(runIdentifier, "runIdentifier");
        Objects.requireNonNull(scienceRun, "scienceRun");
        Objects.requireNonNull(versionPolicy, "versionPolicy");
        Objects.requireNonNull(output, "output");
        requiredGroups = List.copyOf(requiredGroups);
    }
}
