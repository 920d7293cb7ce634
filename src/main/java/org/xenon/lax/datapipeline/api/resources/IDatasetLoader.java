package org.xenon.lax.datapipeline.api.resources;

import java.util.List;

import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.LoadException;
import org.xenon.lax.datapipeline.api.run.DataVersionPolicy;
import org.xenon.lax.datapipeline.api.run.MinitreeGroup;
import org.xenon.lax.datapipeline.api.run.RunIdentifier;

/**
 * Source of per-event minitree data.
 */
public interface IDatasetLoader {

    /**
     * Loads the requested minitree groups of one run into a single dataset, one row per event.
     *
     * @param run           effective run identifier
     * @param groups        minitree groups to load; the first one defines event order
     * @param versionPolicy which data versions are acceptable
     * @return the loaded dataset
     * @throws LoadException if a group is missing, has an unacceptable version, or does not
     *                       line up with the other groups
     */
    Dataset load(RunIdentifier run, List<MinitreeGroup> groups, DataVersionPolicy versionPolicy);
}
