package org.xenon.lax.datapipeline.services;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenon.lax.datapipeline.api.cuts.CutGroup;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.CutEvaluationException;

/**
 * Applies cut groups to a dataset, strictly in order.
 * <p>
 * Each group appends one boolean column per member cut (sub-cuts of composite cuts first)
 * and its aggregate column. Rows are never added or dropped and existing columns keep
 * their position. Evaluation is fail-fast: the first failing group ends the run.
 */
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    /**
     * @param dataset the loaded dataset
     * @param groups  cut groups in evaluation order
     * @return the dataset with all cut columns appended
     * @throws IllegalArgumentException if two groups share a name
     * @throws CutEvaluationException   if a cut cannot be evaluated or a column collides
     */
    public Dataset run(Dataset dataset, List<CutGroup> groups) {
        Set<String> names = new HashSet<>();
        for (CutGroup group : groups) {
            if (!names.add(group.getName())) {
                throw new IllegalArgumentException("Duplicate cut group name: " + group.getName());
            }
        }

        Dataset current = dataset;
        for (CutGroup group : groups) {
            Dataset next = group.evaluate(current);
            verifyAppendOnly(current, next, group);
            log.debug("Cut group {}: {} of {} events pass ({} cuts)",
                group.getName(), next.column(group.aggregateColumn()).countTrue(),
                next.rowCount(), group.getCuts().size());
            current = next;
        }
        return current;
    }

    private static void verifyAppendOnly(Dataset before, Dataset after, CutGroup group) {
        if (after.rowCount() != before.rowCount()) {
            throw new IllegalStateException("Cut group " + group.getName() + " changed the row count from "
                + before.rowCount() + " to " + after.rowCount());
        }
        List<String> beforeNames = before.columnNames();
        if (!after.columnNames().subList(0, Math.min(beforeNames.size(), after.columnCount())).equals(beforeNames)) {
            throw new IllegalStateException("Cut group " + group.getName() + " removed or reordered columns");
        }
    }
}
