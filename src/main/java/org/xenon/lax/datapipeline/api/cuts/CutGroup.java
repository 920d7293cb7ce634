package org.xenon.lax.datapipeline.api.cuts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.xenon.lax.datapipeline.api.dataset.Column;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.CutEvaluationException;

/**
 * Named, ordered collection of cuts evaluated as a unit.
 * <p>
 * Evaluation appends every member cut's column(s) in order, followed by the aggregate
 * column {@code Cut<GroupName>} that is true when all members pass.
 * <p>
 * Groups are immutable. Registry definitions are shared across runs, so every
 * transformation ({@link #withoutCuts(Predicate)}, {@link Builder#from(CutGroup)})
 * produces a new group.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CutGroup rn220 = CutGroup.builder("LowEnergyRn220")
 *     .from(allEnergy)
 *     .replace("InteractionExists", S1_LOW_ENERGY_RANGE)
 *     .add(S1_MAX_PMT)
 *     .build();
 * }</pre>
 */
public final class CutGroup {

    private final String name;
    private final List<Cut> cuts;

    private CutGroup(String name, List<Cut> cuts) {
        this.name = Objects.requireNonNull(name, "name");
        this.cuts = List.copyOf(cuts);
        Set<String> seen = new HashSet<>();
        for (Cut cut : this.cuts) {
            if (!seen.add(cut.getName())) {
                throw new IllegalArgumentException("Cut " + cut.getName() + " appears twice in group " + name);
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * @return member cuts in evaluation order (unmodifiable)
     */
    public List<Cut> getCuts() {
        return cuts;
    }

    /**
     * @return names of the member cuts in order
     */
    public List<String> cutNames() {
        return cuts.stream().map(Cut::getName).collect(Collectors.toList());
    }

    /**
     * @return the name of the aggregate column, {@code Cut<GroupName>}
     */
    public String aggregateColumn() {
        return Cut.COLUMN_PREFIX + name;
    }

    /**
     * @return union of the member cuts' required fields, in first-use order
     */
    public Set<String> requiredFields() {
        Set<String> fields = new LinkedHashSet<>();
        for (Cut cut : cuts) {
            fields.addAll(cut.requiredFields());
        }
        return Collections.unmodifiableSet(fields);
    }

    /**
     * @return every column this group appends, in order, ending with the aggregate
     */
    public List<String> outputColumns() {
        List<String> columns = new ArrayList<>();
        for (Cut cut : cuts) {
            for (String column : cut.outputColumns()) {
                if (!columns.contains(column)) {
                    columns.add(column);
                }
            }
        }
        columns.add(aggregateColumn());
        return columns;
    }

    /**
     * @return identity of this group's aggregate column: name plus member definitions
     */
    public String definitionKey() {
        return "group:" + name
            + cuts.stream().map(Cut::definitionKey).collect(Collectors.joining(",", "[", "]"));
    }

    /**
     * Evaluates all member cuts and the aggregate.
     * <p>
     * Required fields of all members are checked before anything is computed, so a
     * group either appends all its columns or none.
     *
     * @param dataset the input dataset
     * @return the input plus this group's columns
     * @throws CutEvaluationException naming the first member cut with missing fields,
     *                                or any failure of a member cut
     */
    public Dataset evaluate(Dataset dataset) {
        for (Cut cut : cuts) {
            Set<String> missing = dataset.missingFields(cut.requiredFields());
            if (!missing.isEmpty()) {
                throw new CutEvaluationException(cut.columnName(),
                    "Missing required fields " + missing + " (cut group " + name + ")");
            }
        }
        Dataset result = dataset;
        for (Cut cut : cuts) {
            result = cut.evaluate(result);
        }
        return result.withCutColumn(aggregateColumn(), allPassed(result, cuts), definitionKey());
    }

    /**
     * Returns a copy of this group without the cuts matching {@code exclude}.
     * Surviving cuts keep their relative order; the group keeps its name.
     *
     * @param exclude selects the cuts to drop
     * @return a new group, or this group if nothing matched
     */
    public CutGroup withoutCuts(Predicate<Cut> exclude) {
        List<Cut> kept = cuts.stream().filter(exclude.negate()).collect(Collectors.toList());
        return kept.size() == cuts.size() ? this : new CutGroup(name, kept);
    }

    /**
     * ANDs the result columns of {@code cuts}, which must already be present.
     */
    static boolean[] allPassed(Dataset dataset, List<Cut> cuts) {
        boolean[] passed = new boolean[dataset.rowCount()];
        Arrays.fill(passed, true);
        for (Cut cut : cuts) {
            Column column = dataset.column(cut.columnName());
            for (int row = 0; row < passed.length; row++) {
                passed[row] &= column.getBoolean(row);
            }
        }
        return passed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CutGroup)) {
            return false;
        }
        CutGroup other = (CutGroup) o;
        return name.equals(other.name) && cuts.equals(other.cuts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, cuts);
    }

    @Override
    public String toString() {
        return "CutGroup[" + name + ", " + cutNames() + "]";
    }

    /**
     * Builder for cut groups; supports deriving one group from another.
     */
    public static final class Builder {

        private final String name;
        private final List<Cut> cuts = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Starts from the cuts of {@code base}.
         */
        public Builder from(CutGroup base) {
            cuts.addAll(base.getCuts());
            return this;
        }

        public Builder add(Cut... more) {
            Collections.addAll(cuts, more);
            return this;
        }

        /**
         * Replaces the cut named {@code cutName} in place.
         *
         * @throws IllegalArgumentException if no such cut is present
         */
        public Builder replace(String cutName, Cut replacement) {
            for (int i = 0; i < cuts.size(); i++) {
                if (cuts.get(i).getName().equals(cutName)) {
                    cuts.set(i, replacement);
                    return this;
                }
            }
            throw new IllegalArgumentException("No cut " + cutName + " to replace in group " + name);
        }

        public Builder remove(Predicate<Cut> filter) {
            cuts.removeIf(filter);
            return this;
        }

        public CutGroup build() {
            return new CutGroup(name, cuts);
        }
    }
}
