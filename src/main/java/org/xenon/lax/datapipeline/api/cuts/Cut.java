package org.xenon.lax.datapipeline.api.cuts;

import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.CutEvaluationException;

/**
 * A named boolean selection over dataset fields.
 * <p>
 * Evaluating a cut appends its result column, named {@code Cut<Name>}, to the dataset
 * (composite cuts append their sub-cut columns first). Cut instances are immutable and
 * may be shared between cut groups and science runs.
 * <p>
 * Two cuts with the same {@link #definitionKey()} are the same definition; the dataset
 * uses the key to reuse an already computed column instead of treating it as a collision.
 */
public abstract class Cut {

    /** Prefix of every cut-result column. */
    public static final String COLUMN_PREFIX = "Cut";

    private final String name;
    private final CutCategory category;
    private final int version;

    protected Cut(String name, CutCategory category, int version) {
        this.name = Objects.requireNonNull(name, "name");
        this.category = Objects.requireNonNull(category, "category");
        this.version = version;
    }

    /**
     * Creates a cut from a per-event rule.
     *
     * @param name           cut name without the column prefix (e.g. "S2Threshold")
     * @param category       applicability category
     * @param version        definition version
     * @param requiredFields every field the rule reads
     * @param predicate      the rule
     * @return the cut
     */
    public static Cut of(String name, CutCategory category, int version,
                         List<String> requiredFields, EventPredicate predicate) {
        return new PredicateCut(name, category, version, requiredFields, predicate);
    }

    /**
     * Creates a cut that passes when {@code field} lies strictly inside {@code (min, max)}.
     *
     * @param name     cut name without the column prefix
     * @param category applicability category
     * @param version  definition version
     * @param field    the field to bound
     * @param min      exclusive lower bound
     * @param max      exclusive upper bound
     * @return the cut
     */
    public static Cut range(String name, CutCategory category, int version,
                            String field, double min, double max) {
        return new PredicateCut(name, category, version, List.of(field),
            event -> {
                double value = event.get(field);
                return value > min && value < max;
            });
    }

    /**
     * Creates a cut that passes when all of {@code parts} pass. Each part also gets
     * its own result column.
     *
     * @param name     cut name without the column prefix
     * @param category applicability category of the whole composite
     * @param version  definition version
     * @param parts    sub-cuts, evaluated in order
     * @return the cut
     */
    public static Cut allOf(String name, CutCategory category, int version, List<Cut> parts) {
        return new CompositeCut(name, category, version, parts);
    }

    public String getName() {
        return name;
    }

    public CutCategory getCategory() {
        return category;
    }

    public int getVersion() {
        return version;
    }

    /**
     * @return the name of the result column, {@code Cut<Name>}
     */
    public String columnName() {
        return COLUMN_PREFIX + name;
    }

    /**
     * @return sub-cuts in evaluation order; empty unless this is a composite cut
     */
    public List<Cut> getParts() {
        return List.of();
    }

    /**
     * @return every dataset field this cut reads, in declaration order
     */
    public abstract Set<String> requiredFields();

    /**
     * @return every column this cut appends, in the order they are appended
     */
    public abstract List<String> outputColumns();

    /**
     * @return an identity for this definition, equal for equal name, version, category
     *         and (for composites) parts
     */
    public abstract String definitionKey();

    /**
     * Evaluates this cut and appends its result column(s).
     *
     * @param dataset the input dataset
     * @return a dataset equal to the input plus this cut's columns
     * @throws CutEvaluationException if a required field is missing or the rule fails
     */
    public abstract Dataset evaluate(Dataset dataset);

    /**
     * @return whether {@code other} is the same definition as this cut
     */
    public boolean sameDefinitionAs(Cut other) {
        return other != null && definitionKey().equals(other.definitionKey());
    }

    @Override
    public String toString() {
        return columnName() + " (" + category + ", v" + version + ")";
    }
}
