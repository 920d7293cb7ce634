package org.xenon.lax.datapipeline.api.cuts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.CutEvaluationException;

/**
 * Cut made of ordered parts; passes when every part passes.
 * <p>
 * Evaluation appends each part's column, then the composite's own column. The
 * composite is pruned and reported as a single unit: its parts share its category.
 */
final class CompositeCut extends Cut {

    private final List<Cut> parts;
    private final Set<String> requiredFields;

    CompositeCut(String name, CutCategory category, int version, List<Cut> parts) {
        super(name, category, version);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Composite cut " + name + " needs at least one part");
        }
        this.parts = List.copyOf(parts);
        Set<String> fields = new LinkedHashSet<>();
        for (Cut part : this.parts) {
            fields.addAll(part.requiredFields());
        }
        this.requiredFields = Collections.unmodifiableSet(fields);
    }

    @Override
    public List<Cut> getParts() {
        return parts;
    }

    @Override
    public Set<String> requiredFields() {
        return requiredFields;
    }

    @Override
    public List<String> outputColumns() {
        List<String> columns = new ArrayList<>();
        for (Cut part : parts) {
            columns.addAll(part.outputColumns());
        }
        columns.add(columnName());
        return columns;
    }

    @Override
    public String definitionKey() {
        return columnName() + "@v" + getVersion() + ":" + getCategory()
            + parts.stream().map(Cut::definitionKey).collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public Dataset evaluate(Dataset dataset) {
        if (dataset.hasResultOf(columnName(), definitionKey())) {
            return dataset;
        }
        Set<String> missing = dataset.missingFields(requiredFields);
        if (!missing.isEmpty()) {
            throw new CutEvaluationException(columnName(), "Missing required fields " + missing);
        }
        Dataset result = dataset;
        for (Cut part : parts) {
            result = part.evaluate(result);
        }
        return result.withCutColumn(columnName(), CutGroup.allPassed(result, parts), definitionKey());
    }
}
