package org.xenon.lax.datapipeline.api.cuts;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.xenon.lax.datapipeline.api.dataset.Column;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.dataset.Event;
import org.xenon.lax.datapipeline.api.errors.CutEvaluationException;

/**
 * Cut defined by a single {@link EventPredicate} over declared fields.
 */
final class PredicateCut extends Cut {

    private final Set<String> requiredFields;
    private final EventPredicate predicate;

    PredicateCut(String name, CutCategory category, int version,
                 List<String> requiredFields, EventPredicate predicate) {
        super(name, category, version);
        if (requiredFields.isEmpty()) {
            throw new IllegalArgumentException("Cut " + name + " must declare at least one field");
        }
        this.requiredFields = Collections.unmodifiableSet(new LinkedHashSet<>(requiredFields));
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public Set<String> requiredFields() {
        return requiredFields;
    }

    @Override
    public List<String> outputColumns() {
        return List.of(columnName());
    }

    @Override
    public String definitionKey() {
        return columnName() + "@v" + getVersion() + ":" + getCategory();
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

        Map<String, Column> readable = new HashMap<>();
        for (String field : requiredFields) {
            readable.put(field, dataset.column(field));
        }
        Event event = new Event(readable);
        boolean[] passed = new boolean[dataset.rowCount()];
        for (int row = 0; row < passed.length; row++) {
            event.moveTo(row);
            try {
                passed[row] = predicate.test(event);
            } catch (Event.UndeclaredFieldException e) {
                throw new CutEvaluationException(columnName(),
                    "Reads undeclared field '" + e.getField() + "'", e);
            } catch (RuntimeException e) {
                throw new CutEvaluationException(columnName(),
                    "Evaluation failed at row " + row + ": " + e.getMessage(), e);
            }
        }
        return dataset.withCutColumn(columnName(), passed, definitionKey());
    }
}
