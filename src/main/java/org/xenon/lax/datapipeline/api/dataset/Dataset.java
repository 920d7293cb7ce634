package org.xenon.lax.datapipeline.api.dataset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.xenon.lax.datapipeline.api.errors.ColumnCollisionException;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;

/**
 * In-memory columnar table of events.
 * <p>
 * Rows are events, columns are named typed fields. A {@code Dataset} is an immutable
 * value: {@link #withCutColumn(String, boolean[], String)} returns a new instance that
 * shares all existing column arrays and appends one column at the end. Columns are
 * therefore never removed, renamed or reordered once present.
 * <p>
 * Every cut-result column records the definition key of the cut that produced it.
 * Raw fields (loaded from minitrees) carry no key. This is what lets the pipeline tell
 * a harmless re-evaluation of the same cut from a genuine name collision.
 */
public final class Dataset {

    private final int rowCount;
    private final List<Column> columns;
    private final Object2IntLinkedOpenHashMap<String> indexByName;
    private final Map<String, String> producers;

    private Dataset(int rowCount, List<Column> columns, Map<String, String> producers) {
        this.rowCount = rowCount;
        this.columns = Collections.unmodifiableList(columns);
        this.indexByName = new Object2IntLinkedOpenHashMap<>(columns.size());
        this.indexByName.defaultReturnValue(-1);
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (column.size() != rowCount) {
                throw new IllegalArgumentException(String.format(
                    "Column '%s' has %d rows, expected %d", column.getName(), column.size(), rowCount));
            }
            if (indexByName.putIfAbsent(column.getName(), i) != -1) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
        }
        this.producers = Collections.unmodifiableMap(producers);
    }

    /**
     * Creates a dataset of raw fields.
     *
     * @param rowCount number of events
     * @param columns  columns, each with exactly {@code rowCount} values and a unique name
     * @return the dataset
     * @throws IllegalArgumentException on duplicate names or mismatched lengths
     */
    public static Dataset of(int rowCount, List<Column> columns) {
        return new Dataset(rowCount, new ArrayList<>(columns), new HashMap<>());
    }

    /**
     * @return an empty dataset with the given number of rows and no columns
     */
    public static Dataset empty(int rowCount) {
        return of(rowCount, List.of());
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    /**
     * @return columns in insertion order
     */
    public List<Column> columns() {
        return columns;
    }

    /**
     * @return column names in insertion order
     */
    public List<String> columnNames() {
        return new ArrayList<>(indexByName.keySet());
    }

    public boolean hasColumn(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * @param name column name
     * @return the column, if present
     */
    public Optional<Column> findColumn(String name) {
        int index = indexByName.getInt(name);
        return index < 0 ? Optional.empty() : Optional.of(columns.get(index));
    }

    /**
     * @param name column name
     * @return the column
     * @throws IllegalArgumentException if the column does not exist
     */
    public Column column(String name) {
        return findColumn(name)
            .orElseThrow(() -> new IllegalArgumentException("No such column: " + name));
    }

    /**
     * Returns the fields from {@code required} that this dataset lacks, in iteration order.
     *
     * @param required field names to check
     * @return missing names, empty if all are present
     */
    public Set<String> missingFields(Collection<String> required) {
        Set<String> missing = new LinkedHashSet<>();
        for (String field : required) {
            if (!hasColumn(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    /**
     * @param name column name
     * @return the definition key of the cut that produced the column, empty for raw fields
     *         and absent columns
     */
    public Optional<String> producerOf(String name) {
        return Optional.ofNullable(producers.get(name));
    }

    /**
     * @return names of all columns produced by cuts, in insertion order
     */
    public List<String> cutColumnNames() {
        List<String> names = new ArrayList<>();
        for (String name : indexByName.keySet()) {
            if (producers.containsKey(name)) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * Checks whether {@code name} already holds the result of the definition identified
     * by {@code definitionKey}.
     *
     * @param name          column name
     * @param definitionKey definition key of the producing cut
     * @return true if the column exists and was produced by that exact definition
     * @throws ColumnCollisionException if the column exists but belongs to a raw field or
     *                                  to a different definition
     */
    public boolean hasResultOf(String name, String definitionKey) {
        if (!hasColumn(name)) {
            return false;
        }
        String existing = producers.get(name);
        if (definitionKey.equals(existing)) {
            return true;
        }
        throw new ColumnCollisionException(name, existing == null
            ? "Column '" + name + "' is a raw field and cannot be overwritten by " + definitionKey
            : "Column '" + name + "' was produced by " + existing + ", cannot overwrite with " + definitionKey);
    }

    /**
     * Appends a cut-result column.
     * <p>
     * If a column of that name was already produced by the same definition, the existing
     * column is kept and this dataset is returned unchanged.
     *
     * @param name          column name
     * @param values        one value per row; ownership passes to the dataset
     * @param definitionKey definition key of the producing cut
     * @return a dataset with the column appended
     * @throws ColumnCollisionException if the name is taken by a raw field or another definition
     * @throws IllegalArgumentException if {@code values} does not have {@link #rowCount()} entries
     */
    public Dataset withCutColumn(String name, boolean[] values, String definitionKey) {
        if (hasResultOf(name, definitionKey)) {
            return this;
        }
        List<Column> extended = new ArrayList<>(columns.size() + 1);
        extended.addAll(columns);
        extended.add(Column.ofBooleans(name, values));
        Map<String, String> extendedProducers = new HashMap<>(producers);
        extendedProducers.put(name, definitionKey);
        return new Dataset(rowCount, extended, extendedProducers);
    }

    @Override
    public String toString() {
        return "Dataset[rows=" + rowCount + ", columns=" + columnNames() + "]";
    }
}
