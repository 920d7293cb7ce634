package org.xenon.lax.test.utils;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.xenon.lax.datapipeline.api.cuts.Cut;
import org.xenon.lax.datapipeline.api.cuts.CutGroup;
import org.xenon.lax.datapipeline.api.dataset.Column;
import org.xenon.lax.datapipeline.api.dataset.Dataset;

/**
 * Builders for datasets and on-disk minitree files used across tests.
 */
public final class DatasetFixtures {

    private DatasetFixtures() {
    }

    /**
     * One-row dataset with the given DOUBLE fields.
     */
    public static Dataset singleEvent(Map<String, Double> fields) {
        List<Column> columns = new ArrayList<>();
        fields.forEach((name, value) -> columns.add(Column.ofDoubles(name, new double[] {value})));
        return Dataset.of(1, columns);
    }

    /**
     * Evaluates {@code cut} on a single event and returns its verdict.
     */
    public static boolean passes(Cut cut, Map<String, Double> fields) {
        return cut.evaluate(singleEvent(fields)).column(cut.columnName()).getBoolean(0);
    }

    /**
     * Dataset with one DOUBLE column per field, filled with seeded pseudo-random values in [-100, 100).
     */
    public static Dataset randomDataset(int rows, Collection<String> fields, long seed) {
        Random random = new Random(seed);
        List<Column> columns = new ArrayList<>();
        for (String field : fields) {
            double[] values = new double[rows];
            for (int row = 0; row < rows; row++) {
                values[row] = random.nextDouble() * 200 - 100;
            }
            columns.add(Column.ofDoubles(field, values));
        }
        return Dataset.of(rows, columns);
    }

    /**
     * @return every field read by any cut of {@code groups}, in first-use order
     */
    public static Set<String> requiredFields(List<CutGroup> groups) {
        Set<String> fields = new LinkedHashSet<>();
        for (CutGroup group : groups) {
            fields.addAll(group.requiredFields());
        }
        return fields;
    }

    /**
     * Dataset carrying every field {@code groups} need, random values, event numbers 0..rows-1.
     */
    public static Dataset datasetFor(List<CutGroup> groups, int rows, long seed) {
        Set<String> fields = requiredFields(groups);
        fields.remove("event_number");
        Dataset random = randomDataset(rows, fields, seed);
        long[] eventNumbers = new long[rows];
        for (int row = 0; row < rows; row++) {
            eventNumbers[row] = row;
        }
        List<Column> columns = new ArrayList<>();
        columns.add(Column.ofLongs("event_number", eventNumbers));
        columns.addAll(random.columns());
        return Dataset.of(rows, columns);
    }

    /**
     * Writes a minitree Parquet file through DuckDB.
     *
     * @param file         target file
     * @param paxVersion   value of the {@code pax_version} column for all rows
     * @param eventNumbers event numbers, in file order
     * @param fields       DOUBLE columns (NaN values are written as NULL)
     */
    public static void writeMinitree(Path file, String paxVersion, long[] eventNumbers,
                                     Map<String, double[]> fields) throws SQLException {
        Map<String, double[]> ordered = new LinkedHashMap<>(fields);
        StringBuilder create = new StringBuilder("CREATE TABLE minitree (event_number BIGINT, pax_version VARCHAR");
        StringBuilder insert = new StringBuilder("INSERT INTO minitree VALUES (?, ?");
        for (String name : ordered.keySet()) {
            create.append(", \"").append(name).append("\" DOUBLE");
            insert.append(", ?");
        }
        create.append(")");
        insert.append(")");

        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
             Statement stmt = conn.createStatement()) {
            stmt.execute(create.toString());
            try (PreparedStatement ps = conn.prepareStatement(insert.toString())) {
                for (int row = 0; row < eventNumbers.length; row++) {
                    ps.setLong(1, eventNumbers[row]);
                    ps.setString(2, paxVersion);
                    int index = 3;
                    for (double[] values : ordered.values()) {
                        if (Double.isNaN(values[row])) {
                            ps.setNull(index++, java.sql.Types.DOUBLE);
                        } else {
                            ps.setDouble(index++, values[row]);
                        }
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            String path = file.toAbsolutePath().toString().replace("\\", "/");
            stmt.execute("COPY minitree TO '" + path + "' (FORMAT PARQUET)");
        }
    }
}
