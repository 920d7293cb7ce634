package org.xenon.lax.datapipeline.resources.minitree;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenon.lax.datapipeline.api.dataset.Column;
import org.xenon.lax.datapipeline.api.dataset.ColumnType;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.LoadException;
import org.xenon.lax.datapipeline.api.resources.IDatasetLoader;
import org.xenon.lax.datapipeline.api.run.DataVersionPolicy;
import org.xenon.lax.datapipeline.api.run.MinitreeGroup;
import org.xenon.lax.datapipeline.api.run.RunIdentifier;
import org.xenon.lax.datapipeline.resources.DuckDbSupport;

import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * Loads minitree groups stored as one Parquet file per group, using an in-memory DuckDB.
 * <p>
 * File names follow a pattern with the placeholders {@code {run}} and {@code {group}},
 * by default {@code {run}_{group}.parquet}. Every file must carry an {@code event_number}
 * column and a {@code pax_version} column. The first group fixes the event order; all
 * later groups are aligned to it by event number and must contain exactly the same events.
 * <p>
 * Integer columns up to 64 bits load as {@link ColumnType#LONG}; floating-point, decimal,
 * {@code HUGEINT} and {@code UBIGINT} columns as {@link ColumnType#DOUBLE} (NULL becomes NaN);
 * booleans as {@link ColumnType#BOOLEAN}.
 * Other column types are skipped. When several groups carry a column of the same name,
 * the first group's column is kept.
 */
public class ParquetMinitreeLoader implements IDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(ParquetMinitreeLoader.class);

    public static final String DEFAULT_FILE_PATTERN = "{run}_{group}.parquet";
    static final String EVENT_NUMBER = "event_number";
    static final String VERSION_COLUMN = "pax_version";

    private final Path directory;
    private final String filePattern;

    /**
     * @param directory   directory holding the minitree files
     * @param filePattern file name pattern with {@code {run}} and {@code {group}} placeholders
     */
    public ParquetMinitreeLoader(Path directory, String filePattern) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.filePattern = Objects.requireNonNull(filePattern, "filePattern");
        if (!filePattern.contains("{run}") || !filePattern.contains("{group}")) {
            throw new IllegalArgumentException(
                "Minitree file pattern must contain {run} and {group}: " + filePattern);
        }
        DuckDbSupport.loadDriver();
    }

    /**
     * Creates a loader reading {@code lax.minitrees.file-pattern} from {@code config}.
     */
    public static ParquetMinitreeLoader fromConfig(Path directory, Config config) {
        String pattern = config.hasPath("lax.minitrees.file-pattern")
            ? config.getString("lax.minitrees.file-pattern")
            : DEFAULT_FILE_PATTERN;
        return new ParquetMinitreeLoader(directory, pattern);
    }

    /**
     * @return the file a group of {@code run} is read from
     */
    public Path fileFor(RunIdentifier run, MinitreeGroup group) {
        return directory.resolve(filePattern
            .replace("{run}", run.asString())
            .replace("{group}", group.getTreeName()));
    }

    @Override
    public Dataset load(RunIdentifier run, List<MinitreeGroup> groups, DataVersionPolicy versionPolicy) {
        if (groups.isEmpty()) {
            throw new IllegalArgumentException("At least one minitree group is required");
        }
        if (!Files.isDirectory(directory)) {
            throw new LoadException(directory.toString(), "Minitree directory not found: " + directory);
        }

        Map<String, Column> columns = new LinkedHashMap<>();
        Long2IntOpenHashMap rowByEvent = null;
        int rowCount = 0;

        try (Connection conn = DriverManager.getConnection(DuckDbSupport.IN_MEMORY_URL);
             Statement stmt = conn.createStatement()) {
            for (MinitreeGroup group : groups) {
                Path file = fileFor(run, group);
                if (!Files.isRegularFile(file)) {
                    throw new LoadException(group.getTreeName(), "Minitree file not found: " + file);
                }
                String source = "read_parquet(" + DuckDbSupport.pathLiteral(file) + ")";

                Map<String, ColumnType> schema = describe(stmt, source, group);
                checkVersions(stmt, source, group, versionPolicy);

                GroupData data = readGroup(stmt, source, group, schema);
                if (rowByEvent == null) {
                    rowByEvent = indexEvents(data.eventNumbers, group);
                    rowCount = data.eventNumbers.length;
                    for (Column column : data.columns) {
                        columns.put(column.getName(), column);
                    }
                } else {
                    int[] targetRows = alignEvents(data.eventNumbers, rowByEvent, rowCount, group);
                    for (Column column : data.columns) {
                        if (columns.containsKey(column.getName())) {
                            log.trace("Column {} of {} already loaded from an earlier group", column.getName(), group);
                            continue;
                        }
                        columns.put(column.getName(), reorder(column, targetRows, rowCount));
                    }
                }
                log.debug("Loaded minitree {} for run {}: {} events, {} columns",
                    group, run, data.eventNumbers.length, data.columns.size());
            }
        } catch (SQLException e) {
            throw new LoadException(groups.get(0).getTreeName(),
                "DuckDB failed while reading minitrees for run " + run + ": " + e.getMessage(), e);
        }

        log.info("Loaded {} events with {} fields for run {} from {}", rowCount, columns.size(), run, directory);
        return Dataset.of(rowCount, new ArrayList<>(columns.values()));
    }

    private Map<String, ColumnType> describe(Statement stmt, String source, MinitreeGroup group) {
        Map<String, ColumnType> schema = new LinkedHashMap<>();
        Set<String> allColumns = new HashSet<>();
        try (ResultSet rs = stmt.executeQuery("DESCRIBE SELECT * FROM " + source)) {
            while (rs.next()) {
                String name = rs.getString("column_name");
                String type = rs.getString("column_type");
                allColumns.add(name);
                ColumnType mapped = mapType(type);
                if (mapped == null) {
                    log.trace("Skipping column {} of type {} in minitree {}", name, type, group);
                } else {
                    schema.put(name, mapped);
                }
            }
        } catch (SQLException e) {
            throw new LoadException(group.getTreeName(), "Cannot read schema: " + e.getMessage(), e);
        }
        if (schema.get(EVENT_NUMBER) != ColumnType.LONG) {
            throw new LoadException(group.getTreeName(), "Minitree has no integer " + EVENT_NUMBER + " column");
        }
        if (!allColumns.contains(VERSION_COLUMN)) {
            throw new LoadException(group.getTreeName(), "Minitree has no " + VERSION_COLUMN + " column");
        }
        return schema;
    }

    private void checkVersions(Statement stmt, String source, MinitreeGroup group, DataVersionPolicy policy) {
        if (policy.isLoose()) {
            return;
        }
        try (ResultSet rs = stmt.executeQuery(
                "SELECT DISTINCT " + DuckDbSupport.quoteIdentifier(VERSION_COLUMN) + " FROM " + source)) {
            while (rs.next()) {
                String version = rs.getString(1);
                if (!policy.accepts(version)) {
                    throw new LoadException(group.getTreeName(),
                        "Data version " + version + " does not match requested version " + policy.describe());
                }
            }
        } catch (SQLException e) {
            throw new LoadException(group.getTreeName(), "Cannot read data versions: " + e.getMessage(), e);
        }
    }

    private GroupData readGroup(Statement stmt, String source, MinitreeGroup group, Map<String, ColumnType> schema) {
        List<String> names = new ArrayList<>(schema.keySet());
        List<ColumnBuffer> buffers = new ArrayList<>(names.size());
        StringBuilder select = new StringBuilder("SELECT ");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                select.append(", ");
            }
            String quoted = DuckDbSupport.quoteIdentifier(names.get(i));
            if (schema.get(names.get(i)) == ColumnType.DOUBLE) {
                select.append("CAST(").append(quoted).append(" AS DOUBLE)");
            } else {
                select.append(quoted);
            }
            buffers.add(new ColumnBuffer(names.get(i), schema.get(names.get(i))));
        }
        select.append(" FROM ").append(source);

        try (ResultSet rs = stmt.executeQuery(select.toString())) {
            while (rs.next()) {
                for (int i = 0; i < buffers.size(); i++) {
                    buffers.get(i).append(rs, i + 1, group);
                }
            }
        } catch (SQLException e) {
            throw new LoadException(group.getTreeName(), "Cannot read minitree rows: " + e.getMessage(), e);
        }

        List<Column> columns = new ArrayList<>(buffers.size());
        long[] eventNumbers = null;
        for (ColumnBuffer buffer : buffers) {
            Column column = buffer.toColumn();
            columns.add(column);
            if (column.getName().equals(EVENT_NUMBER)) {
                eventNumbers = buffer.longs.toLongArray();
            }
        }
        return new GroupData(eventNumbers, columns);
    }

    private static Long2IntOpenHashMap indexEvents(long[] eventNumbers, MinitreeGroup group) {
        Long2IntOpenHashMap rowByEvent = new Long2IntOpenHashMap(eventNumbers.length);
        rowByEvent.defaultReturnValue(-1);
        for (int row = 0; row < eventNumbers.length; row++) {
            if (rowByEvent.put(eventNumbers[row], row) != -1) {
                throw new LoadException(group.getTreeName(), "Duplicate event number " + eventNumbers[row]);
            }
        }
        return rowByEvent;
    }

    /**
     * Maps each row of a later group onto the row of the same event in the first group.
     */
    private static int[] alignEvents(long[] eventNumbers, Long2IntOpenHashMap rowByEvent, int rowCount,
                                     MinitreeGroup group) {
        if (eventNumbers.length != rowCount) {
            throw new LoadException(group.getTreeName(), String.format(
                "Minitree has %d events, expected %d", eventNumbers.length, rowCount));
        }
        int[] targetRows = new int[eventNumbers.length];
        boolean[] covered = new boolean[rowCount];
        for (int row = 0; row < eventNumbers.length; row++) {
            int target = rowByEvent.get(eventNumbers[row]);
            if (target < 0) {
                throw new LoadException(group.getTreeName(),
                    "Event " + eventNumbers[row] + " is not present in the first minitree");
            }
            if (covered[target]) {
                throw new LoadException(group.getTreeName(), "Duplicate event number " + eventNumbers[row]);
            }
            covered[target] = true;
            targetRows[row] = target;
        }
        return targetRows;
    }

    private static Column reorder(Column column, int[] targetRows, int rowCount) {
        switch (column.getType()) {
            case DOUBLE -> {
                double[] values = new double[rowCount];
                for (int row = 0; row < targetRows.length; row++) {
                    values[targetRows[row]] = column.getDouble(row);
                }
                return Column.ofDoubles(column.getName(), values);
            }
            case LONG -> {
                long[] values = new long[rowCount];
                for (int row = 0; row < targetRows.length; row++) {
                    values[targetRows[row]] = column.getLong(row);
                }
                return Column.ofLongs(column.getName(), values);
            }
            default -> {
                boolean[] values = new boolean[rowCount];
                for (int row = 0; row < targetRows.length; row++) {
                    values[targetRows[row]] = column.getBoolean(row);
                }
                return Column.ofBooleans(column.getName(), values);
            }
        }
    }

    /**
     * @param duckDbType type name as reported by DuckDB's DESCRIBE
     * @return the dataset type, or null if the column is not loaded
     */
    static ColumnType mapType(String duckDbType) {
        String type = duckDbType.toUpperCase(Locale.ROOT);
        if (type.startsWith("DECIMAL")) {
            return ColumnType.DOUBLE;
        }
        return switch (type) {
            case "TINYINT", "SMALLINT", "INTEGER", "BIGINT",
                 "UTINYINT", "USMALLINT", "UINTEGER" -> ColumnType.LONG;
            // wider than a signed 64-bit long
            case "HUGEINT", "UBIGINT", "UHUGEINT" -> ColumnType.DOUBLE;
            case "FLOAT", "REAL", "DOUBLE" -> ColumnType.DOUBLE;
            case "BOOLEAN" -> ColumnType.BOOLEAN;
            default -> null;
        };
    }

    private record GroupData(long[] eventNumbers, List<Column> columns) {
    }
}
