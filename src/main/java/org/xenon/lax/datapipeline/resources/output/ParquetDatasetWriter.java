package org.xenon.lax.datapipeline.resources.output;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenon.lax.datapipeline.api.dataset.Column;
import org.xenon.lax.datapipeline.api.dataset.Dataset;
import org.xenon.lax.datapipeline.api.errors.WriteException;
import org.xenon.lax.datapipeline.api.resources.IDatasetWriter;
import org.xenon.lax.datapipeline.resources.DuckDbSupport;

import com.typesafe.config.Config;

/**
 * Writes a dataset as a Parquet file via an in-memory DuckDB table.
 * <p>
 * Rows are inserted in batches, exported with {@code COPY ... (FORMAT PARQUET)} to a
 * temporary file in the target directory and then moved onto the target. Readers
 * therefore see either the complete file or no file. The logical table name is stored
 * in the file's key-value metadata under {@value #TABLE_METADATA_KEY}.
 */
public class ParquetDatasetWriter implements IDatasetWriter {

    private static final Logger log = LoggerFactory.getLogger(ParquetDatasetWriter.class);

    public static final String EXTENSION = ".parquet";
    /** Parquet key-value metadata entry holding the logical table name. */
    public static final String TABLE_METADATA_KEY = "table";
    static final Set<String> SUPPORTED_CODECS = Set.of("ZSTD", "SNAPPY", "GZIP", "UNCOMPRESSED");

    private final String codec;
    private final int insertBatchSize;

    public ParquetDatasetWriter(String codec, int insertBatchSize) {
        String normalized = codec.toUpperCase(Locale.ROOT);
        if (!SUPPORTED_CODECS.contains(normalized)) {
            throw new IllegalArgumentException("Unsupported Parquet codec " + codec + ", expected one of " + SUPPORTED_CODECS);
        }
        if (insertBatchSize <= 0) {
            throw new IllegalArgumentException("insertBatchSize must be positive, got " + insertBatchSize);
        }
        this.codec = normalized;
        this.insertBatchSize = insertBatchSize;
        DuckDbSupport.loadDriver();
    }

    /**
     * Creates a writer from {@code lax.output.parquet-codec} and {@code lax.output.insert-batch-size}.
     */
    public static ParquetDatasetWriter fromConfig(Config config) {
        String codec = config.hasPath("lax.output.parquet-codec")
            ? config.getString("lax.output.parquet-codec")
            : "ZSTD";
        int batchSize = config.hasPath("lax.output.insert-batch-size")
            ? config.getInt("lax.output.insert-batch-size")
            : 10_000;
        return new ParquetDatasetWriter(codec, batchSize);
    }

    @Override
    public String fileExtension() {
        return EXTENSION;
    }

    @Override
    public void write(Dataset dataset, Path target, String tableName) {
        if (dataset.columnCount() == 0) {
            throw new WriteException(target.toString(), "Dataset has no columns", null);
        }
        Path directory = target.toAbsolutePath().getParent();
        Path tempFile = null;
        try {
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, "." + target.getFileName() + "_", ".tmp");

            try (Connection conn = DriverManager.getConnection(DuckDbSupport.IN_MEMORY_URL);
                 Statement stmt = conn.createStatement()) {
                String table = DuckDbSupport.quoteIdentifier(tableName);
                stmt.execute(createTableSql(table, dataset.columns()));
                insertRows(conn, table, dataset);
                stmt.execute(String.format("COPY %s TO %s (FORMAT PARQUET, CODEC '%s', KV_METADATA {%s: '%s'})",
                    table, DuckDbSupport.pathLiteral(tempFile), codec,
                    TABLE_METADATA_KEY, tableName.replace("'", "''")));
            }

            moveIntoPlace(tempFile, target);
            tempFile = null;
            log.debug("Wrote {} rows and {} columns as table {} to {}",
                dataset.rowCount(), dataset.columnCount(), tableName, target);
        } catch (SQLException | IOException e) {
            throw new WriteException(target.toString(), e.getMessage(), e);
        } finally {
            if (tempFile != null) {
                try {
                    Files.deleteIfExists(tempFile);
                } catch (IOException e) {
                    log.debug("Failed to delete temp file: {}", tempFile);
                }
            }
        }
    }

    private static String createTableSql(String table, List<Column> columns) {
        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(table).append(" (");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            Column column = columns.get(i);
            sql.append(DuckDbSupport.quoteIdentifier(column.getName()))
                .append(' ')
                .append(column.getType().getSqlType());
        }
        return sql.append(")").toString();
    }

    private void insertRows(Connection conn, String table, Dataset dataset) throws SQLException {
        List<Column> columns = dataset.columns();
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(table).append(" VALUES (");
        for (int i = 0; i < columns.size(); i++) {
            sql.append(i > 0 ? ", ?" : "?");
        }
        sql.append(")");

        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int pending = 0;
            for (int row = 0; row < dataset.rowCount(); row++) {
                for (int i = 0; i < columns.size(); i++) {
                    Column column = columns.get(i);
                    int paramIndex = i + 1;
                    switch (column.getType()) {
                        case DOUBLE -> ps.setDouble(paramIndex, column.getDouble(row));
                        case LONG -> ps.setLong(paramIndex, column.getLong(row));
                        case BOOLEAN -> ps.setBoolean(paramIndex, column.getBoolean(row));
                    }
                }
                ps.addBatch();
                if (++pending == insertBatchSize) {
                    ps.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
            }
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
