package org.xenon.lax.datapipeline.resources;

import java.nio.file.Path;

/**
 * Shared helpers for the DuckDB-backed loader and writer.
 */
public final class DuckDbSupport {

    /** In-memory database; each connection gets its own. */
    public static final String IN_MEMORY_URL = "jdbc:duckdb:";

    private static boolean driverLoaded = false;

    private DuckDbSupport() {
    }

    /**
     * Loads the DuckDB JDBC driver (thread-safe, idempotent).
     */
    public static synchronized void loadDriver() {
        if (!driverLoaded) {
            try {
                Class.forName("org.duckdb.DuckDBDriver");
                driverLoaded = true;
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException("DuckDB driver not found on classpath", e);
            }
        }
    }

    /**
     * @return {@code name} as a double-quoted SQL identifier
     */
    public static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    /**
     * @return {@code path} as a single-quoted SQL string literal with forward slashes
     */
    public static String pathLiteral(Path path) {
        String normalized = path.toAbsolutePath().toString().replace("\\", "/");
        return "'" + normalized.replace("'", "''") + "'";
    }
}
