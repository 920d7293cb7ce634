package org.xenon.lax.datapipeline.api.dataset;

/**
 * Supported column types of a {@link Dataset}.
 * <p>
 * Maps to DuckDB SQL types for loading minitrees and writing Parquet output.
 */
public enum ColumnType {
    /**
     * 64-bit floating point. Use for areas, positions, times in ns.
     */
    DOUBLE("DOUBLE"),

    /**
     * 64-bit signed integer. Use for run and event numbers.
     */
    LONG("BIGINT"),

    /**
     * Boolean (true/false). All cut results use this type.
     */
    BOOLEAN("BOOLEAN");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Returns the DuckDB SQL type name.
     *
     * @return SQL type string (e.g., "BIGINT", "DOUBLE")
     */
    public String getSqlType() {
        return sqlType;
    }
}
