package org.xenon.lax.datapipeline.api.dataset;

import java.util.Objects;

/**
 * A named, typed column of a {@link Dataset}.
 * <p>
 * Backed by a primitive array that is never modified after construction. The
 * factory methods take ownership of the passed array; callers must not write to it
 * afterwards.
 */
public final class Column {

    private final String name;
    private final ColumnType type;
    private final double[] doubles;
    private final long[] longs;
    private final boolean[] booleans;

    private Column(String name, ColumnType type, double[] doubles, long[] longs, boolean[] booleans) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
        this.doubles = doubles;
        this.longs = longs;
        this.booleans = booleans;
    }

    public static Column ofDoubles(String name, double[] values) {
        return new Column(name, ColumnType.DOUBLE, Objects.requireNonNull(values, "values"), null, null);
    }

    public static Column ofLongs(String name, long[] values) {
        return new Column(name, ColumnType.LONG, null, Objects.requireNonNull(values, "values"), null);
    }

    public static Column ofBooleans(String name, boolean[] values) {
        return new Column(name, ColumnType.BOOLEAN, null, null, Objects.requireNonNull(values, "values"));
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public int size() {
        return switch (type) {
            case DOUBLE -> doubles.length;
            case LONG -> longs.length;
            case BOOLEAN -> booleans.length;
        };
    }

    /**
     * Reads a value as a double, the common currency of cut formulas.
     * Booleans read as 1.0 / 0.0.
     *
     * @param row row index
     * @return the numeric value at {@code row}
     */
    public double getDouble(int row) {
        return switch (type) {
            case DOUBLE -> doubles[row];
            case LONG -> longs[row];
            case BOOLEAN -> booleans[row] ? 1.0 : 0.0;
        };
    }

    /**
     * Reads a value as a boolean. Numeric values are true when non-zero; NaN is false.
     *
     * @param row row index
     * @return the truth value at {@code row}
     */
    public boolean getBoolean(int row) {
        return switch (type) {
            case BOOLEAN -> booleans[row];
            case LONG -> longs[row] != 0L;
            case DOUBLE -> doubles[row] != 0.0 && !Double.isNaN(doubles[row]);
        };
    }

    /**
     * @param row row index
     * @return the integer value at {@code row}
     * @throws IllegalStateException if this is not a LONG column
     */
    public long getLong(int row) {
        if (type != ColumnType.LONG) {
            throw new IllegalStateException("Column '" + name + "' is " + type + ", not LONG");
        }
        return longs[row];
    }

    /**
     * Number of true values. Only meaningful for BOOLEAN columns.
     *
     * @return count of rows that read as true
     */
    public int countTrue() {
        int count = 0;
        for (int row = 0; row < size(); row++) {
            if (getBoolean(row)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return name + ":" + type + "[" + size() + "]";
    }
}
