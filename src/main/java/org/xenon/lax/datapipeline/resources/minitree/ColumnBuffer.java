package org.xenon.lax.datapipeline.resources.minitree;

import java.sql.ResultSet;
import java.sql.SQLException;

import org.xenon.lax.datapipeline.api.dataset.Column;
import org.xenon.lax.datapipeline.api.dataset.ColumnType;
import org.xenon.lax.datapipeline.api.errors.LoadException;
import org.xenon.lax.datapipeline.api.run.MinitreeGroup;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;

/**
 * Growable primitive buffer for one column while rows stream in from DuckDB.
 */
final class ColumnBuffer {

    final String name;
    final ColumnType type;
    final DoubleArrayList doubles;
    final LongArrayList longs;
    final BooleanArrayList booleans;

    ColumnBuffer(String name, ColumnType type) {
        this.name = name;
        this.type = type;
        this.doubles = type == ColumnType.DOUBLE ? new DoubleArrayList() : null;
        this.longs = type == ColumnType.LONG ? new LongArrayList() : null;
        this.booleans = type == ColumnType.BOOLEAN ? new BooleanArrayList() : null;
    }

    void append(ResultSet rs, int index, MinitreeGroup group) throws SQLException {
        switch (type) {
            case DOUBLE -> {
                double value = rs.getDouble(index);
                doubles.add(rs.wasNull() ? Double.NaN : value);
            }
            case LONG -> {
                long value = rs.getLong(index);
                if (rs.wasNull()) {
                    throw new LoadException(group.getTreeName(), "NULL value in integer column " + name);
                }
                longs.add(value);
            }
            case BOOLEAN -> {
                boolean value = rs.getBoolean(index);
                if (rs.wasNull()) {
                    throw new LoadException(group.getTreeName(), "NULL value in boolean column " + name);
                }
                booleans.add(value);
            }
        }
    }

    Column toColumn() {
        return switch (type) {
            case DOUBLE -> Column.ofDoubles(name, doubles.toDoubleArray());
            case LONG -> Column.ofLongs(name, longs.toLongArray());
            case BOOLEAN -> Column.ofBooleans(name, booleans.toBooleanArray());
        };
    }
}
