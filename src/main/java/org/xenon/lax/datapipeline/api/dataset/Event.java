package org.xenon.lax.datapipeline.api.dataset;

import java.util.Map;

/**
 * Cursor over one row of a {@link Dataset}, restricted to a fixed set of fields.
 * <p>
 * A cut evaluates its predicate against a single reused {@code Event} that is moved
 * from row to row. Reading a field outside the set the cut declared fails, which keeps
 * declared dependencies honest.
 */
public final class Event {

    private final Map<String, Column> fields;
    private int row = -1;

    /**
     * @param fields the readable columns, keyed by field name
     */
    public Event(Map<String, Column> fields) {
        this.fields = Map.copyOf(fields);
    }

    /**
     * Moves the cursor.
     * <p>
     * <b>Internal use only:</b> called by the evaluating cut between predicate invocations.
     *
     * @param row the new row index
     */
    public void moveTo(int row) {
        this.row = row;
    }

    public int row() {
        return row;
    }

    /**
     * @param field field name
     * @return numeric value of {@code field} in the current row
     * @throws UndeclaredFieldException if the field is not readable through this cursor
     */
    public double get(String field) {
        return lookup(field).getDouble(row);
    }

    /**
     * @param field field name
     * @return truth value of {@code field} in the current row
     * @throws UndeclaredFieldException if the field is not readable through this cursor
     */
    public boolean is(String field) {
        return lookup(field).getBoolean(row);
    }

    private Column lookup(String field) {
        Column column = fields.get(field);
        if (column == null) {
            throw new UndeclaredFieldException(field);
        }
        return column;
    }

    /**
     * Thrown when a predicate reads a field that was not declared as required.
     */
    public static final class UndeclaredFieldException extends RuntimeException {

        private final String field;

        public UndeclaredFieldException(String field) {
            super("Field '" + field + "' was read but not declared as required");
            this.field = field;
        }

        public String getField() {
            return field;
        }
    }
}
