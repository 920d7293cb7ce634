package org.xenon.lax.datapipeline.api.errors;

/**
 * Thrown when a cut would write a result column whose name is already taken by a raw
 * field or by a different cut definition.
 * <p>
 * Re-evaluating the identical definition is not a collision; the existing column is reused.
 */
public class ColumnCollisionException extends CutEvaluationException {

    /**
     * @param column  the contested column name
     * @param message description of both producers
     */
    public ColumnCollisionException(String column, String message) {
        super(column, message);
    }
}
