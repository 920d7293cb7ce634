package org.xenon.lax.datapipeline.api.errors;

/**
 * Thrown when a cut cannot be evaluated: one of its required fields is absent from
 * the dataset, it reads a field it did not declare, or its predicate fails.
 */
public class CutEvaluationException extends LaxException {

    /**
     * @param cut     name of the failing cut (or cut group)
     * @param message description of the problem
     */
    public CutEvaluationException(String cut, String message) {
        super(Stage.EVALUATION, cut, message);
    }

    /**
     * @param cut     name of the failing cut
     * @param message description of the problem
     * @param cause   the underlying failure
     */
    public CutEvaluationException(String cut, String message, Throwable cause) {
        super(Stage.EVALUATION, cut, message, cause);
    }
}
