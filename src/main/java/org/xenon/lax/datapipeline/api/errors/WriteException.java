package org.xenon.lax.datapipeline.api.errors;

/**
 * Thrown when the final dataset or its run summary cannot be persisted.
 */
public class WriteException extends LaxException {

    /**
     * @param path    the output path that could not be written
     * @param message description of the problem
     * @param cause   the underlying failure
     */
    public WriteException(String path, String message, Throwable cause) {
        super(Stage.WRITE, path, message, cause);
    }
}
