package org.xenon.lax.datapipeline.api.errors;

/**
 * Thrown when the loader cannot produce the requested dataset: missing minitree,
 * data-version mismatch, misaligned events or an unreadable file.
 */
public class LoadException extends LaxException {

    /**
     * @param group   the minitree group (or run) that could not be loaded
     * @param message description of the problem
     */
    public LoadException(String group, String message) {
        super(Stage.LOAD, group, message);
    }

    /**
     * @param group   the minitree group (or run) that could not be loaded
     * @param message description of the problem
     * @param cause   the underlying failure
     */
    public LoadException(String group, String message, Throwable cause) {
        super(Stage.LOAD, group, message, cause);
    }
}
