package org.xenon.lax.datapipeline.api.errors;

/**
 * Base class for all failures of a cut-selection run.
 * <p>
 * Every failure carries the {@link Stage} it happened in and the offending name:
 * the science run, minitree group, cut or output path. Runs are never retried.
 */
public abstract class LaxException extends RuntimeException {

    private final Stage stage;
    private final String subject;

    protected LaxException(Stage stage, String subject, String message) {
        super(message);
        this.stage = stage;
        this.subject = subject;
    }

    protected LaxException(Stage stage, String subject, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.subject = subject;
    }

    /**
     * @return the stage that failed
     */
    public Stage getStage() {
        return stage;
    }

    /**
     * @return the name of the offending entity (epoch, minitree group, cut or path)
     */
    public String getSubject() {
        return subject;
    }

    /**
     * Formats the failure for the command line: stage, subject and message.
     *
     * @return a one-line user-facing description
     */
    public String describe() {
        return String.format("%s failed for '%s': %s", stage.getLabel(), subject, getMessage());
    }
}
