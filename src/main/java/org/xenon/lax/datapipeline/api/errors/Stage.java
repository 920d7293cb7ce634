package org.xenon.lax.datapipeline.api.errors;

/**
 * Processing stage in which a {@link LaxException} was raised.
 * <p>
 * Each stage maps to its own process exit code.
 */
public enum Stage {
    /** Turning raw run parameters into a run configuration. */
    RESOLUTION("resolution", 2),
    /** Loading minitree data into a dataset. */
    LOAD("load", 3),
    /** Evaluating cut groups against the dataset. */
    EVALUATION("evaluation", 4),
    /** Persisting the final dataset. */
    WRITE("write", 5);

    private final String label;
    private final int exitCode;

    Stage(String label, int exitCode) {
        this.label = label;
        this.exitCode = exitCode;
    }

    /**
     * @return lower-case name used in error messages (e.g. "load")
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return process exit code reported by the CLI for failures in this stage
     */
    public int getExitCode() {
        return exitCode;
    }
}
