package org.xenon.lax.datapipeline.api.run;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of supported science runs (epochs).
 * <p>
 * A science run selects which cut groups and detector assumptions apply. Adding an
 * epoch means adding a constant here and an entry in the cut-set registry.
 */
public enum ScienceRun {
    SR0(0),
    SR1(1);

    private final int number;

    ScienceRun(int number) {
        this.number = number;
    }

    /**
     * @return the epoch number used on the command line and in output file names
     */
    public int getNumber() {
        return number;
    }

    /**
     * @param number epoch number
     * @return the matching science run, empty if unsupported
     */
    public static Optional<ScienceRun> fromNumber(int number) {
        return Arrays.stream(values()).filter(run -> run.number == number).findFirst();
    }
}
