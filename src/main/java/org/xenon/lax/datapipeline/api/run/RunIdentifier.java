package org.xenon.lax.datapipeline.api.run;

import java.util.Objects;

/**
 * Effective identifier of the data being processed: a run number for detector data,
 * or a minitree file stem for simulated data.
 *
 * @param number the run number, or {@code null} for a named (simulated) dataset
 * @param name   the file stem, or {@code null} for a numbered run
 */
public record RunIdentifier(Integer number, String name) {

    public RunIdentifier {
        if ((number == null) == (name == null)) {
            throw new IllegalArgumentException("Exactly one of number and name must be set");
        }
    }

    public static RunIdentifier of(int number) {
        return new RunIdentifier(number, null);
    }

    public static RunIdentifier named(String name) {
        return new RunIdentifier(null, Objects.requireNonNull(name, "name"));
    }

    public boolean isNumbered() {
        return number != null;
    }

    /**
     * @return the identifier as used in file names ("6731" or "sim001")
     */
    public String asString() {
        return isNumbered() ? Integer.toString(number) : name;
    }

    @Override
    public String toString() {
        return asString();
    }
}
