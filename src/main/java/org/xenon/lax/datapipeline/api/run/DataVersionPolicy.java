package org.xenon.lax.datapipeline.api.run;

import java.util.Objects;

/**
 * Rule deciding which processed-data versions the loader accepts.
 * <p>
 * Detector data must match the requested version exactly. Simulated data is produced
 * outside the processing campaign, so any version is accepted ("loose").
 */
public final class DataVersionPolicy {

    private static final String LOOSE = "loose";
    private static final DataVersionPolicy LOOSE_POLICY = new DataVersionPolicy(null);

    private final String requiredVersion;

    private DataVersionPolicy(String requiredVersion) {
        this.requiredVersion = requiredVersion;
    }

    /**
     * @param version the only accepted version (e.g. "6.8.0")
     * @return an exact-match policy
     */
    public static DataVersionPolicy exact(String version) {
        return new DataVersionPolicy(Objects.requireNonNull(version, "version"));
    }

    /**
     * @return the permissive policy accepting every version
     */
    public static DataVersionPolicy loose() {
        return LOOSE_POLICY;
    }

    public boolean isLoose() {
        return requiredVersion == null;
    }

    /**
     * @param version a version found in the data
     * @return true if this policy accepts it
     */
    public boolean accepts(String version) {
        return isLoose() || requiredVersion.equals(version);
    }

    /**
     * @return "loose" or the exact version string
     */
    public String describe() {
        return isLoose() ? LOOSE : requiredVersion;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DataVersionPolicy
            && Objects.equals(requiredVersion, ((DataVersionPolicy) o).requiredVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(requiredVersion);
    }

    @Override
    public String toString() {
        return "DataVersionPolicy[" + describe() + "]";
    }
}
