package org.xenon.lax.datapipeline.api.run;

/**
 * Raw run parameters as given on the command line, before validation.
 *
 * @param runNumber      run number, or {@link #SIMULATION_RUN} for simulated data
 * @param scienceRun     science-run epoch number
 * @param dataVersion    processed-data version to require
 * @param filename       minitree file stem; required exactly for simulated data, may be null
 * @param outputOverride explicit output base name, may be null
 */
public record RunRequest(int runNumber, int scienceRun, String dataVersion,
                         String filename, String outputOverride) {

    /** Reserved run number marking simulated data. */
    public static final int SIMULATION_RUN = -1;

    public boolean isSimulation() {
        return runNumber == SIMULATION_RUN;
    }
}
