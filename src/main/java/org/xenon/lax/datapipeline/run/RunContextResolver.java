package org.xenon.lax.datapipeline.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xenon.lax.datapipeline.api.errors.ConfigurationException;
import org.xenon.lax.datapipeline.api.run.DataVersionPolicy;
import org.xenon.lax.datapipeline.api.run.MinitreeGroup;
import org.xenon.lax.datapipeline.api.run.OutputTarget;
import org.xenon.lax.datapipeline.api.run.RunConfig;
import org.xenon.lax.datapipeline.api.run.RunIdentifier;
import org.xenon.lax.datapipeline.api.run.RunRequest;
import org.xenon.lax.datapipeline.api.run.ScienceRun;

/**
 * Normalizes raw run parameters into a {@link RunConfig}.
 * <p>
 * The simulation sentinel ({@link RunRequest#SIMULATION_RUN}) switches three things at once:
 * the run is identified by the supplied minitree filename, any data version is accepted,
 * and the detector-monitoring minitree groups are not requested.
 */
public class RunContextResolver {

    private static final Logger log = LoggerFactory.getLogger(RunContextResolver.class);

    static final String OUTPUT_SUFFIX = "_lax";

    /**
     * @param request raw parameters
     * @return the validated configuration
     * @throws ConfigurationException if the science run is unsupported, the simulation
     *                                sentinel is used without a filename, the run number is
     *                                negative, or the data version is blank
     */
    public RunConfig resolve(RunRequest request) {
        ScienceRun scienceRun = ScienceRun.fromNumber(request.scienceRun())
            .orElseThrow(() -> new ConfigurationException("SR" + request.scienceRun(),
                "Unsupported science run " + request.scienceRun() + ", expected one of " + supportedNumbers()));

        final RunIdentifier identifier;
        final DataVersionPolicy policy;
        final boolean simulation = request.isSimulation();
        if (simulation) {
            if (request.filename() == null || request.filename().isBlank()) {
                throw new ConfigurationException("filename",
                    "Run number " + RunRequest.SIMULATION_RUN + " selects simulated data and requires a minitree filename");
            }
            identifier = RunIdentifier.named(request.filename().trim());
            policy = DataVersionPolicy.loose();
        } else {
            if (request.runNumber() < 0) {
                throw new ConfigurationException(Integer.toString(request.runNumber()),
                    "Run number must be non-negative (or " + RunRequest.SIMULATION_RUN + " for simulated data)");
            }
            if (request.dataVersion() == null || request.dataVersion().isBlank()) {
                throw new ConfigurationException("pax-version", "A data version is required for detector data");
            }
            identifier = RunIdentifier.of(request.runNumber());
            policy = DataVersionPolicy.exact(request.dataVersion().trim());
        }

        String baseName = request.outputOverride() != null && !request.outputOverride().isBlank()
            ? request.outputOverride()
            : identifier.asString() + OUTPUT_SUFFIX;
        String tableName = simulation
            ? OutputTarget.TABLE_NAME + OutputTarget.SIMULATION_SUFFIX
            : OutputTarget.TABLE_NAME;

        RunConfig config = new RunConfig(identifier, scienceRun, policy, simulation,
            MinitreeGroup.requiredFor(simulation), new OutputTarget(baseName, scienceRun, tableName));
        log.debug("Resolved run {} ({}): policy={}, groups={}, output={}",
            identifier, scienceRun, policy.describe(), config.requiredGroups(), config.output().fileStem());
        return config;
    }

    private static String supportedNumbers() {
        StringBuilder sb = new StringBuilder();
        for (ScienceRun run : ScienceRun.values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(run.getNumber());
        }
        return "[" + sb + "]";
    }
}
