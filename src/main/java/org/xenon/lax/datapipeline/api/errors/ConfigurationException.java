package org.xenon.lax.datapipeline.api.errors;

/**
 * Thrown when run parameters are missing or invalid, e.g. an unsupported science run
 * or a simulation run requested without a minitree filename.
 */
public class ConfigurationException extends LaxException {

    /**
     * @param subject the offending parameter value or name
     * @param message description of the problem
     */
    public ConfigurationException(String subject, String message) {
        super(Stage.RESOLUTION, subject, message);
    }
}
