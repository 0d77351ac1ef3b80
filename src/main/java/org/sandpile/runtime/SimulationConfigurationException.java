package org.sandpile.runtime;

/**
 * Thrown when a simulation is configured with values the model cannot run with,
 * e.g. a non-positive grid size or histogram bin count.
 * <p>
 * Raised while the configuration is built, before any grid exists, so a run never starts
 * with invalid settings.
 */
public class SimulationConfigurationException extends IllegalArgumentException {

    private final String key;

    /**
     * Constructs a new configuration exception for a specific setting.
     *
     * @param key the configuration key that holds the invalid value
     * @param message the detail message explaining the failure
     */
    public SimulationConfigurationException(String key, String message) {
        super("Invalid configuration '" + key + "': " + message);
        this.key = key;
    }

    /**
     * Returns the configuration key that failed validation.
     *
     * @return the key, relative to the {@code sandpile} block
     */
    public String getKey() {
        return key;
    }
}
