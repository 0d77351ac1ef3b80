package org.sandpile.runtime;

import com.typesafe.config.Config;

/**
 * Validated settings of a simulation run.
 * <p>
 * Usually built from the {@code sandpile} block of the HOCON configuration:
 * <pre>
 * sandpile {
 *   simulation { grid-size = 30, iterations = 5000, seed = 42, max-waves = 0 }
 *   statistics { max-cascade = 100, num-bins = 50 }
 *   output { display = false, persist-frames = false }
 * }
 * </pre>
 * The toppling threshold is not part of the configuration; it is fixed at
 * {@link org.sandpile.runtime.Config#TOPPLE_THRESHOLD}.
 *
 * @param gridSize Edge length of the square lattice, at least 1.
 * @param iterations Number of grains to drop, at least 0.
 * @param seed Seed of the run's random provider.
 * @param maxWaves Wave cap per drop; 0 selects the engine default.
 * @param maxCascade Upper edge of the avalanche histogram, positive.
 * @param numBins Number of histogram bins, at least 1.
 * @param display Whether per-event frames go to an interactive display.
 * @param persistFrames Whether per-event frames are written to disk.
 */
public record SimulationConfig(
        int gridSize,
        int iterations,
        long seed,
        long maxWaves,
        double maxCascade,
        int numBins,
        boolean display,
        boolean persistFrames
) {

    public SimulationConfig {
        if (gridSize < 1) {
            throw new SimulationConfigurationException("simulation.grid-size", "must be at least 1 but was " + gridSize);
        }
        if (iterations < 0) {
            throw new SimulationConfigurationException("simulation.iterations", "must not be negative but was " + iterations);
        }
        if (maxWaves < 0) {
            throw new SimulationConfigurationException("simulation.max-waves", "must not be negative but was " + maxWaves);
        }
        if (!(maxCascade > 0) || Double.isInfinite(maxCascade)) {
            throw new SimulationConfigurationException("statistics.max-cascade", "must be a positive number but was " + maxCascade);
        }
        if (numBins < 1) {
            throw new SimulationConfigurationException("statistics.num-bins", "must be at least 1 but was " + numBins);
        }
    }

    /**
     * Reads and validates the settings from a {@code sandpile} configuration block.
     *
     * @param config The block (the object under the {@code sandpile} key).
     * @return The validated settings.
     * @throws SimulationConfigurationException if a value is out of range.
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type.
     */
    public static SimulationConfig fromConfig(Config config) {
        long seed = config.hasPath("simulation.seed") ? config.getLong("simulation.seed") : System.currentTimeMillis();
        return new SimulationConfig(
                config.getInt("simulation.grid-size"),
                config.getInt("simulation.iterations"),
                seed,
                config.hasPath("simulation.max-waves") ? config.getLong("simulation.max-waves") : 0L,
                config.getDouble("statistics.max-cascade"),
                config.getInt("statistics.num-bins"),
                config.hasPath("output.display") && config.getBoolean("output.display"),
                config.hasPath("output.persist-frames") && config.getBoolean("output.persist-frames")
        );
    }

    /**
     * Checks whether the driver must publish a frame for every deposit and toppling.
     *
     * @return true if display or frame persistence is enabled.
     */
    public boolean frameEventsEnabled() {
        return display || persistFrames;
    }
}
