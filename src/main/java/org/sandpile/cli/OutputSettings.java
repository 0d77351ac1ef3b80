package org.sandpile.cli;

import com.typesafe.config.Config;
import org.sandpile.runtime.SimulationConfigurationException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Validated settings of the outer surfaces of a run: where frames and the summary go and how
 * frames are drawn.
 *
 * @param frameDirectory Directory persisted frames are written to.
 * @param summaryFile Target of the JSON run summary, or empty to skip it.
 * @param cellSize Pixels per grid cell, at least 1.
 * @param pauseMillis Delay after each displayed frame, at least 0.
 */
public record OutputSettings(Path frameDirectory, Optional<Path> summaryFile, int cellSize, long pauseMillis) {

    public OutputSettings {
        if (cellSize < 1) {
            throw new SimulationConfigurationException("output.cell-size", "must be at least 1 but was " + cellSize);
        }
        if (pauseMillis < 0) {
            throw new SimulationConfigurationException("output.pause-millis", "must not be negative but was " + pauseMillis);
        }
    }

    /**
     * Reads the settings from the {@code output} block of the {@code sandpile} configuration.
     *
     * @param output The block.
     * @return The validated settings.
     */
    public static OutputSettings fromConfig(Config output) {
        String summary = output.getString("summary-file");
        return new OutputSettings(
                Path.of(output.getString("frame-directory")),
                summary.isBlank() ? Optional.empty() : Optional.of(Path.of(summary)),
                output.getInt("cell-size"),
                output.getLong("pause-millis"));
    }
}
