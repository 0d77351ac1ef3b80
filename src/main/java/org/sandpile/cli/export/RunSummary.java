package org.sandpile.cli.export;

import org.sandpile.runtime.Simulation;
import org.sandpile.runtime.model.GridProperties;
import org.sandpile.runtime.statistics.CascadeStatistics;

/**
 * The final statistics of a run as written to the summary file.
 *
 * @param grid The lattice shape.
 * @param seed The seed of the run.
 * @param iterations The configured number of drops.
 * @param dropsCompleted The number of drops actually performed.
 * @param maxCascade Upper edge of the histogram domain.
 * @param binCutoffs The histogram cutoffs.
 * @param binCounts The histogram counts.
 * @param binnedAvalanches Avalanches that landed in a bin.
 * @param discardedAvalanches Avalanches too large for the histogram.
 * @param averageSeries Mean height after every drop, baseline first.
 * @param finalMean The last entry of the average series.
 */
public record RunSummary(
        GridProperties grid,
        long seed,
        int iterations,
        long dropsCompleted,
        double maxCascade,
        double[] binCutoffs,
        long[] binCounts,
        long binnedAvalanches,
        long discardedAvalanches,
        double[] averageSeries,
        double finalMean
) {

    /**
     * Collects the summary of a finished simulation.
     *
     * @param simulation The simulation.
     * @return The summary.
     */
    public static RunSummary of(Simulation simulation) {
        CascadeStatistics statistics = simulation.getStatistics();
        return new RunSummary(
                simulation.getGrid().getProperties(),
                simulation.getConfig().seed(),
                simulation.getConfig().iterations(),
                simulation.getDropsCompleted(),
                statistics.getMaxCascade(),
                statistics.getBinCutoffs(),
                statistics.getBinCounts(),
                statistics.getRecordedCount(),
                statistics.getDiscardedCount(),
                statistics.getAverageSeries(),
                statistics.getLatestAverage());
    }
}
