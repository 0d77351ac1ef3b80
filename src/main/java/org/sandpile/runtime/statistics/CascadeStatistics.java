package org.sandpile.runtime.statistics;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.sandpile.runtime.model.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Accumulates the derived series of a run: the mean grid height after every drop and a
 * histogram of avalanche sizes.
 * <p>
 * The histogram has {@code numBins} equal-width bins whose cutoffs are
 * {@code linspace(0, maxCascade, numBins + 1)}. A size {@code s} belongs to bin
 * {@code min{i : cutoff[i] > s} - 1}, i.e. to the half-open interval {@code [cutoff[b], cutoff[b+1])}
 * that contains it. Sizes with no cutoff above them ({@code s >= maxCascade}) are not binned;
 * they are only counted as discarded.
 * <p>
 * Accessors return copies; callers never see internal storage.
 */
public class CascadeStatistics {
    private static final Logger LOG = LoggerFactory.getLogger(CascadeStatistics.class);

    private final double maxCascade;
    private final int numBins;
    private final double[] binCutoffs;
    private final long[] binCounts;
    private final DoubleArrayList averageSeries = new DoubleArrayList();
    private long recordedCount = 0;
    private long discardedCount = 0;

    /**
     * Creates empty statistics.
     *
     * @param maxCascade Upper edge of the histogram domain, must be positive.
     * @param numBins Number of bins, must be positive.
     */
    public CascadeStatistics(double maxCascade, int numBins) {
        if (!(maxCascade > 0)) {
            throw new IllegalArgumentException("maxCascade must be positive: " + maxCascade);
        }
        if (numBins < 1) {
            throw new IllegalArgumentException("numBins must be positive: " + numBins);
        }
        this.maxCascade = maxCascade;
        this.numBins = numBins;
        this.binCutoffs = linspace(maxCascade, numBins);
        this.binCounts = new long[numBins];
    }

    /**
     * Appends the grid's current mean height to the average series.
     *
     * @param grid The grid to measure.
     */
    public void recordAverage(Grid grid) {
        averageSeries.add(grid.meanHeight());
    }

    /**
     * Counts an avalanche in the bin that contains its size, or discards it if the size
     * is at or beyond {@code maxCascade}.
     *
     * @param size The avalanche size of a completed drop.
     */
    public void recordAvalanche(int size) {
        OptionalInt bin = binIndexFor(size);
        if (bin.isPresent()) {
            binCounts[bin.getAsInt()]++;
            recordedCount++;
        } else {
            discardedCount++;
            LOG.debug("Avalanche of size {} is outside the histogram domain [0, {})", size, maxCascade);
        }
    }

    /**
     * Finds the bin for an avalanche size.
     *
     * @param size A non-negative avalanche size.
     * @return The bin index, or empty if no cutoff exceeds the size.
     */
    public OptionalInt binIndexFor(int size) {
        for (int i = 0; i < binCutoffs.length; i++) {
            if (binCutoffs[i] > size) {
                return i == 0 ? OptionalInt.empty() : OptionalInt.of(i - 1);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Rescales the bin counts for plotting: {@code log10(count + 1)} divided by its maximum.
     * This is a presentation transform and does not touch the stored counts.
     *
     * @return Values in {@code [0, 1]}, all zero while nothing has been binned.
     */
    public double[] relativeLogCounts() {
        return relativeLogCounts(binCounts);
    }

    /**
     * Applies the plotting transform of {@link #relativeLogCounts()} to arbitrary counts.
     *
     * @param counts Bin counts, e.g. from a snapshot.
     * @return A new array of values in {@code [0, 1]}.
     */
    public static double[] relativeLogCounts(long[] counts) {
        double[] result = new double[counts.length];
        double max = 0.0;
        for (int i = 0; i < counts.length; i++) {
            result[i] = Math.log10(counts[i] + 1.0);
            max = Math.max(max, result[i]);
        }
        if (max > 0.0) {
            for (int i = 0; i < counts.length; i++) {
                result[i] /= max;
            }
        }
        return result;
    }

    /**
     * @return A copy of the mean-height series, baseline first.
     */
    public double[] getAverageSeries() {
        return averageSeries.toDoubleArray();
    }

    /**
     * @return The most recent mean height, or {@code NaN} before the baseline was recorded.
     */
    public double getLatestAverage() {
        return averageSeries.isEmpty() ? Double.NaN : averageSeries.getDouble(averageSeries.size() - 1);
    }

    /**
     * @return A copy of the bin counts.
     */
    public long[] getBinCounts() {
        return binCounts.clone();
    }

    /**
     * @return A copy of the {@code numBins + 1} bin cutoffs.
     */
    public double[] getBinCutoffs() {
        return binCutoffs.clone();
    }

    public int getNumBins() {
        return numBins;
    }

    public double getMaxCascade() {
        return maxCascade;
    }

    /**
     * @return The number of avalanches that landed in a bin.
     */
    public long getRecordedCount() {
        return recordedCount;
    }

    /**
     * @return The number of avalanches that were too large for the histogram.
     */
    public long getDiscardedCount() {
        return discardedCount;
    }

    private static double[] linspace(double stop, int intervals) {
        double[] cutoffs = new double[intervals + 1];
        double step = stop / intervals;
        for (int i = 0; i < intervals; i++) {
            cutoffs[i] = i * step;
        }
        cutoffs[intervals] = stop;
        return cutoffs;
    }

    @Override
    public String toString() {
        return "CascadeStatistics[bins=" + Arrays.toString(binCounts) + ", discarded=" + discardedCount + "]";
    }
}
