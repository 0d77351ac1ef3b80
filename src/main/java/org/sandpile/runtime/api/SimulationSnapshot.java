package org.sandpile.runtime.api;

import java.util.Arrays;

/**
 * An immutable view of a simulation at one moment, handed to observers.
 * <p>
 * All arrays are private copies taken when the snapshot was built; changing them does not
 * affect the simulation, and later simulation steps do not change them.
 *
 * @param phase What just happened when the snapshot was taken.
 * @param dropsCompleted Number of drops fully relaxed so far.
 * @param heights Grid heights indexed {@code [x][y]}, values in {@code [0, threshold]} between steps.
 * @param toppledCounts Per-drop toppled counts indexed {@code [x][y]}, all zero at the start of a drop.
 * @param averageSeries Mean heights, baseline first.
 * @param binCounts Avalanche histogram counts.
 * @param binCutoffs The {@code binCounts.length + 1} histogram cutoffs.
 */
public record SimulationSnapshot(
        Phase phase,
        long dropsCompleted,
        int[][] heights,
        int[][] toppledCounts,
        double[] averageSeries,
        long[] binCounts,
        double[] binCutoffs
) {

    /**
     * The step after which a snapshot was taken.
     */
    public enum Phase {
        /** Before the first drop. */
        INITIAL,
        /** A grain was added, nothing toppled yet. */
        DEPOSIT,
        /** A single cell toppled. */
        TOPPLE,
        /** The drop is relaxed and the statistics are updated. */
        DROP_COMPLETED
    }

    public SimulationSnapshot {
        heights = deepCopy(heights);
        toppledCounts = deepCopy(toppledCounts);
        averageSeries = averageSeries.clone();
        binCounts = binCounts.clone();
        binCutoffs = binCutoffs.clone();
    }

    /**
     * @return The edge length of the grid.
     */
    public int gridSize() {
        return heights.length;
    }

    @Override
    public int[][] heights() {
        return deepCopy(heights);
    }

    @Override
    public int[][] toppledCounts() {
        return deepCopy(toppledCounts);
    }

    @Override
    public double[] averageSeries() {
        return averageSeries.clone();
    }

    @Override
    public long[] binCounts() {
        return binCounts.clone();
    }

    @Override
    public double[] binCutoffs() {
        return binCutoffs.clone();
    }

    /**
     * Reads a single height without copying the grid.
     *
     * @param x The first coordinate.
     * @param y The second coordinate.
     * @return The height.
     */
    public int heightAt(int x, int y) {
        return heights[x][y];
    }

    /**
     * Reads a single toppled count without copying the grid.
     *
     * @param x The first coordinate.
     * @param y The second coordinate.
     * @return The count for the current drop.
     */
    public int toppledCountAt(int x, int y) {
        return toppledCounts[x][y];
    }

    private static int[][] deepCopy(int[][] source) {
        int[][] copy = new int[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationSnapshot other)) return false;
        return phase == other.phase
                && dropsCompleted == other.dropsCompleted
                && Arrays.deepEquals(heights, other.heights)
                && Arrays.deepEquals(toppledCounts, other.toppledCounts)
                && Arrays.equals(averageSeries, other.averageSeries)
                && Arrays.equals(binCounts, other.binCounts)
                && Arrays.equals(binCutoffs, other.binCutoffs);
    }

    @Override
    public int hashCode() {
        int result = phase.hashCode();
        result = 31 * result + Long.hashCode(dropsCompleted);
        result = 31 * result + Arrays.deepHashCode(heights);
        result = 31 * result + Arrays.hashCode(binCounts);
        return result;
    }

    @Override
    public String toString() {
        return "SimulationSnapshot[phase=" + phase + ", dropsCompleted=" + dropsCompleted
                + ", gridSize=" + heights.length + ", binCounts=" + Arrays.toString(binCounts) + "]";
    }
}
