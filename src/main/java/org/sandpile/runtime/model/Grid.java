package org.sandpile.runtime.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.sandpile.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Represents the sandpile lattice, holding one non-negative height per cell.
 * <p>
 * Heights are stored in a flat row-major array. Between drops every height is below the
 * toppling threshold; while a cascade is in progress cells may transiently exceed it.
 * The grid is mutated only by the {@link org.sandpile.runtime.ToppleEngine}.
 */
public class Grid {
    private final int size;
    private final int threshold;
    private final int[] heights;

    /**
     * Grid properties that can be shared with other components.
     */
    public final GridProperties properties;

    /**
     * Creates an all-zero grid.
     *
     * @param properties The lattice shape.
     */
    public Grid(GridProperties properties) {
        this.properties = properties;
        this.size = properties.getGridSize();
        this.threshold = properties.getToppleThreshold();
        this.heights = new int[properties.getCellCount()];
    }

    /**
     * Creates a grid with every cell set to a uniform random height in {@code [0, threshold)}.
     *
     * @param properties The lattice shape.
     * @param random The source of randomness.
     * @return The initialized grid.
     */
    public static Grid randomized(GridProperties properties, IRandomProvider random) {
        Grid grid = new Grid(properties);
        for (int i = 0; i < grid.heights.length; i++) {
            grid.heights[i] = random.nextInt(grid.threshold);
        }
        return grid;
    }

    /**
     * Creates a grid from explicit heights, indexed {@code heights[x][y]}.
     *
     * @param heights A square array of non-negative heights.
     * @return The grid.
     * @throws IllegalArgumentException if the array is empty, not square or holds negative values.
     */
    public static Grid of(int[][] heights) {
        if (heights.length == 0) {
            throw new IllegalArgumentException("Heights must contain at least one row.");
        }
        Grid grid = new Grid(new GridProperties(heights.length));
        for (int x = 0; x < heights.length; x++) {
            if (heights[x].length != heights.length) {
                throw new IllegalArgumentException("Heights must be square; row " + x + " has length " + heights[x].length);
            }
            for (int y = 0; y < heights.length; y++) {
                if (heights[x][y] < 0) {
                    throw new IllegalArgumentException("Height at (" + x + "," + y + ") is negative: " + heights[x][y]);
                }
                grid.heights[x * grid.size + y] = heights[x][y];
            }
        }
        return grid;
    }

    /**
     * Gets the edge length of the lattice.
     * @return The grid size.
     */
    public int getSize() {
        return size;
    }

    /**
     * Gets the height of a cell.
     * @param x The first coordinate.
     * @param y The second coordinate.
     * @return The current height.
     */
    public int getHeight(int x, int y) {
        return heights[properties.toFlatIndex(x, y)];
    }

    /**
     * Adds grains to a cell. The coordinate is expected to be on the lattice.
     * @param x The first coordinate.
     * @param y The second coordinate.
     * @param amount The number of grains to add.
     */
    public void deposit(int x, int y, int amount) {
        heights[properties.toFlatIndex(x, y)] += amount;
    }

    /**
     * Resets a cell to zero, regardless of its current height.
     * @param x The first coordinate.
     * @param y The second coordinate.
     */
    public void topple(int x, int y) {
        heights[properties.toFlatIndex(x, y)] = 0;
    }

    /**
     * Checks whether a cell has reached the toppling threshold.
     * @param x The first coordinate.
     * @param y The second coordinate.
     * @return true if the height is at least the threshold.
     */
    public boolean isUnstable(int x, int y) {
        return heights[properties.toFlatIndex(x, y)] >= threshold;
    }

    /**
     * Returns the valid orthogonal neighbors of a cell.
     * @param x The first coordinate.
     * @param y The second coordinate.
     * @return The neighbors, see {@link GridProperties#neighbors(int, int)}.
     */
    public List<Cell> neighbors(int x, int y) {
        return properties.neighbors(x, y);
    }

    /**
     * Scans the whole grid for unstable cells.
     * <p>
     * Cells are returned in row-major order ({@code x} outer, {@code y} inner), which fixes the
     * processing order of the next topple wave.
     *
     * @return The flat indices of all unstable cells, in ascending order.
     */
    public IntList unstableIndices() {
        IntList result = new IntArrayList();
        for (int i = 0; i < heights.length; i++) {
            if (heights[i] >= threshold) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * Scans the whole grid for unstable cells.
     * @return The unstable cells in row-major order, possibly empty.
     */
    public List<Cell> unstableCells() {
        IntList indices = unstableIndices();
        List<Cell> cells = new ArrayList<>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            cells.add(properties.flatIndexToCell(indices.getInt(i)));
        }
        return cells;
    }

    /**
     * Checks that no cell has reached the threshold.
     * @return true if the grid is stable.
     */
    public boolean isStable() {
        for (int h : heights) {
            if (h >= threshold) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sums all heights.
     * @return The total number of grains on the grid.
     */
    public long totalMass() {
        long sum = 0;
        for (int h : heights) {
            sum += h;
        }
        return sum;
    }

    /**
     * Computes the mean cell height.
     * @return {@code totalMass() / cellCount}.
     */
    public double meanHeight() {
        return (double) totalMass() / heights.length;
    }

    /**
     * Copies the heights into a new two-dimensional array indexed {@code [x][y]}.
     * @return A deep copy of the current heights.
     */
    public int[][] snapshot() {
        int[][] copy = new int[size][];
        for (int x = 0; x < size; x++) {
            copy[x] = Arrays.copyOfRange(heights, x * size, (x + 1) * size);
        }
        return copy;
    }

    /**
     * Gets the grid properties.
     * @return The properties.
     */
    public GridProperties getProperties() {
        return properties;
    }
}
