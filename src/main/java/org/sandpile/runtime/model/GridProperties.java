package org.sandpile.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.sandpile.runtime.Config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents the shape of a sandpile lattice without the height data.
 * This class provides the coordinate calculations and the neighbor policy so they can be
 * shared between the {@link Grid}, the renderers and the run summary without duplicating
 * the coordinate logic.
 * <p>
 * Boundaries are dissipative: a neighbor that falls outside {@code [0, gridSize)} on either
 * axis does not exist, so grains pushed across an edge are lost.
 */
public class GridProperties {
    private final int gridSize;
    private final int toppleThreshold;

    /**
     * Creates new grid properties with the model's fixed toppling threshold.
     *
     * @param gridSize The edge length of the square lattice, must be at least 1.
     */
    public GridProperties(int gridSize) {
        this(gridSize, Config.TOPPLE_THRESHOLD);
    }

    @JsonCreator
    GridProperties(@JsonProperty("gridSize") int gridSize, @JsonProperty("toppleThreshold") int toppleThreshold) {
        if (gridSize < 1) {
            throw new IllegalArgumentException("Grid size must be at least 1: " + gridSize);
        }
        this.gridSize = gridSize;
        this.toppleThreshold = toppleThreshold;
    }

    /**
     * Gets the edge length of the lattice.
     *
     * @return The grid size
     */
    @JsonProperty("gridSize")
    public int getGridSize() {
        return gridSize;
    }

    /**
     * Gets the height at which a cell topples.
     *
     * @return The toppling threshold
     */
    @JsonProperty("toppleThreshold")
    public int getToppleThreshold() {
        return toppleThreshold;
    }

    /**
     * Gets the number of cells in the lattice.
     *
     * @return {@code gridSize * gridSize}
     */
    @JsonIgnore
    public int getCellCount() {
        return gridSize * gridSize;
    }

    /**
     * Checks whether a coordinate lies on the lattice.
     *
     * @param x The first coordinate
     * @param y The second coordinate
     * @return true if both coordinates are in {@code [0, gridSize)}
     */
    public boolean isInBounds(int x, int y) {
        return x >= 0 && x < gridSize && y >= 0 && y < gridSize;
    }

    /**
     * Returns the valid orthogonal neighbors of a cell.
     * <p>
     * Offsets are applied in the order {@code (-1,0), (0,-1), (0,+1), (+1,0)} and every
     * out-of-range result is dropped. The result depends only on {@code (x, y)} and the grid size.
     *
     * @param x The first coordinate of the cell
     * @param y The second coordinate of the cell
     * @return An unmodifiable list of two to four cells (none for a 1x1 grid)
     */
    public List<Cell> neighbors(int x, int y) {
        List<Cell> result = new ArrayList<>(Config.NEIGHBOR_OFFSETS.length);
        for (int[] offset : Config.NEIGHBOR_OFFSETS) {
            int nx = x + offset[0];
            int ny = y + offset[1];
            if (isInBounds(nx, ny)) {
                result.add(new Cell(nx, ny));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Converts a coordinate to its row-major flat index.
     *
     * @param x The first coordinate
     * @param y The second coordinate
     * @return {@code x * gridSize + y}
     * @throws IndexOutOfBoundsException if the coordinate is not on the lattice
     */
    public int toFlatIndex(int x, int y) {
        if (!isInBounds(x, y)) {
            throw new IndexOutOfBoundsException("Cell (" + x + "," + y + ") is outside a grid of size " + gridSize);
        }
        return x * gridSize + y;
    }

    /**
     * Converts a flat index to a cell.
     * <p>
     * This is the inverse operation of {@link #toFlatIndex(int, int)}.
     *
     * @param flatIndex The flat index to convert (must be non-negative)
     * @return The cell at that index
     * @throws IllegalArgumentException if flatIndex is negative or beyond the last cell
     */
    public Cell flatIndexToCell(int flatIndex) {
        if (flatIndex < 0) {
            throw new IllegalArgumentException("Flat index must be non-negative: " + flatIndex);
        }
        if (flatIndex >= getCellCount()) {
            throw new IllegalArgumentException("Flat index " + flatIndex + " exceeds cell count " + getCellCount());
        }
        return new Cell(flatIndex / gridSize, flatIndex % gridSize);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridProperties other)) return false;
        return gridSize == other.gridSize && toppleThreshold == other.toppleThreshold;
    }

    @Override
    public int hashCode() {
        return 31 * gridSize + toppleThreshold;
    }

    @Override
    public String toString() {
        return "GridProperties[gridSize=" + gridSize + ", toppleThreshold=" + toppleThreshold + "]";
    }
}
