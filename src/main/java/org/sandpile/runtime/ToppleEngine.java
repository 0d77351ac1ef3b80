package org.sandpile.runtime;

import org.sandpile.runtime.model.Cell;
import org.sandpile.runtime.model.Grid;
import org.sandpile.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Advances a sandpile by exactly one grain and relaxes it to a stable state.
 * <p>
 * Relaxation runs in waves. A wave processes a batch of unstable cells that was captured
 * before the wave started; each cell is zeroed and its neighbors are incremented in place,
 * one cell after the other, so a cell later in the batch may already have received grains
 * from earlier cells when its turn comes. It is zeroed regardless. After the batch, the whole
 * grid is rescanned and the unstable cells found become the next batch.
 * <p>
 * The engine keeps the per-drop toppled-count grid between callbacks so per-event frames can
 * show it; it is cleared at the start of every drop.
 */
public class ToppleEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ToppleEngine.class);

    private final IRandomProvider randomProvider;
    private final long maxWaves;
    private int[] toppledCountGrid = new int[0];
    private int countGridSize = 0;

    /**
     * Creates an engine without an explicit wave cap. A cap of {@code gridSize^4 + 16} waves
     * still applies per grid.
     *
     * @param randomProvider Source of drop positions.
     */
    public ToppleEngine(IRandomProvider randomProvider) {
        this(randomProvider, 0L);
    }

    /**
     * Creates an engine.
     *
     * @param randomProvider Source of drop positions.
     * @param maxWaves Maximum number of waves per drop; 0 or less selects {@code gridSize^4 + 16}.
     */
    public ToppleEngine(IRandomProvider randomProvider, long maxWaves) {
        this.randomProvider = randomProvider;
        this.maxWaves = maxWaves;
    }

    /**
     * Drops one grain on a uniformly random cell and relaxes the grid.
     *
     * @param grid The grid to mutate. Must be stable on entry.
     * @return The outcome of the drop.
     */
    public DropResult drop(Grid grid) {
        return drop(grid, ToppleListener.NONE);
    }

    /**
     * Drops one grain on a uniformly random cell and relaxes the grid, reporting every step.
     *
     * @param grid The grid to mutate. Must be stable on entry.
     * @param listener Receives the deposit and every toppling.
     * @return The outcome of the drop.
     */
    public DropResult drop(Grid grid, ToppleListener listener) {
        int x = randomProvider.nextInt(grid.getSize());
        int y = randomProvider.nextInt(grid.getSize());
        return dropAt(grid, x, y, listener);
    }

    /**
     * Drops one grain on the given cell and relaxes the grid.
     *
     * @param grid The grid to mutate.
     * @param x The first coordinate of the target cell.
     * @param y The second coordinate of the target cell.
     * @return The outcome of the drop.
     */
    public DropResult dropAt(Grid grid, int x, int y) {
        return dropAt(grid, x, y, ToppleListener.NONE);
    }

    /**
     * Drops one grain on the given cell and relaxes the grid, reporting every step.
     *
     * @param grid The grid to mutate.
     * @param x The first coordinate of the target cell.
     * @param y The second coordinate of the target cell.
     * @param listener Receives the deposit and every toppling.
     * @return The outcome of the drop.
     * @throws IllegalStateException if relaxation exceeds the wave cap.
     */
    public DropResult dropAt(Grid grid, int x, int y, ToppleListener listener) {
        resetToppledCounts(grid.getSize());

        Cell origin = new Cell(x, y);
        grid.deposit(x, y, 1);
        listener.afterDeposit(origin);

        if (!grid.isUnstable(x, y)) {
            LOG.trace("Drop at {} stayed stable", origin);
            return DropResult.stable(origin);
        }

        Map<Cell, Integer> counts = new LinkedHashMap<>();
        List<ToppleEvent> trace = new ArrayList<>();
        int avalancheSize = 1;
        countToppling(grid, origin, counts);

        long waveCap = effectiveWaveCap(grid.getSize());
        List<Cell> batch = List.of(origin);
        int wave = 0;
        while (!batch.isEmpty()) {
            if (wave >= waveCap) {
                throw new IllegalStateException("Drop at " + origin + " did not relax within " + waveCap + " waves");
            }
            for (Cell cell : batch) {
                listener.beforeTopple(cell);
                grid.topple(cell.x(), cell.y());
                countToppling(grid, cell, counts);
                avalancheSize++;
                for (Cell neighbor : grid.neighbors(cell.x(), cell.y())) {
                    grid.deposit(neighbor.x(), neighbor.y(), 1);
                }
                ToppleEvent event = new ToppleEvent(cell, wave);
                trace.add(event);
                LOG.trace("Toppled {} in wave {}", cell, wave);
                listener.afterTopple(event);
            }
            batch = grid.unstableCells();
            wave++;
        }

        return new DropResult(origin, avalancheSize, counts, trace, wave);
    }

    /**
     * Copies the toppled-count grid of the current (or last) drop.
     *
     * @param gridSize The size of the grid the caller is drawing; if no drop has been made on a
     *                 grid of that size yet, an all-zero grid is returned.
     * @return A new array indexed {@code [x][y]}.
     */
    public int[][] toppledCountSnapshot(int gridSize) {
        if (gridSize != countGridSize) {
            return new int[gridSize][gridSize];
        }
        int[][] copy = new int[countGridSize][];
        for (int x = 0; x < countGridSize; x++) {
            copy[x] = Arrays.copyOfRange(toppledCountGrid, x * countGridSize, (x + 1) * countGridSize);
        }
        return copy;
    }

    private void countToppling(Grid grid, Cell cell, Map<Cell, Integer> counts) {
        counts.merge(cell, 1, Integer::sum);
        toppledCountGrid[grid.getProperties().toFlatIndex(cell.x(), cell.y())]++;
    }

    private void resetToppledCounts(int size) {
        if (countGridSize != size) {
            toppledCountGrid = new int[size * size];
            countGridSize = size;
        } else {
            Arrays.fill(toppledCountGrid, 0);
        }
    }

    private long effectiveWaveCap(int size) {
        if (maxWaves > 0) {
            return maxWaves;
        }
        long s = size;
        return s * s * s * s + 16;
    }
}
