package org.sandpile.runtime;

import org.sandpile.runtime.model.Cell;

/**
 * Receives the individual steps of a drop while the {@link ToppleEngine} relaxes the grid.
 * Callbacks run synchronously on the engine's thread, with the grid in the state right
 * after the step; listeners must not mutate the grid.
 */
public interface ToppleListener {

    /**
     * A listener that ignores every step.
     */
    ToppleListener NONE = new ToppleListener() {};

    /**
     * Called once per drop, after the grain has been added and before any toppling.
     *
     * @param cell The cell that received the grain.
     */
    default void afterDeposit(Cell cell) {}

    /**
     * Called before each toppling occurrence, while the cell still holds its grains. The cell
     * may hold more than the threshold when earlier topplings of the same wave fed it.
     *
     * @param cell The cell about to topple.
     */
    default void beforeTopple(Cell cell) {}

    /**
     * Called after each toppling occurrence, once the toppled cell is zeroed and its
     * neighbors have received their grains.
     *
     * @param event The toppling that just happened.
     */
    default void afterTopple(ToppleEvent event) {}
}
