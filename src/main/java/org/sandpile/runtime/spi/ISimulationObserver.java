package org.sandpile.runtime.spi;

import org.sandpile.runtime.DropResult;
import org.sandpile.runtime.api.SimulationSnapshot;

/**
 * Consumes the state a {@link org.sandpile.runtime.Simulation} publishes while it runs.
 * Renderers, frame recorders and summary writers implement this interface.
 * <p>
 * Callbacks run synchronously on the simulation thread. Snapshots are copies, so observers
 * may keep them. An exception thrown by an observer aborts the run.
 */
public interface ISimulationObserver {

    /**
     * Called once before the first drop, after the baseline average was recorded.
     *
     * @param snapshot The initial state.
     */
    default void onRunStarted(SimulationSnapshot snapshot) {}

    /**
     * Called for every per-event frame: after each deposit, after each toppling and once after
     * each completed drop. Only called when display or frame persistence is enabled.
     *
     * @param frameIndex Zero-based frame number, increasing by one per frame across the run.
     * @param snapshot The state after the event.
     */
    default void onFrame(long frameIndex, SimulationSnapshot snapshot) {}

    /**
     * Called after every drop, once its statistics are recorded. Called in every mode.
     *
     * @param snapshot The state after the drop.
     * @param result The outcome of the drop.
     */
    default void onDropCompleted(SimulationSnapshot snapshot, DropResult result) {}

    /**
     * Called once after the last drop.
     *
     * @param snapshot The final state.
     */
    default void onRunCompleted(SimulationSnapshot snapshot) {}
}
