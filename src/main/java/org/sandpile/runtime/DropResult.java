package org.sandpile.runtime;

import org.sandpile.runtime.model.Cell;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of a single grain drop.
 *
 * @param origin The cell that received the grain.
 * @param avalancheSize The cascade size recorded for the drop: 0 if the grid stayed stable,
 *                      otherwise 1 for the initiating instability plus 1 per toppling occurrence.
 * @param toppledCounts Per-cell counts for this drop, in order of first appearance. The
 *                      initiating cell is counted for its instability and again for its toppling.
 * @param trace Every toppling occurrence in processing order.
 * @param waveCount The number of waves processed; 0 if nothing toppled.
 */
public record DropResult(
        Cell origin,
        int avalancheSize,
        Map<Cell, Integer> toppledCounts,
        List<ToppleEvent> trace,
        int waveCount
) {

    public DropResult {
        toppledCounts = Collections.unmodifiableMap(new LinkedHashMap<>(toppledCounts));
        trace = List.copyOf(trace);
    }

    /**
     * Creates the result of a drop that left the grid stable.
     *
     * @param origin The cell that received the grain.
     * @return A result with size 0 and no topplings.
     */
    public static DropResult stable(Cell origin) {
        return new DropResult(origin, 0, Map.of(), List.of(), 0);
    }

    /**
     * Returns the number of toppling occurrences, counting repeats of the same cell.
     *
     * @return The length of the trace.
     */
    public int toppleCount() {
        return trace.size();
    }

    /**
     * Checks whether the drop caused any toppling.
     *
     * @return true if at least one cell toppled.
     */
    public boolean toppled() {
        return avalancheSize > 0;
    }
}
