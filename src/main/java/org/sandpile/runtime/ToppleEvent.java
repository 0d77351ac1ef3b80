package org.sandpile.runtime;

import org.sandpile.runtime.model.Cell;

/**
 * One toppling occurrence within a drop.
 *
 * @param cell The cell that toppled.
 * @param wave The zero-based wave in which it toppled; wave 0 holds only the initiating cell.
 */
public record ToppleEvent(Cell cell, int wave) {
}
