package org.sandpile.runtime.model;

/**
 * A lattice coordinate. Used as the element type of topple batches and as the key
 * of per-drop toppled-count maps.
 *
 * @param x The first (row) coordinate.
 * @param y The second (column) coordinate.
 */
public record Cell(int x, int y) {

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
