package org.agentville.runtime.model;

/**
 * A discrete grid coordinate. {@code x} is the column, {@code y} the row.
 *
 * @param x The column index.
 * @param y The row index.
 */
public record TileCoord(int x, int y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
