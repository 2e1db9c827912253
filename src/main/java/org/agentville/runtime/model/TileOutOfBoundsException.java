package org.agentville.runtime.model;

/**
 * Thrown when a tile coordinate lies outside the grid. This is a programmer error: coordinates
 * are never clamped or wrapped.
 */
public class TileOutOfBoundsException extends IndexOutOfBoundsException {

    private final transient TileCoord coord;

    /**
     * @param coord The offending coordinate.
     * @param width The grid width.
     * @param height The grid height.
     */
    public TileOutOfBoundsException(TileCoord coord, int width, int height) {
        super("Tile " + coord + " is outside the " + width + "x" + height + " grid");
        this.coord = coord;
    }

    public TileCoord getCoord() {
        return coord;
    }
}
