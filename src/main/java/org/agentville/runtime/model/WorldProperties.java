package org.agentville.runtime.model;

/**
 * Static grid metadata that can be shared with other components without exposing the tiles.
 *
 * @param width Number of columns.
 * @param height Number of rows.
 * @param tileSize Edge length of a square tile in pixels.
 * @param specialConstraint Implementation-defined value passed through unexamined.
 */
public record WorldProperties(int width, int height, int tileSize, String specialConstraint) {

    public WorldProperties {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                "World dimensions must be positive, got " + width + "x" + height);
        }
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive, got " + tileSize);
        }
        long cells = (long) width * height;
        if (cells > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                "World too large: " + cells + " cells exceeds Integer.MAX_VALUE. Size: " + width + "x" + height);
        }
        specialConstraint = specialConstraint == null ? "" : specialConstraint;
    }

    /**
     * @return {@code width * height}.
     */
    public int cellCount() {
        return width * height;
    }

    /**
     * @param coord A coordinate.
     * @return {@code true} if the coordinate lies inside {@code [0,width) x [0,height)}.
     */
    public boolean contains(TileCoord coord) {
        return coord.x() >= 0 && coord.x() < width && coord.y() >= 0 && coord.y() < height;
    }
}
