package org.agentville.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * The discretized 2D world: a {@code width x height} grid of {@link Tile}s with hierarchical
 * addresses, collision data, per-tile event sets, and a reverse index from address to tiles.
 * <p>
 * The grid is built once by {@link #load(WorldConfig)} and is read-mostly afterwards: only the
 * tile event sets change at runtime. The reverse index is never mutated after loading because a
 * tile's address fields are fixed.
 * <p>
 * <b>Thread safety:</b> Read queries may run concurrently. Event mutation is not synchronized;
 * the driver must guarantee at most one writer per tile at a time.
 */
public class WorldGrid {
    private static final Logger LOG = LoggerFactory.getLogger(WorldGrid.class);

    private final WorldProperties properties;
    private final String worldName;
    private final Tile[] tiles;

    // Reverse index: address (or spawn key) -> flat indices of the tiles carrying it
    private final Map<String, IntOpenHashSet> tilesByAddress;

    private WorldGrid(WorldProperties properties, String worldName, Tile[] tiles,
                      Map<String, IntOpenHashSet> tilesByAddress) {
        this.properties = properties;
        this.worldName = worldName;
        this.tiles = tiles;
        this.tilesByAddress = tilesByAddress;
    }

    // ==================== Loading ====================

    /**
     * Builds the grid and its reverse index from a configuration bundle.
     * <p>
     * For every cell, each layer's code is resolved through that layer's block table (unmapped
     * codes become empty strings). A tile with a game object starts with one idle event whose
     * subject is the object's full address. Each tile with a non-empty sector, arena, object or
     * spawning location is indexed under the address of every granularity up to that field.
     *
     * @param config The configuration bundle.
     * @return The loaded grid.
     * @throws WorldConfigException if a layer's size does not match the grid or the world name is missing.
     */
    public static WorldGrid load(WorldConfig config) {
        config.validate();
        WorldProperties props = config.properties();
        String world = config.worldName();
        int width = props.width();
        Tile[] tiles = new Tile[props.cellCount()];
        Map<String, IntOpenHashSet> index = new HashMap<>();

        for (int i = 0; i < tiles.length; i++) {
            Tile tile = new Tile(
                world,
                config.sector().resolve(i),
                config.arena().resolve(i),
                config.gameObject().resolve(i),
                config.spawningLocation().resolve(i),
                !"0".equals(config.collision().get(i).trim()));
            tiles[i] = tile;
            indexTile(index, tile, i);
        }

        LOG.info("Loaded world '{}': {}x{} tiles ({}px), {} addresses indexed",
            world, width, props.height(), props.tileSize(), index.size());
        return new WorldGrid(props, world, tiles, index);
    }

    private static void indexTile(Map<String, IntOpenHashSet> index, Tile tile, int flatIndex) {
        if (!tile.getSector().isEmpty()) {
            index.computeIfAbsent(tile.getAddress(AddressLevel.SECTOR), k -> new IntOpenHashSet()).add(flatIndex);
        }
        if (!tile.getArena().isEmpty()) {
            index.computeIfAbsent(tile.getAddress(AddressLevel.ARENA), k -> new IntOpenHashSet()).add(flatIndex);
        }
        if (!tile.getGameObject().isEmpty()) {
            index.computeIfAbsent(tile.getAddress(AddressLevel.OBJECT), k -> new IntOpenHashSet()).add(flatIndex);
        }
        if (!tile.getSpawningLocation().isEmpty()) {
            index.computeIfAbsent(Address.spawnLocation(tile.getSpawningLocation()), k -> new IntOpenHashSet())
                .add(flatIndex);
        }
    }

    // ==================== Queries ====================

    public WorldProperties getProperties() {
        return properties;
    }

    public String getWorldName() {
        return worldName;
    }

    public int getWidth() {
        return properties.width();
    }

    public int getHeight() {
        return properties.height();
    }

    public int getTileSize() {
        return properties.tileSize();
    }

    /**
     * Converts a pixel coordinate to a tile coordinate by ceiling division by the tile size,
     * independently per axis. A pixel exactly on a tile boundary maps to the boundary value, so
     * with 32px tiles both {@code 32} and {@code 33} map to column {@code 1}, and {@code 0} maps
     * to column {@code 0}. The result is not bounds-checked.
     *
     * @param pixelX Horizontal pixel coordinate.
     * @param pixelY Vertical pixel coordinate.
     * @return The tile coordinate.
     */
    public TileCoord coordinateToTile(double pixelX, double pixelY) {
        int size = properties.tileSize();
        return new TileCoord((int) Math.ceil(pixelX / size), (int) Math.ceil(pixelY / size));
    }

    /**
     * @param coord The tile coordinate.
     * @return The tile.
     * @throws TileOutOfBoundsException if the coordinate is outside the grid.
     */
    public Tile accessTile(TileCoord coord) {
        return tiles[flatIndex(coord)];
    }

    /**
     * @param coord The tile coordinate.
     * @return {@code true} if the coordinate lies inside the grid.
     */
    public boolean isInBounds(TileCoord coord) {
        return properties.contains(coord);
    }

    /**
     * Returns the address of a tile truncated at the requested level. Missing intermediate fields
     * still produce their (empty) segment.
     *
     * @param coord The tile coordinate.
     * @param level The granularity.
     * @return The colon-joined address.
     * @throws TileOutOfBoundsException if the coordinate is outside the grid.
     */
    public String addressOf(TileCoord coord, AddressLevel level) {
        return accessTile(coord).getAddress(level);
    }

    /**
     * Returns every coordinate in the square {@code [x-radius, x+radius] x [y-radius, y+radius]},
     * clipped to the grid (never wrapped). Columns vary slowest.
     *
     * @param center The center of the square; may itself lie outside the grid.
     * @param radius The vision radius, {@code >= 0}.
     * @return The coordinates, at most {@code (2*radius+1)^2} of them.
     */
    public List<TileCoord> tilesNear(TileCoord center, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must not be negative: " + radius);
        }
        // Clamp in long: center +/- radius may overflow int
        int xMin = (int) Math.max(0L, (long) center.x() - radius);
        int xMax = (int) Math.min(properties.width() - 1L, (long) center.x() + radius);
        int yMin = (int) Math.max(0L, (long) center.y() - radius);
        int yMax = (int) Math.min(properties.height() - 1L, (long) center.y() + radius);

        List<TileCoord> result = new ArrayList<>();
        for (int x = xMin; x <= xMax; x++) {
            for (int y = yMin; y <= yMax; y++) {
                result.add(new TileCoord(x, y));
            }
        }
        return result;
    }

    /**
     * Looks up the tiles indexed under an address or spawn key.
     *
     * @param address A sector, arena or object address, or a key from {@link Address#spawnLocation(String)}.
     * @return The coordinates carrying that address; empty if it was never indexed.
     */
    public Set<TileCoord> tilesForAddress(String address) {
        IntOpenHashSet indices = tilesByAddress.get(address);
        if (indices == null) {
            return Collections.emptySet();
        }
        Set<TileCoord> result = new LinkedHashSet<>(indices.size());
        for (IntIterator it = indices.iterator(); it.hasNext(); ) {
            result.add(toCoord(it.nextInt()));
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * @return All indexed addresses and spawn keys.
     */
    public Set<String> getIndexedAddresses() {
        return Collections.unmodifiableSet(tilesByAddress.keySet());
    }

    // ==================== Event mutation ====================

    /**
     * Adds an event to a tile. Idempotent: a structurally equal event is not added twice.
     *
     * @param event The event.
     * @param coord The tile coordinate.
     * @throws TileOutOfBoundsException if the coordinate is outside the grid.
     */
    public void addEvent(Event event, TileCoord coord) {
        accessTile(coord).addEvent(event);
    }

    /**
     * Removes a structurally equal event from a tile; no-op if absent.
     *
     * @param event The event.
     * @param coord The tile coordinate.
     * @throws TileOutOfBoundsException if the coordinate is outside the grid.
     */
    public void removeEvent(Event event, TileCoord coord) {
        accessTile(coord).removeEvent(event);
    }

    /**
     * Replaces a structurally equal event with its idle variant; no-op if absent. Idling an event
     * that already is idle leaves the set unchanged.
     *
     * @param event The event.
     * @param coord The tile coordinate.
     * @throws TileOutOfBoundsException if the coordinate is outside the grid.
     */
    public void idleEvent(Event event, TileCoord coord) {
        accessTile(coord).idleEvent(event);
    }

    /**
     * Removes every event of a tile whose subject equals {@code subject}, regardless of the other
     * fields. Events of other subjects are untouched.
     *
     * @param subject The subject.
     * @param coord The tile coordinate.
     * @throws TileOutOfBoundsException if the coordinate is outside the grid.
     */
    public void removeSubjectEvents(String subject, TileCoord coord) {
        int removed = accessTile(coord).removeSubjectEvents(subject);
        if (removed > 0 && LOG.isDebugEnabled()) {
            LOG.debug("Removed {} events of '{}' from tile {}", removed, subject, coord);
        }
    }

    // ==================== Internals ====================

    private int flatIndex(TileCoord coord) {
        if (!properties.contains(coord)) {
            throw new TileOutOfBoundsException(coord, properties.width(), properties.height());
        }
        return coord.y() * properties.width() + coord.x();
    }

    private TileCoord toCoord(int flatIndex) {
        return new TileCoord(flatIndex % properties.width(), flatIndex / properties.width());
    }
}
