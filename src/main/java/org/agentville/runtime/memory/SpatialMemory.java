package org.agentville.runtime.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.agentville.runtime.model.Address;
import org.agentville.runtime.model.AddressLevel;
import org.agentville.runtime.model.Tile;

/**
 * The places an agent knows about, as a tree {@code world -> sector -> arena -> game objects}.
 * <p>
 * The tree only grows: {@link #learn(Tile)} adds the missing segments of a tile's address.
 * Insertion order is preserved.
 */
public class SpatialMemory {

    private final Map<String, Map<String, Map<String, List<String>>>> tree = new LinkedHashMap<>();

    /**
     * @param world The world name.
     * @return The sectors known in that world, empty if the world is unknown.
     */
    public List<String> getAccessibleSectors(String world) {
        Map<String, Map<String, List<String>>> sectors = tree.get(world);
        return sectors == null ? List.of() : List.copyOf(sectors.keySet());
    }

    /**
     * @param sectorAddress A {@code world:sector} address.
     * @return The arenas known in that sector, empty if the sector is unknown.
     */
    public List<String> getAccessibleArenas(String sectorAddress) {
        String[] parts = split(sectorAddress, AddressLevel.SECTOR);
        Map<String, List<String>> arenas = tree.getOrDefault(parts[0], Map.of()).get(parts[1]);
        return arenas == null ? List.of() : List.copyOf(arenas.keySet());
    }

    /**
     * @param arenaAddress A {@code world:sector:arena} address.
     * @return The game objects known in that arena, empty if the arena is unknown.
     */
    public List<String> getAccessibleGameObjects(String arenaAddress) {
        String[] parts = split(arenaAddress, AddressLevel.ARENA);
        List<String> objects = tree.getOrDefault(parts[0], Map.of())
            .getOrDefault(parts[1], Map.of())
            .get(parts[2]);
        return objects == null ? List.of() : List.copyOf(objects);
    }

    /**
     * Records the address of a perceived tile. Only non-empty levels are added, and a level is
     * only added below a known parent.
     *
     * @param tile The tile.
     */
    public void learn(Tile tile) {
        learn(tile.getWorld(), tile.getSector(), tile.getArena(), tile.getGameObject());
    }

    /**
     * Records an address given as its four segments; see {@link #learn(Tile)}.
     */
    public void learn(String world, String sector, String arena, String gameObject) {
        if (world.isEmpty()) {
            return;
        }
        Map<String, Map<String, List<String>>> sectors = tree.computeIfAbsent(world, k -> new LinkedHashMap<>());
        if (sector.isEmpty()) {
            return;
        }
        Map<String, List<String>> arenas = sectors.computeIfAbsent(sector, k -> new LinkedHashMap<>());
        if (arena.isEmpty()) {
            return;
        }
        List<String> objects = arenas.computeIfAbsent(arena, k -> new ArrayList<>());
        if (!gameObject.isEmpty() && !objects.contains(gameObject)) {
            objects.add(gameObject);
        }
    }

    /**
     * @return A read-only view of the whole tree.
     */
    public Map<String, Map<String, Map<String, List<String>>>> getTree() {
        return Collections.unmodifiableMap(tree);
    }

    private static String[] split(String address, AddressLevel level) {
        String[] parts = address.split(Address.SEPARATOR, -1);
        if (parts.length < level.segments()) {
            throw new IllegalArgumentException(
                "Address '" + address + "' needs at least " + level.segments() + " segments");
        }
        return parts;
    }
}
