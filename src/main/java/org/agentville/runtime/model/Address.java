package org.agentville.runtime.model;

/**
 * Helpers for hierarchical colon-delimited addresses ({@code world:sector:arena:object}) and
 * for the spawn-location key namespace.
 * <p>
 * Spawn-location keys start with {@value #SPAWN_PREFIX}. A normal address begins with the world
 * name and therefore never collides with a spawn key.
 */
public final class Address {

    /** Separator between address segments. */
    public static final String SEPARATOR = ":";

    /** Prefix of the spawn-location namespace in the reverse index. */
    public static final String SPAWN_PREFIX = "<spawn_loc>";

    private Address() {
        // Utility class - no instantiation
    }

    /**
     * Joins the given segments with {@value #SEPARATOR}. Empty segments are kept, so
     * {@code join("Town", "", "bench")} yields {@code "Town::bench"}.
     *
     * @param segments The address segments, outermost first.
     * @return The joined address.
     */
    public static String join(String... segments) {
        return String.join(SEPARATOR, segments);
    }

    /**
     * Truncates the four tile segments to the requested level and joins them.
     */
    static String of(AddressLevel level, String world, String sector, String arena, String gameObject) {
        return switch (level) {
            case WORLD -> world;
            case SECTOR -> join(world, sector);
            case ARENA -> join(world, sector, arena);
            case OBJECT -> join(world, sector, arena, gameObject);
        };
    }

    /**
     * Returns the reverse-index key of a spawn location.
     *
     * @param spawningLocation The spawn-location name as found in the block table.
     * @return The key in the spawn namespace.
     */
    public static String spawnLocation(String spawningLocation) {
        return SPAWN_PREFIX + spawningLocation;
    }

    /**
     * @param key A reverse-index key.
     * @return {@code true} if the key lives in the spawn-location namespace.
     */
    public static boolean isSpawnLocation(String key) {
        return key.startsWith(SPAWN_PREFIX);
    }
}
