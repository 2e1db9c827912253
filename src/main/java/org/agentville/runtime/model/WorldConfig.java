package org.agentville.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * The complete configuration bundle a {@link WorldGrid} is loaded from.
 * <p>
 * Built explicitly by the caller (for instance by
 * {@link org.agentville.runtime.worldconfig.WorldConfigLoader}); there is no ambient
 * configuration state.
 *
 * @param properties Grid metadata.
 * @param worldName The single global world name, the first segment of every address.
 * @param collision Row-major collision codes; any code other than {@code "0"} blocks the tile.
 * @param sector Sector layer.
 * @param arena Arena layer.
 * @param gameObject Game-object layer.
 * @param spawningLocation Spawning-location layer.
 */
public record WorldConfig(
    WorldProperties properties,
    String worldName,
    List<String> collision,
    WorldLayer sector,
    WorldLayer arena,
    WorldLayer gameObject,
    WorldLayer spawningLocation
) {

    /** Layer name of the collision codes in error messages. */
    public static final String COLLISION_LAYER = "collision";

    public WorldConfig {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(collision, "collision");
        Objects.requireNonNull(sector, "sector");
        Objects.requireNonNull(arena, "arena");
        Objects.requireNonNull(gameObject, "gameObject");
        Objects.requireNonNull(spawningLocation, "spawningLocation");
        collision = List.copyOf(collision);
    }

    /**
     * Checks that the world name is present and that every layer has exactly
     * {@code width * height} cells.
     *
     * @throws WorldConfigException naming the first inconsistent layer.
     */
    public void validate() {
        if (worldName == null || worldName.isBlank()) {
            throw new WorldConfigException("World name is missing");
        }
        checkSize(COLLISION_LAYER, collision.size());
        for (WorldLayer layer : List.of(sector, arena, gameObject, spawningLocation)) {
            checkSize(layer.name(), layer.codes().size());
        }
    }

    private void checkSize(String layer, int actual) {
        int expected = properties.cellCount();
        if (actual != expected) {
            throw new WorldConfigException(String.format(
                "Layer '%s' has %d cells but the %dx%d grid needs %d",
                layer, actual, properties.width(), properties.height(), expected));
        }
    }
}
