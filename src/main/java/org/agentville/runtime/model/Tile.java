package org.agentville.runtime.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single grid cell with its semantic address layers, collision flag and event set.
 * <p>
 * All fields except the event set are fixed when the {@link WorldGrid} is loaded. Events are
 * mutated only through {@link WorldGrid}; the view returned by {@link #getEvents()} is
 * read-only.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. At most one writer per tile at a time.
 */
public final class Tile {
    private final String world;
    private final String sector;
    private final String arena;
    private final String gameObject;
    private final String spawningLocation;
    private final boolean collision;
    private final Set<Event> events = new LinkedHashSet<>();

    Tile(String world, String sector, String arena, String gameObject, String spawningLocation, boolean collision) {
        this.world = world;
        this.sector = sector;
        this.arena = arena;
        this.gameObject = gameObject;
        this.spawningLocation = spawningLocation;
        this.collision = collision;
        if (!gameObject.isEmpty()) {
            events.add(Event.idle(getAddress(AddressLevel.OBJECT)));
        }
    }

    public String getWorld() {
        return world;
    }

    public String getSector() {
        return sector;
    }

    public String getArena() {
        return arena;
    }

    public String getGameObject() {
        return gameObject;
    }

    public String getSpawningLocation() {
        return spawningLocation;
    }

    public boolean isCollision() {
        return collision;
    }

    /**
     * @return A read-only view of the events currently on this tile.
     */
    public Set<Event> getEvents() {
        return Collections.unmodifiableSet(events);
    }

    /**
     * Returns this tile's address truncated at the given level. Empty intermediate segments are
     * kept, e.g. {@code "Town::"} for a tile without sector and arena at level {@code ARENA}.
     *
     * @param level The granularity.
     * @return The colon-joined address.
     */
    public String getAddress(AddressLevel level) {
        return Address.of(level, world, sector, arena, gameObject);
    }

    boolean addEvent(Event event) {
        return events.add(event);
    }

    boolean removeEvent(Event event) {
        return events.remove(event);
    }

    boolean idleEvent(Event event) {
        if (!events.remove(event)) {
            return false;
        }
        events.add(event.toIdle());
        return true;
    }

    int removeSubjectEvents(String subject) {
        int before = events.size();
        events.removeIf(e -> e.subject().equals(subject));
        return before - events.size();
    }

    @Override
    public String toString() {
        return "Tile{" + getAddress(AddressLevel.OBJECT)
                + (spawningLocation.isEmpty() ? "" : ", spawn=" + spawningLocation)
                + (collision ? ", collision" : "")
                + ", events=" + events.size() + "}";
    }
}
