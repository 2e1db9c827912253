package org.agentville.runtime.model;

/**
 * Granularity of a hierarchical address {@code world:sector:arena:object}.
 */
public enum AddressLevel {
    WORLD(1),
    SECTOR(2),
    ARENA(3),
    OBJECT(4);

    private final int segments;

    AddressLevel(int segments) {
        this.segments = segments;
    }

    /**
     * @return The number of colon-separated segments an address of this level has.
     */
    public int segments() {
        return segments;
    }
}
