package org.agentville.runtime.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A subject-centered fact attached to a tile, e.g.
 * {@code ("Isabella Rodriguez", "is", "brewing coffee", "brewing coffee at the cafe")}.
 * <p>
 * Equality is structural over all four fields: the event set of a tile treats two events as the
 * same only if subject, predicate, object and description all match. Absent fields are stored as
 * {@code null}; use the {@code Optional} accessors when reading them.
 * <p>
 * An <em>idle</em> event carries only a subject.
 *
 * @param subject The address or name of the entity the fact is about. Never null.
 * @param predicate The predicate, or null if absent.
 * @param object The object, or null if absent.
 * @param description A free-text description, or null if absent.
 */
public record Event(String subject, String predicate, String object, String description) {

    public Event {
        Objects.requireNonNull(subject, "subject");
    }

    /**
     * Creates the idle event of a subject.
     *
     * @param subject The subject.
     * @return An event with only the subject set.
     */
    public static Event idle(String subject) {
        return new Event(subject, null, null, null);
    }

    /**
     * @return {@code true} if predicate, object and description are all absent.
     */
    public boolean isIdle() {
        return predicate == null && object == null && description == null;
    }

    /**
     * @return The idle variant of this event (same subject, all other fields cleared).
     */
    public Event toIdle() {
        return isIdle() ? this : idle(subject);
    }

    public Optional<String> predicateValue() {
        return Optional.ofNullable(predicate);
    }

    public Optional<String> objectValue() {
        return Optional.ofNullable(object);
    }

    public Optional<String> descriptionValue() {
        return Optional.ofNullable(description);
    }
}
