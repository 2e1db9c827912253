package org.agentville.runtime.memory;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.agentville.runtime.model.Event;

/**
 * One entry of an agent's {@link AssociativeMemory}.
 *
 * @param id Node id, {@code "node_<nodeCount>"}.
 * @param nodeCount 1-based position among all nodes.
 * @param typeCount 1-based position among nodes of the same type.
 * @param type Event, chat or thought.
 * @param depth 0 for events and chats; for thoughts one more than the deepest evidence node.
 * @param created Creation time (simulation clock).
 * @param expiration Expiration time, or null if the node never expires.
 * @param subject Subject of the underlying triple.
 * @param predicate Predicate of the underlying triple.
 * @param object Object of the underlying triple.
 * @param description Natural-language description.
 * @param embeddingKey Key of the description's embedding in the reasoning service.
 * @param poignancy Importance score assigned by the reasoning service.
 * @param keywords Lower-cased keywords the node is indexed under, in insertion order.
 * @param filling Ids of evidence nodes (thoughts) or chat lines (chats).
 */
public record MemoryNode(
    String id,
    int nodeCount,
    int typeCount,
    Type type,
    int depth,
    LocalDateTime created,
    LocalDateTime expiration,
    String subject,
    String predicate,
    String object,
    String description,
    String embeddingKey,
    int poignancy,
    Set<String> keywords,
    List<String> filling
) {

    public MemoryNode {
        keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        filling = List.copyOf(filling);
    }

    /**
     * Kind of a memory node; {@link #key()} is its name on disk.
     */
    public enum Type {
        EVENT("event"),
        CHAT("chat"),
        THOUGHT("thought");

        private final String key;

        Type(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        public static Type fromKey(String key) {
            for (Type t : values()) {
                if (t.key.equals(key)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown memory node type: " + key);
        }
    }

    /**
     * @return The node's subject/predicate/object triple as a tile event (without description).
     */
    public Event toTriple() {
        return new Event(subject, predicate, object, null);
    }
}
