package org.agentville.runtime.memory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.agentville.runtime.model.Event;

/**
 * An agent's long-term memory stream: events it perceived, chats it took part in, and thoughts
 * produced by reflection.
 * <p>
 * Nodes are append-only and numbered in insertion order. Each node is indexed under its
 * lower-cased keywords, per type. Keyword strength counters record how often a keyword occurred
 * in non-idle events and thoughts; the reflector uses them to decide what to reflect on.
 * <p>
 * Ranking and embeddings are owned by the reasoning service; this class only stores and indexes.
 * <p>
 * <b>Thread safety:</b> Not thread-safe.
 */
public class AssociativeMemory {

    private static final String IDLE = "is idle";

    private final Map<String, MemoryNode> nodesById = new LinkedHashMap<>();
    private final Map<MemoryNode.Type, List<MemoryNode>> sequences = new HashMap<>();
    private final Map<MemoryNode.Type, Map<String, List<MemoryNode>>> keywordIndex = new HashMap<>();
    private final Map<String, Integer> eventKeywordStrength = new LinkedHashMap<>();
    private final Map<String, Integer> thoughtKeywordStrength = new LinkedHashMap<>();

    // Highest node and per-type counts seen so far; new ids continue after them
    private int lastNodeCount;
    private final Map<MemoryNode.Type, Integer> lastTypeCount = new EnumMap<>(MemoryNode.Type.class);

    public AssociativeMemory() {
        for (MemoryNode.Type type : MemoryNode.Type.values()) {
            sequences.put(type, new ArrayList<>());
            keywordIndex.put(type, new HashMap<>());
            lastTypeCount.put(type, 0);
        }
    }

    // ==================== Adding ====================

    public MemoryNode addEvent(LocalDateTime created, LocalDateTime expiration,
                               String subject, String predicate, String object, String description,
                               Set<String> keywords, int poignancy, String embeddingKey, List<String> filling) {
        return add(MemoryNode.Type.EVENT, 0, created, expiration, subject, predicate, object, description,
            keywords, poignancy, embeddingKey, filling);
    }

    public MemoryNode addChat(LocalDateTime created, LocalDateTime expiration,
                              String subject, String predicate, String object, String description,
                              Set<String> keywords, int poignancy, String embeddingKey, List<String> filling) {
        return add(MemoryNode.Type.CHAT, 0, created, expiration, subject, predicate, object, description,
            keywords, poignancy, embeddingKey, filling);
    }

    /**
     * Adds a thought. Its depth is one more than the deepest node in {@code filling}, or 0 if
     * the filling is empty or references no known node.
     */
    public MemoryNode addThought(LocalDateTime created, LocalDateTime expiration,
                                 String subject, String predicate, String object, String description,
                                 Set<String> keywords, int poignancy, String embeddingKey, List<String> filling) {
        int depth = 0;
        boolean hasEvidence = false;
        for (String id : filling) {
            MemoryNode evidence = nodesById.get(id);
            if (evidence != null) {
                depth = Math.max(depth, evidence.depth());
                hasEvidence = true;
            }
        }
        if (hasEvidence) {
            depth++;
        }
        return add(MemoryNode.Type.THOUGHT, depth, created, expiration, subject, predicate, object, description,
            keywords, poignancy, embeddingKey, filling);
    }

    private MemoryNode add(MemoryNode.Type type, int depth, LocalDateTime created, LocalDateTime expiration,
                           String subject, String predicate, String object, String description,
                           Set<String> keywords, int poignancy, String embeddingKey, List<String> filling) {
        int nodeCount = lastNodeCount + 1;
        int typeCount = lastTypeCount.get(type) + 1;
        Set<String> normalized = keywords.stream()
            .map(k -> k.toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        MemoryNode node = new MemoryNode("node_" + nodeCount, nodeCount, typeCount, type, depth,
            created, expiration, subject, predicate, object, description, embeddingKey, poignancy,
            normalized, filling);
        restore(node);

        if (!IDLE.equals(predicate + " " + object)) {
            Map<String, Integer> strength = switch (type) {
                case EVENT -> eventKeywordStrength;
                case THOUGHT -> thoughtKeywordStrength;
                case CHAT -> null;
            };
            if (strength != null) {
                normalized.forEach(k -> strength.merge(k, 1, Integer::sum));
            }
        }
        return node;
    }

    /**
     * Re-inserts a node read from disk without touching the keyword strengths. Numbering gaps
     * are allowed; nodes added afterwards are numbered after the highest count restored.
     */
    void restore(MemoryNode node) {
        if (nodesById.containsKey(node.id())) {
            throw new IllegalArgumentException("Duplicate memory node id: " + node.id());
        }
        nodesById.put(node.id(), node);
        sequences.get(node.type()).add(node);
        lastNodeCount = Math.max(lastNodeCount, node.nodeCount());
        lastTypeCount.merge(node.type(), node.typeCount(), Math::max);
        Map<String, List<MemoryNode>> index = keywordIndex.get(node.type());
        for (String keyword : node.keywords()) {
            index.computeIfAbsent(keyword, k -> new ArrayList<>()).add(node);
        }
    }

    void putKeywordStrengths(Map<String, Integer> events, Map<String, Integer> thoughts) {
        eventKeywordStrength.putAll(events);
        thoughtKeywordStrength.putAll(thoughts);
    }

    // ==================== Queries ====================

    /**
     * Returns the subject/predicate/object triples of the most recent events, newest first,
     * without duplicates. Perceivers use this to skip events the agent has just seen.
     *
     * @param retention How many of the latest events to consider.
     * @return The distinct triples.
     */
    public Set<Event> getSummarizedLatestEvents(int retention) {
        List<MemoryNode> events = sequences.get(MemoryNode.Type.EVENT);
        Set<Event> result = new LinkedHashSet<>();
        for (int i = events.size() - 1; i >= 0 && events.size() - i <= retention; i--) {
            result.add(events.get(i).toTriple());
        }
        return result;
    }

    /**
     * @return Events indexed under the subject, predicate or object (case-insensitive). Null
     *         terms are ignored.
     */
    public Set<MemoryNode> retrieveRelevantEvents(String subject, String predicate, String object) {
        return lookup(MemoryNode.Type.EVENT, Arrays.asList(subject, predicate, object));
    }

    /**
     * @return Thoughts indexed under the subject, predicate or object (case-insensitive).
     */
    public Set<MemoryNode> retrieveRelevantThoughts(String subject, String predicate, String object) {
        return lookup(MemoryNode.Type.THOUGHT, Arrays.asList(subject, predicate, object));
    }

    /**
     * @param partnerName The name of the other chat participant.
     * @return The most recent chat indexed under that name.
     */
    public Optional<MemoryNode> getLastChat(String partnerName) {
        List<MemoryNode> chats = keywordIndex.get(MemoryNode.Type.CHAT)
            .getOrDefault(partnerName.toLowerCase(Locale.ROOT), List.of());
        return chats.isEmpty() ? Optional.empty() : Optional.of(chats.get(chats.size() - 1));
    }

    public Optional<MemoryNode> getNode(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    /**
     * @return All nodes in insertion order.
     */
    public Collection<MemoryNode> getNodes() {
        return Collections.unmodifiableCollection(nodesById.values());
    }

    /**
     * @return Nodes of one type in insertion order.
     */
    public List<MemoryNode> getNodes(MemoryNode.Type type) {
        return Collections.unmodifiableList(sequences.get(type));
    }

    public int size() {
        return nodesById.size();
    }

    public Map<String, Integer> getEventKeywordStrength() {
        return Collections.unmodifiableMap(eventKeywordStrength);
    }

    public Map<String, Integer> getThoughtKeywordStrength() {
        return Collections.unmodifiableMap(thoughtKeywordStrength);
    }

    private Set<MemoryNode> lookup(MemoryNode.Type type, List<String> terms) {
        Map<String, List<MemoryNode>> index = keywordIndex.get(type);
        Set<MemoryNode> result = new LinkedHashSet<>();
        for (String term : terms) {
            if (term != null) {
                result.addAll(index.getOrDefault(term.toLowerCase(Locale.ROOT), List.of()));
            }
        }
        return result;
    }
}
