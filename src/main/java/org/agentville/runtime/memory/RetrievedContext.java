package org.agentville.runtime.memory;

import java.util.List;

/**
 * The memories retrieved for one perceived event.
 *
 * @param focalEvent The perceived event the retrieval was anchored on.
 * @param events Related events.
 * @param thoughts Related thoughts.
 */
public record RetrievedContext(MemoryNode focalEvent, List<MemoryNode> events, List<MemoryNode> thoughts) {

    public RetrievedContext {
        events = List.copyOf(events);
        thoughts = List.copyOf(thoughts);
    }
}
