package org.agentville.runtime.snapshot;

import java.util.Objects;

import org.agentville.runtime.memory.AgentWorkingState;
import org.agentville.runtime.memory.AssociativeMemory;
import org.agentville.runtime.memory.SpatialMemory;

/**
 * The three memory stores of one agent, as loaded from or saved to a snapshot folder.
 *
 * @param spatial Known places.
 * @param associative Long-term memory stream.
 * @param workingState Tick-scoped working state.
 */
public record AgentMemories(SpatialMemory spatial, AssociativeMemory associative, AgentWorkingState workingState) {

    public AgentMemories {
        Objects.requireNonNull(spatial, "spatial");
        Objects.requireNonNull(associative, "associative");
        Objects.requireNonNull(workingState, "workingState");
    }

    /**
     * Creates empty memories for a new agent.
     *
     * @param name The agent name.
     * @return Fresh memories with default perception parameters.
     */
    public static AgentMemories empty(String name) {
        return new AgentMemories(new SpatialMemory(), new AssociativeMemory(), new AgentWorkingState(name));
    }
}
