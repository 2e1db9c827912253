package org.agentville.runtime.spi;

import java.util.List;

import org.agentville.runtime.agent.AgentOrchestrator;
import org.agentville.runtime.memory.MemoryNode;
import org.agentville.runtime.model.WorldGrid;

/**
 * First step of a tick: turns what the agent can see into new memories.
 * <p>
 * Typically reads the tiles around {@code agent.getWorkingState().getCurrentTile()} via
 * {@link WorldGrid#tilesNear}, updates the spatial memory, and records the most salient new
 * events in the associative memory.
 */
@FunctionalInterface
public interface IPerceiver {

    /**
     * @param agent The perceiving agent.
     * @param world The shared world.
     * @return The newly perceived event nodes.
     */
    List<MemoryNode> perceive(AgentOrchestrator agent, WorldGrid world);
}
