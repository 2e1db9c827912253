package org.agentville.runtime.spi;

import java.util.List;
import java.util.Map;

import org.agentville.runtime.agent.AgentOrchestrator;
import org.agentville.runtime.memory.MemoryNode;
import org.agentville.runtime.memory.RetrievedContext;

/**
 * Second step of a tick: retrieves the memories relevant to each perceived event.
 */
@FunctionalInterface
public interface IRetriever {

    /**
     * @param agent The agent.
     * @param perceived The nodes returned by the perceiver.
     * @return Retrieved memories keyed by the focal event's description.
     */
    Map<String, RetrievedContext> retrieve(AgentOrchestrator agent, List<MemoryNode> perceived);
}
