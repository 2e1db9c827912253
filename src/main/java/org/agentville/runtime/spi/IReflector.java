package org.agentville.runtime.spi;

import org.agentville.runtime.agent.AgentOrchestrator;

/**
 * Fourth step of a tick: runs after every plan and may add thoughts to the agent's associative
 * memory. Deciding whether there is anything worth reflecting on is up to the implementation.
 */
@FunctionalInterface
public interface IReflector {

    void reflect(AgentOrchestrator agent);
}
