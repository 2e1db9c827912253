package org.agentville.runtime.spi;

import java.util.Map;

import org.agentville.runtime.agent.AgentAction;
import org.agentville.runtime.agent.AgentOrchestrator;
import org.agentville.runtime.agent.Plan;
import org.agentville.runtime.model.WorldGrid;

/**
 * Last step of a tick: turns the plan into a concrete action (movement target, object
 * interaction or utterance). Must not mutate the world; the driver applies the action.
 */
@FunctionalInterface
public interface IExecutor {

    /**
     * @param agent The agent.
     * @param world The shared world, for path finding.
     * @param peers All agents of the simulation, keyed by name.
     * @param plan The planner's output.
     * @return The action.
     */
    AgentAction execute(AgentOrchestrator agent, WorldGrid world, Map<String, AgentOrchestrator> peers, Plan plan);
}
