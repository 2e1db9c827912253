package org.agentville.runtime.spi;

import java.util.Map;

import org.agentville.runtime.agent.AgentOrchestrator;
import org.agentville.runtime.agent.DayFlag;
import org.agentville.runtime.agent.Plan;
import org.agentville.runtime.memory.RetrievedContext;
import org.agentville.runtime.model.WorldGrid;

/**
 * Third step of a tick: decides what the agent does next. May internally perceive or retrieve
 * again; to the orchestrator it is a single call.
 */
@FunctionalInterface
public interface IPlanner {

    /**
     * @param agent The agent.
     * @param world The shared world.
     * @param peers All agents of the simulation, keyed by name.
     * @param dayFlag Whether a new calendar day began.
     * @param retrieved The retriever's output.
     * @return The plan.
     */
    Plan plan(AgentOrchestrator agent, WorldGrid world, Map<String, AgentOrchestrator> peers,
              DayFlag dayFlag, Map<String, RetrievedContext> retrieved);
}
