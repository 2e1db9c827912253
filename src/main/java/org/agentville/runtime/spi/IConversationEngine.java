package org.agentville.runtime.spi;

import org.agentville.runtime.agent.AgentOrchestrator;
import org.agentville.runtime.agent.ConversationMode;

/**
 * Opens an interactive conversation session with an agent, outside the tick pipeline.
 * May add chat or thought nodes to the agent's associative memory.
 */
@FunctionalInterface
public interface IConversationEngine {

    void openSession(AgentOrchestrator agent, ConversationMode mode);
}
