package org.agentville.runtime.spi;

import java.util.Objects;

/**
 * The capability set an {@link org.agentville.runtime.agent.AgentOrchestrator} is constructed
 * with. Each collaborator can be replaced independently, e.g. by a mock in tests.
 *
 * @param perceiver Perception step.
 * @param retriever Retrieval step.
 * @param planner Planning step.
 * @param reflector Reflection step.
 * @param executor Execution step.
 * @param conversationEngine Conversation sessions.
 */
public record CognitiveModules(
    IPerceiver perceiver,
    IRetriever retriever,
    IPlanner planner,
    IReflector reflector,
    IExecutor executor,
    IConversationEngine conversationEngine
) {

    public CognitiveModules {
        Objects.requireNonNull(perceiver, "perceiver");
        Objects.requireNonNull(retriever, "retriever");
        Objects.requireNonNull(planner, "planner");
        Objects.requireNonNull(reflector, "reflector");
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(conversationEngine, "conversationEngine");
    }
}
