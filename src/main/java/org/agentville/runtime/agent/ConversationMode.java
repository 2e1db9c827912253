package org.agentville.runtime.agent;

/**
 * Style of a conversation session opened through {@link AgentOrchestrator#openConversation}.
 */
public enum ConversationMode {
    /** Free-form interview with the agent. */
    ANALYSIS,
    /** Directed statement planted into the agent's memory. */
    WHISPER
}
