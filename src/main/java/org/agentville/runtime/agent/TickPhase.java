package org.agentville.runtime.agent;

/**
 * Phase of an agent's tick pipeline. A tick moves strictly through
 * {@code IDLE -> PERCEIVING -> RETRIEVING -> PLANNING -> REFLECTING -> EXECUTING -> IDLE};
 * a failure in any phase returns the agent to {@code IDLE}.
 */
public enum TickPhase {
    IDLE,
    PERCEIVING,
    RETRIEVING,
    PLANNING,
    REFLECTING,
    EXECUTING
}
