package org.agentville.runtime.agent;

/**
 * Thrown when a cognitive collaborator (perceiver, retriever, planner, reflector, executor or
 * conversation engine) fails. The remaining steps of the tick are skipped; the position and time
 * already written to the working state are not rolled back.
 * <p>
 * The core never retries; retry, timeout and cancellation are the collaborator's business.
 */
public class CollaboratorFailureException extends RuntimeException {

    private final String agentName;
    private final String operation;

    /**
     * @param agentName The agent whose collaborator failed.
     * @param operation The failed operation, e.g. {@code "plan"}.
     * @param cause The collaborator's exception.
     */
    public CollaboratorFailureException(String agentName, String operation, Throwable cause) {
        super("Agent '" + agentName + "': " + operation + " failed: " + cause.getMessage(), cause);
        this.agentName = agentName;
        this.operation = operation;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getOperation() {
        return operation;
    }
}
