package org.agentville.runtime.agent;

/**
 * The outcome of the planning step: where the agent intends to act.
 * <p>
 * {@code actionAddress} is either a tile address ({@code world:sector:arena:object}) or a
 * planner-specific target such as another agent or a waiting position; the executor interprets it.
 *
 * @param actionAddress The target of the current action.
 */
public record Plan(String actionAddress) {
}
