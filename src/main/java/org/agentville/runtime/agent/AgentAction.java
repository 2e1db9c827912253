package org.agentville.runtime.agent;

import org.agentville.runtime.model.TileCoord;

/**
 * The concrete action returned by a tick. The driver moves the agent to {@code nextTile} and
 * applies any resulting event placement to the world.
 *
 * @param nextTile The tile the agent moves to.
 * @param symbol A short symbolic rendering of the action (e.g. an emoji), or an utterance.
 * @param description A description of the action, e.g. {@code "brewing coffee @ Hobbs Cafe"}.
 */
public record AgentAction(TileCoord nextTile, String symbol, String description) {
}
