package org.agentville.runtime.memory;

import java.time.LocalDateTime;

import org.agentville.runtime.model.TileCoord;

import com.google.gson.JsonObject;

/**
 * Short-lived per-agent state, rewritten every tick.
 * <p>
 * The orchestrator owns {@link #getCurrentTile()} and {@link #getCurrentTime()}; both are
 * {@code null} until the first tick. The perception parameters are read by the perceiver and
 * retriever. Everything the planner and executor keep between ticks (daily schedule, current
 * action, chat partner, ...) lives in the opaque {@link #getOpaqueFields()} object, which is
 * persisted verbatim.
 * <p>
 * <b>Thread safety:</b> Not thread-safe; mutated only by the owning agent's tick.
 */
public class AgentWorkingState {

    public static final int DEFAULT_VISION_RADIUS = 4;
    public static final int DEFAULT_ATTENTION_BANDWIDTH = 3;
    public static final int DEFAULT_RETENTION = 5;

    private final String name;
    private TileCoord currentTile;
    private LocalDateTime currentTime;
    private int visionRadius = DEFAULT_VISION_RADIUS;
    private int attentionBandwidth = DEFAULT_ATTENTION_BANDWIDTH;
    private int retention = DEFAULT_RETENTION;
    private final JsonObject opaqueFields;

    /**
     * Creates an empty working state with default perception parameters.
     *
     * @param name The agent name.
     */
    public AgentWorkingState(String name) {
        this(name, new JsonObject());
    }

    AgentWorkingState(String name, JsonObject opaqueFields) {
        this.name = name;
        this.opaqueFields = opaqueFields;
    }

    public String getName() {
        return name;
    }

    public TileCoord getCurrentTile() {
        return currentTile;
    }

    public void setCurrentTile(TileCoord currentTile) {
        this.currentTile = currentTile;
    }

    public LocalDateTime getCurrentTime() {
        return currentTime;
    }

    public void setCurrentTime(LocalDateTime currentTime) {
        this.currentTime = currentTime;
    }

    public int getVisionRadius() {
        return visionRadius;
    }

    public void setVisionRadius(int visionRadius) {
        this.visionRadius = visionRadius;
    }

    public int getAttentionBandwidth() {
        return attentionBandwidth;
    }

    public void setAttentionBandwidth(int attentionBandwidth) {
        this.attentionBandwidth = attentionBandwidth;
    }

    public int getRetention() {
        return retention;
    }

    public void setRetention(int retention) {
        this.retention = retention;
    }

    /**
     * @return The mutable planner/executor fields. Their schema is owned by those collaborators.
     */
    public JsonObject getOpaqueFields() {
        return opaqueFields;
    }
}
