package org.agentville.runtime.memory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import org.agentville.runtime.model.TileCoord;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Stores an {@link AgentWorkingState} as one JSON file.
 * <p>
 * Known keys: {@code name}, {@code curr_time} ({@code "February 13, 2023, 14:30:00"} or null),
 * {@code curr_tile} ({@code [x, y]} or null), {@code vision_r}, {@code att_bandwidth},
 * {@code retention}. Every other key belongs to the planner/executor and is kept as-is.
 */
public class WorkingStateStore implements IMemoryStore<AgentWorkingState> {

    static final String NAME = "name";
    static final String CURR_TIME = "curr_time";
    static final String CURR_TILE = "curr_tile";
    static final String VISION_R = "vision_r";
    static final String ATT_BANDWIDTH = "att_bandwidth";
    static final String RETENTION = "retention";

    private static final Set<String> KNOWN_KEYS =
        Set.of(NAME, CURR_TIME, CURR_TILE, VISION_R, ATT_BANDWIDTH, RETENTION);

    @Override
    public AgentWorkingState load(Path path) throws IOException {
        JsonObject root = MemoryJson.readObject(path);

        JsonObject opaque = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : root.entrySet()) {
            if (!KNOWN_KEYS.contains(entry.getKey())) {
                opaque.add(entry.getKey(), entry.getValue());
            }
        }

        String name = MemoryJson.optString(root, NAME);
        AgentWorkingState state = new AgentWorkingState(name, opaque);
        state.setCurrentTime(MemoryJson.optTime(root, CURR_TIME, MemoryJson.CLOCK_FORMAT));
        state.setCurrentTile(readTile(root.get(CURR_TILE)));
        if (root.has(VISION_R)) {
            state.setVisionRadius(root.get(VISION_R).getAsInt());
        }
        if (root.has(ATT_BANDWIDTH)) {
            state.setAttentionBandwidth(root.get(ATT_BANDWIDTH).getAsInt());
        }
        if (root.has(RETENTION)) {
            state.setRetention(root.get(RETENTION).getAsInt());
        }
        return state;
    }

    @Override
    public void save(AgentWorkingState state, Path path) throws IOException {
        JsonObject root = new JsonObject();
        root.addProperty(NAME, state.getName());
        root.addProperty(CURR_TIME, MemoryJson.formatTime(state.getCurrentTime(), MemoryJson.CLOCK_FORMAT));
        root.add(CURR_TILE, writeTile(state.getCurrentTile()));
        root.addProperty(VISION_R, state.getVisionRadius());
        root.addProperty(ATT_BANDWIDTH, state.getAttentionBandwidth());
        root.addProperty(RETENTION, state.getRetention());
        for (Map.Entry<String, JsonElement> entry : state.getOpaqueFields().entrySet()) {
            // Typed fields win over opaque entries of the same name
            if (!KNOWN_KEYS.contains(entry.getKey())) {
                root.add(entry.getKey(), entry.getValue());
            }
        }
        MemoryJson.write(root, path);
    }

    private static TileCoord readTile(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonArray() || element.getAsJsonArray().size() != 2) {
            throw new JsonParseException("'" + CURR_TILE + "' must be an [x, y] array, got " + element);
        }
        JsonArray xy = element.getAsJsonArray();
        return new TileCoord(xy.get(0).getAsInt(), xy.get(1).getAsInt());
    }

    private static JsonElement writeTile(TileCoord tile) {
        if (tile == null) {
            return JsonNull.INSTANCE;
        }
        JsonArray xy = new JsonArray();
        xy.add(tile.x());
        xy.add(tile.y());
        return xy;
    }
}
