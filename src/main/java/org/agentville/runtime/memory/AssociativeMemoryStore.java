package org.agentville.runtime.memory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Stores an {@link AssociativeMemory} as a folder with two JSON files:
 * <ul>
 *   <li>{@code nodes.json}: {@code {"node_1": {...}, "node_2": {...}}}</li>
 *   <li>{@code kw_strength.json}: {@code {"kw_strength_event": {...}, "kw_strength_thought": {...}}}</li>
 * </ul>
 * A missing {@code kw_strength.json} loads as empty counters. Embedding vectors are not stored
 * here; nodes only carry their embedding key.
 */
public class AssociativeMemoryStore implements IMemoryStore<AssociativeMemory> {

    static final String NODES_FILE = "nodes.json";
    static final String STRENGTH_FILE = "kw_strength.json";

    @Override
    public AssociativeMemory load(Path folder) throws IOException {
        JsonObject nodesJson = MemoryJson.readObject(folder.resolve(NODES_FILE));
        List<MemoryNode> nodes = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : nodesJson.entrySet()) {
            if (!entry.getValue().isJsonObject()) {
                throw new JsonParseException("Memory node '" + entry.getKey() + "' is not an object");
            }
            nodes.add(readNode(entry.getKey(), entry.getValue().getAsJsonObject()));
        }
        nodes.sort(Comparator.comparingInt(MemoryNode::nodeCount));

        AssociativeMemory memory = new AssociativeMemory();
        nodes.forEach(memory::restore);

        Path strengthFile = folder.resolve(STRENGTH_FILE);
        if (Files.exists(strengthFile)) {
            JsonObject strength = MemoryJson.readObject(strengthFile);
            memory.putKeywordStrengths(
                readCounters(strength.getAsJsonObject("kw_strength_event")),
                readCounters(strength.getAsJsonObject("kw_strength_thought")));
        }
        return memory;
    }

    @Override
    public void save(AssociativeMemory memory, Path folder) throws IOException {
        Files.createDirectories(folder);

        JsonObject nodesJson = new JsonObject();
        for (MemoryNode node : memory.getNodes()) {
            nodesJson.add(node.id(), writeNode(node));
        }
        MemoryJson.write(nodesJson, folder.resolve(NODES_FILE));

        JsonObject strength = new JsonObject();
        strength.add("kw_strength_event",
            MemoryJson.GSON.toJsonTree(new LinkedHashMap<>(memory.getEventKeywordStrength())));
        strength.add("kw_strength_thought",
            MemoryJson.GSON.toJsonTree(new LinkedHashMap<>(memory.getThoughtKeywordStrength())));
        MemoryJson.write(strength, folder.resolve(STRENGTH_FILE));
    }

    private static MemoryNode readNode(String id, JsonObject json) {
        return new MemoryNode(
            id,
            required(id, json, "node_count").getAsInt(),
            required(id, json, "type_count").getAsInt(),
            MemoryNode.Type.fromKey(required(id, json, "type").getAsString()),
            json.has("depth") ? json.get("depth").getAsInt() : 0,
            MemoryJson.optTime(json, "created", MemoryJson.NODE_FORMAT),
            MemoryJson.optTime(json, "expiration", MemoryJson.NODE_FORMAT),
            required(id, json, "subject").getAsString(),
            MemoryJson.optString(json, "predicate"),
            MemoryJson.optString(json, "object"),
            MemoryJson.optString(json, "description"),
            MemoryJson.optString(json, "embedding_key"),
            json.has("poignancy") ? json.get("poignancy").getAsInt() : 0,
            readStrings(json.get("keywords"), new LinkedHashSet<>()),
            readStrings(json.get("filling"), new ArrayList<>()));
    }

    private static JsonElement required(String id, JsonObject json, String key) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            throw new JsonParseException("Memory node '" + id + "' is missing '" + key + "'");
        }
        return element;
    }

    private static JsonObject writeNode(MemoryNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("node_count", node.nodeCount());
        json.addProperty("type_count", node.typeCount());
        json.addProperty("type", node.type().key());
        json.addProperty("depth", node.depth());
        json.addProperty("created", MemoryJson.formatTime(node.created(), MemoryJson.NODE_FORMAT));
        json.addProperty("expiration", MemoryJson.formatTime(node.expiration(), MemoryJson.NODE_FORMAT));
        json.addProperty("subject", node.subject());
        json.addProperty("predicate", node.predicate());
        json.addProperty("object", node.object());
        json.addProperty("description", node.description());
        json.addProperty("embedding_key", node.embeddingKey());
        json.addProperty("poignancy", node.poignancy());
        json.add("keywords", MemoryJson.GSON.toJsonTree(new ArrayList<>(node.keywords())));
        json.add("filling", MemoryJson.GSON.toJsonTree(new ArrayList<>(node.filling())));
        return json;
    }

    private static <C extends Collection<String>> C readStrings(JsonElement element, C target) {
        if (element == null || element.isJsonNull()) {
            return target;
        }
        JsonArray array = element.getAsJsonArray();
        for (JsonElement item : array) {
            if (!item.isJsonNull()) {
                target.add(item.getAsString());
            }
        }
        return target;
    }

    private static Map<String, Integer> readCounters(JsonObject json) {
        Map<String, Integer> counters = new LinkedHashMap<>();
        if (json != null) {
            for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
                counters.put(entry.getKey(), entry.getValue().getAsInt());
            }
        }
        return counters;
    }
}
