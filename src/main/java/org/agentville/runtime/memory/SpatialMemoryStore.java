package org.agentville.runtime.memory;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Stores a {@link SpatialMemory} as one JSON file holding the nested
 * {@code {world: {sector: {arena: [objects]}}}} tree.
 */
public class SpatialMemoryStore implements IMemoryStore<SpatialMemory> {

    private static final Type TREE_TYPE =
        new TypeToken<LinkedHashMap<String, LinkedHashMap<String, LinkedHashMap<String, List<String>>>>>() {}.getType();

    @Override
    public SpatialMemory load(Path path) throws IOException {
        LinkedHashMap<String, LinkedHashMap<String, LinkedHashMap<String, List<String>>>> raw;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            raw = MemoryJson.GSON.fromJson(reader, TREE_TYPE);
        }
        if (raw == null) {
            throw new JsonParseException("Spatial memory file is empty: " + path);
        }
        SpatialMemory memory = new SpatialMemory();
        raw.forEach((world, sectors) -> {
            memory.learn(world, "", "", "");
            if (sectors == null) {
                return;
            }
            sectors.forEach((sector, arenas) -> {
                memory.learn(world, sector, "", "");
                if (arenas == null) {
                    return;
                }
                arenas.forEach((arena, objects) -> {
                    memory.learn(world, sector, arena, "");
                    if (objects != null) {
                        objects.forEach(object -> memory.learn(world, sector, arena, object));
                    }
                });
            });
        });
        return memory;
    }

    @Override
    public void save(SpatialMemory memory, Path path) throws IOException {
        MemoryJson.write(new LinkedHashMap<>(memory.getTree()), path);
    }
}
