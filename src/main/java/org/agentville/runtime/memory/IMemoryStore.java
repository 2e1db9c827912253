package org.agentville.runtime.memory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persistence contract of one agent memory store.
 * <p>
 * The on-disk schema is owned by the implementation; the orchestrator only ever loads and saves
 * whole stores. A store may be a single file or a folder, depending on the implementation.
 *
 * @param <T> The in-memory representation of the store.
 */
public interface IMemoryStore<T> {

    /**
     * Loads the store from the given path.
     *
     * @param path The file or folder of the store.
     * @return The loaded memory.
     * @throws IOException if the path cannot be read.
     * @throws com.google.gson.JsonParseException if the content is not valid for this store.
     */
    T load(Path path) throws IOException;

    /**
     * Writes the store to the given path, creating parent folders as needed.
     *
     * @param memory The memory to write.
     * @param path The file or folder of the store.
     * @throws IOException if the path cannot be written.
     */
    void save(T memory, Path path) throws IOException;
}
