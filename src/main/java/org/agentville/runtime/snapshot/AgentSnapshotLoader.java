package org.agentville.runtime.snapshot;

import java.io.IOException;
import java.nio.file.Path;

import org.agentville.runtime.memory.AgentWorkingState;
import org.agentville.runtime.memory.AssociativeMemory;
import org.agentville.runtime.memory.AssociativeMemoryStore;
import org.agentville.runtime.memory.IMemoryStore;
import org.agentville.runtime.memory.SpatialMemory;
import org.agentville.runtime.memory.SpatialMemoryStore;
import org.agentville.runtime.memory.WorkingStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and saves an agent's three memory stores using the {@link SnapshotLayout}.
 * <p>
 * <b>No cross-store atomicity:</b> {@link #save(AgentMemories, Path)} writes the stores one
 * after the other. A crash between two writes leaves the snapshot folder with stores from
 * different ticks.
 */
public class AgentSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(AgentSnapshotLoader.class);

    private final IMemoryStore<SpatialMemory> spatialStore;
    private final IMemoryStore<AssociativeMemory> associativeStore;
    private final IMemoryStore<AgentWorkingState> workingStateStore;

    /**
     * Creates a loader backed by the default JSON stores.
     */
    public AgentSnapshotLoader() {
        this(new SpatialMemoryStore(), new AssociativeMemoryStore(), new WorkingStateStore());
    }

    /**
     * @param spatialStore Store for the spatial memory.
     * @param associativeStore Store for the associative memory.
     * @param workingStateStore Store for the working state.
     */
    public AgentSnapshotLoader(IMemoryStore<SpatialMemory> spatialStore,
                               IMemoryStore<AssociativeMemory> associativeStore,
                               IMemoryStore<AgentWorkingState> workingStateStore) {
        this.spatialStore = spatialStore;
        this.associativeStore = associativeStore;
        this.workingStateStore = workingStateStore;
    }

    /**
     * Loads all three stores from an agent's snapshot folder.
     *
     * @param agentFolder The agent's snapshot folder.
     * @return The loaded memories.
     * @throws CorruptSnapshotException if any store cannot be loaded.
     */
    public AgentMemories load(Path agentFolder) {
        SnapshotLayout layout = new SnapshotLayout(agentFolder);
        SpatialMemory spatial = loadStore("spatial memory", spatialStore, layout.spatialMemory());
        AssociativeMemory associative = loadStore("associative memory", associativeStore, layout.associativeMemory());
        AgentWorkingState workingState = loadStore("working state", workingStateStore, layout.workingState());

        log.info("Loaded snapshot {}: {} memory nodes, time {}",
            agentFolder, associative.size(), workingState.getCurrentTime());
        return new AgentMemories(spatial, associative, workingState);
    }

    /**
     * Writes all three stores into an agent's snapshot folder, one after the other.
     *
     * @param memories The memories to write.
     * @param agentFolder The agent's snapshot folder; created if missing.
     * @throws IOException if a store cannot be written. Stores written before the failure stay on disk.
     */
    public void save(AgentMemories memories, Path agentFolder) throws IOException {
        SnapshotLayout layout = new SnapshotLayout(agentFolder);
        spatialStore.save(memories.spatial(), layout.spatialMemory());
        associativeStore.save(memories.associative(), layout.associativeMemory());
        workingStateStore.save(memories.workingState(), layout.workingState());
        log.info("Saved snapshot {}", agentFolder);
    }

    private static <T> T loadStore(String name, IMemoryStore<T> store, Path path) {
        try {
            return store.load(path);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load {} from {}: {}", name, path, e.getMessage());
            throw new CorruptSnapshotException(name, path, e);
        }
    }
}
