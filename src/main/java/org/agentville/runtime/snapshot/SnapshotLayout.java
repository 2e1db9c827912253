package org.agentville.runtime.snapshot;

import java.nio.file.Path;

import com.typesafe.config.Config;

/**
 * Locations of the memory stores inside an agent's snapshot folder:
 * <pre>
 *   agentFolder/
 *     bootstrap_memory/
 *       spatial_memory.json
 *       associative_memory/
 *       scratch.json
 * </pre>
 *
 * @param agentFolder The agent's snapshot folder.
 */
public record SnapshotLayout(Path agentFolder) {

    /** Application config path of the parent folder of all agent snapshot folders. */
    public static final String SNAPSHOT_ROOT_PATH = "agentville.agents.snapshot-root";

    static final String MEMORY_DIR = "bootstrap_memory";

    /**
     * Resolves the snapshot folder of an agent below the configured snapshot root.
     *
     * @param appConfig The resolved application configuration.
     * @param agentName The agent name, used as folder name.
     * @return The agent's layout.
     */
    public static SnapshotLayout forAgent(Config appConfig, String agentName) {
        return new SnapshotLayout(Path.of(appConfig.getString(SNAPSHOT_ROOT_PATH)).resolve(agentName));
    }

    public Path memoryFolder() {
        return agentFolder.resolve(MEMORY_DIR);
    }

    public Path spatialMemory() {
        return memoryFolder().resolve("spatial_memory.json");
    }

    public Path associativeMemory() {
        return memoryFolder().resolve("associative_memory");
    }

    public Path workingState() {
        return memoryFolder().resolve("scratch.json");
    }
}
