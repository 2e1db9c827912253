package org.agentville.runtime.snapshot;

import java.nio.file.Path;

/**
 * Thrown when one of an agent's memory stores cannot be loaded from its snapshot folder.
 * <p>
 * Possible causes include a missing file or folder, malformed JSON, or content that does not
 * match the store's schema. The agent cannot be constructed; the message names the store and
 * its path.
 */
public class CorruptSnapshotException extends RuntimeException {

    private final String store;
    private final transient Path path;

    /**
     * @param store The store that failed, e.g. {@code "associative memory"}.
     * @param path The file or folder of the store.
     * @param cause The underlying exception.
     */
    public CorruptSnapshotException(String store, Path path, Throwable cause) {
        super("Cannot load " + store + " from " + path + ": " + cause.getMessage(), cause);
        this.store = store;
        this.path = path;
    }

    public String getStore() {
        return store;
    }

    public Path getPath() {
        return path;
    }
}
