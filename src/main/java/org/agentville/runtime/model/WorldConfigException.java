package org.agentville.runtime.model;

/**
 * Thrown when the world configuration is malformed or inconsistent.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>A code layer whose cell count differs from {@code width * height}</li>
 *   <li>A missing or unreadable configuration file</li>
 *   <li>A missing or invalid metadata key</li>
 * </ul>
 * <p>
 * This is a RuntimeException because configuration errors are fatal at startup and cannot be
 * recovered from automatically. The message always names the offending layer, file or key.
 */
public class WorldConfigException extends RuntimeException {

    /**
     * @param message Description of the configuration error.
     */
    public WorldConfigException(String message) {
        super(message);
    }

    /**
     * @param message Description of the configuration error.
     * @param cause The underlying exception.
     */
    public WorldConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
