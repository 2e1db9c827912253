package org.agentville.runtime.model;

import java.util.List;
import java.util.Map;

/**
 * One per-cell code layer of the world configuration together with its code-to-name block table.
 * <p>
 * Codes are stored row-major: the code of tile {@code (x, y)} is at index {@code y * width + x}.
 * A code without an entry in the block table resolves to an empty name.
 *
 * @param name Layer name used in error messages, e.g. {@code "arena"}.
 * @param codes Row-major cell codes.
 * @param blocks Code-to-name table.
 */
public record WorldLayer(String name, List<String> codes, Map<String, String> blocks) {

    public WorldLayer {
        codes = List.copyOf(codes);
        blocks = Map.copyOf(blocks);
    }

    /**
     * Resolves the name of the cell at the given flat index.
     *
     * @param index Row-major cell index.
     * @return The mapped name, or an empty string if the code is unmapped.
     */
    public String resolve(int index) {
        return blocks.getOrDefault(codes.get(index).trim(), "");
    }
}
