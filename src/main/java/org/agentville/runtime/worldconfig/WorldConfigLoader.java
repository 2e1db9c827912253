package org.agentville.runtime.worldconfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.agentville.runtime.model.WorldConfig;
import org.agentville.runtime.model.WorldConfigException;
import org.agentville.runtime.model.WorldLayer;
import org.agentville.runtime.model.WorldProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Reads a {@link WorldConfig} from an environment-matrix folder.
 * <p>
 * Expected layout:
 * <pre>
 *   envMatrix/
 *     maze_meta_info.json
 *     special_blocks/world_blocks.csv
 *     special_blocks/sector_blocks.csv
 *     special_blocks/arena_blocks.csv
 *     special_blocks/game_object_blocks.csv
 *     special_blocks/spawning_location_blocks.csv
 *     maze/collision_maze.csv
 *     maze/sector_maze.csv
 *     maze/arena_maze.csv
 *     maze/game_object_maze.csv
 *     maze/spawning_location_maze.csv
 * </pre>
 * The meta file is JSON, which Typesafe Config parses as HOCON. Block tables map the first
 * column of each row to its last column; the world block table's first row names the world.
 * Maze files hold comma-separated codes, row-major.
 */
public final class WorldConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(WorldConfigLoader.class);

    /** Application config path of the environment-matrix folder. */
    public static final String ENV_MATRIX_PATH = "agentville.world.env-matrix";

    static final String META_FILE = "maze_meta_info.json";
    static final String BLOCKS_DIR = "special_blocks";
    static final String MAZE_DIR = "maze";

    private WorldConfigLoader() {
    }

    /**
     * Resolves the environment-matrix folder from the application configuration and loads it.
     *
     * @param appConfig The resolved application configuration.
     * @return The world configuration.
     * @throws WorldConfigException if the path is not configured or the folder is inconsistent.
     */
    public static WorldConfig fromConfig(Config appConfig) {
        if (!appConfig.hasPath(ENV_MATRIX_PATH)) {
            throw new WorldConfigException("Missing configuration key '" + ENV_MATRIX_PATH + "'");
        }
        return fromDirectory(Path.of(appConfig.getString(ENV_MATRIX_PATH)));
    }

    /**
     * Loads the world configuration from an environment-matrix folder.
     *
     * @param envMatrix The folder.
     * @return The world configuration, not yet validated against the grid size.
     * @throws WorldConfigException if a file or metadata key is missing or invalid.
     */
    public static WorldConfig fromDirectory(Path envMatrix) {
        LOG.info("Loading world configuration from {}", envMatrix.toAbsolutePath());
        WorldProperties properties = readProperties(envMatrix.resolve(META_FILE));

        Path blocks = envMatrix.resolve(BLOCKS_DIR);
        Path maze = envMatrix.resolve(MAZE_DIR);

        List<List<String>> worldRows = readCsv(blocks.resolve("world_blocks.csv"));
        if (worldRows.isEmpty()) {
            throw new WorldConfigException("World block table is empty: " + blocks.resolve("world_blocks.csv"));
        }
        List<String> worldRow = worldRows.get(0);
        String worldName = worldRow.get(worldRow.size() - 1);

        return new WorldConfig(
            properties,
            worldName,
            readMaze(maze.resolve("collision_maze.csv")),
            layer("sector", blocks, maze),
            layer("arena", blocks, maze),
            layer("game_object", blocks, maze),
            layer("spawning_location", blocks, maze));
    }

    private static WorldProperties readProperties(Path metaFile) {
        if (!Files.isRegularFile(metaFile)) {
            throw new WorldConfigException("World metadata file not found: " + metaFile);
        }
        try {
            Config meta = ConfigFactory.parseFile(metaFile.toFile()).resolve();
            String constraint = meta.hasPath("special_constraint") && !meta.getIsNull("special_constraint")
                ? meta.getValue("special_constraint").unwrapped().toString()
                : "";
            return new WorldProperties(
                meta.getInt("maze_width"),
                meta.getInt("maze_height"),
                meta.getInt("sq_tile_size"),
                constraint);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new WorldConfigException("Invalid world metadata in " + metaFile + ": " + e.getMessage(), e);
        }
    }

    private static WorldLayer layer(String name, Path blocks, Path maze) {
        return new WorldLayer(
            name,
            readMaze(maze.resolve(name + "_maze.csv")),
            readBlocks(blocks.resolve(name + "_blocks.csv")));
    }

    static Map<String, String> readBlocks(Path file) {
        Map<String, String> table = new LinkedHashMap<>();
        for (List<String> row : readCsv(file)) {
            table.put(row.get(0), row.get(row.size() - 1));
        }
        return table;
    }

    static List<String> readMaze(Path file) {
        List<String> cells = new ArrayList<>();
        for (List<String> row : readCsv(file)) {
            cells.addAll(row);
        }
        return cells;
    }

    /**
     * Reads a header-less CSV file, trimming each cell and skipping blank lines.
     */
    static List<List<String>> readCsv(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorldConfigException("Cannot read world configuration file " + file, e);
        }
        List<List<String>> rows = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            List<String> row = new ArrayList<>();
            for (String cell : line.split(",", -1)) {
                row.add(cell.trim());
            }
            rows.add(row);
        }
        return rows;
    }
}
