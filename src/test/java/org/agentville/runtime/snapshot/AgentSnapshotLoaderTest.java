package org.agentville.runtime.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import org.agentville.runtime.memory.AgentWorkingState;
import org.agentville.runtime.memory.AssociativeMemory;
import org.agentville.runtime.memory.AssociativeMemoryStore;
import org.agentville.runtime.memory.IMemoryStore;
import org.agentville.runtime.memory.SpatialMemory;
import org.agentville.runtime.memory.SpatialMemoryStore;
import org.agentville.runtime.model.TileCoord;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

/**
 * Tests loading and saving the three memory stores of an agent snapshot folder.
 */
@Tag("unit")
class AgentSnapshotLoaderTest {

    @TempDir
    Path tempDir;

    private final AgentSnapshotLoader loader = new AgentSnapshotLoader();

    @Test
    void saveThenLoad_roundTripsAllStores() throws IOException {
        AgentMemories memories = AgentMemories.empty("Klaus");
        memories.spatial().learn("Town", "park", "bench", "chessboard");
        memories.associative().addEvent(LocalDateTime.of(2023, 2, 13, 9, 0), null,
            "Klaus", "is", "reading", "Klaus is reading", Set.of("Klaus", "reading"), 2, "Klaus is reading",
            List.of());
        memories.workingState().setCurrentTile(new TileCoord(1, 1));
        memories.workingState().setCurrentTime(LocalDateTime.of(2023, 2, 13, 9, 0));
        Path folder = tempDir.resolve("Klaus");

        loader.save(memories, folder);
        AgentMemories loaded = loader.load(folder);

        SnapshotLayout layout = new SnapshotLayout(folder);
        assertThat(layout.spatialMemory()).isRegularFile();
        assertThat(layout.associativeMemory()).isDirectory();
        assertThat(layout.workingState()).isRegularFile();

        assertThat(loaded.spatial().getTree()).isEqualTo(memories.spatial().getTree());
        assertThat(loaded.associative().getNodes()).containsExactlyElementsOf(memories.associative().getNodes());
        assertThat(loaded.workingState().getName()).isEqualTo("Klaus");
        assertThat(loaded.workingState().getCurrentTile()).isEqualTo(new TileCoord(1, 1));
        assertThat(loaded.workingState().getCurrentTime()).isEqualTo(LocalDateTime.of(2023, 2, 13, 9, 0));
    }

    @Test
    void load_corruptWorkingStateNamesTheStore() throws IOException {
        Path folder = tempDir.resolve("Klaus");
        loader.save(AgentMemories.empty("Klaus"), folder);
        Files.writeString(new SnapshotLayout(folder).workingState(), "{ not json");

        assertThatThrownBy(() -> loader.load(folder))
            .isInstanceOfSatisfying(CorruptSnapshotException.class, e -> {
                assertThat(e.getStore()).isEqualTo("working state");
                assertThat(e.getPath()).isEqualTo(new SnapshotLayout(folder).workingState());
            })
            .hasMessageContaining("scratch.json");
    }

    @Test
    void load_missingAssociativeMemoryNamesTheStore() throws IOException {
        Path folder = tempDir.resolve("Klaus");
        loader.save(AgentMemories.empty("Klaus"), folder);
        SnapshotLayout layout = new SnapshotLayout(folder);
        Files.delete(layout.associativeMemory().resolve("nodes.json"));

        assertThatThrownBy(() -> loader.load(folder))
            .isInstanceOfSatisfying(CorruptSnapshotException.class,
                e -> assertThat(e.getStore()).isEqualTo("associative memory"));
    }

    @Test
    void load_missingFolderFailsOnFirstStore() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("nobody")))
            .isInstanceOfSatisfying(CorruptSnapshotException.class,
                e -> assertThat(e.getStore()).isEqualTo("spatial memory"))
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void save_writesStoresSequentiallyWithoutRollback() throws IOException {
        IMemoryStore<AgentWorkingState> failingStore = mock(IMemoryStore.class);
        doThrow(new IOException("disk full")).when(failingStore).save(any(), any());
        IMemoryStore<AssociativeMemory> associativeStore = mock(IMemoryStore.class);
        AgentSnapshotLoader partial = new AgentSnapshotLoader(new SpatialMemoryStore(), associativeStore, failingStore);
        Path folder = tempDir.resolve("Klaus");

        assertThatThrownBy(() -> partial.save(AgentMemories.empty("Klaus"), folder))
            .isInstanceOf(IOException.class)
            .hasMessage("disk full");

        verify(associativeStore).save(any(), any());
        assertThat(new SnapshotLayout(folder).spatialMemory()).isRegularFile();
    }

    @Test
    @SuppressWarnings("unchecked")
    void save_stopsAtFirstFailingStore() throws IOException {
        IMemoryStore<SpatialMemory> failingStore = mock(IMemoryStore.class);
        doThrow(new IOException("read-only")).when(failingStore).save(any(), any());
        IMemoryStore<AgentWorkingState> workingStateStore = mock(IMemoryStore.class);
        AgentSnapshotLoader partial =
            new AgentSnapshotLoader(failingStore, new AssociativeMemoryStore(), workingStateStore);

        assertThatThrownBy(() -> partial.save(AgentMemories.empty("Klaus"), tempDir.resolve("Klaus")))
            .isInstanceOf(IOException.class);

        verify(workingStateStore, never()).save(any(), any());
    }

    @Test
    void forAgent_resolvesBelowConfiguredRoot() {
        Config config = ConfigFactory.empty()
            .withValue(SnapshotLayout.SNAPSHOT_ROOT_PATH, ConfigValueFactory.fromAnyRef(tempDir.toString()));

        SnapshotLayout layout = SnapshotLayout.forAgent(config, "Isabella Rodriguez");

        assertThat(layout.agentFolder()).isEqualTo(tempDir.resolve("Isabella Rodriguez"));
        assertThat(layout.workingState())
            .isEqualTo(tempDir.resolve("Isabella Rodriguez/bootstrap_memory/scratch.json"));
    }
}
