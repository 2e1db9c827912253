package org.agentville.runtime.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.agentville.runtime.model.Event;
import org.agentville.runtime.snapshot.AgentMemories;
import org.agentville.runtime.snapshot.AgentSnapshotLoader;
import org.agentville.runtime.snapshot.CorruptSnapshotException;
import org.agentville.runtime.snapshot.SnapshotLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParseException;

@Tag("unit")
class AssociativeMemoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2023, 2, 13, 9, 0);

    @TempDir
    Path tempDir;

    private AssociativeMemory memory;

    @BeforeEach
    void setUp() {
        memory = new AssociativeMemory();
    }

    @Test
    void add_numbersNodesInInsertionOrder() {
        MemoryNode first = event("Klaus", "is", "reading", "Klaus");
        MemoryNode chat = memory.addChat(T0, null, "Klaus", "chat with", "Maria", "talk",
            Set.of("Maria"), 3, "talk", List.of());
        MemoryNode second = event("Maria", "is", "painting", "Maria");

        assertThat(first.id()).isEqualTo("node_1");
        assertThat(chat.id()).isEqualTo("node_2");
        assertThat(second.id()).isEqualTo("node_3");
        assertThat(second.typeCount()).isEqualTo(2);
        assertThat(chat.typeCount()).isEqualTo(1);
        assertThat(memory.getNodes()).containsExactly(first, chat, second);
        assertThat(memory.getNodes(MemoryNode.Type.EVENT)).containsExactly(first, second);
    }

    @Test
    void addEvent_incrementsKeywordStrengthUnlessIdle() {
        event("Klaus", "is", "reading", "Klaus", "reading");
        event("Klaus", "is", "reading", "Klaus");
        event("bed", "is", "idle", "bed");

        assertThat(memory.getEventKeywordStrength())
            .containsEntry("klaus", 2)
            .containsEntry("reading", 1)
            .doesNotContainKey("bed");
    }

    @Test
    void addChat_neverIncrementsKeywordStrength() {
        memory.addChat(T0, null, "Klaus", "chat with", "Maria", "talk", Set.of("Maria"), 3, "talk", List.of());

        assertThat(memory.getEventKeywordStrength()).isEmpty();
        assertThat(memory.getThoughtKeywordStrength()).isEmpty();
    }

    @Test
    void addThought_depthIsOneMoreThanDeepestEvidence() {
        MemoryNode e1 = event("Klaus", "is", "reading", "Klaus");
        MemoryNode t1 = thought(List.of(e1.id()));
        MemoryNode t2 = thought(List.of(e1.id(), t1.id()));
        MemoryNode t3 = thought(List.of("node_99"));

        assertThat(e1.depth()).isZero();
        assertThat(t1.depth()).isEqualTo(1);
        assertThat(t2.depth()).isEqualTo(2);
        assertThat(t3.depth()).isZero();
        assertThat(memory.getThoughtKeywordStrength()).containsEntry("klaus", 3);
    }

    @Test
    void retrieve_isCaseInsensitiveAndPerType() {
        MemoryNode reading = event("Klaus", "is", "reading", "Klaus", "Reading");
        MemoryNode thought = thought(List.of(reading.id()));

        assertThat(memory.retrieveRelevantEvents("klaus", null, "READING")).containsExactly(reading);
        assertThat(memory.retrieveRelevantThoughts("KLAUS", "is", "anything")).containsExactly(thought);
        assertThat(memory.retrieveRelevantEvents("Maria", "is", "painting")).isEmpty();
    }

    @Test
    void getSummarizedLatestEvents_returnsDistinctTriplesNewestFirst() {
        event("Klaus", "is", "reading", "Klaus");
        event("Klaus", "is", "writing", "Klaus");
        event("Klaus", "is", "writing", "Klaus");
        event("Klaus", "is", "sleeping", "Klaus");

        assertThat(memory.getSummarizedLatestEvents(3)).containsExactly(
            new Event("Klaus", "is", "sleeping", null),
            new Event("Klaus", "is", "writing", null));
        assertThat(memory.getSummarizedLatestEvents(10)).hasSize(3);
        assertThat(memory.getSummarizedLatestEvents(0)).isEmpty();
    }

    @Test
    void getLastChat_returnsMostRecentChatWithPartner() {
        memory.addChat(T0, null, "Klaus", "chat with", "Maria", "first", Set.of("Maria"), 3, "first", List.of());
        MemoryNode latest = memory.addChat(T0.plusHours(1), null, "Klaus", "chat with", "Maria", "second",
            Set.of("Maria"), 3, "second", List.of());

        assertThat(memory.getLastChat("maria")).contains(latest);
        assertThat(memory.getLastChat("Isabella")).isEmpty();
    }

    @Test
    void restore_rejectsDuplicateIds() {
        MemoryNode node = event("Klaus", "is", "reading", "Klaus");

        assertThatThrownBy(() -> memory.restore(node))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("node_1");
    }

    @Test
    void store_preservesNodesAndCountersAcrossSaveAndLoad() throws IOException {
        MemoryNode reading = event("Klaus", "is", "reading", "Klaus", "reading");
        memory.addChat(T0, T0.plusDays(30), "Klaus", "chat with", "Maria", "talk", Set.of("Maria"), 4, "talk",
            List.of("Klaus: hi", "Maria: hello"));
        thought(List.of(reading.id()));
        Path folder = tempDir.resolve("associative_memory");

        AssociativeMemoryStore store = new AssociativeMemoryStore();
        store.save(memory, folder);
        AssociativeMemory loaded = store.load(folder);

        assertThat(loaded.getNodes()).containsExactlyElementsOf(memory.getNodes());
        assertThat(loaded.getEventKeywordStrength()).isEqualTo(memory.getEventKeywordStrength());
        assertThat(loaded.getThoughtKeywordStrength()).isEqualTo(memory.getThoughtKeywordStrength());
        assertThat(loaded.getLastChat("Maria")).map(MemoryNode::filling).contains(List.of("Klaus: hi", "Maria: hello"));
    }

    @Test
    void store_loadedMemoryContinuesNumbering() throws IOException {
        event("Klaus", "is", "reading", "Klaus");
        Path folder = tempDir.resolve("associative_memory");
        new AssociativeMemoryStore().save(memory, folder);

        AssociativeMemory loaded = new AssociativeMemoryStore().load(folder);
        MemoryNode next = loaded.addEvent(T0, null, "Klaus", "is", "eating", "eating", Set.of(), 1, "eating",
            List.of());

        assertThat(next.id()).isEqualTo("node_2");
    }

    @Test
    void store_missingStrengthFileLoadsEmptyCounters() throws IOException {
        event("Klaus", "is", "reading", "Klaus");
        Path folder = tempDir.resolve("associative_memory");
        new AssociativeMemoryStore().save(memory, folder);
        Files.delete(folder.resolve(AssociativeMemoryStore.STRENGTH_FILE));

        AssociativeMemory loaded = new AssociativeMemoryStore().load(folder);

        assertThat(loaded.size()).isEqualTo(1);
        assertThat(loaded.getEventKeywordStrength()).isEmpty();
    }

    @Test
    void store_unknownNodeTypeIsRejected() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("associative_memory"));
        Files.writeString(folder.resolve(AssociativeMemoryStore.NODES_FILE),
            "{\"node_1\": {\"node_count\": 1, \"type_count\": 1, \"type\": \"dream\"}}");

        assertThatThrownBy(() -> new AssociativeMemoryStore().load(folder))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dream");
    }

    @Test
    void store_nodeThatIsNotAnObjectIsRejected() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("associative_memory"));
        Files.writeString(folder.resolve(AssociativeMemoryStore.NODES_FILE), "{\"node_1\": 42}");

        assertThatThrownBy(() -> new AssociativeMemoryStore().load(folder))
            .isInstanceOf(JsonParseException.class);
    }

    @Test
    void store_numberingContinuesAfterGapsInLoadedIds() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("associative_memory"));
        Files.writeString(folder.resolve(AssociativeMemoryStore.NODES_FILE), "{"
            + "\"node_1\": {\"node_count\": 1, \"type_count\": 1, \"type\": \"event\", \"subject\": \"Klaus\"},"
            + "\"node_3\": {\"node_count\": 3, \"type_count\": 4, \"type\": \"event\", \"subject\": \"Maria\"}"
            + "}");
        memory = new AssociativeMemoryStore().load(folder);

        MemoryNode added = event("Klaus", "is", "reading", "Klaus");
        MemoryNode thought = thought(List.of("node_1"));

        assertThat(added.id()).isEqualTo("node_4");
        assertThat(added.typeCount()).isEqualTo(5);
        assertThat(thought.id()).isEqualTo("node_5");
        assertThat(thought.typeCount()).isEqualTo(1);
        assertThat(memory.getNodes()).extracting(MemoryNode::id).containsExactly("node_1", "node_3", "node_4", "node_5");
    }

    @Test
    void store_nodeWithoutSubjectIsRejected() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("associative_memory"));
        Files.writeString(folder.resolve(AssociativeMemoryStore.NODES_FILE),
            "{\"node_1\": {\"node_count\": 1, \"type_count\": 1, \"type\": \"event\"}}");

        assertThatThrownBy(() -> new AssociativeMemoryStore().load(folder))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("node_1")
            .hasMessageContaining("subject");
    }

    @Test
    void store_nodeWithoutCountIsRejected() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("associative_memory"));
        Files.writeString(folder.resolve(AssociativeMemoryStore.NODES_FILE),
            "{\"node_1\": {\"type_count\": 1, \"type\": \"event\", \"subject\": \"Klaus\"}}");

        assertThatThrownBy(() -> new AssociativeMemoryStore().load(folder))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("node_count");
    }

    @Test
    void snapshotWithSubjectlessNodeIsCorrupt() throws IOException {
        Path folder = tempDir.resolve("Klaus");
        AgentSnapshotLoader loader = new AgentSnapshotLoader();
        loader.save(AgentMemories.empty("Klaus"), folder);
        Files.writeString(new SnapshotLayout(folder).associativeMemory().resolve(AssociativeMemoryStore.NODES_FILE),
            "{\"node_1\": {\"node_count\": 1, \"type_count\": 1, \"type\": \"event\", \"predicate\": \"is\"}}");

        assertThatThrownBy(() -> loader.load(folder))
            .isInstanceOfSatisfying(CorruptSnapshotException.class,
                e -> assertThat(e.getStore()).isEqualTo("associative memory"))
            .hasRootCauseInstanceOf(JsonParseException.class);
    }

    @Test
    void keywordsKeepInsertionOrderAcrossSaveAndLoad() throws IOException {
        Set<String> keywords = new LinkedHashSet<>(List.of("Zebra", "apple", "Mango"));
        MemoryNode node = memory.addEvent(T0, null, "Klaus", "is", "shopping", "Klaus is shopping", keywords, 2,
            "Klaus is shopping", List.of());

        assertThat(node.keywords()).containsExactly("zebra", "apple", "mango");

        Path folder = tempDir.resolve("associative_memory");
        new AssociativeMemoryStore().save(memory, folder);
        MemoryNode loaded = new AssociativeMemoryStore().load(folder).getNode("node_1").orElseThrow();

        assertThat(loaded.keywords()).containsExactly("zebra", "apple", "mango");
    }

    private MemoryNode event(String subject, String predicate, String object, String... keywords) {
        String description = subject + " " + predicate + " " + object;
        return memory.addEvent(T0, null, subject, predicate, object, description, Set.of(keywords), 2,
            description, List.of());
    }

    private MemoryNode thought(List<String> filling) {
        return memory.addThought(T0, null, "Klaus", "is", "studious", "Klaus is studious", Set.of("Klaus"), 6,
            "Klaus is studious", filling);
    }
}
