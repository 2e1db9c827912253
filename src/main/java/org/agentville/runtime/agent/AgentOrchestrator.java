package org.agentville.runtime.agent;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import org.agentville.runtime.memory.AgentWorkingState;
import org.agentville.runtime.memory.AssociativeMemory;
import org.agentville.runtime.memory.MemoryNode;
import org.agentville.runtime.memory.RetrievedContext;
import org.agentville.runtime.memory.SpatialMemory;
import org.agentville.runtime.model.TileCoord;
import org.agentville.runtime.model.WorldGrid;
import org.agentville.runtime.snapshot.AgentMemories;
import org.agentville.runtime.snapshot.AgentSnapshotLoader;
import org.agentville.runtime.spi.CognitiveModules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one agent's per-tick pipeline and owns its tick-scoped state.
 * <p>
 * Every {@link #tick} executes the same fixed sequence: update position, detect a day boundary,
 * update time, then perceive, retrieve, plan, reflect and execute through the injected
 * {@link CognitiveModules}. There are no alternate paths; reflection runs after every plan.
 * <p>
 * The driver calls {@code tick()} once per simulation step and applies the returned
 * {@link AgentAction} to the world itself.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. One tick must finish before the next starts on the same
 * agent; re-entrant calls fail fast. Different agents may tick on different threads, provided
 * the driver serializes world mutations per tile.
 */
public class AgentOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final String name;
    private final SpatialMemory spatialMemory;
    private final AssociativeMemory associativeMemory;
    private final AgentWorkingState workingState;
    private final CognitiveModules modules;
    private final AgentSnapshotLoader snapshotLoader;
    private TickPhase phase = TickPhase.IDLE;

    /**
     * Creates an orchestrator over already loaded memories.
     *
     * @param name The agent name.
     * @param memories The agent's memory stores.
     * @param modules The cognitive collaborators.
     * @param snapshotLoader Used by {@link #save(Path)}.
     */
    public AgentOrchestrator(String name, AgentMemories memories, CognitiveModules modules,
                             AgentSnapshotLoader snapshotLoader) {
        this.name = Objects.requireNonNull(name, "name");
        this.spatialMemory = memories.spatial();
        this.associativeMemory = memories.associative();
        this.workingState = memories.workingState();
        this.modules = Objects.requireNonNull(modules, "modules");
        this.snapshotLoader = Objects.requireNonNull(snapshotLoader, "snapshotLoader");
    }

    /**
     * Creates an orchestrator from an agent's snapshot folder using the default JSON stores.
     *
     * @param name The agent name.
     * @param agentFolder The snapshot folder (see {@link org.agentville.runtime.snapshot.SnapshotLayout}).
     * @param modules The cognitive collaborators.
     * @return The orchestrator.
     * @throws org.agentville.runtime.snapshot.CorruptSnapshotException if any store cannot be loaded.
     */
    public static AgentOrchestrator fromSnapshot(String name, Path agentFolder, CognitiveModules modules) {
        return fromSnapshot(name, agentFolder, modules, new AgentSnapshotLoader());
    }

    /**
     * Creates an orchestrator from an agent's snapshot folder.
     *
     * @throws org.agentville.runtime.snapshot.CorruptSnapshotException if any store cannot be loaded.
     */
    public static AgentOrchestrator fromSnapshot(String name, Path agentFolder, CognitiveModules modules,
                                                 AgentSnapshotLoader snapshotLoader) {
        AgentMemories memories = snapshotLoader.load(agentFolder);
        return new AgentOrchestrator(name, memories, modules, snapshotLoader);
    }

    // ==================== Tick ====================

    /**
     * Advances the agent by one simulation step.
     * <p>
     * Position and time are written before any collaborator runs and are <em>not</em> rolled
     * back if a later step fails.
     *
     * @param world The shared world.
     * @param peers All agents of the simulation, keyed by name.
     * @param position The agent's tile for this step.
     * @param time The simulation time of this step.
     * @return The action chosen by the executor.
     * @throws CollaboratorFailureException if a collaborator fails; the remaining steps are skipped.
     * @throws IllegalStateException if a tick is already running on this agent.
     */
    public AgentAction tick(WorldGrid world, Map<String, AgentOrchestrator> peers,
                            TileCoord position, LocalDateTime time) {
        Objects.requireNonNull(time, "time");
        if (phase != TickPhase.IDLE) {
            throw new IllegalStateException(
                "Agent '" + name + "' is already ticking (phase " + phase + ")");
        }

        workingState.setCurrentTile(position);
        DayFlag dayFlag = DayFlag.between(workingState.getCurrentTime(), time);
        workingState.setCurrentTime(time);
        LOG.debug("Agent '{}' tick at {} on tile {} ({})", name, time, position, dayFlag);

        try {
            List<MemoryNode> perceived = runStep(TickPhase.PERCEIVING, "perceive",
                () -> modules.perceiver().perceive(this, world));
            Map<String, RetrievedContext> retrieved = runStep(TickPhase.RETRIEVING, "retrieve",
                () -> modules.retriever().retrieve(this, perceived));
            Plan plan = runStep(TickPhase.PLANNING, "plan",
                () -> modules.planner().plan(this, world, peers, dayFlag, retrieved));
            runStep(TickPhase.REFLECTING, "reflect", () -> {
                modules.reflector().reflect(this);
                return null;
            });
            AgentAction action = runStep(TickPhase.EXECUTING, "execute",
                () -> modules.executor().execute(this, world, peers, plan));
            LOG.debug("Agent '{}' plan '{}' -> {}", name, plan == null ? null : plan.actionAddress(), action);
            return action;
        } finally {
            phase = TickPhase.IDLE;
        }
    }

    private <T> T runStep(TickPhase next, String operation, Supplier<T> step) {
        phase = next;
        try {
            return step.get();
        } catch (CollaboratorFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Agent '{}' aborted tick at {}: {} failed: {}",
                name, workingState.getCurrentTime(), operation, e.getMessage());
            throw new CollaboratorFailureException(name, operation, e);
        }
    }

    // ==================== Conversation & persistence ====================

    /**
     * Opens a conversation session through the conversation engine.
     *
     * @param mode The conversation style.
     * @throws CollaboratorFailureException if the conversation engine fails.
     */
    public void openConversation(ConversationMode mode) {
        try {
            modules.conversationEngine().openSession(this, mode);
        } catch (RuntimeException e) {
            LOG.warn("Agent '{}' conversation ({}) failed: {}", name, mode, e.getMessage());
            throw new CollaboratorFailureException(name, "openConversation", e);
        }
    }

    /**
     * Writes the three memory stores into a snapshot folder, one after the other. There is no
     * cross-store atomicity.
     *
     * @param agentFolder The snapshot folder.
     * @throws IOException if a store cannot be written.
     */
    public void save(Path agentFolder) throws IOException {
        snapshotLoader.save(new AgentMemories(spatialMemory, associativeMemory, workingState), agentFolder);
    }

    // ==================== Accessors ====================

    public String getName() {
        return name;
    }

    public SpatialMemory getSpatialMemory() {
        return spatialMemory;
    }

    public AssociativeMemory getAssociativeMemory() {
        return associativeMemory;
    }

    public AgentWorkingState getWorkingState() {
        return workingState;
    }

    /**
     * @return The current pipeline phase; {@link TickPhase#IDLE} between ticks.
     */
    public TickPhase getPhase() {
        return phase;
    }

    @Override
    public String toString() {
        return "AgentOrchestrator{" + name + " @ " + workingState.getCurrentTile() + "}";
    }
}
