package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.model.AgentDefinition;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.ScheduleClass;
import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskKind;
import com.proof2pay.orchestrator.model.TaskOrigin;
import com.proof2pay.orchestrator.model.TaskPriority;
import com.proof2pay.orchestrator.model.TaskRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Time-driven producer of tasks.
 *
 * <p>
 * Each tick:
 * <ul>
 * <li>opens the daily cycle when its time has come</li>
 * <li>emits one task per due agent and advances its next fire time past now</li>
 * <li>emits the briefing of every cycle whose tasks are all complete</li>
 * <li>compacts agent memory when the compaction interval has passed</li>
 * </ul>
 * A failing tick is logged and retried on the next one.
 */
@Slf4j
@Service
public class AgentScheduler implements TaskCompletionListener {

    private static final int DIGEST_LINE_CHARS = 300;

    @Value("${agent.scheduler.enabled:true}")
    private boolean enabled = true;

    @Value("${agent.scheduler.tick-seconds:60}")
    private long tickSeconds = 60;

    @Value("${agent.scheduler.compaction-hours:24}")
    private long compactionHours = 24;

    @Value("${agent.scheduler.zone:America/New_York}")
    private String zone = "America/New_York";

    private final AgentRosterService roster;
    private final SchedulerState state;
    private final TaskDispatcher dispatcher;
    private final MemoryStoreService memoryStore;
    private final Clock clock;

    private final AtomicBoolean ticking = new AtomicBoolean();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public AgentScheduler(AgentRosterService roster, SchedulerState state, TaskDispatcher dispatcher,
                          MemoryStoreService memoryStore, Clock clock) {
        this.roster = roster;
        this.state = state;
        this.dispatcher = dispatcher;
        this.memoryStore = memoryStore;
        this.clock = clock;
        dispatcher.addCompletionListener(this);
    }

    public void setCompactionHours(long compactionHours) {
        this.compactionHours = compactionHours;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("[Scheduler] Disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agent-scheduler");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, 1, tickSeconds, TimeUnit.SECONDS);
        log.info("[Scheduler] Started with tick interval: {}s", tickSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        state.flush();
        log.info("[Scheduler] Shut down");
    }

    public void tick() {
        if (!ticking.compareAndSet(false, true)) {
            log.debug("[Scheduler] Tick skipped: previous tick still in progress");
            return;
        }
        try {
            Instant now = clock.instant();
            List<AgentDefinition> agents = roster.getTimeTriggeredAgents();
            state.init(agents, now);

            Optional<String> cycleId = state.openCycleIfDue(now);
            List<AgentDefinition> due = state.dueAgents(agents, now);
            if (!due.isEmpty()) {
                log.info("[Scheduler] Tick: {} due agents", due.size());
            }
            for (AgentDefinition agent : due) {
                emit(agent, cycleId.orElse(null), now);
                Instant next = state.advance(agent, now);
                log.debug("[Scheduler] {} next fires at {}", agent.getId(), next);
            }
            cycleId.ifPresent(state::seal);

            emitReadyBriefings();

            if (state.compactionDue(now, compactionHours)) {
                memoryStore.compactAll();
                state.markCompacted(now);
            }
            state.flush();
        } catch (RuntimeException e) {
            log.error("[Scheduler] Tick failed, retrying next tick: {}", e.getMessage(), e);
        } finally {
            ticking.set(false);
        }
    }

    /**
     * Opens a cycle now and fires every time-triggered agent once. Next fire times are left alone.
     *
     * @return the id of the opened cycle
     */
    public String runDailyCycleNow() {
        Instant now = clock.instant();
        String cycleId = state.openCycle(LocalDate.ofInstant(now, ZoneId.of(zone)).toString());
        for (AgentDefinition agent : roster.getTimeTriggeredAgents()) {
            emit(agent, cycleId, now);
        }
        state.seal(cycleId);
        emitReadyBriefings();
        return cycleId;
    }

    /**
     * Daily cycles whose briefing is still outstanding.
     */
    public List<String> openCycles() {
        return state.openCycleIds();
    }

    /**
     * Fires an agent outside its schedule. The results are stored, not posted.
     *
     * @throws IllegalArgumentException
     *             if the agent is not in the roster
     */
    public Task trigger(String agentId, String payload) {
        return trigger(agentId, payload, null);
    }

    /**
     * Fires an agent outside its schedule. With a reply channel the task is handled like a human request and its
     * result is posted there.
     */
    public Task trigger(String agentId, String payload, String replyChannel) {
        AgentDefinition agent = roster.getAgent(agentId)
            .filter(candidate -> roster.isKnownAgent(candidate.getId()))
            .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + agentId));

        boolean interactive = replyChannel != null && !replyChannel.isBlank();
        String instruction = payload == null || payload.isBlank() ? defaultInstruction(agent) : payload;
        Task task = Task.builder()
            .id(TaskDispatcher.newTaskId())
            .origin(interactive ? TaskOrigin.HUMAN_MESSAGE : TaskOrigin.SCHEDULE)
            .targetAgentIds(List.of(agent.getId()))
            .instruction(instruction)
            .hints(Map.of(Task.HINT_TRIGGER, "event"))
            .priority(interactive ? TaskPriority.INTERACTIVE : TaskPriority.HIGH)
            .createdAt(clock.instant())
            .channel(interactive ? replyChannel : null)
            .build();
        dispatcher.enqueue(task);
        log.info("[Scheduler] Triggered {} with task {}", agentId, task.getId());
        return task;
    }

    @Override
    public void onTaskCompleted(TaskRecord record) {
        Task task = record.getTask();
        if (task.getCycleId() == null || task.getKind() == TaskKind.BRIEFING) {
            return;
        }
        List<String> digestLines = new ArrayList<>();
        for (Run run : record.getRuns()) {
            if (run.isSucceeded()) {
                digestLines.add("- " + roster.displayName(run.getAgentId()) + ": " + abbreviate(run.getResult()));
            }
        }
        state.completeCycleTask(task.getCycleId(), task.getId(), (int) record.countSucceeded(),
            (int) record.countFailed(), digestLines);
        emitReadyBriefings();
    }

    private void emit(AgentDefinition agent, String cycleId, Instant now) {
        Task task = Task.builder()
            .id(TaskDispatcher.newTaskId())
            .origin(TaskOrigin.SCHEDULE)
            .targetAgentIds(List.of(agent.getId()))
            .instruction(defaultInstruction(agent))
            .hints(Map.of(Task.HINT_TRIGGER, agent.getScheduleClass().toValue()))
            .priority(agent.getScheduleClass() == ScheduleClass.DAILY ? TaskPriority.NORMAL : TaskPriority.LOW)
            .createdAt(now)
            .cycleId(cycleId)
            .build();
        if (cycleId != null) {
            state.registerCycleTask(cycleId, task.getId());
        }
        dispatcher.enqueue(task);
        log.info("[Scheduler] Emitted task {} for {} (cycle {})", task.getId(), agent.getId(), cycleId);
    }

    private void emitReadyBriefings() {
        for (SchedulerState.Cycle cycle : state.claimReadyCycles()) {
            String digest = String.join("\n", cycle.getDigestLines());
            Map<String, String> hints = new HashMap<>();
            hints.put(Task.HINT_CYCLE_DIGEST, digest);
            hints.put(Task.HINT_CYCLE_SUCCEEDED, String.valueOf(cycle.getSucceededRuns()));
            hints.put(Task.HINT_CYCLE_FAILED, String.valueOf(cycle.getFailedRuns()));

            Task briefing = Task.builder()
                .id(TaskDispatcher.newTaskId())
                .origin(TaskOrigin.SCHEDULE)
                .kind(TaskKind.BRIEFING)
                .targetAgentIds(List.of(roster.getChiefOfStaffId()))
                .instruction(briefingInstruction(cycle.getCycleId(), digest))
                .hints(Map.copyOf(hints))
                .priority(TaskPriority.HIGH)
                .createdAt(clock.instant())
                .cycleId(cycle.getCycleId())
                .build();
            dispatcher.enqueue(briefing);
            log.info("[Scheduler] Cycle {} complete ({} succeeded, {} failed), briefing task {} emitted",
                cycle.getCycleId(), cycle.getSucceededRuns(), cycle.getFailedRuns(), briefing.getId());
        }
    }

    private static String briefingInstruction(String cycleId, String digest) {
        StringBuilder instruction = new StringBuilder();
        instruction.append("Compile the daily briefing for ").append(cycleId)
            .append(" for the founders. Lead with anything that needs a decision today, ")
            .append("then summarize what changed.");
        if (digest.isBlank()) {
            instruction.append("\n\nNo scheduled agent reported in this cycle.");
        } else {
            instruction.append("\n\nFindings of this cycle:\n").append(digest);
        }
        return instruction.toString();
    }

    private static String defaultInstruction(AgentDefinition agent) {
        if (agent.getDefaultInstruction() != null && !agent.getDefaultInstruction().isBlank()) {
            return agent.getDefaultInstruction();
        }
        return "Run your " + agent.getScheduleClass().toValue()
            + " review and report what changed since your last report.";
    }

    private static String abbreviate(String text) {
        String collapsed = text == null ? "" : text.replaceAll("\\s+", " ").trim();
        return collapsed.length() <= DIGEST_LINE_CHARS ? collapsed
            : collapsed.substring(0, DIGEST_LINE_CHARS - 3) + "...";
    }
}
