package com.proof2pay.orchestrator.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.proof2pay.orchestrator.model.AgentDefinition;
import com.proof2pay.orchestrator.model.ScheduleClass;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Process-wide scheduling state: each agent's next fire time, the next daily-cycle time and the open cycles that
 * gate briefings. {@link #init} loads the persisted table, {@link #flush} writes it back.
 *
 * <p>
 * Cycles live in memory only. A cycle open at shutdown never gets its briefing.
 */
@Slf4j
@Component
public class SchedulerState {

    private static final String STATE_FILE = "scheduler-state.json";

    @Value("${agent.data.path:data}")
    private String dataPath = "data";

    @Value("${agent.scheduler.daily-hour:7}")
    private int dailyHour = 7;

    @Value("${agent.scheduler.daily-minute:0}")
    private int dailyMinute = 0;

    @Value("${agent.scheduler.zone:America/New_York}")
    private String zone = "America/New_York";

    private final ObjectMapper mapper;

    private final Map<String, Instant> nextFire = new TreeMap<>();
    private final Map<String, Cycle> cycles = new LinkedHashMap<>();
    private Instant nextCycleAt;
    // Date of the newest cycle and how many cycles were opened on it
    private String cycleDate;
    private int cyclesOnDate;
    private Instant lastCompactionAt;
    private boolean loaded;

    public SchedulerState() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public void setDailyTime(int hour, int minute) {
        this.dailyHour = hour;
        this.dailyMinute = minute;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    /**
     * Loads the persisted table on first use and makes sure every time-triggered agent has a next fire time.
     *
     * @throws IllegalStateException
     *             if the persisted state cannot be read; the next call tries again
     */
    public synchronized void init(List<AgentDefinition> timeTriggered, Instant now) {
        if (!loaded) {
            load();
            loaded = true;
        }

        Set<String> ids = new HashSet<>();
        for (AgentDefinition agent : timeTriggered) {
            ids.add(agent.getId());
            nextFire.computeIfAbsent(agent.getId(), id -> initialFire(agent, now));
        }
        nextFire.keySet().retainAll(ids);

        if (nextCycleAt == null) {
            nextCycleAt = nextDailyTime(now);
        }
    }

    public synchronized List<AgentDefinition> dueAgents(List<AgentDefinition> agents, Instant now) {
        List<AgentDefinition> due = new ArrayList<>();
        for (AgentDefinition agent : agents) {
            Instant fire = nextFire.get(agent.getId());
            if (fire != null && !fire.isAfter(now)) {
                due.add(agent);
            }
        }
        return due;
    }

    /**
     * Moves the agent's next fire time forward by whole periods until it lies after {@code now}. Missed periods are
     * skipped, never replayed.
     */
    public synchronized Instant advance(AgentDefinition agent, Instant now) {
        long periodDays = agent.getScheduleClass().getPeriodDays();
        if (periodDays <= 0) {
            throw new IllegalArgumentException(agent.getId() + " is not time-triggered");
        }
        ZonedDateTime next = nextFire.getOrDefault(agent.getId(), now).atZone(zoneId());
        while (!next.toInstant().isAfter(now)) {
            next = next.plusDays(periodDays);
        }
        nextFire.put(agent.getId(), next.toInstant());
        return next.toInstant();
    }

    public synchronized Optional<Instant> getNextFire(String agentId) {
        return Optional.ofNullable(nextFire.get(agentId));
    }

    public synchronized void setNextFire(String agentId, Instant at) {
        nextFire.put(agentId, at);
    }

    public synchronized Instant getNextCycleAt() {
        return nextCycleAt;
    }

    /**
     * Opens the daily cycle if its time has come, named after the current local date.
     */
    public synchronized Optional<String> openCycleIfDue(Instant now) {
        if (nextCycleAt == null || nextCycleAt.isAfter(now)) {
            return Optional.empty();
        }
        ZonedDateTime next = nextCycleAt.atZone(zoneId());
        while (!next.toInstant().isAfter(now)) {
            next = next.plusDays(1);
        }
        nextCycleAt = next.toInstant();
        return Optional.of(openCycle(LocalDate.ofInstant(now, zoneId()).toString()));
    }

    /**
     * Opens a new cycle. A second cycle on the same date gets a numeric suffix.
     */
    public synchronized String openCycle(String baseId) {
        if (!baseId.equals(cycleDate)) {
            cycleDate = baseId;
            cyclesOnDate = 0;
        }
        String cycleId = ++cyclesOnDate == 1 ? baseId : baseId + "-" + cyclesOnDate;
        while (cycles.containsKey(cycleId)) {
            cycleId = baseId + "-" + ++cyclesOnDate;
        }
        cycles.put(cycleId, new Cycle(cycleId));
        log.info("[Scheduler] Opened cycle {}", cycleId);
        return cycleId;
    }

    public synchronized void registerCycleTask(String cycleId, String taskId) {
        requireCycle(cycleId).outstanding.add(taskId);
    }

    /**
     * No more tasks join the cycle after this.
     */
    public synchronized void seal(String cycleId) {
        requireCycle(cycleId).sealed = true;
    }

    /**
     * Records a finished cycle task. Unknown cycles and tasks are ignored.
     */
    public synchronized void completeCycleTask(String cycleId, String taskId, int succeeded, int failed,
                                               List<String> digestLines) {
        Cycle cycle = cycles.get(cycleId);
        if (cycle == null || !cycle.outstanding.remove(taskId)) {
            return;
        }
        cycle.succeededRuns += succeeded;
        cycle.failedRuns += failed;
        cycle.digestLines.addAll(digestLines);
    }

    /**
     * Removes and returns every cycle that is sealed and has no outstanding task. Each cycle is returned exactly
     * once; late completions for it are ignored afterwards.
     */
    public synchronized List<Cycle> claimReadyCycles() {
        List<Cycle> ready = new ArrayList<>();
        Iterator<Cycle> open = cycles.values().iterator();
        while (open.hasNext()) {
            Cycle cycle = open.next();
            if (cycle.sealed && cycle.outstanding.isEmpty()) {
                open.remove();
                ready.add(cycle);
            }
        }
        return ready;
    }

    /**
     * Cycles still waiting for their briefing, in the order they were opened.
     */
    public synchronized List<String> openCycleIds() {
        return new ArrayList<>(cycles.keySet());
    }

    public synchronized boolean compactionDue(Instant now, long intervalHours) {
        return lastCompactionAt == null || !now.isBefore(lastCompactionAt.plus(Duration.ofHours(intervalHours)));
    }

    public synchronized void markCompacted(Instant now) {
        this.lastCompactionAt = now;
    }

    public synchronized void flush() {
        Path stateFile = Paths.get(dataPath, STATE_FILE).toAbsolutePath();
        Path tmp = stateFile.resolveSibling(STATE_FILE + ".tmp");
        PersistedState persisted = new PersistedState();
        persisted.setNextFire(new TreeMap<>(nextFire));
        persisted.setNextCycleAt(nextCycleAt);
        persisted.setLastCompactionAt(lastCompactionAt);
        try {
            Files.createDirectories(stateFile.getParent());
            Files.writeString(tmp, mapper.writeValueAsString(persisted), StandardCharsets.UTF_8);
            Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("[Scheduler] Failed to write {}: {}", stateFile, e.getMessage());
        }
    }

    Instant initialFire(AgentDefinition agent, Instant now) {
        if (agent.getScheduleClass() == ScheduleClass.DAILY) {
            return nextDailyTime(now);
        }
        ZonedDateTime local = now.atZone(zoneId());
        ZonedDateTime candidate = local.with(TemporalAdjusters.nextOrSame(agent.getWeekday()))
            .with(dailyTime());
        if (candidate.toInstant().isBefore(now)) {
            candidate = candidate.plusWeeks(1);
        }
        return candidate.toInstant();
    }

    private Instant nextDailyTime(Instant now) {
        ZonedDateTime candidate = now.atZone(zoneId()).with(dailyTime());
        if (candidate.toInstant().isBefore(now)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }

    private void load() {
        Path stateFile = Paths.get(dataPath, STATE_FILE);
        if (!Files.exists(stateFile)) {
            return;
        }
        try {
            PersistedState persisted = mapper.readValue(stateFile.toFile(), PersistedState.class);
            nextFire.putAll(persisted.getNextFire());
            nextCycleAt = persisted.getNextCycleAt();
            lastCompactionAt = persisted.getLastCompactionAt();
            log.info("[Scheduler] Restored next fire times for {} agents", nextFire.size());
        } catch (IOException e) {
            throw new IllegalStateException("Scheduler state unreadable: " + stateFile, e);
        }
    }

    private Cycle requireCycle(String cycleId) {
        Cycle cycle = cycles.get(cycleId);
        if (cycle == null) {
            throw new IllegalArgumentException("Unknown cycle " + cycleId);
        }
        return cycle;
    }

    private LocalTime dailyTime() {
        return LocalTime.of(dailyHour, dailyMinute);
    }

    private ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    /**
     * One daily cycle. Mutated only under the state's lock.
     */
    @Getter
    public static class Cycle {
        private final String cycleId;
        private final Set<String> outstanding = new HashSet<>();
        private final List<String> digestLines = new ArrayList<>();
        private int succeededRuns;
        private int failedRuns;
        private boolean sealed;

        Cycle(String cycleId) {
            this.cycleId = cycleId;
        }
    }

    @Data
    static class PersistedState {
        private Map<String, Instant> nextFire = new TreeMap<>();
        private Instant nextCycleAt;
        private Instant lastCompactionAt;
    }
}
