package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.client.ChatTransport;
import com.proof2pay.orchestrator.exception.DependencyUnmetException;
import com.proof2pay.orchestrator.exception.MemoryStoreException;
import com.proof2pay.orchestrator.exception.RoutingAmbiguityException;
import com.proof2pay.orchestrator.model.AgentDefinition;
import com.proof2pay.orchestrator.model.Briefing;
import com.proof2pay.orchestrator.model.FollowUpDirective;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskKind;
import com.proof2pay.orchestrator.model.TaskOrigin;
import com.proof2pay.orchestrator.model.TaskRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves tasks into runs, executes them on the worker pool and applies the completion policy: one chat reply for
 * human requests, stored results and follow-ups for scheduled work, a posted briefing for briefing tasks.
 */
@Slf4j
@Service
public class TaskDispatcher {

    @Value("${agent.dispatch.consumer-threads:2}")
    private int consumerThreads = 2;

    @Value("${agent.chat.briefing-channel:}")
    private String briefingChannel = "";

    private final AgentRosterService roster;
    private final AgentRunner runner;
    private final RoutingService routing;
    private final FollowUpExtractor followUps;
    private final ReplyComposer composer;
    private final ChatTransport chat;
    private final TaskQueue queue;
    private final UsageTrackerService usageTracker;
    private final RunLedgerService ledger;
    private final MemoryStoreService memoryStore;
    private final ExecutorService runExecutor;
    private final Clock clock;

    private final Map<String, TaskRecord> inFlight = new ConcurrentHashMap<>();
    private final List<TaskCompletionListener> listeners = new CopyOnWriteArrayList<>();
    // Scheduled failures waiting for the next briefing
    private final ConcurrentLinkedQueue<String> pendingFailures = new ConcurrentLinkedQueue<>();
    private final AtomicReference<Briefing> lastBriefing = new AtomicReference<>();
    private final List<Thread> consumers = new ArrayList<>();
    private volatile boolean running;

    public TaskDispatcher(AgentRosterService roster, AgentRunner runner, RoutingService routing,
                          FollowUpExtractor followUps, ReplyComposer composer, ChatTransport chat, TaskQueue queue,
                          UsageTrackerService usageTracker, RunLedgerService ledger, MemoryStoreService memoryStore,
                          @Qualifier("runExecutor") ExecutorService runExecutor, Clock clock) {
        this.roster = roster;
        this.runner = runner;
        this.routing = routing;
        this.followUps = followUps;
        this.composer = composer;
        this.chat = chat;
        this.queue = queue;
        this.usageTracker = usageTracker;
        this.ledger = ledger;
        this.memoryStore = memoryStore;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    public void setConsumerThreads(int consumerThreads) {
        this.consumerThreads = consumerThreads;
    }

    public void setBriefingChannel(String briefingChannel) {
        this.briefingChannel = briefingChannel;
    }

    @PostConstruct
    public void start() {
        running = true;
        for (int i = 0; i < consumerThreads; i++) {
            Thread consumer = new Thread(this::consumeLoop, "dispatch-loop-" + (i + 1));
            consumer.setDaemon(true);
            consumer.start();
            consumers.add(consumer);
        }
        log.info("[Dispatcher] Started {} consumer threads", consumerThreads);
    }

    @PreDestroy
    public void stop() {
        running = false;
        consumers.forEach(Thread::interrupt);
        ledger.flushInFlight(new ArrayList<>(inFlight.values()));
    }

    public void addCompletionListener(TaskCompletionListener listener) {
        listeners.add(listener);
    }

    public void enqueue(Task task) {
        queue.offer(task);
        log.debug("[Dispatcher] Queued task {} ({}, {}), queue size {}", task.getId(), task.getOrigin(),
            task.getPriority(), queue.size());
    }

    /**
     * Runs a task to completion. Blocks until every run is terminal, then applies the completion policy.
     *
     * @return the task's runs, all terminal
     */
    public List<Run> submit(Task task) {
        TaskRecord record = new TaskRecord(task, clock.instant());
        inFlight.put(task.getId(), record);
        log.info("[Dispatcher] Task {} started: origin={}, kind={}, targets={}", task.getId(), task.getOrigin(),
            task.getKind(), task.getTargetAgentIds());
        try {
            RoutingAmbiguityException ambiguity = null;
            try {
                List<String> targets = resolveTargets(task, record);
                executePlan(task, targets, record);
            } catch (RoutingAmbiguityException e) {
                ambiguity = e;
                log.warn("[Dispatcher] Task {} could not be routed: {}", task.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("[Dispatcher] Task {} aborted while planning runs", task.getId(), e);
            }

            record.markComplete(clock.instant());
            log.info("[Dispatcher] Task {} complete: {} succeeded, {} failed", task.getId(),
                record.countSucceeded(), record.countFailed());
            applyCompletionPolicy(record, ambiguity);
        } finally {
            inFlight.remove(task.getId());
            ledger.record(record);
            notifyListeners(record);
        }
        return List.copyOf(record.getRuns());
    }

    public List<TaskRecord> inFlightTasks() {
        return new ArrayList<>(inFlight.values());
    }

    /**
     * Tasks waiting in the queue, in the order they will be taken.
     */
    public List<Task> queuedTasks() {
        return queue.snapshot();
    }

    /**
     * Finished tasks, newest first.
     */
    public List<TaskRecord> recentTasks(int limit) {
        List<TaskRecord> recent = ledger.recentRecords();
        return recent.size() <= limit ? recent : recent.subList(0, limit);
    }

    public Optional<Briefing> lastBriefing() {
        return Optional.ofNullable(lastBriefing.get());
    }

    public int pendingFailureCount() {
        return pendingFailures.size();
    }

    private void consumeLoop() {
        while (running) {
            try {
                Task task = queue.poll(1, TimeUnit.SECONDS);
                if (task != null) {
                    submit(task);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("[Dispatcher] Consumer loop error: {}", e.getMessage(), e);
            }
        }
    }

    private List<String> resolveTargets(Task task, TaskRecord record) {
        if (!task.getTargetAgentIds().isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(task.getTargetAgentIds()));
        }
        if (task.getOrigin() != TaskOrigin.HUMAN_MESSAGE) {
            throw new RoutingAmbiguityException(task.getId(),
                "Task " + task.getId() + " from " + task.getOrigin() + " has no target agents");
        }

        Run routingRun = runner.execute(roster.getRouterAgent(), routing.routingTask(task));
        record.addRun(routingRun);
        if (!routingRun.isSucceeded()) {
            log.warn("[Dispatcher] Routing run for task {} failed: {}", task.getId(), routingRun.getError());
            return List.of();
        }
        List<String> selected = routing.resolve(task, routingRun.getResult());
        log.info("[Dispatcher] Task {} routed to {}", task.getId(), selected);
        return selected;
    }

    private void executePlan(Task task, List<String> targets, TaskRecord record) {
        Set<String> targetSet = new LinkedHashSet<>(targets);
        Map<String, CompletableFuture<Run>> futures = new LinkedHashMap<>();
        try {
            for (String agentId : targets) {
                schedule(agentId, task, targetSet, futures, record);
            }
        } finally {
            // runs already handed to the pool finish before the task can complete
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        }
    }

    /**
     * Schedules one agent's run after the runs of its in-task upstream agents. Composed without blocking a worker.
     */
    private CompletableFuture<Run> schedule(String agentId, Task task, Set<String> targets,
                                            Map<String, CompletableFuture<Run>> futures, TaskRecord record) {
        CompletableFuture<Run> existing = futures.get(agentId);
        if (existing != null) {
            return existing;
        }

        if (!roster.isKnownAgent(agentId)) {
            Run rejected = runner.rejectUnknownAgent(agentId, task);
            record.addRun(rejected);
            CompletableFuture<Run> done = CompletableFuture.completedFuture(rejected);
            futures.put(agentId, done);
            return done;
        }

        AgentDefinition agent = roster.getAgent(agentId).orElseThrow();
        List<CompletableFuture<Run>> upstream = new ArrayList<>();
        for (String upstreamId : agent.getDependsOn()) {
            if (targets.contains(upstreamId)) {
                upstream.add(schedule(upstreamId, task, targets, futures, record));
            }
        }

        CompletableFuture<Run> future;
        if (upstream.isEmpty()) {
            try {
                future = CompletableFuture.supplyAsync(() -> runner.execute(agent, task), runExecutor);
            } catch (RejectedExecutionException e) {
                log.warn("[Dispatcher] Worker pool rejected {} for task {}", agentId, task.getId());
                future = CompletableFuture.failedFuture(e);
            }
        } else {
            future = CompletableFuture.allOf(upstream.toArray(new CompletableFuture[0]))
                .thenApplyAsync(ignored -> runAfterUpstream(agent, task, upstream), runExecutor);
        }

        CompletableFuture<Run> recorded = future
            .exceptionally(e -> runner.internalFailure(agentId, task, e))
            .thenApply(run -> {
                record.addRun(run);
                return run;
            });
        futures.put(agentId, recorded);
        return recorded;
    }

    private Run runAfterUpstream(AgentDefinition agent, Task task, List<CompletableFuture<Run>> upstream) {
        List<Run> upstreamRuns = upstream.stream().map(CompletableFuture::join).toList();
        for (Run upstreamRun : upstreamRuns) {
            if (!upstreamRun.isSucceeded()) {
                return runner.skip(agent, task, new DependencyUnmetException(agent.getId(), upstreamRun.getAgentId()));
            }
        }
        return runner.execute(agent, task, upstreamRuns);
    }

    private void applyCompletionPolicy(TaskRecord record, RoutingAmbiguityException ambiguity) {
        Task task = record.getTask();
        for (Run run : record.getRuns()) {
            usageTracker.recordRun(run);
        }

        if (task.getKind() == TaskKind.BRIEFING) {
            publishBriefing(record);
            // the chief of staff dispatches remediation work from the briefing
            if (task.getHop() == 0) {
                spawnFollowUps(record);
            }
            return;
        }

        switch (task.getOrigin()) {
            case HUMAN_MESSAGE -> replyToHuman(record, ambiguity);
            case SCHEDULE, AGENT_OUTPUT -> {
                recordFailures(record, ambiguity);
                if (task.getOrigin() == TaskOrigin.SCHEDULE && task.getHop() == 0) {
                    spawnFollowUps(record);
                }
            }
        }
    }

    private void replyToHuman(TaskRecord record, RoutingAmbiguityException ambiguity) {
        Task task = record.getTask();
        String text = ambiguity != null ? composer.clarification(task) : composer.composeReply(record);
        if (task.getChannel() == null || task.getChannel().isBlank()) {
            log.warn("[Dispatcher] Human task {} has no reply channel, reply dropped: {}", task.getId(), text);
            return;
        }
        try {
            chat.post(task.getChannel(), text);
        } catch (RuntimeException e) {
            log.error("[Dispatcher] Failed to post reply for task {}: {}", task.getId(), e.getMessage(), e);
        }
    }

    private void recordFailures(TaskRecord record, RoutingAmbiguityException ambiguity) {
        Task task = record.getTask();
        if (ambiguity != null) {
            pendingFailures.add("Task " + task.getId() + " was not dispatched: " + ambiguity.getMessage());
        }
        for (Run run : record.getRuns()) {
            if (run.isFailed()) {
                pendingFailures.add(composer.failureLine(task, run));
            }
        }
    }

    private void spawnFollowUps(TaskRecord record) {
        Task parent = record.getTask();
        for (FollowUpDirective directive : followUps.collect(record.getRuns())) {
            Task followUp = Task.builder()
                .id(newTaskId())
                .origin(TaskOrigin.AGENT_OUTPUT)
                .targetAgentIds(List.of(directive.getTargetAgentId()))
                .instruction(directive.getInstruction())
                .hints(Map.of(Task.HINT_SOURCE_AGENT, directive.getSourceAgentId()))
                .priority(parent.getPriority())
                .createdAt(clock.instant())
                .parentTaskId(parent.getId())
                .hop(parent.getHop() + 1)
                .build();
            log.info("[Dispatcher] {} requested follow-up {} by {}", directive.getSourceAgentId(), followUp.getId(),
                directive.getTargetAgentId());
            enqueue(followUp);
        }
    }

    private void publishBriefing(TaskRecord record) {
        Task task = record.getTask();
        String body = record.getRuns().stream()
            .filter(Run::isSucceeded)
            .map(Run::getResult)
            .findFirst()
            .orElseGet(() -> fallbackDigest(task));

        List<String> failures = new ArrayList<>();
        String line;
        while ((line = pendingFailures.poll()) != null) {
            failures.add(line);
        }
        for (Run run : record.getRuns()) {
            if (run.isFailed()) {
                failures.add(composer.failureLine(task, run));
            }
        }

        String text = composer.briefingText(task.getCycleId(), body, failures);
        Briefing briefing = Briefing.builder()
            .cycleId(task.getCycleId())
            .text(text)
            .createdAt(clock.instant())
            .succeededRuns(intHint(task, Task.HINT_CYCLE_SUCCEEDED))
            .failedRuns(intHint(task, Task.HINT_CYCLE_FAILED))
            .failureLines(List.copyOf(failures))
            .build();
        lastBriefing.set(briefing);

        if (briefingChannel != null && !briefingChannel.isBlank()) {
            try {
                chat.post(briefingChannel, text);
            } catch (RuntimeException e) {
                log.error("[Dispatcher] Failed to post briefing {}: {}", briefing.getCycleId(), e.getMessage(), e);
            }
        } else {
            log.info("[Dispatcher] No briefing channel configured, briefing {} kept in memory only",
                briefing.getCycleId());
        }

        try {
            memoryStore.record(AgentRosterService.BRIEFING_AGENT_ID, task.getId(), text,
                composer.briefingStatus(briefing), briefing.getCreatedAt());
        } catch (MemoryStoreException e) {
            log.error("[Dispatcher] Failed to store briefing {}: {}", briefing.getCycleId(), e.getMessage(), e);
        }
        log.info("[Dispatcher] {}", composer.briefingStatus(briefing));
    }

    private static String fallbackDigest(Task task) {
        String digest = task.hint(Task.HINT_CYCLE_DIGEST);
        if (digest == null || digest.isBlank()) {
            return "_The chief of staff could not compile a briefing and no cycle findings were recorded._";
        }
        return "_The chief of staff could not compile a briefing. Raw findings of this cycle:_\n\n" + digest;
    }

    private static int intHint(Task task, String key) {
        String value = task.hint(key);
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("[Dispatcher] Ignoring non-numeric hint {}={} on task {}", key, value, task.getId());
            return 0;
        }
    }

    private void notifyListeners(TaskRecord record) {
        for (TaskCompletionListener listener : listeners) {
            try {
                listener.onTaskCompleted(record);
            } catch (RuntimeException e) {
                log.error("[Dispatcher] Completion listener failed for task {}: {}", record.getTask().getId(),
                    e.getMessage(), e);
            }
        }
    }

    static String newTaskId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
