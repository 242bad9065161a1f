package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.client.DocumentStore;
import com.proof2pay.orchestrator.client.ReasoningClient;
import com.proof2pay.orchestrator.exception.DependencyUnmetException;
import com.proof2pay.orchestrator.exception.ExternalCallException;
import com.proof2pay.orchestrator.exception.MemoryStoreException;
import com.proof2pay.orchestrator.exception.TransientExternalException;
import com.proof2pay.orchestrator.model.AgentDefinition;
import com.proof2pay.orchestrator.model.AttemptRecord;
import com.proof2pay.orchestrator.model.ConversationTurn;
import com.proof2pay.orchestrator.model.MemoryContext;
import com.proof2pay.orchestrator.model.MemoryEntry;
import com.proof2pay.orchestrator.model.ModelTier;
import com.proof2pay.orchestrator.model.ReasoningRequest;
import com.proof2pay.orchestrator.model.ReasoningResult;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.RunError;
import com.proof2pay.orchestrator.model.RunErrorKind;
import com.proof2pay.orchestrator.model.RunStatus;
import com.proof2pay.orchestrator.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes one agent against one task. Builds the context, calls the reasoning client with bounded retry and
 * exponential backoff, and persists a successful result to memory before returning. Never posts to chat and never
 * throws: every outcome comes back as a terminal {@link Run}.
 *
 * <p>
 * Runs of the same agent are serialized; different agents run in parallel.
 */
@Slf4j
@Service
public class AgentRunner {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private static final String SECTION_SEPARATOR = "\n\n---\n\n";
    private static final int SUMMARY_MAX_CHARS = 400;
    private static final int HISTORY_TURNS = 20;
    static final String SHARED_CONTEXT_FOLDER = "context";
    static final String PRIORITIES_REF = "priorities.md";

    @Value("${agent.runner.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${agent.runner.initial-backoff-ms:2000}")
    private long initialBackoffMs = 2000;

    @Value("${agent.runner.backoff-multiplier:2.0}")
    private double backoffMultiplier = 2.0;

    @Value("${agent.runner.max-backoff-ms:60000}")
    private long maxBackoffMs = 60000;

    @Value("${agent.memory.context-budget:6000}")
    private int contextBudget = 6000;

    private final ReasoningClient reasoningClient;
    private final MemoryStoreService memoryStore;
    private final PromptService promptService;
    private final DocumentStore documentStore;
    private final Clock clock;

    private final Map<String, ReentrantLock> agentLocks = new ConcurrentHashMap<>();
    private Sleeper sleeper = Thread::sleep;

    public AgentRunner(ReasoningClient reasoningClient, MemoryStoreService memoryStore, PromptService promptService,
                       DocumentStore documentStore, Clock clock) {
        this.reasoningClient = reasoningClient;
        this.memoryStore = memoryStore;
        this.promptService = promptService;
        this.documentStore = documentStore;
        this.clock = clock;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public void setContextBudget(int contextBudget) {
        this.contextBudget = contextBudget;
    }

    public void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public Run execute(AgentDefinition agent, Task task) {
        return execute(agent, task, List.of());
    }

    /**
     * @param upstreamRuns
     *            finished runs of the agents this one depends on; their results are injected into the context
     */
    public Run execute(AgentDefinition agent, Task task, List<Run> upstreamRuns) {
        Run run = newRun(task, agent.getId());
        ModelTier tier = resolveModelTier(agent, task);
        run.setModelTier(tier);

        ReentrantLock lock = agentLocks.computeIfAbsent(agent.getId(), id -> new ReentrantLock());
        lock.lock();
        try {
            run.setStartedAt(clock.instant());
            run.setStatus(RunStatus.RUNNING);
            log.info("[Runner] {} started on task {} ({})", agent.getId(), task.getId(), tier.toValue());

            ReasoningRequest request;
            try {
                request = buildRequest(agent, task, upstreamRuns, tier);
            } catch (ExternalCallException e) {
                log.warn("[Runner] {} could not assemble context for task {}: {}", agent.getId(), task.getId(),
                    e.getMessage());
                return fail(run, RunError.from(e));
            } catch (MemoryStoreException e) {
                log.error("[Runner] {} could not read memory: {}", agent.getId(), e.getMessage(), e);
                return fail(run, RunError.of(RunErrorKind.INTERNAL, e.getMessage()));
            }

            return attempt(agent, task, run, request);
        } catch (RuntimeException e) {
            log.error("[Runner] Unexpected failure running {} on task {}", agent.getId(), task.getId(), e);
            return fail(run, RunError.of(RunErrorKind.INTERNAL, String.valueOf(e.getMessage())));
        } finally {
            lock.unlock();
        }
    }

    /**
     * A run that is never started because an upstream run in the same task did not succeed.
     */
    public Run skip(AgentDefinition agent, Task task, DependencyUnmetException cause) {
        Run run = newRun(task, agent.getId());
        run.setModelTier(resolveModelTier(agent, task));
        run.setStartedAt(clock.instant());
        log.warn("[Runner] {}", cause.getMessage());
        return fail(run, RunError.of(RunErrorKind.DEPENDENCY_UNMET, cause.getMessage()));
    }

    public Run rejectUnknownAgent(String agentId, Task task) {
        Run run = newRun(task, agentId);
        run.setStartedAt(clock.instant());
        log.warn("[Runner] Task {} targets unknown agent {}", task.getId(), agentId);
        return fail(run, RunError.of(RunErrorKind.UNKNOWN_AGENT, "Unknown agent: " + agentId));
    }

    /**
     * Terminal record for a run whose execution blew up outside the runner's own handling.
     */
    public Run internalFailure(String agentId, Task task, Throwable cause) {
        Run run = newRun(task, agentId);
        run.setStartedAt(clock.instant());
        return fail(run, RunError.of(RunErrorKind.INTERNAL, String.valueOf(cause.getMessage())));
    }

    long backoffDelay(int failedAttempt) {
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, failedAttempt - 1);
        return (long) Math.min(delay, maxBackoffMs);
    }

    private Run attempt(AgentDefinition agent, Task task, Run run, ReasoningRequest request) {
        RunError lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            run.setAttemptCount(attempt);
            ReasoningResult result;
            try {
                result = reasoningClient.invoke(agent.getId(), request);
                if (result == null || result.getText() == null || result.getText().isBlank()) {
                    throw new TransientExternalException(RunErrorKind.MALFORMED_OUTPUT,
                        "Empty output from " + agent.getId());
                }
            } catch (ExternalCallException e) {
                lastError = RunError.from(e);
                run.getAttempts().add(new AttemptRecord(attempt, clock.instant(), false, e.getKind(), e.getMessage()));

                if (!e.isRetryable()) {
                    log.warn("[Runner] {} attempt {} failed permanently: {}", agent.getId(), attempt, e.getMessage());
                    break;
                }
                if (attempt == maxAttempts) {
                    log.warn("[Runner] {} gave up after {} attempts: {}", agent.getId(), attempt, e.getMessage());
                    break;
                }

                long delay = backoffDelay(attempt);
                run.setStatus(RunStatus.RETRYING);
                log.warn("[Runner] {} attempt {} failed ({}), retrying in {} ms", agent.getId(), attempt,
                    e.getKind(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    lastError = RunError.of(RunErrorKind.INTERNAL, "Interrupted while waiting to retry");
                    break;
                }
                run.setStatus(RunStatus.RUNNING);
                continue;
            }

            run.setUsage(run.getUsage().plus(result.getUsage()));
            run.getAttempts().add(new AttemptRecord(attempt, clock.instant(), true, null, null));
            return succeed(agent, task, run, result.getText().trim());
        }
        return fail(run, lastError);
    }

    private Run succeed(AgentDefinition agent, Task task, Run run, String output) {
        Instant finishedAt = clock.instant();
        try {
            MemoryEntry entry = memoryStore.record(agent.getId(), task.getId(), output, summarize(output), finishedAt);
            run.setMemoryEntryRef(entry.getRawRef());
        } catch (MemoryStoreException e) {
            log.error("[Runner] {} succeeded but its memory write failed: {}", agent.getId(), e.getMessage(), e);
            return fail(run, RunError.of(RunErrorKind.MEMORY_WRITE, e.getMessage()));
        }
        saveConversation(agent, task, output, finishedAt);

        run.setResult(output);
        run.setFinishedAt(finishedAt);
        run.setStatus(RunStatus.SUCCEEDED);
        log.info("[Runner] {} succeeded on task {} after {} attempt(s), {} tokens", agent.getId(), task.getId(),
            run.getAttemptCount(), run.getUsage().getTotalTokens());
        return run;
    }

    private Run fail(Run run, RunError error) {
        run.setError(error);
        run.setFinishedAt(clock.instant());
        run.setStatus(RunStatus.FAILED);
        return run;
    }

    private ReasoningRequest buildRequest(AgentDefinition agent, Task task, List<Run> upstreamRuns, ModelTier tier) {
        List<String> sections = new ArrayList<>();

        if (agent.includes(AgentDefinition.INCLUDE_PRODUCT_DOCS)) {
            String docs = productDocs();
            if (!docs.isEmpty()) {
                sections.add("# Product Documentation\n\n" + docs);
            }
        }
        if (agent.includes(AgentDefinition.INCLUDE_PRIORITIES)
            && documentStore.list("").contains(PRIORITIES_REF)) {
            sections.add("# Company Priorities\n\n" + read(PRIORITIES_REF));
        }

        MemoryContext memory = memoryStore.recentContext(agent.getId(), contextBudget);
        if (!memory.isEmpty()) {
            sections.add("# Your Memory\n\n" + memory.render());
        }

        String crossAgent = crossAgentContext(agent);
        if (!crossAgent.isEmpty()) {
            sections.add("# Other Agents\n\n" + crossAgent);
        }

        for (Run upstream : upstreamRuns) {
            if (upstream.isSucceeded()) {
                sections.add("# Findings from " + upstream.getAgentId() + "\n\n" + upstream.getResult());
            }
        }

        String documentRef = task.hint(Task.HINT_DOCUMENT_REF);
        if (documentRef != null && !documentRef.isBlank()) {
            sections.add("# Document: " + documentRef + "\n\n" + read(documentRef));
        }

        sections.add("# Your Task\n\n" + task.getInstruction());

        return ReasoningRequest.builder()
            .systemPrompt(promptService.loadSystemPrompt(agent.getId()))
            .userMessage(String.join(SECTION_SEPARATOR, sections))
            .history(history(agent, task))
            .modelTier(tier)
            .build();
    }

    /**
     * Every markdown file of the shared context folder, one section per file in name order.
     */
    private String productDocs() {
        List<String> docs = new ArrayList<>();
        for (String ref : documentStore.list(SHARED_CONTEXT_FOLDER)) {
            if (ref.endsWith(".md")) {
                String name = ref.substring(ref.lastIndexOf('/') + 1, ref.length() - ".md".length());
                docs.add("## " + name + "\n\n" + read(ref));
            }
        }
        return String.join(SECTION_SEPARATOR, docs);
    }

    private String read(String ref) {
        return new String(documentStore.fetch(ref), StandardCharsets.UTF_8);
    }

    private List<ConversationTurn> history(AgentDefinition agent, Task task) {
        String conversationId = task.hint(Task.HINT_CONVERSATION);
        if (conversationId == null || conversationId.isBlank()) {
            return List.of();
        }
        List<ConversationTurn> turns = memoryStore.conversation(agent.getId(), conversationId);
        if (turns.size() <= HISTORY_TURNS) {
            return turns;
        }
        return List.copyOf(turns.subList(turns.size() - HISTORY_TURNS, turns.size()));
    }

    private void saveConversation(AgentDefinition agent, Task task, String output, Instant at) {
        String conversationId = task.hint(Task.HINT_CONVERSATION);
        if (conversationId == null || conversationId.isBlank()) {
            return;
        }
        try {
            memoryStore.appendConversation(agent.getId(), conversationId, List.of(
                new ConversationTurn(ConversationTurn.USER, task.getInstruction(), task.getCreatedAt()),
                new ConversationTurn(ConversationTurn.ASSISTANT, output, at)));
        } catch (MemoryStoreException e) {
            // the run's memory entry is already durable; only the thread history misses this exchange
            log.error("[Runner] {} could not save conversation {}: {}", agent.getId(), conversationId,
                e.getMessage(), e);
        }
    }

    private String crossAgentContext(AgentDefinition agent) {
        List<String> sources = agent.getContextFrom();
        if (sources == null || sources.isEmpty()) {
            return "";
        }

        List<String> ids = new ArrayList<>();
        if (sources.contains(AgentDefinition.ALL_AGENTS)) {
            for (String id : memoryStore.agentIds()) {
                if (!id.startsWith("_") && !id.equals(agent.getId())) {
                    ids.add(id);
                }
            }
        } else {
            ids.addAll(sources);
        }
        if (ids.isEmpty()) {
            return "";
        }

        int share = Math.max(200, contextBudget / ids.size());
        StringBuilder text = new StringBuilder();
        for (String id : ids) {
            MemoryContext context = memoryStore.recentContext(id, share);
            if (!context.isEmpty()) {
                text.append("## ").append(id).append("\n").append(context.render()).append("\n\n");
            }
        }
        return text.toString().trim();
    }

    private ModelTier resolveModelTier(AgentDefinition agent, Task task) {
        return ModelTier.parse(task.hint(Task.HINT_MODEL_TIER)).orElse(agent.getModelTier());
    }

    private Run newRun(Task task, String agentId) {
        return Run.builder()
            .id(UUID.randomUUID().toString().substring(0, 8))
            .taskId(task.getId())
            .agentId(agentId)
            .status(RunStatus.PENDING)
            .build();
    }

    /**
     * First paragraph of the output that is not a heading, collapsed to a single line.
     */
    static String summarize(String output) {
        String chosen = "";
        for (String paragraph : output.split("\\n\\s*\\n")) {
            String trimmed = paragraph.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                chosen = trimmed;
                break;
            }
        }
        if (chosen.isEmpty()) {
            chosen = output.trim();
        }
        String collapsed = chosen.replaceAll("\\s+", " ");
        if (collapsed.length() <= SUMMARY_MAX_CHARS) {
            return collapsed;
        }
        return collapsed.substring(0, SUMMARY_MAX_CHARS - 3) + "...";
    }
}
