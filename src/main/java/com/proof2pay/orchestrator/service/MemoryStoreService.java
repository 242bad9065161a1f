package com.proof2pay.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.proof2pay.orchestrator.exception.MemoryStoreException;
import com.proof2pay.orchestrator.model.ConversationTurn;
import com.proof2pay.orchestrator.model.MemoryContext;
import com.proof2pay.orchestrator.model.MemoryEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Durable per-agent memory. Each agent owns a directory holding an append-only JSON-lines log
 * ({@code entries.jsonl}), the raw outputs the entries point to, and the rolling summary produced
 * by compaction ({@code summary.json}). Entries are never deleted.
 *
 * <p>
 * Writers lock per agent id only; agents never contend with each other.
 */
@Slf4j
@Service
public class MemoryStoreService {

    private static final String ENTRIES_FILE = "entries.jsonl";
    private static final String SUMMARY_FILE = "summary.json";
    private static final String OUTPUTS_DIR = "outputs";
    private static final String CONVERSATIONS_DIR = "conversations";
    private static final int CONVERSATION_MAX_TURNS = 50;
    private static final int LINE_OVERHEAD = 16;
    private static final DateTimeFormatter RAW_FILE_TIME =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    static final Comparator<MemoryEntry> TIMESTAMP_ORDER = Comparator
        .comparing(MemoryEntry::getTimestamp)
        .thenComparingLong(MemoryEntry::getSequence);

    @Value("${agent.memory.path:memory}")
    private String memoryPath = "memory";

    @Value("${agent.memory.retain-chars:12000}")
    private int retainChars = 12000;

    @Value("${agent.memory.summary-max-chars:3000}")
    private int summaryMaxChars = 3000;

    private final ObjectMapper mapper;
    private final Map<String, ReentrantLock> agentLocks = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public MemoryStoreService() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setMemoryPath(String path) {
        this.memoryPath = path;
        sequences.clear();
    }

    public void setRetainChars(int retainChars) {
        this.retainChars = retainChars;
    }

    public void setSummaryMaxChars(int summaryMaxChars) {
        this.summaryMaxChars = summaryMaxChars;
    }

    /**
     * Stores a run's full output and appends the entry that points to it.
     */
    public MemoryEntry record(String agentId, String taskId, String rawOutput, String summary, Instant timestamp) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            long sequence = nextSequence(agentId);
            String rawRef = writeRaw(agentId, sequence, rawOutput, timestamp);
            MemoryEntry entry = MemoryEntry.builder()
                .agentId(agentId)
                .timestamp(timestamp)
                .sequence(sequence)
                .taskId(taskId)
                .summary(summary)
                .rawRef(rawRef)
                .build();
            return appendLocked(agentId, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends one entry. The entry is written as a single line in a single write, so a reader sees
     * either the whole entry or, after a crash mid-write, a torn line that is skipped.
     */
    public MemoryEntry append(String agentId, MemoryEntry entry) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            if (entry.getSequence() == 0) {
                entry.setSequence(nextSequence(agentId));
            }
            return appendLocked(agentId, entry);
        } finally {
            lock.unlock();
        }
    }

    private MemoryEntry appendLocked(String agentId, MemoryEntry entry) {
        if (entry.getTimestamp() == null) {
            throw new IllegalArgumentException("Memory entry without timestamp for " + agentId);
        }
        entry.setAgentId(agentId);
        try {
            Path entriesFile = agentDir(agentId).resolve(ENTRIES_FILE);
            Files.createDirectories(entriesFile.getParent());
            String line = mapper.writeValueAsString(entry) + "\n";
            Files.writeString(entriesFile, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to append memory entry for " + agentId, e);
        }
        log.debug("[Memory] Appended entry {} for {}", entry.getSequence(), agentId);
        return entry;
    }

    /**
     * All entries of an agent in timestamp order.
     */
    public List<MemoryEntry> readEntries(String agentId) {
        Path entriesFile = agentDir(agentId).resolve(ENTRIES_FILE);
        if (!Files.exists(entriesFile)) {
            return List.of();
        }
        List<MemoryEntry> entries = new ArrayList<>();
        try (Stream<String> lines = Files.lines(entriesFile, StandardCharsets.UTF_8)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    entries.add(mapper.readValue(line, MemoryEntry.class));
                } catch (JsonProcessingException e) {
                    log.warn("[Memory] Skipping unreadable entry for {}: {}", agentId, e.getOriginalMessage());
                }
            });
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to read memory for " + agentId, e);
        }
        entries.sort(TIMESTAMP_ORDER);
        return entries;
    }

    /**
     * Rolling summary plus the newest entries not yet folded into it, bounded by a character budget.
     */
    public MemoryContext recentContext(String agentId, int budgetChars) {
        SummaryState state = readSummaryState(agentId);
        String summary = state.getSummary() == null ? "" : state.getSummary();
        if (summary.length() > budgetChars) {
            summary = summary.substring(summary.length() - budgetChars);
        }

        List<MemoryEntry> unfolded = readEntries(agentId).stream()
            .filter(entry -> isAfterWatermark(entry, state))
            .toList();

        int remaining = budgetChars - summary.length();
        Deque<MemoryEntry> chosen = new ArrayDeque<>();
        for (int i = unfolded.size() - 1; i >= 0; i--) {
            MemoryEntry entry = unfolded.get(i);
            int cost = cost(entry);
            if (cost > remaining) {
                break;
            }
            chosen.addFirst(entry);
            remaining -= cost;
        }
        return new MemoryContext(summary, List.copyOf(chosen));
    }

    /**
     * Folds every entry outside the retained tail into the rolling summary. The summary is computed
     * from the log alone, so running this twice without new entries yields the same summary.
     */
    public String compact(String agentId) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            List<MemoryEntry> entries = readEntries(agentId);

            int split = entries.size();
            int kept = 0;
            for (int i = entries.size() - 1; i >= 0; i--) {
                int cost = cost(entries.get(i));
                if (kept + cost > retainChars) {
                    break;
                }
                kept += cost;
                split = i;
            }

            List<MemoryEntry> folded = entries.subList(0, split);
            if (folded.isEmpty()) {
                return readSummaryState(agentId).getSummary();
            }

            String summary = fold(folded);
            MemoryEntry last = folded.get(folded.size() - 1);
            writeSummaryState(agentId, new SummaryState(summary, last.getTimestamp(), last.getSequence(), folded.size()));

            log.info("[Memory] Compacted {}: {} entries folded, {} retained", agentId, folded.size(),
                entries.size() - folded.size());
            return summary;
        } finally {
            lock.unlock();
        }
    }

    public void compactAll() {
        for (String agentId : agentIds()) {
            try {
                compact(agentId);
            } catch (MemoryStoreException e) {
                log.error("[Memory] Compaction failed for {}: {}", agentId, e.getMessage(), e);
            }
        }
    }

    public String summary(String agentId) {
        String summary = readSummaryState(agentId).getSummary();
        return summary == null ? "" : summary;
    }

    /**
     * Non-empty rolling summaries keyed by agent id.
     */
    public Map<String, String> allSummaries() {
        Map<String, String> summaries = new LinkedHashMap<>();
        for (String agentId : agentIds()) {
            String summary = summary(agentId);
            if (!summary.isBlank()) {
                summaries.put(agentId, summary);
            }
        }
        return summaries;
    }

    public Optional<MemoryEntry> latestEntry(String agentId) {
        List<MemoryEntry> entries = readEntries(agentId);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    public String readRaw(MemoryEntry entry) {
        try {
            return Files.readString(root().resolve(entry.getRawRef()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to read raw output " + entry.getRawRef(), e);
        }
    }

    /**
     * Turns of one chat thread the agent took part in, oldest first.
     */
    public List<ConversationTurn> conversation(String agentId, String conversationId) {
        Path file = conversationFile(agentId, conversationId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return mapper.readValue(file.toFile(), new TypeReference<List<ConversationTurn>>() { });
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to read conversation " + conversationId + " of " + agentId, e);
        }
    }

    /**
     * Appends turns to a chat thread. Only the newest turns are kept.
     */
    public void appendConversation(String agentId, String conversationId, List<ConversationTurn> turns) {
        ReentrantLock lock = lockFor(agentId);
        lock.lock();
        try {
            List<ConversationTurn> history = new ArrayList<>(conversation(agentId, conversationId));
            history.addAll(turns);
            if (history.size() > CONVERSATION_MAX_TURNS) {
                history = new ArrayList<>(history.subList(history.size() - CONVERSATION_MAX_TURNS, history.size()));
            }
            Path file = conversationFile(agentId, conversationId);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.createDirectories(file.getParent());
            Files.writeString(tmp, mapper.writeValueAsString(history), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to write conversation " + conversationId + " of " + agentId, e);
        } finally {
            lock.unlock();
        }
    }

    public List<String> agentIds() {
        Path root = root();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs.filter(Files::isDirectory)
                .map(dir -> dir.getFileName().toString())
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to list memory root " + root, e);
        }
    }

    private String fold(List<MemoryEntry> folded) {
        Deque<String> lines = new ArrayDeque<>();
        int length = 0;
        int omitted = 0;
        for (int i = folded.size() - 1; i >= 0; i--) {
            MemoryEntry entry = folded.get(i);
            String line = "- [" + LocalDate.ofInstant(entry.getTimestamp(), ZoneOffset.UTC) + "] "
                + entry.getSummary();
            if (length + line.length() + 1 > summaryMaxChars) {
                omitted = i + 1;
                break;
            }
            lines.addFirst(line);
            length += line.length() + 1;
        }
        StringBuilder summary = new StringBuilder();
        if (omitted > 0) {
            summary.append("(").append(omitted).append(" older entries omitted)\n");
        }
        summary.append(String.join("\n", lines));
        return summary.toString();
    }

    private boolean isAfterWatermark(MemoryEntry entry, SummaryState state) {
        if (state.getCompactedThrough() == null) {
            return true;
        }
        int byTime = entry.getTimestamp().compareTo(state.getCompactedThrough());
        return byTime > 0 || (byTime == 0 && entry.getSequence() > state.getCompactedThroughSequence());
    }

    private static int cost(MemoryEntry entry) {
        return (entry.getSummary() == null ? 0 : entry.getSummary().length()) + LINE_OVERHEAD;
    }

    private long nextSequence(String agentId) {
        return sequences.computeIfAbsent(agentId, id -> new AtomicLong(readEntries(id).stream()
                .mapToLong(MemoryEntry::getSequence)
                .max()
                .orElse(0)))
            .incrementAndGet();
    }

    private String writeRaw(String agentId, long sequence, String rawOutput, Instant timestamp) {
        String fileName = RAW_FILE_TIME.format(timestamp) + "_" + sequence + ".md";
        Path rawFile = agentDir(agentId).resolve(OUTPUTS_DIR).resolve(fileName);
        try {
            Files.createDirectories(rawFile.getParent());
            Files.writeString(rawFile, rawOutput == null ? "" : rawOutput, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to store raw output for " + agentId, e);
        }
        return root().relativize(rawFile).toString().replace('\\', '/');
    }

    private SummaryState readSummaryState(String agentId) {
        Path summaryFile = agentDir(agentId).resolve(SUMMARY_FILE);
        if (!Files.exists(summaryFile)) {
            return new SummaryState();
        }
        try {
            return mapper.readValue(summaryFile.toFile(), SummaryState.class);
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to read summary for " + agentId, e);
        }
    }

    private void writeSummaryState(String agentId, SummaryState state) {
        Path summaryFile = agentDir(agentId).resolve(SUMMARY_FILE);
        Path tmp = summaryFile.resolveSibling(SUMMARY_FILE + ".tmp");
        try {
            Files.createDirectories(summaryFile.getParent());
            Files.writeString(tmp, mapper.writeValueAsString(state), StandardCharsets.UTF_8);
            Files.move(tmp, summaryFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new MemoryStoreException("Failed to write summary for " + agentId, e);
        }
    }

    private ReentrantLock lockFor(String agentId) {
        return agentLocks.computeIfAbsent(agentId, id -> new ReentrantLock());
    }

    private Path conversationFile(String agentId, String conversationId) {
        String fileName = conversationId.replaceAll("[^A-Za-z0-9_.-]", "_") + ".json";
        return agentDir(agentId).resolve(CONVERSATIONS_DIR).resolve(fileName);
    }

    private Path agentDir(String agentId) {
        return root().resolve(agentId);
    }

    private Path root() {
        return Paths.get(memoryPath).toAbsolutePath().normalize();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class SummaryState {
        private String summary = "";
        private Instant compactedThrough;
        private long compactedThroughSequence;
        private int foldedEntries;
    }
}
