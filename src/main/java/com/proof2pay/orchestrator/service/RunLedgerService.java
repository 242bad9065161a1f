package com.proof2pay.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.TaskRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable record of finished tasks and their runs, one JSON line per task in {@code runs.jsonl}.
 */
@Slf4j
@Service
public class RunLedgerService {

    private static final String LEDGER_FILE = "runs.jsonl";
    private static final int RECENT_LIMIT = 100;

    @Value("${agent.data.path:data}")
    private String dataPath = "data";

    private final ObjectMapper mapper;
    private final Deque<TaskRecord> recent = new ArrayDeque<>();

    public RunLedgerService() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    public void record(TaskRecord record) {
        synchronized (recent) {
            recent.addFirst(record);
            while (recent.size() > RECENT_LIMIT) {
                recent.removeLast();
            }
        }
        write(toLine(record, false));
    }

    /**
     * Writes whatever is known about tasks still running at shutdown, so no task goes unrecorded.
     */
    public void flushInFlight(Collection<TaskRecord> inFlight) {
        for (TaskRecord record : inFlight) {
            write(toLine(record, true));
        }
        if (!inFlight.isEmpty()) {
            log.info("[Ledger] Flushed {} in-flight tasks", inFlight.size());
        }
    }

    public List<TaskRecord> recentRecords() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    private Map<String, Object> toLine(TaskRecord record, boolean inFlight) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("task_id", record.getTask().getId());
        line.put("origin", record.getTask().getOrigin());
        line.put("kind", record.getTask().getKind());
        line.put("cycle_id", record.getTask().getCycleId());
        line.put("parent_task_id", record.getTask().getParentTaskId());
        line.put("hop", record.getTask().getHop());
        line.put("submitted_at", record.getSubmittedAt());
        line.put("completed_at", record.getCompletedAt());
        line.put("in_flight", inFlight);

        List<Map<String, Object>> runs = new ArrayList<>();
        for (Run run : record.getRuns()) {
            Map<String, Object> runLine = new LinkedHashMap<>();
            runLine.put("run_id", run.getId());
            runLine.put("agent_id", run.getAgentId());
            runLine.put("status", run.getStatus());
            runLine.put("attempts", run.getAttemptCount());
            runLine.put("model_tier", run.getModelTier());
            runLine.put("input_tokens", run.getUsage().getInputTokens());
            runLine.put("output_tokens", run.getUsage().getOutputTokens());
            runLine.put("started_at", run.getStartedAt());
            runLine.put("finished_at", run.getFinishedAt());
            if (run.getError() != null) {
                runLine.put("error_kind", run.getError().getKind());
                runLine.put("error_message", run.getError().getMessage());
            }
            runLine.put("memory_ref", run.getMemoryEntryRef());
            runs.add(runLine);
        }
        line.put("runs", runs);
        return line;
    }

    private void write(Map<String, Object> line) {
        try {
            Path ledgerFile = Paths.get(dataPath, LEDGER_FILE);
            Files.createDirectories(ledgerFile.toAbsolutePath().getParent());
            Files.writeString(ledgerFile, mapper.writeValueAsString(line) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            log.error("[Ledger] Could not serialize task {}: {}", line.get("task_id"), e.getMessage());
        } catch (IOException e) {
            log.error("[Ledger] Failed to write task {}: {}", line.get("task_id"), e.getMessage());
        }
    }
}
