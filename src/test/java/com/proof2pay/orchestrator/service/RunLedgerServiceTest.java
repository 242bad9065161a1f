package com.proof2pay.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.RunError;
import com.proof2pay.orchestrator.model.RunErrorKind;
import com.proof2pay.orchestrator.model.RunStatus;
import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskOrigin;
import com.proof2pay.orchestrator.model.TaskRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @TempDir
    Path tempDir;

    private RunLedgerService ledger;

    @BeforeEach
    void setUp() {
        ledger = new RunLedgerService();
        ledger.setDataPath(tempDir.toString());
    }

    @Test
    void shouldAppendOneLinePerTask() throws Exception {
        TaskRecord record = record("t1");
        Run failed = run("r2", "technical_pm", RunStatus.FAILED);
        failed.setError(RunError.of(RunErrorKind.DEPENDENCY_UNMET, "domain_intelligence failed"));
        record.addRun(run("r1", "domain_intelligence", RunStatus.SUCCEEDED));
        record.addRun(failed);
        record.markComplete(NOW);

        ledger.record(record);
        ledger.record(record("t2"));

        List<String> lines = Files.readAllLines(tempDir.resolve("runs.jsonl"));
        assertEquals(2, lines.size());
        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        assertEquals("t1", first.get("task_id").asText());
        assertFalse(first.get("in_flight").asBoolean());
        assertEquals(2, first.get("runs").size());
        assertEquals("DEPENDENCY_UNMET", first.get("runs").get(1).get("error_kind").asText());
        assertEquals("t2", ledger.recentRecords().get(0).getTask().getId());
    }

    @Test
    void shouldFlagTasksFlushedInFlight() throws Exception {
        TaskRecord open = record("t3");
        open.addRun(run("r3", "market_research", RunStatus.RUNNING));

        ledger.flushInFlight(List.of(open));

        List<String> lines = Files.readAllLines(tempDir.resolve("runs.jsonl"));
        assertEquals(1, lines.size());
        JsonNode line = new ObjectMapper().readTree(lines.get(0));
        assertTrue(line.get("in_flight").asBoolean());
        assertEquals("RUNNING", line.get("runs").get(0).get("status").asText());
    }

    private static TaskRecord record(String taskId) {
        Task task = Task.builder()
            .id(taskId)
            .origin(TaskOrigin.SCHEDULE)
            .targetAgentIds(List.of("market_research"))
            .instruction("Daily review")
            .createdAt(NOW)
            .build();
        return new TaskRecord(task, NOW);
    }

    private static Run run(String id, String agentId, RunStatus status) {
        return Run.builder().id(id).taskId("t").agentId(agentId).status(status).attemptCount(1).build();
    }
}
