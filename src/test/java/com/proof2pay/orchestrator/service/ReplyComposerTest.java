package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.RunError;
import com.proof2pay.orchestrator.model.RunErrorKind;
import com.proof2pay.orchestrator.model.RunStatus;
import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskOrigin;
import com.proof2pay.orchestrator.model.TaskRecord;
import com.proof2pay.orchestrator.support.TestRoster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplyComposerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path tempDir;

    private ReplyComposer composer;

    @BeforeEach
    void setUp() {
        composer = new ReplyComposer(TestRoster.load(tempDir));
    }

    @Test
    void shouldSynthesizeSucceededRunsAndNoteFailures() {
        TaskRecord record = record(
            succeeded(AgentRosterService.ROUTER_AGENT_ID, "fundraising, market_research"),
            succeeded("fundraising", "Deck outline ready."),
            failed("market_research", RunErrorKind.TRANSIENT_EXTERNAL, "HTTP 529"));

        String reply = composer.composeReply(record);

        assertTrue(reply.contains("*Fundraising*\nDeck outline ready."));
        assertTrue(reply.contains("Market Research failed: TRANSIENT_EXTERNAL HTTP 529"));
        assertFalse(reply.contains("fundraising, market_research"));
    }

    @Test
    void shouldComposeFailureNoticeWhenNothingSucceeded() {
        TaskRecord record = record(failed("fundraising", RunErrorKind.PERMANENT_EXTERNAL, "HTTP 400"));

        String reply = composer.composeReply(record);

        assertTrue(reply.startsWith("*Request failed*"));
        assertTrue(reply.contains("Fundraising: PERMANENT_EXTERNAL HTTP 400"));
    }

    @Test
    void shouldAskForClarification() {
        String text = composer.clarification(task());

        assertTrue(text.contains("> Make it better"));
        assertTrue(text.contains("/agent-run"));
    }

    @Test
    void shouldAppendFailuresToBriefing() {
        String text = composer.briefingText("2026-03-02", "All quiet.", List.of("Compliance (schedule task t1): X"));

        assertTrue(text.startsWith("*Daily briefing 2026-03-02*"));
        assertTrue(text.contains("All quiet."));
        assertTrue(text.contains("• Compliance (schedule task t1): X"));
    }

    @Test
    void shouldTruncateLongText() {
        String truncated = ReplyComposer.truncate("x".repeat(500), 100);

        assertTrue(truncated.length() <= 100);
        assertTrue(truncated.endsWith("_(truncated)_"));
    }

    private static Task task() {
        return Task.builder()
            .id("t1")
            .origin(TaskOrigin.HUMAN_MESSAGE)
            .instruction("Make it better")
            .createdAt(NOW)
            .channel("C1")
            .build();
    }

    private static TaskRecord record(Run... runs) {
        TaskRecord record = new TaskRecord(task(), NOW);
        for (Run run : runs) {
            record.addRun(run);
        }
        record.markComplete(NOW);
        return record;
    }

    private static Run succeeded(String agentId, String result) {
        return Run.builder().agentId(agentId).taskId("t1").status(RunStatus.SUCCEEDED).result(result).build();
    }

    private static Run failed(String agentId, RunErrorKind kind, String message) {
        return Run.builder().agentId(agentId).taskId("t1").status(RunStatus.FAILED)
            .error(new RunError(kind, message, false)).build();
    }
}
