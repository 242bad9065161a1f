package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.client.DocumentStore;
import com.proof2pay.orchestrator.client.ReasoningClient;
import com.proof2pay.orchestrator.exception.DependencyUnmetException;
import com.proof2pay.orchestrator.exception.DocumentFetchException;
import com.proof2pay.orchestrator.exception.PermanentExternalException;
import com.proof2pay.orchestrator.exception.TransientExternalException;
import com.proof2pay.orchestrator.model.AgentDefinition;
import com.proof2pay.orchestrator.model.ConversationTurn;
import com.proof2pay.orchestrator.model.ModelTier;
import com.proof2pay.orchestrator.model.ReasoningRequest;
import com.proof2pay.orchestrator.model.ReasoningResult;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.RunErrorKind;
import com.proof2pay.orchestrator.model.RunStatus;
import com.proof2pay.orchestrator.model.ScheduleClass;
import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskOrigin;
import com.proof2pay.orchestrator.model.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T14:00:00Z");

    @Mock
    private ReasoningClient reasoningClient;

    @Mock
    private PromptService promptService;

    @Mock
    private DocumentStore documentStore;

    @TempDir
    Path tempDir;

    private MemoryStoreService memoryStore;
    private AgentRunner runner;
    private final List<Long> sleeps = new ArrayList<>();

    private final AgentDefinition marketResearch = AgentDefinition.builder()
        .id("market_research")
        .name("Market Research")
        .capabilityTag("research.market")
        .scheduleClass(ScheduleClass.DAILY)
        .modelTier(ModelTier.SONNET)
        .build();

    @BeforeEach
    void setUp() {
        memoryStore = new MemoryStoreService();
        memoryStore.setMemoryPath(tempDir.resolve("memory").toString());
        runner = new AgentRunner(reasoningClient, memoryStore, promptService, documentStore,
            Clock.fixed(NOW, ZoneOffset.UTC));
        runner.setMaxAttempts(3);
        runner.setInitialBackoffMs(100);
        runner.setBackoffMultiplier(2.0);
        runner.setMaxBackoffMs(1000);
        runner.setSleeper(sleeps::add);
        lenient().when(promptService.loadSystemPrompt(anyString())).thenReturn("You are a test agent.");
    }

    @Test
    void shouldSucceedAfterTwoTransientFailures() {
        when(reasoningClient.invoke(eq("market_research"), any()))
            .thenThrow(new TransientExternalException("HTTP 429"))
            .thenThrow(new TransientExternalException("HTTP 503"))
            .thenReturn(result("Demand is up 12%.\n\nDetails follow."));

        Run run = runner.execute(marketResearch, task("Size the market"));

        assertEquals(RunStatus.SUCCEEDED, run.getStatus());
        assertEquals(3, run.getAttemptCount());
        assertEquals(3, run.getAttempts().size());
        assertFalse(run.getAttempts().get(0).isSucceeded());
        assertTrue(run.getAttempts().get(2).isSucceeded());
        assertEquals(List.of(100L, 200L), sleeps);
        assertNull(run.getError());
        assertEquals("Demand is up 12%.\n\nDetails follow.", run.getResult());
    }

    @Test
    void shouldFailImmediatelyOnPermanentError() {
        when(reasoningClient.invoke(eq("market_research"), any()))
            .thenThrow(new PermanentExternalException("HTTP 400: bad request"));

        Run run = runner.execute(marketResearch, task("Size the market"));

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(1, run.getAttemptCount());
        assertEquals(RunErrorKind.PERMANENT_EXTERNAL, run.getError().getKind());
        assertFalse(run.getError().isRetryable());
        assertTrue(sleeps.isEmpty());
        verify(reasoningClient, times(1)).invoke(anyString(), any());
    }

    @Test
    void shouldStopAtRetryCeilingAndKeepLastError() {
        when(reasoningClient.invoke(eq("market_research"), any()))
            .thenThrow(new TransientExternalException("HTTP 529 first"))
            .thenThrow(new TransientExternalException("HTTP 529 second"))
            .thenThrow(new TransientExternalException("HTTP 529 third"));

        Run run = runner.execute(marketResearch, task("Size the market"));

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(3, run.getAttemptCount());
        assertEquals(3, run.getAttempts().size());
        assertEquals(RunErrorKind.TRANSIENT_EXTERNAL, run.getError().getKind());
        assertEquals("HTTP 529 third", run.getError().getMessage());
        assertEquals(2, sleeps.size());
        verify(reasoningClient, times(3)).invoke(anyString(), any());
    }

    @Test
    void shouldAppendExactlyOneMemoryEntryOnSuccess() {
        when(reasoningClient.invoke(eq("market_research"), any())).thenReturn(result("Prices fell."));

        Run run = runner.execute(marketResearch, task("Check pricing"));

        assertEquals(1, memoryStore.readEntries("market_research").size());
        assertEquals("Prices fell.", memoryStore.readEntries("market_research").get(0).getSummary());
        assertEquals(NOW, memoryStore.readEntries("market_research").get(0).getTimestamp());
        assertNotNull(run.getMemoryEntryRef());
    }

    @Test
    void shouldNotWriteMemoryWhenRunFails() {
        when(reasoningClient.invoke(eq("market_research"), any()))
            .thenThrow(new PermanentExternalException("HTTP 401"));

        runner.execute(marketResearch, task("Check pricing"));

        assertTrue(memoryStore.readEntries("market_research").isEmpty());
    }

    @Test
    void shouldFailRunWhenMemoryWriteFails() throws Exception {
        Path blocked = tempDir.resolve("blocked");
        Files.writeString(blocked, "not a directory", StandardCharsets.UTF_8);
        memoryStore.setMemoryPath(blocked.toString());
        when(reasoningClient.invoke(eq("market_research"), any())).thenReturn(result("Prices fell."));

        Run run = runner.execute(marketResearch, task("Check pricing"));

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(RunErrorKind.MEMORY_WRITE, run.getError().getKind());
        assertNull(run.getResult());
    }

    @Test
    void shouldRetryBlankOutputAsMalformed() {
        when(reasoningClient.invoke(eq("market_research"), any()))
            .thenReturn(result("   "))
            .thenReturn(result("Real answer."));

        Run run = runner.execute(marketResearch, task("Check pricing"));

        assertEquals(RunStatus.SUCCEEDED, run.getStatus());
        assertEquals(2, run.getAttemptCount());
        assertEquals(RunErrorKind.MALFORMED_OUTPUT, run.getAttempts().get(0).getErrorKind());
    }

    @Test
    void shouldUseModelTierHintOverAgentDefault() {
        when(reasoningClient.invoke(eq("market_research"), any())).thenReturn(result("ok"));
        Task task = task("Deep dive").toBuilder()
            .hints(Map.of(Task.HINT_MODEL_TIER, "opus"))
            .build();

        Run run = runner.execute(marketResearch, task);

        ArgumentCaptor<ReasoningRequest> captor = ArgumentCaptor.forClass(ReasoningRequest.class);
        verify(reasoningClient).invoke(eq("market_research"), captor.capture());
        assertEquals(ModelTier.OPUS, captor.getValue().getModelTier());
        assertEquals(ModelTier.OPUS, run.getModelTier());
    }

    @Test
    void shouldBuildContextFromMemoryUpstreamDocumentAndInstruction() {
        memoryStore.record("market_research", "old", "raw", "Last week demand was flat.", NOW.minusSeconds(3600));
        when(documentStore.fetch("decks/seed.md")).thenReturn("Seed deck v3".getBytes(StandardCharsets.UTF_8));
        when(reasoningClient.invoke(eq("market_research"), any())).thenReturn(result("ok"));

        Run upstream = Run.builder()
            .agentId("domain_intelligence")
            .status(RunStatus.SUCCEEDED)
            .result("Regulator published new guidance.")
            .usage(TokenUsage.ZERO)
            .build();
        Task task = task("Update sizing").toBuilder()
            .hints(Map.of(Task.HINT_DOCUMENT_REF, "decks/seed.md"))
            .build();

        runner.execute(marketResearch, task, List.of(upstream));

        ArgumentCaptor<ReasoningRequest> captor = ArgumentCaptor.forClass(ReasoningRequest.class);
        verify(reasoningClient).invoke(eq("market_research"), captor.capture());
        String message = captor.getValue().getUserMessage();
        assertTrue(message.contains("Last week demand was flat."));
        assertTrue(message.contains("Regulator published new guidance."));
        assertTrue(message.contains("Seed deck v3"));
        assertTrue(message.endsWith("# Your Task\n\nUpdate sizing"));
        assertEquals("You are a test agent.", captor.getValue().getSystemPrompt());
    }

    @Test
    void shouldFailWithDocumentFetchWithoutCallingReasoningClient() {
        when(documentStore.fetch("missing.md")).thenThrow(new DocumentFetchException("No such document: missing.md"));
        Task task = task("Review").toBuilder()
            .hints(Map.of(Task.HINT_DOCUMENT_REF, "missing.md"))
            .build();

        Run run = runner.execute(marketResearch, task);

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(RunErrorKind.DOCUMENT_FETCH, run.getError().getKind());
        assertEquals(0, run.getAttemptCount());
        verifyNoInteractions(reasoningClient);
    }

    @Test
    void shouldSkipWithDependencyUnmetAndZeroAttempts() {
        AgentDefinition technicalPm = AgentDefinition.builder().id("technical_pm").build();

        Run run = runner.skip(technicalPm, task("Draft the API design"),
            new DependencyUnmetException("technical_pm", "domain_intelligence"));

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(RunErrorKind.DEPENDENCY_UNMET, run.getError().getKind());
        assertEquals(0, run.getAttemptCount());
        verifyNoInteractions(reasoningClient);
    }

    @Test
    void shouldCapBackoffDelay() {
        runner.setInitialBackoffMs(2000);
        runner.setBackoffMultiplier(2.0);
        runner.setMaxBackoffMs(60000);

        assertEquals(2000, runner.backoffDelay(1));
        assertEquals(4000, runner.backoffDelay(2));
        assertEquals(60000, runner.backoffDelay(10));
    }

    @Test
    void shouldSummarizeFirstParagraphSkippingHeadings() {
        String summary = AgentRunner.summarize("# Weekly report\n\nTwo new  competitors\nlaunched.\n\nMore text.");

        assertEquals("Two new competitors launched.", summary);
    }

    @Test
    void shouldRunOneAgentsTasksOneAtATime() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger invocations = new AtomicInteger();
        when(reasoningClient.invoke(eq("market_research"), any())).thenAnswer(invocation -> {
            if (invocations.incrementAndGet() == 1) {
                firstStarted.countDown();
                assertTrue(releaseFirst.await(5, TimeUnit.SECONDS));
            }
            return result("ok");
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Run> first = pool.submit(() -> runner.execute(marketResearch, task("First")));
            assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
            Future<Run> second = pool.submit(() -> runner.execute(marketResearch, task("Second")));

            Thread.sleep(200);
            assertEquals(1, invocations.get());
            assertFalse(second.isDone());

            releaseFirst.countDown();
            assertEquals(RunStatus.SUCCEEDED, first.get(5, TimeUnit.SECONDS).getStatus());
            assertEquals(RunStatus.SUCCEEDED, second.get(5, TimeUnit.SECONDS).getStatus());
            assertEquals(2, invocations.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldPrependProductDocsAndPriorities() {
        AgentDefinition compliance = AgentDefinition.builder()
            .id("compliance")
            .name("Compliance & Security")
            .modelTier(ModelTier.SONNET)
            .contextIncludes(List.of(AgentDefinition.INCLUDE_PRODUCT_DOCS, AgentDefinition.INCLUDE_PRIORITIES))
            .build();
        when(documentStore.list(AgentRunner.SHARED_CONTEXT_FOLDER))
            .thenReturn(List.of("context/product.md", "context/logo.png"));
        when(documentStore.list("")).thenReturn(List.of("context", AgentRunner.PRIORITIES_REF));
        when(documentStore.fetch("context/product.md"))
            .thenReturn("Invoices are matched to grant budgets.".getBytes(StandardCharsets.UTF_8));
        when(documentStore.fetch(AgentRunner.PRIORITIES_REF))
            .thenReturn("Close the SOC 2 gap first.".getBytes(StandardCharsets.UTF_8));
        when(reasoningClient.invoke(eq("compliance"), any())).thenReturn(result("ok"));

        runner.execute(compliance, task("Review controls"));

        ArgumentCaptor<ReasoningRequest> captor = ArgumentCaptor.forClass(ReasoningRequest.class);
        verify(reasoningClient).invoke(eq("compliance"), captor.capture());
        String message = captor.getValue().getUserMessage();
        assertTrue(message.startsWith("# Product Documentation\n\n## product\n\nInvoices are matched to grant budgets."));
        assertTrue(message.contains("# Company Priorities\n\nClose the SOC 2 gap first."));
        assertTrue(message.endsWith("# Your Task\n\nReview controls"));
        verify(documentStore, never()).fetch("context/logo.png");
    }

    @Test
    void shouldSkipSharedContextForAgentsThatDoNotInclude() {
        when(reasoningClient.invoke(eq("market_research"), any())).thenReturn(result("ok"));

        runner.execute(marketResearch, task("Size the market"));

        verify(documentStore, never()).list(anyString());
    }

    @Test
    void shouldCarryThreadHistoryAndSaveTheExchange() {
        memoryStore.appendConversation("market_research", "C1_1772452700.000200", List.of(
            new ConversationTurn(ConversationTurn.USER, "How big is the NPO segment?", NOW.minusSeconds(600)),
            new ConversationTurn(ConversationTurn.ASSISTANT, "Roughly 1.5M organisations.", NOW.minusSeconds(590))));
        when(reasoningClient.invoke(eq("market_research"), any())).thenReturn(result("About 40% take federal grants."));
        Task task = task("How many take federal grants?").toBuilder()
            .hints(Map.of(Task.HINT_CONVERSATION, "C1_1772452700.000200"))
            .build();

        Run run = runner.execute(marketResearch, task);

        assertEquals(RunStatus.SUCCEEDED, run.getStatus());
        ArgumentCaptor<ReasoningRequest> captor = ArgumentCaptor.forClass(ReasoningRequest.class);
        verify(reasoningClient).invoke(eq("market_research"), captor.capture());
        List<ConversationTurn> history = captor.getValue().getHistory();
        assertEquals(2, history.size());
        assertEquals("How big is the NPO segment?", history.get(0).getContent());

        List<ConversationTurn> saved = memoryStore.conversation("market_research", "C1_1772452700.000200");
        assertEquals(4, saved.size());
        assertEquals(ConversationTurn.USER, saved.get(2).getRole());
        assertEquals("How many take federal grants?", saved.get(2).getContent());
        assertEquals(ConversationTurn.ASSISTANT, saved.get(3).getRole());
        assertEquals("About 40% take federal grants.", saved.get(3).getContent());
    }

    @Test
    void shouldSendOnlyTheLatestTwentyTurns() {
        List<ConversationTurn> turns = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            turns.add(new ConversationTurn(i % 2 == 0 ? ConversationTurn.USER : ConversationTurn.ASSISTANT,
                "turn " + i, NOW.minusSeconds(1000 - i)));
        }
        memoryStore.appendConversation("market_research", "thread-1", turns);
        when(reasoningClient.invoke(eq("market_research"), any())).thenReturn(result("ok"));
        Task task = task("Continue").toBuilder()
            .hints(Map.of(Task.HINT_CONVERSATION, "thread-1"))
            .build();

        runner.execute(marketResearch, task);

        ArgumentCaptor<ReasoningRequest> captor = ArgumentCaptor.forClass(ReasoningRequest.class);
        verify(reasoningClient).invoke(eq("market_research"), captor.capture());
        List<ConversationTurn> history = captor.getValue().getHistory();
        assertEquals(20, history.size());
        assertEquals("turn 10", history.get(0).getContent());
        assertEquals("turn 29", history.get(19).getContent());
    }

    private static Task task(String instruction) {
        return Task.builder()
            .id("task-1")
            .origin(TaskOrigin.SCHEDULE)
            .targetAgentIds(List.of("market_research"))
            .instruction(instruction)
            .createdAt(NOW)
            .build();
    }

    private static ReasoningResult result(String text) {
        return new ReasoningResult(text, new TokenUsage(1000, 200), "test-model");
    }
}
