package com.proof2pay.orchestrator.controller;

import com.proof2pay.orchestrator.model.MemoryContext;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskRecord;
import com.proof2pay.orchestrator.service.AgentRosterService;
import com.proof2pay.orchestrator.service.AgentScheduler;
import com.proof2pay.orchestrator.service.ChatIngestionService;
import com.proof2pay.orchestrator.service.MemoryStoreService;
import com.proof2pay.orchestrator.service.TaskDispatcher;
import com.proof2pay.orchestrator.service.UsageTrackerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/slack")
public class SlackController {

    private static final int SUMMARY_BUDGET_CHARS = 3000;
    private static final int RECENT_TASKS = 5;

    @Autowired
    private ChatIngestionService chatIngestion;

    @Autowired
    private TaskDispatcher dispatcher;

    @Autowired
    private AgentScheduler scheduler;

    @Autowired
    private MemoryStoreService memoryStore;

    @Autowired
    private UsageTrackerService usageTracker;

    @Autowired
    private AgentRosterService roster;

    @PostMapping("/events")
    public ResponseEntity<?> handleSlackEvent(@RequestBody Map<String, Object> payload) {
        if (payload.containsKey("challenge")) {
            return ResponseEntity.ok(Map.of("challenge", payload.get("challenge")));
        }

        chatIngestion.processSlackPayload(payload);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/slash-commands")
    public ResponseEntity<?> handleSlashCommand(@RequestParam Map<String, String> params) {
        String command = params.getOrDefault("command", "");
        String text = params.getOrDefault("text", "").trim();
        String userId = params.get("user_id");
        String channelId = params.get("channel_id");

        String response = switch (command) {
            case "/agent-task" -> handleTask(channelId, text, userId);
            case "/agent-run" -> handleRun(channelId, text);
            case "/agent-daily" -> handleDaily();
            case "/agent-status" -> handleStatus();
            case "/agent-summary" -> handleSummary(text);
            case "/agent-budget" -> handleBudget();
            default -> "Unknown command: " + command;
        };

        return ResponseEntity.ok(Map.of(
            "response_type", "in_channel",
            "text", response
        ));
    }

    private String handleTask(String channelId, String text, String userId) {
        if (text.isEmpty()) {
            return "Usage: /agent-task <request>";
        }
        chatIngestion.submitRequest(channelId, text, userId);
        return "On it. I'll reply here when the agents are done.";
    }

    private String handleRun(String channelId, String text) {
        String[] parts = text.split("\\s+", 2);
        if (parts[0].isEmpty()) {
            return "Usage: /agent-run <agent_id> <request>";
        }
        try {
            scheduler.trigger(parts[0], parts.length > 1 ? parts[1] : "", channelId);
            return String.format("Triggered *%s*.", roster.displayName(parts[0]));
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
    }

    private String handleDaily() {
        String cycleId = scheduler.runDailyCycleNow();
        return String.format("Daily cycle %s started. The briefing follows when every agent has reported.", cycleId);
    }

    private String handleStatus() {
        List<TaskRecord> inFlight = dispatcher.inFlightTasks();
        List<Task> queued = dispatcher.queuedTasks();
        List<String> openCycles = scheduler.openCycles();
        List<TaskRecord> recent = dispatcher.recentTasks(RECENT_TASKS);

        List<String> sections = new ArrayList<>();
        if (inFlight.isEmpty()) {
            sections.add("No tasks in flight.");
        } else {
            sections.add(inFlight.stream()
                .map(record -> String.format("• `%s` %s for %s (%d runs finished, started %s)",
                    record.getTask().getId(),
                    record.getTask().getOrigin().name().toLowerCase(),
                    targets(record.getTask()),
                    record.getRuns().stream().filter(Run::isTerminal).count(),
                    record.getSubmittedAt()))
                .collect(Collectors.joining("\n", "*In flight:*\n", "")));
        }
        if (!queued.isEmpty()) {
            sections.add(queued.stream()
                .map(task -> String.format("• `%s` %s for %s", task.getId(), task.getPriority().name().toLowerCase(),
                    targets(task)))
                .collect(Collectors.joining("\n", "*Queued:*\n", "")));
        }
        if (!openCycles.isEmpty()) {
            sections.add("*Briefings pending for cycles:* " + String.join(", ", openCycles));
        }
        if (!recent.isEmpty()) {
            sections.add(recent.stream()
                .map(record -> String.format("• `%s` %d succeeded, %d failed",
                    record.getTask().getId(), record.countSucceeded(), record.countFailed()))
                .collect(Collectors.joining("\n", "*Recently finished:*\n", "")));
        }
        return String.join("\n\n", sections);
    }

    private static Object targets(Task task) {
        return task.getTargetAgentIds().isEmpty() ? "routing" : task.getTargetAgentIds();
    }

    private String handleSummary(String agentId) {
        if (agentId.isEmpty()) {
            return "Usage: /agent-summary <agent_id>";
        }
        if (!roster.isKnownAgent(agentId) && !AgentRosterService.BRIEFING_AGENT_ID.equals(agentId)) {
            return "Unknown agent: " + agentId;
        }
        MemoryContext context = memoryStore.recentContext(agentId, SUMMARY_BUDGET_CHARS);
        if (context.isEmpty()) {
            return String.format("*%s* has no memory yet.", roster.displayName(agentId));
        }
        return String.format("*%s*\n%s", roster.displayName(agentId), context.render());
    }

    private String handleBudget() {
        StringBuilder text = new StringBuilder("Monthly budget: ").append(usageTracker.formatBudgetStatus());
        usageTracker.getMonthlySpendByAgent().forEach((agentId, spend) ->
            text.append(String.format("\n• %s: $%.2f", roster.displayName(agentId), spend)));
        if (usageTracker.isOverBudgetThreshold()) {
            text.append("\nWarning: Over 80% of budget used!");
        }
        return text.toString();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
