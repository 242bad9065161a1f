package com.proof2pay.orchestrator.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.proof2pay.orchestrator.model.ModelTier;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.UsageEntry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Token and cost accounting per agent and model tier, checked against a monthly budget. Entries are appended to
 * {@code usage.jsonl} under the data folder.
 */
@Slf4j
@Service
public class UsageTrackerService {

    private static final String USAGE_FILE = "usage.jsonl";

    @Value("${agent.data.path:data}")
    private String dataPath = "data";

    @Value("${agent.monthly.budget:500.0}")
    private double monthlyBudget = 500.0;

    private final Clock clock;
    private final ObjectMapper mapper;
    private final List<UsageEntry> entries = Collections.synchronizedList(new ArrayList<>());

    public UsageTrackerService(Clock clock) {
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    public void setMonthlyBudget(double budget) {
        this.monthlyBudget = budget;
    }

    @PostConstruct
    public void init() {
        loadCurrentMonthUsage();
    }

    public double calculateCost(ModelTier tier, long inputTokens, long outputTokens) {
        double inputCost = (inputTokens * tier.getInputPricePerMillion()) / 1_000_000.0;
        double outputCost = (outputTokens * tier.getOutputPricePerMillion()) / 1_000_000.0;
        return inputCost + outputCost;
    }

    /**
     * Records the tokens a run consumed. Runs that never reached the reasoning service record nothing.
     */
    public UsageEntry recordRun(Run run) {
        if (run.getUsage() == null || run.getUsage().getTotalTokens() == 0) {
            return null;
        }
        ModelTier tier = run.getModelTier() != null ? run.getModelTier() : ModelTier.SONNET;
        return recordUsage(run.getAgentId(), run.getTaskId(), tier,
            run.getUsage().getInputTokens(), run.getUsage().getOutputTokens());
    }

    public UsageEntry recordUsage(String agentId, String taskId, ModelTier tier, long inputTokens, long outputTokens) {
        UsageEntry entry = UsageEntry.builder()
            .timestamp(clock.instant())
            .agentId(agentId)
            .taskId(taskId)
            .modelTier(tier)
            .inputTokens(inputTokens)
            .outputTokens(outputTokens)
            .costUsd(calculateCost(tier, inputTokens, outputTokens))
            .build();

        entries.add(entry);
        persistEntry(entry);
        log.info("[Usage] {} on task {}: {}", agentId, taskId, formatUsageSummary(entry));

        if (isOverBudgetThreshold()) {
            log.warn("[Usage] Monthly spend at {}", formatBudgetStatus());
        }
        return entry;
    }

    public double getMonthlySpend() {
        YearMonth month = currentMonth();
        synchronized (entries) {
            return entries.stream()
                .filter(entry -> YearMonth.from(entry.getTimestamp().atZone(ZoneOffset.UTC)).equals(month))
                .mapToDouble(UsageEntry::getCostUsd)
                .sum();
        }
    }

    public Map<String, Double> getMonthlySpendByAgent() {
        YearMonth month = currentMonth();
        Map<String, Double> byAgent = new TreeMap<>();
        synchronized (entries) {
            entries.stream()
                .filter(entry -> YearMonth.from(entry.getTimestamp().atZone(ZoneOffset.UTC)).equals(month))
                .forEach(entry -> byAgent.merge(entry.getAgentId(), entry.getCostUsd(), Double::sum));
        }
        return byAgent;
    }

    public double getBudgetPercentage() {
        return (getMonthlySpend() / monthlyBudget) * 100.0;
    }

    public boolean isOverBudgetThreshold() {
        return getBudgetPercentage() >= 80.0;
    }

    public String formatUsageSummary(UsageEntry entry) {
        return String.format("$%.2f (%s, %dK tokens)",
            entry.getCostUsd(),
            entry.getModelTier().toValue(),
            (entry.getInputTokens() + entry.getOutputTokens()) / 1000);
    }

    public String formatBudgetStatus() {
        return String.format("$%.2f / $%.0f (%.0f%%)",
            getMonthlySpend(),
            monthlyBudget,
            getBudgetPercentage());
    }

    private YearMonth currentMonth() {
        return YearMonth.from(clock.instant().atZone(ZoneOffset.UTC));
    }

    private void persistEntry(UsageEntry entry) {
        try {
            Path usageFile = Paths.get(dataPath, USAGE_FILE);
            Files.createDirectories(usageFile.toAbsolutePath().getParent());

            String json = mapper.writeValueAsString(entry);
            Files.writeString(usageFile, json + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("[Usage] Failed to persist usage entry for {}: {}", entry.getAgentId(), e.getMessage());
        }
    }

    private void loadCurrentMonthUsage() {
        Path usageFile = Paths.get(dataPath, USAGE_FILE);
        if (!Files.exists(usageFile)) {
            return;
        }

        YearMonth month = currentMonth();
        try (Stream<String> lines = Files.lines(usageFile, StandardCharsets.UTF_8)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    UsageEntry entry = mapper.readValue(line, UsageEntry.class);
                    if (YearMonth.from(entry.getTimestamp().atZone(ZoneOffset.UTC)).equals(month)) {
                        entries.add(entry);
                    }
                } catch (IOException e) {
                    log.warn("[Usage] Skipping malformed usage line: {}", e.getMessage());
                }
            });
        } catch (IOException e) {
            log.error("[Usage] Failed to load usage history: {}", e.getMessage());
        }
        log.info("[Usage] Loaded {} usage entries for {}", entries.size(), month);
    }
}
