package com.proof2pay.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent system prompts. Looked up in the prompts folder first, then on the classpath under {@code prompts/}.
 */
@Slf4j
@Service
public class PromptService {

    static final String DEFAULT_PROMPT = "You are a specialist assistant on a two-person founding team. "
        + "Answer the task directly and concisely.";

    @Value("${agent.prompts.path:agent-prompts}")
    private String promptsPath = "agent-prompts";

    private final Map<String, String> promptCache = new ConcurrentHashMap<>();

    public void setPromptsPath(String path) {
        this.promptsPath = path;
        promptCache.clear();
    }

    public String loadSystemPrompt(String agentId) {
        return promptCache.computeIfAbsent(agentId, this::readPrompt);
    }

    private String readPrompt(String agentId) {
        try {
            Path promptFile = Paths.get(promptsPath, agentId + ".md");
            if (Files.isRegularFile(promptFile)) {
                return Files.readString(promptFile, StandardCharsets.UTF_8).trim();
            }

            ClassPathResource resource = new ClassPathResource("prompts/" + agentId + ".md");
            if (resource.exists()) {
                try (InputStream in = resource.getInputStream()) {
                    return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
                }
            }
        } catch (IOException e) {
            log.error("[Prompts] Failed to read prompt for {}: {}", agentId, e.getMessage());
            return DEFAULT_PROMPT;
        }

        log.warn("[Prompts] No prompt found for {}, using default", agentId);
        return DEFAULT_PROMPT;
    }
}
