package com.proof2pay.orchestrator.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PromptServiceTest {

    @TempDir
    Path tempDir;

    private PromptService promptService;

    @BeforeEach
    void setUp() {
        promptService = new PromptService();
        promptService.setPromptsPath(tempDir.toString());
    }

    @Test
    void shouldPreferPromptFolder() throws Exception {
        Files.writeString(tempDir.resolve("market_research.md"), "  Local market prompt.\n");

        assertEquals("Local market prompt.", promptService.loadSystemPrompt("market_research"));
    }

    @Test
    void shouldFallBackToBundledPrompt() {
        String prompt = promptService.loadSystemPrompt("market_research");

        assertFalse(prompt.isBlank());
        assertNotEquals(PromptService.DEFAULT_PROMPT, prompt);
    }

    @Test
    void shouldUseDefaultForUnknownAgent() {
        assertEquals(PromptService.DEFAULT_PROMPT, promptService.loadSystemPrompt("no_such_agent"));
    }

    @Test
    void shouldCacheUntilFolderChanges() throws Exception {
        Path prompt = tempDir.resolve("fundraising.md");
        Files.writeString(prompt, "First.");
        assertEquals("First.", promptService.loadSystemPrompt("fundraising"));

        Files.writeString(prompt, "Second.");
        assertEquals("First.", promptService.loadSystemPrompt("fundraising"));

        promptService.setPromptsPath(tempDir.toString());
        assertEquals("Second.", promptService.loadSystemPrompt("fundraising"));
    }
}
