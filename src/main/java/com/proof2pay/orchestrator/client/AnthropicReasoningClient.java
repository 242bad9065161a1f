package com.proof2pay.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.proof2pay.orchestrator.exception.ExternalCallException;
import com.proof2pay.orchestrator.exception.PermanentExternalException;
import com.proof2pay.orchestrator.exception.TransientExternalException;
import com.proof2pay.orchestrator.model.ConversationTurn;
import com.proof2pay.orchestrator.model.ModelTier;
import com.proof2pay.orchestrator.model.ReasoningRequest;
import com.proof2pay.orchestrator.model.ReasoningResult;
import com.proof2pay.orchestrator.model.RunErrorKind;
import com.proof2pay.orchestrator.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API client. Makes exactly one HTTP attempt per call; retrying is left to the runner.
 */
@Slf4j
@Component
public class AnthropicReasoningClient implements ReasoningClient {

    static final String API_VERSION = "2023-06-01";

    private final RestClient restClient;
    private final String apiKey;
    private final Map<ModelTier, String> models = new EnumMap<>(ModelTier.class);

    public AnthropicReasoningClient(RestClient.Builder restClientBuilder,
                                    @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                                    @Value("${anthropic.api-key:}") String apiKey,
                                    @Value("${anthropic.models.opus:claude-opus-4-5-20250514}") String opusModel,
                                    @Value("${anthropic.models.sonnet:claude-sonnet-4-5-20250514}") String sonnetModel,
                                    @Value("${anthropic.models.haiku:claude-haiku-3-5-20241022}") String haikuModel) {
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
        this.apiKey = apiKey;
        models.put(ModelTier.OPUS, opusModel);
        models.put(ModelTier.SONNET, sonnetModel);
        models.put(ModelTier.HAIKU, haikuModel);
    }

    @Override
    public ReasoningResult invoke(String agentId, ReasoningRequest request) {
        String model = models.get(request.getModelTier());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", request.getMaxTokens());
        body.put("system", request.getSystemPrompt() == null ? "" : request.getSystemPrompt());
        List<Map<String, String>> messages = new ArrayList<>();
        for (ConversationTurn turn : request.getHistory()) {
            messages.add(Map.of("role", turn.getRole(), "content", turn.getContent()));
        }
        messages.add(Map.of("role", "user", "content", request.getUserMessage()));
        body.put("messages", messages);

        JsonNode response;
        try {
            response = restClient.post()
                .uri("/v1/messages")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw classify(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            throw new TransientExternalException("I/O failure calling reasoning service: " + e.getMessage(), e);
        } catch (RestClientException e) {
            // response arrived but could not be read
            throw new TransientExternalException(RunErrorKind.MALFORMED_OUTPUT,
                "Unreadable response from reasoning service: " + e.getMessage(), e);
        }

        if (response == null || !response.path("content").isArray()) {
            throw new TransientExternalException(RunErrorKind.MALFORMED_OUTPUT,
                "Reasoning service returned no content for " + agentId);
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }

        JsonNode usageNode = response.path("usage");
        TokenUsage usage = new TokenUsage(usageNode.path("input_tokens").asLong(0),
            usageNode.path("output_tokens").asLong(0));

        log.info("[LLM] {} call complete: model={}, input_tokens={}, output_tokens={}, stop_reason={}",
            agentId, model, usage.getInputTokens(), usage.getOutputTokens(),
            response.path("stop_reason").asText(""));

        return new ReasoningResult(text.toString(), usage, model);
    }

    /**
     * 408, 429, 529 and 5xx are worth retrying; every other status is a problem with the request itself.
     */
    static ExternalCallException classify(int status, String responseBody) {
        String message = "Reasoning service returned HTTP " + status + abbreviate(responseBody);
        if (status == 408 || status == 429 || status == 529 || status >= 500) {
            return new TransientExternalException(message);
        }
        return new PermanentExternalException(message);
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.trim();
        return ": " + (trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...");
    }
}
