package com.proof2pay.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proof2pay.orchestrator.model.ChatEvent;
import com.proof2pay.orchestrator.model.ModelTier;
import com.proof2pay.orchestrator.model.RosterConfig;
import com.proof2pay.orchestrator.model.SlackMessageEvent;
import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskOrigin;
import com.proof2pay.orchestrator.model.TaskPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns inbound chat messages into interactive tasks. Mapped channels send every message to their agent (or to the
 * router); elsewhere only direct mentions of the bot are picked up and routed.
 */
@Slf4j
@Service
public class ChatIngestionService {

    private static final Pattern MODEL_FLAG_PATTERN = Pattern.compile("--model\\s+(\\w+)");
    private static final Pattern MENTION_PATTERN = Pattern.compile("<@[A-Z0-9]+>");

    private final AgentRosterService roster;
    private final TaskDispatcher dispatcher;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public ChatIngestionService(AgentRosterService roster, TaskDispatcher dispatcher, Clock clock) {
        this.roster = roster;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public void processSlackPayload(Map<String, Object> payload) {
        Object raw = payload.get("event");
        if (raw == null) {
            return;
        }
        SlackMessageEvent event;
        try {
            event = mapper.convertValue(raw, SlackMessageEvent.class);
        } catch (IllegalArgumentException e) {
            log.warn("[Chat] Ignoring unreadable Slack event: {}", e.getMessage());
            return;
        }
        String type = event.getType();
        if (!"app_mention".equals(type) && !"message".equals(type)) {
            return;
        }
        // edits, joins and other message subtypes are not requests
        if (event.getSubtype() != null) {
            return;
        }

        String channel = event.getChannel();
        boolean mapped = roster.channelTarget(channel).isPresent();
        // Slack sends a mention in a mapped channel twice, once as message and once as app_mention
        if (mapped && "app_mention".equals(type)) {
            return;
        }
        if (!mapped && "message".equals(type)) {
            return;
        }

        onEvent(ChatEvent.builder()
            .channel(channel)
            .author(event.getUser())
            .text(event.getText())
            .timestamp(parseTimestamp(event.getTs()))
            .threadTs(event.getThreadTs() != null ? event.getThreadTs() : event.getTs())
            .fromBot(event.getBotId() != null)
            .build());
    }

    public Optional<Task> onEvent(ChatEvent event) {
        if (event.isFromBot() || event.getText() == null || event.getText().isBlank()) {
            return Optional.empty();
        }
        String target = roster.channelTarget(event.getChannel()).orElse(RosterConfig.ROUTE);
        String text = MENTION_PATTERN.matcher(event.getText()).replaceAll("").trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        List<String> targets = RosterConfig.ROUTE.equals(target) ? List.of() : List.of(target);
        String conversationId = event.getThreadTs() == null || event.getThreadTs().isBlank()
            ? null
            : event.getChannel() + "_" + event.getThreadTs();
        return Optional.of(submitRequest(event.getChannel(), text, event.getAuthor(), targets, conversationId));
    }

    /**
     * Queues a human request for routing. Replies go to {@code channel}.
     */
    public Task submitRequest(String channel, String text, String author) {
        return submitRequest(channel, text, author, List.of(), null);
    }

    /**
     * @param conversationId
     *            chat thread the request belongs to, or {@code null}; agents see the thread's earlier turns
     */
    public Task submitRequest(String channel, String text, String author, List<String> targets,
                              String conversationId) {
        Map<String, String> hints = new HashMap<>();
        parseModel(text).ifPresent(tier -> hints.put(Task.HINT_MODEL_TIER, tier.toValue()));
        if (author != null) {
            hints.put(Task.HINT_AUTHOR, author);
        }
        if (conversationId != null) {
            hints.put(Task.HINT_CONVERSATION, conversationId);
        }

        Task task = Task.builder()
            .id(TaskDispatcher.newTaskId())
            .origin(TaskOrigin.HUMAN_MESSAGE)
            .targetAgentIds(targets)
            .instruction(stripModelFlag(text))
            .hints(Map.copyOf(hints))
            .priority(TaskPriority.INTERACTIVE)
            .createdAt(clock.instant())
            .channel(channel)
            .build();
        dispatcher.enqueue(task);
        log.info("[Chat] Request {} from {} in {} queued for {}", task.getId(), author, channel,
            targets.isEmpty() ? "routing" : targets);
        return task;
    }

    public Optional<ModelTier> parseModel(String command) {
        Matcher matcher = MODEL_FLAG_PATTERN.matcher(command);
        if (matcher.find()) {
            return ModelTier.parse(matcher.group(1));
        }
        return Optional.empty();
    }

    public String stripModelFlag(String command) {
        return MODEL_FLAG_PATTERN.matcher(command).replaceAll("").trim();
    }

    private Instant parseTimestamp(String value) {
        if (value != null && !value.isBlank()) {
            try {
                BigDecimal seconds = new BigDecimal(value);
                long whole = seconds.longValue();
                long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
                return Instant.ofEpochSecond(whole, nanos);
            } catch (NumberFormatException e) {
                log.debug("[Chat] Unparseable event timestamp {}", value);
            }
        }
        return clock.instant();
    }
}
