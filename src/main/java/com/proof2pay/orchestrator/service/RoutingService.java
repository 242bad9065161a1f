package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.exception.RoutingAmbiguityException;
import com.proof2pay.orchestrator.model.AgentDefinition;
import com.proof2pay.orchestrator.model.Task;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a human request without explicit targets into a routing task for the router agent, and reads the router's
 * answer back as a list of roster agent ids.
 */
@Service
public class RoutingService {

    static final String NO_AGENT = "NONE";

    private static final Pattern AGENT_TOKEN = Pattern.compile("[a-z0-9_]+");

    private final AgentRosterService roster;

    public RoutingService(AgentRosterService roster) {
        this.roster = roster;
    }

    /**
     * Same task id as the request, so the routing run belongs to the task it routes.
     */
    public Task routingTask(Task request) {
        return request.toBuilder()
            .instruction(buildRoutingInstruction(request.getInstruction()))
            .hints(Map.of())
            .build();
    }

    public String buildRoutingInstruction(String request) {
        StringBuilder instruction = new StringBuilder();
        instruction.append("Pick the agents that should handle the request below.\n\n");
        instruction.append("Available agents:\n");
        for (AgentDefinition agent : roster.getAllAgents()) {
            instruction.append("- ").append(agent.getId())
                .append(" (").append(agent.getCapabilityTag()).append("): ")
                .append(agent.getDisplayName()).append("\n");
        }
        instruction.append("\nReply with the chosen agent ids separated by commas, and nothing else. ");
        instruction.append("Reply ").append(NO_AGENT).append(" if no agent fits or the request is unclear.\n\n");
        instruction.append("Request:\n").append(request);
        return instruction.toString();
    }

    /**
     * Known agent ids mentioned in the answer, in order of first mention.
     */
    public List<String> parseSelection(String answer) {
        if (answer == null || answer.isBlank()) {
            return List.of();
        }
        Set<String> selected = new LinkedHashSet<>();
        Matcher matcher = AGENT_TOKEN.matcher(answer.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (roster.isKnownAgent(token)) {
                selected.add(token);
            }
        }
        return new ArrayList<>(selected);
    }

    /**
     * @throws RoutingAmbiguityException
     *             when the answer names no known agent
     */
    public List<String> resolve(Task request, String routerAnswer) {
        List<String> selected = parseSelection(routerAnswer);
        if (selected.isEmpty()) {
            throw new RoutingAmbiguityException(request.getId(),
                "No agent matched the request: " + abbreviate(request.getInstruction()));
        }
        return selected;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 120 ? text : text.substring(0, 117) + "...";
    }
}
