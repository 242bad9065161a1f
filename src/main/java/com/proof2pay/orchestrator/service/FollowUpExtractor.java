package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.model.AgentDefinition;
import com.proof2pay.orchestrator.model.FollowUpDirective;
import com.proof2pay.orchestrator.model.Run;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads follow-up directives ({@code DISPATCH: <agent_id> | <instruction>}) out of agent output.
 *
 * <p>
 * When several directives name the same target, the one from the agent with the narrower capability tag wins;
 * equally narrow sources are ordered by agent id.
 */
@Slf4j
@Component
public class FollowUpExtractor {

    private static final Pattern DIRECTIVE = Pattern.compile(
        "^\\s*DISPATCH:\\s*([A-Za-z0-9_]+)\\s*\\|\\s*(.+?)\\s*$",
        Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

    private final AgentRosterService roster;

    public FollowUpExtractor(AgentRosterService roster) {
        this.roster = roster;
    }

    public List<FollowUpDirective> extract(String sourceAgentId, String output) {
        List<FollowUpDirective> directives = new ArrayList<>();
        if (output == null || output.isBlank()) {
            return directives;
        }
        Matcher matcher = DIRECTIVE.matcher(output);
        while (matcher.find()) {
            String target = matcher.group(1).toLowerCase(Locale.ROOT);
            if (!roster.isKnownAgent(target)) {
                log.warn("[Dispatcher] {} asked for follow-up by unknown agent {}, ignored", sourceAgentId, target);
                continue;
            }
            directives.add(new FollowUpDirective(sourceAgentId, target, matcher.group(2)));
        }
        return directives;
    }

    /**
     * All directives in the succeeded runs, reduced to one per target agent. Ordered by target id.
     */
    public List<FollowUpDirective> collect(List<Run> runs) {
        List<FollowUpDirective> all = new ArrayList<>();
        for (Run run : runs) {
            if (run.isSucceeded()) {
                all.addAll(extract(run.getAgentId(), run.getResult()));
            }
        }
        return resolveConflicts(all);
    }

    public List<FollowUpDirective> resolveConflicts(List<FollowUpDirective> directives) {
        Comparator<FollowUpDirective> precedence = Comparator
            .comparingInt((FollowUpDirective directive) -> capabilityDepth(directive.getSourceAgentId()))
            .reversed()
            .thenComparing(FollowUpDirective::getSourceAgentId);

        Map<String, FollowUpDirective> winners = new TreeMap<>();
        for (FollowUpDirective directive : directives) {
            winners.merge(directive.getTargetAgentId(), directive,
                (current, candidate) -> precedence.compare(candidate, current) < 0 ? candidate : current);
        }
        return new ArrayList<>(winners.values());
    }

    private int capabilityDepth(String agentId) {
        return roster.getAgent(agentId).map(AgentDefinition::getCapabilityDepth).orElse(0);
    }
}
