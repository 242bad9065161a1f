package com.proof2pay.orchestrator.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.proof2pay.orchestrator.model.AgentDefinition;
import com.proof2pay.orchestrator.model.ModelTier;
import com.proof2pay.orchestrator.model.RosterConfig;
import com.proof2pay.orchestrator.model.ScheduleClass;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads the agent roster and the chat channel map. Read-only after startup; changes need a restart.
 */
@Slf4j
@Service
public class AgentRosterService {

    public static final String ROUTER_AGENT_ID = "_router";
    public static final String BRIEFING_AGENT_ID = "_briefing";

    private static final String CLASSPATH_ROSTER = "agents.yaml";

    @Value("${agent.roster.path:config/agents.yaml}")
    private String rosterPath = "config/agents.yaml";

    private final ObjectMapper yamlMapper;

    private volatile Map<String, AgentDefinition> agents = Map.of();
    // declaration order, for listings and routing prompts
    private volatile List<String> orderedIds = List.of();
    private volatile Map<String, String> channels = Map.of();
    private volatile String chiefOfStaffId = "chief_of_staff";

    private final AgentDefinition routerAgent = AgentDefinition.builder()
        .id(ROUTER_AGENT_ID)
        .name("Router")
        .capabilityTag("routing")
        .scheduleClass(ScheduleClass.EVENT_TRIGGERED)
        .modelTier(ModelTier.HAIKU)
        .build();

    public AgentRosterService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setRosterPath(String path) {
        this.rosterPath = path;
    }

    @PostConstruct
    public void loadRoster() {
        RosterConfig config = readConfig();

        Map<String, AgentDefinition> loaded = new LinkedHashMap<>();
        for (AgentDefinition agent : config.getAgents()) {
            if (agent.getId() == null || agent.getId().isBlank()) {
                throw new IllegalStateException("Roster entry without id: " + agent);
            }
            if (agent.getId().startsWith("_")) {
                throw new IllegalStateException("Agent ids starting with '_' are reserved: " + agent.getId());
            }
            if (loaded.putIfAbsent(agent.getId(), agent) != null) {
                throw new IllegalStateException("Duplicate agent id in roster: " + agent.getId());
            }
        }
        validateDependencies(loaded);

        this.agents = Map.copyOf(loaded);
        this.channels = Map.copyOf(config.getChannels());
        this.chiefOfStaffId = config.getChiefOfStaff();
        this.orderedIds = List.copyOf(loaded.keySet());

        log.info("[Roster] Loaded {} agents and {} channel mappings", loaded.size(), channels.size());
    }

    public Optional<AgentDefinition> getAgent(String agentId) {
        if (ROUTER_AGENT_ID.equals(agentId)) {
            return Optional.of(routerAgent);
        }
        return Optional.ofNullable(agents.get(agentId));
    }

    public boolean isKnownAgent(String agentId) {
        return agents.containsKey(agentId);
    }

    public List<AgentDefinition> getAllAgents() {
        List<AgentDefinition> all = new ArrayList<>();
        for (String id : orderedIds) {
            all.add(agents.get(id));
        }
        return all;
    }

    public List<AgentDefinition> getTimeTriggeredAgents() {
        return getAllAgents().stream()
            .filter(agent -> agent.getScheduleClass().isTimeTriggered())
            .toList();
    }

    public AgentDefinition getRouterAgent() {
        return routerAgent;
    }

    public String getChiefOfStaffId() {
        return chiefOfStaffId;
    }

    /**
     * Target configured for a chat channel: an agent id, {@code route}, or empty when the channel is not mapped.
     */
    public Optional<String> channelTarget(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    public String displayName(String agentId) {
        return getAgent(agentId).map(AgentDefinition::getDisplayName).orElse(agentId);
    }

    private RosterConfig readConfig() {
        File rosterFile = new File(rosterPath);
        try {
            if (rosterFile.isFile()) {
                log.info("[Roster] Reading roster from {}", rosterFile.getAbsolutePath());
                return yamlMapper.readValue(rosterFile, RosterConfig.class);
            }
            ClassPathResource resource = new ClassPathResource(CLASSPATH_ROSTER);
            if (!resource.exists()) {
                throw new IllegalStateException("No roster at " + rosterPath + " and no classpath " + CLASSPATH_ROSTER);
            }
            log.info("[Roster] {} not found, using classpath {}", rosterPath, CLASSPATH_ROSTER);
            try (InputStream in = resource.getInputStream()) {
                return yamlMapper.readValue(in, RosterConfig.class);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read roster: " + e.getMessage(), e);
        }
    }

    private static void validateDependencies(Map<String, AgentDefinition> roster) {
        for (AgentDefinition agent : roster.values()) {
            for (String upstream : agent.getDependsOn()) {
                if (!roster.containsKey(upstream)) {
                    throw new IllegalStateException(agent.getId() + " depends on unknown agent " + upstream);
                }
            }
        }
        Set<String> done = new HashSet<>();
        for (String id : roster.keySet()) {
            checkAcyclic(id, roster, new HashSet<>(), done);
        }
    }

    private static void checkAcyclic(String id, Map<String, AgentDefinition> roster, Set<String> path, Set<String> done) {
        if (done.contains(id)) {
            return;
        }
        if (!path.add(id)) {
            throw new IllegalStateException("Dependency cycle in roster through " + id);
        }
        for (String upstream : roster.get(id).getDependsOn()) {
            checkAcyclic(upstream, roster, path, done);
        }
        path.remove(id);
        done.add(id);
    }
}
