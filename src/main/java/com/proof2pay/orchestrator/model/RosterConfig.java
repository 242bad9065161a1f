package com.proof2pay.orchestrator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the roster YAML: the agents plus the chat channel map.
 */
@Data
public class RosterConfig {

    /**
     * Channel target meaning "let the router pick the agents".
     */
    public static final String ROUTE = "route";

    private String chiefOfStaff = "chief_of_staff";
    private List<AgentDefinition> agents = new ArrayList<>();

    // channel id -> agent id, or "route"
    private Map<String, String> channels = new LinkedHashMap<>();
}
