package com.proof2pay.orchestrator.support;

import com.proof2pay.orchestrator.service.AgentRosterService;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the standard test roster to a folder and loads it.
 */
public final class TestRoster {

    public static final String YAML = String.join("\n",
        "chief_of_staff: chief_of_staff",
        "agents:",
        "  - id: chief_of_staff",
        "    name: Chief of Staff",
        "    capability_tag: orchestration",
        "    schedule_class: always_on",
        "    model_tier: opus",
        "    context_from: [\"*\"]",
        "  - id: domain_intelligence",
        "    name: Domain Intelligence",
        "    capability_tag: research.domain",
        "    schedule_class: daily",
        "  - id: market_research",
        "    name: Market Research",
        "    capability_tag: research.market",
        "    schedule_class: daily",
        "  - id: competitive_intel",
        "    name: Competitive Intelligence",
        "    capability_tag: research.market.competitors",
        "    schedule_class: daily",
        "  - id: compliance",
        "    name: Compliance",
        "    capability_tag: review.compliance",
        "    schedule_class: weekly",
        "    schedule_weekday: monday",
        "  - id: fundraising",
        "    name: Fundraising",
        "    capability_tag: drafting.fundraising",
        "    schedule_class: weekly",
        "    schedule_weekday: thursday",
        "  - id: brand_marketing",
        "    name: Brand & Marketing",
        "    capability_tag: drafting.marketing",
        "    schedule_class: biweekly",
        "    schedule_weekday: tuesday",
        "  - id: technical_pm",
        "    name: Technical PM",
        "    capability_tag: drafting.product.technical",
        "    schedule_class: event_triggered",
        "    depends_on: [domain_intelligence]",
        "channels:",
        "  C_ROUTE: route",
        "  C_FUND: fundraising",
        "");

    private TestRoster() {
    }

    public static AgentRosterService load(Path dir) {
        return load(dir, YAML);
    }

    public static AgentRosterService load(Path dir, String yaml) {
        try {
            Path file = dir.resolve("agents.yaml");
            Files.writeString(file, yaml, StandardCharsets.UTF_8);
            AgentRosterService roster = new AgentRosterService();
            roster.setRosterPath(file.toString());
            roster.loadRoster();
            return roster;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
