package com.proof2pay.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * The {@code event} object of a Slack Events API callback, reduced to the fields ingestion reads.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlackMessageEvent {
    private String type;
    private String subtype;
    private String channel;
    private String user;
    private String text;
    private String ts;

    @JsonProperty("thread_ts")
    private String threadTs;

    @JsonProperty("bot_id")
    private String botId;
}
