package com.proof2pay.orchestrator.model;

import lombok.Value;

@Value
public class FollowUpDirective {
    String sourceAgentId;
    String targetAgentId;
    String instruction;
}
