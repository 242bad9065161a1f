package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.model.Briefing;
import com.proof2pay.orchestrator.model.Run;
import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskRecord;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Chat-facing text. Builds the single reply of a human task, clarification requests, failure notices and briefings.
 */
@Service
public class ReplyComposer {

    static final int MAX_SECTION_CHARS = 3500;
    static final int MAX_MESSAGE_CHARS = 12000;

    private final AgentRosterService roster;

    public ReplyComposer(AgentRosterService roster) {
        this.roster = roster;
    }

    /**
     * Synthesis of every succeeded run plus a note for each failed one, or a failure notice if nothing succeeded.
     */
    public String composeReply(TaskRecord record) {
        List<Run> agentRuns = agentRuns(record);
        List<Run> succeeded = agentRuns.stream().filter(Run::isSucceeded).toList();
        if (succeeded.isEmpty()) {
            return failureNotice(record);
        }

        StringBuilder message = new StringBuilder();
        for (Run run : succeeded) {
            message.append("*").append(roster.displayName(run.getAgentId())).append("*\n");
            message.append(truncate(run.getResult(), MAX_SECTION_CHARS)).append("\n\n");
        }

        List<Run> failed = agentRuns.stream().filter(Run::isFailed).toList();
        if (!failed.isEmpty()) {
            message.append("*Not included:*\n");
            for (Run run : failed) {
                message.append("• ").append(roster.displayName(run.getAgentId())).append(" failed: ")
                    .append(describeError(run)).append("\n");
            }
        }
        return truncate(message.toString().trim(), MAX_MESSAGE_CHARS);
    }

    public String failureNotice(TaskRecord record) {
        StringBuilder message = new StringBuilder();
        message.append("*Request failed*\n\n");
        message.append("*Request:* ").append(truncate(record.getTask().getInstruction(), 300)).append("\n");
        List<Run> runs = record.getRuns();
        if (runs.isEmpty()) {
            message.append("No agent ran for this request.");
        }
        for (Run run : runs) {
            message.append("• ").append(roster.displayName(run.getAgentId())).append(": ")
                .append(describeError(run)).append("\n");
        }
        return message.toString().trim();
    }

    public String clarification(Task task) {
        return String.format("I couldn't tell which agent should handle this:\n> %s\n\n"
                + "Could you rephrase it, or name the agent with `/agent-run <agent_id> <request>`?",
            truncate(task.getInstruction(), 300));
    }

    public String briefingText(String cycleId, String body, List<String> failureLines) {
        StringBuilder message = new StringBuilder();
        message.append("*Daily briefing ").append(cycleId).append("*\n\n");
        message.append(truncate(body, MAX_MESSAGE_CHARS - 1000).trim());
        if (!failureLines.isEmpty()) {
            message.append("\n\n*Failures since the last briefing:*\n");
            for (String line : failureLines) {
                message.append("• ").append(line).append("\n");
            }
        }
        return truncate(message.toString().trim(), MAX_MESSAGE_CHARS);
    }

    public String briefingStatus(Briefing briefing) {
        return String.format("Briefing %s: %d succeeded, %d failed", briefing.getCycleId(),
            briefing.getSucceededRuns(), briefing.getFailedRuns());
    }

    /**
     * One-line description of a failed run for the failure ledger.
     */
    public String failureLine(Task task, Run run) {
        return String.format("%s (%s task %s): %s", roster.displayName(run.getAgentId()),
            task.getOrigin().name().toLowerCase(Locale.ROOT), task.getId(), describeError(run));
    }

    private String describeError(Run run) {
        if (run.getError() == null) {
            return String.valueOf(run.getStatus());
        }
        return run.getError().getKind() + " " + truncate(run.getError().getMessage(), 200);
    }

    private static List<Run> agentRuns(TaskRecord record) {
        return record.getRuns().stream()
            .filter(run -> !AgentRosterService.ROUTER_AGENT_ID.equals(run.getAgentId()))
            .toList();
    }

    static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max - 15) + "\n_(truncated)_";
    }
}
