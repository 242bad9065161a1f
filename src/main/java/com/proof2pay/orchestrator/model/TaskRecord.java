package com.proof2pay.orchestrator.model;

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A dispatched task together with the runs it produced.
 */
@Getter
public class TaskRecord {

    private final Task task;
    private final Instant submittedAt;
    private final List<Run> runs = new CopyOnWriteArrayList<>();
    private volatile Instant completedAt;

    public TaskRecord(Task task, Instant submittedAt) {
        this.task = task;
        this.submittedAt = submittedAt;
    }

    public void addRun(Run run) {
        runs.add(run);
    }

    /**
     * A task is complete only once every run it owns is terminal.
     */
    public boolean isComplete() {
        return completedAt != null && runs.stream().allMatch(Run::isTerminal);
    }

    public void markComplete(Instant at) {
        Run open = runs.stream().filter(run -> !run.isTerminal()).findFirst().orElse(null);
        if (open != null) {
            throw new IllegalStateException("Task " + task.getId() + " still has run " + open.getId()
                + " in status " + open.getStatus());
        }
        this.completedAt = at;
    }

    public long countSucceeded() {
        return runs.stream().filter(Run::isSucceeded).count();
    }

    public long countFailed() {
        return runs.stream().filter(Run::isFailed).count();
    }
}
