package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.model.TaskRecord;

/**
 * Notified by the dispatcher once a task and all of its runs are terminal.
 */
@FunctionalInterface
public interface TaskCompletionListener {

    void onTaskCompleted(TaskRecord record);
}
