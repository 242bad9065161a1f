package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.model.Task;
import com.proof2pay.orchestrator.model.TaskOrigin;
import com.proof2pay.orchestrator.model.TaskPriority;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {

    private static final Instant T0 = Instant.parse("2026-03-02T12:00:00Z");

    @Test
    void shouldTakeInteractiveTasksBeforeScheduledOnes() throws Exception {
        TaskQueue queue = new TaskQueue();
        queue.offer(task("scheduled", TaskPriority.NORMAL, T0));
        queue.offer(task("human", TaskPriority.INTERACTIVE, T0.plusSeconds(5)));

        assertEquals("human", queue.poll(1, TimeUnit.SECONDS).getId());
        assertEquals("scheduled", queue.poll(1, TimeUnit.SECONDS).getId());
    }

    @Test
    void shouldOrderByCreationTimeThenInsertion() {
        TaskQueue queue = new TaskQueue();
        queue.offer(task("late", TaskPriority.NORMAL, T0.plusSeconds(10)));
        queue.offer(task("first", TaskPriority.NORMAL, T0));
        queue.offer(task("second", TaskPriority.NORMAL, T0));

        List<String> order = queue.snapshot().stream().map(Task::getId).toList();

        assertEquals(List.of("first", "second", "late"), order);
        assertEquals(3, queue.size());
    }

    @Test
    void shouldReturnNullWhenPollTimesOut() throws Exception {
        assertNull(new TaskQueue().poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldRejectTaskWithoutCreationTime() {
        TaskQueue queue = new TaskQueue();

        assertThrows(IllegalArgumentException.class, () -> queue.offer(task("x", TaskPriority.LOW, null)));
    }

    private static Task task(String id, TaskPriority priority, Instant createdAt) {
        return Task.builder()
            .id(id)
            .origin(TaskOrigin.SCHEDULE)
            .instruction("work")
            .priority(priority)
            .createdAt(createdAt)
            .build();
    }
}
