package com.proof2pay.orchestrator.service;

import com.proof2pay.orchestrator.model.Task;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared inbox of the dispatcher. Ordered by priority, then creation time, then insertion order. Safe for any
 * number of producers and consumers.
 */
@Component
public class TaskQueue {

    private static final Comparator<Entry> ORDER = Comparator
        .comparing((Entry entry) -> entry.getTask().getPriority())
        .thenComparing(entry -> entry.getTask().getCreatedAt())
        .thenComparingLong(Entry::getSequence);

    private final PriorityBlockingQueue<Entry> queue = new PriorityBlockingQueue<>(64, ORDER);
    private final AtomicLong sequence = new AtomicLong();

    public void offer(Task task) {
        if (task.getCreatedAt() == null) {
            throw new IllegalArgumentException("Task " + task.getId() + " has no creation time");
        }
        queue.offer(new Entry(task, sequence.incrementAndGet()));
    }

    public Task poll(long timeout, TimeUnit unit) throws InterruptedException {
        Entry entry = queue.poll(timeout, unit);
        return entry == null ? null : entry.getTask();
    }

    public int size() {
        return queue.size();
    }

    /**
     * Queued tasks in the order they will be taken.
     */
    public List<Task> snapshot() {
        List<Entry> entries = new ArrayList<>(queue);
        entries.sort(ORDER);
        return entries.stream().map(Entry::getTask).toList();
    }

    @Value
    private static class Entry {
        Task task;
        long sequence;
    }
}
