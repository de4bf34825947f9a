package com.browseflow.browseflow_backend.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Pending executions, highest priority first and FIFO within a priority.
 * Not thread-safe; {@link ExecutionManager} guards it.
 */
public class ExecutionQueue {

    private static final Comparator<QueueItem> ORDER = Comparator
            .comparingInt(QueueItem::priority).reversed()
            .thenComparingLong(QueueItem::sequence);

    private final TreeSet<QueueItem> items = new TreeSet<>(ORDER);
    private final Map<String, QueueItem> byExecution = new HashMap<>();
    private long nextSequence;

    public QueueItem enqueue(String executionId, String batchId, int priority) {
        if (byExecution.containsKey(executionId)) {
            throw new IllegalStateException("Execution " + executionId + " is already queued");
        }
        QueueItem item = new QueueItem(executionId, batchId, priority, Instant.now(), nextSequence++);
        items.add(item);
        byExecution.put(executionId, item);
        return item;
    }

    /** Removes and returns the first item, in queue order, that the predicate accepts. Blocked items stay put. */
    public Optional<QueueItem> takeFirst(Predicate<QueueItem> eligible) {
        Iterator<QueueItem> it = items.iterator();
        while (it.hasNext()) {
            QueueItem item = it.next();
            if (eligible.test(item)) {
                it.remove();
                byExecution.remove(item.executionId());
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    public boolean remove(String executionId) {
        QueueItem item = byExecution.remove(executionId);
        return item != null && items.remove(item);
    }

    public boolean contains(String executionId) {
        return byExecution.containsKey(executionId);
    }

    public int countForBatch(String batchId) {
        return (int) items.stream().filter(i -> batchId.equals(i.batchId())).count();
    }

    public int size() {
        return items.size();
    }

    public List<QueueItem> snapshot() {
        return new ArrayList<>(items);
    }
}
