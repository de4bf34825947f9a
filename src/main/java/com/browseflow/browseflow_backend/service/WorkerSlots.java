package com.browseflow.browseflow_backend.service;

import java.util.HashMap;
import java.util.Map;

/**
 * Admission control for batch workers: one global ceiling plus a ceiling per batch.
 * Slots are keyed by execution id, so every exit path (completion, error, stop) releases
 * through the same call and a second release of the same execution is a no-op.
 * Not thread-safe; {@link ExecutionManager} guards it.
 */
public class WorkerSlots {

    private final int globalLimit;
    private final Map<String, String> holders = new HashMap<>();   // executionId -> batchId
    private final Map<String, Integer> perBatch = new HashMap<>();

    public WorkerSlots(int globalLimit) {
        if (globalLimit < 1) {
            throw new IllegalArgumentException("Global worker limit must be at least 1, got " + globalLimit);
        }
        this.globalLimit = globalLimit;
    }

    public boolean hasGlobalCapacity() {
        return holders.size() < globalLimit;
    }

    public boolean hasBatchCapacity(String batchId, int batchLimit) {
        return activeFor(batchId) < batchLimit;
    }

    public void acquire(String executionId, String batchId) {
        if (holders.containsKey(executionId)) {
            throw new IllegalStateException("Execution " + executionId + " already holds a worker slot");
        }
        if (!hasGlobalCapacity()) {
            throw new IllegalStateException("No free worker slot (limit " + globalLimit + ")");
        }
        holders.put(executionId, batchId);
        perBatch.merge(batchId, 1, Integer::sum);
    }

    /** Returns false when the execution held no slot. */
    public boolean release(String executionId) {
        if (!holders.containsKey(executionId)) return false;
        String batchId = holders.remove(executionId);
        perBatch.computeIfPresent(batchId, (k, count) -> count > 1 ? count - 1 : null);
        return true;
    }

    public int activeCount() {
        return holders.size();
    }

    public int activeFor(String batchId) {
        return perBatch.getOrDefault(batchId, 0);
    }
}
