package com.browseflow.browseflow_backend.service;

import java.time.Instant;

/** @param sequence enqueue order, breaks ties between items of equal priority */
public record QueueItem(String executionId, String batchId, int priority, Instant enqueuedAt, long sequence) {}
