package com.browseflow.browseflow_backend.model.dto;

public record StopBatchResult(
        String batchId,
        int    stoppedExecutions,
        int    runningStopped,
        int    queuedCancelled
) {}
