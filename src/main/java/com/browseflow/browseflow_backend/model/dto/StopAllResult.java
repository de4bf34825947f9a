package com.browseflow.browseflow_backend.model.dto;

import java.util.List;

public record StopAllResult(
        int                   totalBatches,
        int                   totalStopped,
        int                   runningStopped,
        int                   queuedCancelled,
        List<StopBatchResult> batches
) {}
