package com.browseflow.browseflow_backend.model.dto;

import com.browseflow.browseflow_backend.model.context.BatchStatus;
import com.browseflow.browseflow_backend.model.domain.BatchRecord;
import com.browseflow.browseflow_backend.model.domain.BatchSourceType;

import java.time.Instant;
import java.util.List;

public record BatchStatusView(
        String          batchId,
        BatchStatus     status,
        BatchSourceType sourceType,
        String          sourcePath,
        int             totalWorkflows,
        int             validWorkflows,
        int             invalidWorkflows,
        int             completedWorkflows,
        int             failedWorkflows,
        int             stoppedWorkflows,
        int             runningWorkflows,
        int             queuedWorkflows,
        int             workerLimit,
        int             priority,
        String          outputPath,
        Instant         createdAt,
        Instant         startedAt,
        Instant         completedAt,
        List<String>    executionIds,
        boolean         live   // false when answered from the durable store
) {

    public static BatchStatusView fromRecord(BatchRecord r) {
        return new BatchStatusView(
                r.getId(),
                r.getStatus(),
                r.getSourceType(),
                r.getSourcePath(),
                r.getTotalWorkflows(),
                r.getValidWorkflows(),
                r.getInvalidWorkflows(),
                r.getCompletedWorkflows(),
                r.getFailedWorkflows(),
                r.getStoppedWorkflows(),
                r.getRunningWorkflows(),
                r.getQueuedWorkflows(),
                r.getWorkerLimit(),
                r.getPriority(),
                r.getOutputPath(),
                r.getCreatedAt(),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getExecutionIds() != null ? List.copyOf(r.getExecutionIds()) : List.of(),
                false
        );
    }
}
