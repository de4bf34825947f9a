package com.browseflow.browseflow_backend.model.dto;

import com.browseflow.browseflow_backend.model.context.ExecutionStatus;
import com.browseflow.browseflow_backend.model.context.ExecutorState;
import com.browseflow.browseflow_backend.model.domain.ExecutionRecord;

import java.time.Instant;

public record ExecutionStatusView(
        String          executionId,
        String          batchId,
        String          workflowName,
        ExecutionStatus status,
        ExecutorState   executorState,   // null when answered from the durable store
        Long            workerId,
        Instant         startedAt,
        Instant         completedAt,
        String          error,
        String          currentNodeId,
        String          pausedNodeId,
        String          pauseReason,
        boolean         live
) {

    public static ExecutionStatusView fromRecord(ExecutionRecord r) {
        return new ExecutionStatusView(
                r.getId(),
                r.getBatchId(),
                r.getWorkflowName(),
                r.getStatus(),
                null,
                r.getWorkerId(),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getErrorMessage(),
                null,
                null,
                null,
                false
        );
    }
}
