package com.browseflow.browseflow_backend.service;

import com.browseflow.browseflow_backend.engine.WorkflowExecutor;
import com.browseflow.browseflow_backend.model.context.ExecutionStatus;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/** Live bookkeeping for one queued or running execution. Mutated only under the manager's lock. */
@Data
@Builder
public class ExecutionMetadata {

    private final String executionId;
    private final String batchId;
    private final Workflow workflow;
    private final String workflowName;
    private final String sourcePath;
    private final WorkflowExecutor executor;

    private ExecutionStatus status;
    private Long workerId;
    private Instant startTime;
    private Instant endTime;
    private String error;

    // Set while still queued so an in-flight dispatch drops the item
    private boolean cancelled;
}
