package com.browseflow.browseflow_backend.model.domain;

import com.browseflow.browseflow_backend.model.context.ExecutionStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "executions")
@Data
public class ExecutionRecord {

    @Id
    private String id;

    // Null for single-mode runs
    @Column(name = "batch_id")
    private String batchId;

    @Column(name = "workflow_name")
    private String workflowName;

    @Column(name = "source_path")
    private String sourcePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.QUEUED;

    @Column(name = "worker_id")
    private Long workerId;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
