package com.browseflow.browseflow_backend.model.domain;

import com.browseflow.browseflow_backend.model.context.BatchStatus;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "batches")
@Data
public class BatchRecord {

    @Id
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false)
    private BatchSourceType sourceType;

    @Column(name = "source_path")
    private String sourcePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchStatus status = BatchStatus.RUNNING;

    @Column(name = "total_workflows")
    private int totalWorkflows;

    @Column(name = "valid_workflows")
    private int validWorkflows;

    @Column(name = "invalid_workflows")
    private int invalidWorkflows;

    @Column(name = "completed_workflows")
    private int completedWorkflows;

    @Column(name = "failed_workflows")
    private int failedWorkflows;

    @Column(name = "stopped_workflows")
    private int stoppedWorkflows;

    @Column(name = "running_workflows")
    private int runningWorkflows;

    @Column(name = "queued_workflows")
    private int queuedWorkflows;

    @Column(name = "worker_limit")
    private int workerLimit;

    private int priority;

    @Column(name = "output_path")
    private String outputPath;

    // Member execution ids in submission order
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_ids")
    private List<String> executionIds = new ArrayList<>();

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
