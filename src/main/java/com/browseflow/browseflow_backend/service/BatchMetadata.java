package com.browseflow.browseflow_backend.service;

import com.browseflow.browseflow_backend.model.context.BatchStatus;
import com.browseflow.browseflow_backend.model.domain.BatchSourceType;
import com.browseflow.browseflow_backend.model.dto.BatchStatusView;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class BatchMetadata {

    private final String batchId;
    private final BatchSourceType sourceType;
    private final String sourcePath;
    private final int totalWorkflows;
    private final int validWorkflows;
    private final int invalidWorkflows;
    private final int workerLimit;
    private final int priority;
    private final String outputPath;
    private final Instant createdAt;

    @Builder.Default
    private final List<String> executionIds = new ArrayList<>();

    private int completedWorkflows;
    private int failedWorkflows;
    private int stoppedWorkflows;
    private int runningWorkflows;
    private int queuedWorkflows;

    @Builder.Default
    private BatchStatus status = BatchStatus.RUNNING;
    private Instant startTime;
    private Instant endTime;

    public int finishedWorkflows() {
        return completedWorkflows + failedWorkflows + stoppedWorkflows;
    }

    public BatchStatusView toView() {
        return new BatchStatusView(
                batchId,
                status,
                sourceType,
                sourcePath,
                totalWorkflows,
                validWorkflows,
                invalidWorkflows,
                completedWorkflows,
                failedWorkflows,
                stoppedWorkflows,
                runningWorkflows,
                queuedWorkflows,
                workerLimit,
                priority,
                outputPath,
                createdAt,
                startTime,
                endTime,
                List.copyOf(executionIds),
                true
        );
    }
}
