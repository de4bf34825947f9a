package com.browseflow.browseflow_backend.service;

import com.browseflow.browseflow_backend.model.context.BatchStatus;
import com.browseflow.browseflow_backend.model.context.ExecutionStatus;
import com.browseflow.browseflow_backend.model.domain.BatchRecord;
import com.browseflow.browseflow_backend.model.domain.ExecutionRecord;
import com.browseflow.browseflow_backend.repository.BatchRecordRepository;
import com.browseflow.browseflow_backend.repository.ExecutionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Durable batch and execution records. Any storage failure, including a database that
 * cannot hand out a transaction, is logged and reported as "nothing stored", never
 * thrown: scheduling carries on without persistence.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchPersistenceService {

    private static final EnumSet<ExecutionStatus> UNFINISHED = EnumSet.of(ExecutionStatus.QUEUED, ExecutionStatus.RUNNING);

    private final BatchRecordRepository batchRepository;
    private final ExecutionRecordRepository executionRepository;

    public void saveBatch(BatchMetadata batch) {
        try {
            BatchRecord record = batchRepository.findById(batch.getBatchId()).orElseGet(BatchRecord::new);
            record.setId(batch.getBatchId());
            record.setSourceType(batch.getSourceType());
            record.setSourcePath(batch.getSourcePath());
            record.setTotalWorkflows(batch.getTotalWorkflows());
            record.setValidWorkflows(batch.getValidWorkflows());
            record.setInvalidWorkflows(batch.getInvalidWorkflows());
            record.setWorkerLimit(batch.getWorkerLimit());
            record.setPriority(batch.getPriority());
            record.setOutputPath(batch.getOutputPath());
            record.setExecutionIds(new ArrayList<>(batch.getExecutionIds()));
            record.setCreatedAt(batch.getCreatedAt());
            copyProgress(batch, record);
            batchRepository.save(record);
        } catch (RuntimeException e) {
            log.error("Failed to save batch {}: {}", batch.getBatchId(), e.getMessage(), e);
        }
    }

    public void updateBatchProgress(BatchMetadata batch) {
        try {
            Optional<BatchRecord> existing = batchRepository.findById(batch.getBatchId());
            if (existing.isEmpty()) {
                saveBatch(batch);
                return;
            }
            BatchRecord record = existing.get();
            copyProgress(batch, record);
            batchRepository.save(record);
        } catch (RuntimeException e) {
            log.error("Failed to update progress of batch {}: {}", batch.getBatchId(), e.getMessage(), e);
        }
    }

    public void saveExecution(ExecutionMetadata execution) {
        try {
            ExecutionRecord record = executionRepository.findById(execution.getExecutionId()).orElseGet(ExecutionRecord::new);
            record.setId(execution.getExecutionId());
            record.setBatchId(execution.getBatchId());
            record.setWorkflowName(execution.getWorkflowName());
            record.setSourcePath(execution.getSourcePath());
            record.setStatus(execution.getStatus());
            record.setWorkerId(execution.getWorkerId());
            record.setStartedAt(execution.getStartTime());
            record.setCompletedAt(execution.getEndTime());
            record.setErrorMessage(truncate(execution.getError(), 4000));
            executionRepository.save(record);
        } catch (RuntimeException e) {
            log.error("Failed to save execution {}: {}", execution.getExecutionId(), e.getMessage(), e);
        }
    }

    public Optional<BatchRecord> getBatch(String batchId) {
        try {
            return batchRepository.findById(batchId);
        } catch (RuntimeException e) {
            log.error("Failed to load batch {}: {}", batchId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<ExecutionRecord> getExecution(String executionId) {
        try {
            return executionRepository.findById(executionId);
        } catch (RuntimeException e) {
            log.error("Failed to load execution {}: {}", executionId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public List<ExecutionRecord> getBatchExecutions(String batchId) {
        try {
            return executionRepository.findByBatchIdOrderByCreatedAtAsc(batchId);
        } catch (RuntimeException e) {
            log.error("Failed to load executions of batch {}: {}", batchId, e.getMessage(), e);
            return List.of();
        }
    }

    /** All batches newest first, optionally filtered by status. */
    public List<BatchRecord> getBatches(BatchStatus status) {
        try {
            return status == null
                    ? batchRepository.findAllByOrderByCreatedAtDesc()
                    : batchRepository.findByStatusOrderByCreatedAtDesc(status);
        } catch (RuntimeException e) {
            log.error("Failed to list batches: {}", e.getMessage(), e);
            return List.of();
        }
    }

    @Transactional
    public void markBatchStopped(String batchId) {
        try {
            batchRepository.findById(batchId).ifPresent(record -> {
                record.setStatus(BatchStatus.STOPPED);
                record.setRunningWorkflows(0);
                record.setQueuedWorkflows(0);
                if (record.getCompletedAt() == null) record.setCompletedAt(Instant.now());
                batchRepository.save(record);
            });
            List<ExecutionRecord> unfinished = executionRepository.findByBatchIdAndStatusIn(batchId, UNFINISHED);
            unfinished.forEach(execution -> {
                execution.setStatus(ExecutionStatus.STOPPED);
                if (execution.getCompletedAt() == null) execution.setCompletedAt(Instant.now());
            });
            executionRepository.saveAll(unfinished);
        } catch (RuntimeException e) {
            log.error("Failed to mark batch {} stopped: {}", batchId, e.getMessage(), e);
        }
    }

    /** Batches still marked running belong to a previous process and can never finish. */
    public int markInterruptedBatches() {
        List<BatchRecord> stale = getBatches(BatchStatus.RUNNING);
        stale.forEach(record -> markBatchStopped(record.getId()));
        return stale.size();
    }

    @Transactional
    public void deleteBatch(String batchId) {
        try {
            long executions = executionRepository.deleteByBatchId(batchId);
            batchRepository.deleteById(batchId);
            log.info("Deleted batch {} and {} execution record(s)", batchId, executions);
        } catch (RuntimeException e) {
            log.error("Failed to delete batch {}: {}", batchId, e.getMessage(), e);
        }
    }

    @Transactional
    public int cleanupOldBatches(int retentionDays) {
        if (retentionDays <= 0) return 0;
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        try {
            List<BatchRecord> old = batchRepository.findByCompletedAtBefore(cutoff);
            old.forEach(record -> executionRepository.deleteByBatchId(record.getId()));
            batchRepository.deleteAll(old);
            return old.size();
        } catch (RuntimeException e) {
            log.error("Failed to clean up batches older than {} days: {}", retentionDays, e.getMessage(), e);
            return 0;
        }
    }

    private static void copyProgress(BatchMetadata batch, BatchRecord record) {
        record.setStatus(batch.getStatus());
        record.setCompletedWorkflows(batch.getCompletedWorkflows());
        record.setFailedWorkflows(batch.getFailedWorkflows());
        record.setStoppedWorkflows(batch.getStoppedWorkflows());
        record.setRunningWorkflows(batch.getRunningWorkflows());
        record.setQueuedWorkflows(batch.getQueuedWorkflows());
        record.setStartedAt(batch.getStartTime());
        record.setCompletedAt(batch.getEndTime());
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) return value;
        return value.substring(0, max);
    }
}
