package com.browseflow.browseflow_backend.service;

import com.browseflow.browseflow_backend.engine.ExecutionEventPublisher;
import com.browseflow.browseflow_backend.engine.RunSettings;
import com.browseflow.browseflow_backend.engine.WorkflowExecutor;
import com.browseflow.browseflow_backend.engine.WorkflowExecutorFactory;
import com.browseflow.browseflow_backend.model.context.BatchStatus;
import com.browseflow.browseflow_backend.model.context.ExecutionStatus;
import com.browseflow.browseflow_backend.model.context.ExecutorState;
import com.browseflow.browseflow_backend.model.domain.BatchRecord;
import com.browseflow.browseflow_backend.model.domain.BatchSourceType;
import com.browseflow.browseflow_backend.model.dto.BatchRunRequest;
import com.browseflow.browseflow_backend.model.dto.BatchStatusView;
import com.browseflow.browseflow_backend.model.dto.ExecutionStatusView;
import com.browseflow.browseflow_backend.model.dto.SingleRunRequest;
import com.browseflow.browseflow_backend.model.dto.StopAllResult;
import com.browseflow.browseflow_backend.model.dto.StopBatchResult;
import com.browseflow.browseflow_backend.model.dto.StopExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns every live execution and batch. Single runs start immediately on their own thread;
 * batch members go through a priority queue and are dispatched while both the global
 * worker ceiling and their batch's ceiling allow it.
 *
 * <p>All scheduler state (registries, queue, worker slots, batch counters) is guarded by
 * this object's monitor. Executors run outside it.
 */
@Slf4j
public class ExecutionManager {

    private final int maxWorkers;
    private final long cleanupDelayMs;
    private final String defaultOutputPath;
    private final WorkflowExecutorFactory executorFactory;
    private final BatchPersistenceService persistence;
    private final ExecutionEventPublisher eventPublisher;
    private final Executor executionThreads;
    private final ScheduledExecutorService cleanupScheduler;

    private final Map<String, ExecutionMetadata> executions = new LinkedHashMap<>();
    private final Map<String, BatchMetadata> batches = new LinkedHashMap<>();
    private final ExecutionQueue queue = new ExecutionQueue();
    private final WorkerSlots slots;

    private long lastWorkerId;
    private String mostRecentExecutionId;

    public ExecutionManager(int maxWorkers,
                            long cleanupDelayMs,
                            String defaultOutputPath,
                            WorkflowExecutorFactory executorFactory,
                            BatchPersistenceService persistence,
                            ExecutionEventPublisher eventPublisher,
                            Executor executionThreads,
                            ScheduledExecutorService cleanupScheduler) {
        this.maxWorkers = maxWorkers;
        this.cleanupDelayMs = cleanupDelayMs;
        this.defaultOutputPath = defaultOutputPath;
        this.executorFactory = executorFactory;
        this.persistence = persistence;
        this.eventPublisher = eventPublisher;
        this.executionThreads = executionThreads;
        this.cleanupScheduler = cleanupScheduler;
        this.slots = new WorkerSlots(maxWorkers);
    }

    /** Starts a non-parallel run right away. Failures surface later as an error status. */
    public String startSingle(SingleRunRequest request) {
        if (request == null || request.workflow() == null) {
            throw new IllegalArgumentException("Workflow is required");
        }
        String executionId = UUID.randomUUID().toString();
        WorkflowExecutor executor = executorFactory.create(executionId, null, request.workflow(),
                RunSettings.single(request.breakpointsOrDisabled(), request.slowMoOrZero()));

        ExecutionMetadata meta = ExecutionMetadata.builder()
                .executionId(executionId)
                .workflow(request.workflow())
                .workflowName(request.workflowName())
                .executor(executor)
                .status(ExecutionStatus.RUNNING)
                .startTime(Instant.now())
                .build();

        synchronized (this) {
            executions.put(executionId, meta);
            mostRecentExecutionId = executionId;
            launch(meta);
            sideEffect("Saving execution " + executionId, () -> persistence.saveExecution(meta));
        }
        log.info("Single execution {} started", executionId);
        return executionId;
    }

    public String startBatch(List<WorkflowEntry> entries, BatchRunRequest options,
                             BatchSourceType sourceType, String sourcePath) {
        if (entries == null) {
            throw new IllegalArgumentException("Batch entries are required");
        }
        int workerLimit = options != null && options.workers() != null ? options.workers() : maxWorkers;
        if (workerLimit < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workerLimit);
        }
        int priority = options != null && options.priority() != null ? options.priority() : 0;
        long slowMo = options != null && options.slowMo() != null && options.slowMo() > 0 ? options.slowMo() : 0L;
        String outputPath = options != null && options.outputPath() != null && !options.outputPath().isBlank()
                ? options.outputPath() : defaultOutputPath;

        String batchId = UUID.randomUUID().toString();
        List<WorkflowEntry> valid = entries.stream().filter(WorkflowEntry::isValid).toList();
        entries.stream()
                .filter(e -> !e.isValid())
                .forEach(e -> log.warn("Batch {}: skipping invalid workflow {}: {}", batchId, e.name(), e.error()));

        BatchMetadata batch = BatchMetadata.builder()
                .batchId(batchId)
                .sourceType(sourceType)
                .sourcePath(sourcePath)
                .totalWorkflows(entries.size())
                .validWorkflows(valid.size())
                .invalidWorkflows(entries.size() - valid.size())
                .workerLimit(workerLimit)
                .priority(priority)
                .outputPath(outputPath)
                .createdAt(Instant.now())
                .build();

        List<ExecutionMetadata> members = new ArrayList<>();
        for (WorkflowEntry entry : valid) {
            String executionId = UUID.randomUUID().toString();
            members.add(ExecutionMetadata.builder()
                    .executionId(executionId)
                    .batchId(batchId)
                    .workflow(entry.workflow())
                    .workflowName(entry.name())
                    .sourcePath(entry.sourcePath())
                    .executor(executorFactory.create(executionId, batchId, entry.workflow(),
                            RunSettings.batchMember(slowMo)))
                    .status(ExecutionStatus.QUEUED)
                    .build());
            batch.getExecutionIds().add(executionId);
        }

        synchronized (this) {
            batches.put(batchId, batch);
            for (ExecutionMetadata member : members) {
                executions.put(member.getExecutionId(), member);
                queue.enqueue(member.getExecutionId(), batchId, priority);
            }
            refreshCounts(batch);
            log.info("Batch {} started: {} valid, {} invalid, workers={}, priority={}",
                    batchId, batch.getValidWorkflows(), batch.getInvalidWorkflows(), workerLimit, priority);
            sideEffect("Saving batch " + batchId, () -> {
                persistence.saveBatch(batch);
                members.forEach(persistence::saveExecution);
            });
            sideEffect("Publishing start of batch " + batchId, () -> eventPublisher.batchStarted(batch.toView()));

            checkBatchCompletion(batch);
            processQueue();
        }
        return batchId;
    }

    synchronized void processQueue() {
        while (slots.hasGlobalCapacity()) {
            Optional<QueueItem> next = queue.takeFirst(this::canDispatch);
            if (next.isEmpty()) return;
            dispatch(next.get());
        }
    }

    // Cancelled or unknown items are accepted so the scan drops them
    private boolean canDispatch(QueueItem item) {
        ExecutionMetadata meta = executions.get(item.executionId());
        if (meta == null || meta.isCancelled()) return true;
        BatchMetadata batch = batches.get(item.batchId());
        int limit = batch != null ? batch.getWorkerLimit() : maxWorkers;
        return slots.hasBatchCapacity(item.batchId(), limit);
    }

    private void dispatch(QueueItem item) {
        ExecutionMetadata meta = executions.get(item.executionId());
        if (meta == null || meta.isCancelled()) {
            log.debug("Dropping cancelled queue item {}", item.executionId());
            return;
        }
        meta.setWorkerId(++lastWorkerId);
        meta.setStatus(ExecutionStatus.RUNNING);
        meta.setStartTime(Instant.now());
        slots.acquire(meta.getExecutionId(), item.batchId());
        mostRecentExecutionId = meta.getExecutionId();

        BatchMetadata batch = batches.get(item.batchId());
        if (batch != null) {
            if (batch.getStartTime() == null) batch.setStartTime(meta.getStartTime());
            refreshCounts(batch);
        }
        log.info("Dispatched execution {} of batch {} on worker {} (waited {} ms)",
                meta.getExecutionId(), item.batchId(), meta.getWorkerId(),
                meta.getStartTime().toEpochMilli() - item.enqueuedAt().toEpochMilli());
        launch(meta);

        sideEffect("Saving execution " + meta.getExecutionId(), () -> persistence.saveExecution(meta));
        if (batch != null) reportProgress(batch);
    }

    private void launch(ExecutionMetadata meta) {
        try {
            executionThreads.execute(() -> runExecution(meta));
        } catch (RejectedExecutionException e) {
            log.error("Execution {} could not be started: {}", meta.getExecutionId(), e.getMessage());
            finish(meta, ExecutionStatus.ERROR, "Execution could not be started: " + e.getMessage());
        }
    }

    private void runExecution(ExecutionMetadata meta) {
        try {
            meta.getExecutor().execute();
        } catch (Exception e) {
            // The executor has already logged the failure and recorded it as its last error
            log.debug("Execution {} ended with {}", meta.getExecutionId(), e.getClass().getSimpleName());
        } finally {
            onExecutionFinished(meta);
        }
    }

    private synchronized void onExecutionFinished(ExecutionMetadata meta) {
        WorkflowExecutor executor = meta.getExecutor();
        ExecutionStatus status = switch (executor.getState()) {
            case COMPLETED -> ExecutionStatus.COMPLETED;
            case STOPPED -> ExecutionStatus.STOPPED;
            default -> ExecutionStatus.ERROR;
        };
        String error = status == ExecutionStatus.ERROR
                ? Optional.ofNullable(executor.getLastError()).orElse("Execution ended in state " + executor.getState())
                : null;
        // No-op for members that stop() already finished
        finish(meta, status, error);
        processQueue();
    }

    /**
     * Moves an execution to a terminal status exactly once: releases its worker slot,
     * updates its batch counters, persists it and schedules its eviction.
     * Returns false when the execution was already terminal.
     */
    private boolean finish(ExecutionMetadata meta, ExecutionStatus status, String error) {
        if (meta.getStatus() != null && meta.getStatus().isTerminal()) return false;
        meta.setStatus(status);
        meta.setEndTime(Instant.now());
        meta.setError(error);
        slots.release(meta.getExecutionId());
        BatchMetadata batch = meta.getBatchId() != null ? batches.get(meta.getBatchId()) : null;
        if (batch != null) {
            switch (status) {
                case COMPLETED -> batch.setCompletedWorkflows(batch.getCompletedWorkflows() + 1);
                case ERROR -> batch.setFailedWorkflows(batch.getFailedWorkflows() + 1);
                case STOPPED -> batch.setStoppedWorkflows(batch.getStoppedWorkflows() + 1);
                default -> throw new IllegalStateException("Not a terminal status: " + status);
            }
        }
        log.info("Execution {} finished with status {}", meta.getExecutionId(), status);

        sideEffect("Saving execution " + meta.getExecutionId(), () -> persistence.saveExecution(meta));
        scheduleEviction(() -> evictExecution(meta.getExecutionId()));
        if (batch != null) checkBatchCompletion(batch);
        return true;
    }

    private void refreshCounts(BatchMetadata batch) {
        batch.setRunningWorkflows(slots.activeFor(batch.getBatchId()));
        batch.setQueuedWorkflows(queue.countForBatch(batch.getBatchId()));
    }

    /** Terminal once every valid member has finished. A stopped batch keeps its status. */
    private void checkBatchCompletion(BatchMetadata batch) {
        refreshCounts(batch);
        if (batch.getEndTime() != null) return;
        if (batch.finishedWorkflows() < batch.getValidWorkflows()) {
            reportProgress(batch);
            return;
        }
        if (batch.getStatus() == BatchStatus.RUNNING) {
            if (batch.getFailedWorkflows() > 0) batch.setStatus(BatchStatus.ERROR);
            else if (batch.getStoppedWorkflows() > 0) batch.setStatus(BatchStatus.STOPPED);
            else batch.setStatus(BatchStatus.COMPLETED);
        }
        batch.setEndTime(Instant.now());
        log.info("Batch {} finished with status {}: completed={}, failed={}, stopped={}",
                batch.getBatchId(), batch.getStatus(), batch.getCompletedWorkflows(),
                batch.getFailedWorkflows(), batch.getStoppedWorkflows());
        sideEffect("Saving batch " + batch.getBatchId(), () -> persistence.updateBatchProgress(batch));
        sideEffect("Publishing completion of batch " + batch.getBatchId(),
                () -> eventPublisher.batchCompleted(batch.toView()));
        scheduleEviction(() -> evictBatch(batch.getBatchId()));
    }

    private void reportProgress(BatchMetadata batch) {
        sideEffect("Saving progress of batch " + batch.getBatchId(), () -> persistence.updateBatchProgress(batch));
        sideEffect("Publishing progress of batch " + batch.getBatchId(),
                () -> eventPublisher.batchProgress(batch.toView()));
    }

    // Called only after the scheduler state it reports on is complete; a failure is logged and never unwinds it
    private static void sideEffect(String description, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("{} failed: {}", description, e.getMessage(), e);
        }
    }

    public StopExecutionResult stop(String executionId) {
        synchronized (this) {
            ExecutionMetadata meta = executions.get(executionId);
            if (meta != null) {
                StopOutcome outcome = stopMember(meta);
                processQueue();
                return new StopExecutionResult(executionId,
                        outcome == StopOutcome.RUNNING, outcome == StopOutcome.QUEUED);
            }
        }
        if (persistence.getExecution(executionId).isPresent()) {
            return new StopExecutionResult(executionId, false, false);
        }
        throw new ExecutionNotFoundException(executionId);
    }

    private enum StopOutcome { RUNNING, QUEUED, ALREADY_FINISHED }

    private StopOutcome stopMember(ExecutionMetadata meta) {
        ExecutionStatus status = meta.getStatus();
        if (status == ExecutionStatus.QUEUED) {
            meta.setCancelled(true);
            queue.remove(meta.getExecutionId());
            meta.getExecutor().stop();
            finish(meta, ExecutionStatus.STOPPED, null);
            sideEffect("Publishing stop of " + meta.getExecutionId(),
                    () -> eventPublisher.executionStopped(meta.getExecutionId()));
            return StopOutcome.QUEUED;
        }
        if (status == ExecutionStatus.RUNNING) {
            meta.getExecutor().stop();
            finish(meta, ExecutionStatus.STOPPED, null);
            return StopOutcome.RUNNING;
        }
        return StopOutcome.ALREADY_FINISHED;
    }

    public StopBatchResult stopBatch(String batchId) {
        synchronized (this) {
            BatchMetadata batch = batches.get(batchId);
            if (batch != null) {
                StopBatchResult result = stopLiveBatch(batch);
                processQueue();
                return result;
            }
        }
        Optional<BatchRecord> stored = persistence.getBatch(batchId);
        if (stored.isEmpty()) {
            throw new BatchNotFoundException(batchId);
        }
        if (stored.get().getStatus() == BatchStatus.RUNNING) {
            persistence.markBatchStopped(batchId);
        }
        return new StopBatchResult(batchId, 0, 0, 0);
    }

    private StopBatchResult stopLiveBatch(BatchMetadata batch) {
        int running = 0;
        int queued = 0;
        if (batch.getEndTime() == null) {
            batch.setStatus(BatchStatus.STOPPED);
        }
        for (String executionId : batch.getExecutionIds()) {
            ExecutionMetadata meta = executions.get(executionId);
            if (meta == null) continue;
            switch (stopMember(meta)) {
                case RUNNING -> running++;
                case QUEUED -> queued++;
                default -> { }
            }
        }
        checkBatchCompletion(batch);
        log.info("Batch {} stopped: {} running stopped, {} queued cancelled", batch.getBatchId(), running, queued);
        return new StopBatchResult(batch.getBatchId(), running + queued, running, queued);
    }

    public synchronized StopAllResult stopAll() {
        List<StopBatchResult> results = new ArrayList<>();
        for (BatchMetadata batch : new ArrayList<>(batches.values())) {
            if (batch.getEndTime() == null) {
                results.add(stopLiveBatch(batch));
            }
        }
        processQueue();
        int running = results.stream().mapToInt(StopBatchResult::runningStopped).sum();
        int queued = results.stream().mapToInt(StopBatchResult::queuedCancelled).sum();
        return new StopAllResult(results.size(), running + queued, running, queued, results);
    }

    public boolean continueExecution(String executionId) {
        return requireExecutor(executionId).continueExecution();
    }

    public boolean skipNode(String executionId) {
        return requireExecutor(executionId).skipNode();
    }

    public boolean continueWithoutBreakpoint(String executionId) {
        return requireExecutor(executionId).continueWithoutBreakpoint();
    }

    public synchronized Optional<WorkflowExecutor> getExecutor(String executionId) {
        return Optional.ofNullable(executions.get(executionId)).map(ExecutionMetadata::getExecutor);
    }

    private WorkflowExecutor requireExecutor(String executionId) {
        return getExecutor(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    public ExecutionStatusView getExecutionStatus(String executionId) {
        synchronized (this) {
            ExecutionMetadata meta = executions.get(executionId);
            if (meta != null) return toView(meta);
        }
        return persistence.getExecution(executionId)
                .map(ExecutionStatusView::fromRecord)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    public BatchStatusView getBatchStatus(String batchId) {
        synchronized (this) {
            BatchMetadata batch = batches.get(batchId);
            if (batch != null) return batch.toView();
        }
        return persistence.getBatch(batchId)
                .map(BatchStatusView::fromRecord)
                .orElseThrow(() -> new BatchNotFoundException(batchId));
    }

    public synchronized List<ExecutionStatusView> getActiveExecutions() {
        return executions.values().stream()
                .filter(meta -> !meta.getStatus().isTerminal())
                .map(ExecutionManager::toView)
                .toList();
    }

    public synchronized List<BatchStatusView> getActiveBatches() {
        return batches.values().stream()
                .filter(batch -> batch.getEndTime() == null)
                .map(BatchMetadata::toView)
                .toList();
    }

    public synchronized Optional<String> getMostRecentExecutionId() {
        return Optional.ofNullable(mostRecentExecutionId);
    }

    /** Live batches first, then stored ones not held in memory, newest first within each group. */
    public List<BatchStatusView> listBatches(BatchStatus status) {
        List<BatchStatusView> live;
        synchronized (this) {
            live = batches.values().stream()
                    .filter(batch -> status == null || batch.getStatus() == status)
                    .map(BatchMetadata::toView)
                    .sorted(Comparator.comparing(BatchStatusView::createdAt).reversed())
                    .toList();
        }
        List<BatchStatusView> result = new ArrayList<>(live);
        persistence.getBatches(status).stream()
                .filter(record -> live.stream().noneMatch(view -> view.batchId().equals(record.getId())))
                .map(BatchStatusView::fromRecord)
                .forEach(result::add);
        return result;
    }

    public List<ExecutionStatusView> getBatchExecutions(String batchId) {
        List<String> memberIds;
        Map<String, ExecutionStatusView> liveViews = new LinkedHashMap<>();
        synchronized (this) {
            BatchMetadata batch = batches.get(batchId);
            memberIds = batch != null ? List.copyOf(batch.getExecutionIds()) : null;
            if (memberIds != null) {
                memberIds.stream()
                        .map(executions::get)
                        .filter(meta -> meta != null)
                        .forEach(meta -> liveViews.put(meta.getExecutionId(), toView(meta)));
            }
        }
        if (memberIds == null && persistence.getBatch(batchId).isEmpty()) {
            throw new BatchNotFoundException(batchId);
        }
        Map<String, ExecutionStatusView> result = new LinkedHashMap<>(liveViews);
        persistence.getBatchExecutions(batchId)
                .forEach(record -> result.putIfAbsent(record.getId(), ExecutionStatusView.fromRecord(record)));
        return new ArrayList<>(result.values());
    }

    private static ExecutionStatusView toView(ExecutionMetadata meta) {
        WorkflowExecutor executor = meta.getExecutor();
        ExecutorState state = executor != null ? executor.getState() : null;
        return new ExecutionStatusView(
                meta.getExecutionId(),
                meta.getBatchId(),
                meta.getWorkflowName(),
                meta.getStatus(),
                state,
                meta.getWorkerId(),
                meta.getStartTime(),
                meta.getEndTime(),
                meta.getError(),
                executor != null ? executor.getCurrentNodeId() : null,
                executor != null ? executor.getPausedNodeId() : null,
                executor != null && executor.getPauseReason() != null ? executor.getPauseReason().label() : null,
                true
        );
    }

    /** Removes a finished batch and its execution records. Running batches must be stopped first. */
    public void deleteBatch(String batchId) {
        synchronized (this) {
            BatchMetadata batch = batches.get(batchId);
            if (batch != null) {
                if (batch.getEndTime() == null) {
                    throw new IllegalStateException("Batch " + batchId + " is still running; stop it first");
                }
                batches.remove(batchId);
                batch.getExecutionIds().forEach(executions::remove);
            } else if (persistence.getBatch(batchId).isEmpty()) {
                throw new BatchNotFoundException(batchId);
            }
        }
        persistence.deleteBatch(batchId);
    }

    private void scheduleEviction(Runnable eviction) {
        try {
            cleanupScheduler.schedule(eviction, cleanupDelayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Cleanup scheduler is shut down, evicting immediately");
            eviction.run();
        }
    }

    private synchronized void evictExecution(String executionId) {
        ExecutionMetadata meta = executions.get(executionId);
        if (meta != null && meta.getStatus().isTerminal()) {
            executions.remove(executionId);
            log.debug("Evicted execution {}", executionId);
        }
    }

    private synchronized void evictBatch(String batchId) {
        BatchMetadata batch = batches.get(batchId);
        if (batch != null && batch.getEndTime() != null) {
            batches.remove(batchId);
            log.debug("Evicted batch {}", batchId);
        }
    }

    /** Stops everything still running. Called when the application context closes. */
    public void shutdown() {
        List<ExecutionMetadata> singles;
        synchronized (this) {
            StopAllResult result = stopAll();
            if (result.totalStopped() > 0) {
                log.info("Shutdown stopped {} batch execution(s)", result.totalStopped());
            }
            singles = executions.values().stream()
                    .filter(meta -> meta.getBatchId() == null && !meta.getStatus().isTerminal())
                    .toList();
        }
        singles.forEach(meta -> stop(meta.getExecutionId()));
        cleanupScheduler.shutdownNow();
    }

    synchronized int activeWorkerCount() {
        return slots.activeCount();
    }

    synchronized int queuedCount() {
        return queue.size();
    }
}
