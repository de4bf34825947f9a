package com.browseflow.browseflow_backend.service;

import com.browseflow.browseflow_backend.browser.BrowserSession;
import com.browseflow.browseflow_backend.browser.BrowserSessionFactory;
import com.browseflow.browseflow_backend.engine.ExecutionEventPublisher;
import com.browseflow.browseflow_backend.engine.RedisWebSocketBridge;
import com.browseflow.browseflow_backend.engine.ReusableScopeExtractor;
import com.browseflow.browseflow_backend.engine.WorkflowExecutorFactory;
import com.browseflow.browseflow_backend.engine.WorkflowParser;
import com.browseflow.browseflow_backend.executor.NodeHandler;
import com.browseflow.browseflow_backend.executor.NodeHandlerRegistry;
import com.browseflow.browseflow_backend.executor.ReferenceResolver;
import com.browseflow.browseflow_backend.executor.handler.StartHandler;
import com.browseflow.browseflow_backend.model.context.BatchStatus;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.context.ExecutionStatus;
import com.browseflow.browseflow_backend.model.domain.BatchRecord;
import com.browseflow.browseflow_backend.model.domain.BatchSourceType;
import com.browseflow.browseflow_backend.model.domain.ExecutionRecord;
import com.browseflow.browseflow_backend.model.domain.FlowEdge;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import com.browseflow.browseflow_backend.model.dto.BatchRunRequest;
import com.browseflow.browseflow_backend.model.dto.BatchStatusView;
import com.browseflow.browseflow_backend.model.dto.ExecutionStatusView;
import com.browseflow.browseflow_backend.model.dto.SingleRunRequest;
import com.browseflow.browseflow_backend.model.dto.StopAllResult;
import com.browseflow.browseflow_backend.model.dto.StopBatchResult;
import com.browseflow.browseflow_backend.model.dto.StopExecutionResult;
import com.browseflow.browseflow_backend.repository.BatchRecordRepository;
import com.browseflow.browseflow_backend.repository.ExecutionRecordRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionManagerTest {

    private static final long LONG_CLEANUP_MS = 60_000;

    // Gate nodes block until the test hands out a permit
    private final Semaphore gate = new Semaphore(0);
    private final List<String> started = new CopyOnWriteArrayList<>();

    private final BatchPersistenceService persistence = mock(BatchPersistenceService.class);
    private final ExecutionEventPublisher events = mock(ExecutionEventPublisher.class);
    private final ExecutorService threads = Executors.newCachedThreadPool();
    private final ScheduledExecutorService cleanup = Executors.newSingleThreadScheduledExecutor();

    private ExecutionManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) manager.shutdown();
        threads.shutdownNow();
        cleanup.shutdownNow();
    }

    @Test
    void shouldHoldBatchMembersBeyondItsWorkerLimit() {
        manager = manager(4, LONG_CLEANUP_MS);

        String batchId = manager.startBatch(entries(5, "gate"), options(2, 0), BatchSourceType.WORKFLOWS, null);

        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 2);
        BatchStatusView status = manager.getBatchStatus(batchId);
        assertThat(status.runningWorkflows()).isEqualTo(2);
        assertThat(status.queuedWorkflows()).isEqualTo(3);
        assertThat(manager.activeWorkerCount()).isEqualTo(2);

        gate.release(5);
        await().atMost(3, TimeUnit.SECONDS)
                .until(() -> manager.getBatchStatus(batchId).status() == BatchStatus.COMPLETED);
        BatchStatusView done = manager.getBatchStatus(batchId);
        assertThat(done.completedWorkflows()).isEqualTo(5);
        assertThat(done.runningWorkflows()).isZero();
        assertThat(done.queuedWorkflows()).isZero();
        assertThat(done.completedAt()).isNotNull();
        verify(events).batchCompleted(any());
    }

    @Test
    void shouldNotLetASaturatedBatchBlockOthers() {
        manager = manager(4, LONG_CLEANUP_MS);

        String busy = manager.startBatch(entries(3, "gate"), options(1, 5), BatchSourceType.WORKFLOWS, null);
        String other = manager.startBatch(entries(2, "gate"), options(2, 0), BatchSourceType.WORKFLOWS, null);

        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 3);
        assertThat(manager.getBatchStatus(busy).runningWorkflows()).isEqualTo(1);
        assertThat(manager.getBatchStatus(busy).queuedWorkflows()).isEqualTo(2);
        assertThat(manager.getBatchStatus(other).runningWorkflows()).isEqualTo(2);
        gate.release(10);
    }

    @Test
    void shouldDispatchByPriorityThenSubmissionOrder() {
        manager = manager(1, LONG_CLEANUP_MS);
        manager.startBatch(entries(1, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);
        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 1);

        String low = manager.startBatch(entries(2, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);
        String high = manager.startBatch(entries(2, "gate"), options(1, 5), BatchSourceType.WORKFLOWS, null);
        List<String> expected = new ArrayList<>(manager.getBatchStatus(high).executionIds());
        expected.addAll(manager.getBatchStatus(low).executionIds());

        for (int i = 1; i <= 4; i++) {
            gate.release();
            int count = i + 1;
            await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == count);
        }
        gate.release();

        assertThat(started.subList(1, 5)).containsExactlyElementsOf(expected);
    }

    @Test
    void shouldStopRunningAndCancelQueuedMembers() {
        manager = manager(4, LONG_CLEANUP_MS);
        String batchId = manager.startBatch(entries(5, "gate"), options(2, 0), BatchSourceType.FOLDER, "/flows");
        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 2);

        StopBatchResult result = manager.stopBatch(batchId);

        assertThat(result).isEqualTo(new StopBatchResult(batchId, 5, 2, 3));
        BatchStatusView status = manager.getBatchStatus(batchId);
        assertThat(status.status()).isEqualTo(BatchStatus.STOPPED);
        assertThat(status.runningWorkflows()).isZero();
        assertThat(status.queuedWorkflows()).isZero();
        assertThat(status.stoppedWorkflows()).isEqualTo(5);

        await().atMost(2, TimeUnit.SECONDS).until(() -> manager.activeWorkerCount() == 0);
        assertThat(manager.queuedCount()).isZero();
        assertThat(started).hasSize(2);
        assertThat(manager.stopBatch(batchId)).isEqualTo(new StopBatchResult(batchId, 0, 0, 0));
    }

    @Test
    void shouldNeverDispatchAStoppedQueuedExecution() {
        manager = manager(1, LONG_CLEANUP_MS);
        String batchId = manager.startBatch(entries(2, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);
        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 1);
        String queuedId = manager.getBatchStatus(batchId).executionIds().get(1);

        StopExecutionResult result = manager.stop(queuedId);
        gate.release(2);

        assertThat(result.wasQueued()).isTrue();
        assertThat(result.wasRunning()).isFalse();
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> manager.getBatchStatus(batchId).status() != BatchStatus.RUNNING);
        BatchStatusView status = manager.getBatchStatus(batchId);
        assertThat(status.status()).isEqualTo(BatchStatus.STOPPED);
        assertThat(status.completedWorkflows()).isEqualTo(1);
        assertThat(status.stoppedWorkflows()).isEqualTo(1);
        assertThat(started).doesNotContain(queuedId);
    }

    @Test
    void shouldMarkBatchErrorWhenAnyMemberFails() {
        manager = manager(4, LONG_CLEANUP_MS);
        List<WorkflowEntry> entries = new ArrayList<>(entries(1, "gate"));
        entries.addAll(entries(1, "fail"));
        gate.release(1);

        String batchId = manager.startBatch(entries, options(2, 0), BatchSourceType.WORKFLOWS, null);

        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> manager.getBatchStatus(batchId).status() == BatchStatus.ERROR);
        BatchStatusView status = manager.getBatchStatus(batchId);
        assertThat(status.completedWorkflows()).isEqualTo(1);
        assertThat(status.failedWorkflows()).isEqualTo(1);
        ExecutionStatusView failed = manager.getExecutionStatus(status.executionIds().get(1));
        assertThat(failed.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(failed.error()).isEqualTo("selector timed out");
    }

    @Test
    void shouldCompleteBatchWithoutValidWorkflowsImmediately() {
        manager = manager(4, LONG_CLEANUP_MS);
        List<WorkflowEntry> entries = List.of(
                WorkflowEntry.invalid("broken.json", "/flows/broken.json", "Invalid workflow JSON"));

        String batchId = manager.startBatch(entries, null, BatchSourceType.FILES, null);

        BatchStatusView status = manager.getBatchStatus(batchId);
        assertThat(status.status()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(status.totalWorkflows()).isEqualTo(1);
        assertThat(status.invalidWorkflows()).isEqualTo(1);
        assertThat(status.workerLimit()).isEqualTo(4);
        assertThat(status.outputPath()).isEqualTo("./output");
    }

    @Test
    void shouldRunSingleExecutionImmediatelyOutsideWorkerSlots() {
        manager = manager(1, LONG_CLEANUP_MS);
        manager.startBatch(entries(1, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);
        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 1);

        String executionId = manager.startSingle(new SingleRunRequest(workflow("gate"), "manual.json", null, null));

        await().atMost(2, TimeUnit.SECONDS).until(() -> started.contains(executionId));
        assertThat(manager.getExecutionStatus(executionId).status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(manager.activeWorkerCount()).isEqualTo(1);
        assertThat(manager.getMostRecentExecutionId()).contains(executionId);

        gate.release(2);
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> manager.getExecutionStatus(executionId).status() == ExecutionStatus.COMPLETED);
    }

    @Test
    void shouldStopRunningSingleExecution() {
        manager = manager(2, LONG_CLEANUP_MS);
        String executionId = manager.startSingle(new SingleRunRequest(workflow("gate"), null, null, null));
        await().atMost(2, TimeUnit.SECONDS).until(() -> started.contains(executionId));

        StopExecutionResult result = manager.stop(executionId);

        assertThat(result.wasRunning()).isTrue();
        assertThat(manager.getExecutionStatus(executionId).status()).isEqualTo(ExecutionStatus.STOPPED);
        assertThat(manager.stop(executionId)).isEqualTo(new StopExecutionResult(executionId, false, false));
    }

    @Test
    void shouldStopEveryActiveBatch() {
        manager = manager(2, LONG_CLEANUP_MS);
        manager.startBatch(entries(2, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);
        manager.startBatch(entries(2, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);
        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 2);

        StopAllResult result = manager.stopAll();

        assertThat(result.totalBatches()).isEqualTo(2);
        assertThat(result.runningStopped()).isEqualTo(2);
        assertThat(result.queuedCancelled()).isEqualTo(2);
        assertThat(result.totalStopped()).isEqualTo(4);
        assertThat(manager.getActiveBatches()).isEmpty();
    }

    @Test
    void shouldAnswerFromStoreAfterEviction() {
        manager = manager(2, 50);
        when(persistence.getExecution(any())).thenAnswer(invocation -> {
            ExecutionRecord record = new ExecutionRecord();
            record.setId(invocation.getArgument(0));
            record.setStatus(ExecutionStatus.COMPLETED);
            return Optional.of(record);
        });
        gate.release();

        String executionId = manager.startSingle(new SingleRunRequest(workflow("gate"), null, null, null));

        await().atMost(3, TimeUnit.SECONDS).until(() -> !manager.getExecutionStatus(executionId).live());

        assertThat(manager.getExecutionStatus(executionId).status()).isEqualTo(ExecutionStatus.COMPLETED);
        verify(persistence, atLeastOnce()).saveExecution(any());
    }

    @Test
    void shouldReportUnknownIdsAsNotFound() {
        manager = manager(2, LONG_CLEANUP_MS);

        assertThatThrownBy(() -> manager.getExecutionStatus("nope")).isInstanceOf(ExecutionNotFoundException.class);
        assertThatThrownBy(() -> manager.getBatchStatus("nope")).isInstanceOf(BatchNotFoundException.class);
        assertThatThrownBy(() -> manager.stopBatch("nope")).isInstanceOf(BatchNotFoundException.class);
        assertThatThrownBy(() -> manager.continueExecution("nope")).isInstanceOf(ExecutionNotFoundException.class);
    }

    @Test
    void shouldMarkStoredRunningBatchStopped() {
        manager = manager(2, LONG_CLEANUP_MS);
        BatchRecord record = new BatchRecord();
        record.setId("old-batch");
        record.setStatus(BatchStatus.RUNNING);
        when(persistence.getBatch("old-batch")).thenReturn(Optional.of(record));

        StopBatchResult result = manager.stopBatch("old-batch");

        assertThat(result.stoppedExecutions()).isZero();
        verify(persistence).markBatchStopped("old-batch");
    }

    @Test
    void shouldRefuseToDeleteRunningBatch() {
        manager = manager(2, LONG_CLEANUP_MS);
        String batchId = manager.startBatch(entries(1, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);

        assertThatThrownBy(() -> manager.deleteBatch(batchId)).isInstanceOf(IllegalStateException.class);

        manager.stopBatch(batchId);
        manager.deleteBatch(batchId);
        verify(persistence).deleteBatch(batchId);
    }

    @Test
    void shouldRejectMissingWorkflowAndBadWorkerCount() {
        manager = manager(2, LONG_CLEANUP_MS);

        assertThatThrownBy(() -> manager.startSingle(new SingleRunRequest(null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.startBatch(entries(1, "gate"), options(0, 0), BatchSourceType.WORKFLOWS, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepDispatchingWhenStorageIsUnavailable() {
        BatchRecordRepository batchRepository = mock(BatchRecordRepository.class);
        ExecutionRecordRepository executionRepository = mock(ExecutionRecordRepository.class);
        CannotCreateTransactionException down = new CannotCreateTransactionException("db down");
        when(batchRepository.findById(any())).thenThrow(down);
        when(executionRepository.findById(any())).thenThrow(down);
        manager = manager(2, LONG_CLEANUP_MS, new BatchPersistenceService(batchRepository, executionRepository), events);

        String batchId = manager.startBatch(entries(3, "gate"), options(2, 0), BatchSourceType.WORKFLOWS, null);

        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 2);
        assertThat(manager.activeWorkerCount()).isEqualTo(2);
        assertThat(manager.queuedCount()).isEqualTo(1);

        gate.release(3);
        await().atMost(3, TimeUnit.SECONDS)
                .until(() -> manager.getBatchStatus(batchId).status() == BatchStatus.COMPLETED);
        assertThat(manager.getBatchStatus(batchId).completedWorkflows()).isEqualTo(3);
        assertThat(manager.activeWorkerCount()).isZero();
        assertThat(manager.queuedCount()).isZero();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldKeepDispatchingWhenRedisIsUnavailable() {
        RedisWebSocketBridge bridge = mock(RedisWebSocketBridge.class);
        doThrow(new RedisConnectionFailureException("redis down")).when(bridge).publish(any(), any());
        ObjectProvider<RedisWebSocketBridge> bridgeProvider = mock(ObjectProvider.class);
        when(bridgeProvider.getIfAvailable()).thenReturn(bridge);
        ExecutionEventPublisher publisher = new ExecutionEventPublisher(mock(SimpMessagingTemplate.class), bridgeProvider);
        manager = manager(1, LONG_CLEANUP_MS, persistence, publisher);

        String batchId = manager.startBatch(entries(2, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);

        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 1);
        gate.release(2);
        await().atMost(3, TimeUnit.SECONDS)
                .until(() -> manager.getBatchStatus(batchId).status() == BatchStatus.COMPLETED);
        assertThat(started).hasSize(2);
        assertThat(manager.activeWorkerCount()).isZero();
        verify(bridge, atLeastOnce()).publish(any(), any());
    }

    @Test
    void shouldReleaseSlotsWhenAProgressListenerThrows() {
        doThrow(new IllegalStateException("listener failed")).when(events).batchProgress(any());
        doThrow(new IllegalStateException("listener failed")).when(persistence).saveExecution(any());
        manager = manager(1, LONG_CLEANUP_MS);

        String batchId = manager.startBatch(entries(2, "gate"), options(1, 0), BatchSourceType.WORKFLOWS, null);

        await().atMost(2, TimeUnit.SECONDS).until(() -> started.size() == 1);
        assertThat(manager.getBatchStatus(batchId).runningWorkflows()).isEqualTo(1);
        gate.release(2);
        await().atMost(3, TimeUnit.SECONDS)
                .until(() -> manager.getBatchStatus(batchId).status() == BatchStatus.COMPLETED);
        assertThat(manager.getBatchStatus(batchId).completedWorkflows()).isEqualTo(2);
        assertThat(manager.activeWorkerCount()).isZero();
    }

    private ExecutionManager manager(int maxWorkers, long cleanupDelayMs) {
        return manager(maxWorkers, cleanupDelayMs, persistence, events);
    }

    private ExecutionManager manager(int maxWorkers, long cleanupDelayMs,
                                     BatchPersistenceService persistence, ExecutionEventPublisher events) {
        NodeHandlerRegistry registry = new NodeHandlerRegistry(List.of(new StartHandler(), new GateHandler(), new FailHandler()));
        registry.init();
        BrowserSessionFactory sessions = () -> mock(BrowserSession.class);
        WorkflowExecutorFactory factory = new WorkflowExecutorFactory(registry, new WorkflowParser(),
                new ReusableScopeExtractor(), new ReferenceResolver(), events, sessions);
        return new ExecutionManager(maxWorkers, cleanupDelayMs, "./output", factory, persistence, events, threads, cleanup);
    }

    private static BatchRunRequest options(int workers, int priority) {
        return new BatchRunRequest(null, null, null, workers, priority, null, null);
    }

    private static List<WorkflowEntry> entries(int count, String nodeType) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> WorkflowEntry.valid(nodeType + "-" + i + ".json", null, workflow(nodeType)))
                .toList();
    }

    private static Workflow workflow(String nodeType) {
        FlowNode start = FlowNode.builder().id("start").type("start").data(new HashMap<>()).build();
        FlowNode work = FlowNode.builder().id("work").type(nodeType).data(new HashMap<>()).build();
        FlowEdge edge = FlowEdge.builder().id("e1").source("start").target("work").build();
        return Workflow.builder()
                .nodes(new ArrayList<>(List.of(start, work)))
                .edges(new ArrayList<>(List.of(edge)))
                .build();
    }

    private class GateHandler implements NodeHandler {
        @Override
        public String supportedType() {
            return "gate";
        }

        @Override
        public void execute(FlowNode node, ExecutionContext context) throws InterruptedException {
            started.add(context.getExecutionId());
            gate.acquire();
        }
    }

    private static class FailHandler implements NodeHandler {
        @Override
        public String supportedType() {
            return "fail";
        }

        @Override
        public void execute(FlowNode node, ExecutionContext context) {
            throw new IllegalStateException("selector timed out");
        }
    }
}
