package com.browseflow.browseflow_backend.engine;

import com.browseflow.browseflow_backend.browser.BrowserSession;
import com.browseflow.browseflow_backend.executor.NodeHandler;
import com.browseflow.browseflow_backend.executor.NodeHandlerRegistry;
import com.browseflow.browseflow_backend.executor.ReferenceResolver;
import com.browseflow.browseflow_backend.model.context.BreakpointConfig;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.context.ExecutionControl;
import com.browseflow.browseflow_backend.model.context.ExecutorState;
import com.browseflow.browseflow_backend.model.context.PauseReason;
import com.browseflow.browseflow_backend.model.domain.FlowEdge;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one workflow graph on the calling thread.
 *
 * <p>States move IDLE -> RUNNING (<-> PAUSED) -> COMPLETED | ERROR | STOPPED. Control calls
 * ({@link #stop()}, {@link #continueExecution()}, {@link #skipNode()},
 * {@link #continueWithoutBreakpoint()}) are safe from any thread. A pause blocks the execution
 * thread in place, so the run resumes at the same node with its context untouched.
 *
 * <p>Stopping is cooperative: the flag is checked between nodes, a paused run is released and
 * the execution thread is interrupted to cut short sleeps and waits. A browser call already in
 * flight is not aborted and finishes (or times out) first.
 */
@Slf4j
public class WorkflowExecutor implements ExecutionControl {

    private static final int MAX_REUSABLE_DEPTH = 20;

    private final String executionId;
    private final Workflow workflow;
    private final ExecutionContext context;
    private final RunSettings settings;
    private final NodeHandlerRegistry handlerRegistry;
    private final WorkflowParser parser;
    private final ReusableScopeExtractor scopeExtractor;
    private final ReferenceResolver referenceResolver;
    private final ExecutionEventPublisher eventPublisher;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();

    private volatile ExecutorState state = ExecutorState.IDLE;
    private volatile String currentNodeId;
    private volatile String lastError;
    private volatile boolean stopRequested;
    private volatile boolean breakpointsDisabled;

    // Guarded by lock
    private boolean paused;
    private String pausedNodeId;
    private PauseReason pauseReason;
    private boolean skipRequested;
    private Thread runner;

    private int reusableDepth;

    public WorkflowExecutor(String executionId,
                            Workflow workflow,
                            ExecutionContext context,
                            RunSettings settings,
                            NodeHandlerRegistry handlerRegistry,
                            WorkflowParser parser,
                            ReusableScopeExtractor scopeExtractor,
                            ReferenceResolver referenceResolver,
                            ExecutionEventPublisher eventPublisher) {
        this.executionId = executionId;
        this.workflow = workflow;
        this.context = context;
        this.settings = settings;
        this.handlerRegistry = handlerRegistry;
        this.parser = parser;
        this.scopeExtractor = scopeExtractor;
        this.referenceResolver = referenceResolver;
        this.eventPublisher = eventPublisher;
        this.context.setControl(this);
    }

    /**
     * Drives the workflow to a terminal state. Returns normally when the run completes or is
     * stopped; rethrows the failure that moved it to ERROR.
     */
    public void execute() throws Exception {
        lock.lock();
        try {
            if (state != ExecutorState.IDLE) {
                throw new IllegalStateException("Execution " + executionId + " has already been started");
            }
            if (stopRequested) {
                state = ExecutorState.STOPPED;
                log.info("Execution {} stopped before it started", executionId);
                return;
            }
            runner = Thread.currentThread();
            state = ExecutorState.RUNNING;
        } finally {
            lock.unlock();
        }

        eventPublisher.executionStarted(executionId, context.getBatchId());
        log.info("Execution {} started ({} nodes)", executionId, workflow.getNodes().size());
        try {
            runNodes(workflow, parser.executionOrder(workflow));
            checkStopped();
            state = ExecutorState.COMPLETED;
            eventPublisher.executionCompleted(executionId);
            log.info("Execution {} completed", executionId);
        } catch (ExecutionStoppedException e) {
            markStopped();
        } catch (Exception e) {
            if (stopRequested) {
                markStopped();
                return;
            }
            lastError = describe(e);
            state = ExecutorState.ERROR;
            log.error("Execution {} failed at node {}: {}", executionId, currentNodeId, lastError, e);
            eventPublisher.executionFailed(executionId, lastError);
            throw e;
        } finally {
            closeBrowser();
            lock.lock();
            try {
                runner = null;
                paused = false;
            } finally {
                lock.unlock();
            }
            // Clear a stop interrupt before the thread goes back to its pool
            if (stopRequested) Thread.interrupted();
        }
    }

    @Override
    public void runSubWorkflow(Workflow subWorkflow) throws Exception {
        if (reusableDepth >= MAX_REUSABLE_DEPTH) {
            throw new WorkflowValidationException("Reusable flows nested deeper than " + MAX_REUSABLE_DEPTH + " levels");
        }
        String callerNodeId = currentNodeId;
        reusableDepth++;
        try {
            runNodes(subWorkflow, parser.subWorkflowOrder(subWorkflow));
        } finally {
            reusableDepth--;
            currentNodeId = callerNodeId;
        }
    }

    private void runNodes(Workflow graph, List<FlowNode> order) throws Exception {
        // Scope members only run through a runReusable node
        Set<String> scoped = scopeExtractor.nodesInAnyScope(graph);

        for (FlowNode node : order) {
            checkStopped();
            if (NodeTypes.isReusableMarker(node.getType()) || scoped.contains(node.getId())) {
                continue;
            }
            if (node.isBypassed()) {
                log.info("Execution {}: node {} ({}) bypassed", executionId, node.getId(), node.getType());
                eventPublisher.nodeSkipped(executionId, node.getId(), node.getType());
                continue;
            }

            currentNodeId = node.getId();
            if (breakpointHit(node, BreakpointConfig.At.PRE)) {
                eventPublisher.breakpointTriggered(executionId, node.getId(), "pre");
                if (pauseAt(node.getId(), PauseReason.BREAKPOINT)) {
                    log.info("Execution {}: node {} skipped at breakpoint", executionId, node.getId());
                    eventPublisher.nodeSkipped(executionId, node.getId(), node.getType());
                    continue;
                }
            }

            runNode(graph, node);

            if (breakpointHit(node, BreakpointConfig.At.POST)) {
                eventPublisher.breakpointTriggered(executionId, node.getId(), "post");
                pauseAt(node.getId(), PauseReason.BREAKPOINT);
            }
            applySlowMo();
        }
    }

    private void runNode(Workflow graph, FlowNode node) throws Exception {
        String type = node.getType();
        eventPublisher.nodeStarted(executionId, node.getId(), type);
        try {
            NodeHandler handler = handlerRegistry.get(type);
            handler.execute(prepare(graph, node), context);
        } catch (ExecutionStoppedException e) {
            throw e;
        } catch (Exception e) {
            if (stopRequested) {
                throw new ExecutionStoppedException("Execution stopped by user");
            }
            String message = describe(e);
            log.warn("Execution {}: node {} ({}) failed: {}", executionId, node.getId(), type, message);
            eventPublisher.nodeError(executionId, node.getId(), type, message);
            throw e;
        }
        eventPublisher.nodeCompleted(executionId, node.getId(), type);
    }

    // Copies wired property inputs into the node's data, then interpolates templates
    private FlowNode prepare(Workflow graph, FlowNode node) {
        Map<String, Object> data = new HashMap<>(node.getData() != null ? node.getData() : Map.of());
        for (FlowEdge edge : graph.propertyInputsTo(node.getId())) {
            Object value = context.getVariable(edge.getSource());
            if (value != null) {
                data.put(edge.getTargetHandle(), value);
            } else {
                log.debug("Property input {} of node {} has no value from {}",
                        edge.getTargetHandle(), node.getId(), edge.getSource());
            }
        }
        return node.toBuilder().data(referenceResolver.resolveMap(data, context)).build();
    }

    private boolean breakpointHit(FlowNode node, BreakpointConfig.At timing) {
        if (breakpointsDisabled || settings.parallel()) return false;
        BreakpointConfig breakpoints = settings.breakpoints();
        return breakpoints != null && breakpoints.shouldTrigger(node, timing);
    }

    @Override
    public void requestPause(String nodeId, PauseReason reason) {
        pauseAt(nodeId, reason);
    }

    /** Blocks until released. Returns true when released with a request to skip the node. */
    private boolean pauseAt(String nodeId, PauseReason reason) {
        lock.lock();
        try {
            checkStopped();
            paused = true;
            pausedNodeId = nodeId;
            pauseReason = reason;
            skipRequested = false;
            state = ExecutorState.PAUSED;
            log.info("Execution {} paused at node {} ({})", executionId, nodeId, reason.label());
            eventPublisher.executionPaused(executionId, nodeId, reason.label());

            while (paused && !stopRequested) {
                released.await();
            }
            checkStopped();
            state = ExecutorState.RUNNING;
            log.info("Execution {} resumed at node {}", executionId, nodeId);
            return skipRequested;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionStoppedException("Execution stopped by user");
        } finally {
            paused = false;
            pausedNodeId = null;
            pauseReason = null;
            lock.unlock();
        }
    }

    public boolean continueExecution() {
        return release(false, false);
    }

    public boolean skipNode() {
        return release(true, false);
    }

    public boolean continueWithoutBreakpoint() {
        return release(false, true);
    }

    private boolean release(boolean skip, boolean disableBreakpoints) {
        lock.lock();
        try {
            if (!paused) return false;
            if (disableBreakpoints) breakpointsDisabled = true;
            skipRequested = skip;
            paused = false;
            released.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Requests cancellation. Safe to call from any thread and more than once. */
    public void stop() {
        lock.lock();
        try {
            if (state.isTerminal() || stopRequested) return;
            stopRequested = true;
            paused = false;
            released.signalAll();
            if (runner != null && runner != Thread.currentThread()) {
                runner.interrupt();
            }
        } finally {
            lock.unlock();
        }
        log.info("Stop requested for execution {}", executionId);
    }

    private void checkStopped() {
        if (stopRequested) {
            throw new ExecutionStoppedException("Execution stopped by user");
        }
    }

    private void markStopped() {
        state = ExecutorState.STOPPED;
        log.info("Execution {} stopped at node {}", executionId, currentNodeId);
        eventPublisher.executionStopped(executionId);
    }

    private void applySlowMo() {
        if (settings.slowMoMs() <= 0) return;
        try {
            Thread.sleep(settings.slowMoMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionStoppedException("Execution stopped by user");
        }
    }

    private void closeBrowser() {
        BrowserSession session = context.getBrowserSession();
        if (session == null || !session.isOpen()) return;
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Execution {}: failed to close browser: {}", executionId, e.getMessage());
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutorState getState() {
        return state;
    }

    public String getCurrentNodeId() {
        return currentNodeId;
    }

    public String getPausedNodeId() {
        lock.lock();
        try {
            return pausedNodeId;
        } finally {
            lock.unlock();
        }
    }

    public PauseReason getPauseReason() {
        lock.lock();
        try {
            return pauseReason;
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        return state == ExecutorState.PAUSED;
    }

    public String getLastError() {
        return lastError;
    }

    @Override
    public Workflow getWorkflow() {
        return workflow;
    }

    @Override
    public boolean isStopRequested() {
        return stopRequested;
    }
}
