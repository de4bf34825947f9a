package com.browseflow.browseflow_backend.engine;

import com.browseflow.browseflow_backend.model.context.ExecutionEventType;
import com.browseflow.browseflow_backend.model.dto.BatchStatusView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Broadcasts execution and batch lifecycle events over STOMP. Observers use them for
 * progress display only; nothing in scheduling depends on delivery.
 */
@Slf4j
@Component
public class ExecutionEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    // The UI subscribes to /topic/execution/{executionId} for node-level updates
    public static final String EXECUTION_TOPIC = "/topic/execution/";
    public static final String BATCH_TOPIC = "/topic/batches";

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void executionStarted(String executionId, String batchId) {
        Map<String, Object> payload = base(ExecutionEventType.EXECUTION_START, executionId);
        if (batchId != null) payload.put("batchId", batchId);
        publish(EXECUTION_TOPIC + executionId, payload);
    }

    public void executionCompleted(String executionId) {
        publish(EXECUTION_TOPIC + executionId, base(ExecutionEventType.EXECUTION_COMPLETE, executionId));
    }

    public void executionFailed(String executionId, String error) {
        Map<String, Object> payload = base(ExecutionEventType.EXECUTION_ERROR, executionId);
        payload.put("error", error != null ? error : "");
        publish(EXECUTION_TOPIC + executionId, payload);
    }

    public void executionStopped(String executionId) {
        publish(EXECUTION_TOPIC + executionId, base(ExecutionEventType.EXECUTION_STOPPED, executionId));
    }

    public void executionPaused(String executionId, String nodeId, String reason) {
        Map<String, Object> payload = base(ExecutionEventType.EXECUTION_PAUSED, executionId);
        payload.put("nodeId", nodeId);
        payload.put("reason", reason);
        publish(EXECUTION_TOPIC + executionId, payload);
    }

    public void breakpointTriggered(String executionId, String nodeId, String timing) {
        Map<String, Object> payload = base(ExecutionEventType.BREAKPOINT_TRIGGERED, executionId);
        payload.put("nodeId", nodeId);
        payload.put("timing", timing);
        publish(EXECUTION_TOPIC + executionId, payload);
    }

    public void nodeStarted(String executionId, String nodeId, String nodeType) {
        publish(EXECUTION_TOPIC + executionId, nodePayload(ExecutionEventType.NODE_START, executionId, nodeId, nodeType, null));
    }

    public void nodeCompleted(String executionId, String nodeId, String nodeType) {
        publish(EXECUTION_TOPIC + executionId, nodePayload(ExecutionEventType.NODE_COMPLETE, executionId, nodeId, nodeType, null));
    }

    public void nodeSkipped(String executionId, String nodeId, String nodeType) {
        publish(EXECUTION_TOPIC + executionId, nodePayload(ExecutionEventType.NODE_SKIPPED, executionId, nodeId, nodeType, null));
    }

    public void nodeError(String executionId, String nodeId, String nodeType, String error) {
        publish(EXECUTION_TOPIC + executionId, nodePayload(ExecutionEventType.NODE_ERROR, executionId, nodeId, nodeType,
                error != null ? error : ""));
    }

    public void batchStarted(BatchStatusView batch) {
        publishBatch(ExecutionEventType.BATCH_START, batch);
    }

    public void batchProgress(BatchStatusView batch) {
        publishBatch(ExecutionEventType.BATCH_PROGRESS, batch);
    }

    public void batchCompleted(BatchStatusView batch) {
        publishBatch(ExecutionEventType.BATCH_COMPLETE, batch);
    }

    private void publishBatch(ExecutionEventType type, BatchStatusView batch) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type.wireName());
        payload.put("batchId", batch.batchId());
        payload.put("status", batch.status().name());
        payload.put("total", batch.totalWorkflows());
        payload.put("valid", batch.validWorkflows());
        payload.put("completed", batch.completedWorkflows());
        payload.put("failed", batch.failedWorkflows());
        payload.put("stopped", batch.stoppedWorkflows());
        payload.put("running", batch.runningWorkflows());
        payload.put("queued", batch.queuedWorkflows());
        payload.put("timestamp", Instant.now().toString());
        publish(BATCH_TOPIC, payload);
    }

    private Map<String, Object> nodePayload(ExecutionEventType type, String executionId, String nodeId,
                                            String nodeType, String error) {
        Map<String, Object> payload = base(type, executionId);
        payload.put("nodeId", nodeId);
        payload.put("nodeType", nodeType);
        if (error != null) payload.put("error", error);
        return payload;
    }

    private Map<String, Object> base(ExecutionEventType type, String executionId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type.wireName());
        payload.put("executionId", executionId);
        payload.put("timestamp", Instant.now().toString());
        return payload;
    }

    private void publish(String destination, Map<String, Object> payload) {
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("Publishing {} to {} via {}", payload.get("type"), destination, bridge != null ? "Redis" : "Direct");
        try {
            if (bridge != null) {
                bridge.publish(destination, payload);
            } else {
                messagingTemplate.convertAndSend(destination, payload);
            }
        } catch (RuntimeException e) {
            // Best effort: a broker or Redis outage must not fail the execution that emitted it
            log.warn("Failed to publish {} to {}: {}", payload.get("type"), destination, e.getMessage());
        }
    }
}
