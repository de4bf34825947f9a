package com.browseflow.browseflow_backend.executor.handler;

import com.browseflow.browseflow_backend.engine.ExecutionStoppedException;
import com.browseflow.browseflow_backend.engine.RetryHelper;
import com.browseflow.browseflow_backend.engine.WaitHelper;
import com.browseflow.browseflow_backend.executor.NodeConfigurationException;
import com.browseflow.browseflow_backend.executor.NodeOptionsReader;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.context.PauseReason;
import com.browseflow.browseflow_backend.model.context.WaitOptions;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Waits for a fixed time, a selector, a URL or a javascript condition, or pauses the run
 * until someone continues it ({@code pause: true}).
 */
@Slf4j
@Component
public class WaitHandler extends AbstractBrowserNodeHandler {

    public WaitHandler(RetryHelper retryHelper, WaitHelper waitHelper, NodeOptionsReader optionsReader) {
        super(retryHelper, waitHelper, optionsReader);
    }

    @Override
    public String supportedType() {
        return NodeTypes.WAIT;
    }

    @Override
    public void execute(FlowNode node, ExecutionContext context) throws Exception {
        if (node.getBoolean("pause")) {
            pause(node, context);
            return;
        }

        String waitType = node.getString("waitType") != null ? node.getString("waitType") : "timeout";
        long timeout = node.getLong("timeout", WaitOptions.DEFAULT_TIMEOUT_MS);
        String value = node.getString("value");

        switch (waitType) {
            case "timeout" -> sleep(node.getLong("value", timeout));
            case "selector" -> waitFor(node, context, "Wait for selector",
                    WaitOptions.builder()
                            .selector(require(value, "Selector is required for Wait node"))
                            .selectorType(node.getString("selectorType"))
                            .selectorTimeoutMs(timeout)
                            .build());
            case "url" -> waitFor(node, context, "Wait for URL",
                    WaitOptions.builder()
                            .urlPattern(require(value, "URL pattern is required for Wait node"))
                            .urlTimeoutMs(timeout)
                            .build());
            case "condition" -> waitFor(node, context, "Wait for condition",
                    WaitOptions.builder()
                            .condition(require(value, "Condition is required for Wait node"))
                            .conditionTimeoutMs(timeout)
                            .build());
            default -> throw new NodeConfigurationException("Unsupported wait type: " + waitType);
        }
    }

    private void pause(FlowNode node, ExecutionContext context) {
        // Nobody is watching a batch member, so a pause would hold its worker forever
        if (context.isParallelExecution()) {
            if (context.markPauseWarningLogged()) {
                log.warn("Execution {}: wait-pause on node {} ignored in parallel execution",
                        context.getExecutionId(), node.getId());
            }
            return;
        }
        if (context.getControl() == null) {
            throw new IllegalStateException("Execution " + context.getExecutionId() + " cannot be paused");
        }
        context.getControl().requestPause(node.getId(), PauseReason.WAIT_PAUSE);
    }

    private void waitFor(FlowNode node, ExecutionContext context, String description, WaitOptions options) throws Exception {
        WaitOptions effective = options.toBuilder().failSilently(node.getBoolean("failSilently")).build();
        runWithResilience(node, context, description,
                page -> waitHelper.executeWaits(page, effective, context));
    }

    private static String require(String value, String message) {
        if (value == null || value.isBlank()) throw new NodeConfigurationException(message);
        return value;
    }

    private static void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionStoppedException("Interrupted during wait");
        }
    }
}
