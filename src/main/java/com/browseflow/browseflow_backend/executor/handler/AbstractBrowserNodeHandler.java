package com.browseflow.browseflow_backend.executor.handler;

import com.browseflow.browseflow_backend.browser.BrowserPage;
import com.browseflow.browseflow_backend.engine.RetryHelper;
import com.browseflow.browseflow_backend.engine.WaitHelper;
import com.browseflow.browseflow_backend.executor.NodeConfigurationException;
import com.browseflow.browseflow_backend.executor.NodeExecutionException;
import com.browseflow.browseflow_backend.executor.NodeHandler;
import com.browseflow.browseflow_backend.executor.NodeOptionsReader;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.context.RetryOptions;
import com.browseflow.browseflow_backend.model.context.WaitOptions;
import com.browseflow.browseflow_backend.model.domain.FlowNode;

import java.util.function.Consumer;

/**
 * Base for handlers that drive the page: waits run before or after the main action
 * depending on {@code waitAfterOperation}, and action plus waits retry together.
 */
public abstract class AbstractBrowserNodeHandler implements NodeHandler {

    protected static final long DEFAULT_ACTION_TIMEOUT_MS = 30_000L;

    protected final RetryHelper retryHelper;
    protected final WaitHelper waitHelper;
    protected final NodeOptionsReader optionsReader;

    protected AbstractBrowserNodeHandler(RetryHelper retryHelper, WaitHelper waitHelper,
                                         NodeOptionsReader optionsReader) {
        this.retryHelper = retryHelper;
        this.waitHelper = waitHelper;
        this.optionsReader = optionsReader;
    }

    protected BrowserPage requirePage(ExecutionContext context) {
        BrowserPage page = context.getPage();
        if (page == null) {
            throw new NodeConfigurationException("No page available. Ensure Open Browser node is executed first.");
        }
        return page;
    }

    protected String requireString(FlowNode node, String key, String message) {
        String value = node.getString(key);
        if (value == null || value.isBlank()) {
            throw new NodeConfigurationException(message);
        }
        return value;
    }

    protected long actionTimeout(FlowNode node) {
        return node.getLong("timeout", DEFAULT_ACTION_TIMEOUT_MS);
    }

    protected void runWithResilience(FlowNode node, ExecutionContext context, String description,
                                     Consumer<BrowserPage> action) throws Exception {
        BrowserPage page = requirePage(context);
        runWithResilience(node, context, page, description, action);
    }

    protected void runWithResilience(FlowNode node, ExecutionContext context, BrowserPage page, String description,
                                     Consumer<BrowserPage> action) throws Exception {
        RetryOptions retry = optionsReader.retryOptions(node);
        WaitOptions waits = optionsReader.waitOptions(node);

        Boolean done = retryHelper.executeWithRetry(() -> {
            if (waits.getTiming() == WaitOptions.Timing.BEFORE) {
                waitHelper.executeWaits(page, waits, context);
            }
            action.accept(page);
            if (waits.getTiming() == WaitOptions.Timing.AFTER) {
                waitHelper.executeWaits(page, waits, context);
            }
            return Boolean.TRUE;
        }, retry, page);

        // Retries ran out under failSilently; surface it so progress tracking stays accurate
        if (done == null && retry.isFailSilently()) {
            throw new NodeExecutionException(description + " failed on node " + node.getId()
                    + " after all retry attempts");
        }
    }
}
