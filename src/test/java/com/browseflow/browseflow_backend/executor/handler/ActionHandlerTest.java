package com.browseflow.browseflow_backend.executor.handler;

import com.browseflow.browseflow_backend.browser.FakeBrowserPage;
import com.browseflow.browseflow_backend.engine.RetryHelper;
import com.browseflow.browseflow_backend.engine.WaitHelper;
import com.browseflow.browseflow_backend.executor.NodeConfigurationException;
import com.browseflow.browseflow_backend.executor.NodeExecutionException;
import com.browseflow.browseflow_backend.executor.NodeOptionsReader;
import com.browseflow.browseflow_backend.executor.ReferenceResolver;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionHandlerTest {

    private final ActionHandler handler = new ActionHandler(
            new RetryHelper(),
            new WaitHelper(new ReferenceResolver(), Runnable::run),
            new NodeOptionsReader(new ObjectMapper()));

    @Test
    void shouldClickOnceWithoutRetry() throws Exception {
        FakeBrowserPage page = new FakeBrowserPage().show("#buy");
        ExecutionContext context = contextWith(page);

        handler.execute(node(Map.of("selector", "#buy")), context);

        assertThat(page.clicks).hasValue(1);
    }

    @Test
    void shouldRetryClickAndReportFailSilentlyAsNodeFailure() {
        FakeBrowserPage page = new FakeBrowserPage();
        ExecutionContext context = contextWith(page);
        FlowNode node = node(Map.of(
                "selector", "#buy",
                "retryEnabled", true,
                "retryCount", 2,
                "retryDelay", 1,
                "failSilently", true));

        assertThatThrownBy(() -> handler.execute(node, context))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("after all retry attempts");
        assertThat(page.clicks).hasValue(3);
    }

    @Test
    void shouldWaitBeforeClickingByDefault() throws Exception {
        FakeBrowserPage page = new FakeBrowserPage().show("#buy");
        ExecutionContext context = contextWith(page);

        handler.execute(node(Map.of("selector", "#buy", "waitForSelector", "#buy", "waitForSelectorTimeout", 50)), context);

        assertThat(page.selectorWaits).hasValue(1);
        assertThat(page.clicks).hasValue(1);
    }

    @Test
    void shouldRequireSelectorAndPage() {
        assertThatThrownBy(() -> handler.execute(node(Map.of()), contextWith(new FakeBrowserPage())))
                .isInstanceOf(NodeConfigurationException.class)
                .hasMessage("Selector is required for Action node");
        assertThatThrownBy(() -> handler.execute(node(Map.of("selector", "#x")), contextWith(null)))
                .isInstanceOf(NodeConfigurationException.class);
    }

    private static ExecutionContext contextWith(FakeBrowserPage page) {
        ExecutionContext context = new ExecutionContext("exec-1", null, false, null);
        context.setPage(page);
        return context;
    }

    private static FlowNode node(Map<String, Object> data) {
        return FlowNode.builder().id("click-1").type("action").data(new HashMap<>(data)).build();
    }
}
