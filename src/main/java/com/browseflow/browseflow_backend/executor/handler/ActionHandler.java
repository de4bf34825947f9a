package com.browseflow.browseflow_backend.executor.handler;

import com.browseflow.browseflow_backend.browser.SelectorTypes;
import com.browseflow.browseflow_backend.engine.RetryHelper;
import com.browseflow.browseflow_backend.engine.WaitHelper;
import com.browseflow.browseflow_backend.executor.NodeConfigurationException;
import com.browseflow.browseflow_backend.executor.NodeOptionsReader;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import org.springframework.stereotype.Component;

@Component
public class ActionHandler extends AbstractBrowserNodeHandler {

    public ActionHandler(RetryHelper retryHelper, WaitHelper waitHelper, NodeOptionsReader optionsReader) {
        super(retryHelper, waitHelper, optionsReader);
    }

    @Override
    public String supportedType() {
        return NodeTypes.ACTION;
    }

    @Override
    public void execute(FlowNode node, ExecutionContext context) throws Exception {
        String selector = requireString(node, "selector", "Selector is required for Action node");
        String action = node.getString("action");
        if (action != null && !action.isBlank() && !"click".equalsIgnoreCase(action)) {
            throw new NodeConfigurationException("Unsupported action type: " + action);
        }
        String engineSelector = SelectorTypes.toEngineSelector(selector, node.getString("selectorType"));
        runWithResilience(node, context, "Click on selector \"" + selector + "\"",
                page -> page.click(engineSelector, actionTimeout(node)));
    }
}
