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
public class TypeHandler extends AbstractBrowserNodeHandler {

    public TypeHandler(RetryHelper retryHelper, WaitHelper waitHelper, NodeOptionsReader optionsReader) {
        super(retryHelper, waitHelper, optionsReader);
    }

    @Override
    public String supportedType() {
        return NodeTypes.TYPE;
    }

    @Override
    public void execute(FlowNode node, ExecutionContext context) throws Exception {
        String selector = requireString(node, "selector", "Selector is required for Type node");
        String text = node.getString("text");
        if (text == null) {
            throw new NodeConfigurationException("Text is required for Type node");
        }
        String engineSelector = SelectorTypes.toEngineSelector(selector, node.getString("selectorType"));
        runWithResilience(node, context, "Typing into selector \"" + selector + "\"",
                page -> page.fill(engineSelector, text, actionTimeout(node)));
        context.setVariable(node.getId(), text);
    }
}
