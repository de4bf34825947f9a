package com.browseflow.browseflow_backend.executor.handler;

import com.browseflow.browseflow_backend.engine.RetryHelper;
import com.browseflow.browseflow_backend.engine.WaitHelper;
import com.browseflow.browseflow_backend.executor.NodeOptionsReader;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import org.springframework.stereotype.Component;

@Component
public class NavigationHandler extends AbstractBrowserNodeHandler {

    public NavigationHandler(RetryHelper retryHelper, WaitHelper waitHelper, NodeOptionsReader optionsReader) {
        super(retryHelper, waitHelper, optionsReader);
    }

    @Override
    public String supportedType() {
        return NodeTypes.NAVIGATION;
    }

    @Override
    public void execute(FlowNode node, ExecutionContext context) throws Exception {
        String url = requireString(node, "url", "URL is required for Navigation node");
        runWithResilience(node, context, "Navigation to " + url, page -> page.navigate(url, actionTimeout(node)));
        context.setVariable(node.getId(), context.getPage().url());
    }
}
