package com.browseflow.browseflow_backend.executor.handler;

import com.browseflow.browseflow_backend.browser.BrowserPage;
import com.browseflow.browseflow_backend.browser.BrowserSession;
import com.browseflow.browseflow_backend.engine.RetryHelper;
import com.browseflow.browseflow_backend.engine.WaitHelper;
import com.browseflow.browseflow_backend.executor.NodeConfigurationException;
import com.browseflow.browseflow_backend.executor.NodeOptionsReader;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class OpenBrowserHandler extends AbstractBrowserNodeHandler {

    public OpenBrowserHandler(RetryHelper retryHelper, WaitHelper waitHelper, NodeOptionsReader optionsReader) {
        super(retryHelper, waitHelper, optionsReader);
    }

    @Override
    public String supportedType() {
        return NodeTypes.OPEN_BROWSER;
    }

    @Override
    public void execute(FlowNode node, ExecutionContext context) throws Exception {
        BrowserSession session = context.getBrowserSession();
        if (session == null) {
            throw new NodeConfigurationException("No browser session is attached to execution " + context.getExecutionId());
        }
        BrowserPage page = session.open();
        context.setPage(page);
        log.info("Execution {}: browser opened by node {}", context.getExecutionId(), node.getId());

        String url = node.getString("url");
        if (url != null && !url.isBlank()) {
            runWithResilience(node, context, page, "Open browser at " + url,
                    p -> p.navigate(url, actionTimeout(node)));
        }
    }
}
