package com.browseflow.browseflow_backend.executor.handler;

import com.browseflow.browseflow_backend.engine.ReusableScopeExtractor;
import com.browseflow.browseflow_backend.executor.NodeConfigurationException;
import com.browseflow.browseflow_backend.executor.NodeHandler;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.context.ExecutionControl;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RunReusableHandler implements NodeHandler {

    private final ReusableScopeExtractor scopeExtractor;

    @Override
    public String supportedType() {
        return NodeTypes.RUN_REUSABLE;
    }

    @Override
    public void execute(FlowNode node, ExecutionContext context) throws Exception {
        String contextName = node.getString("contextName");
        if (contextName == null || contextName.isBlank()) {
            throw new NodeConfigurationException("Context name is required for Run Reusable node");
        }
        ExecutionControl control = context.getControl();
        Workflow workflow = control.getWorkflow();
        FlowNode entry = scopeExtractor.findEntryByContext(workflow, contextName)
                .orElseThrow(() -> new NodeConfigurationException("No reusable flow found for context: " + contextName));

        Workflow subWorkflow = scopeExtractor.extract(workflow, entry.getId());
        if (subWorkflow.getNodes().isEmpty()) {
            log.warn("Reusable flow '{}' has no nodes connected to its entry, nothing to run", contextName);
            return;
        }
        log.info("Execution {}: running reusable flow '{}' ({} nodes)",
                context.getExecutionId(), contextName, subWorkflow.getNodes().size());
        control.runSubWorkflow(subWorkflow);
    }
}
