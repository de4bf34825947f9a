package com.browseflow.browseflow_backend.executor.handler;

import com.browseflow.browseflow_backend.executor.NodeHandler;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import org.springframework.stereotype.Component;

@Component
public class StartHandler implements NodeHandler {

    @Override
    public String supportedType() {
        return NodeTypes.START;
    }

    // Start only marks the entry point; the executor has already seeded the context
    @Override
    public void execute(FlowNode node, ExecutionContext context) {
        context.setVariable(node.getId(), context.getExecutionId());
    }
}
