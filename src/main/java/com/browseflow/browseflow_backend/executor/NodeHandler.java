package com.browseflow.browseflow_backend.executor;

import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.domain.FlowNode;

/**
 * Runs one node type. The node arrives with its templates already interpolated and its
 * property inputs applied, so handlers read their configuration straight from {@code node.getData()}.
 */
public interface NodeHandler {

    String supportedType();

    void execute(FlowNode node, ExecutionContext context) throws Exception;
}
