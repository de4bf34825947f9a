package com.browseflow.browseflow_backend.engine;

import com.browseflow.browseflow_backend.browser.BrowserSessionFactory;
import com.browseflow.browseflow_backend.executor.NodeHandlerRegistry;
import com.browseflow.browseflow_backend.executor.ReferenceResolver;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds one executor per execution, each with its own context and browser session. */
@Component
@RequiredArgsConstructor
public class WorkflowExecutorFactory {

    private final NodeHandlerRegistry handlerRegistry;
    private final WorkflowParser parser;
    private final ReusableScopeExtractor scopeExtractor;
    private final ReferenceResolver referenceResolver;
    private final ExecutionEventPublisher eventPublisher;
    private final BrowserSessionFactory browserSessionFactory;

    public WorkflowExecutor create(String executionId, String batchId, Workflow workflow, RunSettings settings) {
        ExecutionContext context = new ExecutionContext(executionId, batchId, settings.parallel(),
                browserSessionFactory.create());
        return new WorkflowExecutor(executionId, workflow, context, settings,
                handlerRegistry, parser, scopeExtractor, referenceResolver, eventPublisher);
    }
}
