package com.browseflow.browseflow_backend.model.dto;

import com.browseflow.browseflow_backend.model.context.BreakpointConfig;
import com.browseflow.browseflow_backend.model.domain.Workflow;

public record SingleRunRequest(
        Workflow         workflow,
        String           workflowName,
        BreakpointConfig breakpoints,
        Long             slowMo
) {
    public BreakpointConfig breakpointsOrDisabled() {
        return breakpoints != null ? breakpoints : BreakpointConfig.disabled();
    }

    public long slowMoOrZero() {
        return slowMo != null && slowMo > 0 ? slowMo : 0L;
    }
}
