package com.browseflow.browseflow_backend.service;

import com.browseflow.browseflow_backend.model.domain.Workflow;

/** One candidate batch member. A null workflow marks an entry that could not be loaded. */
public record WorkflowEntry(String name, String sourcePath, Workflow workflow, String error) {

    public static WorkflowEntry valid(String name, String sourcePath, Workflow workflow) {
        return new WorkflowEntry(name, sourcePath, workflow, null);
    }

    public static WorkflowEntry invalid(String name, String sourcePath, String error) {
        return new WorkflowEntry(name, sourcePath, null, error);
    }

    public boolean isValid() {
        return workflow != null;
    }
}
