package com.browseflow.browseflow_backend.model.context;

// Scheduler-side lifecycle of one execution
public enum ExecutionStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    ERROR,
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == STOPPED;
    }
}
