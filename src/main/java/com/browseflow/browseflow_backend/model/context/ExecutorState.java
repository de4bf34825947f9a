package com.browseflow.browseflow_backend.model.context;

public enum ExecutorState {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    ERROR,
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == STOPPED;
    }
}
