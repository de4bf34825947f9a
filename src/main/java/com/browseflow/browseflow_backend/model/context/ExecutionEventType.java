package com.browseflow.browseflow_backend.model.context;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionEventType {
    NODE_START("node_start"),
    NODE_COMPLETE("node_complete"),
    NODE_ERROR("node_error"),
    NODE_SKIPPED("node_skipped"),
    EXECUTION_START("execution_start"),
    EXECUTION_COMPLETE("execution_complete"),
    EXECUTION_ERROR("execution_error"),
    EXECUTION_STOPPED("execution_stopped"),
    EXECUTION_PAUSED("execution_paused"),
    BREAKPOINT_TRIGGERED("breakpoint_triggered"),
    BATCH_START("batch-start"),
    BATCH_PROGRESS("batch-progress"),
    BATCH_COMPLETE("batch-complete");

    private final String wireName;

    ExecutionEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
