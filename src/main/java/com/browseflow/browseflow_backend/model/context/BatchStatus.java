package com.browseflow.browseflow_backend.model.context;

public enum BatchStatus {
    RUNNING,
    COMPLETED,
    ERROR,
    STOPPED
}
