package com.browseflow.browseflow_backend.service;

public class ExecutionNotFoundException extends RuntimeException {

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
    }
}
