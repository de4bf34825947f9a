package com.browseflow.browseflow_backend.engine;

public class WorkflowValidationException extends RuntimeException {

    public WorkflowValidationException(String message) {
        super(message);
    }
}
