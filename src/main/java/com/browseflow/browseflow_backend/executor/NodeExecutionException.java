package com.browseflow.browseflow_backend.executor;

public class NodeExecutionException extends RuntimeException {

    public NodeExecutionException(String message) {
        super(message);
    }
}
