package com.browseflow.browseflow_backend.engine;

/** Unwinds a run that was asked to stop. Never treated as a node failure. */
public class ExecutionStoppedException extends RuntimeException {

    public ExecutionStoppedException(String message) {
        super(message);
    }
}
