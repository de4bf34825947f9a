package com.browseflow.browseflow_backend.executor;

/** Required node data is missing or malformed. Thrown before any browser call and never retried. */
public class NodeConfigurationException extends RuntimeException {

    public NodeConfigurationException(String message) {
        super(message);
    }
}
