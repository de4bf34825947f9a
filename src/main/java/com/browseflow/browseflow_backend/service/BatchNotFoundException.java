package com.browseflow.browseflow_backend.service;

public class BatchNotFoundException extends RuntimeException {

    public BatchNotFoundException(String batchId) {
        super("Batch not found: " + batchId);
    }
}
