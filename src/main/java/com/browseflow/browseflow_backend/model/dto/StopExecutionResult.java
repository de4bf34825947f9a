package com.browseflow.browseflow_backend.model.dto;

// Both false means the execution had already finished
public record StopExecutionResult(String executionId, boolean wasRunning, boolean wasQueued) {}
