package com.browseflow.browseflow_backend.model.domain;

public enum BatchSourceType {
    FOLDER,
    FILES,
    WORKFLOWS
}
