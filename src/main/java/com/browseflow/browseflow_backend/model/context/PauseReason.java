package com.browseflow.browseflow_backend.model.context;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PauseReason {
    WAIT_PAUSE("wait-pause"),
    BREAKPOINT("breakpoint");

    private final String label;

    PauseReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
