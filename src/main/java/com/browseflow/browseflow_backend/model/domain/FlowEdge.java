package com.browseflow.browseflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A connection between two nodes.
 *
 * Edges leaving a node's driver handle carry control flow. Edges arriving at a named
 * property handle (e.g. "url", "text") wire a value into that property and never
 * take part in execution order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowEdge {

    public static final String HANDLE_OUTPUT = "output";
    public static final String HANDLE_DRIVER = "driver";
    public static final String HANDLE_INPUT  = "input";

    private String id;
    private String source;
    private String target;
    private String sourceHandle;
    private String targetHandle;

    @JsonIgnore
    public boolean isDriverEdge() {
        boolean driverSource = sourceHandle == null
                || HANDLE_OUTPUT.equals(sourceHandle)
                || HANDLE_DRIVER.equals(sourceHandle);
        return driverSource && !isPropertyInput();
    }

    @JsonIgnore
    public boolean isPropertyInput() {
        return targetHandle != null
                && !HANDLE_DRIVER.equals(targetHandle)
                && !HANDLE_INPUT.equals(targetHandle);
    }
}
