package com.browseflow.browseflow_backend.engine;

import com.browseflow.browseflow_backend.model.context.BreakpointConfig;

/**
 * @param parallel    true for batch members; wait-pauses are ignored and breakpoints never fire
 * @param slowMoMs    delay inserted after every node
 */
public record RunSettings(boolean parallel, BreakpointConfig breakpoints, long slowMoMs) {

    public static RunSettings single(BreakpointConfig breakpoints, long slowMoMs) {
        return new RunSettings(false, breakpoints != null ? breakpoints : BreakpointConfig.disabled(), slowMoMs);
    }

    public static RunSettings batchMember(long slowMoMs) {
        return new RunSettings(true, BreakpointConfig.disabled(), slowMoMs);
    }
}
