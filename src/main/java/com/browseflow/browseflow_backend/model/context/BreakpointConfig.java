package com.browseflow.browseflow_backend.model.context;

import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreakpointConfig {

    private boolean enabled;

    @Builder.Default
    private At breakpointAt = At.PRE;

    @Builder.Default
    private For breakpointFor = For.MARKED;

    public static BreakpointConfig disabled() {
        return BreakpointConfig.builder().enabled(false).build();
    }

    public boolean shouldTrigger(FlowNode node, At timing) {
        if (!enabled || node == null) return false;
        boolean timingMatches = breakpointAt == At.BOTH || breakpointAt == timing;
        if (!timingMatches) return false;
        return breakpointFor == For.ALL || node.isBreakpointMarked();
    }

    public enum At {
        @JsonProperty("pre") PRE,
        @JsonProperty("post") POST,
        @JsonProperty("both") BOTH
    }

    public enum For {
        @JsonProperty("all") ALL,
        @JsonProperty("marked") MARKED
    }
}
