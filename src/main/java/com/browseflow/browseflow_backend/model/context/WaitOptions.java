package com.browseflow.browseflow_backend.model.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Up to three independent conditions checked around a node's main action.
 * Each condition with a null timeout falls back to {@link #defaultTimeoutMs}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WaitOptions {

    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    private String selector;
    private String selectorType;
    private Long selectorTimeoutMs;

    private String urlPattern;
    private Long urlTimeoutMs;

    private String condition;
    private Long conditionTimeoutMs;

    @Builder.Default
    private Strategy strategy = Strategy.PARALLEL;

    @Builder.Default
    private Timing timing = Timing.BEFORE;

    private boolean failSilently;

    @Builder.Default
    private long defaultTimeoutMs = DEFAULT_TIMEOUT_MS;

    public boolean hasConditions() {
        return selector != null || urlPattern != null || condition != null;
    }

    public long selectorTimeout() {
        return selectorTimeoutMs != null ? selectorTimeoutMs : defaultTimeoutMs;
    }

    public long urlTimeout() {
        return urlTimeoutMs != null ? urlTimeoutMs : defaultTimeoutMs;
    }

    public long conditionTimeout() {
        return conditionTimeoutMs != null ? conditionTimeoutMs : defaultTimeoutMs;
    }

    public enum Strategy {
        PARALLEL,
        SEQUENTIAL
    }

    public enum Timing {
        BEFORE("before"),
        AFTER("after");

        private final String label;

        Timing(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
