package com.browseflow.browseflow_backend.model.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-node retry policy, read from the node's data.
 *
 * <pre>
 * {
 *   "retryEnabled": true,
 *   "retryStrategy": "count",          // or "untilCondition"
 *   "retryCount": 3,
 *   "retryUntilCondition": { "type": "selector", "value": "#done", "timeout": 30000 },
 *   "retryDelay": 1000,
 *   "retryDelayStrategy": "exponential",
 *   "retryMaxDelay": 10000,
 *   "failSilently": false
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryOptions {

    public static final int DEFAULT_COUNT = 3;
    public static final long DEFAULT_DELAY_MS = 1000L;

    private boolean enabled;

    @Builder.Default
    private Strategy strategy = Strategy.COUNT;

    /** Retries after the first attempt, so the operation runs at most count + 1 times. */
    @Builder.Default
    private int count = DEFAULT_COUNT;

    private RetryCondition untilCondition;

    @Builder.Default
    private long delayMs = DEFAULT_DELAY_MS;

    @Builder.Default
    private DelayStrategy delayStrategy = DelayStrategy.FIXED;

    // Cap for exponential backoff; null means uncapped
    private Long maxDelayMs;

    private boolean failSilently;

    public static RetryOptions disabled() {
        return RetryOptions.builder().enabled(false).build();
    }

    public enum Strategy {
        @JsonProperty("count") COUNT,
        @JsonProperty("untilCondition") UNTIL_CONDITION
    }

    public enum DelayStrategy {
        @JsonProperty("fixed") FIXED,
        @JsonProperty("exponential") EXPONENTIAL
    }
}
