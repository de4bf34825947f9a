package com.browseflow.browseflow_backend.executor;

import com.browseflow.browseflow_backend.model.context.RetryCondition;
import com.browseflow.browseflow_backend.model.context.RetryOptions;
import com.browseflow.browseflow_backend.model.context.WaitOptions;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads the retry and wait settings every browser-facing node shares. */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeOptionsReader {

    private static final int MAX_RETRY_COUNT = 100;

    private final ObjectMapper objectMapper;

    public RetryOptions retryOptions(FlowNode node) {
        if (!node.getBoolean("retryEnabled")) {
            return RetryOptions.disabled();
        }
        RetryOptions.Strategy strategy = "untilCondition".equalsIgnoreCase(node.getString("retryStrategy"))
                ? RetryOptions.Strategy.UNTIL_CONDITION
                : RetryOptions.Strategy.COUNT;
        RetryOptions.DelayStrategy delayStrategy = "exponential".equalsIgnoreCase(node.getString("retryDelayStrategy"))
                ? RetryOptions.DelayStrategy.EXPONENTIAL
                : RetryOptions.DelayStrategy.FIXED;

        long count = node.getLong("retryCount", RetryOptions.DEFAULT_COUNT);
        long delay = node.getLong("retryDelay", RetryOptions.DEFAULT_DELAY_MS);
        long maxDelay = node.getLong("retryMaxDelay", -1L);

        return RetryOptions.builder()
                .enabled(true)
                .strategy(strategy)
                .count((int) Math.max(0, Math.min(MAX_RETRY_COUNT, count)))
                .untilCondition(readCondition(node))
                .delayMs(delay >= 0 ? delay : RetryOptions.DEFAULT_DELAY_MS)
                .delayStrategy(delayStrategy)
                .maxDelayMs(maxDelay > 0 ? maxDelay : null)
                .failSilently(node.getBoolean("failSilently"))
                .build();
    }

    public WaitOptions waitOptions(FlowNode node) {
        return WaitOptions.builder()
                .selector(blankToNull(node.getString("waitForSelector")))
                .selectorType(blankToNull(node.getString("waitForSelectorType")))
                .selectorTimeoutMs(optionalLong(node, "waitForSelectorTimeout"))
                .urlPattern(blankToNull(node.getString("waitForUrl")))
                .urlTimeoutMs(optionalLong(node, "waitForUrlTimeout"))
                .condition(blankToNull(node.getString("waitForCondition")))
                .conditionTimeoutMs(optionalLong(node, "waitForConditionTimeout"))
                .strategy("sequential".equalsIgnoreCase(node.getString("waitStrategy"))
                        ? WaitOptions.Strategy.SEQUENTIAL
                        : WaitOptions.Strategy.PARALLEL)
                .timing(node.getBoolean("waitAfterOperation") ? WaitOptions.Timing.AFTER : WaitOptions.Timing.BEFORE)
                .failSilently(node.getBoolean("failSilently"))
                .build();
    }

    private RetryCondition readCondition(FlowNode node) {
        Object raw = node.get("retryUntilCondition");
        if (raw == null) return null;
        try {
            return objectMapper.convertValue(raw, RetryCondition.class);
        } catch (IllegalArgumentException ex) {
            log.warn("Failed to parse retry condition for node {}: {}", node.getId(), ex.getMessage());
            return null;
        }
    }

    private static Long optionalLong(FlowNode node, String key) {
        long value = node.getLong(key, -1L);
        return value > 0 ? value : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
