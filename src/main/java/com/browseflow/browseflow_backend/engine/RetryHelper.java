package com.browseflow.browseflow_backend.engine;

import com.browseflow.browseflow_backend.browser.BrowserPage;
import com.browseflow.browseflow_backend.browser.SelectorTypes;
import com.browseflow.browseflow_backend.browser.UrlPatterns;
import com.browseflow.browseflow_backend.executor.NodeConfigurationException;
import com.browseflow.browseflow_backend.model.context.RetryCondition;
import com.browseflow.browseflow_backend.model.context.RetryOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;

/**
 * Runs a node's main action under its retry policy.
 *
 * <p>A {@code null} return means every attempt failed and the policy asked to fail silently.
 * Handlers turn that into their own descriptive error. Configuration errors are never retried.
 */
@Slf4j
@Component
public class RetryHelper {

    public <T> T executeWithRetry(Callable<T> operation, RetryOptions options, BrowserPage page) throws Exception {
        if (options == null || !options.isEnabled()) {
            return operation.call();
        }
        if (options.getStrategy() == RetryOptions.Strategy.UNTIL_CONDITION) {
            return retryUntilCondition(operation, options, page);
        }
        return retryByCount(operation, options);
    }

    /**
     * Delay before retry number {@code attempt} (1-based): the base delay when fixed,
     * {@code base * 2^(attempt-1)} when exponential, capped at the max delay if one is set.
     */
    public static long calculateDelay(int attempt, RetryOptions options) {
        long base = Math.max(0L, options.getDelayMs());
        if (options.getDelayStrategy() != RetryOptions.DelayStrategy.EXPONENTIAL) {
            return base;
        }
        double delay = base * Math.pow(2, Math.max(0, attempt - 1));
        if (options.getMaxDelayMs() != null && options.getMaxDelayMs() > 0) {
            delay = Math.min(delay, options.getMaxDelayMs());
        }
        return delay >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) delay;
    }

    private <T> T retryByCount(Callable<T> operation, RetryOptions options) throws Exception {
        int count = Math.max(0, options.getCount());
        Exception lastFailure = null;

        for (int attempt = 0; attempt <= count; attempt++) {
            try {
                return operation.call();
            } catch (ExecutionStoppedException | NodeConfigurationException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutionStoppedException("Interrupted during attempt " + (attempt + 1));
            } catch (Exception e) {
                lastFailure = e;
                if (attempt < count) {
                    long delay = calculateDelay(attempt + 1, options);
                    log.warn("Attempt {}/{} failed: {}. Retrying in {} ms",
                            attempt + 1, count + 1, e.getMessage(), delay);
                    sleep(delay);
                }
            }
        }

        if (options.isFailSilently()) {
            log.warn("All {} attempts failed, continuing silently. Last error: {}",
                    count + 1, lastFailure.getMessage());
            return null;
        }
        throw lastFailure;
    }

    private <T> T retryUntilCondition(Callable<T> operation, RetryOptions options, BrowserPage page) throws Exception {
        RetryCondition condition = options.getUntilCondition();
        if (page == null) {
            throw new IllegalArgumentException("Retry until condition requires an open browser page");
        }
        if (condition == null || condition.getType() == null
                || condition.getValue() == null || condition.getValue().isBlank()) {
            throw new IllegalArgumentException("Retry until condition requires a condition type and value");
        }

        long timeout = condition.getTimeout() > 0 ? condition.getTimeout() : RetryCondition.DEFAULT_TIMEOUT_MS;
        long startedAt = System.currentTimeMillis();
        int attempt = 0;
        Exception lastFailure = null;

        while (true) {
            attempt++;
            try {
                T result = operation.call();
                lastFailure = null;
                if (conditionMet(page, condition)) {
                    return result;
                }
                log.debug("Attempt {} succeeded but {} condition \"{}\" is not met yet",
                        attempt, describe(condition), condition.getValue());
            } catch (ExecutionStoppedException | NodeConfigurationException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutionStoppedException("Interrupted during attempt " + attempt);
            } catch (Exception e) {
                lastFailure = e;
                // The page may already be where we want it even though the action failed
                if (conditionMet(page, condition)) {
                    log.info("Attempt {} failed ({}) but {} condition \"{}\" is met, continuing",
                            attempt, e.getMessage(), describe(condition), condition.getValue());
                    return null;
                }
            }

            long delay = calculateDelay(attempt, options);
            long elapsed = System.currentTimeMillis() - startedAt;
            if (elapsed + delay >= timeout) break;
            log.warn("Attempt {} did not satisfy {} condition \"{}\". Retrying in {} ms",
                    attempt, describe(condition), condition.getValue(), delay);
            sleep(delay);
        }

        String message = String.format("Retry until condition timed out after %dms: %s \"%s\" not met after %d attempt(s)",
                timeout, describe(condition), condition.getValue(), attempt);
        if (options.isFailSilently()) {
            log.warn("{}. Continuing silently.", message);
            return null;
        }
        if (lastFailure != null) throw lastFailure;
        throw new WaitConditionException(message);
    }

    boolean conditionMet(BrowserPage page, RetryCondition condition) {
        try {
            return switch (condition.getType()) {
                case SELECTOR -> page.isVisible(
                        SelectorTypes.toEngineSelector(condition.getValue(), condition.getSelectorType()));
                case URL -> UrlPatterns.matches(page.url(), condition.getValue());
                case JAVASCRIPT -> BrowserPage.isTruthy(page.evaluate(condition.getValue()));
            };
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            // A probe that throws (e.g. page mid-navigation) counts as "not met yet"
            log.debug("Condition probe failed: {}", e.getMessage());
            return false;
        }
    }

    private static String describe(RetryCondition condition) {
        return condition.getType().name().toLowerCase();
    }

    private static void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionStoppedException("Interrupted while waiting to retry");
        }
    }
}
