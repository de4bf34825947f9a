package com.browseflow.browseflow_backend.engine;

import com.browseflow.browseflow_backend.browser.BrowserPage;
import com.browseflow.browseflow_backend.browser.SelectorTypes;
import com.browseflow.browseflow_backend.executor.NodeConfigurationException;
import com.browseflow.browseflow_backend.executor.ReferenceResolver;
import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import com.browseflow.browseflow_backend.model.context.WaitOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

@Slf4j
@Component
public class WaitHelper {

    private final ReferenceResolver referenceResolver;
    private final Executor waitExecutor;

    public WaitHelper(ReferenceResolver referenceResolver,
                      @Qualifier("waitConditionExecutor") Executor waitExecutor) {
        this.referenceResolver = referenceResolver;
        this.waitExecutor = waitExecutor;
    }

    /**
     * Checks every configured condition, in parallel or one after another. In parallel mode
     * the call returns only once every check has settled, so a failure is never reported
     * before the slowest check's own timeout.
     */
    public void executeWaits(BrowserPage page, WaitOptions options, ExecutionContext context) {
        if (options == null || !options.hasConditions()) return;
        String prefix = "Wait " + options.getTiming().label() + " operation";

        try {
            if (page == null) {
                throw new NodeConfigurationException(prefix + ": no page available. Ensure Open Browser node is executed first.");
            }
            List<Runnable> checks = buildChecks(page, options, context, prefix);
            if (checks.isEmpty()) return;

            if (options.getStrategy() == WaitOptions.Strategy.SEQUENTIAL) {
                checks.forEach(Runnable::run);
            } else {
                runParallel(checks);
            }
        } catch (ExecutionStoppedException | NodeConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (options.isFailSilently()) {
                log.warn("{} failed, continuing (failSilently): {}", prefix, e.getMessage());
                return;
            }
            throw e;
        }
    }

    private List<Runnable> buildChecks(BrowserPage page, WaitOptions options, ExecutionContext context, String prefix) {
        List<Runnable> checks = new ArrayList<>();

        if (options.getSelector() != null) {
            String selector = requireValue(referenceResolver.resolve(options.getSelector(), context), "Selector", prefix);
            long timeout = options.selectorTimeout();
            checks.add(() -> checkSelector(page, selector, options.getSelectorType(), timeout, prefix));
        }
        if (options.getUrlPattern() != null) {
            String pattern = requireValue(referenceResolver.resolve(options.getUrlPattern(), context), "URL pattern", prefix);
            long timeout = options.urlTimeout();
            checks.add(() -> checkUrl(page, pattern, timeout, prefix));
        }
        if (options.getCondition() != null) {
            String expression = requireValue(referenceResolver.resolve(options.getCondition(), context), "Condition", prefix);
            long timeout = options.conditionTimeout();
            checks.add(() -> checkCondition(page, expression, timeout, prefix));
        }
        return checks;
    }

    private static String requireValue(String value, String what, String prefix) {
        if (value == null || value.isBlank()) {
            throw new NodeConfigurationException(prefix + ": " + what + " is empty");
        }
        return value;
    }

    private void runParallel(List<Runnable> checks) {
        List<CompletableFuture<Void>> futures = checks.stream()
                .map(check -> CompletableFuture.runAsync(check, waitExecutor))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new ExecutionStoppedException("Interrupted while waiting for conditions");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException re) throw re;
            throw new WaitConditionException(cause != null ? cause.getMessage() : e.getMessage());
        }
    }

    private void checkSelector(BrowserPage page, String selector, String selectorType, long timeout, String prefix) {
        String typeLabel = SelectorTypes.labelOf(selectorType);
        log.debug("WAIT_CHECK_START timing={}, condition=selector, expected=\"{}\" ({}) visible, timeoutMs={}",
                prefix, selector, typeLabel, timeout);
        long startedAt = System.currentTimeMillis();
        boolean visible = page.waitForSelector(SelectorTypes.toEngineSelector(selector, selectorType), timeout);
        log.info("WAIT_CHECK timing={}, condition=selector, expected=\"{}\" visible, observed={}, timeoutMs={}, elapsedMs={}",
                prefix, selector, visible ? "visible" : "not visible", timeout, System.currentTimeMillis() - startedAt);
        if (!visible) {
            throw new WaitConditionException(String.format("%s: Selector \"%s\" (%s) did not appear within %dms",
                    prefix, selector, typeLabel, timeout));
        }
    }

    private void checkUrl(BrowserPage page, String pattern, long timeout, String prefix) {
        log.debug("WAIT_CHECK_START timing={}, condition=url, expected=\"{}\", timeoutMs={}", prefix, pattern, timeout);
        long startedAt = System.currentTimeMillis();
        boolean matched = page.waitForUrl(pattern, timeout);
        String currentUrl = page.url();
        log.info("WAIT_CHECK timing={}, condition=url, expected=\"{}\", observed=\"{}\", matched={}, timeoutMs={}, elapsedMs={}",
                prefix, pattern, currentUrl, matched, timeout, System.currentTimeMillis() - startedAt);
        if (!matched) {
            throw new WaitConditionException(String.format("%s: URL did not match pattern \"%s\" within %dms. Current URL: %s",
                    prefix, pattern, timeout, currentUrl));
        }
    }

    private void checkCondition(BrowserPage page, String expression, long timeout, String prefix) {
        log.debug("WAIT_CHECK_START timing={}, condition=javascript, expected=\"{}\" truthy, timeoutMs={}",
                prefix, expression, timeout);
        long startedAt = System.currentTimeMillis();
        boolean met = page.waitForFunction(expression, timeout);
        log.info("WAIT_CHECK timing={}, condition=javascript, expected=\"{}\" truthy, observed={}, timeoutMs={}, elapsedMs={}",
                prefix, expression, met ? "truthy" : "falsy", timeout, System.currentTimeMillis() - startedAt);
        if (!met) {
            throw new WaitConditionException(String.format("%s: Condition \"%s\" was not met within %dms",
                    prefix, expression, timeout));
        }
    }
}
