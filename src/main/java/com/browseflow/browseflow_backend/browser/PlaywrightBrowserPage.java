package com.browseflow.browseflow_backend.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import lombok.extern.slf4j.Slf4j;

import java.util.function.BooleanSupplier;

/**
 * Playwright-backed page. Playwright objects are not thread-safe, so every call into the
 * driver is a short synchronized probe; waits poll those probes, which lets several
 * wait conditions run side by side on one page.
 */
@Slf4j
public class PlaywrightBrowserPage implements BrowserPage {

    private static final long POLL_INTERVAL_MS = 100L;

    private final Page page;
    private final Object driverLock = new Object();

    public PlaywrightBrowserPage(Page page) {
        this.page = page;
    }

    @Override
    public String url() {
        synchronized (driverLock) {
            return page.url();
        }
    }

    @Override
    public boolean isVisible(String selector) {
        synchronized (driverLock) {
            return page.locator(selector).first().isVisible();
        }
    }

    @Override
    public Object evaluate(String expression) {
        synchronized (driverLock) {
            return page.evaluate(expression);
        }
    }

    @Override
    public boolean waitForSelector(String selector, long timeoutMs) {
        return poll(timeoutMs, () -> isVisible(selector));
    }

    @Override
    public boolean waitForUrl(String pattern, long timeoutMs) {
        return poll(timeoutMs, () -> UrlPatterns.matches(url(), pattern));
    }

    @Override
    public boolean waitForFunction(String expression, long timeoutMs) {
        return poll(timeoutMs, () -> BrowserPage.isTruthy(evaluate(expression)));
    }

    @Override
    public void navigate(String url, long timeoutMs) {
        synchronized (driverLock) {
            page.navigate(url, new Page.NavigateOptions().setTimeout(timeoutMs));
        }
    }

    @Override
    public void click(String selector, long timeoutMs) {
        synchronized (driverLock) {
            page.locator(selector).first().click(new Locator.ClickOptions().setTimeout(timeoutMs));
        }
    }

    @Override
    public void fill(String selector, String text, long timeoutMs) {
        synchronized (driverLock) {
            page.locator(selector).first().fill(text, new Locator.FillOptions().setTimeout(timeoutMs));
        }
    }

    private boolean poll(long timeoutMs, BooleanSupplier probe) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (true) {
            if (probe.getAsBoolean()) return true;
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) return false;
            try {
                Thread.sleep(Math.min(POLL_INTERVAL_MS, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Wait interrupted after {} ms budget", timeoutMs);
                return false;
            }
        }
    }
}
