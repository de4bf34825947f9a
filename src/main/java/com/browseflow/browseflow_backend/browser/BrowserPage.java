package com.browseflow.browseflow_backend.browser;

/**
 * The browser operations the engine and built-in handlers rely on.
 * Wait methods return false on timeout instead of throwing so callers can report
 * the observed state themselves.
 */
public interface BrowserPage {

    String url();

    boolean isVisible(String selector);

    Object evaluate(String expression);

    boolean waitForSelector(String selector, long timeoutMs);

    /** Pattern wrapped in slashes is a regex, anything else is a substring. */
    boolean waitForUrl(String pattern, long timeoutMs);

    boolean waitForFunction(String expression, long timeoutMs);

    void navigate(String url, long timeoutMs);

    void click(String selector, long timeoutMs);

    void fill(String selector, String text, long timeoutMs);

    /** Javascript truthiness for values returned by {@link #evaluate(String)}. */
    static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0d;
        if (value instanceof String s) return !s.isEmpty();
        return true;
    }
}
