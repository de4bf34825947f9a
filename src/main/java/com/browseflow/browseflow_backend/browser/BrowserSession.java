package com.browseflow.browseflow_backend.browser;

/** One isolated browser instance owned by a single execution. */
public interface BrowserSession extends AutoCloseable {

    /** Launches the browser on first call and returns its page; later calls return the same page. */
    BrowserPage open();

    boolean isOpen();

    @Override
    void close();
}
