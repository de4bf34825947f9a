package com.browseflow.browseflow_backend.browser;

public interface BrowserSessionFactory {

    BrowserSession create();
}
