package com.browseflow.browseflow_backend.browser;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {

    @Value("${browseflow.browser.type:chromium}")
    private String browserType;

    @Value("${browseflow.browser.headless:true}")
    private boolean headless;

    // Sessions launch lazily, so creating one per queued execution is cheap
    @Override
    public BrowserSession create() {
        return new PlaywrightBrowserSession(browserType, headless);
    }
}
