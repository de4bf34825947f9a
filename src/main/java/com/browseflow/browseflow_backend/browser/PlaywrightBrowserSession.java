package com.browseflow.browseflow_backend.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PlaywrightBrowserSession implements BrowserSession {

    private final String browserType;
    private final boolean headless;

    private Playwright playwright;
    private Browser browser;
    private BrowserContext browserContext;
    private PlaywrightBrowserPage page;

    public PlaywrightBrowserSession(String browserType, boolean headless) {
        this.browserType = browserType;
        this.headless = headless;
    }

    @Override
    public synchronized BrowserPage open() {
        if (page != null) return page;
        playwright = Playwright.create();
        browser = resolveType(playwright).launch(new BrowserType.LaunchOptions().setHeadless(headless));
        browserContext = browser.newContext();
        page = new PlaywrightBrowserPage(browserContext.newPage());
        log.info("Launched {} browser (headless={})", browserType, headless);
        return page;
    }

    @Override
    public synchronized boolean isOpen() {
        return page != null;
    }

    @Override
    public synchronized void close() {
        if (playwright == null) return;
        try {
            // Closing Playwright tears down browser, context and page with it
            playwright.close();
        } catch (PlaywrightException e) {
            log.warn("Browser did not close cleanly: {}", e.getMessage());
        } finally {
            playwright = null;
            browser = null;
            browserContext = null;
            page = null;
        }
    }

    private BrowserType resolveType(Playwright pw) {
        return switch (browserType == null ? "chromium" : browserType.toLowerCase()) {
            case "firefox" -> pw.firefox();
            case "webkit"  -> pw.webkit();
            default        -> pw.chromium();
        };
    }
}
