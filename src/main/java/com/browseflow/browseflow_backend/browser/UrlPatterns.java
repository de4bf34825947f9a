package com.browseflow.browseflow_backend.browser;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class UrlPatterns {

    private UrlPatterns() {}

    // "/^https:\/\/.*\/done$/" is a regex, "/checkout" is a plain substring
    public static boolean matches(String url, String pattern) {
        if (url == null || pattern == null) return false;
        if (isRegex(pattern)) {
            try {
                return Pattern.compile(pattern.substring(1, pattern.length() - 1)).matcher(url).find();
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid URL pattern: " + pattern, e);
            }
        }
        return url.contains(pattern);
    }

    private static boolean isRegex(String pattern) {
        return pattern.length() > 2 && pattern.startsWith("/") && pattern.endsWith("/");
    }
}
