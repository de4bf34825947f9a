package com.browseflow.browseflow_backend.browser;

public final class SelectorTypes {

    public static final String CSS   = "css";
    public static final String XPATH = "xpath";
    public static final String TEXT  = "text";

    private SelectorTypes() {}

    /** Prefixes the selector with the engine name Playwright expects for the given type. */
    public static String toEngineSelector(String selector, String selectorType) {
        if (selector == null) return null;
        if (XPATH.equalsIgnoreCase(selectorType)) return "xpath=" + selector;
        if (TEXT.equalsIgnoreCase(selectorType)) return "text=" + selector;
        return selector;
    }

    public static String labelOf(String selectorType) {
        return selectorType == null || selectorType.isBlank() ? CSS : selectorType;
    }
}
