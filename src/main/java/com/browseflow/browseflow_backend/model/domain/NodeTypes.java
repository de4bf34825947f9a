package com.browseflow.browseflow_backend.model.domain;

/** Type tags the engine itself understands. Handlers may register any other tag. */
public final class NodeTypes {

    public static final String START          = "start";
    public static final String OPEN_BROWSER   = "openBrowser";
    public static final String NAVIGATION     = "navigation";
    public static final String ACTION         = "action";
    public static final String TYPE           = "type";
    public static final String WAIT           = "wait";
    public static final String RUN_REUSABLE   = "runReusable";

    // Reusable scope markers
    public static final String REUSABLE_ENTRY = "reusable.reusable";
    public static final String REUSABLE_END   = "reusable.end";

    private NodeTypes() {}

    public static boolean isReusableMarker(String type) {
        return REUSABLE_ENTRY.equals(type) || REUSABLE_END.equals(type);
    }
}
