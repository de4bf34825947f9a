package com.browseflow.browseflow_backend.model.context;

import com.browseflow.browseflow_backend.browser.BrowserPage;
import com.browseflow.browseflow_backend.browser.BrowserSession;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution-scoped state shared by every node of one run: a key/value data store,
 * variable bindings (by node id or by a user-chosen name), and the active browser page.
 */
public class ExecutionContext {

    public static final String KEY_EXECUTION_ID        = "executionId";
    public static final String KEY_BATCH_ID            = "batchId";
    public static final String KEY_PARALLEL_EXECUTION  = "isParallelExecution";

    private final String executionId;
    private final String batchId;
    private final boolean parallelExecution;
    private final BrowserSession browserSession;

    private final Map<String, Object> data = new ConcurrentHashMap<>();
    private final Map<String, Object> variables = new ConcurrentHashMap<>();
    private final AtomicBoolean pauseWarningLogged = new AtomicBoolean(false);

    private volatile BrowserPage page;
    private volatile ExecutionControl control;

    public ExecutionContext(String executionId, String batchId, boolean parallelExecution,
                            BrowserSession browserSession) {
        this.executionId = executionId;
        this.batchId = batchId;
        this.parallelExecution = parallelExecution;
        this.browserSession = browserSession;
        seedData();
    }

    private void seedData() {
        data.put(KEY_EXECUTION_ID, executionId);
        data.put(KEY_PARALLEL_EXECUTION, parallelExecution);
        if (batchId != null) data.put(KEY_BATCH_ID, batchId);
    }

    public Object getData(String key) {
        return data.get(key);
    }

    public void setData(String key, Object value) {
        if (value == null) data.remove(key);
        else data.put(key, value);
    }

    public Object getVariable(String key) {
        return variables.get(key);
    }

    public void setVariable(String key, Object value) {
        if (value == null) variables.remove(key);
        else variables.put(key, value);
    }

    public BrowserPage getPage() {
        return page;
    }

    public void setPage(BrowserPage page) {
        this.page = page;
    }

    public BrowserSession getBrowserSession() {
        return browserSession;
    }

    public ExecutionControl getControl() {
        return control;
    }

    public void setControl(ExecutionControl control) {
        this.control = control;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getBatchId() {
        return batchId;
    }

    public boolean isParallelExecution() {
        return parallelExecution;
    }

    /** Returns true only for the first caller in this run. */
    public boolean markPauseWarningLogged() {
        return pauseWarningLogged.compareAndSet(false, true);
    }
}
