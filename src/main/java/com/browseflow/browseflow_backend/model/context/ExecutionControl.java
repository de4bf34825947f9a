package com.browseflow.browseflow_backend.model.context;

import com.browseflow.browseflow_backend.model.domain.Workflow;

/**
 * Callbacks a node handler may use to steer the execution that is running it.
 * Implemented by the executor and handed to handlers through {@link ExecutionContext}.
 */
public interface ExecutionControl {

    /**
     * Blocks the calling (execution) thread until the run is continued or stopped.
     * Throws {@code ExecutionStoppedException} if the run is stopped while paused.
     */
    void requestPause(String nodeId, PauseReason reason);

    /** Runs the given nodes in control-flow order inside the current execution. */
    void runSubWorkflow(Workflow subWorkflow) throws Exception;

    Workflow getWorkflow();

    boolean isStopRequested();
}
