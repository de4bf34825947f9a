package com.browseflow.browseflow_backend.engine;

/** A wait or retry condition was not met in time. The message carries expected and observed state. */
public class WaitConditionException extends RuntimeException {

    public WaitConditionException(String message) {
        super(message);
    }
}
