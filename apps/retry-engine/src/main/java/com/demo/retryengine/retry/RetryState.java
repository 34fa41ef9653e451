package com.demo.retryengine.retry;

/**
 * States of a single execute call.
 *
 * ATTEMPTING -> SUCCESS (terminal)
 * ATTEMPTING -> RETRYING -> ATTEMPTING
 * ATTEMPTING -> FAILED (terminal)
 */
public enum RetryState {
    ATTEMPTING,
    RETRYING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
