package org.retryhandler.model;

/** What an {@link org.retryhandler.interfaces.ErrorCallback} wants after a failed retry. */
public enum RetryDecision {
    CONTINUE,
    STOP
}
