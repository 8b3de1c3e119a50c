package org.retryhandler.model;

/**
 * States of a single retry sequence.
 * <ul>
 *   <li>{@code ATTEMPTING} - the action is about to run (initial state).</li>
 *   <li>{@code FAILED} - the last attempt failed and more attempts may follow.</li>
 *   <li>{@code SUCCEEDED} - an attempt completed; terminal.</li>
 *   <li>{@code STOPPED} - the error callback asked to stop, or the wait was interrupted; terminal.</li>
 *   <li>{@code EXHAUSTED} - every permitted attempt failed; terminal.</li>
 * </ul>
 */
public enum RetryState {
    ATTEMPTING,
    FAILED,
    SUCCEEDED,
    STOPPED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == STOPPED || this == EXHAUSTED;
    }
}
