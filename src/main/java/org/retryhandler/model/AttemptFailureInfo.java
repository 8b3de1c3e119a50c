package org.retryhandler.model;

import java.util.Objects;

/**
 * Details of one failed retry attempt, handed to the error callback.
 *
 * @param retryCount number of retries made so far, starting at 1 for the first retry
 * @param cause      the failure raised by that attempt
 */
public record AttemptFailureInfo(int retryCount, Exception cause) {

    public AttemptFailureInfo {
        if (retryCount < 1) {
            throw new IllegalArgumentException("retryCount must be >= 1: " + retryCount);
        }
        Objects.requireNonNull(cause, "cause");
    }
}
