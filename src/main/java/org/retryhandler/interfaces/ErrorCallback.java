package org.retryhandler.interfaces;

import org.retryhandler.model.AttemptFailureInfo;
import org.retryhandler.model.RetryDecision;

/**
 * Receives every failed retry attempt (never the initial attempt) and decides
 * whether the executor keeps going.
 */
@FunctionalInterface
public interface ErrorCallback {

    /**
     * @param info retry count and cause of the failed attempt
     * @return {@link RetryDecision#STOP} to abandon the remaining retries
     */
    RetryDecision onError(AttemptFailureInfo info);
}
