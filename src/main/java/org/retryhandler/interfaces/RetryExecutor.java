package org.retryhandler.interfaces;

import org.retryhandler.model.RetrySettings;

import java.util.Objects;

public interface RetryExecutor {

    /**
     * Runs the action, retrying it up to {@code maxRetries} more times with a fixed
     * pause between attempts.
     *
     * @param maxRetries     retries after the initial attempt (0 means a single attempt)
     * @param intervalMillis pause between retries, in milliseconds
     * @param action         operation to run
     * @throws org.retryhandler.exception.AggregateRetryFailure if every attempt failed
     */
    default void execute(int maxRetries, long intervalMillis, RetryAction action) {
        execute(maxRetries, intervalMillis, action, null);
    }

    /**
     * Runs the action with retry, reporting each failed retry to {@code errorCallback}.
     * <p>
     * When a callback is given the callback is the only failure channel: this method
     * returns normally even if every attempt failed.
     * </p>
     *
     * @param errorCallback may be {@code null}, in which case exhaustion raises
     *                      {@link org.retryhandler.exception.AggregateRetryFailure}
     */
    void execute(int maxRetries, long intervalMillis, RetryAction action, ErrorCallback errorCallback);

    default void execute(RetrySettings settings, RetryAction action) {
        execute(settings, action, null);
    }

    default void execute(RetrySettings settings, RetryAction action, ErrorCallback errorCallback) {
        Objects.requireNonNull(settings, "settings");
        execute(settings.maxRetries(), settings.intervalMillis(), action, errorCallback);
    }
}
