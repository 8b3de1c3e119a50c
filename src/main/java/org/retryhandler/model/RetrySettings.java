package org.retryhandler.model;

/**
 * Immutable retry configuration.
 *
 * @param maxRetries     retries after the initial attempt
 * @param intervalMillis pause between retries, in milliseconds
 */
public record RetrySettings(int maxRetries, long intervalMillis) {

    public RetrySettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (intervalMillis < 0) {
            throw new IllegalArgumentException("intervalMillis must be >= 0: " + intervalMillis);
        }
    }
}
