package org.retryhandler.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when every attempt of a retry sequence failed and no error callback was
 * registered to receive the failures.
 * <p>
 * {@link #getFailures()} lists every failure in attempt order. The most recent one
 * is also the {@linkplain #getCause() cause}, and all of them are attached as
 * suppressed exceptions so they show up in stack traces.
 * </p>
 */
public final class AggregateRetryFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // ArrayList copy so the list survives serialization with the exception
    private final List<Exception> failures;

    public AggregateRetryFailure(List<Exception> failures) {
        super(message(failures), failures.isEmpty() ? null : failures.get(failures.size() - 1));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
        for (Exception e : this.failures) {
            if (e != getCause()) {
                addSuppressed(e);
            }
        }
    }

    /** @return the failures in the order they happened (unmodifiable) */
    public List<Exception> getFailures() {
        return failures;
    }

    /** @return how many times the action was invoked */
    public int attempts() {
        return failures.size();
    }

    private static String message(List<Exception> failures) {
        if (failures.isEmpty()) {
            return "Retry failed with no recorded failures";
        }
        Exception last = failures.get(failures.size() - 1);
        return "Retry failed after " + failures.size() + " attempt(s); last error: " + last;
    }
}
