package org.retryhandler.util;

import org.retryhandler.exception.AggregateRetryFailure;
import org.retryhandler.interfaces.ErrorCallback;
import org.retryhandler.interfaces.RetryAction;
import org.retryhandler.interfaces.RetryExecutor;
import org.retryhandler.interfaces.Sleeper;
import org.retryhandler.model.AttemptFailureInfo;
import org.retryhandler.model.RetryDecision;
import org.retryhandler.model.RetryState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * FixedIntervalRetryExecutor runs an action up to {@code maxRetries + 1} times,
 * pausing a fixed interval between retries.
 * <p>
 * Failure accounting:
 * <ul>
 *   <li>The initial failure is recorded silently: no callback, no pause.</li>
 *   <li>Every later failure is passed to the error callback (if any) with the
 *       1-based retry count; {@link RetryDecision#STOP} ends the sequence.</li>
 *   <li>A pause of {@code intervalMillis} follows a failed retry only while retries remain.</li>
 *   <li>On exhaustion without a callback an {@link AggregateRetryFailure} carries every failure.
 *       With a callback, or after an early stop, the call returns normally.</li>
 * </ul>
 * <b>SonarQube notes:</b>
 * <ul>
 *   <li>The executor is stateless; each call owns its failure list and counter, so a
 *       single instance can be shared between threads.</li>
 *   <li>Blocking on the calling thread is intentional; the sequence is strictly sequential.</li>
 *   <li>Only {@link Exception}s count as attempt failures; {@link Error}s propagate.</li>
 * </ul>
 */
public final class FixedIntervalRetryExecutor implements RetryExecutor {

    // Pause strategy between retries (ThreadSleeper outside of tests)
    private final Sleeper sleeper;

    public FixedIntervalRetryExecutor() {
        this(ThreadSleeper.INSTANCE);
    }

    /**
     * @param sleeper pause strategy used between retries
     */
    public FixedIntervalRetryExecutor(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public void execute(int maxRetries, long intervalMillis, RetryAction action, ErrorCallback errorCallback) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (intervalMillis < 0) {
            throw new IllegalArgumentException("intervalMillis must be >= 0: " + intervalMillis);
        }
        Objects.requireNonNull(action, "action");

        List<Exception> failures = new ArrayList<>();
        int activeRetries = 0;
        RetryState state = RetryState.ATTEMPTING;

        while (!state.isTerminal()) {
            if (state == RetryState.FAILED) {
                // previous attempt failed and budget remains
                state = RetryState.ATTEMPTING;
            }

            try {
                action.run();
                state = RetryState.SUCCEEDED;
            } catch (Exception e) {
                failures.add(e);
                state = RetryState.FAILED;
                System.err.println("[Retry] attempt " + failures.size() + "/" + ((long) maxRetries + 1)
                        + " failed (error: " + e + ")");

                if (activeRetries > 0) {
                    state = onRetryFailure(activeRetries, maxRetries, intervalMillis, failures, errorCallback);
                }
            }

            if (state == RetryState.FAILED) {
                if (activeRetries == maxRetries) {
                    state = RetryState.EXHAUSTED;
                } else {
                    activeRetries++;
                }
            }
        }

        switch (state) {
            case SUCCEEDED:
                if (!failures.isEmpty()) {
                    System.out.println("[Retry] succeeded after " + failures.size() + " failed attempt(s)");
                }
                return;
            case STOPPED:
                return;
            case EXHAUSTED:
                System.err.println("[Retry] gave up after " + failures.size() + " attempt(s)");
                if (errorCallback == null) {
                    throw new AggregateRetryFailure(failures);
                }
                return;
            default:
                throw new IllegalStateException("Unexpected retry state: " + state);
        }
    }

    /**
     * Handles a failed retry (not the initial attempt): reports it, then waits if
     * another retry will follow.
     *
     * @param failures failures so far; the last entry belongs to the current attempt
     * @return {@link RetryState#STOPPED} to end the sequence, otherwise {@link RetryState#FAILED}
     */
    private RetryState onRetryFailure(int activeRetries, int maxRetries, long intervalMillis,
                                      List<Exception> failures, ErrorCallback errorCallback) {
        Exception cause = failures.get(failures.size() - 1);
        if (errorCallback != null) {
            RetryDecision decision = errorCallback.onError(new AttemptFailureInfo(activeRetries, cause));
            if (decision == RetryDecision.STOP) {
                System.out.println("[Retry] stop requested by error callback at retry " + activeRetries);
                return RetryState.STOPPED;
            }
        }

        if (activeRetries < maxRetries) {
            System.out.println("[Retry] retry " + (activeRetries + 1) + " in " + intervalMillis + "ms");
            try {
                sleeper.sleep(intervalMillis);
            } catch (InterruptedException ie) {
                // Restore interrupt flag; no further attempts on an interrupted thread
                Thread.currentThread().interrupt();
                System.err.println("[Retry] interrupted while waiting; abandoning remaining retries");
                if (errorCallback == null) {
                    AggregateRetryFailure failure = new AggregateRetryFailure(failures);
                    failure.addSuppressed(ie);
                    throw failure;
                }
                return RetryState.STOPPED;
            }
        }
        return RetryState.FAILED;
    }
}
