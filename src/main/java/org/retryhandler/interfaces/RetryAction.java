package org.retryhandler.interfaces;

/**
 * A zero-argument operation run under retry. Must be safe to invoke repeatedly.
 */
@FunctionalInterface
public interface RetryAction {

    void run() throws Exception;
}
