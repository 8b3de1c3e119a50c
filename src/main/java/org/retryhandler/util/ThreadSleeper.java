package org.retryhandler.util;

import org.retryhandler.interfaces.Sleeper;

/** {@link Sleeper} backed by {@link Thread#sleep(long)}. */
public final class ThreadSleeper implements Sleeper {

    public static final ThreadSleeper INSTANCE = new ThreadSleeper();

    private ThreadSleeper() {
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
