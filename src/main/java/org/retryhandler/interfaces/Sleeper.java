package org.retryhandler.interfaces;

public interface Sleeper {

    /** Blocks the calling thread for the given number of milliseconds. */
    void sleep(long millis) throws InterruptedException;
}
