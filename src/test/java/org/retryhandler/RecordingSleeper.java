package org.retryhandler;

import org.retryhandler.interfaces.Sleeper;

import java.util.ArrayList;
import java.util.List;

/** Test sleeper that records requested pauses instead of blocking. */
public final class RecordingSleeper implements Sleeper {

    private final List<Long> pauses = new ArrayList<>();

    @Override
    public void sleep(long millis) {
        pauses.add(millis);
    }

    public List<Long> pauses() {
        return pauses;
    }
}
