package org.retryhandler;

import org.retryhandler.model.AttemptFailureInfo;
import org.retryhandler.model.RetrySettings;
import org.retryhandler.model.RetryState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryModelTest {

    @Test
    void attemptFailureInfoRequiresPositiveCountAndCause() {
        AttemptFailureInfo info = new AttemptFailureInfo(1, new RuntimeException("x"));
        assertEquals(1, info.retryCount());
        assertEquals("x", info.cause().getMessage());

        assertThrows(IllegalArgumentException.class, () -> new AttemptFailureInfo(0, new RuntimeException()));
        assertThrows(NullPointerException.class, () -> new AttemptFailureInfo(1, null));
    }

    @Test
    void settingsValidation() {
        RetrySettings s = new RetrySettings(0, 0);
        assertEquals(0, s.maxRetries());
        assertEquals(0L, s.intervalMillis());

        assertThrows(IllegalArgumentException.class, () -> new RetrySettings(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new RetrySettings(0, -1));
    }

    @Test
    void terminalStates() {
        assertFalse(RetryState.ATTEMPTING.isTerminal());
        assertFalse(RetryState.FAILED.isTerminal());
        assertTrue(RetryState.SUCCEEDED.isTerminal());
        assertTrue(RetryState.STOPPED.isTerminal());
        assertTrue(RetryState.EXHAUSTED.isTerminal());
    }
}
