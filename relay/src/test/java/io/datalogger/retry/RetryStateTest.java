package io.datalogger.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryStateTest {
    @Test
    void backs_off_with_growing_delay_then_exhausts() {
        RetryState s = new RetryState(new ExponentialBackoffRetryPolicy(3, 100, 1_000));
        assertEquals(RetryState.Phase.READY, s.phase());

        assertEquals(100, s.onFailure(new RuntimeException("1")));
        assertEquals(RetryState.Phase.BACKING_OFF, s.phase());
        s.onAttempt();
        assertEquals(RetryState.Phase.READY, s.phase());
        assertEquals(200, s.onFailure(new RuntimeException("2")));
        s.onAttempt();

        assertEquals(-1, s.onFailure(new RuntimeException("3")));
        assertEquals(RetryState.Phase.EXHAUSTED, s.phase());
        assertEquals(3, s.failures());
        assertThrows(IllegalStateException.class, s::onAttempt);
        assertEquals(-1, s.onFailure(new RuntimeException("4")));
    }

    @Test
    void success_resets_the_counter() {
        RetryState s = new RetryState(new ExponentialBackoffRetryPolicy(5, 100, 1_000));
        s.onFailure(new RuntimeException());
        s.onAttempt();
        s.onFailure(new RuntimeException());
        s.onSuccess();
        assertEquals(0, s.failures());
        assertEquals(RetryState.Phase.READY, s.phase());
        assertEquals(100, s.onFailure(new RuntimeException()));
    }

    @Test
    void reconnect_delays_are_capped() {
        RetryState s = new RetryState(new ExponentialBackoffRetryPolicy(Integer.MAX_VALUE, 1_000, 60_000));
        long last = 0;
        for (int i = 0; i < 10; i++) {
            long d = s.onFailure(new RuntimeException());
            assertTrue(d >= last);
            assertTrue(d <= 60_000);
            last = d;
            s.onAttempt();
        }
        assertEquals(60_000, last);
    }
}
