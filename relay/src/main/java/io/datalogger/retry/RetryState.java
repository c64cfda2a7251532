package io.datalogger.retry;

import java.util.Objects;

/**
 * Attempt counter driven by a {@link RetryPolicy}. Callers report outcomes and read back the
 * delay to wait; the state machine itself never sleeps, so it can be exercised without timing.
 *
 * <pre>
 * READY --failure(retryable)--> BACKING_OFF --attempt--> READY
 *   |                                |
 *   +--failure(exhausted)--> EXHAUSTED <--+
 * any --success--> READY (attempts reset)
 * </pre>
 */
public final class RetryState {
    public enum Phase { READY, BACKING_OFF, EXHAUSTED }

    private final RetryPolicy policy;
    private int failures;
    private long currentDelayMillis;
    private Phase phase = Phase.READY;

    public RetryState(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Records a failed attempt.
     *
     * @return the delay before the next attempt, or -1 if retries are exhausted
     */
    public synchronized long onFailure(Exception cause) {
        if (phase == Phase.EXHAUSTED) return -1;
        failures++;
        if (policy.shouldRetry(failures, cause)) {
            currentDelayMillis = policy.backoffMillis(failures);
            phase = Phase.BACKING_OFF;
            return currentDelayMillis;
        }
        currentDelayMillis = -1;
        phase = Phase.EXHAUSTED;
        return -1;
    }

    /** Backoff elapsed, a new attempt is starting. */
    public synchronized void onAttempt() {
        if (phase == Phase.EXHAUSTED) throw new IllegalStateException("retries exhausted after " + failures + " failures");
        phase = Phase.READY;
    }

    public synchronized void onSuccess() {
        failures = 0;
        currentDelayMillis = 0;
        phase = Phase.READY;
    }

    public synchronized Phase phase() { return phase; }
    public synchronized int failures() { return failures; }
    public synchronized long currentDelayMillis() { return currentDelayMillis; }
}
