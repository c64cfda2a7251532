package io.datalogger.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Doubles the delay per attempt up to a cap. With jitter enabled the delay is drawn uniformly
 * from {@code [0, cappedDelay]} ("full jitter").
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final LongUnaryOperator jitter;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, LongUnaryOperator.identity());
    }

    ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, LongUnaryOperator jitter) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.jitter = jitter;
    }

    /** Full-jitter variant, e.g. {@code withFullJitter(Integer.MAX_VALUE, 1_000, 60_000)} for reconnects. */
    public static ExponentialBackoffRetryPolicy withFullJitter(int maxAttempts, long baseMillis, long maxMillis) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseMillis, maxMillis,
                cap -> ThreadLocalRandom.current().nextLong(cap + 1));
    }

    public int maxAttempts() { return maxAttempts; }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return jitter.applyAsLong(Math.min(delay, maxMillis));
    }
}
