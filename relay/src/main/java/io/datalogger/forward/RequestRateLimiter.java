package io.datalogger.forward;

import java.util.concurrent.TimeUnit;

/**
 * Spaces collector requests at least {@code 1 / permitsPerSecond} apart across all forward workers.
 * {@link #acquire()} reserves the next free slot under the lock and sleeps outside it, so a worker
 * waiting for its slot never holds up another worker's reservation.
 */
public class RequestRateLimiter {
    private final long intervalNanos;
    private long nextSlotNanos;

    /** {@code permitsPerSecond <= 0} disables limiting. */
    public RequestRateLimiter(long permitsPerSecond) {
        this.intervalNanos = permitsPerSecond <= 0 ? 0 : TimeUnit.SECONDS.toNanos(1) / permitsPerSecond;
        this.nextSlotNanos = System.nanoTime();
    }

    public static RequestRateLimiter unlimited() { return new RequestRateLimiter(0); }

    /** Blocks the calling worker until its request slot comes up. */
    public void acquire() throws InterruptedException {
        if (intervalNanos == 0) return;
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = Math.max(nextSlotNanos, now);
            nextSlotNanos = slot + intervalNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) TimeUnit.NANOSECONDS.sleep(waitNanos);
    }
}
