package io.datalogger.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A reading held by the durable queue together with its ordering key and delivery bookkeeping.
 */
public record QueuedRecord(long sequence,
                           Reading reading,
                           DeliveryState state,
                           int attempts,
                           String lastError,
                           Instant enqueuedAt,
                           Instant nextAttemptAt) implements Comparable<QueuedRecord> {
    public QueuedRecord {
        Objects.requireNonNull(reading, "reading");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        Objects.requireNonNull(nextAttemptAt, "nextAttemptAt");
    }

    public QueuedRecord withState(DeliveryState newState) {
        return new QueuedRecord(sequence, reading, newState, attempts, lastError, enqueuedAt, nextAttemptAt);
    }

    @Override
    public int compareTo(QueuedRecord o) {
        return Long.compare(sequence, o.sequence);
    }
}
