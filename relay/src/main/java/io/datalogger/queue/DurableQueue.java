package io.datalogger.queue;

import io.datalogger.core.Batch;
import io.datalogger.core.DeadLetter;
import io.datalogger.core.Reading;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Crash-durable buffer of readings awaiting delivery, ordered by sequence number.
 *
 * <p>All operations are serialized; a record handed out by {@link #peekBatch(int)} is IN_FLIGHT and
 * will not be selected again until it is marked delivered or failed.
 */
public interface DurableQueue extends AutoCloseable {

    /** Persists the reading and returns its sequence number. Returns only after the write is committed. */
    long enqueue(Reading reading);

    /**
     * Selects up to {@code maxSize} pending records in ascending sequence order and marks them in flight.
     * Selection stops at the first pending record that is still waiting out its retry backoff.
     */
    Batch peekBatch(int maxSize);

    /** Removes delivered records. Unknown sequence numbers are ignored. */
    void markDelivered(Collection<Long> sequences);

    /**
     * Records a failed attempt.
     *
     * @return true if the record was moved to the dead-letter store
     */
    boolean markFailed(long sequence, FailureReason reason);

    /** Returns every in-flight record to pending. Used at startup after an unclean stop. */
    int recover();

    /** Pending records, including those waiting out a backoff. */
    int pendingCount();

    /** All records held, pending and in flight. */
    int size();

    int remainingCapacity();

    /** Enqueue time of the lowest pending record. */
    Optional<Instant> oldestPendingAt();

    /** Waits until the queue has room or the timeout elapses. */
    boolean awaitCapacity(Duration timeout) throws InterruptedException;

    /** Waits until the queue changes (enqueue or a record returned to pending) or the timeout elapses. */
    void awaitRecords(Duration timeout) throws InterruptedException;

    List<DeadLetter> deadLetters(int limit);

    int deadLetterCount();

    /** Moves up to {@code limit} dead letters back to pending under new sequence numbers. */
    int replayDeadLetters(int limit);

    @Override
    void close();
}
