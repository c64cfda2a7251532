package io.datalogger.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.datalogger.core.AckToken;
import io.datalogger.core.Batch;
import io.datalogger.core.InboundMessage;
import io.datalogger.core.Reading;
import io.datalogger.decode.DecodeException;
import io.datalogger.decode.Decoder;
import io.datalogger.decode.RejectLog;
import io.datalogger.forward.DeliveryReport;
import io.datalogger.forward.ForwardException;
import io.datalogger.forward.Forwarder;
import io.datalogger.metrics.Metrics;
import io.datalogger.mqtt.BrokerSession;
import io.datalogger.mqtt.InboundChannel;
import io.datalogger.queue.DurableQueue;
import io.datalogger.queue.FailureReason;
import io.datalogger.queue.QueueStorageException;
import io.datalogger.retry.RetryPolicy;
import io.datalogger.retry.RetryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Broker session -> decoder -> durable queue -> forwarder, with broker acknowledgements issued
 * only once a record has been delivered or dead-lettered.
 *
 * <p>One intake thread drains the {@link InboundChannel}, decodes and enqueues. A small pool of
 * forward threads selects batches from the queue and posts them. The queue is the only state the
 * two sides share; the map of outstanding ack tokens is guarded by {@code ackLock} so a token is
 * always registered before its record can be selected.
 *
 * <p>Queue writes that fail are retried under {@code storageRetry} until they commit or the
 * pipeline stops. A message whose enqueue keeps failing therefore stays in intake, unacknowledged,
 * and holds back the messages behind it.
 */
public class RelayPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayPipeline.class);

    static final String INTAKE = "intake";
    static final String FORWARD_PREFIX = "forward-";

    private final BrokerSession session;
    private final InboundChannel channel;
    private final Decoder decoder;
    private final RejectLog rejectLog;
    private final DurableQueue queue;
    private final Forwarder forwarder;
    private final Metrics metrics;
    private final Clock clock;
    private final int batchSize;
    private final long flushMillis;
    private final int concurrency;
    private final Duration stopTimeout;
    private final RetryPolicy storageRetry;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean handlerInstalled = new AtomicBoolean(false);
    private final Object ackLock = new Object();
    private final Map<Long, AckToken> pendingAcks = new HashMap<>();
    private final Map<String, CycleState> states = new ConcurrentHashMap<>();
    private final List<Thread> threads = new ArrayList<>();

    private final Meter inMeter;
    private final Meter rejectedMeter;
    private final Meter enqueueFailedMeter;
    private final Meter deliveredMeter;
    private final Meter failedMeter;
    private final Timer decodeTimer;
    private final Timer forwardTimer;
    private final Histogram batchSizes;
    private final Counter ackCounter;
    private final Counter deadLetterCounter;

    RelayPipeline(BrokerSession session, InboundChannel channel, Decoder decoder, RejectLog rejectLog,
                  DurableQueue queue, Forwarder forwarder, Metrics metrics, Clock clock,
                  int batchSize, long flushMillis, int concurrency, Duration stopTimeout, RetryPolicy storageRetry) {
        this.session = Objects.requireNonNull(session, "session");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.rejectLog = rejectLog == null ? RejectLog.discarding() : rejectLog;
        this.queue = Objects.requireNonNull(queue, "queue");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.batchSize = Math.max(1, batchSize);
        this.flushMillis = Math.max(0, flushMillis);
        this.concurrency = Math.max(1, concurrency);
        this.stopTimeout = stopTimeout;
        this.storageRetry = Objects.requireNonNull(storageRetry, "storageRetry");

        this.inMeter = metrics.meter(Metrics.INBOUND_RATE);
        this.rejectedMeter = metrics.meter(Metrics.DECODE_REJECTED);
        this.enqueueFailedMeter = metrics.meter(Metrics.ENQUEUE_FAILED);
        this.deliveredMeter = metrics.meter(Metrics.FORWARD_DELIVERED);
        this.failedMeter = metrics.meter(Metrics.FORWARD_FAILED);
        this.decodeTimer = metrics.timer(Metrics.DECODE_TIME);
        this.forwardTimer = metrics.timer(Metrics.FORWARD_TIME);
        this.batchSizes = metrics.histogram(Metrics.FORWARD_BATCH_SIZE);
        this.ackCounter = metrics.counter(Metrics.ACK_COUNT);
        this.deadLetterCounter = metrics.counter(Metrics.DEAD_LETTER_COUNT);
        metrics.gauge(Metrics.QUEUE_PENDING, queue::pendingCount);
        metrics.gauge(Metrics.QUEUE_SIZE, queue::size);
        metrics.gauge(Metrics.CHANNEL_DEPTH, channel::size);
        metrics.gauge(Metrics.PENDING_ACKS, this::pendingAckCount);

        states.put(INTAKE, CycleState.IDLE);
        for (int i = 0; i < this.concurrency; i++) states.put(FORWARD_PREFIX + i, CycleState.IDLE);
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) return;
        // records a previous run left in flight (stopped mid-send or mid-write) go back to pending
        int returned = queue.recover();
        if (returned > 0) log.info("Returned {} in-flight record(s) to pending", returned);
        if (handlerInstalled.compareAndSet(false, true)) session.onMessage(channel);
        threads.clear();
        Thread intake = new Thread(this::runIntake, "relay-intake");
        threads.add(intake);
        for (int i = 0; i < concurrency; i++) {
            String name = FORWARD_PREFIX + i;
            threads.add(new Thread(() -> runForward(name), "relay-" + name));
        }
        threads.forEach(Thread::start);
        log.info("Relay pipeline started: batch size {}, flush {} ms, {} forward worker(s)", batchSize, flushMillis, concurrency);
    }

    /** Stops intake and forwarding without tearing down threads. Inbound messages back up into the broker. */
    public void pause() {
        if (paused.compareAndSet(false, true)) log.info("Relay pipeline paused");
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) log.info("Relay pipeline resumed");
    }

    /**
     * Graceful stop: intake ends first, then forward workers finish the request they are in.
     * Nothing is discarded; unacknowledged messages are redelivered by the broker and records
     * still in the queue are picked up on the next start.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) return;
        long deadline = System.nanoTime() + stopTimeout.toNanos();
        for (Thread t : threads) {
            long left = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                t.join(Math.max(1, left));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (t.isAlive()) {
                log.warn("{} did not finish within {} ms; interrupting", t.getName(), stopTimeout.toMillis());
                t.interrupt();
            }
        }
        log.info("Relay pipeline stopped; {} record(s) pending, {} acknowledgement(s) outstanding",
                queue.pendingCount(), pendingAckCount());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() { return running.get(); }
    public boolean isPaused() { return paused.get(); }

    public CycleState stateOf(String worker) {
        CycleState s = states.get(worker);
        if (s == null) throw new IllegalArgumentException("unknown worker '" + worker + "'");
        return s;
    }

    /** Worker name to current state, intake first. */
    public Map<String, CycleState> states() {
        Map<String, CycleState> out = new LinkedHashMap<>();
        out.put(INTAKE, states.get(INTAKE));
        for (int i = 0; i < concurrency; i++) out.put(FORWARD_PREFIX + i, states.get(FORWARD_PREFIX + i));
        return Collections.unmodifiableMap(out);
    }

    public int pendingAckCount() {
        synchronized (ackLock) {
            return pendingAcks.size();
        }
    }

    public DurableQueue queue() { return queue; }
    public BrokerSession session() { return session; }
    public Metrics metrics() { return metrics; }

    // ---- intake ----

    private void runIntake() {
        while (running.get()) {
            if (paused.get()) { sleepQuiet(5); continue; }
            Optional<InboundMessage> next;
            try {
                next = channel.poll(50, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (next.isEmpty()) continue;
            inMeter.mark();
            try {
                handleInbound(next.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Intake failed for message on {}; left unacknowledged", next.get().topic(), e);
            } finally {
                states.put(INTAKE, CycleState.IDLE);
            }
        }
    }

    void handleInbound(InboundMessage msg) throws InterruptedException {
        states.put(INTAKE, CycleState.DECODING);
        Reading reading;
        try (Timer.Context ignored = decodeTimer.time()) {
            reading = decoder.decode(msg.topic(), msg.payload(), msg.receivedAt());
        } catch (DecodeException e) {
            rejectedMeter.mark();
            log.warn("Dropping undecodable message on {}: {}", msg.topic(), e.getMessage());
            rejectLog.reject(msg, e);
            acknowledge(msg.ackToken());
            return;
        }

        states.put(INTAKE, CycleState.QUEUING);
        RetryState retry = new RetryState(storageRetry);
        while (true) {
            try {
                while (!queue.awaitCapacity(Duration.ofMillis(250))) {
                    if (!running.get()) {
                        log.info("Stopping while queue is full; message on {} left for broker redelivery", msg.topic());
                        return;
                    }
                    log.debug("Queue full ({} records); holding intake", queue.size());
                }
                synchronized (ackLock) {
                    long seq = queue.enqueue(reading);
                    pendingAcks.put(seq, msg.ackToken());
                }
                return;
            } catch (QueueStorageException e) {
                enqueueFailedMeter.mark();
                long delay = retry.onFailure(e);
                if (delay < 0 || !running.get()) {
                    log.error("Could not persist reading from {}; leaving it unacknowledged", msg.topic(), e);
                    return;
                }
                log.warn("Could not persist reading from {}, retrying in {} ms: {}", msg.topic(), delay, e.getMessage());
                Thread.sleep(delay);
                retry.onAttempt();
            }
        }
    }

    // ---- forwarding ----

    private void runForward(String name) {
        while (running.get()) {
            if (paused.get()) { sleepQuiet(5); continue; }
            try {
                states.put(name, CycleState.BATCHING);
                Batch batch = nextBatch();
                if (batch.isEmpty()) continue;
                forwardBatch(name, batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Batch selection failed in {}", name, e);
                sleepQuiet(Math.max(100, flushMillis));
            } finally {
                states.put(name, CycleState.IDLE);
            }
        }
    }

    /** Empty when neither the size nor the age threshold has been reached yet. */
    private Batch nextBatch() throws InterruptedException {
        int pending = queue.pendingCount();
        if (pending == 0) {
            queue.awaitRecords(Duration.ofMillis(Math.max(10, flushMillis)));
            return Batch.empty();
        }
        if (pending < batchSize) {
            Optional<Instant> oldest = queue.oldestPendingAt();
            long age = oldest.map(t -> Duration.between(t, clock.instant()).toMillis()).orElse(0L);
            if (age < flushMillis) {
                queue.awaitRecords(Duration.ofMillis(Math.max(1, flushMillis - age)));
                return Batch.empty();
            }
        }
        Batch batch = queue.peekBatch(batchSize);
        if (batch.isEmpty()) {
            // head of the queue is waiting out a retry backoff
            Thread.sleep(Math.max(1, Math.min(flushMillis, 100)));
        }
        return batch;
    }

    void forwardBatch(String name, Batch batch) throws InterruptedException {
        states.put(name, CycleState.FORWARDING);
        batchSizes.update(batch.size());
        DeliveryReport report;
        try (Timer.Context ignored = forwardTimer.time()) {
            report = forwarder.send(batch);
        } catch (ForwardException e) {
            failedMeter.mark(batch.size());
            handleFailure(name, batch, e.isPermanent()
                    ? FailureReason.permanentFailure(e.getMessage())
                    : FailureReason.transientFailure(e.getMessage()));
            return;
        } catch (RuntimeException e) {
            failedMeter.mark(batch.size());
            log.error("{}: unexpected error sending sequences {}..{}", name, batch.firstSequence(), batch.lastSequence(), e);
            handleFailure(name, batch, FailureReason.transientFailure("unexpected error: " + e));
            return;
        }

        states.put(name, CycleState.ACKING);
        List<Long> delivered = report.delivered();
        Optional<Boolean> stored = withStorageRetry(name + ": marking sequences " + batch.firstSequence() + ".." + batch.lastSequence() + " delivered",
                () -> {
                    queue.markDelivered(delivered);
                    return Boolean.TRUE;
                });
        deliveredMeter.mark(delivered.size());
        if (stored.isEmpty()) return;
        for (Long seq : delivered) acknowledgeRecord(seq);
        log.debug("{} delivered sequences {}..{} ({} records)", name, batch.firstSequence(), batch.lastSequence(), batch.size());
    }

    private void handleFailure(String name, Batch batch, FailureReason reason) throws InterruptedException {
        int dead = 0;
        for (Long seq : batch.sequences()) {
            Optional<Boolean> movedToDeadLetter = withStorageRetry(name + ": recording failure of record " + seq,
                    () -> queue.markFailed(seq, reason));
            if (movedToDeadLetter.isEmpty()) return;
            if (movedToDeadLetter.get()) {
                dead++;
                deadLetterCounter.inc();
                acknowledgeRecord(seq);
            }
        }
        if (reason.permanent()) {
            log.error("{}: collector rejected sequences {}..{}; {} record(s) dead-lettered: {}",
                    name, batch.firstSequence(), batch.lastSequence(), dead, reason.message());
        } else if (dead > 0) {
            log.error("{}: {} record(s) exhausted retries and were dead-lettered: {}", name, dead, reason.message());
        } else {
            log.warn("{}: transient failure for sequences {}..{}, will retry: {}",
                    name, batch.firstSequence(), batch.lastSequence(), reason.message());
        }
    }

    /**
     * Runs a queue write until it commits. Empty when the pipeline stopped first; the records
     * involved stay in flight and return to pending on the next start.
     */
    private <T> Optional<T> withStorageRetry(String what, Supplier<T> write) throws InterruptedException {
        RetryState retry = new RetryState(storageRetry);
        while (true) {
            try {
                return Optional.of(write.get());
            } catch (QueueStorageException e) {
                long delay = retry.onFailure(e);
                if (delay < 0 || !running.get()) {
                    log.error("{} failed; leaving the records in flight until the next start", what, e);
                    return Optional.empty();
                }
                log.warn("{} failed, retrying in {} ms: {}", what, delay, e.getMessage());
                Thread.sleep(delay);
                retry.onAttempt();
            }
        }
    }

    private void acknowledgeRecord(long seq) {
        AckToken token;
        synchronized (ackLock) {
            token = pendingAcks.remove(seq);
        }
        // records recovered after a restart or replayed from dead letters carry no token
        if (token != null) acknowledge(token);
    }

    private void acknowledge(AckToken token) {
        session.acknowledge(token);
        ackCounter.inc();
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }
}
