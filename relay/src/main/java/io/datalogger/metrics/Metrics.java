package io.datalogger.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.function.Supplier;

public class Metrics {
    public static final String INBOUND_RATE = "relay.inbound.rate";
    public static final String DECODE_TIME = "relay.decode.time";
    public static final String DECODE_REJECTED = "relay.decode.rejected";
    public static final String ENQUEUE_FAILED = "relay.enqueue.failed";
    public static final String FORWARD_TIME = "relay.forward.time";
    public static final String FORWARD_DELIVERED = "relay.forward.delivered";
    public static final String FORWARD_FAILED = "relay.forward.failed";
    public static final String FORWARD_BATCH_SIZE = "relay.forward.batch.size";
    public static final String ACK_COUNT = "relay.ack.count";
    public static final String DEAD_LETTER_COUNT = "relay.deadletter.count";
    public static final String QUEUE_PENDING = "relay.queue.pending";
    public static final String QUEUE_SIZE = "relay.queue.size";
    public static final String CHANNEL_DEPTH = "relay.channel.depth";
    public static final String PENDING_ACKS = "relay.ack.pending";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }

    /** Registers a gauge, replacing any gauge previously registered under the same name. */
    public <T> void gauge(String name, Supplier<T> supplier) {
        registry.remove(name);
        registry.register(name, (Gauge<T>) supplier::get);
    }
}
