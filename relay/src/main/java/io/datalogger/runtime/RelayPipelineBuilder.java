package io.datalogger.runtime;

import com.codahale.metrics.MetricRegistry;
import io.datalogger.decode.Decoder;
import io.datalogger.decode.RejectLog;
import io.datalogger.forward.Forwarder;
import io.datalogger.metrics.Metrics;
import io.datalogger.mqtt.BrokerSession;
import io.datalogger.mqtt.InboundChannel;
import io.datalogger.queue.DurableQueue;
import io.datalogger.retry.ExponentialBackoffRetryPolicy;
import io.datalogger.retry.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public class RelayPipelineBuilder {
    private BrokerSession session;
    private InboundChannel channel;
    private Decoder decoder;
    private RejectLog rejectLog = RejectLog.discarding();
    private DurableQueue queue;
    private Forwarder forwarder;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private Clock clock = Clock.systemUTC();
    private int batchSize = 50;
    private long flushMillis = 500;
    private int concurrency = 2;
    private Duration stopTimeout = Duration.ofSeconds(15);
    private RetryPolicy storageRetry = new ExponentialBackoffRetryPolicy(Integer.MAX_VALUE, 100, 5_000);

    public RelayPipelineBuilder session(BrokerSession s) { this.session = s; return this; }
    public RelayPipelineBuilder channel(InboundChannel c) { this.channel = c; return this; }
    public RelayPipelineBuilder decoder(Decoder d) { this.decoder = d; return this; }
    public RelayPipelineBuilder rejectLog(RejectLog r) { this.rejectLog = r; return this; }
    public RelayPipelineBuilder queue(DurableQueue q) { this.queue = q; return this; }
    public RelayPipelineBuilder forwarder(Forwarder f) { this.forwarder = f; return this; }
    public RelayPipelineBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public RelayPipelineBuilder clock(Clock c) { this.clock = c; return this; }
    public RelayPipelineBuilder batchSize(int n) { this.batchSize = Math.max(1, n); return this; }
    public RelayPipelineBuilder flushMillis(long ms) { this.flushMillis = Math.max(0, ms); return this; }
    public RelayPipelineBuilder concurrency(int n) { this.concurrency = Math.max(1, n); return this; }
    public RelayPipelineBuilder stopTimeout(Duration d) { this.stopTimeout = d; return this; }
    /** Backoff for queue writes that fail; retried until they commit or the pipeline stops. */
    public RelayPipelineBuilder storageRetry(RetryPolicy p) { this.storageRetry = p; return this; }

    public RelayPipeline build() {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(forwarder, "forwarder");
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(storageRetry, "storageRetry");
        InboundChannel ch = channel != null ? channel : new InboundChannel(256);
        return new RelayPipeline(session, ch, decoder, rejectLog, queue, forwarder, new Metrics(metricRegistry), clock,
                batchSize, flushMillis, concurrency, stopTimeout, storageRetry);
    }
}
