package io.datalogger.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import io.datalogger.config.RelayConfig;
import io.datalogger.decode.Decoder;
import io.datalogger.decode.FileRejectLog;
import io.datalogger.decode.RejectLog;
import io.datalogger.decode.SensorPayloadDecoder;
import io.datalogger.decode.TopicPattern;
import io.datalogger.forward.BatchCodec;
import io.datalogger.forward.CollectorAuth;
import io.datalogger.forward.Forwarder;
import io.datalogger.forward.HttpCollectorForwarder;
import io.datalogger.forward.LoginTokenAuth;
import io.datalogger.forward.RequestRateLimiter;
import io.datalogger.mqtt.BrokerAddress;
import io.datalogger.mqtt.BrokerConnector;
import io.datalogger.mqtt.BrokerSession;
import io.datalogger.mqtt.ConnectionException;
import io.datalogger.mqtt.ConnectionSupervisor;
import io.datalogger.mqtt.Credentials;
import io.datalogger.mqtt.InboundChannel;
import io.datalogger.mqtt.MqttBrokerConnector;
import io.datalogger.queue.DurableQueue;
import io.datalogger.queue.JdbcDurableQueue;
import io.datalogger.retry.ExponentialBackoffRetryPolicy;
import io.datalogger.retry.RetryPolicy;
import io.datalogger.runtime.RelayPipeline;
import io.datalogger.runtime.RelayPipelineBuilder;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

public class RelayModule extends AbstractModule {
    private final RelayConfig config;

    public RelayModule(RelayConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(RelayConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton HttpClient httpClient() {
        return HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build();
    }

    /** Unbounded attempts with full jitter; used for broker connects and reconnects. */
    @Provides @Singleton RetryPolicy reconnectPolicy() {
        return ExponentialBackoffRetryPolicy.withFullJitter(Integer.MAX_VALUE, 1_000, 60_000);
    }

    /** Per-record forward retries. No jitter, so each retry of a record waits strictly longer until the cap. */
    @Provides @Singleton @Named("forwardRetry") RetryPolicy forwardRetryPolicy() {
        return new ExponentialBackoffRetryPolicy(config.maxAttempts(), config.retryBaseMillis(), config.retryMaxMillis());
    }

    @Provides @Singleton DurableQueue queue(ObjectMapper mapper, Clock clock, @Named("forwardRetry") RetryPolicy backoff) throws IOException {
        Path parent = config.queuePath().toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        return new JdbcDurableQueue(config.queueJdbcUrl(), null, null,
                config.queueMaxRecords(), config.maxAttempts(), backoff, mapper, clock);
    }

    @Provides @Singleton Decoder decoder(ObjectMapper mapper) {
        return new SensorPayloadDecoder(TopicPattern.compileAll(config.topicPatterns()), config.zone(), mapper);
    }

    @Provides @Singleton RejectLog rejectLog(ObjectMapper mapper, Clock clock) throws IOException {
        return new FileRejectLog(config.rejectLog(), mapper, clock);
    }

    @Provides @Singleton CollectorAuth collectorAuth(HttpClient client, ObjectMapper mapper) {
        switch (config.authMode()) {
            case TOKEN: return CollectorAuth.staticToken(config.authToken());
            case LOGIN: return new LoginTokenAuth(client, config.loginUrl(), config.loginEmail(), config.loginPassword(),
                    config.requestTimeout(), mapper);
            default: return CollectorAuth.none();
        }
    }

    @Provides @Singleton Forwarder forwarder(HttpClient client, CollectorAuth auth, ObjectMapper mapper, Clock clock) {
        RequestRateLimiter limiter = config.qps() > 0 ? new RequestRateLimiter(config.qps()) : RequestRateLimiter.unlimited();
        return new HttpCollectorForwarder(client, config.collectorUrl(), config.requestTimeout(), auth, limiter,
                new BatchCodec(mapper), clock);
    }

    @Provides @Singleton BrokerConnector connector(RetryPolicy reconnectPolicy, Clock clock) {
        return new MqttBrokerConnector(reconnectPolicy, config.requestTimeout(), 60, clock);
    }

    @Provides @Singleton BrokerSession session(BrokerConnector connector, RetryPolicy reconnectPolicy)
            throws ConnectionException, InterruptedException {
        List<String> filters = TopicPattern.compileAll(config.topics()).stream()
                .map(TopicPattern::subscriptionFilter)
                .distinct()
                .toList();
        return new ConnectionSupervisor(connector, reconnectPolicy).connectWithRetry(
                new BrokerAddress(config.brokerHost(), config.brokerPort(), config.clientId()),
                new Credentials(config.brokerUsername(), config.brokerPassword()),
                filters);
    }

    @Provides @Singleton InboundChannel channel() { return new InboundChannel(config.channelCapacity()); }

    @Provides @Singleton RelayPipeline pipeline(BrokerSession session, InboundChannel channel, Decoder decoder, RejectLog rejectLog,
                                                DurableQueue queue, Forwarder forwarder, MetricRegistry registry, Clock clock) {
        return new RelayPipelineBuilder()
                .session(session)
                .channel(channel)
                .decoder(decoder)
                .rejectLog(rejectLog)
                .queue(queue)
                .forwarder(forwarder)
                .metrics(registry)
                .clock(clock)
                .batchSize(config.batchSize())
                .flushMillis(config.flushMillis())
                .concurrency(config.concurrency())
                .stopTimeout(config.requestTimeout().multipliedBy(2).plus(Duration.ofSeconds(1)))
                .build();
    }
}
