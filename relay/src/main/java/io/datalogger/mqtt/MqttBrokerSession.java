package io.datalogger.mqtt;

import com.hivemq.client.mqtt.datatypes.MqttQos;
import com.hivemq.client.mqtt.lifecycle.MqttClientDisconnectedContext;
import com.hivemq.client.mqtt.mqtt3.Mqtt3AsyncClient;
import com.hivemq.client.mqtt.mqtt3.message.publish.Mqtt3Publish;
import io.datalogger.core.AckToken;
import io.datalogger.core.InboundMessage;
import io.datalogger.retry.RetryPolicy;
import io.datalogger.retry.RetryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

class MqttBrokerSession implements BrokerSession {
    private static final Logger log = LoggerFactory.getLogger(MqttBrokerSession.class);

    private final Mqtt3AsyncClient client;
    private final ExecutorService callbacks;
    private final List<String> topicFilters;
    private final RetryState reconnect;
    private final Clock clock;
    private final CompletableFuture<MessageHandler> handler = new CompletableFuture<>();
    private final AtomicLong tokenIds = new AtomicLong();
    private volatile boolean connected;
    private volatile boolean closed;

    MqttBrokerSession(Mqtt3AsyncClient client, ExecutorService callbacks, List<String> topicFilters,
                      RetryPolicy reconnectPolicy, Clock clock) {
        this.client = client;
        this.callbacks = callbacks;
        this.topicFilters = List.copyOf(topicFilters);
        this.reconnect = new RetryState(reconnectPolicy);
        this.clock = clock;
    }

    @Override
    public void onMessage(MessageHandler h) {
        if (!handler.complete(h)) throw new IllegalStateException("message handler already installed");
    }

    /** Runs on the single callback thread; blocking here stops further consumption. */
    void dispatch(Mqtt3Publish publish) {
        InboundMessage msg = new InboundMessage(
                publish.getTopic().toString(),
                publish.getPayloadAsBytes(),
                clock.instant(),
                new AckToken(tokenIds.incrementAndGet(), publish));
        try {
            handler.get().onMessage(msg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Inbound dispatch interrupted; {} left unacknowledged for redelivery", msg.ackToken());
        } catch (ExecutionException e) {
            log.error("No handler for message on {}", msg.topic(), e.getCause());
        }
    }

    @Override
    public void acknowledge(AckToken token) {
        if (!(token.handle() instanceof Mqtt3Publish publish)) {
            throw new IllegalArgumentException("token " + token + " was not issued by this session");
        }
        if (publish.getQos() == MqttQos.AT_MOST_ONCE) return;
        try {
            publish.acknowledge();
        } catch (IllegalStateException e) {
            log.warn("Could not acknowledge {} on {}: {}", token, publish.getTopic(), e.getMessage());
        }
    }

    void onConnected() {
        boolean wasReconnect = reconnect.failures() > 0;
        reconnect.onSuccess();
        connected = true;
        if (wasReconnect) log.info("Reconnected to broker; session resumed for {}", topicFilters);
    }

    void onDisconnected(MqttClientDisconnectedContext ctx) {
        connected = false;
        if (closed || MqttBrokerConnector.userInitiated(ctx)) return;
        long delay = reconnect.onFailure(ctx.getCause() instanceof Exception ex ? ex : new Exception(ctx.getCause()));
        if (delay < 0) {
            log.error("Broker connection lost and reconnect attempts exhausted", ctx.getCause());
            return;
        }
        reconnect.onAttempt();
        log.warn("Broker connection lost ({}); reconnecting in {} ms", ctx.getCause().getMessage(), delay);
        ctx.getReconnector()
                .reconnect(true)
                .resubscribeIfSessionExpired(true)
                .delay(delay, TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isConnected() { return connected && !closed; }

    @Override
    public List<String> topicFilters() { return topicFilters; }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        connected = false;
        try {
            client.disconnect().get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Disconnect did not complete cleanly: {}", e.toString());
        }
        callbacks.shutdownNow();
        log.info("Broker session closed");
    }
}
