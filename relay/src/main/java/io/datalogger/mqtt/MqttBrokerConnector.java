package io.datalogger.mqtt;

import com.hivemq.client.mqtt.MqttClient;
import com.hivemq.client.mqtt.MqttGlobalPublishFilter;
import com.hivemq.client.mqtt.datatypes.MqttQos;
import com.hivemq.client.mqtt.lifecycle.MqttClientDisconnectedContext;
import com.hivemq.client.mqtt.lifecycle.MqttDisconnectSource;
import com.hivemq.client.mqtt.mqtt3.Mqtt3AsyncClient;
import com.hivemq.client.mqtt.mqtt3.message.auth.Mqtt3SimpleAuth;
import com.hivemq.client.mqtt.mqtt3.message.connect.Mqtt3Connect;
import com.hivemq.client.mqtt.mqtt3.message.connect.Mqtt3ConnectBuilder;
import com.hivemq.client.mqtt.mqtt3.message.subscribe.suback.Mqtt3SubAck;
import com.hivemq.client.mqtt.mqtt3.message.subscribe.suback.Mqtt3SubAckReturnCode;
import io.datalogger.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens MQTT 3.1.1 sessions with the HiveMQ client: persistent session ({@code cleanSession=false}),
 * QoS 1 subscriptions and manual acknowledgement. After the first successful connect the client
 * reconnects on its own with the given backoff and resubscribes if the broker lost the session.
 */
public class MqttBrokerConnector implements BrokerConnector {
    private static final Logger log = LoggerFactory.getLogger(MqttBrokerConnector.class);

    private final RetryPolicy reconnectPolicy;
    private final Duration connectTimeout;
    private final int keepAliveSeconds;
    private final Clock clock;

    public MqttBrokerConnector(RetryPolicy reconnectPolicy, Duration connectTimeout, int keepAliveSeconds, Clock clock) {
        this.reconnectPolicy = reconnectPolicy;
        this.connectTimeout = connectTimeout;
        this.keepAliveSeconds = keepAliveSeconds;
        this.clock = clock;
    }

    @Override
    public BrokerSession connect(BrokerAddress address, Credentials credentials, List<String> topicFilters) throws ConnectionException {
        if (topicFilters == null || topicFilters.isEmpty()) throw new IllegalArgumentException("at least one topic filter is required");
        ExecutorService callbacks = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mqtt-inbound-" + address.clientId());
            t.setDaemon(true);
            return t;
        });
        MqttBrokerSession[] holder = new MqttBrokerSession[1];
        Mqtt3AsyncClient client = MqttClient.builder()
                .useMqttVersion3()
                .identifier(address.clientId())
                .serverHost(address.host())
                .serverPort(address.port())
                .addConnectedListener(ctx -> {
                    MqttBrokerSession s = holder[0];
                    if (s != null) s.onConnected();
                })
                .addDisconnectedListener(ctx -> {
                    MqttBrokerSession s = holder[0];
                    if (s != null) s.onDisconnected(ctx);
                })
                .buildAsync();

        MqttBrokerSession session = new MqttBrokerSession(client, callbacks, topicFilters, reconnectPolicy, clock);
        // registered before connecting so queued session messages are not dropped
        client.publishes(MqttGlobalPublishFilter.SUBSCRIBED, session::dispatch, callbacks, true);

        try {
            client.connect(connectMessage(credentials)).get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            for (String filter : topicFilters) {
                Mqtt3SubAck ack = client.subscribeWith()
                        .topicFilter(filter)
                        .qos(MqttQos.AT_LEAST_ONCE)
                        .send()
                        .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (ack.getReturnCodes().contains(Mqtt3SubAckReturnCode.FAILURE)) {
                    throw new ConnectionException("broker refused subscription to '" + filter + "'", null);
                }
            }
        } catch (ExecutionException e) {
            abandon(client, callbacks);
            throw new ConnectionException("could not connect to " + address + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            abandon(client, callbacks);
            throw new ConnectionException("timed out connecting to " + address, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(client, callbacks);
            throw new ConnectionException("interrupted connecting to " + address, e);
        } catch (ConnectionException e) {
            abandon(client, callbacks);
            throw e;
        }
        holder[0] = session;
        session.onConnected();
        log.info("Connected to {} subscribed to {}", address, topicFilters);
        return session;
    }

    private Mqtt3Connect connectMessage(Credentials credentials) {
        Mqtt3ConnectBuilder builder = Mqtt3Connect.builder()
                .cleanSession(false)
                .keepAlive(keepAliveSeconds);
        if (credentials != null && credentials.user().isPresent()) {
            if (credentials.password() == null) {
                builder.simpleAuth(Mqtt3SimpleAuth.builder().username(credentials.username()).build());
            } else {
                builder.simpleAuth(Mqtt3SimpleAuth.builder()
                        .username(credentials.username())
                        .password(credentials.password().getBytes(StandardCharsets.UTF_8))
                        .build());
            }
        }
        return builder.build();
    }

    private static void abandon(Mqtt3AsyncClient client, ExecutorService callbacks) {
        client.disconnect().whenComplete((ok, err) -> {
            if (err != null) log.debug("Disconnect after failed connect: {}", err.toString());
        });
        callbacks.shutdownNow();
    }

    static boolean userInitiated(MqttClientDisconnectedContext ctx) {
        return ctx.getSource() == MqttDisconnectSource.USER;
    }
}
