package io.datalogger.aqi;

import com.hivemq.client.mqtt.MqttClient;
import com.hivemq.client.mqtt.datatypes.MqttQos;
import com.hivemq.client.mqtt.mqtt3.Mqtt3BlockingClient;
import com.hivemq.client.mqtt.mqtt3.message.auth.Mqtt3SimpleAuth;
import com.hivemq.client.mqtt.mqtt3.message.connect.Mqtt3Connect;
import com.hivemq.client.mqtt.mqtt3.message.connect.Mqtt3ConnectBuilder;
import io.datalogger.mqtt.BrokerAddress;
import io.datalogger.mqtt.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Connects, publishes one message at QoS 1 and disconnects. Feed cycles are seconds apart, so
 * no connection is held between them.
 */
public class MqttFeedPublisher implements FeedPublisher {
    private static final Logger log = LoggerFactory.getLogger(MqttFeedPublisher.class);

    private final BrokerAddress address;
    private final Credentials credentials;
    private final String topic;

    public MqttFeedPublisher(BrokerAddress address, Credentials credentials, String topic) {
        this.address = address;
        this.credentials = credentials == null ? Credentials.anonymous() : credentials;
        this.topic = topic;
    }

    @Override
    public boolean publish(String payload) {
        Mqtt3BlockingClient client = MqttClient.builder()
                .useMqttVersion3()
                .identifier(address.clientId())
                .serverHost(address.host())
                .serverPort(address.port())
                .buildBlocking();
        try {
            client.connect(connectMessage());
            client.publishWith()
                    .topic(topic)
                    .qos(MqttQos.AT_LEAST_ONCE)
                    .payload(payload.getBytes(StandardCharsets.UTF_8))
                    .send();
            log.info("Published to {}", topic);
            return true;
        } catch (RuntimeException e) {
            log.error("Publishing to {} on {} failed: {}", topic, address, e.toString());
            return false;
        } finally {
            if (client.getState().isConnected()) {
                client.disconnect();
            }
        }
    }

    private Mqtt3Connect connectMessage() {
        Mqtt3ConnectBuilder b = Mqtt3Connect.builder().keepAlive(60);
        credentials.user().ifPresent(u -> {
            if (credentials.password() == null) {
                b.simpleAuth(Mqtt3SimpleAuth.builder().username(u).build());
            } else {
                b.simpleAuth(Mqtt3SimpleAuth.builder().username(u)
                        .password(credentials.password().getBytes(StandardCharsets.UTF_8)).build());
            }
        });
        return b.build();
    }
}
