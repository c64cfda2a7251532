package io.datalogger.mqtt;

import io.datalogger.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MqttBrokerConnectorTest {
    final MqttBrokerConnector connector = new MqttBrokerConnector(
            new ExponentialBackoffRetryPolicy(3, 10, 100), Duration.ofSeconds(2), 30, Clock.systemUTC());

    @Test
    void unreachable_broker_raises_connection_exception() throws Exception {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) { closedPort = s.getLocalPort(); }
        BrokerAddress address = new BrokerAddress("127.0.0.1", closedPort, "relay-unreachable");
        assertThrows(ConnectionException.class,
                () -> connector.connect(address, Credentials.anonymous(), List.of("sensors/#")));
    }

    @Test
    void requires_topic_filters() {
        BrokerAddress address = new BrokerAddress("127.0.0.1", 1883, "relay-no-topics");
        assertThrows(IllegalArgumentException.class, () -> connector.connect(address, Credentials.anonymous(), List.of()));
    }
}
