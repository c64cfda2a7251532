package io.datalogger.mqtt;

import com.hivemq.client.mqtt.datatypes.MqttQos;
import com.hivemq.client.mqtt.lifecycle.MqttClientDisconnectedContext;
import com.hivemq.client.mqtt.lifecycle.MqttClientReconnector;
import com.hivemq.client.mqtt.lifecycle.MqttDisconnectSource;
import com.hivemq.client.mqtt.mqtt3.Mqtt3AsyncClient;
import com.hivemq.client.mqtt.mqtt3.message.publish.Mqtt3Publish;
import io.datalogger.core.AckToken;
import io.datalogger.core.InboundMessage;
import io.datalogger.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MqttBrokerSessionTest {
    static final Instant NOW = Instant.parse("2025-03-01T00:00:00Z");

    private static MqttBrokerSession session(int maxReconnects) {
        return new MqttBrokerSession(mock(Mqtt3AsyncClient.class), null, List.of("sensors/#"),
                new ExponentialBackoffRetryPolicy(maxReconnects, 100, 1_000), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static MqttClientDisconnectedContext disconnect(MqttDisconnectSource source, MqttClientReconnector reconnector) {
        MqttClientDisconnectedContext ctx = mock(MqttClientDisconnectedContext.class);
        when(ctx.getSource()).thenReturn(source);
        when(ctx.getCause()).thenReturn(new IOException("connection reset by broker"));
        when(ctx.getReconnector()).thenReturn(reconnector);
        return ctx;
    }

    private static MqttClientReconnector reconnector() {
        return mock(MqttClientReconnector.class, RETURNS_SELF);
    }

    @Test
    void lost_connection_schedules_reconnect_that_resubscribes() {
        MqttBrokerSession s = session(Integer.MAX_VALUE);
        s.onConnected();
        assertTrue(s.isConnected());

        MqttClientReconnector r = reconnector();
        s.onDisconnected(disconnect(MqttDisconnectSource.SERVER, r));

        assertFalse(s.isConnected());
        verify(r).reconnect(true);
        verify(r).resubscribeIfSessionExpired(true);
        verify(r).delay(100L, TimeUnit.MILLISECONDS);
    }

    @Test
    void reconnect_delay_grows_until_a_connect_succeeds() {
        MqttBrokerSession s = session(Integer.MAX_VALUE);
        s.onConnected();

        MqttClientReconnector first = reconnector();
        MqttClientReconnector second = reconnector();
        s.onDisconnected(disconnect(MqttDisconnectSource.CLIENT, first));
        s.onDisconnected(disconnect(MqttDisconnectSource.CLIENT, second));
        verify(first).delay(100L, TimeUnit.MILLISECONDS);
        verify(second).delay(200L, TimeUnit.MILLISECONDS);

        s.onConnected();
        assertTrue(s.isConnected());
        MqttClientReconnector afterRecovery = reconnector();
        s.onDisconnected(disconnect(MqttDisconnectSource.SERVER, afterRecovery));
        verify(afterRecovery).delay(100L, TimeUnit.MILLISECONDS);
    }

    @Test
    void user_disconnect_does_not_reconnect() {
        MqttBrokerSession s = session(Integer.MAX_VALUE);
        s.onConnected();
        MqttClientReconnector r = reconnector();

        s.onDisconnected(disconnect(MqttDisconnectSource.USER, r));

        assertFalse(s.isConnected());
        verify(r, never()).reconnect(anyBoolean());
        verify(r, never()).delay(anyLong(), any());
    }

    @Test
    void exhausted_reconnect_budget_leaves_the_session_down() {
        MqttBrokerSession s = session(1);
        s.onConnected();
        MqttClientReconnector r = reconnector();

        s.onDisconnected(disconnect(MqttDisconnectSource.SERVER, r));

        assertFalse(s.isConnected());
        verify(r, never()).reconnect(anyBoolean());
    }

    @Test
    void dispatch_hands_the_publish_to_the_handler_with_its_token() {
        MqttBrokerSession s = session(Integer.MAX_VALUE);
        List<InboundMessage> seen = new ArrayList<>();
        s.onMessage(seen::add);
        Mqtt3Publish publish = Mqtt3Publish.builder()
                .topic("sensors/temp")
                .payload("{\"temp\":21}".getBytes(StandardCharsets.UTF_8))
                .qos(MqttQos.AT_MOST_ONCE)
                .build();

        s.dispatch(publish);

        assertEquals(1, seen.size());
        InboundMessage msg = seen.get(0);
        assertEquals("sensors/temp", msg.topic());
        assertEquals("{\"temp\":21}", new String(msg.payload(), StandardCharsets.UTF_8));
        assertEquals(NOW, msg.receivedAt());
        assertSame(publish, msg.ackToken().handle());
        // QoS 0 carries nothing to acknowledge
        s.acknowledge(msg.ackToken());
        assertThrows(IllegalArgumentException.class, () -> s.acknowledge(new AckToken(99, "not a publish")));
        assertThrows(IllegalStateException.class, () -> s.onMessage(m -> { }));
    }
}
