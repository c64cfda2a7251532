package io.datalogger.mqtt;

import io.datalogger.core.AckToken;
import io.datalogger.core.InboundMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InboundChannelTest {

    private static InboundMessage msg(long id) {
        return new InboundMessage("sensors/a", new byte[]{1}, Instant.EPOCH, new AckToken(id, null));
    }

    @Test
    void preserves_arrival_order() throws Exception {
        InboundChannel ch = new InboundChannel(4);
        ch.onMessage(msg(1));
        ch.onMessage(msg(2));
        assertEquals(1, ch.poll(10, TimeUnit.MILLISECONDS).orElseThrow().ackToken().id());
        assertEquals(2, ch.poll(10, TimeUnit.MILLISECONDS).orElseThrow().ackToken().id());
        assertTrue(ch.poll(10, TimeUnit.MILLISECONDS).isEmpty());
    }

    @Test
    void full_channel_blocks_the_producer() throws Exception {
        InboundChannel ch = new InboundChannel(1);
        ch.put(msg(1));
        assertEquals(0, ch.remainingCapacity());
        assertFalse(ch.offer(msg(2), 20, TimeUnit.MILLISECONDS));

        CountDownLatch delivered = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                ch.onMessage(msg(3));
                delivered.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        assertFalse(delivered.await(100, TimeUnit.MILLISECONDS));
        ch.poll(10, TimeUnit.MILLISECONDS);
        assertTrue(delivered.await(2, TimeUnit.SECONDS));
        assertEquals(1, ch.size());
        producer.join(1_000);
    }
}
