package io.datalogger.mqtt;

import io.datalogger.core.InboundMessage;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between the broker session and the pipeline. {@link #put} blocks when full,
 * which stalls the session's callback thread and with it consumption from the broker.
 */
public class InboundChannel implements MessageHandler {
    private final BlockingQueue<InboundMessage> queue;

    public InboundChannel(int capacity) {
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
    }

    @Override
    public void onMessage(InboundMessage message) throws InterruptedException {
        put(message);
    }

    public void put(InboundMessage message) throws InterruptedException { queue.put(message); }

    public boolean offer(InboundMessage message, long timeout, TimeUnit unit) throws InterruptedException {
        return queue.offer(message, timeout, unit);
    }

    public Optional<InboundMessage> poll(long timeout, TimeUnit unit) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout, unit));
    }

    public int size() { return queue.size(); }
    public int remainingCapacity() { return queue.remainingCapacity(); }
}
