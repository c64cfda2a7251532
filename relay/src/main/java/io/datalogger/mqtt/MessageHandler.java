package io.datalogger.mqtt;

import io.datalogger.core.InboundMessage;

@FunctionalInterface
public interface MessageHandler {
    /** May block to apply backpressure to the broker connection. */
    void onMessage(InboundMessage message) throws InterruptedException;
}
