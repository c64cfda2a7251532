package io.datalogger.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Raw publish as received from the broker, before decoding.
 */
public record InboundMessage(String topic, byte[] payload, Instant receivedAt, AckToken ackToken) {
    public InboundMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(receivedAt, "receivedAt");
        Objects.requireNonNull(ackToken, "ackToken");
        payload = payload == null ? new byte[0] : payload;
    }
}
