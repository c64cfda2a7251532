package io.datalogger.decode;

import io.datalogger.core.InboundMessage;

/**
 * Audit trail for messages dropped because they could not be decoded. Nothing reads it back;
 * rejected messages are never retried.
 */
public interface RejectLog extends AutoCloseable {
    void reject(InboundMessage message, DecodeException e);

    @Override default void close() {}

    static RejectLog discarding() { return (message, e) -> {}; }
}
