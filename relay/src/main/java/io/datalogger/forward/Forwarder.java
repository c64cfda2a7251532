package io.datalogger.forward;

import io.datalogger.core.Batch;

/**
 * Submits a batch to the collector in a single request. Implementations must be safe to call
 * from several forwarding workers at once.
 */
public interface Forwarder extends AutoCloseable {
    DeliveryReport send(Batch batch) throws ForwardException;

    @Override
    default void close() {}
}
