package io.datalogger.decode;

import io.datalogger.core.Reading;

import java.time.Instant;

/**
 * Turns a raw topic and payload into a typed reading. Implementations must be stateless; the same
 * input always produces the same reading or the same failure.
 */
public interface Decoder {
    /**
     * @param receivedAt broker receipt time, used when the payload carries no timestamp
     */
    Reading decode(String topic, byte[] payload, Instant receivedAt) throws DecodeException;
}
