package io.datalogger.runtime;

/**
 * Where a pipeline worker currently is in its cycle. The intake worker moves
 * IDLE, DECODING, QUEUING and back; forward workers move IDLE, BATCHING, FORWARDING, ACKING and back,
 * returning to BATCHING after a transient forwarding failure.
 */
public enum CycleState {
    IDLE,
    DECODING,
    QUEUING,
    BATCHING,
    FORWARDING,
    ACKING
}
