package io.datalogger.core;

import java.time.Instant;

/**
 * A reading that exhausted its delivery attempts or was rejected permanently by the collector.
 */
public record DeadLetter(long sequence, Reading reading, int attempts, String reason, Instant failedAt) {}
