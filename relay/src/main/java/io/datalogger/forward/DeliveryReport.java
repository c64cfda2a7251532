package io.datalogger.forward;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a batch the collector accepted.
 *
 * @param requests HTTP requests spent on the batch (2 when an expired token was refreshed)
 */
public record DeliveryReport(List<Long> delivered, int statusCode, int requests, Duration elapsed) {
    public DeliveryReport {
        delivered = List.copyOf(delivered);
    }
}
