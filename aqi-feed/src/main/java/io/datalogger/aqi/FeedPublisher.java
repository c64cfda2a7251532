package io.datalogger.aqi;

@FunctionalInterface
public interface FeedPublisher {
    /** @return true once the broker accepted the payload */
    boolean publish(String payload);
}
