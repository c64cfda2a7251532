package io.datalogger.core;

public enum DeliveryState {
    PENDING,
    IN_FLIGHT,
    DELIVERED,
    FAILED
}
