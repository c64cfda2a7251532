package io.datalogger.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded sensor reading. Immutable: the value map and raw payload are copied on construction
 * and the payload is copied again on access.
 */
public final class Reading {
    private final String topic;
    private final String deviceId;
    private final Instant timestamp;
    private final Map<String, Object> values;
    private final byte[] payload;

    public Reading(String topic, String deviceId, Instant timestamp, Map<String, Object> values, byte[] payload) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
        this.payload = payload == null ? new byte[0] : payload.clone();
    }

    public String topic() { return topic; }
    public String deviceId() { return deviceId; }
    public Instant timestamp() { return timestamp; }
    public Map<String, Object> values() { return values; }
    public byte[] payload() { return payload.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reading that)) return false;
        return topic.equals(that.topic)
                && deviceId.equals(that.deviceId)
                && timestamp.equals(that.timestamp)
                && values.equals(that.values)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(topic, deviceId, timestamp, values) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Reading{" +
                "topic='" + topic + '\'' +
                ", deviceId='" + deviceId + '\'' +
                ", timestamp=" + timestamp +
                ", values=" + values +
                '}';
    }
}
