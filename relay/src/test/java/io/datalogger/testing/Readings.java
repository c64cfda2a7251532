package io.datalogger.testing;

import io.datalogger.core.Reading;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

public final class Readings {
    private Readings() {}

    public static Reading temp(String device, double value) {
        String payload = "{\"temp\":" + value + "}";
        return new Reading("sensors/" + device, device, Instant.parse("2025-02-13T20:45:28Z"),
                Map.of("temp", value), payload.getBytes(StandardCharsets.UTF_8));
    }
}
