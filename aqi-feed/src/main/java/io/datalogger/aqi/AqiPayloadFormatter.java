package io.datalogger.aqi;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Turns the first device of a device-list response into the datalogger text line, e.g.
 * {@code PM2.5:12,TEMP:24.5,DATE:2025-02-13,20:45:28}.
 */
public class AqiPayloadFormatter {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("'DATE:'yyyy-MM-dd,HH:mm:ss");

    private final Clock clock;

    /** The clock's zone decides the local time written into {@code DATE}. */
    public AqiPayloadFormatter(Clock clock) {
        this.clock = clock;
    }

    public Optional<String> format(JsonNode deviceList) {
        if (deviceList == null) return Optional.empty();
        JsonNode data = deviceList.get("data");
        if (data == null || !data.isArray() || data.isEmpty()) return Optional.empty();

        JsonNode realtime = data.get(0).path("realtime");
        if (!realtime.isArray() || realtime.isEmpty()) return Optional.empty();

        StringJoiner line = new StringJoiner(",");
        for (JsonNode sensor : realtime) {
            line.add(sensorName(sensor.path("sensorname").asText("Unknown")) + ":" + sensorValue(sensor.get("sensorvalue")));
        }
        line.add(LocalDateTime.now(clock).format(DATE));
        return Optional.of(line.toString());
    }

    /** {@code "Temp(cel)"} becomes {@code "TEMP"}. */
    static String sensorName(String raw) {
        int paren = raw.indexOf('(');
        String name = paren >= 0 ? raw.substring(0, paren) : raw;
        return name.trim().toUpperCase(Locale.ROOT);
    }

    private static String sensorValue(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return "0";
        return v.asText();
    }
}
