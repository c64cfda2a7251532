package io.datalogger.decode;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.datalogger.core.Reading;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SensorPayloadDecoderTest {
    static final Instant RECEIVED = Instant.parse("2025-03-01T00:00:00Z");

    final SensorPayloadDecoder decoder = new SensorPayloadDecoder(
            TopicPattern.compileAll(List.of("plant/{device}/data", "sensors/#", "test/+")),
            ZoneId.of("Asia/Kolkata"), new ObjectMapper());

    private Reading decode(String topic, String payload) throws DecodeException {
        return decoder.decode(topic, payload.getBytes(StandardCharsets.UTF_8), RECEIVED);
    }

    @Test
    void decodes_versioned_json_with_values_object() throws Exception {
        Reading r = decode("sensors/temp",
                "{\"v\":1,\"device_id\":\"display_1\",\"ts\":\"2025-02-13T20:45:28Z\",\"values\":{\"TEMP\":24.5,\"ON\":true,\"MODE\":\"auto\"}}");
        assertEquals("display_1", r.deviceId());
        assertEquals(Instant.parse("2025-02-13T20:45:28Z"), r.timestamp());
        assertEquals(24.5, r.values().get("TEMP"));
        assertEquals(true, r.values().get("ON"));
        assertEquals("auto", r.values().get("MODE"));
        assertEquals("sensors/temp", r.topic());
    }

    @Test
    void flat_json_uses_every_non_reserved_field_and_falls_back_to_topic_and_receive_time() throws Exception {
        Reading r = decode("sensors/temp", "{\"temp\":21,\"hum\":40.5}");
        assertEquals("temp", r.deviceId());
        assertEquals(RECEIVED, r.timestamp());
        assertEquals(21.0, r.values().get("temp"));
        assertEquals(40.5, r.values().get("hum"));
    }

    @Test
    void device_level_in_topic_wins_over_payload_device() throws Exception {
        Reading r = decode("plant/boiler-3/data", "{\"device_id\":\"other\",\"p\":2}");
        assertEquals("boiler-3", r.deviceId());
    }

    @Test
    void epoch_millis_and_local_timestamps_are_accepted() throws Exception {
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), decode("sensors/a", "{\"ts\":1700000000000,\"x\":1}").timestamp());
        assertEquals(Instant.parse("2025-02-13T15:15:28Z"), decode("sensors/a", "{\"ts\":\"2025-02-13T20:45:28\",\"x\":1}").timestamp());
    }

    @Test
    void decodes_feeder_text_line_in_configured_zone() throws Exception {
        Reading r = decode("test/display_1", "PM2.5:12,TEMP:24.5,HUM:40,STATUS:ok,DATE:2025-02-13,20:45:28");
        assertEquals("display_1", r.deviceId());
        assertEquals(Instant.parse("2025-02-13T15:15:28Z"), r.timestamp());
        assertEquals(12.0, r.values().get("PM2.5"));
        assertEquals(24.5, r.values().get("TEMP"));
        assertEquals("ok", r.values().get("STATUS"));
        assertEquals(List.of("PM2.5", "TEMP", "HUM", "STATUS"), List.copyOf(r.values().keySet()));
    }

    @Test
    void text_line_only_treats_plain_decimals_as_numbers() throws Exception {
        Reading r = decode("test/display_1", "A:NaN,B:Infinity,C:12f,D:0x1p3,E:-3,F:.5,G:1e3,H:+7.");
        assertEquals("NaN", r.values().get("A"));
        assertEquals("Infinity", r.values().get("B"));
        assertEquals("12f", r.values().get("C"));
        assertEquals("0x1p3", r.values().get("D"));
        assertEquals(-3.0, r.values().get("E"));
        assertEquals(0.5, r.values().get("F"));
        assertEquals(1000.0, r.values().get("G"));
        assertEquals(7.0, r.values().get("H"));
    }

    @Test
    void keeps_raw_payload_bytes() throws Exception {
        String raw = "{\"temp\":21}";
        assertArrayEquals(raw.getBytes(StandardCharsets.UTF_8), decode("sensors/t", raw).payload());
    }

    @Test
    void rejects_malformed_payloads() {
        assertThrows(DecodeException.class, () -> decode("unknown/topic", "{\"x\":1}"));
        assertThrows(DecodeException.class, () -> decode("sensors/a", ""));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "   "));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "{not json"));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "{\"v\":2,\"x\":1}"));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "{\"values\":[1,2]}"));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "{\"x\":{\"y\":1}}"));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "{\"device_id\":\"d\"}"));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "garbage"));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "DATE:2025-02-13,20:45:28"));
        assertThrows(DecodeException.class, () -> decode("sensors/a", "T:1,DATE:2025-13-40,20:45:28"));
    }

    @Test
    void rejects_invalid_utf8() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> decoder.decode("sensors/a", new byte[]{(byte) 0xC3, (byte) 0x28}, RECEIVED));
        assertEquals("sensors/a", e.topic());
    }
}
