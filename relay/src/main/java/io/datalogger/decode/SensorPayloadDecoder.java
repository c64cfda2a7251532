package io.datalogger.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datalogger.core.Reading;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the two payload encodings a datalogger device may publish.
 *
 * <p>JSON ({@code datalogger.reading/v1}):
 * <pre>{"v":1,"device_id":"display_1","ts":"2025-02-13T20:45:28Z","values":{"TEMP":24.5}}</pre>
 * A flat object without {@code values} is accepted too; every non-reserved scalar field becomes a value.
 * {@code ts} is ISO-8601 (with or without offset) or epoch milliseconds.
 *
 * <p>Text line, as published by the AQI feeder:
 * <pre>PM2.5:12,TEMP:24.5,HUM:40,DATE:2025-02-13,20:45:28</pre>
 * Local date-times are interpreted in the configured zone.
 */
public class SensorPayloadDecoder implements Decoder {
    public static final int SCHEMA_VERSION = 1;

    private static final Set<String> RESERVED = Set.of("v", "device_id", "ts", "values");
    private static final Pattern DATE_SUFFIX =
            Pattern.compile("(?:^|,)\\s*DATE:(\\d{4}-\\d{2}-\\d{2}),(\\d{2}:\\d{2}:\\d{2})\\s*$");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private final List<TopicPattern> patterns;
    private final ZoneId zone;
    private final ObjectMapper mapper;

    public SensorPayloadDecoder(List<TopicPattern> patterns, ZoneId zone, ObjectMapper mapper) {
        if (patterns == null || patterns.isEmpty()) throw new IllegalArgumentException("at least one topic pattern is required");
        this.patterns = List.copyOf(patterns);
        this.zone = Objects.requireNonNull(zone, "zone");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Reading decode(String topic, byte[] payload, Instant receivedAt) throws DecodeException {
        TopicPattern.Match match = matchTopic(topic);
        if (payload == null || payload.length == 0) throw new DecodeException(topic, "empty payload");
        String text = utf8(topic, payload).trim();
        if (text.isEmpty()) throw new DecodeException(topic, "blank payload");

        Parsed parsed = text.startsWith("{") ? parseJson(topic, text) : parseLine(topic, text);
        String device = match.deviceId()
                .or(() -> Optional.ofNullable(parsed.deviceId))
                .orElseGet(() -> lastLevel(topic));
        Instant ts = parsed.timestamp != null ? parsed.timestamp : receivedAt;
        return new Reading(topic, device, ts, parsed.values, payload);
    }

    private TopicPattern.Match matchTopic(String topic) throws DecodeException {
        for (TopicPattern p : patterns) {
            Optional<TopicPattern.Match> m = p.match(topic);
            if (m.isPresent()) return m.get();
        }
        throw new DecodeException(topic, "no topic pattern matches '" + topic + "'");
    }

    private static String utf8(String topic, byte[] payload) throws DecodeException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException(topic, "payload is not valid UTF-8", e);
        }
    }

    private Parsed parseJson(String topic, String text) throws DecodeException {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DecodeException(topic, "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) throw new DecodeException(topic, "JSON payload must be an object");

        JsonNode version = root.get("v");
        if (version != null && (!version.canConvertToInt() || version.asInt() != SCHEMA_VERSION)) {
            throw new DecodeException(topic, "unsupported schema version " + version);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        JsonNode nested = root.get("values");
        if (nested != null) {
            if (!nested.isObject()) throw new DecodeException(topic, "'values' must be an object");
            collectScalars(topic, nested, Set.of(), values);
        } else {
            collectScalars(topic, root, RESERVED, values);
        }
        if (values.isEmpty()) throw new DecodeException(topic, "payload carries no values");

        String device = null;
        JsonNode d = root.get("device_id");
        if (d != null && !d.isNull()) {
            if (!d.isTextual() || d.asText().isBlank()) throw new DecodeException(topic, "'device_id' must be a non-blank string");
            device = d.asText();
        }
        return new Parsed(device, parseJsonTimestamp(topic, root.get("ts")), values);
    }

    private static void collectScalars(String topic, JsonNode node, Set<String> skip, Map<String, Object> out) throws DecodeException {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (skip.contains(e.getKey())) continue;
            JsonNode v = e.getValue();
            if (v.isNumber()) out.put(e.getKey(), v.asDouble());
            else if (v.isBoolean()) out.put(e.getKey(), v.asBoolean());
            else if (v.isTextual()) out.put(e.getKey(), v.asText());
            else throw new DecodeException(topic, "value '" + e.getKey() + "' is not a scalar");
        }
    }

    private Instant parseJsonTimestamp(String topic, JsonNode ts) throws DecodeException {
        if (ts == null || ts.isNull()) return null;
        if (ts.isIntegralNumber()) return Instant.ofEpochMilli(ts.asLong());
        if (!ts.isTextual()) throw new DecodeException(topic, "'ts' must be ISO-8601 text or epoch millis");
        String s = ts.asText();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException notInstant) {
            try {
                return LocalDateTime.parse(s).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                throw new DecodeException(topic, "unparseable timestamp '" + s + "'", e);
            }
        }
    }

    private Parsed parseLine(String topic, String text) throws DecodeException {
        Instant ts = null;
        String body = text;
        Matcher m = DATE_SUFFIX.matcher(text);
        if (m.find()) {
            try {
                ts = LocalDateTime.of(LocalDate.parse(m.group(1)), LocalTime.parse(m.group(2))).atZone(zone).toInstant();
            } catch (DateTimeException e) {
                throw new DecodeException(topic, "invalid DATE field", e);
            }
            body = text.substring(0, m.start());
        }

        Map<String, Object> values = new LinkedHashMap<>();
        if (!body.isBlank()) {
            for (String part : body.split(",")) {
                int colon = part.indexOf(':');
                if (colon <= 0) throw new DecodeException(topic, "field '" + part.trim() + "' is not NAME:value");
                String name = part.substring(0, colon).trim();
                String raw = part.substring(colon + 1).trim();
                if (name.isEmpty()) throw new DecodeException(topic, "field with empty name");
                values.put(name, numberOrText(raw));
            }
        }
        if (values.isEmpty()) throw new DecodeException(topic, "payload carries no values");
        return new Parsed(null, ts, values);
    }

    /** Plain decimal text becomes a number; anything else (NaN, Infinity, hex, 12f) stays text. */
    private static Object numberOrText(String raw) {
        if (!DECIMAL.matcher(raw).matches()) return raw;
        return Double.parseDouble(raw);
    }

    private static String lastLevel(String topic) {
        int slash = topic.lastIndexOf('/');
        return slash < 0 ? topic : topic.substring(slash + 1);
    }

    private record Parsed(String deviceId, Instant timestamp, Map<String, Object> values) {}
}
