package io.datalogger.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datalogger.core.AckToken;
import io.datalogger.core.InboundMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileRejectLogTest {
    @TempDir
    Path dir;

    @Test
    void appends_one_json_line_per_rejected_message() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Path file = dir.resolve("nested/rejected.jsonl");
        FileRejectLog log = new FileRejectLog(file, mapper, Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
        byte[] bad = "garbage".getBytes(StandardCharsets.UTF_8);
        InboundMessage msg = new InboundMessage("sensors/a", bad, Instant.parse("2024-12-31T23:59:59Z"), new AckToken(1, null));
        log.reject(msg, new DecodeException("sensors/a", "field 'garbage' is not NAME:value"));
        log.reject(msg, new DecodeException("sensors/a", "again"));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        JsonNode first = mapper.readTree(lines.get(0));
        assertEquals("2025-01-01T00:00:00Z", first.get("ts").asText());
        assertEquals("sensors/a", first.get("topic").asText());
        assertEquals("field 'garbage' is not NAME:value", first.get("error").asText());
        assertArrayEquals(bad, Base64.getDecoder().decode(first.get("payload").asText()));
    }
}
