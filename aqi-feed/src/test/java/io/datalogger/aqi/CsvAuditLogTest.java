package io.datalogger.aqi;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvAuditLogTest {
    @TempDir
    Path dir;

    final Clock clock = Clock.fixed(Instant.parse("2025-02-13T20:45:28Z"), ZoneOffset.UTC);

    @Test
    void header_is_written_once() throws Exception {
        Path file = dir.resolve("logs/audit.csv");
        CsvAuditLog log = new CsvAuditLog(file, clock);
        assertTrue(log.append("GET /devices", "{}", "TEMP:1"));
        assertTrue(log.append("GET /devices", "{}", "TEMP:2"));

        List<String> lines = List.of(Files.readString(file, StandardCharsets.UTF_8).split("\r\n"));
        assertEquals(3, lines.size());
        assertEquals("Timestamp,Request_Details,Raw_API_Response_JSON,MQTT_Payload", lines.get(0));
        assertEquals("2025-02-13 20:45:28,GET /devices,{},TEMP:1", lines.get(1));
    }

    @Test
    void fields_with_separators_are_quoted() {
        assertEquals("a,\"{\"\"x\"\":1,\"\"y\"\":2}\",\"P:1,DATE:2025-02-13,20:45:28\"\r\n",
                CsvAuditLog.row(List.of("a", "{\"x\":1,\"y\":2}", "P:1,DATE:2025-02-13,20:45:28")));
        assertEquals(",b\r\n", CsvAuditLog.row(Arrays.asList(null, "b")));
    }

    @Test
    void write_failure_is_reported_not_thrown() {
        CsvAuditLog log = new CsvAuditLog(dir, clock);
        assertFalse(log.append("GET /devices", "{}", "TEMP:1"));
    }
}
