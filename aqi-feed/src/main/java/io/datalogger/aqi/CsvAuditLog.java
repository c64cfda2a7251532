package io.datalogger.aqi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Append-only CSV trail of every feed cycle. The header is written when the file is created.
 * Write failures are logged and reported through the return value, never thrown.
 */
public class CsvAuditLog {
    private static final Logger log = LoggerFactory.getLogger(CsvAuditLog.class);

    public static final List<String> HEADER = List.of("Timestamp", "Request_Details", "Raw_API_Response_JSON", "MQTT_Payload");
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final Clock clock;

    public CsvAuditLog(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public Path file() { return file; }

    public synchronized boolean append(String requestDetails, String rawResponse, String mqttPayload) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            boolean exists = Files.exists(file);
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                if (!exists) w.write(row(HEADER));
                w.write(row(List.of(LocalDateTime.now(clock).format(TS), requestDetails, rawResponse, mqttPayload)));
            }
            log.debug("Audit row written to {}", file);
            return true;
        } catch (IOException e) {
            log.error("Could not write audit row to {}", file, e);
            return false;
        }
    }

    static String row(List<String> fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(quote(fields.get(i)));
        }
        return sb.append("\r\n").toString();
    }

    private static String quote(String field) {
        if (field == null) return "";
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
