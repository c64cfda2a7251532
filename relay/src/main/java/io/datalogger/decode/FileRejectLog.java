package io.datalogger.decode;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datalogger.core.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Base64;

/** Appends one JSON object per rejected message. */
public class FileRejectLog implements RejectLog {
    private static final Logger log = LoggerFactory.getLogger(FileRejectLog.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileRejectLog(Path file, ObjectMapper mapper, Clock clock) throws IOException {
        this.file = file;
        this.mapper = mapper;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void reject(InboundMessage message, DecodeException e) {
        ObjectNode node = mapper.createObjectNode();
        node.put("ts", clock.instant().toString());
        node.put("topic", message.topic());
        node.put("receivedAt", message.receivedAt().toString());
        node.put("error", e.getMessage());
        node.put("payload", Base64.getEncoder().encodeToString(message.payload()));
        try {
            Files.writeString(file, mapper.writeValueAsString(node) + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            log.warn("Could not append rejected message from '{}' to {}", message.topic(), file, io);
        }
    }

    public Path file() { return file; }
}
