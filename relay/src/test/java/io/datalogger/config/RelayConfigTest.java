package io.datalogger.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("datalogger.batch.size");
        System.clearProperty("datalogger.broker.host");
    }

    @Test
    void defaults_apply_when_nothing_is_set() {
        RelayConfig c = RelayConfig.fromSources(Map.of());
        assertEquals("localhost", c.brokerHost());
        assertEquals(1883, c.brokerPort());
        assertEquals("datalogger-relay", c.clientId());
        assertEquals(List.of("sensors/#"), c.topics());
        assertEquals(c.topics(), c.topicPatterns());
        assertEquals(ZoneId.of("UTC"), c.zone());
        assertEquals(50, c.batchSize());
        assertEquals(500, c.flushMillis());
        assertEquals(2, c.concurrency());
        assertEquals(10, c.maxAttempts());
        assertEquals(Duration.ofSeconds(10), c.requestTimeout());
        assertEquals(RelayConfig.AuthMode.NONE, c.authMode());
        assertEquals(URI.create("http://localhost:8080/ingest"), c.collectorUrl());
        assertEquals("jdbc:h2:file:" + Path.of("./data/queue").toAbsolutePath(), c.queueJdbcUrl());
    }

    @Test
    void environment_variables_override_defaults() {
        RelayConfig c = RelayConfig.fromSources(Map.of(
                "DATALOGGER_BROKER_HOST", "mqtt.plant.local",
                "DATALOGGER_TOPICS", "plant/+/data, test/#",
                "DATALOGGER_PATTERNS", "plant/{device}/data,test/#",
                "DATALOGGER_ZONE", "Asia/Kolkata",
                "DATALOGGER_AUTH_MODE", "token",
                "DATALOGGER_AUTH_TOKEN", "abc"));
        assertEquals("mqtt.plant.local", c.brokerHost());
        assertEquals(List.of("plant/+/data", "test/#"), c.topics());
        assertEquals(List.of("plant/{device}/data", "test/#"), c.topicPatterns());
        assertEquals(ZoneId.of("Asia/Kolkata"), c.zone());
        assertEquals(RelayConfig.AuthMode.TOKEN, c.authMode());
        assertEquals("abc", c.authToken());
    }

    @Test
    void system_properties_win_over_environment() {
        System.setProperty("datalogger.batch.size", "7");
        System.setProperty("datalogger.broker.host", "from-property");
        RelayConfig c = RelayConfig.fromSources(Map.of("DATALOGGER_BATCH_SIZE", "99", "DATALOGGER_BROKER_HOST", "from-env"));
        assertEquals(7, c.batchSize());
        assertEquals("from-property", c.brokerHost());
    }

    @Test
    void invalid_settings_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromSources(Map.of("DATALOGGER_BATCH_SIZE", "0")));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromSources(Map.of("DATALOGGER_BROKER_PORT", "70000")));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromSources(Map.of("DATALOGGER_COLLECTOR_URL", "ftp://x/y")));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromSources(Map.of("DATALOGGER_AUTH_MODE", "token")));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromSources(Map.of(
                "DATALOGGER_AUTH_MODE", "login", "DATALOGGER_LOGIN_URL", "http://auth/login")));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromSources(Map.of(
                "DATALOGGER_RETRY_BASE_MILLIS", "5000", "DATALOGGER_RETRY_MAX_MILLIS", "100")));
    }

    @Test
    void string_form_hides_secrets() {
        RelayConfig c = RelayConfig.fromSources(Map.of(
                "DATALOGGER_BROKER_PASSWORD", "hunter2",
                "DATALOGGER_AUTH_MODE", "token",
                "DATALOGGER_AUTH_TOKEN", "sekrit"));
        assertFalse(c.toString().contains("hunter2"));
        assertFalse(c.toString().contains("sekrit"));
    }
}
