package io.datalogger.ingestor;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import io.datalogger.config.RelayConfig;
import io.datalogger.core.Reading;
import io.datalogger.decode.Decoder;
import io.datalogger.forward.CollectorAuth;
import io.datalogger.forward.Forwarder;
import io.datalogger.forward.HttpCollectorForwarder;
import io.datalogger.forward.LoginTokenAuth;
import io.datalogger.queue.DurableQueue;
import io.datalogger.queue.JdbcDurableQueue;
import io.datalogger.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelayModuleTest {
    static final List<String> KEYS = List.of("queue.path", "reject.log", "patterns", "auth.mode", "login.url",
            "login.email", "login.password");

    @TempDir
    Path dir;

    Injector injector;

    @BeforeEach
    void configure() {
        System.setProperty("datalogger.queue.path", dir.resolve("db/queue").toString());
        System.setProperty("datalogger.reject.log", dir.resolve("rejected.jsonl").toString());
        System.setProperty("datalogger.patterns", "plant/{device}/data");
        System.setProperty("datalogger.auth.mode", "login");
        System.setProperty("datalogger.login.url", "http://127.0.0.1:1/login");
        System.setProperty("datalogger.login.email", "ops@example.com");
        System.setProperty("datalogger.login.password", "s3cret");
        injector = Guice.createInjector(new RelayModule(RelayConfig.fromEnv()));
    }

    @AfterEach
    void clear() {
        KEYS.forEach(k -> System.clearProperty("datalogger." + k));
        if (injector != null) injector.getInstance(DurableQueue.class).close();
    }

    @Test
    void queue_is_a_singleton_on_the_configured_path() {
        DurableQueue q = injector.getInstance(DurableQueue.class);
        assertInstanceOf(JdbcDurableQueue.class, q);
        assertSame(q, injector.getInstance(DurableQueue.class));
        assertTrue(Files.isDirectory(dir.resolve("db")));
        assertEquals(0, q.size());
    }

    @Test
    void decoder_uses_configured_patterns() throws Exception {
        Reading r = injector.getInstance(Decoder.class)
                .decode("plant/boiler/data", "{\"pressure\":3.2}".getBytes(StandardCharsets.UTF_8), Instant.EPOCH);
        assertEquals("boiler", r.deviceId());
    }

    @Test
    void login_mode_wires_token_refreshing_forwarder() {
        assertInstanceOf(LoginTokenAuth.class, injector.getInstance(CollectorAuth.class));
        assertInstanceOf(HttpCollectorForwarder.class, injector.getInstance(Forwarder.class));
    }

    @Test
    void forward_retry_delays_grow_on_every_attempt_until_the_cap() {
        RetryPolicy p = injector.getInstance(Key.get(RetryPolicy.class, Names.named("forwardRetry")));
        long previous = 0;
        for (int attempt = 1; attempt <= 6; attempt++) {
            long delay = p.backoffMillis(attempt);
            assertTrue(delay > previous, "attempt " + attempt + " waited " + delay + " ms after " + previous);
            assertEquals(delay, p.backoffMillis(attempt));
            previous = delay;
        }
        assertEquals(60_000, p.backoffMillis(30));
    }
}
