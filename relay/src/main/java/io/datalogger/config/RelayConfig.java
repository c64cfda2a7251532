package io.datalogger.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Relay settings. Each option is read from a {@code datalogger.*} system property, then the matching
 * {@code DATALOGGER_*} environment variable, then a default.
 */
public record RelayConfig(
        String brokerHost,
        int brokerPort,
        String clientId,
        String brokerUsername,
        String brokerPassword,
        List<String> topics,
        List<String> topicPatterns,
        ZoneId zone,
        Path queuePath,
        int queueMaxRecords,
        int maxAttempts,
        int batchSize,
        long flushMillis,
        int concurrency,
        long retryBaseMillis,
        long retryMaxMillis,
        Duration requestTimeout,
        URI collectorUrl,
        AuthMode authMode,
        String authToken,
        URI loginUrl,
        String loginEmail,
        String loginPassword,
        long qps,
        int channelCapacity,
        int adminPort,
        Path rejectLog
) {
    public enum AuthMode { NONE, TOKEN, LOGIN }

    public static RelayConfig fromEnv() {
        return fromSources(System.getenv());
    }

    static RelayConfig fromSources(Map<String, String> env) {
        Reader r = new Reader(env);
        List<String> topics = list(r.get("topics", "sensors/#"));
        String patterns = r.get("patterns", null);
        String loginUrl = r.get("login.url", null);
        return new RelayConfig(
                r.get("broker.host", "localhost"),
                Integer.parseInt(r.get("broker.port", "1883")),
                r.get("broker.client.id", "datalogger-relay"),
                r.get("broker.username", null),
                r.get("broker.password", null),
                topics,
                patterns == null ? topics : list(patterns),
                ZoneId.of(r.get("zone", "UTC")),
                Path.of(r.get("queue.path", "./data/queue")),
                Integer.parseInt(r.get("queue.max.records", "100000")),
                Integer.parseInt(r.get("max.attempts", "10")),
                Integer.parseInt(r.get("batch.size", "50")),
                Long.parseLong(r.get("flush.millis", "500")),
                Integer.parseInt(r.get("concurrency", "2")),
                Long.parseLong(r.get("retry.base.millis", "1000")),
                Long.parseLong(r.get("retry.max.millis", "60000")),
                Duration.ofMillis(Long.parseLong(r.get("request.timeout.millis", "10000"))),
                URI.create(r.get("collector.url", "http://localhost:8080/ingest")),
                AuthMode.valueOf(r.get("auth.mode", "none").toUpperCase(Locale.ROOT)),
                r.get("auth.token", null),
                loginUrl == null ? null : URI.create(loginUrl),
                r.get("login.email", null),
                r.get("login.password", null),
                Long.parseLong(r.get("qps", "0")),
                Integer.parseInt(r.get("channel.capacity", "256")),
                Integer.parseInt(r.get("admin.port", "9090")),
                Path.of(r.get("reject.log", "./data/rejected.jsonl"))
        ).validate();
    }

    public RelayConfig validate() {
        require(brokerPort > 0 && brokerPort <= 65535, "broker port out of range: " + brokerPort);
        require(!topics.isEmpty(), "at least one topic filter is required");
        require(!topicPatterns.isEmpty(), "at least one topic pattern is required");
        require(queueMaxRecords > 0, "queue max records must be positive");
        require(maxAttempts > 0, "max attempts must be positive");
        require(batchSize > 0, "batch size must be positive");
        require(flushMillis >= 0, "flush millis must not be negative");
        require(concurrency > 0, "concurrency must be positive");
        require(retryBaseMillis > 0 && retryMaxMillis >= retryBaseMillis, "retry max must be >= retry base > 0");
        require(!requestTimeout.isNegative() && !requestTimeout.isZero(), "request timeout must be positive");
        require(qps >= 0, "qps must not be negative");
        require(channelCapacity > 0, "channel capacity must be positive");
        require(adminPort >= 0 && adminPort <= 65535, "admin port out of range: " + adminPort);
        String scheme = collectorUrl.getScheme();
        require("http".equals(scheme) || "https".equals(scheme), "collector url must be http(s): " + collectorUrl);
        if (authMode == AuthMode.TOKEN) require(authToken != null && !authToken.isBlank(), "auth mode token needs datalogger.auth.token");
        if (authMode == AuthMode.LOGIN) {
            require(loginUrl != null, "auth mode login needs datalogger.login.url");
            require(loginEmail != null && loginPassword != null, "auth mode login needs datalogger.login.email and datalogger.login.password");
        }
        return this;
    }

    /** H2 file database URL for the queue. */
    public String queueJdbcUrl() {
        return "jdbc:h2:file:" + queuePath.toAbsolutePath();
    }

    private static void require(boolean ok, String message) {
        if (!ok) throw new IllegalArgumentException(message);
    }

    private static List<String> list(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "RelayConfig{broker=" + brokerHost + ":" + brokerPort + ", clientId=" + clientId
                + ", topics=" + topics + ", queue=" + queuePath + ", collector=" + collectorUrl
                + ", auth=" + authMode + ", batchSize=" + batchSize + ", concurrency=" + concurrency + "}";
    }

    private static final class Reader {
        private final Map<String, String> env;

        Reader(Map<String, String> env) { this.env = env; }

        String get(String key, String def) {
            String prop = System.getProperty("datalogger." + key);
            if (prop != null) return prop;
            String envKey = "DATALOGGER_" + key.toUpperCase(Locale.ROOT).replace('.', '_');
            return env.getOrDefault(envKey, def);
        }
    }
}
