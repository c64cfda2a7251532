package io.datalogger.aqi;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datalogger.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * One poll of the AQI API, formatted and published to the broker, with an audit row per cycle.
 */
public class FeedCycle {
    private static final Logger log = LoggerFactory.getLogger(FeedCycle.class);

    static final String NO_DATA = "ERROR: No Data to Format";
    static final String API_FAILED = "ERROR: API Request Failed";
    static final String EXCEPTION = "ERROR: Exception";

    public enum Outcome { PUBLISHED, PUBLISH_FAILED, NO_DATA, API_ERROR, AUTH_FAILED, FAILED }

    private final AqiClient client;
    private final AqiPayloadFormatter formatter;
    private final FeedPublisher publisher;
    private final CsvAuditLog audit;
    private final ObjectMapper mapper;
    private final Metrics metrics;

    public FeedCycle(AqiClient client, AqiPayloadFormatter formatter, FeedPublisher publisher, CsvAuditLog audit,
                     ObjectMapper mapper, MetricRegistry registry) {
        this.client = client;
        this.formatter = formatter;
        this.publisher = publisher;
        this.audit = audit;
        this.mapper = mapper;
        this.metrics = new Metrics(registry);
    }

    public Outcome runOnce() throws InterruptedException {
        String request = "GET " + client.devicesUri();
        Outcome outcome;
        try (Timer.Context ignored = metrics.timer("feed.cycle.time").time()) {
            outcome = fetchAndPublish(request);
        }
        metrics.meter("feed.cycle." + outcome.name().toLowerCase(Locale.ROOT)).mark();
        return outcome;
    }

    private Outcome fetchAndPublish(String request) throws InterruptedException {
        try {
            AqiClient.ApiResponse resp = client.fetchDevices();
            if (!resp.ok()) {
                log.warn("API error {}: {}", resp.statusCode(), resp.body());
                audit.append(request, resp.body(), API_FAILED);
                return Outcome.API_ERROR;
            }
            JsonNode json = mapper.readTree(resp.body());
            String raw = mapper.writeValueAsString(json);
            Optional<String> payload = formatter.format(json);
            if (payload.isEmpty()) {
                log.warn("Valid JSON received but no device data found to format");
                audit.append(request, raw, NO_DATA);
                return Outcome.NO_DATA;
            }
            String line = payload.get();
            log.info("Payload generated: {}", line.length() > 50 ? line.substring(0, 50) + "..." : line);
            boolean published = publisher.publish(line);
            audit.append(request, raw, line);
            return published ? Outcome.PUBLISHED : Outcome.PUBLISH_FAILED;
        } catch (AqiApiException e) {
            log.error("Could not authenticate with the AQI API: {}", e.getMessage());
            return Outcome.AUTH_FAILED;
        } catch (JsonProcessingException e) {
            log.error("API answered with invalid JSON", e);
            audit.append(request, e.getOriginalMessage(), EXCEPTION);
            return Outcome.FAILED;
        } catch (IOException | RuntimeException e) {
            log.error("Feed cycle failed", e);
            audit.append(request, e.toString(), EXCEPTION);
            return Outcome.FAILED;
        }
    }

    /** Runs a cycle every {@code interval}, sleeping whatever the cycle did not use. */
    public void run(Duration interval, BooleanSupplier keepRunning) throws InterruptedException {
        log.info("Starting feed, interval {} s", interval.toSeconds());
        while (keepRunning.getAsBoolean()) {
            long t0 = System.nanoTime();
            runOnce();
            long sleep = interval.toMillis() - Duration.ofNanos(System.nanoTime() - t0).toMillis();
            if (sleep > 0) {
                log.debug("Sleeping for {} ms", sleep);
                Thread.sleep(sleep);
            }
        }
    }
}
