package io.datalogger.forward;

import io.datalogger.core.Batch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Posts each batch to the collector endpoint as one JSON request.
 *
 * <p>Response classification: 2xx delivers the whole batch; 401 refreshes the token and resends
 * once, then counts as transient; 408 and 429 are transient; any other 4xx is a permanent
 * rejection; 5xx, timeouts and connection failures are transient.
 */
public class HttpCollectorForwarder implements Forwarder {
    private static final Logger log = LoggerFactory.getLogger(HttpCollectorForwarder.class);

    private final HttpClient client;
    private final URI collectorUri;
    private final Duration timeout;
    private final CollectorAuth auth;
    private final RequestRateLimiter limiter;
    private final BatchCodec codec;
    private final Clock clock;

    public HttpCollectorForwarder(HttpClient client, URI collectorUri, Duration timeout, CollectorAuth auth,
                                  RequestRateLimiter limiter, BatchCodec codec, Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.collectorUri = Objects.requireNonNull(collectorUri, "collectorUri");
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        this.auth = auth == null ? CollectorAuth.none() : auth;
        this.limiter = limiter == null ? RequestRateLimiter.unlimited() : limiter;
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public DeliveryReport send(Batch batch) throws ForwardException {
        if (batch.isEmpty()) return new DeliveryReport(batch.sequences(), 0, 0, Duration.ZERO);
        long t0 = System.nanoTime();
        byte[] body = codec.encode(batch, clock.instant());
        String batchId = BatchCodec.batchId(batch);

        int requests = 1;
        HttpResponse<String> resp = post(body, batchId);
        if (resp.statusCode() == 401 && auth.refreshable()) {
            log.info("Collector rejected token for batch {}, logging in again", batchId);
            auth.invalidate();
            requests++;
            resp = post(body, batchId);
        }

        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
            log.debug("Batch {} ({} readings) accepted with {} in {} ms", batchId, batch.size(), status, elapsed.toMillis());
            return new DeliveryReport(batch.sequences(), status, requests, elapsed);
        }
        String detail = "collector returned " + status + " for batch " + batchId + summarize(resp.body());
        if (isPermanent(status)) {
            throw ForwardException.permanentFailure(detail, status);
        }
        throw ForwardException.transientFailure(detail, status, null);
    }

    static boolean isPermanent(int status) {
        if (status == 401 || status == 408 || status == 429) return false;
        return status >= 400 && status < 500;
    }

    private HttpResponse<String> post(byte[] body, String batchId) throws ForwardException {
        Optional<String> token = auth.bearerToken();
        HttpRequest.Builder req = HttpRequest.newBuilder(collectorUri)
                .timeout(timeout)
                .header("Content-Type", BatchCodec.CONTENT_TYPE)
                .header("X-Batch-Id", batchId)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        token.ifPresent(t -> req.header("Authorization", "Bearer " + t));
        try {
            limiter.acquire();
            return client.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw ForwardException.transientFailure("collector timed out after " + timeout.toMillis() + " ms for batch " + batchId,
                    ForwardException.NO_STATUS, e);
        } catch (IOException e) {
            throw ForwardException.transientFailure("collector unreachable for batch " + batchId + ": " + e,
                    ForwardException.NO_STATUS, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ForwardException.transientFailure("interrupted while sending batch " + batchId, ForwardException.NO_STATUS, e);
        }
    }

    private static String summarize(String body) {
        if (body == null || body.isBlank()) return "";
        String s = body.strip();
        return ": " + (s.length() > 200 ? s.substring(0, 200) + "..." : s);
    }
}
