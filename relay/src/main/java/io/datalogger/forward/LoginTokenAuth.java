package io.datalogger.forward;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Logs in with a form-encoded email/password and caches the returned {@code {"token": ...}} until
 * the collector rejects it. Login failures are transient so queued readings are kept.
 */
public class LoginTokenAuth implements CollectorAuth {
    private final HttpClient client;
    private final URI loginUri;
    private final String email;
    private final String password;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private volatile String token;

    public LoginTokenAuth(HttpClient client, URI loginUri, String email, String password, Duration timeout, ObjectMapper mapper) {
        this.client = client;
        this.loginUri = loginUri;
        this.email = email;
        this.password = password;
        this.timeout = timeout;
        this.mapper = mapper;
    }

    @Override
    public synchronized Optional<String> bearerToken() throws ForwardException {
        if (token == null) token = login();
        return Optional.of(token);
    }

    @Override
    public void invalidate() { token = null; }

    @Override
    public boolean refreshable() { return true; }

    private String login() throws ForwardException {
        String form = "email=" + URLEncoder.encode(email, StandardCharsets.UTF_8)
                + "&password=" + URLEncoder.encode(password, StandardCharsets.UTF_8);
        HttpRequest req = HttpRequest.newBuilder(loginUri)
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw ForwardException.transientFailure("collector login failed: " + e, ForwardException.NO_STATUS, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ForwardException.transientFailure("collector login interrupted", ForwardException.NO_STATUS, e);
        }
        if (resp.statusCode() != 200) {
            throw ForwardException.transientFailure("collector login returned " + resp.statusCode(), resp.statusCode(), null);
        }
        try {
            JsonNode t = mapper.readTree(resp.body()).get("token");
            if (t == null || !t.isTextual() || t.asText().isEmpty()) {
                throw ForwardException.transientFailure("collector login response has no token", resp.statusCode(), null);
            }
            return t.asText();
        } catch (IOException e) {
            throw ForwardException.transientFailure("collector login response is not JSON", resp.statusCode(), e);
        }
    }
}
