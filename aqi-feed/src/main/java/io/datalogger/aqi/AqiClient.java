package io.datalogger.aqi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Minimal AQI.in client: form login for a bearer token, then the account's device list.
 * The token is kept until the API answers 401.
 */
public class AqiClient {
    private static final Logger log = LoggerFactory.getLogger(AqiClient.class);

    public static final URI DEFAULT_LOGIN_URI = URI.create("https://airquality.aqi.in/api/v1/login");
    public static final URI DEFAULT_DEVICES_URI = URI.create("https://airquality.aqi.in/api/v1/GetAllUserDevices");

    private final HttpClient http;
    private final URI loginUri;
    private final URI devicesUri;
    private final String email;
    private final String password;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private volatile String token;

    public AqiClient(HttpClient http, URI loginUri, URI devicesUri, String email, String password,
                     Duration timeout, ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http");
        this.loginUri = Objects.requireNonNull(loginUri, "loginUri");
        this.devicesUri = Objects.requireNonNull(devicesUri, "devicesUri");
        this.email = Objects.requireNonNull(email, "email");
        this.password = Objects.requireNonNull(password, "password");
        this.timeout = timeout;
        this.mapper = mapper;
    }

    /** Raw answer of the device endpoint. */
    public record ApiResponse(int statusCode, String body) {
        public boolean ok() { return statusCode == 200; }
    }

    public URI devicesUri() { return devicesUri; }

    public boolean hasToken() { return token != null; }

    public String login() throws AqiApiException, IOException, InterruptedException {
        String form = "email=" + URLEncoder.encode(email, StandardCharsets.UTF_8)
                + "&password=" + URLEncoder.encode(password, StandardCharsets.UTF_8);
        HttpRequest req = HttpRequest.newBuilder(loginUri)
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        log.info("Requesting new token from {}", loginUri);
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new AqiApiException("login failed with status " + resp.statusCode(), resp.statusCode());
        }
        JsonNode t;
        try {
            t = mapper.readTree(resp.body()).get("token");
        } catch (JsonProcessingException e) {
            throw new AqiApiException("login response is not JSON", -1);
        }
        if (t == null || !t.isTextual() || t.asText().isEmpty()) {
            throw new AqiApiException("no token returned", -1);
        }
        token = t.asText();
        return token;
    }

    /**
     * Fetches all devices of the account, logging in first if needed. A 401 drops the token,
     * logs in again and repeats the request once.
     */
    public ApiResponse fetchDevices() throws AqiApiException, IOException, InterruptedException {
        if (token == null) login();
        ApiResponse resp = getDevices();
        if (resp.statusCode() == 401) {
            log.info("Token expired, re-authenticating");
            token = null;
            login();
            resp = getDevices();
        }
        return resp;
    }

    private ApiResponse getDevices() throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(devicesUri)
                .timeout(timeout)
                .header("Authorization", "bearer " + token)
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 401) token = null;
        return new ApiResponse(resp.statusCode(), resp.body());
    }

    /** Devices listed under {@code data}; missing fields read as {@code N/A}. */
    public static List<AqiDevice> devices(JsonNode root) {
        List<AqiDevice> out = new ArrayList<>();
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isArray()) return out;
        for (JsonNode d : data) {
            out.add(new AqiDevice(d.path("devicename").asText("N/A"), d.path("serialNo").asText("N/A")));
        }
        return out;
    }
}
