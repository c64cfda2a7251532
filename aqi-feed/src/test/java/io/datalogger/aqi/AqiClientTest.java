package io.datalogger.aqi;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AqiClientTest {
    FakeAqiApi api;
    final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void start() throws Exception { api = new FakeAqiApi(); }

    @AfterEach
    void stop() { api.close(); }

    private AqiClient client() {
        return new AqiClient(HttpClient.newHttpClient(), api.loginUri(), api.devicesUri(), "ops@example.com", "s3cret",
                Duration.ofSeconds(2), mapper);
    }

    @Test
    void logs_in_once_and_reuses_the_token() throws Exception {
        AqiClient c = client();
        assertFalse(c.hasToken());
        assertTrue(c.fetchDevices().ok());
        assertTrue(c.fetchDevices().ok());
        assertEquals(1, api.logins.get());
        assertEquals(List.of("bearer tok-1", "bearer tok-1"), api.deviceAuth);
    }

    @Test
    void expired_token_triggers_one_login_and_retry() throws Exception {
        api.firstAcceptedLogin = 2;
        AqiClient.ApiResponse resp = client().fetchDevices();
        assertTrue(resp.ok());
        assertEquals(2, api.logins.get());
        assertEquals(List.of("bearer tok-1", "bearer tok-2"), api.deviceAuth);
    }

    @Test
    void repeated_401_is_returned_not_looped() throws Exception {
        api.firstAcceptedLogin = Integer.MAX_VALUE;
        AqiClient c = client();
        assertEquals(401, c.fetchDevices().statusCode());
        assertEquals(2, api.logins.get());
        assertFalse(c.hasToken());
    }

    @Test
    void login_failures_carry_the_status() {
        api.loginStatus = 403;
        AqiApiException e = assertThrows(AqiApiException.class, () -> client().login());
        assertEquals(403, e.statusCode());
    }

    @Test
    void login_without_token_is_not_an_http_failure() {
        api.loginBody = "{\"message\":\"ok\"}";
        AqiApiException e = assertThrows(AqiApiException.class, () -> client().login());
        assertEquals(-1, e.statusCode());
    }

    @Test
    void device_list_defaults_missing_fields() throws Exception {
        List<AqiDevice> devices = AqiClient.devices(mapper.readTree(FakeAqiApi.SAMPLE));
        assertEquals(List.of(new AqiDevice("Lobby", "AQ-001"), new AqiDevice("Roof", "N/A")), devices);
        assertTrue(AqiClient.devices(mapper.readTree("{}")).isEmpty());
    }
}
