package com.broadcaster.api;

import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExtendedApiClient Tests")
class ExtendedApiClientTest {

    private MockWebServer server;
    private ExtendedApiClient client;
    private AccountIdentity account;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        var http = new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(2)).build();
        client = new ExtendedApiClient(http, new ObjectMapper());
        account = new AccountIdentity("account_1", "Main", "secret-key",
            server.url("/api/v1").toString(), null);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should send API key, user agent and query parameters")
    void sendsHeaders() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"status\":\"OK\",\"data\":[]}"));

        var result = client.fetch(account, "/user/orders", Map.of("status", "ACTIVE"));

        assertTrue(result.isPresent());
        assertEquals("OK", result.get().path("status").asText());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/api/v1/user/orders?status=ACTIVE", request.getPath());
        assertEquals("secret-key", request.getHeader("X-Api-Key"));
        assertEquals("extended-broadcaster/3.0-multiaccount", request.getHeader("User-Agent"));
    }

    @Test
    @DisplayName("Should return empty on non-2xx status")
    void non2xxIsEmpty() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"rate limited\"}"));

        assertTrue(client.fetch(account, "/user/balance").isEmpty());
    }

    @Test
    @DisplayName("Should return empty on an unparseable body")
    void garbageIsEmpty() {
        server.enqueue(new MockResponse().setBody("<html>bad gateway</html>"));

        assertTrue(client.fetch(account, "/user/balance").isEmpty());
    }

    @Test
    @DisplayName("get() should expose the status code of a rejected call")
    void getThrowsWithStatus() {
        server.enqueue(new MockResponse().setResponseCode(503));

        var e = assertThrows(ExchangeRequestException.class,
            () -> client.get(account, "/user/positions", Map.of()));
        assertEquals(503, e.getStatusCode());
        assertEquals("account_1", e.getAccountId());
        assertEquals("/user/positions", e.getPath());
    }

    @Test
    @DisplayName("Should return empty when the connection drops")
    void transportFailureIsEmpty() throws IOException {
        server.shutdown();

        assertTrue(client.fetch(account, "/user/positions").isEmpty());
    }
}
