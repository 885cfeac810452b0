package com.broadcaster.broker;

import com.broadcaster.cache.OrderBookCache;
import com.broadcaster.cache.OrderBookSnapshot;
import com.broadcaster.websocket.BroadcastMessages;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("OrderBookStreamClient Tests")
class OrderBookStreamClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2025-01-10T12:00:00Z"), ZoneOffset.UTC);
    private OrderBookCache cache;
    private List<ObjectNode> published;
    private OrderBookStreamClient client;

    @BeforeEach
    void setUp() {
        cache = new OrderBookCache();
        published = new CopyOnWriteArrayList<>();
        client = newClient("ws://localhost:1/stream", published::add);
    }

    @AfterEach
    void tearDown() {
        client.stop();
    }

    private OrderBookStreamClient newClient(String url, java.util.function.Consumer<ObjectNode> publisher) {
        return new OrderBookStreamClient(url, List.of("BTC-USD", "ETH-USD"), Optional.empty(), 3, cache,
            new BroadcastMessages(mapper, clock), publisher,
            new ReconnectBackoff(Duration.ofSeconds(30), Duration.ofMinutes(5)), mapper, clock);
    }

    private static Response upgradeResponse() {
        return new Response.Builder()
            .request(new Request.Builder().url("http://localhost/stream").build())
            .protocol(Protocol.HTTP_1_1)
            .code(101)
            .message("Switching Protocols")
            .build();
    }

    @Nested
    @DisplayName("Message handling")
    class Messages {

        @Test
        @DisplayName("Should replace the book and publish an update")
        void appliesBook() {
            boolean applied = client.handleMessage(
                "{\"type\":\"SNAPSHOT\",\"seq\":7,\"data\":{\"m\":\"BTC-USD\","
                    + "\"b\":[{\"p\":\"65000.5\",\"q\":\"0.2\"}],\"a\":[{\"p\":\"65001\",\"q\":\"1.5\"}]}}");

            assertTrue(applied);
            OrderBookSnapshot book = cache.get("BTC-USD").orElseThrow();
            assertEquals(0, new BigDecimal("65000.5").compareTo(book.bestBid()));
            assertEquals(0, new BigDecimal("65001").compareTo(book.bestAsk()));
            assertEquals(7, book.sequence());
            assertEquals(1, published.size());
            assertEquals("orderbook_update", published.get(0).path("type").asText());
            assertEquals(1, client.getMessagesReceived());
        }

        @Test
        @DisplayName("Should truncate depth to the configured levels")
        void truncatesDepth() {
            client.handleMessage("{\"market\":\"ETH-USD\",\"bids\":[[\"3000\",\"1\"],[\"2999\",\"2\"],"
                + "[\"2998\",\"3\"],[\"2997\",\"4\"],[\"2996\",\"5\"]],\"asks\":[]}");

            OrderBookSnapshot book = cache.get("ETH-USD").orElseThrow();
            assertEquals(3, book.bids().size());
            assertTrue(book.asks().isEmpty());
            assertEquals(0, new BigDecimal("2998").compareTo(book.bids().get(2).price()));
        }

        @Test
        @DisplayName("Should drop messages without a market")
        void dropsWithoutMarket() {
            assertFalse(client.handleMessage("{\"type\":\"PING\",\"data\":{\"b\":[]}}"));
            assertFalse(client.handleMessage("not json"));

            assertEquals(0, cache.size());
            assertTrue(published.isEmpty());
        }

        @Test
        @DisplayName("Should skip malformed levels and keep the rest")
        void skipsMalformedLevels() {
            client.handleMessage("{\"m\":\"BTC-USD\",\"b\":[{\"p\":\"abc\",\"q\":\"1\"},{\"p\":\"64000\",\"q\":\"1\"}]}");

            OrderBookSnapshot book = cache.get("BTC-USD").orElseThrow();
            assertEquals(1, book.bids().size());
            assertEquals(0, new BigDecimal("64000").compareTo(book.bestBid()));
        }
    }

    @Nested
    @DisplayName("Connection lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Open should send the subscription and mark the stream subscribed")
        void subscribesOnOpen() throws Exception {
            WebSocket ws = mock(WebSocket.class);

            client.onOpen(ws, upgradeResponse());

            ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
            verify(ws).send(sent.capture());
            JsonNode subscribe = mapper.readTree(sent.getValue());
            assertEquals("subscribe", subscribe.path("type").asText());
            assertEquals("BTC-USD", subscribe.path("markets").get(0).asText());
            assertEquals(StreamState.SUBSCRIBED, client.getState());
            assertTrue(client.isConnected());
        }

        @Test
        @DisplayName("Failure should disconnect and schedule a reconnect")
        void failureSchedulesReconnect() {
            WebSocket ws = mock(WebSocket.class);
            client.onOpen(ws, upgradeResponse());

            client.onFailure(ws, new java.io.IOException("reset"), null);

            assertEquals(StreamState.DISCONNECTED, client.getState());
            assertEquals(1, client.getReconnects());
        }

        @Test
        @DisplayName("Stop should prevent reconnects")
        void stopPreventsReconnect() {
            client.stop();

            client.onClosed(mock(WebSocket.class), 1000, "bye");

            assertEquals(0, client.getReconnects());
            assertEquals(StreamState.DISCONNECTED, client.getState());
        }

        @Test
        @DisplayName("Should subscribe and apply books from a live socket")
        void liveSocket() throws Exception {
            AtomicReference<String> subscription = new AtomicReference<>();
            MockWebServer server = new MockWebServer();
            server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
                @Override
                public void onMessage(WebSocket webSocket, String text) {
                    subscription.set(text);
                    webSocket.send("{\"data\":{\"m\":\"ETH-USD\",\"b\":[{\"p\":\"3000\",\"q\":\"2\"}],\"a\":[]}}");
                }
            }));
            server.start();

            CountDownLatch received = new CountDownLatch(1);
            OrderBookStreamClient live = newClient(server.url("/stream").toString().replace("http", "ws"), message -> {
                published.add(message);
                received.countDown();
            });
            try {
                live.connect();

                assertTrue(received.await(5, TimeUnit.SECONDS));
                assertTrue(subscription.get().contains("\"orderbooks\""));
                assertTrue(live.isConnected());
                assertTrue(cache.get("ETH-USD").isPresent());
            } finally {
                live.stop();
                server.shutdown();
            }
        }
    }
}
