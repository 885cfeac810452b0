package com.broadcaster.poller;

import com.broadcaster.api.ExchangeGateway;
import com.broadcaster.cache.AccountCacheRegistry;
import com.broadcaster.cache.AccountSnapshot;
import com.broadcaster.cache.ChangeDetector;
import com.broadcaster.cache.PointsTracker;
import com.broadcaster.config.AccountIdentity;
import com.broadcaster.notifications.NotificationChannel;
import com.broadcaster.persistence.HistoryStore;
import com.broadcaster.persistence.PersistenceQueue;
import com.broadcaster.risk.AlertState;
import com.broadcaster.risk.MarginAlert;
import com.broadcaster.risk.MarginRiskMonitor;
import com.broadcaster.websocket.BroadcastMessages;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AccountPoller Tests")
class AccountPollerTest {

    private static final Instant NOW = Instant.parse("2025-01-10T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final AccountIdentity main = new AccountIdentity("account_1", "Main", "k1", null, null);
    private final AccountIdentity hedge = new AccountIdentity("account_2", "Hedge", "k2", null, null);

    private ExchangeGateway gateway;
    private HistoryStore store;
    private NotificationChannel channel;
    private PersistenceQueue persistence;
    private AccountCacheRegistry registry;
    private PointsTracker points;
    private List<ObjectNode> published;
    private AccountPoller poller;

    @BeforeEach
    void setUp() {
        gateway = mock(ExchangeGateway.class);
        store = mock(HistoryStore.class);
        channel = mock(NotificationChannel.class);
        when(channel.name()).thenReturn("telegram");
        when(channel.minimumThreshold()).thenReturn(0.70);
        when(channel.isConfigured()).thenReturn(true);
        when(channel.send(any(MarginAlert.class))).thenReturn(true);

        persistence = new PersistenceQueue();
        registry = new AccountCacheRegistry(List.of(main, hedge), clock);
        points = new PointsTracker();
        published = new CopyOnWriteArrayList<>();

        var riskMonitor = new MarginRiskMonitor(List.of(0.70, 0.80, 0.90, 0.95), Duration.ofMinutes(30),
            List.of(channel), new AlertState(), clock, new SimpleMeterRegistry());
        poller = new AccountPoller(registry, gateway, new ChangeDetector(), new BroadcastMessages(mapper, clock),
            published::add, persistence, store, riskMonitor, points, Runnable::run, clock);
    }

    @AfterEach
    void tearDown() {
        persistence.stop();
    }

    private void respond(AccountIdentity account, String path, String json) throws Exception {
        when(gateway.fetch(eq(account), eq(path), anyMap())).thenReturn(Optional.of(mapper.readTree(json)));
    }

    private List<String> publishedTypes() {
        return published.stream().map(m -> m.path("type").asText()).toList();
    }

    private AccountSnapshot snapshot(AccountIdentity account) {
        return registry.require(account);
    }

    @Nested
    @DisplayName("Fast cadence")
    class Fast {

        @Test
        @DisplayName("First poll should publish account and orders updates")
        void firstPoll() throws Exception {
            respond(main, AccountPoller.POSITIONS_PATH, "{\"data\":[{\"market\":\"BTC-USD\",\"size\":\"1\"}]}");
            respond(main, AccountPoller.BALANCE_PATH, "{\"data\":{\"equity\":\"1000\",\"marginRatio\":\"0.1\"}}");
            respond(main, AccountPoller.ORDERS_PATH, "{\"data\":[{\"id\":\"o1\"}]}");

            poller.pollFast();

            assertEquals(List.of("account_update", "orders_update"), publishedTypes());
            ObjectNode update = published.get(0);
            assertEquals("account_1", update.path("account_id").asText());
            assertTrue(update.path("positions").isObject());
            assertTrue(update.path("balance").isObject());
            assertTrue(snapshot(main).isInitialized());
            assertFalse(snapshot(hedge).isInitialized());

            persistence.stop();
            verify(store).savePositions(eq(main), any(JsonNode.class));
            verify(store).saveSnapshot(eq(main), any(JsonNode.class), any());
            verify(store).saveOrders(eq(main), any(JsonNode.class));
        }

        @Test
        @DisplayName("Reordered payload should not produce an event")
        void reorderedPayload() throws Exception {
            respond(main, AccountPoller.BALANCE_PATH, "{\"equity\":\"1000\",\"marginRatio\":\"0.1\"}");
            poller.pollFast();
            published.clear();

            respond(main, AccountPoller.BALANCE_PATH, "{\"marginRatio\":\"0.1\",\"equity\":\"1000\"}");
            poller.pollFast();

            assertTrue(published.isEmpty());
        }

        @Test
        @DisplayName("Only the changed field should be sent")
        void partialChange() throws Exception {
            respond(main, AccountPoller.POSITIONS_PATH, "[{\"market\":\"ETH-USD\"}]");
            respond(main, AccountPoller.BALANCE_PATH, "{\"equity\":\"1000\"}");
            poller.pollFast();
            published.clear();

            respond(main, AccountPoller.BALANCE_PATH, "{\"equity\":\"990\"}");
            poller.pollFast();

            assertEquals(1, published.size());
            assertTrue(published.get(0).get("positions").isNull());
            assertEquals("990", published.get(0).path("balance").path("equity").asText());
        }

        @Test
        @DisplayName("Failing account should not stop its siblings")
        void failureIsolation() throws Exception {
            when(gateway.fetch(eq(hedge), anyString(), anyMap())).thenThrow(new IllegalStateException("proxy down"));
            respond(main, AccountPoller.BALANCE_PATH, "{\"equity\":\"1000\"}");

            assertDoesNotThrow(() -> poller.pollFast());

            assertEquals(List.of("account_update"), publishedTypes());
            assertNotNull(snapshot(main).get(AccountSnapshot.Field.BALANCE));
            assertNull(snapshot(hedge).get(AccountSnapshot.Field.BALANCE));
        }

        @Test
        @DisplayName("Empty fetches should leave the cache untouched")
        void emptyFetch() {
            poller.pollFast();

            assertTrue(published.isEmpty());
            assertTrue(snapshot(main).lastUpdate(AccountSnapshot.Field.BALANCE).isEmpty());
        }
    }

    @Nested
    @DisplayName("Medium cadence")
    class Medium {

        @Test
        @DisplayName("Changed closed positions should be published and saved per record")
        void tradesChanged() throws Exception {
            respond(main, AccountPoller.TRADES_PATH, "{\"data\":[{\"id\":\"1\"},{\"id\":\"2\"}]}");

            poller.pollTrades();
            poller.pollTrades();

            assertEquals(List.of("trades_update"), publishedTypes());
            persistence.stop();
            verify(store, times(2)).saveTrade(eq(main), any(JsonNode.class));
            verify(store, never()).saveTrade(eq(hedge), any(JsonNode.class));
        }
    }

    @Nested
    @DisplayName("Slow cadence")
    class Slow {

        @Test
        @DisplayName("Points should be published only when they change")
        void pointsUpdate() throws Exception {
            respond(main, AccountPoller.POINTS_PATH, "{\"data\":[{\"points\":\"10\"},{\"points\":\"5\"}]}");
            respond(hedge, AccountPoller.POINTS_PATH, "{\"data\":[{\"points\":\"2\"}]}");

            poller.pollPoints();
            poller.pollPoints();

            assertEquals(List.of("points_update"), publishedTypes());
            ObjectNode message = published.get(0);
            assertEquals(17.0, message.path("total_points").asDouble());
            assertEquals(15.0, message.path("accounts").path("account_1").path("points").asDouble());
            assertEquals(NOW, points.getLastRefresh());
        }

        @Test
        @DisplayName("Risk check should alert from the cached balance")
        void riskCheck() throws Exception {
            respond(main, AccountPoller.BALANCE_PATH, "{\"equity\":\"1000\",\"marginRatio\":\"0.75\"}");
            respond(hedge, AccountPoller.BALANCE_PATH, "{\"equity\":\"1000\",\"marginRatio\":\"0.20\"}");
            poller.pollFast();

            poller.checkRisk();
            poller.checkRisk();

            verify(channel, times(1)).send(any(MarginAlert.class));
        }
    }
}
