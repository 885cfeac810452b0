package com.broadcaster.api.controller;

import com.broadcaster.api.ResilientExchangeGateway;
import com.broadcaster.api.model.BalanceSummary;
import com.broadcaster.broker.OrderBookStreamClient;
import com.broadcaster.cache.AccountCacheRegistry;
import com.broadcaster.cache.AccountSnapshot;
import com.broadcaster.cache.OrderBookCache;
import com.broadcaster.cache.OrderBookSnapshot;
import com.broadcaster.cache.PointsTracker;
import com.broadcaster.persistence.HistoryArchiver;
import com.broadcaster.persistence.HistoryStore;
import com.broadcaster.persistence.HistoryStoreException;
import com.broadcaster.persistence.PeriodStats;
import com.broadcaster.persistence.PersistenceQueue;
import com.broadcaster.risk.MarginRiskMonitor;
import com.broadcaster.websocket.BroadcastHub;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for the broadcaster: cached account state, order books, points, history, stats and alerts.
 * Cached endpoints are served from memory and never call the exchange.
 */
public final class BroadcasterController {
    private static final Logger logger = LoggerFactory.getLogger(BroadcasterController.class);
    private static final String SERVICE_NAME = "extended-multi-account-broadcaster";

    private final AccountCacheRegistry registry;
    private final OrderBookCache orderBooks;
    private final PointsTracker points;
    private final BroadcastHub hub;
    private final Optional<OrderBookStreamClient> stream;
    private final ResilientExchangeGateway gateway;
    private final HistoryStore store;
    private final HistoryArchiver archiver;
    private final PersistenceQueue persistence;
    private final MarginRiskMonitor riskMonitor;
    private final Clock clock;

    public BroadcasterController(AccountCacheRegistry registry,
                                 OrderBookCache orderBooks,
                                 PointsTracker points,
                                 BroadcastHub hub,
                                 Optional<OrderBookStreamClient> stream,
                                 ResilientExchangeGateway gateway,
                                 HistoryStore store,
                                 HistoryArchiver archiver,
                                 PersistenceQueue persistence,
                                 MarginRiskMonitor riskMonitor,
                                 Clock clock) {
        this.registry = registry;
        this.orderBooks = orderBooks;
        this.points = points;
        this.hub = hub;
        this.stream = stream;
        this.gateway = gateway;
        this.store = store;
        this.archiver = archiver;
        this.persistence = persistence;
        this.riskMonitor = riskMonitor;
        this.clock = clock;
    }

    /**
     * Register all API routes.
     */
    public void registerRoutes(Javalin app) {
        app.get("/health", this::getHealth);

        // Cached state
        app.get("/api/cached-accounts", this::getCachedAccounts);
        app.get("/api/cached-account", this::getPrimaryAccount);
        app.get("/api/cached-account/{id}", this::getCachedAccount);
        app.get("/api/broadcaster/stats", this::getBroadcasterStats);

        // Market data
        app.get("/api/orderbook", this::getOrderBooks);
        app.get("/api/orderbook/{market}", this::getOrderBook);
        app.get("/api/points", this::getPoints);

        // History
        app.get("/api/account/{index}/history", this::getAccountHistory);
        app.get("/api/trades/recent", this::getRecentTrades);
        app.get("/api/trades", this::getTrades);
        app.get("/api/stats/periods", this::getPeriodStats);
        app.get("/api/stats/summary", this::getStatsSummary);
        app.post("/api/history/refresh", this::refreshHistory);

        // Alerts
        app.get("/api/alerts/status", this::getAlertStatus);
        app.post("/api/alerts/test", this::testAlerts);

        app.exception(HistoryStoreException.class, (e, ctx) -> {
            logger.error("History query failed on {}", ctx.path(), e);
            ctx.status(HttpStatus.SERVICE_UNAVAILABLE).json(Map.of("error", "History store unavailable"));
        });
    }

    // ==================== Health ====================

    private void getHealth(Context ctx) {
        List<Map<String, Object>> accounts = new ArrayList<>();
        for (AccountSnapshot snapshot : registry.all()) {
            accounts.add(Map.of(
                "id", snapshot.account().id(),
                "name", snapshot.account().name(),
                "cache_initialized", snapshot.isInitialized()
            ));
        }

        var broadcaster = new LinkedHashMap<String, Object>();
        broadcaster.put("connected_clients", hub.getSubscriberCount());
        broadcaster.put("accounts", accounts);
        broadcaster.put("orderbook_stream", stream.map(s -> s.getState().name()).orElse("DISABLED"));

        var health = new LinkedHashMap<String, Object>();
        health.put("status", "ok");
        health.put("service", SERVICE_NAME);
        health.put("accounts_configured", registry.size());
        health.put("broadcaster", broadcaster);
        ctx.json(health);
    }

    // ==================== Cached state ====================

    private void getCachedAccounts(Context ctx) {
        Instant now = clock.instant();
        var accounts = new LinkedHashMap<String, Object>();
        for (AccountSnapshot snapshot : registry.all()) {
            AccountSnapshot.View view = snapshot.view();
            var entry = new LinkedHashMap<String, Object>();
            entry.put("id", view.id());
            entry.put("name", view.name());
            putFields(entry, view);
            entry.put("cache_age_ms", view.cacheAgeMs(now));
            entry.put("last_update", view.lastUpdate());
            accounts.put(view.id(), entry);
        }

        var body = new LinkedHashMap<String, Object>();
        body.put("accounts", accounts);
        body.put("total_accounts", registry.size());
        body.put("timestamp", timestamp());
        ctx.json(body);
    }

    private void getPrimaryAccount(Context ctx) {
        registry.primary().ifPresentOrElse(
            snapshot -> ctx.json(accountBody(snapshot.view())),
            () -> ctx.status(HttpStatus.NOT_FOUND).json(Map.of("error", "No accounts configured")));
    }

    private void getCachedAccount(Context ctx) {
        String id = ctx.pathParam("id");
        registry.get(id).ifPresentOrElse(
            snapshot -> ctx.json(accountBody(snapshot.view())),
            () -> ctx.status(HttpStatus.NOT_FOUND).json(Map.of("error", "Account " + id + " not found")));
    }

    private Map<String, Object> accountBody(AccountSnapshot.View view) {
        var body = new LinkedHashMap<String, Object>();
        body.put("account_id", view.id());
        body.put("account_name", view.name());
        putFields(body, view);
        body.put("cache_age_ms", view.cacheAgeMs(clock.instant()));
        return body;
    }

    private static void putFields(Map<String, Object> target, AccountSnapshot.View view) {
        target.put("positions", view.positions());
        target.put("balance", view.balance());
        target.put("trades", view.trades());
        target.put("orders", view.orders());
    }

    private void getBroadcasterStats(Context ctx) {
        Instant now = clock.instant();
        List<Map<String, Object>> accounts = new ArrayList<>();
        for (AccountSnapshot snapshot : registry.all()) {
            AccountSnapshot.View view = snapshot.view();
            Map<String, Long> ages = view.cacheAgeMs(now);
            var entry = new LinkedHashMap<String, Object>();
            entry.put("id", view.id());
            entry.put("name", view.name());
            entry.put("positions_initialized", view.positions() != null);
            entry.put("balance_initialized", view.balance() != null);
            entry.put("trades_initialized", view.trades() != null);
            entry.put("orders_initialized", view.orders() != null);
            entry.put("positions_age_seconds", seconds(ages.get("positions")));
            entry.put("balance_age_seconds", seconds(ages.get("balance")));
            accounts.add(entry);
        }

        var broadcaster = new LinkedHashMap<String, Object>();
        broadcaster.put("connected_clients", hub.getSubscriberCount());
        broadcaster.put("accounts_configured", registry.size());
        broadcaster.put("messages_broadcast", hub.getMessagesBroadcast());
        broadcaster.put("failed_deliveries", hub.getFailedDeliveries());
        broadcaster.put("persistence_pending", persistence.getPending());
        broadcaster.put("persistence_failed", persistence.getFailed());
        broadcaster.put("circuit_breakers", gateway.getCircuitBreakerStates());
        stream.ifPresent(s -> {
            broadcaster.put("orderbook_state", s.getState().name());
            broadcaster.put("orderbook_messages", s.getMessagesReceived());
            broadcaster.put("orderbook_reconnects", s.getReconnects());
        });

        var body = new LinkedHashMap<String, Object>();
        body.put("broadcaster", broadcaster);
        body.put("accounts", accounts);
        body.put("timestamp", timestamp());
        ctx.json(body);
    }

    private static Long seconds(Long millis) {
        return millis == null ? null : millis / 1000;
    }

    // ==================== Market data ====================

    private void getOrderBooks(Context ctx) {
        var body = new LinkedHashMap<String, Object>();
        body.put("orderbooks", orderBooks.all());
        body.put("markets", orderBooks.size());
        body.put("stream_state", stream.map(s -> s.getState().name()).orElse("DISABLED"));
        body.put("timestamp", timestamp());
        ctx.json(body);
    }

    private void getOrderBook(Context ctx) {
        String market = ctx.pathParam("market").toUpperCase();
        Optional<OrderBookSnapshot> book = orderBooks.get(market);
        if (book.isEmpty()) {
            ctx.status(HttpStatus.NOT_FOUND).json(Map.of("error", "No order book for " + market));
            return;
        }
        ctx.json(book.get());
    }

    private void getPoints(Context ctx) {
        var body = new LinkedHashMap<String, Object>();
        body.put("accounts", points.all());
        body.put("total_points", points.totalPoints());
        body.put("total_last_week_points", points.totalLastWeekPoints());
        body.put("last_refresh", points.getLastRefresh());
        body.put("timestamp", timestamp());
        ctx.json(body);
    }

    // ==================== History ====================

    private void getAccountHistory(Context ctx) {
        int index = ctx.pathParamAsClass("index", Integer.class).get();
        int limit = ctx.queryParamAsClass("limit", Integer.class).getOrDefault(100);
        var history = store.getHistory(index, limit);

        var body = new LinkedHashMap<String, Object>();
        body.put("account_id", index);
        body.put("history", history);
        body.put("count", history.size());
        ctx.json(body);
    }

    private void getRecentTrades(Context ctx) {
        Integer accountIndex = accountIndexParam(ctx);
        int limit = ctx.queryParamAsClass("limit", Integer.class).getOrDefault(100);
        var trades = store.getRecentTrades(accountIndex, limit);

        var body = new LinkedHashMap<String, Object>();
        body.put("account_id", accountIndex);
        body.put("trades", trades);
        body.put("count", trades.size());
        ctx.json(body);
    }

    private void getTrades(Context ctx) {
        Integer accountIndex = accountIndexParam(ctx);
        int limit = ctx.queryParamAsClass("limit", Integer.class).getOrDefault(100);
        var trades = store.getClosedPositions(accountIndex, limit);

        var body = new LinkedHashMap<String, Object>();
        body.put("account_id", accountIndex);
        body.put("trades", trades);
        body.put("count", trades.size());
        body.put("timestamp", timestamp());
        ctx.json(body);
    }

    private void getPeriodStats(Context ctx) {
        Integer accountIndex = accountIndexParam(ctx);
        var body = new LinkedHashMap<String, Object>();
        body.put("account_id", accountIndex);
        body.put("stats", store.getStats(accountIndex));
        body.put("timestamp", timestamp());
        ctx.json(body);
    }

    private void getStatsSummary(Context ctx) {
        double totalEquity = 0.0;
        var accountsEquity = new LinkedHashMap<String, Double>();
        for (AccountSnapshot snapshot : registry.all()) {
            var balance = snapshot.get(AccountSnapshot.Field.BALANCE);
            if (balance == null) {
                continue;
            }
            double equity = BalanceSummary.from(balance).map(BalanceSummary::equity).orElse(0.0);
            accountsEquity.put(snapshot.account().id(), equity);
            totalEquity += equity;
        }

        Map<String, PeriodStats> stats = store.getStats(null);
        var body = new LinkedHashMap<String, Object>();
        body.put("total_equity", Math.round(totalEquity * 100.0) / 100.0);
        body.put("accounts_equity", accountsEquity);
        for (var entry : stats.entrySet()) {
            PeriodStats period = entry.getValue();
            body.put("pnl_" + entry.getKey(), period.totalPnl());
            body.put("volume_" + entry.getKey(), period.totalVolume());
            body.put("trades_" + entry.getKey(), period.tradesCount());
            body.put("win_rate_" + entry.getKey(), period.winRate());
        }
        body.put("closed_positions_archived", store.countClosedPositions());
        body.put("filled_orders_archived", store.countFilledOrders());
        body.put("timestamp", timestamp());
        ctx.json(body);
    }

    private void refreshHistory(Context ctx) {
        if (archiver.isRunning()) {
            ctx.status(HttpStatus.CONFLICT).json(Map.of("status", "busy", "message", "Archive pass in progress"));
            return;
        }
        archiver.requestFullRefresh();
        logger.info("📚 Full history refresh requested via API");
        ctx.status(HttpStatus.ACCEPTED).json(Map.of("status", "accepted"));
    }

    // ==================== Alerts ====================

    private void getAlertStatus(Context ctx) {
        var body = new LinkedHashMap<String, Object>();
        body.put("thresholds", riskMonitor.getThresholds());
        body.put("cooldown_minutes", riskMonitor.getCooldown().toMinutes());
        body.put("channels", riskMonitor.channelStatus());
        body.put("alert_state", riskMonitor.getState().snapshot());
        ctx.json(body);
    }

    private void testAlerts(Context ctx) {
        logger.info("🧪 Sending test alert through all channels");
        Map<String, Boolean> results = riskMonitor.testAllChannels();
        var body = new LinkedHashMap<String, Object>();
        body.put("results", results);
        body.put("success", results.values().stream().anyMatch(Boolean::booleanValue));
        ctx.json(body);
    }

    // ==================== Helpers ====================

    private static Integer accountIndexParam(Context ctx) {
        String raw = ctx.queryParam("account_id");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return ctx.queryParamAsClass("account_id", Integer.class).get();
    }

    private double timestamp() {
        return clock.millis() / 1000.0;
    }
}
