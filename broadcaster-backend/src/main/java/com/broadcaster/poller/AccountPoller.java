package com.broadcaster.poller;

import com.broadcaster.api.ExchangeGateway;
import com.broadcaster.api.model.AccountPoints;
import com.broadcaster.api.model.Payloads;
import com.broadcaster.cache.AccountCacheRegistry;
import com.broadcaster.cache.AccountSnapshot;
import com.broadcaster.cache.AccountSnapshot.Field;
import com.broadcaster.cache.ChangeDetector;
import com.broadcaster.cache.PointsTracker;
import com.broadcaster.config.AccountIdentity;
import com.broadcaster.persistence.HistoryStore;
import com.broadcaster.persistence.PersistenceQueue;
import com.broadcaster.risk.AlertResult;
import com.broadcaster.risk.MarginRiskMonitor;
import com.broadcaster.websocket.BroadcastMessages;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Per-account polling work for each cadence.
 *
 * Every account runs concurrently on the shared poll executor and is joined with its own
 * error handling, so a failing account never cancels its siblings. Changes update the cache
 * first, then go out as broadcast events, then to the persistence queue.
 */
public final class AccountPoller {
    private static final Logger logger = LoggerFactory.getLogger(AccountPoller.class);

    static final String POSITIONS_PATH = "/user/positions";
    static final String BALANCE_PATH = "/user/balance";
    static final String ORDERS_PATH = "/user/orders";
    static final String TRADES_PATH = "/user/positions/history";
    static final String POINTS_PATH = "/user/rewards/earned";

    private final AccountCacheRegistry registry;
    private final ExchangeGateway gateway;
    private final ChangeDetector detector;
    private final BroadcastMessages messages;
    private final Consumer<ObjectNode> publisher;
    private final PersistenceQueue persistence;
    private final HistoryStore store;
    private final MarginRiskMonitor riskMonitor;
    private final PointsTracker points;
    private final Executor executor;
    private final Clock clock;

    public AccountPoller(AccountCacheRegistry registry,
                         ExchangeGateway gateway,
                         ChangeDetector detector,
                         BroadcastMessages messages,
                         Consumer<ObjectNode> publisher,
                         PersistenceQueue persistence,
                         HistoryStore store,
                         MarginRiskMonitor riskMonitor,
                         PointsTracker points,
                         Executor executor,
                         Clock clock) {
        this.registry = registry;
        this.gateway = gateway;
        this.detector = detector;
        this.messages = messages;
        this.publisher = publisher;
        this.persistence = persistence;
        this.store = store;
        this.riskMonitor = riskMonitor;
        this.points = points;
        this.executor = executor;
        this.clock = clock;
    }

    // ==================== Fast: positions, balance, orders ====================

    public void pollFast() {
        forEachAccount("fast", this::pollAccountFast);
    }

    /**
     * Positions and balance are fetched concurrently; the orders fetch follows them.
     */
    CompletableFuture<Void> pollAccountFast(AccountSnapshot snapshot) {
        AccountIdentity account = snapshot.account();
        CompletableFuture<Optional<JsonNode>> positions = fetchAsync(account, POSITIONS_PATH, Map.of());
        CompletableFuture<Optional<JsonNode>> balance = fetchAsync(account, BALANCE_PATH, Map.of());

        return positions.thenCombine(balance, (p, b) -> {
                applyPositionsAndBalance(snapshot, p, b);
                return null;
            })
            .thenCompose(ignored -> fetchAsync(account, ORDERS_PATH, Map.of("status", "ACTIVE")))
            .thenAccept(orders -> applyOrders(snapshot, orders));
    }

    private void applyPositionsAndBalance(AccountSnapshot snapshot, Optional<JsonNode> positions,
                                          Optional<JsonNode> balance) {
        Map<Field, JsonNode> fresh = new EnumMap<>(Field.class);
        positions.ifPresent(value -> fresh.put(Field.POSITIONS, value));
        balance.ifPresent(value -> fresh.put(Field.BALANCE, value));
        if (fresh.isEmpty()) {
            return;
        }

        Set<Field> changed = snapshot.applyChanges(fresh, detector);
        if (changed.isEmpty()) {
            return;
        }

        AccountSnapshot.View view = snapshot.view();
        publisher.accept(messages.accountUpdate(view, changed));

        AccountIdentity account = snapshot.account();
        if (changed.contains(Field.POSITIONS)) {
            JsonNode value = view.positions();
            persistence.submit("positions " + account.id(), () -> store.savePositions(account, value));
        }
        if (changed.contains(Field.BALANCE)) {
            JsonNode value = view.balance();
            JsonNode orders = view.orders();
            persistence.submit("snapshot " + account.id(), () -> store.saveSnapshot(account, value, orders));
        }
        logger.debug("📊 {} changed: {}", account.name(), changed);
    }

    private void applyOrders(AccountSnapshot snapshot, Optional<JsonNode> orders) {
        if (orders.isEmpty() || !snapshot.updateIfChanged(Field.ORDERS, orders.get(), detector)) {
            return;
        }
        AccountSnapshot.View view = snapshot.view();
        publisher.accept(messages.ordersUpdate(view));

        AccountIdentity account = snapshot.account();
        JsonNode value = view.orders();
        persistence.submit("orders " + account.id(), () -> store.saveOrders(account, value));
    }

    // ==================== Medium: closed positions ====================

    public void pollTrades() {
        forEachAccount("trades", this::pollAccountTrades);
    }

    CompletableFuture<Void> pollAccountTrades(AccountSnapshot snapshot) {
        AccountIdentity account = snapshot.account();
        return fetchAsync(account, TRADES_PATH, Map.of()).thenAccept(trades -> {
            if (trades.isEmpty() || !snapshot.updateIfChanged(Field.TRADES, trades.get(), detector)) {
                return;
            }
            AccountSnapshot.View view = snapshot.view();
            publisher.accept(messages.tradesUpdate(view));

            List<JsonNode> records = Payloads.records(view.trades());
            persistence.submit("trades " + account.id(), () -> records.forEach(t -> store.saveTrade(account, t)));
            logger.debug("💰 {} closed positions changed ({} records)", account.name(), records.size());
        });
    }

    // ==================== Slow: risk and points ====================

    public void checkRisk() {
        forEachAccount("risk", snapshot -> CompletableFuture.runAsync(() -> {
            Optional<AlertResult> result = riskMonitor.checkAccount(snapshot);
            result.filter(AlertResult::alerted).ifPresent(r ->
                logger.warn("🚨 {} margin {}% alerted via {}", r.accountName(),
                    Math.round(r.marginRatio() * 100), r.alertsSent()));
        }, executor));
    }

    public void pollPoints() {
        List<CompletableFuture<Boolean>> updates = registry.accounts().stream()
            .map(account -> fetchAsync(account, POINTS_PATH, Map.of())
                .thenApply(payload -> payload
                    .flatMap(p -> AccountPoints.from(p, account.id(), account.name()))
                    .map(points::update)
                    .orElse(false))
                .exceptionally(e -> {
                    logger.warn("Points refresh failed for {}: {}", account.id(), e.getMessage());
                    return false;
                }))
            .toList();

        boolean changed = updates.stream().map(CompletableFuture::join).reduce(false, Boolean::logicalOr);
        points.markRefreshed(clock.instant());
        if (changed) {
            publisher.accept(messages.pointsUpdate(points.all()));
            logger.info("⭐ Points updated: total {}", points.totalPoints());
        }
    }

    // ==================== Fan-out ====================

    private void forEachAccount(String cadence, Function<AccountSnapshot, CompletableFuture<Void>> work) {
        CompletableFuture<?>[] futures = registry.all().stream()
            .map(snapshot -> work.apply(snapshot).exceptionally(e -> {
                logger.warn("⚠️ [{}] {} poll failed: {}", cadence, snapshot.account().id(), e.getMessage());
                return null;
            }))
            .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
    }

    private CompletableFuture<Optional<JsonNode>> fetchAsync(AccountIdentity account, String path,
                                                             Map<String, String> params) {
        return CompletableFuture.supplyAsync(() -> gateway.fetch(account, path, params), executor)
            .exceptionally(e -> {
                logger.warn("Fetch {} for {} raised: {}", path, account.id(), e.getMessage());
                return Optional.empty();
            });
    }
}
