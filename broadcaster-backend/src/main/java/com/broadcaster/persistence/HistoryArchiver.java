package com.broadcaster.persistence;

import com.broadcaster.api.ExchangeGateway;
import com.broadcaster.api.model.ClosedPosition;
import com.broadcaster.api.model.FilledOrder;
import com.broadcaster.api.model.Payloads;
import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Periodically pages through each account's closed positions and filled orders and upserts
 * them into the archive tables. A failing account is logged and skipped.
 */
public final class HistoryArchiver {
    private static final Logger logger = LoggerFactory.getLogger(HistoryArchiver.class);

    static final String POSITIONS_HISTORY_PATH = "/user/positions/history";
    static final String ORDERS_HISTORY_PATH = "/user/orders/history";

    private final List<AccountIdentity> accounts;
    private final ExchangeGateway gateway;
    private final HistoryStore store;
    private final int pageSize;
    private final Duration interval;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "history-archiver");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ArchiveReport> lastReport = new AtomicReference<>();

    public HistoryArchiver(List<AccountIdentity> accounts, ExchangeGateway gateway, HistoryStore store,
                           int pageSize, Duration interval) {
        this.accounts = List.copyOf(accounts);
        this.gateway = gateway;
        this.store = store;
        this.pageSize = pageSize;
        this.interval = interval;
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::scheduledPass, 0, interval.toSeconds(), TimeUnit.SECONDS);
        logger.info("📚 History archiver started: every {} min, page size {}", interval.toMinutes(), pageSize);
    }

    public void stop() {
        scheduler.shutdownNow();
        logger.info("History archiver stopped");
    }

    private void scheduledPass() {
        try {
            runPass();
        } catch (RuntimeException e) {
            logger.error("Archive pass failed", e);
        }
    }

    /**
     * Clears the archive tables and re-fetches everything, off the caller's thread.
     */
    public void requestFullRefresh() {
        scheduler.execute(() -> {
            try {
                runFullRefresh();
            } catch (RuntimeException e) {
                logger.error("Full history refresh failed", e);
            }
        });
    }

    public ArchiveReport runFullRefresh() {
        logger.info("🔄 Full history refresh requested");
        store.clearArchive();
        return runPass();
    }

    /**
     * One pass over every account. Returns an empty report when a pass is already in progress.
     */
    public ArchiveReport runPass() {
        if (!running.compareAndSet(false, true)) {
            logger.info("Archive pass already running, skipping");
            return new ArchiveReport(0, 0, List.of(), Duration.ZERO);
        }
        Instant started = Instant.now();
        int positions = 0;
        int orders = 0;
        List<String> failed = new ArrayList<>();
        try {
            for (AccountIdentity account : accounts) {
                try {
                    positions += archive(account, POSITIONS_HISTORY_PATH, Map.of(),
                        ClosedPosition::from, store::upsertClosedPosition);
                    orders += archive(account, ORDERS_HISTORY_PATH, Map.of("status", "FILLED"),
                        FilledOrder::from, store::upsertFilledOrder);
                } catch (RuntimeException e) {
                    failed.add(account.id());
                    logger.warn("⚠️ Archive failed for {}: {}", account.name(), e.getMessage());
                }
            }
        } finally {
            running.set(false);
        }

        ArchiveReport report = new ArchiveReport(positions, orders, failed,
            Duration.between(started, Instant.now()));
        lastReport.set(report);
        logger.atInfo()
            .addKeyValue("positions", positions)
            .addKeyValue("orders", orders)
            .addKeyValue("failedAccounts", failed.size())
            .addKeyValue("elapsedMs", report.elapsed().toMillis())
            .log("📚 Archive pass complete");
        return report;
    }

    private <T> int archive(AccountIdentity account, String path, Map<String, String> filters,
                            BiFunction<JsonNode, AccountIdentity, Optional<T>> normalizer,
                            Consumer<T> upsert) {
        int upserted = 0;
        String cursor = null;
        while (true) {
            Map<String, String> params = new LinkedHashMap<>(filters);
            params.put("limit", String.valueOf(pageSize));
            if (cursor != null) {
                params.put("cursor", cursor);
            }

            Optional<JsonNode> page = gateway.fetch(account, path, params);
            if (page.isEmpty()) {
                if (cursor == null) {
                    throw new IllegalStateException("no response from " + path);
                }
                logger.warn("Page fetch failed for {} {} after cursor {}", account.id(), path, cursor);
                break;
            }

            List<JsonNode> records = Payloads.records(page.get());
            for (JsonNode record : records) {
                Optional<T> normalized = normalizer.apply(record, account);
                if (normalized.isPresent()) {
                    upsert.accept(normalized.get());
                    upserted++;
                }
            }

            String next = nextCursor(page.get());
            if (records.size() < pageSize || next == null || next.equals(cursor)) {
                break;
            }
            cursor = next;
        }
        logger.debug("Archived {} records from {} for {}", upserted, path, account.id());
        return upserted;
    }

    private static String nextCursor(JsonNode page) {
        JsonNode cursor = page.path("pagination").path("cursor");
        if (cursor.isMissingNode() || cursor.isNull()) {
            return null;
        }
        String text = cursor.asText();
        return text.isEmpty() ? null : text;
    }

    public Optional<ArchiveReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public boolean isRunning() {
        return running.get();
    }
}
