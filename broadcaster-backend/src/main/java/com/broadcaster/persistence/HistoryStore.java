package com.broadcaster.persistence;

import com.broadcaster.api.model.ClosedPosition;
import com.broadcaster.api.model.FilledOrder;
import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Durable history of account snapshots, trades and archived exchange records.
 *
 * Write methods throw {@link HistoryStoreException} on storage failure.
 */
public interface HistoryStore extends AutoCloseable {

    /**
     * Stores a balance snapshot together with the currently active orders.
     */
    void saveSnapshot(AccountIdentity account, JsonNode balance, JsonNode orders);

    void savePositions(AccountIdentity account, JsonNode positions);

    void saveOrders(AccountIdentity account, JsonNode orders);

    /**
     * Idempotent by (account, exchange trade id): a repeated record refines the stored row.
     */
    void saveTrade(AccountIdentity account, JsonNode trade);

    void upsertClosedPosition(ClosedPosition position);

    void upsertFilledOrder(FilledOrder order);

    /**
     * Empties the archived closed positions and filled orders.
     */
    void clearArchive();

    List<Map<String, Object>> getHistory(int accountIndex, int limit);

    /**
     * Most recent trades, across all accounts when {@code accountIndex} is null.
     */
    List<Map<String, Object>> getRecentTrades(Integer accountIndex, int limit);

    /**
     * Statistics keyed {@code 24h}, {@code 7d} and {@code 30d}.
     */
    Map<String, PeriodStats> getStats(Integer accountIndex);

    List<Map<String, Object>> getClosedPositions(Integer accountIndex, int limit);

    int countClosedPositions();

    int countFilledOrders();

    @Override
    void close();
}
