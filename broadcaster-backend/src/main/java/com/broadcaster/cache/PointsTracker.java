package com.broadcaster.cache;

import com.broadcaster.api.model.AccountPoints;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Earned reward points per account, refreshed on the slow cadence.
 */
public final class PointsTracker {
    private final Map<String, AccountPoints> points = new ConcurrentHashMap<>();
    private volatile Instant lastRefresh;

    /**
     * @return true when the account's points differ from what was stored
     */
    public boolean update(AccountPoints fresh) {
        AccountPoints previous = points.put(fresh.accountId(), fresh);
        return !Objects.equals(previous, fresh);
    }

    public void markRefreshed(Instant at) {
        this.lastRefresh = at;
    }

    public Instant getLastRefresh() {
        return lastRefresh;
    }

    public Map<String, AccountPoints> all() {
        return new TreeMap<>(points);
    }

    public double totalPoints() {
        return points.values().stream().mapToDouble(AccountPoints::totalPoints).sum();
    }

    public double totalLastWeekPoints() {
        return points.values().stream().mapToDouble(AccountPoints::lastWeekPoints).sum();
    }
}
