package com.broadcaster.risk;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last alert time per (account, threshold).
 */
public final class AlertState {
    private final Map<String, Map<Double, Instant>> lastSent = new ConcurrentHashMap<>();

    public boolean canSend(String accountId, double threshold, Instant now, Duration cooldown) {
        Instant last = lastSent.getOrDefault(accountId, Map.of()).get(threshold);
        return last == null || now.isAfter(last.plus(cooldown));
    }

    public void markSent(String accountId, double threshold, Instant at) {
        lastSent.computeIfAbsent(accountId, id -> new ConcurrentHashMap<>()).put(threshold, at);
    }

    /**
     * Forgets every threshold above {@code level} so the next crossing alerts again.
     */
    public void clearAbove(String accountId, double level) {
        Map<Double, Instant> sent = lastSent.get(accountId);
        if (sent != null) {
            sent.keySet().removeIf(threshold -> threshold > level);
        }
    }

    public void clear(String accountId) {
        lastSent.remove(accountId);
    }

    public Map<String, Map<Double, Instant>> snapshot() {
        var copy = new TreeMap<String, Map<Double, Instant>>();
        lastSent.forEach((account, sent) -> {
            if (!sent.isEmpty()) {
                copy.put(account, new TreeMap<>(sent));
            }
        });
        return copy;
    }
}
