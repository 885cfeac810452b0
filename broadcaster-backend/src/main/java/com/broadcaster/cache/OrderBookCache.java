package com.broadcaster.cache;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest order book per market symbol.
 */
public final class OrderBookCache {
    private final Map<String, OrderBookSnapshot> books = new ConcurrentHashMap<>();

    public void replace(OrderBookSnapshot snapshot) {
        books.put(snapshot.market(), snapshot);
    }

    public Optional<OrderBookSnapshot> get(String market) {
        return Optional.ofNullable(books.get(market));
    }

    /**
     * Copy of all books, sorted by market.
     */
    public Map<String, OrderBookSnapshot> all() {
        return new TreeMap<>(books);
    }

    public int size() {
        return books.size();
    }
}
