package com.broadcaster.cache;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Top-of-book depth for one market, replaced wholesale on every stream message.
 */
public record OrderBookSnapshot(
    String market,
    List<PriceLevel> bids,
    List<PriceLevel> asks,
    long sequence,
    Instant timestamp
) {

    public OrderBookSnapshot {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    public record PriceLevel(BigDecimal price, BigDecimal quantity) {
    }

    public BigDecimal bestBid() {
        return bids.isEmpty() ? null : bids.get(0).price();
    }

    public BigDecimal bestAsk() {
        return asks.isEmpty() ? null : asks.get(0).price();
    }
}
