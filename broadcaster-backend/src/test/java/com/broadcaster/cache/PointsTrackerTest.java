package com.broadcaster.cache;

import com.broadcaster.api.model.AccountPoints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Points and order book cache Tests")
class PointsTrackerTest {

    @Test
    @DisplayName("Should report a change only when an account's points differ")
    void pointsChange() {
        var tracker = new PointsTracker();

        assertTrue(tracker.update(new AccountPoints("account_1", "One", 10, 2)));
        assertFalse(tracker.update(new AccountPoints("account_1", "One", 10, 2)));
        assertTrue(tracker.update(new AccountPoints("account_1", "One", 11, 3)));
        tracker.update(new AccountPoints("account_2", "Two", 5, 1));

        assertEquals(16.0, tracker.totalPoints());
        assertEquals(4.0, tracker.totalLastWeekPoints());
        assertEquals(List.of("account_1", "account_2"), List.copyOf(tracker.all().keySet()));
    }

    @Test
    @DisplayName("Order book cache should replace the whole book per market")
    void orderBookReplace() {
        var cache = new OrderBookCache();
        var level = new OrderBookSnapshot.PriceLevel(new BigDecimal("100.5"), BigDecimal.ONE);

        cache.replace(new OrderBookSnapshot("ETH-USD", List.of(level), List.of(), 1, Instant.EPOCH));
        cache.replace(new OrderBookSnapshot("ETH-USD", List.of(), List.of(level), 2, Instant.EPOCH));

        var book = cache.get("ETH-USD").orElseThrow();
        assertEquals(1, cache.size());
        assertEquals(2, book.sequence());
        assertNull(book.bestBid());
        assertEquals(new BigDecimal("100.5"), book.bestAsk());
    }
}
