package com.broadcaster.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    private final MetricsService metrics = new MetricsService();

    @Test
    @DisplayName("Scrape should expose counters, timers and gauges")
    void scrape() {
        AtomicInteger subscribers = new AtomicInteger(3);
        metrics.gauge("broadcaster.subscribers", subscribers::get);
        metrics.incrementBroadcast("account_update");
        metrics.incrementBroadcast("account_update");
        metrics.recordTick("fast", Duration.ofMillis(120));

        subscribers.set(5);
        String text = metrics.scrape();

        assertTrue(text.contains("broadcaster_subscribers 5.0"));
        assertTrue(text.contains("broadcaster_messages_published_total{type=\"account_update\""));
        assertTrue(text.contains("broadcaster_poll_tick_seconds_count{cadence=\"fast\""));
        assertEquals(2.0, metrics.getRegistry().get("broadcaster.messages.published")
            .tag("type", "account_update").counter().count());
    }

    @Test
    @DisplayName("Tick failures should be counted per cadence")
    void tickFailures() {
        metrics.incrementTickFailures("slow");

        assertEquals(1.0, metrics.getRegistry().get("broadcaster.poll.tick.failures")
            .tag("cadence", "slow").counter().count());
    }
}
