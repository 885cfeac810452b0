package com.broadcaster.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Metrics for the broadcaster, backed by a Prometheus registry.
 *
 * Usage:
 *   var metrics = new MetricsService();
 *   metrics.recordTick("fast", elapsed);
 *   metrics.incrementBroadcast("account_update");
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;

    public MetricsService() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public MetricsService(PrometheusMeterRegistry registry) {
        this.registry = registry;
        logger.info("MetricsService initialized with Prometheus registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Prometheus text format for scraping.
     */
    public String scrape() {
        return registry.scrape();
    }

    public void recordTick(String cadence, Duration elapsed) {
        registry.timer("broadcaster.poll.tick", "cadence", cadence).record(elapsed);
    }

    public void incrementTickFailures(String cadence) {
        registry.counter("broadcaster.poll.tick.failures", "cadence", cadence).increment();
    }

    public void incrementBroadcast(String type) {
        registry.counter("broadcaster.messages.published", "type", type).increment();
    }

    /**
     * Registers a gauge read from {@code value} on every scrape.
     */
    public void gauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value, supplier -> supplier.get().doubleValue())
            .strongReference(true)
            .register(registry);
    }
}
