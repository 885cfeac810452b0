package com.broadcaster.api;

import com.broadcaster.config.AccountIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decorates {@link ExtendedApiClient} with one circuit breaker per account plus call metrics.
 *
 * A dead proxy opens only that account's breaker; while open, calls short-circuit to empty
 * without touching the network and sibling accounts keep polling normally.
 */
public final class ResilientExchangeGateway implements ExchangeGateway {
    private static final Logger logger = LoggerFactory.getLogger(ResilientExchangeGateway.class);

    private final ExtendedApiClient delegate;
    private final MeterRegistry meterRegistry;
    private final CircuitBreakerConfig breakerConfig;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public ResilientExchangeGateway(ExtendedApiClient delegate, MeterRegistry meterRegistry) {
        this(delegate, meterRegistry, CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build());
    }

    public ResilientExchangeGateway(ExtendedApiClient delegate, MeterRegistry meterRegistry,
                                    CircuitBreakerConfig breakerConfig) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;
        this.breakerConfig = breakerConfig;
    }

    @Override
    public Optional<JsonNode> fetch(AccountIdentity account, String path, Map<String, String> params) {
        CircuitBreaker breaker = breakerFor(account);
        String endpoint = endpointTag(path);
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            JsonNode result = breaker.executeCallable(() -> delegate.get(account, path, params));
            meterRegistry.counter("exchange.api.success",
                "account", account.id(), "endpoint", endpoint).increment();
            return Optional.of(result);
        } catch (CallNotPermittedException e) {
            meterRegistry.counter("exchange.api.rejected",
                "account", account.id(), "endpoint", endpoint).increment();
            logger.debug("[{}][{}] circuit open, skipping call", account.name(), path);
            return Optional.empty();
        } catch (Exception e) {
            meterRegistry.counter("exchange.api.failure",
                "account", account.id(),
                "endpoint", endpoint,
                "error", e.getClass().getSimpleName()).increment();
            logger.warn("⚠️ [{}][{}] {}", account.name(), path, e.getMessage());
            return Optional.empty();
        } finally {
            sample.stop(Timer.builder("exchange.api.call")
                .tag("account", account.id())
                .tag("endpoint", endpoint)
                .register(meterRegistry));
        }
    }

    /**
     * Breaker state per account id, for health and stats endpoints.
     */
    public Map<String, String> getCircuitBreakerStates() {
        var states = new TreeMap<String, String>();
        breakers.forEach((id, breaker) -> states.put(id, breaker.getState().name()));
        return states;
    }

    public void resetCircuitBreakers() {
        logger.info("🔄 Manual circuit breaker reset requested");
        breakers.values().forEach(CircuitBreaker::reset);
    }

    private CircuitBreaker breakerFor(AccountIdentity account) {
        return breakers.computeIfAbsent(account.id(), id -> {
            CircuitBreaker breaker = CircuitBreaker.of("exchange-" + id, breakerConfig);
            breaker.getEventPublisher().onStateTransition(event ->
                logger.warn("Circuit breaker for {} changed: {}", account.name(), event.getStateTransition()));
            return breaker;
        });
    }

    private static String endpointTag(String path) {
        int query = path.indexOf('?');
        return query < 0 ? path : path.substring(0, query);
    }
}
