package com.broadcaster.broker;

import com.broadcaster.cache.OrderBookCache;
import com.broadcaster.cache.OrderBookSnapshot;
import com.broadcaster.cache.OrderBookSnapshot.PriceLevel;
import com.broadcaster.config.ProxySettings;
import com.broadcaster.websocket.BroadcastMessages;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * ORDER BOOK STREAM CLIENT
 *
 * Public depth stream for the configured markets. Each message replaces the market's book
 * in {@link OrderBookCache} and goes out as an {@code orderbook_update}.
 *
 * DISCONNECTED -> CONNECTING -> SUBSCRIBED -> DISCONNECTED, reconnecting with
 * {@link ReconnectBackoff} until {@link #stop()}.
 */
public final class OrderBookStreamClient extends WebSocketListener {
    private static final Logger logger = LoggerFactory.getLogger(OrderBookStreamClient.class);

    private final String url;
    private final List<String> markets;
    private final int maxLevels;
    private final OrderBookCache cache;
    private final BroadcastMessages messages;
    private final Consumer<ObjectNode> publisher;
    private final ReconnectBackoff backoff;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final OkHttpClient httpClient;

    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.DISCONNECTED);
    private final AtomicReference<WebSocket> webSocket = new AtomicReference<>();
    private final AtomicBoolean shouldReconnect = new AtomicBoolean(true);
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "orderbook-ws-scheduler");
        t.setDaemon(true);
        return t;
    });

    public OrderBookStreamClient(String url,
                                 List<String> markets,
                                 Optional<ProxySettings> proxy,
                                 int maxLevels,
                                 OrderBookCache cache,
                                 BroadcastMessages messages,
                                 Consumer<ObjectNode> publisher,
                                 ReconnectBackoff backoff,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.url = url;
        this.markets = List.copyOf(markets);
        this.maxLevels = maxLevels;
        this.cache = cache;
        this.messages = messages;
        this.publisher = publisher;
        this.backoff = backoff;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.httpClient = buildClient(proxy);
        logger.info("📖 Order book stream created for markets: {}{}", this.markets,
            proxy.map(p -> " via " + p.describe()).orElse(""));
    }

    private static OkHttpClient buildClient(Optional<ProxySettings> proxy) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ZERO)
            .pingInterval(Duration.ofSeconds(30));
        proxy.ifPresent(settings -> {
            builder.proxy(settings.toProxy());
            if (settings.hasCredentials()) {
                String credential = Credentials.basic(settings.username(), settings.password());
                builder.proxyAuthenticator((route, response) -> response.request().newBuilder()
                    .header("Proxy-Authorization", credential)
                    .build());
            }
        });
        return builder.build();
    }

    /**
     * Opens the connection; failures are handled by the reconnect loop.
     */
    public void connect() {
        if (!shouldReconnect.get()) {
            return;
        }
        state.set(StreamState.CONNECTING);
        logger.info("🔌 Connecting to order book stream: {}", url);
        Request request = new Request.Builder().url(url).build();
        webSocket.set(httpClient.newWebSocket(request, this));
    }

    public void stop() {
        shouldReconnect.set(false);
        scheduler.shutdownNow();
        WebSocket ws = webSocket.getAndSet(null);
        if (ws != null) {
            ws.close(1000, "Shutting down");
        }
        state.set(StreamState.DISCONNECTED);
        httpClient.dispatcher().executorService().shutdown();
        logger.info("🔌 Order book stream stopped");
    }

    // ==================== WebSocketListener ====================

    @Override
    public void onOpen(WebSocket ws, Response response) {
        try {
            String subscribe = objectMapper.writeValueAsString(Map.of(
                "type", "subscribe",
                "channel", "orderbooks",
                "markets", markets
            ));
            ws.send(subscribe);
            state.set(StreamState.SUBSCRIBED);
            backoff.reset();
            logger.info("✅ Order book stream subscribed: {}", markets);
        } catch (JsonProcessingException e) {
            logger.error("Failed to build subscribe message", e);
            ws.close(1011, "subscribe failed");
        }
    }

    @Override
    public void onMessage(WebSocket ws, String text) {
        handleMessage(text);
    }

    @Override
    public void onClosing(WebSocket ws, int code, String reason) {
        ws.close(code, reason);
    }

    @Override
    public void onClosed(WebSocket ws, int code, String reason) {
        logger.warn("🔒 Order book stream closed: {} - {}", code, reason);
        disconnected(ws);
    }

    @Override
    public void onFailure(WebSocket ws, Throwable t, Response response) {
        logger.error("❌ Order book stream error: {}", t.getMessage());
        disconnected(ws);
    }

    private void disconnected(WebSocket ws) {
        // a superseded socket never triggers a reconnect
        WebSocket current = webSocket.get();
        if (current != null && current != ws) {
            return;
        }
        webSocket.set(null);
        state.set(StreamState.DISCONNECTED);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!shouldReconnect.get()) {
            return;
        }
        Duration delay = backoff.nextDelay();
        reconnects.incrementAndGet();
        logger.info("🔄 Reconnecting order book stream in {} ms (attempt {})", delay.toMillis(), backoff.attempts());
        scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    // ==================== Message handling ====================

    /**
     * Applies one depth message. Messages without a market are dropped.
     *
     * @return true when a book was replaced
     */
    boolean handleMessage(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            logger.debug("Unparseable order book message: {}", e.getMessage());
            return false;
        }
        messagesReceived.incrementAndGet();

        JsonNode body = root.path("data").isObject() ? root.path("data") : root;
        String market = firstText(body, "m", "market");
        if (market == null) {
            logger.trace("Dropping order book message without market: {}", abbreviate(text));
            return false;
        }

        OrderBookSnapshot book = new OrderBookSnapshot(
            market,
            levels(first(body, "b", "bids")),
            levels(first(body, "a", "asks")),
            root.path("seq").asLong(body.path("seq").asLong(0)),
            clock.instant()
        );
        cache.replace(book);
        publisher.accept(messages.orderBookUpdate(book));
        return true;
    }

    private List<PriceLevel> levels(JsonNode side) {
        List<PriceLevel> levels = new ArrayList<>();
        if (!side.isArray()) {
            return levels;
        }
        for (JsonNode level : side) {
            if (levels.size() >= maxLevels) {
                break;
            }
            parseLevel(level).ifPresent(levels::add);
        }
        return levels;
    }

    private static Optional<PriceLevel> parseLevel(JsonNode level) {
        JsonNode price = level.isArray() ? level.path(0) : first(level, "p", "price");
        JsonNode quantity = level.isArray() ? level.path(1) : first(level, "q", "qty");
        if (price.isMissingNode() || quantity.isMissingNode() || price.isNull() || quantity.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new PriceLevel(new BigDecimal(price.asText()), new BigDecimal(quantity.asText())));
        } catch (NumberFormatException e) {
            logger.debug("Skipping malformed level {}", level);
            return Optional.empty();
        }
    }

    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.path(name);
            if (!value.isMissingNode()) {
                return value;
            }
        }
        return node.path(names[0]);
    }

    private static String firstText(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    private static String abbreviate(String text) {
        return text.substring(0, Math.min(200, text.length()));
    }

    // ==================== Status ====================

    public StreamState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == StreamState.SUBSCRIBED;
    }

    public long getMessagesReceived() {
        return messagesReceived.get();
    }

    public long getReconnects() {
        return reconnects.get();
    }

    public List<String> getMarkets() {
        return markets;
    }
}
