package com.broadcaster;

import com.broadcaster.api.ExtendedApiClient;
import com.broadcaster.api.ResilientExchangeGateway;
import com.broadcaster.api.controller.BroadcasterController;
import com.broadcaster.broker.OrderBookStreamClient;
import com.broadcaster.broker.ReconnectBackoff;
import com.broadcaster.cache.AccountCacheRegistry;
import com.broadcaster.cache.AccountSnapshot;
import com.broadcaster.cache.ChangeDetector;
import com.broadcaster.cache.OrderBookCache;
import com.broadcaster.cache.PointsTracker;
import com.broadcaster.config.AccountIdentity;
import com.broadcaster.config.Config;
import com.broadcaster.dashboard.BroadcasterServer;
import com.broadcaster.metrics.MetricsService;
import com.broadcaster.notifications.NotificationChannel;
import com.broadcaster.notifications.PushoverNotifier;
import com.broadcaster.notifications.TelegramNotifier;
import com.broadcaster.notifications.TwilioCallNotifier;
import com.broadcaster.notifications.TwilioSettings;
import com.broadcaster.notifications.TwilioSmsNotifier;
import com.broadcaster.persistence.HistoryArchiver;
import com.broadcaster.persistence.PersistenceQueue;
import com.broadcaster.persistence.SqliteHistoryStore;
import com.broadcaster.poller.AccountPoller;
import com.broadcaster.poller.PollingScheduler;
import com.broadcaster.risk.AlertState;
import com.broadcaster.risk.MarginRiskMonitor;
import com.broadcaster.websocket.BroadcastHub;
import com.broadcaster.websocket.BroadcastMessages;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Entry point: wires the broadcaster and runs until the JVM is stopped.
 */
public final class BroadcasterApp {
    private static final Logger logger = LoggerFactory.getLogger(BroadcasterApp.class);
    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(5);
    private static final int DELIVERY_THREADS = 8;

    private BroadcasterApp() {
    }

    public static void main(String[] args) {
        Config config;
        List<AccountIdentity> accounts;
        try {
            config = new Config();
            config.validate();
            accounts = config.loadAccounts();
        } catch (IllegalStateException e) {
            logger.error("❌ {}", e.getMessage());
            System.exit(1);
            return;
        }

        var clock = Clock.systemUTC();
        var objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        var metrics = new MetricsService();
        var gateway = new ResilientExchangeGateway(
            new ExtendedApiClient(config.getRequestTimeout()), metrics.getRegistry());

        var registry = new AccountCacheRegistry(accounts, clock);
        var orderBooks = new OrderBookCache();
        var points = new PointsTracker();
        var messages = new BroadcastMessages(objectMapper, clock);
        var hub = new BroadcastHub(objectMapper, messages,
            () -> messages.snapshot(
                registry.all().stream().map(AccountSnapshot::view).toList(),
                orderBooks.all(),
                points.all()),
            SEND_TIMEOUT, DELIVERY_THREADS);

        var store = new SqliteHistoryStore(config.getDatabasePath(), objectMapper, clock);
        var persistence = new PersistenceQueue();

        var riskMonitor = new MarginRiskMonitor(config.getMarginThresholds(), config.getAlertCooldown(),
            notificationChannels(config, objectMapper), new AlertState(), clock, metrics.getRegistry());

        ExecutorService pollExecutor = Executors.newFixedThreadPool(config.getPollThreads(), pollThreadFactory());
        Consumer<ObjectNode> publisher = message -> {
            metrics.incrementBroadcast(message.path("type").asText());
            hub.publish(message);
        };
        var poller = new AccountPoller(registry, gateway, new ChangeDetector(), messages, publisher,
            persistence, store, riskMonitor, points, pollExecutor, clock);
        var scheduler = new PollingScheduler(poller, metrics, config.getFastPollInterval(),
            config.getMediumEveryTicks(), config.getSlowEveryTicks(), config.getPointsEverySlowTicks());

        Optional<OrderBookStreamClient> stream = Optional.empty();
        if (config.isOrderBookEnabled()) {
            stream = Optional.of(new OrderBookStreamClient(
                config.getOrderBookWebsocketUrl(),
                config.getOrderBookMarkets(),
                config.getOrderBookProxy(),
                config.getOrderBookMaxLevels(),
                orderBooks,
                messages,
                publisher,
                new ReconnectBackoff(config.getReconnectBaseDelay(), config.getReconnectMaxDelay()),
                objectMapper,
                clock));
        }

        var archiver = new HistoryArchiver(accounts, gateway, store,
            config.getArchivePageSize(), config.getArchiveInterval());

        var controller = new BroadcasterController(registry, orderBooks, points, hub, stream, gateway,
            store, archiver, persistence, riskMonitor, clock);
        var server = new BroadcasterServer(controller, hub, metrics, objectMapper, config.getServerPort());

        metrics.gauge("broadcaster.subscribers", hub::getSubscriberCount);
        metrics.gauge("broadcaster.persistence.pending", persistence::getPending);
        metrics.gauge("broadcaster.orderbook.markets", orderBooks::size);
        stream.ifPresent(client -> metrics.gauge("broadcaster.orderbook.reconnects", client::getReconnects));

        logger.atInfo()
            .addKeyValue("accounts", accounts.size())
            .addKeyValue("proxied", accounts.stream().filter(a -> a.proxy() != null).count())
            .addKeyValue("orderbook", config.isOrderBookEnabled())
            .log("🚀 Starting Extended multi-account broadcaster");
        accounts.forEach(account -> logger.info("   {}", account));

        hub.start();
        server.start();
        scheduler.start();
        stream.ifPresent(OrderBookStreamClient::connect);
        archiver.start();

        final Optional<OrderBookStreamClient> streamRef = stream;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping broadcaster...");
            archiver.stop();
            streamRef.ifPresent(OrderBookStreamClient::stop);
            scheduler.stop();
            pollExecutor.shutdown();
            awaitQuietly(pollExecutor);
            server.stop();
            hub.stop();
            persistence.stop();
            store.close();
            logger.info("Broadcaster stopped");
        }, "shutdown-hook"));
    }

    private static List<NotificationChannel> notificationChannels(Config config, ObjectMapper objectMapper) {
        var httpClient = new OkHttpClient.Builder()
            .callTimeout(Duration.ofSeconds(15))
            .build();
        var twilio = new TwilioSettings(
            config.getTwilioAccountSid(),
            config.getTwilioApiKeySid(),
            config.getTwilioApiKeySecret(),
            config.getAlertPhoneNumber(),
            config.getTwilioFromNumber());
        return List.of(
            new TelegramNotifier(httpClient, objectMapper, config.getTelegramBotToken(), config.getTelegramChatId()),
            new PushoverNotifier(httpClient, objectMapper, config.getPushoverAppToken(), config.getPushoverUserKey()),
            new TwilioSmsNotifier(httpClient, objectMapper, twilio),
            new TwilioCallNotifier(httpClient, objectMapper, twilio)
        );
    }

    private static ThreadFactory pollThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "poll-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void awaitQuietly(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
