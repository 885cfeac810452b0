package com.broadcaster.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.websocket.WsCloseContext;
import io.javalin.websocket.WsConnectContext;
import io.javalin.websocket.WsErrorContext;
import io.javalin.websocket.WsMessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Fan-out of broadcast messages to every connected subscriber.
 *
 * Producers call {@link #publish}, which hands the message to a single dispatcher thread
 * so polling never waits on delivery. Each broadcast is serialized once and queued on every
 * subscriber's own lane; lanes drain serially on the delivery pool, so a slow connection
 * only delays itself. A lane whose send fails, runs past the send timeout or whose backlog
 * overflows is closed and its subscriber removed. No acknowledgment, no retry.
 */
public final class BroadcastHub {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastHub.class);
    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    static final int DEFAULT_MAX_PENDING = 1024;

    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;
    private final BroadcastMessages messages;
    private final Supplier<ObjectNode> snapshotSupplier;
    private final Duration sendTimeout;
    private final int maxPending;

    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(daemon("broadcast-dispatcher"));
    private final ExecutorService deliveryPool;
    private final ScheduledExecutorService timer =
        Executors.newSingleThreadScheduledExecutor(daemon("broadcast-timer"));

    private final AtomicLong messagesBroadcast = new AtomicLong();
    private final AtomicLong failedDeliveries = new AtomicLong();

    public BroadcastHub(ObjectMapper mapper, BroadcastMessages messages,
                        Supplier<ObjectNode> snapshotSupplier, Duration sendTimeout, int deliveryThreads) {
        this(mapper, messages, snapshotSupplier, sendTimeout, deliveryThreads, DEFAULT_MAX_PENDING);
    }

    BroadcastHub(ObjectMapper mapper, BroadcastMessages messages, Supplier<ObjectNode> snapshotSupplier,
                 Duration sendTimeout, int deliveryThreads, int maxPending) {
        this.mapper = mapper;
        this.messages = messages;
        this.snapshotSupplier = snapshotSupplier;
        this.sendTimeout = sendTimeout;
        this.maxPending = maxPending;
        this.deliveryPool = Executors.newFixedThreadPool(deliveryThreads, daemon("broadcast-delivery"));

        long checkMillis = Math.max(50, sendTimeout.toMillis() / 4);
        timer.scheduleWithFixedDelay(this::closeStalledLanes, checkMillis, checkMillis, TimeUnit.MILLISECONDS);
    }

    public void start() {
        timer.scheduleAtFixedRate(() -> publish(messages.ping()),
            HEARTBEAT_INTERVAL.toSeconds(), HEARTBEAT_INTERVAL.toSeconds(), TimeUnit.SECONDS);
        logger.info("📡 Broadcast hub started (heartbeat every {}s)", HEARTBEAT_INTERVAL.toSeconds());
    }

    public void stop() {
        timer.shutdownNow();
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(2, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        int dropped = lanes.size();
        lanes.values().forEach(Lane::close);
        lanes.clear();
        deliveryPool.shutdownNow();
        logger.info("Broadcast hub stopped ({} subscribers dropped)", dropped);
    }

    /**
     * Sends the full snapshot to the subscriber before returning. Broadcasts published while
     * the snapshot is in flight are held on the subscriber's lane and follow it.
     *
     * @return false when the snapshot could not be delivered; the subscriber is not kept
     */
    public boolean register(Subscriber subscriber) {
        Lane lane = new Lane(subscriber);
        Lane previous = lanes.put(subscriber.id(), lane);
        if (previous != null) {
            previous.close();
        }

        try {
            String snapshot = mapper.writeValueAsString(snapshotSupplier.get());
            subscriber.send(snapshot);
            logger.debug("📸 [WS] Sent snapshot to {}", subscriber.id());
        } catch (Exception e) {
            logger.warn("Failed to send snapshot to {}: {}", subscriber.id(), e.getMessage());
            lane.close();
            lanes.remove(subscriber.id(), lane);
            return false;
        }

        lane.open();
        logger.info("✅ [WS] Client connected: {} (total: {})", subscriber.id(), lanes.size());
        return true;
    }

    public void unregister(String subscriberId) {
        Lane lane = lanes.remove(subscriberId);
        if (lane != null) {
            lane.close();
            logger.info("🗑️ [WS] Client removed: {} (remaining: {})", subscriberId, lanes.size());
        }
    }

    /**
     * Queues the message on the dispatcher thread and returns immediately.
     */
    public void publish(ObjectNode message) {
        try {
            dispatcher.execute(() -> broadcast(message));
        } catch (RejectedExecutionException e) {
            logger.debug("Hub stopped, dropping {} message", message.path("type").asText());
        }
    }

    /**
     * Serializes the message once and queues it on every subscriber's lane without waiting
     * for delivery.
     *
     * @return number of subscribers the message was queued for
     */
    public int broadcast(ObjectNode message) {
        if (lanes.isEmpty()) {
            return 0;
        }
        String json;
        try {
            json = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {} message", message.path("type").asText(), e);
            return 0;
        }

        int queued = 0;
        for (Lane lane : lanes.values()) {
            if (lane.offer(json)) {
                queued++;
            }
        }
        messagesBroadcast.incrementAndGet();
        return queued;
    }

    private void closeStalledLanes() {
        long now = System.nanoTime();
        for (Lane lane : lanes.values()) {
            if (lane.stalledAt(now)) {
                lane.fail("send timed out after " + sendTimeout.toMillis() + " ms");
            }
        }
    }

    /**
     * Serial outbound queue of one subscriber. At most one drain task per lane runs on the
     * delivery pool at a time, which keeps per-subscriber order.
     */
    private final class Lane {
        private final Subscriber subscriber;
        private final Queue<String> pending = new ConcurrentLinkedQueue<>();
        private final AtomicInteger pendingCount = new AtomicInteger();
        private final AtomicBoolean draining = new AtomicBoolean();
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile boolean opened;

        // guarded by this
        private Thread sender;
        private long sendStartedNanos;

        Lane(Subscriber subscriber) {
            this.subscriber = subscriber;
        }

        boolean offer(String json) {
            if (closed.get()) {
                return false;
            }
            if (pendingCount.incrementAndGet() > maxPending) {
                pendingCount.decrementAndGet();
                fail("backlog exceeded " + maxPending + " messages");
                return false;
            }
            pending.add(json);
            scheduleDrain();
            return true;
        }

        void open() {
            opened = true;
            scheduleDrain();
        }

        synchronized boolean stalledAt(long now) {
            return sender != null && now - sendStartedNanos > sendTimeout.toNanos();
        }

        /**
         * Closes the lane after a delivery problem and removes its subscriber.
         */
        void fail(String reason) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            interruptSender();
            pending.clear();
            if (lanes.remove(subscriber.id(), this)) {
                failedDeliveries.incrementAndGet();
                logger.info("🗑️ [Broadcast] Removed client {}: {} (remaining: {})",
                    subscriber.id(), reason, lanes.size());
            }
        }

        void close() {
            if (closed.compareAndSet(false, true)) {
                interruptSender();
                pending.clear();
            }
        }

        private synchronized void interruptSender() {
            if (sender != null && sender != Thread.currentThread()) {
                sender.interrupt();
            }
        }

        private void scheduleDrain() {
            if (!opened || closed.get() || !draining.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryPool.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
            }
        }

        private void drain() {
            try {
                String json;
                while (!closed.get() && (json = pending.poll()) != null) {
                    pendingCount.decrementAndGet();
                    synchronized (this) {
                        sender = Thread.currentThread();
                        sendStartedNanos = System.nanoTime();
                    }
                    try {
                        subscriber.send(json);
                    } catch (Exception e) {
                        fail("send failed: " + e.getMessage());
                    } finally {
                        synchronized (this) {
                            sender = null;
                        }
                    }
                }
            } finally {
                // a timeout may have interrupted this pool thread after the send returned
                if (closed.get()) {
                    Thread.interrupted();
                }
                draining.set(false);
            }
            if (!pending.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    // ==================== Javalin WebSocket callbacks ====================

    public void onConnect(WsConnectContext ctx) {
        register(new JavalinSubscriber(ctx));
    }

    public void onClose(WsCloseContext ctx) {
        unregister(ctx.sessionId());
    }

    public void onError(WsErrorContext ctx) {
        logger.warn("WebSocket error for session {}", ctx.sessionId());
        unregister(ctx.sessionId());
    }

    public void onMessage(WsMessageContext ctx) {
        onMessage(new JavalinSubscriber(ctx), ctx.message());
    }

    /**
     * Handles a client message; {@code {"type":"ping"}} is answered with a pong.
     */
    void onMessage(Subscriber from, String text) {
        try {
            JsonNode msgNode = mapper.readTree(text);
            String type = msgNode.path("type").asText("");
            switch (type) {
                case "ping" -> reply(from, mapper.writeValueAsString(messages.pong()));
                case "pong" -> logger.trace("Pong from {}", from.id());
                default -> logger.debug("Ignoring client message type '{}' from {}", type, from.id());
            }
        } catch (Exception e) {
            logger.debug("Unreadable client message from {}: {}", from.id(), e.getMessage());
        }
    }

    private void reply(Subscriber from, String json) throws IOException {
        Lane lane = lanes.get(from.id());
        if (lane != null) {
            lane.offer(json);
        } else {
            from.send(json);
        }
    }

    public int getSubscriberCount() {
        return lanes.size();
    }

    public boolean isSubscribed(String subscriberId) {
        return lanes.containsKey(subscriberId);
    }

    public long getMessagesBroadcast() {
        return messagesBroadcast.get();
    }

    public long getFailedDeliveries() {
        return failedDeliveries.get();
    }

    private static ThreadFactory daemon(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
