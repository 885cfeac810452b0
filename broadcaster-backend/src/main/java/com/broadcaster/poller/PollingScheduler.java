package com.broadcaster.poller;

import com.broadcaster.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the three polling cadences, each on its own daemon thread.
 *
 * Fast: positions, balance and orders every period.
 * Medium: closed positions every N fast periods.
 * Slow: risk checks every M fast periods, points every K-th slow tick.
 *
 * Pacing is sleep-after-work, so a slow tick delays the next one instead of overlapping it.
 * A tick that throws is logged and followed by a short backoff; the loop keeps running.
 */
public final class PollingScheduler {
    private static final Logger logger = LoggerFactory.getLogger(PollingScheduler.class);
    static final Duration ERROR_BACKOFF = Duration.ofMillis(500);

    private final AccountPoller poller;
    private final MetricsService metrics;
    private final Duration fastInterval;
    private final Duration mediumInterval;
    private final Duration slowInterval;
    private final int pointsEverySlowTicks;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> loops = new ArrayList<>();
    private final AtomicLong fastTicks = new AtomicLong();
    private final AtomicLong mediumTicks = new AtomicLong();
    private final AtomicLong slowTicks = new AtomicLong();

    public PollingScheduler(AccountPoller poller, MetricsService metrics, Duration fastInterval,
                            int mediumEveryTicks, int slowEveryTicks, int pointsEverySlowTicks) {
        this.poller = poller;
        this.metrics = metrics;
        this.fastInterval = fastInterval;
        this.mediumInterval = fastInterval.multipliedBy(mediumEveryTicks);
        this.slowInterval = fastInterval.multipliedBy(slowEveryTicks);
        this.pointsEverySlowTicks = pointsEverySlowTicks;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Polling scheduler already running");
            return;
        }
        loops.add(startLoop("poll-fast", "fast", fastInterval, this::runFastTick));
        loops.add(startLoop("poll-medium", "medium", mediumInterval, this::runMediumTick));
        loops.add(startLoop("poll-slow", "slow", slowInterval, this::runSlowTick));
        logger.info("🚀 Polling started: fast {}ms, medium {}ms, slow {}ms, points every {} slow ticks",
            fastInterval.toMillis(), mediumInterval.toMillis(), slowInterval.toMillis(), pointsEverySlowTicks);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        loops.forEach(Thread::interrupt);
        for (Thread loop : loops) {
            try {
                loop.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        loops.clear();
        logger.info("Polling stopped after {} fast, {} medium, {} slow ticks",
            fastTicks.get(), mediumTicks.get(), slowTicks.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== Ticks ====================

    public void runFastTick() {
        poller.pollFast();
        fastTicks.incrementAndGet();
    }

    public void runMediumTick() {
        poller.pollTrades();
        mediumTicks.incrementAndGet();
    }

    /**
     * Risk checks every slow tick; points on the first slow tick and every K-th after it.
     */
    public void runSlowTick() {
        long tick = slowTicks.getAndIncrement();
        poller.checkRisk();
        if (tick % pointsEverySlowTicks == 0) {
            poller.pollPoints();
        }
    }

    public long getFastTicks() {
        return fastTicks.get();
    }

    public long getMediumTicks() {
        return mediumTicks.get();
    }

    public long getSlowTicks() {
        return slowTicks.get();
    }

    private Thread startLoop(String threadName, String cadence, Duration interval, Runnable tick) {
        Thread thread = new Thread(() -> loop(cadence, interval, tick), threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void loop(String cadence, Duration interval, Runnable tick) {
        while (running.get()) {
            long started = System.nanoTime();
            Duration pause = interval;
            try {
                tick.run();
                metrics.recordTick(cadence, Duration.ofNanos(System.nanoTime() - started));
            } catch (RuntimeException e) {
                metrics.incrementTickFailures(cadence);
                logger.error("❌ [{}] tick failed: {}", cadence, e.getMessage(), e);
                pause = ERROR_BACKOFF;
            }
            try {
                Thread.sleep(pause.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.debug("[{}] loop exited", cadence);
    }
}
