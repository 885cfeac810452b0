package com.broadcaster.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single writer thread in front of the history store.
 *
 * Pollers enqueue and return; a failed write is logged and counted, never propagated
 * back to the broadcast path.
 */
public final class PersistenceQueue {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceQueue.class);

    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "history-writer");
        t.setDaemon(true);
        return t;
    });
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public void submit(String description, Runnable write) {
        pending.incrementAndGet();
        try {
            writer.execute(() -> run(description, write));
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            logger.warn("Persistence queue stopped, dropping write: {}", description);
        }
    }

    private void run(String description, Runnable write) {
        try {
            write.run();
            completed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            logger.error("💾 Write failed ({}): {}", description, e.getMessage(), e);
        } finally {
            pending.decrementAndGet();
        }
    }

    /**
     * Stops accepting writes and drains what is already queued.
     */
    public void stop() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Persistence queue did not drain, {} writes abandoned", pending.get());
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Persistence queue stopped ({} written, {} failed)", completed.get(), failed.get());
    }

    public int getPending() {
        return pending.get();
    }

    public long getCompleted() {
        return completed.get();
    }

    public long getFailed() {
        return failed.get();
    }
}
