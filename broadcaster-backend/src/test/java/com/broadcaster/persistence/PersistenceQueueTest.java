package com.broadcaster.persistence;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PersistenceQueue Tests")
class PersistenceQueueTest {

    private final PersistenceQueue queue = new PersistenceQueue();

    @AfterEach
    void tearDown() {
        queue.stop();
    }

    @Test
    @DisplayName("Writes should run in submission order on one thread")
    void ordered() {
        List<String> executed = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 5; i++) {
            int n = i;
            queue.submit("write " + n, () -> {
                executed.add("w" + n);
                threads.add(Thread.currentThread().getName());
            });
        }

        queue.stop();

        assertEquals(List.of("w0", "w1", "w2", "w3", "w4"), executed);
        assertTrue(threads.stream().allMatch("history-writer"::equals));
        assertEquals(5, queue.getCompleted());
        assertEquals(0, queue.getPending());
    }

    @Test
    @DisplayName("A failing write should be counted and not stop later writes")
    void failureIsolated() throws Exception {
        CountDownLatch done = new CountDownLatch(1);

        queue.submit("broken", () -> {
            throw new HistoryStoreException("disk full", null);
        });
        queue.submit("next", done::countDown);

        assertTrue(done.await(2, TimeUnit.SECONDS));
        queue.stop();
        assertEquals(1, queue.getFailed());
        assertEquals(1, queue.getCompleted());
    }

    @Test
    @DisplayName("Writes after stop should be dropped")
    void afterStop() {
        queue.stop();

        queue.submit("late", () -> fail("should not run"));

        assertEquals(0, queue.getPending());
        assertEquals(0, queue.getCompleted());
    }
}
