package com.ciro.jtemplatex.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TxOperationQueueTest {

    private final TxOperationQueue queue = new TxOperationQueue();
    private final List<String> log = new ArrayList<>();

    @Test
    void flushRunsHighPriorityFirstThenFifo() {
        queue.enqueue("a", () -> log.add("a"));
        queue.enqueueRoot(() -> {
            log.add("root");
            return "ROOT";
        });
        queue.enqueue("b", () -> log.add("b"));
        queue.enqueueHighPriority("err", () -> log.add("err"));

        Object result = queue.forceFlush();

        assertEquals("ROOT", result);
        assertEquals(List.of("err", "a", "root", "b"), log);
        assertEquals(4, queue.stats().lastFlushCount());
        assertEquals(0, queue.pendingCount());
        assertEquals(QueueState.IDLE, queue.state());
    }

    @Test
    void onlyTheFirstRootResultCounts() {
        queue.enqueueRoot(() -> "first");
        queue.enqueueRoot(() -> "second");

        assertEquals("first", queue.forceFlush());
    }

    @Test
    void failingOperationDoesNotStopTheRest() {
        queue.enqueue("boom", () -> {
            throw new IllegalStateException("boom");
        });
        queue.enqueue("after", () -> log.add("after"));

        queue.forceFlush();

        assertEquals(List.of("after"), log);
    }

    @Test
    void idleSyncFlushDoesNotWait() {
        queue.enqueue("x", () -> log.add("x"));

        queue.syncFlush(10_000);

        assertEquals(List.of("x"), log);
        assertEquals(0, queue.stats().lastWaitMs());
    }

    @Test
    void syncFlushTimesOutAndRunsWhatIsThere() {
        queue.markPreparing();
        queue.enqueue("early", () -> log.add("early"));

        long t0 = System.nanoTime();
        queue.syncFlush(20);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertEquals(List.of("early"), log);
        assertEquals(1, queue.stats().timeouts());
        assertTrue(elapsedMs >= 15, "esperó " + elapsedMs + " ms");
        // el background sigue: la cola vuelve a preparing
        assertEquals(QueueState.PREPARING, queue.state());
    }

    @Test
    void syncFlushWakesUpWhenBackgroundIsReady() throws Exception {
        queue.markPreparing();
        CompletableFuture<Void> bg = CompletableFuture.runAsync(() -> {
            sleep(30);
            queue.enqueueRoot(() -> "view");
            queue.markReady();
        });

        Object result = queue.syncFlush(5_000);
        bg.get(5, TimeUnit.SECONDS);

        assertEquals("view", result);
        assertEquals(0, queue.stats().timeouts());
        assertEquals(QueueState.IDLE, queue.state());
    }

    @Test
    void markErrorDropsNormalOpsAndKeepsHighPriority() {
        queue.markPreparing();
        queue.enqueue("normal", () -> log.add("normal"));
        queue.enqueueHighPriority("error", () -> log.add("error"));

        queue.markError(new IllegalArgumentException("parse"));

        assertEquals(1, queue.pendingCount());
        assertEquals(QueueState.IDLE, queue.state());
        queue.syncFlush(10_000);
        assertEquals(List.of("error"), log);
    }

    @Test
    void resetClearsEverythingAndReleasesWaiter() throws Exception {
        queue.markPreparing();
        queue.enqueue("x", () -> log.add("x"));
        CompletableFuture<Object> waiter = CompletableFuture.supplyAsync(() -> queue.syncFlush(10_000));

        sleep(20);
        queue.reset();

        assertNull(waiter.get(5, TimeUnit.SECONDS));
        assertEquals(0, queue.pendingCount());
    }

    @Test
    void operationsEnqueuedDuringFlushWaitForTheNextOne() {
        queue.enqueue("outer", () -> {
            log.add("outer");
            queue.enqueue("inner", () -> log.add("inner"));
        });

        queue.forceFlush();
        assertEquals(List.of("outer"), log);
        assertEquals(1, queue.pendingCount());

        queue.forceFlush();
        assertEquals(List.of("outer", "inner"), log);
    }

    @Test
    void markReadyDuringFlushDoesNotOverrideFlushingState() {
        queue.markPreparing();
        List<QueueState> seen = new ArrayList<>();
        queue.enqueue("ready-from-inside", () -> {
            queue.markReady();
            seen.add(queue.state());
        });

        queue.forceFlush();

        assertEquals(List.of(QueueState.FLUSHING), seen);
        assertEquals(QueueState.IDLE, queue.state());
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
