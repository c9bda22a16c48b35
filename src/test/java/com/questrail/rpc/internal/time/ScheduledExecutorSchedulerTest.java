package com.questrail.rpc.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the production scheduler.
 *
 * These use real time; tolerances are generous to avoid false failures on
 * loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void backoffDelayElapsesBeforeTaskRuns() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = System.nanoTime();

        scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "task should run");
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test
    void zeroDelayRunsPromptly() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ZERO, SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> { }));
    }

    @Test
    void cancelledHeartbeatTimeoutNeverFires() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean(false);

        Cancellable timeout = scheduler.scheduleAfter(
                Duration.ofMillis(100), SystemMonotonicClock.INSTANCE, () -> fired.set(true));

        assertTrue(timeout.cancel());
        Thread.sleep(200);
        assertFalse(fired.get());
    }

    @Test
    void cancelAfterRunReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        Thread.sleep(20);
        assertFalse(handle.cancel());
    }

    @Test
    void tasksRunInDeadlineOrder() throws InterruptedException {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        long now = SystemMonotonicClock.INSTANCE.nowNanos();

        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(60), () -> { order.add("beat"); latch.countDown(); });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), () -> { order.add("timeout"); latch.countDown(); });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> { order.add("dial"); latch.countDown(); });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(List.of("dial", "timeout", "beat"), order);
    }
}
