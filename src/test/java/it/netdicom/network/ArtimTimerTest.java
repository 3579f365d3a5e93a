package it.netdicom.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ArtimTimerTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void expiryReportsTheCurrentGeneration() throws InterruptedException {
        ArtimTimer timer = new ArtimTimer(scheduler, Duration.ofMillis(50));
        CountDownLatch expired = new CountDownLatch(1);
        AtomicLong generation = new AtomicLong();

        timer.start(current -> {
            generation.set(current);
            expired.countDown();
        });

        assertTrue(expired.await(2, TimeUnit.SECONDS));
        assertTrue(timer.isCurrent(generation.get()));
    }

    @Test
    void stoppedTimerNeverFires() throws InterruptedException {
        ArtimTimer timer = new ArtimTimer(scheduler, Duration.ofMillis(100));
        CountDownLatch expired = new CountDownLatch(1);
        timer.start(current -> expired.countDown());

        timer.stop();

        assertFalse(timer.isRunning());
        assertFalse(expired.await(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void restartInvalidatesEarlierGeneration() throws InterruptedException {
        ArtimTimer timer = new ArtimTimer(scheduler, Duration.ofMillis(30));
        CountDownLatch expired = new CountDownLatch(1);
        AtomicLong generation = new AtomicLong();
        timer.start(current -> {
        });
        timer.start(current -> {
            generation.set(current);
            expired.countDown();
        });

        assertTrue(expired.await(2, TimeUnit.SECONDS));
        assertEquals(2, generation.get());
        assertFalse(timer.isCurrent(1));
    }
}
