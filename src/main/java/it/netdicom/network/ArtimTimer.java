package it.netdicom.network;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * Association Request/Reject/Release timer. Every start or stop begins a new generation so an expiry
 * that raced with a stop can be recognised and dropped.
 */
class ArtimTimer {

    private final ScheduledExecutorService scheduler;
    private final Duration timeout;
    private ScheduledFuture<?> pending;
    private long generation;

    ArtimTimer(ScheduledExecutorService scheduler, Duration timeout) {
        this.scheduler = scheduler;
        this.timeout = timeout;
    }

    synchronized void start(LongConsumer onExpiry) {
        cancelPending();
        long current = ++generation;
        pending = scheduler.schedule(() -> onExpiry.accept(current), timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized void stop() {
        cancelPending();
        generation++;
    }

    synchronized boolean isCurrent(long expiredGeneration) {
        return pending != null && expiredGeneration == generation;
    }

    synchronized boolean isRunning() {
        return pending != null && !pending.isDone();
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }
}
