package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.metrics.WalletSyncMetrics;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Warns once when an action runs past a deadline. Never interrupts or
 * cancels the action.
 */
public final class TimeoutWatchdog implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(TimeoutWatchdog.class.getName());

    private final ScheduledExecutorService scheduler;

    public TimeoutWatchdog() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "wallet-blistener-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /** Runs {@code action} on the calling thread; logs one warning if it is still running after {@code firstWarning}. */
    public <T> T logWarningWaitOnce(Duration firstWarning, String tag, Supplier<T> action) {
        long started = System.nanoTime();
        AtomicBoolean warned = new AtomicBoolean();
        ScheduledFuture<?> warning = scheduler.schedule(() -> {
            warned.set(true);
            WalletSyncMetrics.recordSlowBatch();
            LOG.warning(tag + " is taking longer than " + firstWarning.toMillis() + " ms");
        }, Math.max(0L, firstWarning.toMillis()), TimeUnit.MILLISECONDS);
        try {
            return action.get();
        } finally {
            warning.cancel(false);
            if (warned.get()) {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                LOG.info(tag + " finished after " + elapsedMs + " ms");
            }
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
