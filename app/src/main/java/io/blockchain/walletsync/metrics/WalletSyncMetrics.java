package io.blockchain.walletsync.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class WalletSyncMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter slowBatches = Counter.builder("wallet.blistener.slow")
            .description("Batches that outlived half a slot")
            .register(registry);
    private static final Counter reportedFailures = Counter.builder("wallet.blistener.failures.reported")
            .description("Per-wallet sync failures sent to the reporter")
            .register(registry);
    private static final DistributionSummary flushedWallets = DistributionSummary.builder("wallet.flush.wallets")
            .description("Wallets written per flush")
            .register(registry);

    private WalletSyncMetrics() {}

    public static <T> T recordBatch(String operation, Supplier<T> batch) {
        Timer timer = Timer.builder("wallet.blistener.batch")
                .description("Block listener batch duration")
                .tag("op", operation)
                .register(registry);
        return timer.record(batch);
    }

    public static void recordOutcome(String operation, String outcome) {
        registry.counter("wallet.blistener.wallets", "op", operation, "outcome", outcome).increment();
    }

    public static void recordSlowBatch() {
        slowBatches.increment();
    }

    public static void recordReportedFailure() {
        reportedFailures.increment();
    }

    public static void recordFlush(int wallets) {
        flushedWallets.record(wallets);
    }

    public static double outcomeCount(String operation, String outcome) {
        Counter c = registry.find("wallet.blistener.wallets").tags("op", operation, "outcome", outcome).counter();
        return c == null ? 0 : c.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static double slowBatchCount() {
        return slowBatches.count();
    }
}
