package io.blockchain.walletsync.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WalletSyncMetricsTest {

    @Test
    void countsOutcomesPerOperation() {
        double before = WalletSyncMetrics.outcomeCount("apply", "failed");
        double rollbackBefore = WalletSyncMetrics.outcomeCount("rollback", "failed");

        WalletSyncMetrics.recordOutcome("apply", "failed");
        WalletSyncMetrics.recordOutcome("apply", "failed");

        assertEquals(before + 2, WalletSyncMetrics.outcomeCount("apply", "failed"));
        assertEquals(rollbackBefore, WalletSyncMetrics.outcomeCount("rollback", "failed"));
    }

    @Test
    void batchTimerReturnsResultAndShowsInScrape() {
        String result = WalletSyncMetrics.recordBatch("apply", () -> "ok");

        assertEquals("ok", result);
        String scrape = WalletSyncMetrics.scrapeMetrics();
        assertTrue(scrape.contains("wallet.blistener.batch,op=apply{stat=COUNT}"));
    }
}
