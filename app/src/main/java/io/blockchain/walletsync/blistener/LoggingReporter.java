package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.metrics.WalletSyncMetrics;

import java.util.logging.Level;
import java.util.logging.Logger;

/** Reporter without a remote endpoint: logs and counts. */
public final class LoggingReporter implements Reporter {
    private static final Logger LOG = Logger.getLogger(LoggingReporter.class.getName());

    @Override
    public void reportOrLogW(String prefix, Throwable cause) {
        WalletSyncMetrics.recordReportedFailure();
        LOG.log(Level.WARNING, prefix + cause, cause);
    }
}
