package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.blistener.BlocksStorageModifier;
import io.blockchain.walletsync.chain.PostBatchHook;
import io.blockchain.walletsync.metrics.WalletSyncMetrics;
import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.tracking.WalletModifier;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Writes buffered wallet modifiers to the wallet DB and moves each written
 * wallet's sync tip from the batch's old tip to its new tip. Wallets without a
 * buffered entry (skipped or failed in the batch) keep their old tip.
 * <p>
 * An entry is written only if the wallet is still synced with the tip the
 * batch started from. Anything else is stale: left over from an earlier flush
 * that failed, it was built against a different tip. Stale entries are
 * dropped and the wallet keeps its recorded tip until it is resynced.
 */
public final class WalletStorageFlusher implements PostBatchHook {
    private static final Logger LOG = Logger.getLogger(WalletStorageFlusher.class.getName());

    private final BlocksStorageModifier buffer;
    private final WalletDB walletDb;

    public WalletStorageFlusher(BlocksStorageModifier buffer, WalletDB walletDb) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.walletDb = Objects.requireNonNull(walletDb, "walletDb");
    }

    @Override
    public void afterBatch(Hash oldTip, Hash newTip) {
        flush(oldTip, newTip);
    }

    /**
     * Returns the number of wallets written. A wallet whose write fails goes
     * back to the buffer and the others are still flushed; the failures are
     * then rethrown together, so the same flush can be retried.
     */
    public int flush(Hash oldTip, Hash newTip) {
        Map<WalletId, WalletModifier> pending = buffer.drain();
        Map<WalletId, WalletModifier> failed = new LinkedHashMap<>();
        IllegalStateException failure = null;
        Optional<SyncTip> expected = Optional.of(SyncTip.syncedWith(oldTip));
        int written = 0;
        for (Map.Entry<WalletId, WalletModifier> e : pending.entrySet()) {
            WalletId wid = e.getKey();
            try {
                Optional<SyncTip> current = walletDb.getWalletSyncTip(wid);
                if (expected.equals(current)) {
                    walletDb.applyModifier(wid, e.getValue());
                    walletDb.setWalletSyncTip(wid, SyncTip.syncedWith(newTip));
                    written++;
                } else {
                    LOG.warning("Dropping buffered changes for wallet " + wid + ": wallet is "
                            + current.map(SyncTip::toString).orElse("unknown")
                            + " but the batch started at " + oldTip);
                }
            } catch (RuntimeException ex) {
                failed.put(wid, e.getValue());
                if (failure == null) {
                    failure = new IllegalStateException("Failed to flush wallet " + wid, ex);
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        WalletSyncMetrics.recordFlush(written);
        if (written > 0) {
            LOG.fine("Flushed " + written + " wallet(s) at tip " + newTip);
        }
        if (failure != null) {
            buffer.restore(failed);
            throw failure;
        }
        return written;
    }
}
