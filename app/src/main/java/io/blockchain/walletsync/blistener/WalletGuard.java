package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.wallet.SyncTip;
import io.blockchain.walletsync.wallet.WalletDB;
import io.blockchain.walletsync.wallet.WalletId;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Lets a wallet be updated by a batch only when its sync tip is the chain
 * tip the batch starts from. Wallets that fell behind or diverged are
 * skipped here and left to a resync.
 */
public final class WalletGuard {
    private static final Logger LOG = Logger.getLogger(WalletGuard.class.getName());

    public enum Decision { ELIGIBLE, NO_SYNC_TIP, NOT_SYNCED, TIP_MISMATCH }

    @FunctionalInterface
    public interface SyncAction {
        void run() throws Exception;
    }

    private final WalletDB walletDb;

    public WalletGuard(WalletDB walletDb) {
        this.walletDb = Objects.requireNonNull(walletDb, "walletDb");
    }

    public Decision check(Hash curTip, WalletId wid) {
        Optional<SyncTip> syncTip = walletDb.getWalletSyncTip(wid);
        if (syncTip.isEmpty()) {
            LOG.info("There is no syncTip corresponding to wallet #" + wid);
            return Decision.NO_SYNC_TIP;
        }
        if (!syncTip.get().isSynced()) {
            LOG.info("Wallet #" + wid + " hasn't been synced yet");
            return Decision.NOT_SYNCED;
        }
        Hash walletTip = syncTip.get().tip().orElseThrow();
        if (!walletTip.equals(curTip)) {
            LOG.warning("Skip wallet #" + wid + ", because of wallet's tip " + walletTip
                    + " mismatched with current tip " + curTip);
            return Decision.TIP_MISMATCH;
        }
        return Decision.ELIGIBLE;
    }

    /** Runs {@code action} only if the wallet is eligible; failures of the action propagate. */
    public Decision runIfEligible(Hash curTip, WalletId wid, SyncAction action) throws Exception {
        Decision decision = check(curTip, wid);
        if (decision == Decision.ELIGIBLE) {
            action.run();
        }
        return decision;
    }
}
