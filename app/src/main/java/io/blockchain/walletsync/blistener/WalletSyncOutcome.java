package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.wallet.WalletId;

import java.util.Optional;

/** What happened to one wallet in one batch. */
public record WalletSyncOutcome(WalletId walletId, Status status, WalletGuard.Decision decision, Throwable error) {

    public enum Status { SYNCED, SKIPPED, FAILED }

    static WalletSyncOutcome of(WalletId wid, WalletGuard.Decision decision) {
        Status status = decision == WalletGuard.Decision.ELIGIBLE ? Status.SYNCED : Status.SKIPPED;
        return new WalletSyncOutcome(wid, status, decision, null);
    }

    static WalletSyncOutcome failed(WalletId wid, Throwable error) {
        return new WalletSyncOutcome(wid, Status.FAILED, null, error);
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(error);
    }
}
