package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.Hash;

import java.util.Objects;
import java.util.Optional;

/**
 * Chain position a wallet's derived state is consistent with:
 * either not synced at all, or synced exactly up to a header hash.
 */
public final class SyncTip {
    private static final SyncTip NOT_SYNCED = new SyncTip(null);

    private final Hash tip;

    private SyncTip(Hash tip) {
        this.tip = tip;
    }

    public static SyncTip notSynced() {
        return NOT_SYNCED;
    }

    public static SyncTip syncedWith(Hash tip) {
        return new SyncTip(Objects.requireNonNull(tip, "tip"));
    }

    public boolean isSynced() {
        return tip != null;
    }

    public Optional<Hash> tip() {
        return Optional.ofNullable(tip);
    }

    @Override public boolean equals(Object o) {
        return o instanceof SyncTip && Objects.equals(tip, ((SyncTip) o).tip);
    }

    @Override public int hashCode() { return Objects.hashCode(tip); }

    @Override public String toString() {
        return tip == null ? "NotSynced" : "SyncedWith(" + tip + ")";
    }
}
