package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.tracking.WalletModifier;
import io.blockchain.walletsync.wallet.WalletId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide buffer of wallet modifiers not yet written to the wallet DB.
 * Every update is one atomic read-modify-write of a wallet's entry; readers
 * only ever see whole, immutable modifiers.
 */
public final class BlocksStorageModifier {

    private final Map<WalletId, WalletModifier> modifiers = new LinkedHashMap<>();

    /** Buffered modifier for {@code wid} followed by {@code modifier}. Returns the merged result. */
    public synchronized WalletModifier applyWalModifier(WalletId wid, WalletModifier modifier) {
        return modifiers.merge(wid, modifier, WalletModifier::then);
    }

    public synchronized Optional<WalletModifier> get(WalletId wid) {
        return Optional.ofNullable(modifiers.get(wid));
    }

    public synchronized Map<WalletId, WalletModifier> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(modifiers));
    }

    /** Take everything buffered and leave the buffer empty. */
    public synchronized Map<WalletId, WalletModifier> drain() {
        Map<WalletId, WalletModifier> out = new LinkedHashMap<>(modifiers);
        modifiers.clear();
        return out;
    }

    /** Put back drained modifiers that could not be flushed, ahead of anything merged since. */
    public synchronized void restore(Map<WalletId, WalletModifier> unflushed) {
        for (Map.Entry<WalletId, WalletModifier> e : unflushed.entrySet()) {
            WalletModifier later = modifiers.get(e.getKey());
            modifiers.put(e.getKey(), later == null ? e.getValue() : e.getValue().then(later));
        }
    }

    public synchronized int size() {
        return modifiers.size();
    }

    public synchronized boolean isEmpty() {
        return modifiers.isEmpty();
    }
}
