package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.TxIn;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.tracking.TxHistoryEntry;
import io.blockchain.walletsync.tracking.WalletModifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory implementation of WalletDB.
 * Not persistent; resets every process run.
 */
public final class InMemoryWalletDB implements WalletDB {

    private final Map<WalletId, WalletRecord> wallets = new TreeMap<>();

    @Override
    public synchronized List<WalletId> getWalletIds() {
        return new ArrayList<>(wallets.keySet());
    }

    @Override
    public synchronized Optional<SyncTip> getWalletSyncTip(WalletId id) {
        WalletRecord record = wallets.get(id);
        return record == null ? Optional.empty() : Optional.ofNullable(record.syncTip);
    }

    @Override
    public synchronized Set<String> getWalletAddresses(WalletId id) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(requireRecord(id).addresses));
    }

    @Override
    public synchronized void createWallet(WalletId id, Set<String> addresses) {
        Objects.requireNonNull(id, "id");
        if (wallets.containsKey(id)) {
            throw new IllegalArgumentException("Wallet already exists: " + id);
        }
        WalletRecord record = new WalletRecord();
        record.addresses.addAll(addresses);
        record.syncTip = SyncTip.notSynced();
        wallets.put(id, record);
    }

    @Override
    public synchronized void addWalletAddress(WalletId id, String address) {
        requireRecord(id).addresses.add(address);
    }

    @Override
    public synchronized void setWalletSyncTip(WalletId id, SyncTip tip) {
        requireRecord(id).syncTip = Objects.requireNonNull(tip, "tip");
    }

    /** Drop the recorded sync tip, leaving the wallet without one. */
    public synchronized void removeWalletSyncTip(WalletId id) {
        requireRecord(id).syncTip = null;
    }

    @Override
    public synchronized void applyModifier(WalletId id, WalletModifier modifier) {
        WalletRecord record = requireRecord(id);
        for (TxIn spent : modifier.utxo().deletions().keySet()) {
            record.utxo.remove(spent);
        }
        record.utxo.putAll(modifier.utxo().insertions());
        for (Hash removed : modifier.history().deletions().keySet()) {
            record.history.remove(removed);
        }
        record.history.putAll(modifier.history().insertions());
    }

    @Override
    public synchronized Map<TxIn, TxOut> getWalletUtxo(WalletId id) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(requireRecord(id).utxo));
    }

    @Override
    public synchronized Map<Hash, TxHistoryEntry> getWalletHistory(WalletId id) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(requireRecord(id).history));
    }

    private WalletRecord requireRecord(WalletId id) {
        WalletRecord record = wallets.get(id);
        if (record == null) {
            throw new IllegalArgumentException("Unknown wallet: " + id);
        }
        return record;
    }

    private static final class WalletRecord {
        final Set<String> addresses = new LinkedHashSet<>();
        final Map<TxIn, TxOut> utxo = new LinkedHashMap<>();
        final Map<Hash, TxHistoryEntry> history = new LinkedHashMap<>();
        SyncTip syncTip;
    }
}
