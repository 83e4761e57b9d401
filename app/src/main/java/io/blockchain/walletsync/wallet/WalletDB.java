package io.blockchain.walletsync.wallet;

import io.blockchain.walletsync.protocol.Hash;
import io.blockchain.walletsync.protocol.TxIn;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.tracking.TxHistoryEntry;
import io.blockchain.walletsync.tracking.WalletModifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Wallet metadata and derived state.
 * The block listener only reads from it; the flush step and wallet
 * bootstrap write to it.
 */
public interface WalletDB {

    /** All known wallets, sorted by id. */
    List<WalletId> getWalletIds();

    /** Empty when the wallet has no recorded sync tip at all. */
    Optional<SyncTip> getWalletSyncTip(WalletId id);

    /** Every address the wallet has ever tracked. */
    Set<String> getWalletAddresses(WalletId id);

    /** Register a wallet as {@link SyncTip#notSynced()}. */
    void createWallet(WalletId id, Set<String> addresses);

    void addWalletAddress(WalletId id, String address);

    void setWalletSyncTip(WalletId id, SyncTip tip);

    /** Apply a flushed modifier to the stored UTXO set and history. */
    void applyModifier(WalletId id, WalletModifier modifier);

    Map<TxIn, TxOut> getWalletUtxo(WalletId id);

    Map<Hash, TxHistoryEntry> getWalletHistory(WalletId id);

    default long getBalance(WalletId id) {
        long total = 0;
        for (TxOut out : getWalletUtxo(id).values()) {
            total += out.amountMinor();
        }
        return total;
    }
}
