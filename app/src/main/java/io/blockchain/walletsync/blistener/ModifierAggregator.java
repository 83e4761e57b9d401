package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.chain.ChainReader;
import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.slotting.SlotClock;
import io.blockchain.walletsync.slotting.SlotId;
import io.blockchain.walletsync.tracking.HeaderInfo;
import io.blockchain.walletsync.tracking.TxTracker;
import io.blockchain.walletsync.tracking.TxWithUndo;
import io.blockchain.walletsync.tracking.WalletModifier;
import io.blockchain.walletsync.wallet.KeyProvider;
import io.blockchain.walletsync.wallet.WalletDB;
import io.blockchain.walletsync.wallet.WalletId;
import io.blockchain.walletsync.wallet.WalletKeys;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes one wallet's delta for a batch and merges it into the shared
 * {@link BlocksStorageModifier}. Reads wallet metadata and keys only; never
 * writes to the wallet DB.
 */
public final class ModifierAggregator {

    private final ChainReader chain;
    private final SlotClock slots;
    private final WalletDB walletDb;
    private final KeyProvider keys;
    private final TxTracker tracker;
    private final BlocksStorageModifier buffer;

    public ModifierAggregator(ChainReader chain,
                              SlotClock slots,
                              WalletDB walletDb,
                              KeyProvider keys,
                              TxTracker tracker,
                              BlocksStorageModifier buffer) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.slots = Objects.requireNonNull(slots, "slots");
        this.walletDb = Objects.requireNonNull(walletDb, "walletDb");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    /** Returns this batch's modifier (not the merged one). */
    public WalletModifier applyTxs(WalletId wid, List<TxWithUndo> txs) {
        Function<BlockHeader, HeaderInfo> headerInfo = HeaderTimestamps.headerInfoGetter(chain, slots);
        Set<String> allAddresses = walletDb.getWalletAddresses(wid);
        WalletKeys walletKeys = keys.keysFor(wid);
        WalletModifier modifier = tracker.trackingApplyTxs(walletKeys, allAddresses, headerInfo, txs);
        buffer.applyWalModifier(wid, modifier);
        return modifier;
    }

    public WalletModifier rollbackTxs(WalletId wid, SlotId curSlot, List<TxWithUndo> txs) {
        Set<String> allAddresses = walletDb.getWalletAddresses(wid);
        WalletKeys walletKeys = keys.keysFor(wid);
        Function<BlockHeader, HeaderInfo> headerInfo = HeaderTimestamps.headerInfoGetter(chain, slots);
        WalletModifier modifier = tracker.trackingRollbackTxs(walletKeys, allAddresses, curSlot, headerInfo, txs);
        buffer.applyWalModifier(wid, modifier);
        return modifier;
    }
}
