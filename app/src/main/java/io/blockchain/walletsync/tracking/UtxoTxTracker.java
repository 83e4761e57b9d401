package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxIn;
import io.blockchain.walletsync.protocol.TxOut;
import io.blockchain.walletsync.slotting.SlotId;
import io.blockchain.walletsync.wallet.WalletKeys;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Tracks a wallet's UTXO set and history. An address belongs to the wallet
 * when it is one of its tracked addresses or its root address.
 */
public final class UtxoTxTracker implements TxTracker {

    @Override
    public WalletModifier trackingApplyTxs(WalletKeys keys,
                                           Set<String> addresses,
                                           Function<BlockHeader, HeaderInfo> headerInfo,
                                           List<TxWithUndo> txs) {
        WalletModifier.Builder modifier = WalletModifier.builder();
        for (TxWithUndo t : txs) {
            Transaction tx = t.tx();
            List<TxOut> spent = spentOutputs(t);
            boolean touched = false;

            for (int i = 0; i < spent.size(); i++) {
                TxOut prev = spent.get(i);
                if (owns(keys, addresses, prev.address())) {
                    modifier.spendUtxo(tx.inputs().get(i), prev);
                    touched = true;
                }
            }
            for (int i = 0; i < tx.outputs().size(); i++) {
                TxOut out = tx.outputs().get(i);
                if (owns(keys, addresses, out.address())) {
                    modifier.addUtxo(tx.outRef(i), out);
                    touched = true;
                }
            }
            if (touched) {
                HeaderInfo info = headerInfo.apply(t.header());
                modifier.addHistory(new TxHistoryEntry(
                        tx.id(), spent, tx.outputs(),
                        Optional.of(info.difficulty()), info.timestamp(), t.header().slot()));
            }
        }
        return modifier.build();
    }

    @Override
    public WalletModifier trackingRollbackTxs(WalletKeys keys,
                                              Set<String> addresses,
                                              SlotId curSlot,
                                              Function<BlockHeader, HeaderInfo> headerInfo,
                                              List<TxWithUndo> txs) {
        WalletModifier.Builder modifier = WalletModifier.builder();
        for (TxWithUndo t : txs) {
            Transaction tx = t.tx();
            List<TxOut> spent = spentOutputs(t);
            boolean touched = false;

            for (int i = 0; i < tx.outputs().size(); i++) {
                TxOut out = tx.outputs().get(i);
                if (owns(keys, addresses, out.address())) {
                    modifier.spendUtxo(tx.outRef(i), out);
                    touched = true;
                }
            }
            for (int i = 0; i < spent.size(); i++) {
                TxOut prev = spent.get(i);
                if (owns(keys, addresses, prev.address())) {
                    TxIn in = tx.inputs().get(i);
                    modifier.addUtxo(in, prev);
                    touched = true;
                }
            }
            if (touched) {
                // the block is gone, so the entry is dated at the rollback slot
                HeaderInfo info = headerInfo.apply(t.header());
                modifier.removeHistory(new TxHistoryEntry(
                        tx.id(), spent, tx.outputs(),
                        Optional.empty(), info.timestamp(), curSlot));
            }
        }
        return modifier.build();
    }

    private static List<TxOut> spentOutputs(TxWithUndo t) {
        List<TxOut> spent = t.undo().spent();
        if (spent.size() != t.tx().inputs().size()) {
            throw new IllegalStateException("Undo of tx " + t.tx().id() + " has " + spent.size()
                    + " outputs for " + t.tx().inputs().size() + " inputs");
        }
        return spent;
    }

    private static boolean owns(WalletKeys keys, Set<String> addresses, String address) {
        return addresses.contains(address) || address.equals(keys.rootAddress());
    }
}
