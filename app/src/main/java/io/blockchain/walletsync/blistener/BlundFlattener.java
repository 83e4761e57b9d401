package io.blockchain.walletsync.blistener;

import io.blockchain.walletsync.chrono.NewestFirst;
import io.blockchain.walletsync.chrono.OldestFirst;
import io.blockchain.walletsync.protocol.Block;
import io.blockchain.walletsync.protocol.Blund;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxUndo;
import io.blockchain.walletsync.tracking.TxWithUndo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a batch of blunds into the (tx, undo, header) sequence the tracker
 * consumes. Mismatched undo data is corrupt upstream data and throws.
 */
public final class BlundFlattener {
    private BlundFlattener() {}

    /** Blocks oldest first, transactions in block order. */
    public static List<TxWithUndo> flattenApply(OldestFirst<Blund> blunds) {
        List<TxWithUndo> out = new ArrayList<>();
        for (Blund blund : blunds) {
            out.addAll(txsWithUndo(blund));
        }
        return out;
    }

    /** Blocks newest first, and each block's transactions reversed. */
    public static List<TxWithUndo> flattenRollback(NewestFirst<Blund> blunds) {
        List<TxWithUndo> out = new ArrayList<>();
        for (Blund blund : blunds) {
            List<TxWithUndo> txs = txsWithUndo(blund);
            Collections.reverse(txs);
            out.addAll(txs);
        }
        return out;
    }

    /** Genesis blocks carry nothing. */
    static List<TxWithUndo> txsWithUndo(Blund blund) {
        Block block = blund.block();
        if (block.isGenesis()) {
            return new ArrayList<>();
        }
        List<Transaction> txs = block.transactions();
        List<TxUndo> undos = blund.undo().txUndos();
        if (txs.size() != undos.size()) {
            throw new IllegalStateException("Block " + block.hash() + " has " + txs.size()
                    + " txs but " + undos.size() + " undos");
        }
        List<TxWithUndo> out = new ArrayList<>(txs.size());
        for (int i = 0; i < txs.size(); i++) {
            Transaction tx = txs.get(i);
            TxUndo undo = undos.get(i);
            if (tx.inputs().size() != undo.size()) {
                throw new IllegalStateException("Tx " + tx.id() + " in block " + block.hash() + " has "
                        + tx.inputs().size() + " inputs but undo for " + undo.size());
            }
            out.add(new TxWithUndo(tx, undo, block.header()));
        }
        return out;
    }
}
