package io.blockchain.walletsync.tracking;

import io.blockchain.walletsync.protocol.BlockHeader;
import io.blockchain.walletsync.protocol.Transaction;
import io.blockchain.walletsync.protocol.TxUndo;

import java.util.Objects;

/** A transaction, its undo data and the header of the block that carries it. */
public record TxWithUndo(Transaction tx, TxUndo undo, BlockHeader header) {
    public TxWithUndo {
        Objects.requireNonNull(tx, "tx");
        Objects.requireNonNull(undo, "undo");
        Objects.requireNonNull(header, "header");
    }
}
